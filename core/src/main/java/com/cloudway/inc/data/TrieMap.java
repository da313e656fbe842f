/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.data;

import java.util.Optional;

import com.cloudway.inc.engine.Name;
import com.cloudway.inc.function.TriFunction;

/**
 * Finite maps represented as tries of key-value pairs. Entries are placed
 * by the hash of their key, so updating a key replaces its entry.
 *
 * <p>Removal and appending are not supported by the underlying trie.</p>
 */
public final class TrieMap {
    private TrieMap() {}

    public static <K, V> Trie<Tuple<K, V>> empty() {
        return Trie.empty();
    }

    public static <K, V> Trie<Tuple<K, V>> empty(Meta meta) {
        return Trie.empty(meta);
    }

    /**
     * Returns a map that associates the given key with the given value,
     * any previous value for the key is replaced.
     */
    public static <K, V> Trie<Tuple<K, V>> update(Trie<Tuple<K, V>> map, K key, V value) {
        return update(Name.unit(), map, key, value);
    }

    /**
     * Same as {@link #update(Trie, Object, Object)} under the given
     * insertion name.
     */
    public static <K, V> Trie<Tuple<K, V>> update(Name nm, Trie<Tuple<K, V>> map, K key, V value) {
        return TriePlacement.extend(nm, map, Tuple.of(key, value), Tuple::first);
    }

    /**
     * Returns the value associated with the given key.
     */
    public static <K, V> Optional<V> find(Trie<Tuple<K, V>> map, K key) {
        return Trie.findBy(map, key, Trie.placementHash(key), Tuple::first).map(Tuple::second);
    }

    public static <K, V> boolean contains(Trie<Tuple<K, V>> map, K key) {
        return find(map, key).isPresent();
    }

    /**
     * Reduce the entries of the map in unspecified order.
     */
    public static <K, V, R> R fold(Trie<Tuple<K, V>> map, R init, TriFunction<? super K, ? super V, R, R> f) {
        return Trie.fold(map, init, (kv, acc) -> f.apply(kv.first(), kv.second(), acc));
    }

    public static <K, V> int size(Trie<Tuple<K, V>> map) {
        return Trie.size(map);
    }

    /**
     * Check the structural invariants of the map.
     */
    public static <K, V> boolean valid(Trie<Tuple<K, V>> map) {
        return Trie.valid(map, Tuple::first);
    }

    public static <K, V> Trie<Tuple<K, V>> remove(Trie<Tuple<K, V>> map, K key) {
        throw new UnsupportedOperationException("remove");
    }

    public static <K, V> Trie<Tuple<K, V>> append(Trie<Tuple<K, V>> map, Trie<Tuple<K, V>> other) {
        throw new UnsupportedOperationException("append");
    }
}
