/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.data;

import java.util.function.BiFunction;

import com.cloudway.inc.engine.Name;

/**
 * Finite sets represented as tries of pairs whose second component is
 * the unit value.
 */
public final class TrieSet {
    private TrieSet() {}

    public static <X> Trie<Tuple<X, Unit>> empty() {
        return Trie.empty();
    }

    public static <X> Trie<Tuple<X, Unit>> empty(Meta meta) {
        return Trie.empty(meta);
    }

    /**
     * Construct a set containing the given elements.
     */
    @SafeVarargs
    public static <X> Trie<Tuple<X, Unit>> of(X... elements) {
        Trie<Tuple<X, Unit>> s = empty();
        for (X x : elements)
            s = add(s, x);
        return s;
    }

    public static <X> Trie<Tuple<X, Unit>> add(Trie<Tuple<X, Unit>> set, X x) {
        return add(Name.unit(), set, x);
    }

    /**
     * Returns a set containing the elements of the given set and the given
     * element, inserted under the given name.
     */
    public static <X> Trie<Tuple<X, Unit>> add(Name nm, Trie<Tuple<X, Unit>> set, X x) {
        return TrieMap.update(nm, set, x, Unit.U);
    }

    /**
     * Test membership of the given element.
     */
    public static <X> boolean mem(Trie<Tuple<X, Unit>> set, X x) {
        return Trie.find(set, Tuple.of(x, Unit.U), Trie.placementHash(x)).isPresent();
    }

    /**
     * Reduce the elements of the set in unspecified order.
     */
    public static <X, R> R fold(Trie<Tuple<X, Unit>> set, R init, BiFunction<? super X, R, R> f) {
        return Trie.fold(set, init, (xu, acc) -> f.apply(xu.first(), acc));
    }

    public static <X> int size(Trie<Tuple<X, Unit>> set) {
        return Trie.size(set);
    }

    public static <X> boolean valid(Trie<Tuple<X, Unit>> set) {
        return Trie.valid(set, Tuple::first);
    }
}
