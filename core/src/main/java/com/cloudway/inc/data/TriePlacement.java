/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.data;

import java.util.Objects;
import java.util.function.Function;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import com.cloudway.inc.engine.Art;
import com.cloudway.inc.engine.Name;

/**
 * Inserts elements into tries. Elements are placed by a key extracted
 * from the element: the element itself for plain tries, the first
 * component of a pair for sets and maps.
 *
 * <p>The placement hash is derived from {@code hashCode()}, so unequal
 * keys with equal hash codes share a path. They are kept together in a
 * collision bucket at the depth where a single leaf would sit.</p>
 */
final class TriePlacement {
    private TriePlacement() {}

    static final int PLACEMENT_SEED = 42;

    private static final HashFunction PLACEMENT_HASH = Hashing.murmur3_128(PLACEMENT_SEED);

    static long hash(Object key) {
        return PLACEMENT_HASH.hashInt(key.hashCode()).asLong();
    }

    /**
     * The state of one insertion, shared by every level of the descent.
     */
    static final class Insertion<X> {
        final Meta meta;
        final X elt;
        final Object key;
        final long hash;
        final BitString path;
        final Function<? super X, ?> keyOf;

        Insertion(Meta meta, X elt, Function<? super X, ?> keyOf) {
            this.meta = meta;
            this.elt = Objects.requireNonNull(elt);
            this.key = Objects.requireNonNull(keyOf.apply(elt));
            this.hash = hash(key);
            this.path = BitString.of(BitString.MAX_LEN, hash);
            this.keyOf = keyOf;
        }

        int bit(int depth) {
            return path.bit(depth);
        }

        boolean sameKey(X other) {
            return key.equals(keyOf.apply(other));
        }

        boolean sameHash(X other) {
            return hash == hash(keyOf.apply(other));
        }
    }

    static <X> Trie<X> extend(Name nm, Trie<X> trie, X elt, Function<? super X, ?> keyOf) {
        Tuple<Name, Name> nms = Name.fork(nm);
        Trie.RootNode<X> root = rootOf(trie);
        Insertion<X> ins = new Insertion<>(root.meta, elt, keyOf);
        Trie<X> placed = root.trie.place(ins, BitString.EMPTY);
        Trie<X> updated = Trie.root(root.meta, Trie.name(nms.second(), Trie.art(Art.put(placed))));
        return Trie.name(nms.first(), Trie.art(Art.put(updated)));
    }

    // descend through named articulations down to the root
    private static <X> Trie.RootNode<X> rootOf(Trie<X> trie) {
        Trie<X> t = trie;
        while (t instanceof Trie.NameNode && ((Trie.NameNode<X>)t).trie instanceof Trie.ArtNode) {
            Trie<X> inner = Trie.normalize(((Trie.NameNode<X>)t).trie);
            if (inner instanceof Trie.RootNode)
                return (Trie.RootNode<X>)inner;
            t = inner;
        }
        throw new IllegalStateException(t == trie
            ? "Non-name node at entry to trie extension: " + t
            : "Non-root node at entry to trie extension: " + t);
    }
}
