/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.graph;

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import com.cloudway.inc.data.Trie;
import com.cloudway.inc.data.TrieSet;
import com.cloudway.inc.data.Tuple;
import com.cloudway.inc.data.Unit;
import com.cloudway.inc.engine.Engine;
import com.cloudway.inc.engine.Name;

/**
 * A graph represented as the list of its edges in insertion order, each
 * edge remembering the name it was added under.
 */
public final class EdgeListGraph<N> extends AbstractGraph<N> {
    private final ImmutableList<Tuple<Name, Tuple<N, N>>> edges;

    private EdgeListGraph(ImmutableList<Tuple<Name, Tuple<N, N>>> edges) {
        this.edges = edges;
    }

    public static <N> EdgeListGraph<N> empty() {
        return new EdgeListGraph<>(ImmutableList.of());
    }

    @Override
    protected Graph<N> newGraph() {
        return empty();
    }

    @Override
    public EdgeListGraph<N> addEdge(Name nm, N src, N dst) {
        return new EdgeListGraph<>(ImmutableList.<Tuple<Name, Tuple<N, N>>>builder()
            .addAll(edges)
            .add(Tuple.of(Objects.requireNonNull(nm), Tuple.of(src, dst)))
            .build());
    }

    /**
     * Renames the most recently added edge, the name then covers every
     * edge added so far.
     */
    @Override
    public EdgeListGraph<N> named(Engine engine, Name nm) {
        if (edges.isEmpty())
            return this;
        int last = edges.size() - 1;
        return new EdgeListGraph<>(ImmutableList.<Tuple<Name, Tuple<N, N>>>builder()
            .addAll(edges.subList(0, last))
            .add(Tuple.of(nm, edges.get(last).second()))
            .build());
    }

    /**
     * Returns the number of recorded edges, duplicates included.
     */
    public int size() {
        return edges.size();
    }

    @Override
    public Trie<Tuple<Tuple<N, N>, Unit>> edges(Engine engine) {
        return engine.ns(EDGES, () -> {
            Trie<Tuple<Tuple<N, N>, Unit>> set = TrieSet.empty();
            for (Tuple<Name, Tuple<N, N>> e : edges) {
                set = TrieSet.add(set, e.second());
                if (!e.first().equals(Name.unit()))
                    set = nameSet(engine, e.first(), set);
            }
            return set;
        });
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || (obj instanceof EdgeListGraph) && edges.equals(((EdgeListGraph<?>)obj).edges);
    }

    @Override
    public int hashCode() {
        return edges.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("edges", edges).toString();
    }
}
