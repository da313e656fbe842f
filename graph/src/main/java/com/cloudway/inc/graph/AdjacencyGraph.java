/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.graph;

import java.util.function.UnaryOperator;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import com.cloudway.inc.data.Trie;
import com.cloudway.inc.data.TrieMap;
import com.cloudway.inc.data.TrieSet;
import com.cloudway.inc.data.Tuple;
import com.cloudway.inc.data.Unit;
import com.cloudway.inc.engine.Engine;
import com.cloudway.inc.engine.Name;

/**
 * A graph represented as a map from each source node to its outgoing
 * adjacency list, most recent edge first.
 */
public final class AdjacencyGraph<N> extends AbstractGraph<N> {
    private final Trie<Tuple<N, ImmutableList<N>>> adjacency;

    private AdjacencyGraph(Trie<Tuple<N, ImmutableList<N>>> adjacency) {
        this.adjacency = adjacency;
    }

    public static <N> AdjacencyGraph<N> empty() {
        return new AdjacencyGraph<>(TrieMap.empty());
    }

    @Override
    protected Graph<N> newGraph() {
        return empty();
    }

    /**
     * Returns the adjacency map of this graph.
     */
    public Trie<Tuple<N, ImmutableList<N>>> adjacency() {
        return adjacency;
    }

    /**
     * Returns the outgoing adjacency list of the given node.
     */
    public ImmutableList<N> successors(N src) {
        return TrieMap.find(adjacency, src).orElse(ImmutableList.of());
    }

    @Override
    public AdjacencyGraph<N> addEdge(Name nm, N src, N dst) {
        ImmutableList<N> succ = ImmutableList.<N>builder()
            .add(dst)
            .addAll(successors(src))
            .build();
        return new AdjacencyGraph<>(TrieMap.update(nm, adjacency, src, succ));
    }

    @Override
    public AdjacencyGraph<N> named(Engine engine, Name nm) {
        return new AdjacencyGraph<>(nameSet(engine, nm, adjacency));
    }

    @Override
    public Trie<Tuple<Tuple<N, N>, Unit>> edges(Engine engine) {
        return engine.ns(EDGES, () ->
            Trie.foldSeq(engine, adjacency, TrieSet.<Tuple<N, N>>empty(),
                (entry, set) -> {
                    Trie<Tuple<Tuple<N, N>, Unit>> res = set;
                    for (N dst : entry.second())
                        res = TrieSet.add(res, Tuple.of(entry.first(), dst));
                    return res;
                },
                UnaryOperator.identity(),
                (nm, set) -> nameSet(engine, nm, set)));
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || (obj instanceof AdjacencyGraph) && adjacency.equals(((AdjacencyGraph<?>)obj).adjacency);
    }

    @Override
    public int hashCode() {
        return adjacency.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("adjacency", adjacency).toString();
    }
}
