/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.graph;

import java.util.function.UnaryOperator;

import com.cloudway.inc.data.Trie;
import com.cloudway.inc.data.TrieSet;
import com.cloudway.inc.data.Tuple;
import com.cloudway.inc.data.Unit;
import com.cloudway.inc.engine.Engine;
import com.cloudway.inc.engine.Name;

/**
 * Skeleton graph implementation deriving vertices and reversal from the
 * edge set.
 */
public abstract class AbstractGraph<N> implements Graph<N> {
    static final Name EDGES = Name.ofString("edges");
    static final Name VERTICES = Name.ofString("vertices");
    static final Name REVERSE = Name.ofString("reverse_edges");

    /**
     * Returns an empty graph of the same representation.
     */
    protected abstract Graph<N> newGraph();

    /**
     * Wraps a set under the given name in an engine cell.
     */
    static <X> Trie<X> nameSet(Engine engine, Name nm, Trie<X> set) {
        return Trie.name(nm, Trie.art(engine.cell(nm, set)));
    }

    @Override
    public Trie<Tuple<N, Unit>> vertices(Engine engine) {
        return engine.ns(VERTICES, () -> {
            Trie<Tuple<Tuple<N, N>, Unit>> es = edges(engine);
            return Trie.foldSeq(engine, es, TrieSet.<N>empty(),
                (e, set) -> TrieSet.add(TrieSet.add(set, e.first().first()), e.first().second()),
                UnaryOperator.identity(),
                (nm, set) -> nameSet(engine, nm, set));
        });
    }

    @Override
    public Graph<N> reverseEdges(Engine engine) {
        return engine.ns(REVERSE, () -> {
            Trie<Tuple<Tuple<N, N>, Unit>> es = edges(engine);
            return Trie.foldSeq(engine, es, newGraph(),
                (e, g) -> e.first().swap().as((src, dst) -> g.addEdge(Name.unit(), src, dst)),
                UnaryOperator.identity(),
                (nm, g) -> g.named(engine, nm));
        });
    }
}
