/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.graph;

import java.util.function.UnaryOperator;

import com.cloudway.inc.data.Trie;
import com.cloudway.inc.engine.Engine;
import com.cloudway.inc.engine.Name;

/**
 * Conversions between graph representations. The names found on the input
 * are carried over to the corresponding parts of the output.
 */
public final class Graphs {
    private Graphs() {}

    private static final Name ADJ_OF_EDGES = Name.ofString("adjacency_of_edge_list");
    private static final Name EDGES_OF_ADJ = Name.ofString("edge_list_of_adjacency");

    public static <N> AdjacencyGraph<N> adjacencyOfEdgeList(Engine engine, EdgeListGraph<N> graph) {
        return engine.ns(ADJ_OF_EDGES, () ->
            Trie.foldSeqNm(engine, graph.edges(engine), AdjacencyGraph.<N>empty(),
                (e, nm, g) -> e.first().as((src, dst) -> g.addEdge(nm.orElse(Name.unit()), src, dst)),
                UnaryOperator.identity(),
                (nm, g) -> g.named(engine, nm)));
    }

    public static <N> EdgeListGraph<N> edgeListOfAdjacency(Engine engine, AdjacencyGraph<N> graph) {
        return engine.ns(EDGES_OF_ADJ, () ->
            Trie.foldSeqNm(engine, graph.adjacency(), EdgeListGraph.<N>empty(),
                (entry, nm, g) -> {
                    EdgeListGraph<N> res = g;
                    Name first = nm.orElse(Name.unit());
                    for (N dst : entry.second()) {
                        res = res.addEdge(first, entry.first(), dst);
                        first = Name.unit();
                    }
                    return res;
                },
                UnaryOperator.identity(),
                (nm, g) -> g.named(engine, nm)));
    }
}
