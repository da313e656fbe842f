/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.graph;

import com.cloudway.inc.data.Trie;
import com.cloudway.inc.data.Tuple;
import com.cloudway.inc.data.Unit;
import com.cloudway.inc.engine.Engine;
import com.cloudway.inc.engine.Name;

/**
 * A persistent directed graph whose reductions are computed through an
 * incremental engine.
 *
 * @param <N> the type of node identifiers
 */
public interface Graph<N> {
    /**
     * Returns a graph with the given edge added.
     *
     * @param nm the name of the edge insertion
     * @param src the source node
     * @param dst the destination node
     */
    Graph<N> addEdge(Name nm, N src, N dst);

    /**
     * Tag the graph with a name, so that later reductions can reuse the
     * results computed over this graph.
     */
    Graph<N> named(Engine engine, Name nm);

    /**
     * Returns the set of edges in the graph.
     */
    Trie<Tuple<Tuple<N, N>, Unit>> edges(Engine engine);

    /**
     * Returns the set of nodes appearing as source or destination of an
     * edge.
     */
    Trie<Tuple<N, Unit>> vertices(Engine engine);

    /**
     * Returns a graph with every edge reversed.
     */
    Graph<N> reverseEdges(Engine engine);
}
