/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.data;

import java.util.logging.Logger;

import com.cloudway.inc.config.Config;

/**
 * Metadata held by the root of a trie, fixed when the trie is created.
 */
public final class Meta {
    private static final Logger logger = Logger.getLogger(Meta.class.getName());

    private final int minDepth;

    private Meta(int minDepth) {
        this.minDepth = minDepth;
    }

    /**
     * Construct metadata with the given minimum depth. The value is
     * recorded as given, it is clamped when a trie is created.
     *
     * @param minDepth the number of branch levels enforced before any
     * leaf may appear
     */
    public static Meta of(int minDepth) {
        return new Meta(minDepth);
    }

    /**
     * Returns metadata with the configured minimum depth. The configuration
     * is read on each call, so a system property set at run time applies
     * to tries created afterwards.
     */
    public static Meta getDefault() {
        return of(Config.getDefault().minDepth());
    }

    public int minDepth() {
        return minDepth;
    }

    /**
     * Returns metadata whose minimum depth lies within
     * {@code [0, BitString.MAX_LEN]}. Out of range values are clamped and
     * reported.
     */
    public Meta clamped() {
        if (minDepth > BitString.MAX_LEN) {
            logger.warning("Cannot make trie with min_depth > " + BitString.MAX_LEN
                           + " (given " + minDepth + ")");
            return new Meta(BitString.MAX_LEN);
        }
        if (minDepth < 0) {
            logger.warning("Cannot make trie with negative min_depth (given " + minDepth + ")");
            return new Meta(0);
        }
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || (obj instanceof Meta) && minDepth == ((Meta)obj).minDepth;
    }

    @Override
    public int hashCode() {
        return minDepth;
    }

    @Override
    public String toString() {
        return "Meta(min_depth=" + minDepth + ")";
    }
}
