/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.engine;

/**
 * This interface provides an operation for resolving a possibly deferred
 * value. Forcing may trigger a computation the first time, subsequent
 * forcing yields the same value.
 */
public interface Forcible<T> {
    /**
     * Resolve the deferred value.
     *
     * @return the resolved value
     */
    T force();
}
