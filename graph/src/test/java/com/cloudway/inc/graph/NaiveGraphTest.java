/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.graph;

import com.cloudway.inc.engine.Engine;

public class NaiveGraphTest extends GraphTestBase {
    @Override
    protected Engine newEngine() {
        return Engine.naive();
    }
}
