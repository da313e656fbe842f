/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.MoreObjects;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;

import com.cloudway.inc.config.Config;

/**
 * A minimal incremental computation engine. The engine hands out named
 * articulations and memoizes named computations, so that a computation
 * repeated under the same name with equal arguments is not run again.
 *
 * <p>The execution mode is fixed when the engine is created. A
 * {@linkplain Mode#NAIVE naive} engine never reuses anything and serves as
 * the from-scratch baseline, an {@linkplain Mode#INCREMENTAL incremental}
 * engine keeps a memo table. Engines of both modes can be used side by side.
 * An engine is not thread safe.</p>
 */
public final class Engine {
    private static final Logger logger = Logger.getLogger(Engine.class.getName());

    /**
     * The engine execution mode.
     */
    public enum Mode {
        NAIVE, INCREMENTAL;

        /**
         * Parse a mode name, case insensitive.
         *
         * @throws IllegalArgumentException if the name denotes no mode
         */
        public static Mode parse(String name) {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
    }

    private static final String CELL = "cell";

    private final Mode mode;
    private final Cache<MemoKey, MemoEntry> table;
    private final Deque<Name> namespace = new ArrayDeque<>();
    private final Set<MemoKey> pending = new HashSet<>();
    private long reused, computed;

    private Engine(Mode mode, int capacity) {
        if (capacity < 0)
            throw new IllegalArgumentException("Negative memo capacity: " + capacity);
        this.mode = Objects.requireNonNull(mode);
        this.table = CacheBuilder.newBuilder().maximumSize(capacity).build();
    }

    /**
     * Create an engine that recomputes everything.
     */
    public static Engine naive() {
        return create(Mode.NAIVE);
    }

    /**
     * Create a memoizing engine.
     */
    public static Engine incremental() {
        return create(Mode.INCREMENTAL);
    }

    public static Engine create(Mode mode) {
        return create(mode, Config.DEFAULT_MEMO_CAPACITY);
    }

    public static Engine create(Mode mode, int capacity) {
        return new Engine(mode, capacity);
    }

    /**
     * Create an engine as described by the given configuration.
     */
    public static Engine create(Config config) {
        return create(Mode.parse(config.engineMode()), config.memoCapacity());
    }

    public Mode mode() {
        return mode;
    }

    private boolean memoizing() {
        return mode == Mode.INCREMENTAL;
    }

    /**
     * Register a named articulation holding the given value. An incremental
     * engine returns the articulation registered earlier under the same
     * name if its value is unchanged.
     *
     * @param nm the articulation name
     * @param value the articulated value
     */
    @SuppressWarnings("unchecked")
    public <T> Art<T> cell(Name nm, T value) {
        if (!memoizing()) {
            computed++;
            return Art.named(nm, value);
        }

        MemoKey key = key(nm, CELL);
        MemoEntry entry = table.getIfPresent(key);
        if (entry != null && entry.result.equals(value)) {
            reused++;
            return (Art<T>)entry.args;
        }

        Art<T> art = Art.named(nm, value);
        table.put(key, new MemoEntry(art, value));
        computed++;
        return art;
    }

    /**
     * Create a demand-driven articulation whose value is the memoized
     * result of the given computation. The namespace is captured when the
     * thunk is created.
     *
     * @param nm the computation name
     * @param progPt identifies the computation code
     * @param args the arguments the computation depends on
     * @param body the computation
     */
    public <T> Art<T> thunk(Name nm, String progPt, Object args, Supplier<T> body) {
        MemoKey key = key(nm, progPt);
        return Art.lazy(nm, () -> memo(key, args, body));
    }

    /**
     * Run a named computation. An incremental engine returns the result
     * recorded under the same namespace, name and program point if the
     * arguments are equal to the recorded ones, otherwise the computation
     * runs and its result replaces the recorded one.
     *
     * @param nm the computation name
     * @param progPt identifies the computation code
     * @param args the arguments the computation depends on
     * @param body the computation
     * @return the computation result
     * @throws IllegalStateException if the computation is requested while
     * it is already running
     */
    public <T> T memo(Name nm, String progPt, Object args, Supplier<T> body) {
        return memo(key(nm, progPt), args, body);
    }

    @SuppressWarnings("unchecked")
    private <T> T memo(MemoKey key, Object args, Supplier<T> body) {
        if (memoizing()) {
            MemoEntry entry = table.getIfPresent(key);
            if (entry != null && Objects.equals(entry.args, args)) {
                reused++;
                if (logger.isLoggable(Level.FINE))
                    logger.fine("Reuse " + key);
                return (T)entry.result;
            }
        }

        if (!pending.add(key))
            throw new IllegalStateException("Cycle detected while computing " + key);
        try {
            if (logger.isLoggable(Level.FINE))
                logger.fine("Compute " + key);
            T result = body.get();
            if (memoizing())
                table.put(key, new MemoEntry(args, result));
            computed++;
            return result;
        } finally {
            pending.remove(key);
        }
    }

    /**
     * Run the given computation in the namespace of the given name. Memo
     * keys created inside the computation are qualified by the namespace,
     * so equal names in distinct namespaces do not collide.
     */
    public <T> T ns(Name nm, Supplier<T> body) {
        namespace.addLast(Objects.requireNonNull(nm));
        try {
            return body.get();
        } finally {
            namespace.removeLast();
        }
    }

    private MemoKey key(Name nm, String progPt) {
        return new MemoKey(ImmutableList.copyOf(namespace),
                           Objects.requireNonNull(nm),
                           Objects.requireNonNull(progPt));
    }

    /**
     * Returns a snapshot of the reuse statistics.
     */
    public Stats stats() {
        return new Stats(reused, computed);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("mode", mode)
            .add("size", table.size())
            .add("stats", stats())
            .toString();
    }

    /**
     * Counts how often the engine reused a recorded result and how often
     * it had to compute one.
     */
    public static final class Stats {
        private final long reused, computed;

        Stats(long reused, long computed) {
            this.reused = reused;
            this.computed = computed;
        }

        public long reused() {
            return reused;
        }

        public long computed() {
            return computed;
        }

        public String toString() {
            return "reused=" + reused + ", computed=" + computed;
        }
    }

    private static final class MemoKey {
        private final ImmutableList<Name> namespace;
        private final Name name;
        private final String progPt;

        MemoKey(ImmutableList<Name> namespace, Name name, String progPt) {
            this.namespace = namespace;
            this.name = name;
            this.progPt = progPt;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof MemoKey))
                return false;
            MemoKey other = (MemoKey)obj;
            return name.equals(other.name)
                && progPt.equals(other.progPt)
                && namespace.equals(other.namespace);
        }

        @Override
        public int hashCode() {
            return Objects.hash(namespace, name, progPt);
        }

        @Override
        public String toString() {
            return progPt + "@" + (namespace.isEmpty() ? "" : namespace + "/") + name;
        }
    }

    // for cells, args holds the articulation and result holds its value
    private static final class MemoEntry {
        final Object args;
        final Object result;

        MemoEntry(Object args, Object result) {
            this.args = args;
            this.result = result;
        }
    }
}
