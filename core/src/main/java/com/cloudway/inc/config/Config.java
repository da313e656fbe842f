/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;

import static java.util.Objects.requireNonNull;

/**
 * Configuration properties for tries and incremental engines. Properties
 * are read from a classpath resource, a system property with the same key
 * takes precedence over the resource value.
 */
public final class Config
{
    public static final String DEFAULT_RESOURCE = "cloudway-inc.properties";

    public static final String MIN_DEPTH_KEY = "inc.trie.min_depth";
    public static final int DEFAULT_MIN_DEPTH = 1;

    public static final String ENGINE_MODE_KEY = "inc.engine.mode";
    public static final String DEFAULT_ENGINE_MODE = "incremental";

    public static final String MEMO_CAPACITY_KEY = "inc.engine.memo_capacity";
    public static final int DEFAULT_MEMO_CAPACITY = 10000;

    private static final Config DEFAULT = new Config(DEFAULT_RESOURCE);

    private final String resource;
    private final ImmutableMap<String, String> properties;

    /**
     * Load configuration from the given classpath resource. A missing
     * resource yields an empty configuration.
     *
     * @param resource the classpath resource name
     */
    public Config(String resource) {
        this(resource, load(requireNonNull(resource)));
    }

    /**
     * Create configuration from the given property mapping.
     */
    public Config(Map<String, String> properties) {
        this("<memory>", ImmutableMap.copyOf(properties));
    }

    private Config(String resource, ImmutableMap<String, String> properties) {
        this.resource = resource;
        this.properties = properties;
    }

    /**
     * Returns the configuration loaded from the default resource.
     */
    public static Config getDefault() {
        return DEFAULT;
    }

    private static ImmutableMap<String, String> load(String resource) {
        Properties props = new Properties();
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read configuration " + resource, ex);
        }

        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        props.stringPropertyNames().forEach(key -> builder.put(key, props.getProperty(key).trim()));
        return builder.build();
    }

    public Optional<String> get(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(properties.get(name));
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public boolean getBoolean(String name, boolean deflt) {
        return get(name).map(Boolean::valueOf).orElse(deflt);
    }

    public int getInt(String name, int deflt) {
        return get(name).map(s -> Ints.tryParse(s.trim())).orElse(deflt);
    }

    /**
     * The minimum branching depth of newly created tries.
     */
    public int minDepth() {
        return getInt(MIN_DEPTH_KEY, DEFAULT_MIN_DEPTH);
    }

    /**
     * The name of the execution mode of engines created from this
     * configuration.
     */
    public String engineMode() {
        return get(ENGINE_MODE_KEY, DEFAULT_ENGINE_MODE);
    }

    /**
     * The maximum number of entries in an engine memo table.
     */
    public int memoCapacity() {
        return getInt(MEMO_CAPACITY_KEY, DEFAULT_MEMO_CAPACITY);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("resource", resource)
            .add("properties", properties)
            .toString();
    }
}
