/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.engine;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import com.google.common.base.Suppliers;

/**
 * An articulation: a shared handle to a value that may not have been
 * computed yet. Forcing the articulation yields the value, the value is
 * computed at most once and never changes afterwards, so an articulation
 * can be shared freely between persistent data structures.
 *
 * @param <T> the type of the articulated value
 */
public final class Art<T> implements Forcible<T> {
    private final Name name;
    private final Supplier<T> value;

    private Art(Name name, Supplier<T> value) {
        this.name = name;
        this.value = value;
    }

    /**
     * Wraps an already computed value. The articulation has no name and
     * is identified by its content.
     */
    public static <T> Art<T> put(T value) {
        return new Art<>(null, Suppliers.ofInstance(Objects.requireNonNull(value)));
    }

    /**
     * Wraps an already computed value under the given name.
     */
    public static <T> Art<T> named(Name name, T value) {
        return new Art<>(Objects.requireNonNull(name),
                         Suppliers.ofInstance(Objects.requireNonNull(value)));
    }

    /**
     * Creates a demand-driven articulation, the computation runs the first
     * time the articulation is forced.
     */
    public static <T> Art<T> lazy(Name name, Supplier<T> computation) {
        return new Art<>(Objects.requireNonNull(name),
                         Suppliers.memoize(computation::get));
    }

    /**
     * Returns the name of this articulation, or empty for a structural
     * articulation created by {@link #put(Object)}.
     */
    public Optional<Name> name() {
        return Optional.ofNullable(name);
    }

    @Override
    public T force() {
        return value.get();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Art))
            return false;
        Art<?> other = (Art<?>)obj;
        return Objects.equals(name, other.name)
            && force().equals(other.force());
    }

    @Override
    public int hashCode() {
        return name != null ? name.hashCode() : force().hashCode();
    }

    @Override
    public String toString() {
        return name != null ? "Art(" + name + ")" : "Art(" + force() + ")";
    }
}
