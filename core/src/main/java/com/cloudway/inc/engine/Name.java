/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.engine;

import java.util.Objects;

import com.cloudway.inc.data.Tuple;

/**
 * A stable identity used to correlate a computation across edits, so that
 * a memoizing engine can reuse prior results.
 *
 * <p>Names are immutable structural values. Two names are equal iff they
 * were built by the same sequence of constructors from equal arguments.
 * {@link #fork(Name)} is the primitive that derives fresh names: forking
 * the same name always yields the same two children, the children are
 * distinct from each other and from the parent.</p>
 */
public abstract class Name {
    private final int hash;

    private Name(int hash) {
        this.hash = hash;
    }

    private static final Name UNIT = new Unit();

    /**
     * Returns the unit name, used where no particular identity is needed.
     */
    public static Name unit() {
        return UNIT;
    }

    /**
     * Construct a name from a symbol.
     */
    public static Name ofString(String s) {
        return new Sym(Objects.requireNonNull(s));
    }

    /**
     * Construct a name from a number.
     */
    public static Name ofLong(long n) {
        return new Num(n);
    }

    /**
     * Combine two names into one.
     */
    public static Name pair(Name a, Name b) {
        return new Pair(Objects.requireNonNull(a), Objects.requireNonNull(b));
    }

    /**
     * Derive two names from the given name.
     *
     * @param nm the name to fork
     * @return a tuple of the left and right fork
     */
    public static Tuple<Name, Name> fork(Name nm) {
        Objects.requireNonNull(nm);
        return Tuple.of(new Fork(nm, false), new Fork(nm, true));
    }

    @Override
    public abstract boolean equals(Object obj);

    @Override
    public final int hashCode() {
        return hash;
    }

    private static final class Unit extends Name {
        Unit() {
            super(0x5bd1e995);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Unit;
        }

        @Override
        public String toString() {
            return "()";
        }
    }

    private static final class Sym extends Name {
        private final String symbol;

        Sym(String symbol) {
            super(31 + symbol.hashCode());
            this.symbol = symbol;
        }

        @Override
        public boolean equals(Object obj) {
            return (obj instanceof Sym) && symbol.equals(((Sym)obj).symbol);
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    private static final class Num extends Name {
        private final long number;

        Num(long number) {
            super(31 * 2 + Long.hashCode(number));
            this.number = number;
        }

        @Override
        public boolean equals(Object obj) {
            return (obj instanceof Num) && number == ((Num)obj).number;
        }

        @Override
        public String toString() {
            return String.valueOf(number);
        }
    }

    private static final class Pair extends Name {
        private final Name first, second;

        Pair(Name first, Name second) {
            super(31 * (31 * 3 + first.hashCode()) + second.hashCode());
            this.first = first;
            this.second = second;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Pair))
                return false;
            Pair other = (Pair)obj;
            return hashCode() == other.hashCode()
                && first.equals(other.first)
                && second.equals(other.second);
        }

        @Override
        public String toString() {
            return "(" + first + "," + second + ")";
        }
    }

    private static final class Fork extends Name {
        private final Name parent;
        private final boolean right;

        Fork(Name parent, boolean right) {
            super(31 * (31 * 4 + parent.hashCode()) + (right ? 2 : 1));
            this.parent = parent;
            this.right = right;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Fork))
                return false;
            Fork other = (Fork)obj;
            return right == other.right
                && hashCode() == other.hashCode()
                && parent.equals(other.parent);
        }

        @Override
        public String toString() {
            return parent + (right ? ".2" : ".1");
        }
    }
}
