/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.data;

/**
 * A bounded sequence of bits used as the address of a trie node.
 *
 * <p>Bit {@code i} of the value is the branch taken at depth {@code i},
 * so every node at a path holds only elements whose placement hash agrees
 * with the path value on the low {@code length} bits.</p>
 */
public final class BitString {
    /**
     * The maximum length of a bit string, the width of a placement hash.
     */
    public static final int MAX_LEN = Long.SIZE;

    /**
     * The zero-length bit string addressing the top of a trie.
     */
    public static final BitString EMPTY = new BitString(0, 0L);

    private final int length;
    private final long value;

    private BitString(int length, long value) {
        this.length = length;
        this.value = value;
    }

    /**
     * Construct a bit string from its length and value. Bits of the value
     * beyond the length are discarded.
     *
     * @throws IllegalArgumentException if the length is out of range
     */
    public static BitString of(int length, long value) {
        if (length < 0 || length > MAX_LEN)
            throw new IllegalArgumentException("Bit string length out of range: " + length);
        return length == 0 ? EMPTY : new BitString(length, value & mask(length));
    }

    /**
     * Returns a bit string one bit longer than the given one, extended
     * with the given bit.
     *
     * @param bit the bit to append at the next depth, 0 or 1
     * @param bs the bit string to extend
     * @throws IllegalArgumentException if bit is neither 0 nor 1
     * @throws IllegalStateException if the bit string is already at its
     * maximum length
     */
    public static BitString prepend(int bit, BitString bs) {
        if (bit != 0 && bit != 1)
            throw new IllegalArgumentException("Not a bit: " + bit);
        if (bs.length >= MAX_LEN)
            throw new IllegalStateException("Bit string exceeds " + MAX_LEN + " bits");
        return new BitString(bs.length + 1, bs.value | ((long)bit << bs.length));
    }

    public int length() {
        return length;
    }

    public long value() {
        return value;
    }

    /**
     * Returns the bit at the given depth.
     */
    public int bit(int i) {
        if (i < 0 || i >= length)
            throw new IndexOutOfBoundsException("Bit index " + i + " out of length " + length);
        return (int)(value >>> i) & 1;
    }

    /**
     * Returns the mask selecting the low bits covered by this bit string.
     */
    public long mask() {
        return mask(length);
    }

    static long mask(int length) {
        return length == MAX_LEN ? -1L : (1L << length) - 1;
    }

    /**
     * Test whether the given hash has this bit string as its suffix, that
     * is whether a hash would be placed beneath this path.
     */
    public boolean matches(long hash) {
        return (hash & mask()) == value;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof BitString))
            return false;
        BitString other = (BitString)obj;
        return length == other.length && value == other.value;
    }

    @Override
    public int hashCode() {
        return 31 * length + Long.hashCode(value);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder(length + 2);
        buf.append('<');
        for (int i = 0; i < length; i++)
            buf.append((value >>> i) & 1);
        return buf.append('>').toString();
    }
}
