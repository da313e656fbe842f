/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.data;

import org.junit.Test;
import static org.junit.Assert.*;

public class BitStringTest {
    @Test
    public void test_empty() {
        assertEquals(0, BitString.EMPTY.length());
        assertEquals(0L, BitString.EMPTY.value());
        assertEquals("<>", BitString.EMPTY.toString());
        assertTrue(BitString.EMPTY.matches(0xdeadbeefL));
    }

    @Test
    public void test_prepend() {
        BitString bs = BitString.prepend(1, BitString.prepend(0, BitString.prepend(1, BitString.EMPTY)));
        assertEquals(3, bs.length());
        assertEquals(0b101L, bs.value());
        assertEquals(1, bs.bit(0));
        assertEquals(0, bs.bit(1));
        assertEquals(1, bs.bit(2));
        assertEquals("<101>", bs.toString());
        assertEquals(BitString.of(3, 0b101L), bs);
    }

    @Test
    public void test_of_discards_high_bits() {
        assertEquals(BitString.of(2, 0b01L), BitString.of(2, 0b1101L));
        assertNotEquals(BitString.of(2, 1L), BitString.of(3, 1L));
    }

    @Test
    public void test_matches() {
        BitString bs = BitString.of(3, 0b110L);
        assertTrue(bs.matches(0b110L));
        assertTrue(bs.matches(0b1010110L));
        assertFalse(bs.matches(0b111L));
        assertEquals(0b111L, bs.mask());
    }

    @Test
    public void test_full_length() {
        BitString bs = BitString.EMPTY;
        for (int i = 0; i < BitString.MAX_LEN; i++)
            bs = BitString.prepend(i & 1, bs);
        assertEquals(BitString.MAX_LEN, bs.length());
        assertEquals(-1L, bs.mask());
        assertTrue(bs.matches(bs.value()));

        try {
            BitString.prepend(0, bs);
            fail("Bit string longer than " + BitString.MAX_LEN);
        } catch (IllegalStateException ex) {
            // ok
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_bad_bit() {
        BitString.prepend(2, BitString.EMPTY);
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_bad_length() {
        BitString.of(BitString.MAX_LEN + 1, 0L);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void test_bit_out_of_range() {
        BitString.of(2, 3L).bit(2);
    }
}
