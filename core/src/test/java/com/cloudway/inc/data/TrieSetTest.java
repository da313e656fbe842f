/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.inc.engine.Name;

public class TrieSetTest {
    @Test
    public void test_empty() {
        Trie<Tuple<Integer, Unit>> s = TrieSet.empty();
        assertTrue(Trie.isEmpty(s));
        assertEquals(0, TrieSet.size(s));
        for (int x = -5; x < 5; x++)
            assertFalse(TrieSet.mem(s, x));
        assertFalse(Trie.isEmpty(TrieSet.add(s, 0)));
    }

    @Test
    public void test_add_mem() {
        Trie<Tuple<Integer, Unit>> s = TrieSet.empty(Meta.of(1));
        s = TrieSet.add(s, 7);
        s = TrieSet.add(s, 1);
        s = TrieSet.add(s, 8);
        assertTrue(TrieSet.mem(s, 7));
        assertTrue(TrieSet.mem(s, 1));
        assertTrue(TrieSet.mem(s, 8));
        assertFalse(TrieSet.mem(s, 0));

        Trie<Tuple<Integer, Unit>> s2 = TrieSet.empty(Meta.of(1));
        s2 = TrieSet.add(s2, 8);
        s2 = TrieSet.add(s2, 7);
        s2 = TrieSet.add(s2, 1);
        assertEquals(s, s2);
        assertTrue(TrieSet.valid(s));
    }

    @Test
    public void test_idempotent() {
        Trie<Tuple<String, Unit>> s = TrieSet.of("a", "b");
        Trie<Tuple<String, Unit>> s2 = TrieSet.add(s, "b");
        assertEquals(s, s2);
        assertEquals(2, TrieSet.size(s2));
        assertEquals(s2, TrieSet.add(s2, "b"));
    }

    @Test
    public void test_permutations() {
        List<Integer> xs = IntStream.range(0, 100).boxed().collect(Collectors.toList());
        Trie<Tuple<Integer, Unit>> expected = TrieSet.of(xs.toArray(new Integer[0]));
        Random rnd = new Random(42);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(xs, rnd);
            Trie<Tuple<Integer, Unit>> s = TrieSet.empty();
            for (Integer x : xs)
                s = TrieSet.add(Name.ofLong(x), s, x);
            assertEquals(expected, s);
            assertEquals(expected.hashCode(), s.hashCode());
        }
    }

    @Test
    public void test_membership() {
        Random rnd = new Random(7);
        int[] inserted = rnd.ints(300, 0, 1000).toArray();
        Trie<Tuple<Integer, Unit>> s = TrieSet.empty(Meta.of(3));
        TreeSet<Integer> model = new TreeSet<>();
        for (int x : inserted) {
            s = TrieSet.add(s, x);
            model.add(x);
        }
        for (int x = 0; x < 1000; x++)
            assertEquals("element " + x, model.contains(x), TrieSet.mem(s, x));
        assertEquals(model.size(), TrieSet.size(s));
        assertTrue(TrieSet.valid(s));
    }

    @Test
    public void test_fold() {
        Trie<Tuple<Integer, Unit>> s = TrieSet.of(1, 2, 3, 4);
        TreeSet<Integer> seen = TrieSet.fold(s, new TreeSet<Integer>(), (x, acc) -> { acc.add(x); return acc; });
        assertEquals(new TreeSet<>(Arrays.asList(1, 2, 3, 4)), seen);
    }

    @Test
    public void test_equal_hash_codes() {
        assertEquals("Aa".hashCode(), "BB".hashCode());
        Trie<Tuple<String, Unit>> s = TrieSet.of("Aa", "BB");
        assertEquals(2, TrieSet.size(s));
        assertTrue(TrieSet.mem(s, "Aa"));
        assertTrue(TrieSet.mem(s, "BB"));
        assertFalse(TrieSet.mem(s, "AaAa"));
        assertTrue(TrieSet.valid(s));
        assertEquals(s, TrieSet.of("BB", "Aa"));
        assertEquals(s, TrieSet.add(s, "BB"));

        Trie<Tuple<String, Unit>> s2 = TrieSet.of("AaAa", "x", "BBBB", "AaBB", "y", "BBAa");
        assertEquals(6, TrieSet.size(s2));
        assertEquals(s2, TrieSet.of("y", "BBAa", "x", "AaBB", "BBBB", "AaAa"));
        assertTrue(TrieSet.mem(s2, "AaBB"));
        assertFalse(TrieSet.mem(s2, "Aa"));
        assertTrue(TrieSet.valid(s2));
    }

    @Test
    public void test_equal_hash_code_longs() {
        Trie<Tuple<Long, Unit>> s = TrieSet.of(0L, -1L);
        assertEquals(2, TrieSet.size(s));
        assertTrue(TrieSet.mem(s, 0L));
        assertTrue(TrieSet.mem(s, -1L));
        assertEquals(s, TrieSet.of(-1L, 0L));
        assertTrue(TrieSet.valid(s));
    }

    @Test
    public void test_equal_hash_code_tuples() {
        Tuple<Integer, Integer> a = Tuple.of(0, 31), b = Tuple.of(1, 0);
        assertEquals(a.hashCode(), b.hashCode());
        Trie<Tuple<Tuple<Integer, Integer>, Unit>> s = TrieSet.of(a, b);
        assertEquals(2, TrieSet.size(s));
        assertTrue(TrieSet.mem(s, a));
        assertTrue(TrieSet.mem(s, b));
        assertEquals(s, TrieSet.of(b, a));
        assertTrue(TrieSet.valid(s));
    }

    @Test
    public void test_different_sets() {
        assertNotEquals(TrieSet.of(1, 2, 3), TrieSet.of(1, 2, 4));
        assertNotEquals(TrieSet.of(1, 2, 3), TrieSet.of(1, 2));
    }
}
