/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.inc.data;

import java.util.HashSet;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import com.google.common.collect.ImmutableSet;

import com.cloudway.inc.engine.Art;
import com.cloudway.inc.engine.Engine;
import com.cloudway.inc.engine.Name;
import com.cloudway.inc.function.QuadFunction;
import com.cloudway.inc.function.TriFunction;

/**
 * A probabilistically balanced binary hash trie whose structure is
 * annotated with names and articulations, so that an incremental engine
 * can reuse results computed over unchanged parts of the trie.
 *
 * <p>A trie node is one of</p>
 * <ul>
 * <li>{@code Nil(bs)} an empty subtree at path {@code bs}</li>
 * <li>{@code Leaf(bs, x)} a single element at path {@code bs}</li>
 * <li>{@code Collision(bs, xs)} two or more elements whose keys share a
 * placement hash, at the path a single leaf would take</li>
 * <li>{@code Bin(bs, l, r)} a branch at path {@code bs}</li>
 * <li>{@code Root(meta, t)} the top of a complete trie</li>
 * <li>{@code Name(nm, t)} a subtree tagged with a stable identity</li>
 * <li>{@code Art(a)} an articulated subtree, transparent to every operation</li>
 * </ul>
 *
 * <p>Tries are persistent: {@link #extend(Name, Trie, Object)} returns a
 * new trie that shares unmodified subtrees with its input. Equality
 * ignores names and articulations: two tries with the same metadata and
 * the same elements are equal, whatever the insertion order.</p>
 *
 * @param <X> the type of trie elements
 */
public abstract class Trie<X> {
    private Trie() {}

    private static final Name EMPTY_NAME = Name.ofString("empty");

    private static final String FOLD_SEQ = "Trie.foldSeq";
    private static final String FOLD_SEQ_NM = "Trie.foldSeqNm";

    /**
     * The read-only visitor of trie nodes. Articulations are forced before
     * the visitor sees a node, so there is no articulation case.
     *
     * <p>Unless overridden, a collision bucket is seen as a chain of
     * branches at the path of the bucket, each holding one element as its
     * left child.</p>
     */
    public interface Visitor<X, R> {
        R nil(BitString bs);
        R leaf(BitString bs, X elt);
        R bin(BitString bs, Trie<X> left, Trie<X> right);
        R root(Meta meta, Trie<X> trie);
        R name(Name name, Trie<X> trie);

        default R collision(BitString bs, Set<X> elts) {
            Iterator<X> it = elts.iterator();
            X first = it.next();
            return bin(bs, Trie.leaf(bs, first), Trie.collision(bs, ImmutableSet.copyOf(it)));
        }
    }

    abstract <R> R accept(Visitor<X, R> v);

    abstract Trie<X> place(TriePlacement.Insertion<X> ins, BitString bs);

    abstract Trie<X> split(Function<? super X, ?> keyOf);

    abstract boolean sameAs(Trie<?> other);

    abstract int shapeHash();

    // Introduction ---------------------------------------------------------

    /**
     * Returns the empty node at the given path.
     */
    public static <X> Trie<X> nil(BitString bs) {
        return new NilNode<>(Objects.requireNonNull(bs));
    }

    /**
     * Returns a node holding exactly one element.
     */
    public static <X> Trie<X> leaf(BitString bs, X elt) {
        return new LeafNode<>(Objects.requireNonNull(bs), Objects.requireNonNull(elt));
    }

    // a bucket of one element is a leaf
    static <X> Trie<X> collision(BitString bs, ImmutableSet<X> elts) {
        return elts.size() == 1
            ? leaf(bs, elts.iterator().next())
            : new CollisionNode<>(bs, elts);
    }

    /**
     * Returns a branch owning the two given subtrees.
     */
    public static <X> Trie<X> bin(BitString bs, Trie<X> left, Trie<X> right) {
        return new BinNode<>(Objects.requireNonNull(bs),
                             Objects.requireNonNull(left),
                             Objects.requireNonNull(right));
    }

    /**
     * Wraps the given subtree as the top of a trie carrying the given
     * metadata.
     */
    public static <X> Trie<X> root(Meta meta, Trie<X> trie) {
        return new RootNode<>(Objects.requireNonNull(meta), Objects.requireNonNull(trie));
    }

    /**
     * Tags the given subtree with a name.
     */
    public static <X> Trie<X> name(Name nm, Trie<X> trie) {
        return new NameNode<>(Objects.requireNonNull(nm), Objects.requireNonNull(trie));
    }

    /**
     * Wraps an articulated subtree.
     */
    public static <X> Trie<X> art(Art<Trie<X>> art) {
        return new ArtNode<>(Objects.requireNonNull(art));
    }

    /**
     * Construct an empty trie. The minimum depth of the metadata is clamped
     * to {@code [0, BitString.MAX_LEN]}.
     *
     * @param meta the trie metadata
     */
    public static <X> Trie<X> empty(Meta meta) {
        Tuple<Name, Name> nms = Name.fork(EMPTY_NAME);
        Trie<X> mt = name(nms.second(), art(Art.put(nil(BitString.EMPTY))));
        return name(nms.first(), art(Art.put(root(meta.clamped(), mt))));
    }

    /**
     * Construct an empty trie with the configured default metadata.
     */
    public static <X> Trie<X> empty() {
        return empty(Meta.getDefault());
    }

    /**
     * Construct a trie with a single element.
     */
    public static <X> Trie<X> singleton(Meta meta, Name nm, X elt) {
        return extend(nm, empty(meta), elt);
    }

    /**
     * Returns a new trie containing the elements of the given trie and the
     * given element. The given trie must be a trie returned by
     * {@code empty}, {@code singleton} or {@code extend}, possibly wrapped
     * in further named articulations.
     *
     * @param nm the name of this insertion
     * @param trie the trie to extend
     * @param elt the element to insert
     * @return the extended trie
     * @throws IllegalStateException if the given trie is malformed
     */
    public static <X> Trie<X> extend(Name nm, Trie<X> trie, X elt) {
        return TriePlacement.extend(nm, trie, elt, Function.identity());
    }

    // Elimination ----------------------------------------------------------

    /**
     * Force articulations until the node is not an articulation. Names are
     * never unwrapped.
     */
    public static <X> Trie<X> normalize(Trie<X> trie) {
        Trie<X> t = trie;
        while (t instanceof ArtNode)
            t = ((ArtNode<X>)t).art.force();
        return t;
    }

    /**
     * Dispatch on the node kind, forcing articulations first.
     */
    public static <X, R> R visit(Trie<X> trie, Visitor<X, R> visitor) {
        return normalize(trie).accept(visitor);
    }

    /**
     * Dispatch on the node kind with one handler per case, forcing
     * articulations first.
     */
    public static <X, R> R elim(Trie<X> trie,
                                Function<BitString, R> nilFn,
                                BiFunction<BitString, X, R> leafFn,
                                TriFunction<BitString, Trie<X>, Trie<X>, R> binFn,
                                BiFunction<Meta, Trie<X>, R> rootFn,
                                BiFunction<Name, Trie<X>, R> nameFn) {
        return visit(trie, new Visitor<X, R>() {
            @Override
            public R nil(BitString bs) {
                return nilFn.apply(bs);
            }

            @Override
            public R leaf(BitString bs, X elt) {
                return leafFn.apply(bs, elt);
            }

            @Override
            public R bin(BitString bs, Trie<X> left, Trie<X> right) {
                return binFn.apply(bs, left, right);
            }

            @Override
            public R root(Meta meta, Trie<X> t) {
                return rootFn.apply(meta, t);
            }

            @Override
            public R name(Name nm, Trie<X> t) {
                return nameFn.apply(nm, t);
            }
        });
    }

    /**
     * Same as {@link #elim(Trie, Function, BiFunction, TriFunction, BiFunction, BiFunction) elim}
     * with a handler for collision buckets.
     */
    public static <X, R> R elim(Trie<X> trie,
                                Function<BitString, R> nilFn,
                                BiFunction<BitString, X, R> leafFn,
                                BiFunction<BitString, Set<X>, R> collisionFn,
                                TriFunction<BitString, Trie<X>, Trie<X>, R> binFn,
                                BiFunction<Meta, Trie<X>, R> rootFn,
                                BiFunction<Name, Trie<X>, R> nameFn) {
        return visit(trie, new Visitor<X, R>() {
            @Override
            public R nil(BitString bs) {
                return nilFn.apply(bs);
            }

            @Override
            public R leaf(BitString bs, X elt) {
                return leafFn.apply(bs, elt);
            }

            @Override
            public R collision(BitString bs, Set<X> elts) {
                return collisionFn.apply(bs, elts);
            }

            @Override
            public R bin(BitString bs, Trie<X> left, Trie<X> right) {
                return binFn.apply(bs, left, right);
            }

            @Override
            public R root(Meta meta, Trie<X> t) {
                return rootFn.apply(meta, t);
            }

            @Override
            public R name(Name nm, Trie<X> t) {
                return nameFn.apply(nm, t);
            }
        });
    }

    /**
     * Same as {@link #elim(Trie, Function, BiFunction, TriFunction, BiFunction, BiFunction) elim}
     * but threads an extra argument through to the handlers.
     */
    public static <X, A, R> R elimArg(Trie<X> trie, A arg,
                                      BiFunction<BitString, A, R> nilFn,
                                      TriFunction<BitString, X, A, R> leafFn,
                                      QuadFunction<BitString, Trie<X>, Trie<X>, A, R> binFn,
                                      TriFunction<Meta, Trie<X>, A, R> rootFn,
                                      TriFunction<Name, Trie<X>, A, R> nameFn) {
        return visit(trie, new Visitor<X, R>() {
            @Override
            public R nil(BitString bs) {
                return nilFn.apply(bs, arg);
            }

            @Override
            public R leaf(BitString bs, X elt) {
                return leafFn.apply(bs, elt, arg);
            }

            @Override
            public R bin(BitString bs, Trie<X> left, Trie<X> right) {
                return binFn.apply(bs, left, right, arg);
            }

            @Override
            public R root(Meta meta, Trie<X> t) {
                return rootFn.apply(meta, t, arg);
            }

            @Override
            public R name(Name nm, Trie<X> t) {
                return nameFn.apply(nm, t, arg);
            }
        });
    }

    /**
     * Same as {@link #elimArg(Trie, Object, BiFunction, TriFunction, QuadFunction, TriFunction, TriFunction) elimArg}
     * with a handler for collision buckets.
     */
    public static <X, A, R> R elimArg(Trie<X> trie, A arg,
                                      BiFunction<BitString, A, R> nilFn,
                                      TriFunction<BitString, X, A, R> leafFn,
                                      TriFunction<BitString, Set<X>, A, R> collisionFn,
                                      QuadFunction<BitString, Trie<X>, Trie<X>, A, R> binFn,
                                      TriFunction<Meta, Trie<X>, A, R> rootFn,
                                      TriFunction<Name, Trie<X>, A, R> nameFn) {
        return visit(trie, new Visitor<X, R>() {
            @Override
            public R nil(BitString bs) {
                return nilFn.apply(bs, arg);
            }

            @Override
            public R leaf(BitString bs, X elt) {
                return leafFn.apply(bs, elt, arg);
            }

            @Override
            public R collision(BitString bs, Set<X> elts) {
                return collisionFn.apply(bs, elts, arg);
            }

            @Override
            public R bin(BitString bs, Trie<X> left, Trie<X> right) {
                return binFn.apply(bs, left, right, arg);
            }

            @Override
            public R root(Meta meta, Trie<X> t) {
                return rootFn.apply(meta, t, arg);
            }

            @Override
            public R name(Name nm, Trie<X> t) {
                return nameFn.apply(nm, t, arg);
            }
        });
    }

    private static <X> Optional<X> findIn(Set<X> elts, Object key, Function<? super X, ?> keyOf) {
        for (X x : elts) {
            if (key.equals(keyOf.apply(x)))
                return Optional.of(x);
        }
        return Optional.empty();
    }

    /**
     * Find an element equal to the given element. The branches are chosen
     * by successive low bits of the hash index, even goes left and odd goes
     * right.
     *
     * @param trie the trie to search
     * @param elt the element to find
     * @param hashIndex the placement hash of the element
     * @return the stored element, or empty if not found
     */
    public static <X> Optional<X> find(Trie<X> trie, X elt, long hashIndex) {
        return findBy(trie, elt, hashIndex, Function.identity());
    }

    static <X> Optional<X> findBy(Trie<X> trie, Object key, long hashIndex, Function<? super X, ?> keyOf) {
        return Trie.<X, Optional<X>>elim(trie,
            bs -> Optional.empty(),
            (bs, x) -> key.equals(keyOf.apply(x)) ? Optional.of(x) : Optional.empty(),
            (bs, xs) -> findIn(xs, key, keyOf),
            (bs, left, right) -> (hashIndex & 1) == 0
                ? findBy(left, key, hashIndex >>> 1, keyOf)
                : findBy(right, key, hashIndex >>> 1, keyOf),
            (meta, t) -> findBy(t, key, hashIndex, keyOf),
            (nm, t) -> findBy(t, key, hashIndex, keyOf));
    }

    /**
     * Returns {@code true} if every reachable node is empty.
     */
    public static <X> boolean isEmpty(Trie<X> trie) {
        return Trie.<X, Boolean>elim(trie,
            bs -> true,
            (bs, x) -> false,
            (bs, xs) -> false,
            (bs, left, right) -> isEmpty(left) && isEmpty(right),
            (meta, t) -> isEmpty(t),
            (nm, t) -> isEmpty(t));
    }

    /**
     * Split a leaf into a branch, the element moves to the child selected
     * by the next bit of its hash. A collision bucket moves as a whole.
     * Empty nodes and branches are returned unchanged.
     *
     * @throws IllegalStateException if the node is a root, a name or an
     * articulation
     */
    public static <X> Trie<X> splitAtomic(Trie<X> trie) {
        return trie.split(Function.identity());
    }

    /**
     * Returns the placement hash of the given key.
     */
    public static long placementHash(Object key) {
        return TriePlacement.hash(key);
    }

    /**
     * Returns the number of elements in the trie.
     */
    public static <X> int size(Trie<X> trie) {
        return fold(trie, 0, (x, n) -> n + 1);
    }

    /**
     * Check the structural invariants of the trie: every node sits at the
     * path its parent assigns, every leaf is at least as deep as the
     * minimum depth and sits on the path of its placement hash. A collision
     * bucket holds at least two elements of distinct keys sharing one
     * placement hash.
     *
     * @param trie the trie to check
     * @param keyOf extracts the placement key of an element
     */
    public static <X> boolean valid(Trie<X> trie, Function<? super X, ?> keyOf) {
        return valid(trie, BitString.EMPTY, 0, keyOf);
    }

    private static <X> boolean valid(Trie<X> trie, BitString path, int minDepth, Function<? super X, ?> keyOf) {
        return Trie.<X, Boolean>elim(trie,
            bs -> bs.equals(path),
            (bs, x) -> bs.equals(path)
                && bs.length() >= minDepth
                && bs.matches(placementHash(keyOf.apply(x))),
            (bs, xs) -> bs.equals(path)
                && bs.length() >= minDepth
                && validBucket(bs, xs, keyOf),
            (bs, left, right) -> bs.equals(path)
                && valid(left, BitString.prepend(0, bs), minDepth, keyOf)
                && valid(right, BitString.prepend(1, bs), minDepth, keyOf),
            (meta, t) -> valid(t, path, meta.minDepth(), keyOf),
            (nm, t) -> valid(t, path, minDepth, keyOf));
    }

    private static <X> boolean validBucket(BitString bs, Set<X> elts, Function<? super X, ?> keyOf) {
        if (elts.size() < 2)
            return false;
        Set<Object> keys = new HashSet<>();
        long hash = placementHash(keyOf.apply(elts.iterator().next()));
        for (X x : elts) {
            Object key = keyOf.apply(x);
            if (!keys.add(key) || placementHash(key) != hash)
                return false;
        }
        return bs.matches(hash);
    }

    // Folds ----------------------------------------------------------------

    /**
     * Reduce the elements of the trie in unspecified order.
     *
     * @param trie the trie to reduce
     * @param init the initial accumulator
     * @param leafFn combines an element with the accumulator
     */
    public static <X, R> R fold(Trie<X> trie, R init, BiFunction<? super X, R, R> leafFn) {
        return Trie.<X, R, R>elimArg(trie, init,
            (bs, acc) -> acc,
            (bs, x, acc) -> leafFn.apply(x, acc),
            (bs, xs, acc) -> {
                R res = acc;
                for (X x : xs)
                    res = leafFn.apply(x, res);
                return res;
            },
            (bs, left, right, acc) -> fold(left, fold(right, acc, leafFn), leafFn),
            (meta, t, acc) -> fold(t, acc, leafFn),
            (nm, t, acc) -> fold(t, acc, leafFn));
    }

    /**
     * Reduce the elements of the trie from left to right.
     *
     * <p>The fold of a named subtree is memoized by the engine under its
     * name, then {@code nameFn} is applied to the result. The subtree is
     * folded in the namespace of its name, so a name nested under itself
     * gets its own memo entry. Folding the same
     * trie with different functions in one engine must be scoped with
     * {@link Engine#ns Engine.ns} to keep the memo entries apart.</p>
     *
     * @param engine the engine memoizing named subtrees
     * @param trie the trie to reduce
     * @param init the initial accumulator
     * @param leafFn combines an element with the accumulator
     * @param binFn applied between the left and the right subtree
     * @param nameFn applied to the result of a named subtree
     */
    public static <X, R> R foldSeq(Engine engine, Trie<X> trie, R init,
                                   BiFunction<? super X, R, R> leafFn,
                                   UnaryOperator<R> binFn,
                                   BiFunction<Name, R, R> nameFn) {
        return Trie.<X, R, R>elimArg(trie, init,
            (bs, acc) -> acc,
            (bs, x, acc) -> leafFn.apply(x, acc),
            (bs, xs, acc) -> {
                R res = acc;
                for (X x : xs)
                    res = leafFn.apply(x, res);
                return res;
            },
            (bs, left, right, acc) -> {
                R res = foldSeq(engine, left, acc, leafFn, binFn, nameFn);
                res = binFn.apply(res);
                return foldSeq(engine, right, res, leafFn, binFn, nameFn);
            },
            (meta, t, acc) -> foldSeq(engine, t, acc, leafFn, binFn, nameFn),
            (nm, t, acc) -> {
                R res = engine.memo(nm, FOLD_SEQ, Tuple.of(t, acc), () ->
                    engine.ns(nm, () -> foldSeq(engine, t, acc, leafFn, binFn, nameFn)));
                return nameFn.apply(nm, res);
            });
    }

    /**
     * Same as {@link #foldSeq foldSeq} but the leaf function also receives
     * the name of the nearest enclosing named subtree. The name is given
     * to the first leaf visited beneath the named subtree only, later leaves
     * receive an empty name.
     */
    public static <X, R> R foldSeqNm(Engine engine, Trie<X> trie, R init,
                                     TriFunction<? super X, Optional<Name>, R, R> leafFn,
                                     UnaryOperator<R> binFn,
                                     BiFunction<Name, R, R> nameFn) {
        return foldSeqNm0(engine, trie, Tuple.of(init, Optional.<Name>empty()), leafFn, binFn, nameFn).first();
    }

    private static <X, R> Tuple<R, Optional<Name>>
    foldSeqNm0(Engine engine, Trie<X> trie, Tuple<R, Optional<Name>> state,
               TriFunction<? super X, Optional<Name>, R, R> leafFn,
               UnaryOperator<R> binFn,
               BiFunction<Name, R, R> nameFn) {
        return Trie.<X, Tuple<R, Optional<Name>>, Tuple<R, Optional<Name>>>elimArg(trie, state,
            (bs, st) -> st,
            (bs, x, st) -> Tuple.of(leafFn.apply(x, st.second(), st.first()), Optional.<Name>empty()),
            (bs, xs, st) -> {
                Tuple<R, Optional<Name>> res = st;
                for (X x : xs)
                    res = Tuple.of(leafFn.apply(x, res.second(), res.first()), Optional.<Name>empty());
                return res;
            },
            (bs, left, right, st) -> {
                Tuple<R, Optional<Name>> res = foldSeqNm0(engine, left, st, leafFn, binFn, nameFn);
                res = Tuple.of(binFn.apply(res.first()), res.second());
                return foldSeqNm0(engine, right, res, leafFn, binFn, nameFn);
            },
            (meta, t, st) -> foldSeqNm0(engine, t, st, leafFn, binFn, nameFn),
            (nm, t, st) -> {
                R res = engine.memo(nm, FOLD_SEQ_NM, Tuple.of(t, st.first()), () ->
                    engine.ns(nm, () -> foldSeqNm0(engine, t, Tuple.of(st.first(), Optional.of(nm)),
                                                   leafFn, binFn, nameFn).first()));
                return Tuple.of(nameFn.apply(nm, res), Optional.<Name>empty());
            });
    }

    /**
     * Rebuild the trie bottom-up, one node at a time. A collision bucket is
     * rebuilt as the chain of branches described by {@link Visitor}.
     *
     * @param trie the trie to rebuild
     * @param nilFn builds an empty node
     * @param leafFn builds a leaf
     * @param binFn builds a branch from the rebuilt children
     * @param rootFn builds a root from the rebuilt subtree
     * @param nameFn builds a named node from the rebuilt subtree
     */
    public static <X, R> R foldUp(Trie<X> trie,
                                  Function<BitString, R> nilFn,
                                  BiFunction<BitString, X, R> leafFn,
                                  TriFunction<BitString, R, R, R> binFn,
                                  BiFunction<Meta, R, R> rootFn,
                                  BiFunction<Name, R, R> nameFn) {
        return Trie.<X, R>elim(trie,
            nilFn,
            leafFn,
            (bs, left, right) -> binFn.apply(bs,
                foldUp(left, nilFn, leafFn, binFn, rootFn, nameFn),
                foldUp(right, nilFn, leafFn, binFn, rootFn, nameFn)),
            (meta, t) -> rootFn.apply(meta, foldUp(t, nilFn, leafFn, binFn, rootFn, nameFn)),
            (nm, t) -> nameFn.apply(nm, foldUp(t, nilFn, leafFn, binFn, rootFn, nameFn)));
    }

    /**
     * Returns a copy of the trie with all names and articulations removed.
     */
    public static <X> Trie<X> strip(Trie<X> trie) {
        return Trie.<X, Trie<X>>elim(trie,
            Trie::nil,
            Trie::leaf,
            (bs, xs) -> collision(bs, ImmutableSet.copyOf(xs)),
            (bs, left, right) -> bin(bs, strip(left), strip(right)),
            (meta, t) -> root(meta, strip(t)),
            (nm, t) -> strip(t));
    }

    /**
     * Compare two tries node by node, names included. Articulations are
     * compared by their forced content.
     */
    public static boolean strictEquals(Trie<?> a, Trie<?> b) {
        return a.sameAs(b);
    }

    @Override
    public final boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Trie))
            return false;
        return strip(this).sameAs(strip((Trie<?>)obj));
    }

    @Override
    public final int hashCode() {
        return strip(this).shapeHash();
    }

    // Nodes ----------------------------------------------------------------

    static final class NilNode<X> extends Trie<X> {
        final BitString bs;

        NilNode(BitString bs) {
            this.bs = bs;
        }

        @Override
        <R> R accept(Visitor<X, R> v) {
            return v.nil(bs);
        }

        @Override
        Trie<X> place(TriePlacement.Insertion<X> ins, BitString bs) {
            int depth = bs.length();
            if (depth < ins.meta.minDepth()) {
                BitString bs0 = BitString.prepend(0, bs);
                BitString bs1 = BitString.prepend(1, bs);
                Trie<X> mt0 = nil(bs0), mt1 = nil(bs1);
                return ins.bit(depth) == 0
                    ? bin(bs, mt0.place(ins, bs0), mt1)
                    : bin(bs, mt0, mt1.place(ins, bs1));
            }
            return leaf(bs, ins.elt);
        }

        @Override
        Trie<X> split(Function<? super X, ?> keyOf) {
            return this;
        }

        @Override
        boolean sameAs(Trie<?> other) {
            return other instanceof ArtNode
                ? sameAs(normalize(other))
                : other instanceof NilNode && bs.equals(((NilNode<?>)other).bs);
        }

        @Override
        int shapeHash() {
            return bs.hashCode();
        }

        public String toString() {
            return "Nil" + bs;
        }
    }

    static final class LeafNode<X> extends Trie<X> {
        final BitString bs;
        final X elt;

        LeafNode(BitString bs, X elt) {
            this.bs = bs;
            this.elt = elt;
        }

        @Override
        <R> R accept(Visitor<X, R> v) {
            return v.leaf(bs, elt);
        }

        @Override
        Trie<X> place(TriePlacement.Insertion<X> ins, BitString bs) {
            if (elt.equals(ins.elt))
                return this;
            if (ins.sameKey(elt))
                return leaf(bs, ins.elt);
            if (ins.sameHash(elt))
                return new CollisionNode<>(bs, ImmutableSet.of(elt, ins.elt));
            return split(ins.keyOf).place(ins, bs);
        }

        @Override
        Trie<X> split(Function<? super X, ?> keyOf) {
            return splitTo(bs, TriePlacement.hash(keyOf.apply(elt)), path -> leaf(path, elt));
        }

        @Override
        boolean sameAs(Trie<?> other) {
            if (other instanceof ArtNode)
                return sameAs(normalize(other));
            if (!(other instanceof LeafNode))
                return false;
            LeafNode<?> that = (LeafNode<?>)other;
            return bs.equals(that.bs) && elt.equals(that.elt);
        }

        @Override
        int shapeHash() {
            return 31 * bs.hashCode() + elt.hashCode();
        }

        public String toString() {
            return "Leaf" + bs + "(" + elt + ")";
        }
    }

    // move a node one level down, beside an empty sibling
    static <X> Trie<X> splitTo(BitString bs, long hash, Function<BitString, Trie<X>> at) {
        BitString bs0 = BitString.prepend(0, bs);
        BitString bs1 = BitString.prepend(1, bs);
        if (BitString.of(BitString.MAX_LEN, hash).bit(bs.length()) != 0) {
            return bin(bs, nil(bs0), at.apply(bs1));
        } else {
            return bin(bs, at.apply(bs0), nil(bs1));
        }
    }

    static final class CollisionNode<X> extends Trie<X> {
        final BitString bs;
        final ImmutableSet<X> elts;

        CollisionNode(BitString bs, ImmutableSet<X> elts) {
            this.bs = bs;
            this.elts = elts;
        }

        @Override
        <R> R accept(Visitor<X, R> v) {
            return v.collision(bs, elts);
        }

        @Override
        Trie<X> place(TriePlacement.Insertion<X> ins, BitString bs) {
            if (!ins.sameHash(elts.iterator().next()))
                return split(ins.keyOf).place(ins, bs);
            if (elts.contains(ins.elt))
                return this;

            ImmutableSet.Builder<X> builder = ImmutableSet.builder();
            for (X x : elts) {
                if (!ins.sameKey(x))
                    builder.add(x);
            }
            return new CollisionNode<>(bs, builder.add(ins.elt).build());
        }

        @Override
        Trie<X> split(Function<? super X, ?> keyOf) {
            long hash = TriePlacement.hash(keyOf.apply(elts.iterator().next()));
            return splitTo(bs, hash, path -> new CollisionNode<>(path, elts));
        }

        @Override
        boolean sameAs(Trie<?> other) {
            if (other instanceof ArtNode)
                return sameAs(normalize(other));
            if (!(other instanceof CollisionNode))
                return false;
            CollisionNode<?> that = (CollisionNode<?>)other;
            return bs.equals(that.bs) && elts.equals(that.elts);
        }

        @Override
        int shapeHash() {
            return 31 * bs.hashCode() + elts.hashCode();
        }

        public String toString() {
            return "Collision" + bs + elts;
        }
    }

    static final class BinNode<X> extends Trie<X> {
        final BitString bs;
        final Trie<X> left, right;

        BinNode(BitString bs, Trie<X> left, Trie<X> right) {
            this.bs = bs;
            this.left = left;
            this.right = right;
        }

        @Override
        <R> R accept(Visitor<X, R> v) {
            return v.bin(bs, left, right);
        }

        @Override
        Trie<X> place(TriePlacement.Insertion<X> ins, BitString bs) {
            if (ins.bit(bs.length()) == 0) {
                return bin(bs, left.place(ins, BitString.prepend(0, bs)), right);
            } else {
                return bin(bs, left, right.place(ins, BitString.prepend(1, bs)));
            }
        }

        @Override
        Trie<X> split(Function<? super X, ?> keyOf) {
            return this;
        }

        @Override
        boolean sameAs(Trie<?> other) {
            if (other instanceof ArtNode)
                return sameAs(normalize(other));
            if (!(other instanceof BinNode))
                return false;
            BinNode<?> that = (BinNode<?>)other;
            return bs.equals(that.bs) && left.sameAs(that.left) && right.sameAs(that.right);
        }

        @Override
        int shapeHash() {
            return 31 * (31 * bs.hashCode() + left.shapeHash()) + right.shapeHash();
        }

        public String toString() {
            return "Bin" + bs + "(" + left + ", " + right + ")";
        }
    }

    static final class RootNode<X> extends Trie<X> {
        final Meta meta;
        final Trie<X> trie;

        RootNode(Meta meta, Trie<X> trie) {
            this.meta = meta;
            this.trie = trie;
        }

        @Override
        <R> R accept(Visitor<X, R> v) {
            return v.root(meta, trie);
        }

        @Override
        Trie<X> place(TriePlacement.Insertion<X> ins, BitString bs) {
            throw new IllegalStateException("Root node found below the root of a trie");
        }

        @Override
        Trie<X> split(Function<? super X, ?> keyOf) {
            throw new IllegalStateException("Cannot split a root node");
        }

        @Override
        boolean sameAs(Trie<?> other) {
            if (other instanceof ArtNode)
                return sameAs(normalize(other));
            if (!(other instanceof RootNode))
                return false;
            RootNode<?> that = (RootNode<?>)other;
            return meta.equals(that.meta) && trie.sameAs(that.trie);
        }

        @Override
        int shapeHash() {
            return 31 * meta.hashCode() + trie.shapeHash();
        }

        public String toString() {
            return "Root(" + meta + ", " + trie + ")";
        }
    }

    static final class NameNode<X> extends Trie<X> {
        final Name name;
        final Trie<X> trie;

        NameNode(Name name, Trie<X> trie) {
            this.name = name;
            this.trie = trie;
        }

        @Override
        <R> R accept(Visitor<X, R> v) {
            return v.name(name, trie);
        }

        @Override
        Trie<X> place(TriePlacement.Insertion<X> ins, BitString bs) {
            return trie.place(ins, bs);
        }

        @Override
        Trie<X> split(Function<? super X, ?> keyOf) {
            throw new IllegalStateException("Cannot split a named node");
        }

        @Override
        boolean sameAs(Trie<?> other) {
            if (other instanceof ArtNode)
                return sameAs(normalize(other));
            if (!(other instanceof NameNode))
                return false;
            NameNode<?> that = (NameNode<?>)other;
            return name.equals(that.name) && trie.sameAs(that.trie);
        }

        @Override
        int shapeHash() {
            return 31 * name.hashCode() + trie.shapeHash();
        }

        public String toString() {
            return "Name(" + name + ", " + trie + ")";
        }
    }

    static final class ArtNode<X> extends Trie<X> {
        final Art<Trie<X>> art;

        ArtNode(Art<Trie<X>> art) {
            this.art = art;
        }

        @Override
        <R> R accept(Visitor<X, R> v) {
            return normalize(this).accept(v);
        }

        @Override
        Trie<X> place(TriePlacement.Insertion<X> ins, BitString bs) {
            return art.force().place(ins, bs);
        }

        @Override
        Trie<X> split(Function<? super X, ?> keyOf) {
            throw new IllegalStateException("Cannot split an articulation");
        }

        @Override
        boolean sameAs(Trie<?> other) {
            return art.force().sameAs(other);
        }

        @Override
        int shapeHash() {
            return art.force().shapeHash();
        }

        public String toString() {
            return "Art(" + art.force() + ")";
        }
    }
}
