/*
 * AbstractHashContainer.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;
import java.util.*;

import org.jboss.logging.Logger;

/**
 * This class provides the hash table shared by {@link ValueSet} and
 * {@link ValueMap}, together with the mutable/frozen lifecycle described in
 * {@link ValueContainer}.
 *
 * <p>The table is laid out as a structure of arrays.  The keys (set elements, or
 * map keys) and their hash codes live in dense parallel arrays, in no particular
 * order, with no holes.  A separate sparse <code>index</code> array, whose length
 * is a power of two, maps each bucket to a dense position plus one; zero marks an
 * empty bucket.  Collisions are resolved by linear probing, and the index is kept
 * at most three-quarters full.
 *
 * <p>Removal repairs the probe chain by backward-shift deletion, so there are no
 * tombstones, and keeps the dense arrays dense by moving the last entry into the
 * vacated position (swap-and-pop).  Both steps are O(1) amortized.
 *
 * @author Scott L. Burson
 */

public abstract class AbstractHashContainer<Key> implements ValueContainer {

    private static final Logger log = Logger.getLogger(AbstractHashContainer.class);

    /*package*/ AbstractHashContainer(int expected_size) {
	if (expected_size < 0)
	    throw new IllegalArgumentException("Negative expected size: " + expected_size);
	int nbuckets = bucketsFor(expected_size);
	index = new int[nbuckets];
	mask = nbuckets - 1;
	keys = new Object[Math.max(expected_size, MIN_DENSE_LENGTH)];
	hashes = new int[keys.length];
    }

    /*package*/ AbstractHashContainer(AbstractHashContainer<? extends Key> src) {
	index = src.index.clone();
	mask = src.mask;
	keys = Arrays.copyOf(src.keys, Math.max(src.size, MIN_DENSE_LENGTH));
	hashes = Arrays.copyOf(src.hashes, keys.length);
	size = src.size;
    }

    public int size() {
	return size;
    }

    public boolean isEmpty() {
	return size == 0;
    }

    public boolean isFrozen() {
	return frozen;
    }

    public void freeze() {
	hashCode();
    }

    /**
     * Returns the hash code of this container, freezing it (and every container it
     * holds) if it is not already frozen.
     *
     * @return the hash code
     */
    public final int hashCode() {
	if (!frozen) {
	    hash_code = computeHash(true);
	    frozen = true;
	}
	return hash_code;
    }

    public final int contentHash() {
	return frozen ? hash_code : computeHash(false);
    }

    /**
     * Grows the table, if necessary, so that it can hold <code>n</code> entries
     * without further reallocation.
     *
     * @param n the number of entries to make room for
     * @throws FrozenMutationException if this container is frozen
     */
    public void ensureCapacity(int n) {
	checkMutable("ensureCapacity");
	if (n > keys.length) growDense(n);
	int nbuckets = bucketsFor(n);
	if (nbuckets > index.length) rehash(nbuckets);
    }

    /******************************************************************************/
    /* Internals */

    static final int MIN_BUCKETS = 16;
    static final int MAX_BUCKETS = 1 << 30;
    private static final int MIN_DENSE_LENGTH = 8;

    /*package*/ Object[] keys;
    /*package*/ int[] hashes;
    /*package*/ int size;
    private int[] index;
    private int mask;
    private boolean frozen;
    private int hash_code;
    // Dense positions in canonical order; null when stale.
    private int[] canonical_order;

    /**
     * Computes the content hash.  If <code>freeze_members</code> is true, the
     * hash codes of nested containers are obtained so as to freeze them.
     */
    abstract int computeHash(boolean freeze_members);

    /** Called when the dense entry at <code>from</code> has moved to <code>to</code>. */
    void moved(int from, int to) { }

    /** Called when the dense entry at <code>pos</code> is no longer in use. */
    void vacated(int pos) { }

    /** Called after the dense arrays have been reallocated at <code>length</code>. */
    void denseResized(int length) { }

    /** Pushes onto <code>stack</code> every nested value that might hold a container. */
    void pushNested(Deque<Object> stack) {
	for (int i = 0; i < size; ++i) Values.pushNested(stack, keys[i]);
    }

    /*package*/ final void checkMutable(String operation) {
	if (frozen) throw new FrozenMutationException(operation, this);
    }

    /*package*/ final void modified() {
	canonical_order = null;
    }

    /*package*/ static int bucketsFor(int n) {
	int nbuckets = MIN_BUCKETS;
	while ((long)n * 4 > (long)nbuckets * 3) {
	    if (nbuckets == MAX_BUCKETS)
		throw new IllegalStateException("Hash table cannot hold " + n + " entries");
	    nbuckets <<= 1;
	}
	return nbuckets;
    }

    /**
     * Probes for <code>key</code>, whose hash code is <code>h</code>.  Returns the
     * bucket holding it if present, or else <code>-(b + 1)</code> where
     * <code>b</code> is the empty bucket that ended the probe.
     */
    /*package*/ final int findBucket(Object key, int h) {
	int b = h & mask;
	while (true) {
	    int entry = index[b];
	    if (entry == 0) return -(b + 1);
	    int pos = entry - 1;
	    if (hashes[pos] == h && Values.equal(keys[pos], key)) return b;
	    b = (b + 1) & mask;
	}
    }

    /*package*/ final int find(Object key, int h) {
	int b = findBucket(key, h);
	return b < 0 ? -1 : positionAt(b);
    }

    /*package*/ final int positionAt(int b) {
	return index[b] - 1;
    }

    /**
     * Appends a new entry, given the (negative) result of a failed
     * {@link #findBucket}, and returns its dense position.
     */
    /*package*/ final int insert(int not_found, Object key, int h) {
	int b = -(not_found + 1);
	if ((long)(size + 1) * 4 > (long)index.length * 3) {
	    rehash(bucketsFor(size + 1));
	    b = emptyBucket(h);
	}
	if (size == keys.length) growDense(size + 1);
	keys[size] = key;
	hashes[size] = h;
	index[b] = ++size;
	modified();
	return size - 1;
    }

    /**
     * Removes the entry in bucket <code>b</code>.  First closes the gap in the
     * probe chain by shifting back any later entries that belong at or before
     * the vacated bucket; then moves the last dense entry into the vacated dense
     * position.
     */
    /*package*/ final void removeBucket(int b) {
	int pos = index[b] - 1;
	int hole = b;
	for (int i = (b + 1) & mask; index[i] != 0; i = (i + 1) & mask) {
	    int ideal = hashes[index[i] - 1] & mask;
	    // Distances, along the probe sequence, from the ideal bucket.
	    if (((hole - ideal) & mask) < ((i - ideal) & mask)) {
		index[hole] = index[i];
		hole = i;
	    }
	}
	index[hole] = 0;

	int last = --size;
	if (pos != last) {
	    keys[pos] = keys[last];
	    hashes[pos] = hashes[last];
	    moved(last, pos);
	    int lb = hashes[pos] & mask;
	    while (index[lb] != last + 1) lb = (lb + 1) & mask;
	    index[lb] = pos + 1;
	}
	keys[last] = null;
	vacated(last);
	modified();
    }

    /*package*/ final void clearTable() {
	Arrays.fill(index, 0);
	Arrays.fill(keys, 0, size, null);
	for (int i = 0; i < size; ++i) vacated(i);
	size = 0;
	modified();
    }

    private int emptyBucket(int h) {
	int b = h & mask;
	while (index[b] != 0) b = (b + 1) & mask;
	return b;
    }

    private void rehash(int nbuckets) {
	log.tracef("Rehashing %s from %d to %d buckets (%d entries)",
		   getClass().getSimpleName(), index.length, nbuckets, size);
	index = new int[nbuckets];
	mask = nbuckets - 1;
	for (int pos = 0; pos < size; ++pos)
	    index[emptyBucket(hashes[pos])] = pos + 1;
    }

    private void growDense(int min_length) {
	int length = Math.max(min_length, keys.length + (keys.length >> 1));
	keys = Arrays.copyOf(keys, length);
	hashes = Arrays.copyOf(hashes, length);
	denseResized(length);
    }

    /**
     * Returns the dense positions of the entries, ordered by key according to
     * {@link ValueComparator}.  The array is cached until the next modification and
     * must not be altered by the caller.
     */
    /*package*/ final int[] canonicalOrder() {
	if (canonical_order == null) {
	    Integer[] order = new Integer[size];
	    for (int i = 0; i < size; ++i) order[i] = i;
	    Arrays.sort(order, new Comparator<Integer>() {
		    public int compare(Integer x, Integer y) {
			return ValueComparator.Instance.compare(keys[x], keys[y]);
		    }
		});
	    int[] res = new int[size];
	    for (int i = 0; i < size; ++i) res[i] = order[i];
	    canonical_order = res;
	}
	return canonical_order;
    }

    /*package*/ final Object[] canonicalKeys() {
	int[] order = canonicalOrder();
	Object[] res = new Object[order.length];
	for (int i = 0; i < order.length; ++i) res[i] = keys[order[i]];
	return res;
    }

    /*package*/ final Object keyAt(int pos) {
	return keys[pos];
    }

    // For debugging.
    /*package*/ String dump() {
	StringBuilder sb = new StringBuilder();
	sb.append(getClass().getSimpleName()).append(" size=").append(size)
	    .append(" buckets=").append(index.length).append(frozen ? " frozen" : "")
	    .append('\n');
	for (int b = 0; b < index.length; ++b) {
	    if (index[b] == 0) continue;
	    int pos = index[b] - 1;
	    sb.append("  [").append(b).append("] -> ").append(pos).append(" (ideal ")
		.append(hashes[pos] & mask).append(") ").append(Values.toString(keys[pos]))
		.append('\n');
	}
	return sb.toString();
    }

    /**
     * Checks the table invariants: every dense entry is reachable by probing from its
     * ideal bucket without crossing an empty bucket, exactly one bucket refers to it,
     * its cached hash is its content hash, and no two entries are equal.
     */
    /*package*/ boolean verify() {
	int referenced = 0;
	boolean[] seen = new boolean[size];
	for (int b = 0; b < index.length; ++b) {
	    int entry = index[b];
	    if (entry == 0) continue;
	    int pos = entry - 1;
	    if (pos >= size || seen[pos]) return false;
	    seen[pos] = true;
	    ++referenced;
	    for (int i = hashes[pos] & mask; i != b; i = (i + 1) & mask)
		if (index[i] == 0) return false;
	}
	if (referenced != size) return false;
	for (int pos = 0; pos < size; ++pos) {
	    if (hashes[pos] != Values.peekHash(keys[pos])) return false;
	    if (find(keys[pos], hashes[pos]) != pos) return false;
	}
	for (int pos = size; pos < keys.length; ++pos)
	    if (keys[pos] != null) return false;
	return (long)size * 4 <= (long)index.length * 3;
    }

}
