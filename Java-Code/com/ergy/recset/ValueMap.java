/*
 * ValueMap.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;
import java.util.*;

import org.jetbrains.annotations.NotNull;

/**
 * A map with value semantics.  Keys are looked up by content, not identity: a
 * freshly constructed <code>Tuple.of(0, "a")</code> finds the entry stored under
 * another tuple equal to it.  Two <code>ValueMap</code>s are equal iff they have
 * the same keys mapped to equal values, whatever order the entries were made in.
 *
 * <p>A map is created mutable and supports <code>put</code>, <code>remove</code>
 * and <code>clear</code> until it is frozen (see {@link ValueContainer}).  A key
 * is frozen when it is inserted.  Values are left alone until the map's own hash
 * code is computed, which freezes every value along with the map.
 *
 * <p>The table is the one used by {@link ValueSet}, with a third dense array,
 * parallel to the keys, holding the values.  Lookup, insertion and removal take
 * O(1) amortized time.  The hash code is the XOR, over the entries, of
 * <code>31 * hash(key) ^ hash(value)</code>; it is computed, in O(n) time, when
 * first asked for.
 *
 * <p>Iteration is over a snapshot of the entries, taken when the iterator is
 * created, in canonical order of the keys.
 *
 * @author Scott L. Burson
 * @see ValueSet
 */

public final class ValueMap<Key, Val>
    extends AbstractHashContainer<Key>
    implements Iterable<Map.Entry<Key, Val>>, Comparable<ValueMap<?, ?>>
{

    /**
     * Constructs an empty, mutable <code>ValueMap</code>.
     */
    public ValueMap() {
	super(0);
	vals = new Object[keys.length];
    }

    /**
     * Constructs an empty, mutable <code>ValueMap</code> with room for
     * <code>expected_size</code> entries.
     *
     * @param expected_size the number of entries to make room for
     */
    public ValueMap(int expected_size) {
	super(expected_size);
	vals = new Object[keys.length];
    }

    /**
     * Constructs a mutable <code>ValueMap</code> with the entries of
     * <code>map</code>.
     *
     * @param map the entries
     * @throws InvalidValueException if a key or value is not a value
     */
    public ValueMap(Map<? extends Key, ? extends Val> map) {
	this(map.size());
	putAll(map);
    }

    private ValueMap(ValueMap<? extends Key, ? extends Val> src) {
	super(src);
	vals = Arrays.copyOf(src.vals, keys.length);
    }

    /**
     * Returns a new, empty, mutable map.
     *
     * @return the map
     */
    @NotNull
    public static <Key, Val> ValueMap<Key, Val> empty() {
	return new ValueMap<Key, Val>();
    }

    /**
     * Returns a new mutable map of one entry.
     */
    @NotNull
    public static <Key, Val> ValueMap<Key, Val> of(Key k1, Val v1) {
	ValueMap<Key, Val> res = new ValueMap<Key, Val>(1);
	res.put(k1, v1);
	return res;
    }

    /**
     * Returns a new mutable map of two entries; if the keys are equal, the second
     * value wins.
     */
    @NotNull
    public static <Key, Val> ValueMap<Key, Val> of(Key k1, Val v1, Key k2, Val v2) {
	ValueMap<Key, Val> res = new ValueMap<Key, Val>(2);
	res.put(k1, v1);
	res.put(k2, v2);
	return res;
    }

    /**
     * Returns a new mutable map of three entries.
     */
    @NotNull
    public static <Key, Val> ValueMap<Key, Val> of(Key k1, Val v1, Key k2, Val v2,
						   Key k3, Val v3) {
	ValueMap<Key, Val> res = new ValueMap<Key, Val>(3);
	res.put(k1, v1);
	res.put(k2, v2);
	res.put(k3, v3);
	return res;
    }

    /**
     * Returns a new mutable map with the entries of <code>map</code>.
     *
     * @param map the entries
     * @return the map
     */
    @NotNull
    public static <Key, Val> ValueMap<Key, Val> copyOf(Map<? extends Key, ? extends Val> map) {
	return new ValueMap<Key, Val>(map);
    }

    public Kind kind() {
	return Kind.MAP;
    }

    /**
     * Returns the value mapped to <code>key</code>, or null if there is none.  Does
     * not freeze <code>key</code>.
     *
     * @param key the key to look up
     * @return the value, or null
     * @throws InvalidValueException if <code>key</code> is not a value
     */
    public Val get(Object key) {
	int pos = find(key, Values.peekHash(key));
	return pos < 0 ? null : val(pos);
    }

    /**
     * Returns the value mapped to <code>key</code>, or <code>dflt</code> if there
     * is none.
     *
     * @param key the key to look up
     * @param dflt the value to return if there is no entry
     * @return the value, or <code>dflt</code>
     */
    public Val getOrDefault(Object key, Val dflt) {
	int pos = find(key, Values.peekHash(key));
	return pos < 0 ? dflt : val(pos);
    }

    /**
     * Returns true if there is an entry for <code>key</code>.
     *
     * @param key the key to look up
     * @return whether the key is present
     */
    public boolean containsKey(Object key) {
	return find(key, Values.peekHash(key)) >= 0;
    }

    /**
     * Returns true if some key is mapped to a value equal to <code>val</code>.
     * Takes O(n) time.
     *
     * @param val the value to look for
     * @return whether it is present
     */
    public boolean containsValue(Object val) {
	for (int i = 0; i < size; ++i)
	    if (Values.equal(vals[i], val)) return true;
	return false;
    }

    /**
     * Maps <code>key</code> to <code>val</code>.  If there is already an entry for
     * <code>key</code>, its value is replaced and the size is unchanged.  The key is
     * frozen if it is a container; sequences are stored as unmodifiable copies.
     *
     * @param key the key
     * @param val the value
     * @return the previous value for <code>key</code>, or null
     * @throws FrozenMutationException if this map is frozen
     * @throws InvalidValueException if <code>key</code> or <code>val</code> is not a
     * value
     * @throws CycleViolationException if <code>key</code> or <code>val</code> is
     * this map, or this map can be reached from it
     */
    public Val put(Key key, Val val) {
	checkMutable("put");
	Object k = Values.admit(key);
	Object v = Values.admit(val);
	Values.checkFoundation(k, this, "key");
	Values.checkFoundation(v, this, "value");
	return putAdmitted(k, Values.hash(k), v);
    }

    /**
     * Copies every entry of <code>map</code> into this map.  All keys and values
     * are checked first, so on failure this map is unchanged.
     *
     * @param map the entries to copy
     * @throws FrozenMutationException if this map is frozen
     */
    public void putAll(Map<? extends Key, ? extends Val> map) {
	checkMutable("putAll");
	Object[] ks = new Object[map.size()];
	Object[] vs = new Object[map.size()];
	int n = 0;
	for (Map.Entry<? extends Key, ? extends Val> ent : map.entrySet()) {
	    ks[n] = Values.admit(ent.getKey());
	    vs[n] = Values.admit(ent.getValue());
	    Values.checkFoundation(ks[n], this, "key");
	    Values.checkFoundation(vs[n], this, "value");
	    ++n;
	}
	for (int i = 0; i < n; ++i) putAdmitted(ks[i], Values.hash(ks[i]), vs[i]);
    }

    /**
     * Copies every entry of <code>other</code> into this map.
     *
     * @param other the entries to copy
     * @throws FrozenMutationException if this map is frozen
     * @throws CycleViolationException if this map can be reached from a value
     */
    public void putAll(ValueMap<? extends Key, ? extends Val> other) {
	checkMutable("putAll");
	for (int i = 0; i < other.size; ++i)
	    Values.checkFoundation(other.vals[i], this, "value");
	for (int i = 0; i < other.size; ++i)
	    putAdmitted(other.keys[i], other.hashes[i], other.vals[i]);
    }

    /**
     * Removes the entry for <code>key</code>, if there is one.
     *
     * @param key the key
     * @return the value that was removed, or null
     * @throws FrozenMutationException if this map is frozen
     */
    public Val remove(Object key) {
	checkMutable("remove");
	int b = findBucket(key, Values.peekHash(key));
	if (b < 0) return null;
	Val res = val(positionAt(b));
	removeBucket(b);
	return res;
    }

    /**
     * Removes all entries.
     *
     * @throws FrozenMutationException if this map is frozen
     */
    public void clear() {
	checkMutable("clear");
	clearTable();
    }

    /**
     * Returns the keys, as a new mutable set.
     *
     * @return the keys
     */
    public @NotNull ValueSet<Key> keys() {
	ValueSet<Key> res = new ValueSet<Key>(size);
	for (int i = 0; i < size; ++i) res.add(key(i));
	return res;
    }

    /**
     * Returns the values, in the canonical order of their keys, as an unmodifiable
     * list.
     *
     * @return the values
     */
    public List<Val> values() {
	int[] order = canonicalOrder();
	List<Val> res = new ArrayList<Val>(order.length);
	for (int pos : order) res.add(val(pos));
	return Collections.unmodifiableList(res);
    }

    /**
     * Returns the entries, in canonical order of their keys, as an unmodifiable
     * list.
     *
     * @return the entries
     */
    public List<Map.Entry<Key, Val>> entries() {
	return Collections.unmodifiableList(Arrays.asList(snapshot()));
    }

    /**
     * Returns an iterator over a snapshot of the entries, in canonical order of the
     * keys.  The entries are immutable, and the iterator does not support
     * <code>remove</code>.
     */
    public Iterator<Map.Entry<Key, Val>> iterator() {
	return new ValueSet.SnapshotIterator<Map.Entry<Key, Val>>(snapshot());
    }

    /**
     * Returns a new, mutable map with the same entries as this one.  The copy shares
     * no storage with this map, and may be modified even if this map is frozen.
     *
     * @return the copy
     */
    public @NotNull ValueMap<Key, Val> mutableCopy() {
	return new ValueMap<Key, Val>(this);
    }

    /**
     * Same as {@link #mutableCopy}.
     */
    public @NotNull ValueMap<Key, Val> clone() {
	return mutableCopy();
    }

    /**
     * Returns true if <code>obj</code> is a <code>ValueMap</code> with the same keys
     * mapped to equal values.  Does not freeze either map.
     */
    public boolean equals(Object obj) {
	if (obj == this) return true;
	else if (!(obj instanceof ValueMap)) return false;
	ValueMap<?, ?> vm = (ValueMap<?, ?>)obj;
	if (vm.size != size) return false;
	if (isFrozen() && vm.isFrozen() && vm.hashCode() != hashCode()) return false;
	for (int i = 0; i < size; ++i) {
	    int pos = vm.find(keys[i], hashes[i]);
	    if (pos < 0 || !Values.equal(vals[i], vm.vals[pos])) return false;
	}
	return true;
    }

    public int compareTo(ValueMap<?, ?> other) {
	return ValueComparator.Instance.compare(this, other);
    }

    public String toString() {
	StringBuilder sb = new StringBuilder("{");
	int[] order = canonicalOrder();
	for (int i = 0; i < order.length; ++i) {
	    if (i > 0) sb.append(", ");
	    sb.append(Values.toString(keys[order[i]])).append('=')
		.append(Values.toString(vals[order[i]]));
	}
	return sb.append('}').toString();
    }

    /******************************************************************************/
    /* Internals */

    private Object[] vals;

    int computeHash(boolean freeze_members) {
	int h = 0;
	for (int i = 0; i < size; ++i) {
	    int hv = freeze_members ? Values.hash(vals[i]) : Values.peekHash(vals[i]);
	    h ^= (31 * hashes[i]) ^ hv;
	}
	return h;
    }

    void moved(int from, int to) {
	vals[to] = vals[from];
    }

    void vacated(int pos) {
	vals[pos] = null;
    }

    void denseResized(int length) {
	vals = Arrays.copyOf(vals, length);
    }

    void pushNested(Deque<Object> stack) {
	super.pushNested(stack);
	for (int i = 0; i < size; ++i) Values.pushNested(stack, vals[i]);
    }

    /*package*/ Object valueAt(int pos) {
	return vals[pos];
    }

    // `k' and `v' must already have been admitted and checked; `k' hashed.
    private Val putAdmitted(Object k, int h, Object v) {
	int b = findBucket(k, h);
	if (b >= 0) {
	    int pos = positionAt(b);
	    Val old = val(pos);
	    vals[pos] = v;
	    return old;
	}
	int pos = insert(b, k, h);
	vals[pos] = v;
	return null;
    }

    private Key key(int pos) {
	return (Key)keys[pos];
    }

    private Val val(int pos) {
	return (Val)vals[pos];
    }

    private Map.Entry<Key, Val>[] snapshot() {
	int[] order = canonicalOrder();
	Map.Entry<Key, Val>[] res = (Map.Entry<Key, Val>[])new Map.Entry[order.length];
	for (int i = 0; i < order.length; ++i)
	    res[i] = new AbstractMap.SimpleImmutableEntry<Key, Val>(key(order[i]),
								    val(order[i]));
	return res;
    }

}
