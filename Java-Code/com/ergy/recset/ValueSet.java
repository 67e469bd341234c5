/*
 * ValueSet.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;
import java.util.*;
import java.util.concurrent.ThreadLocalRandom;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * A set with value semantics.  Two <code>ValueSet</code>s are equal iff they have
 * equal elements, whatever order the elements were added in; sets may be
 * elements of sets, keys of {@link ValueMap}s, and so on to any depth.
 *
 * <p>A set is created mutable and supports <code>add</code>, <code>remove</code>
 * and <code>clear</code> until it is frozen (see {@link ValueContainer}).  Adding
 * a container to a set freezes that container, since the set depends on its hash
 * code from then on.  The algebraic operators (<code>union</code>,
 * <code>intersection</code> and so on) never modify their operands; they return
 * a new, mutable set.
 *
 * <p>Iteration is over a snapshot taken when the iterator is created, in the
 * canonical order defined by {@link ValueComparator}; changes to the set made
 * during iteration are not seen by the iterator.
 *
 * <p>The set also enforces the Foundation axiom: it may not become a member of
 * itself, directly or by way of nested containers.
 *
 * <p>Time costs: <code>contains</code>, <code>add</code> and <code>remove</code>
 * take O(1) amortized time.  <code>union</code>, <code>intersection</code>,
 * <code>difference</code>, <code>symmetricDifference</code>,
 * <code>isSubset</code>, <code>isSuperset</code> and <code>equals</code> take
 * O(n) time.  The first iteration after a modification sorts the elements, in
 * O(n log n) time.  <code>hashCode</code> takes O(1) time: the hash code, the XOR
 * of the elements' hash codes, is maintained as elements are added and removed.
 *
 * @author Scott L. Burson
 * @see ValueMap
 * @see Tuple
 */

public final class ValueSet<Elt>
    extends AbstractHashContainer<Elt>
    implements Iterable<Elt>, Comparable<ValueSet<?>>
{

    private static final Logger log = Logger.getLogger(ValueSet.class);

    /**
     * Constructs an empty, mutable <code>ValueSet</code>.
     */
    public ValueSet() {
	super(0);
    }

    /**
     * Constructs an empty, mutable <code>ValueSet</code> with room for
     * <code>expected_size</code> elements.
     *
     * @param expected_size the number of elements to make room for
     */
    public ValueSet(int expected_size) {
	super(expected_size);
    }

    /**
     * Constructs a mutable <code>ValueSet</code> containing the elements of
     * <code>coll</code>.
     *
     * @param coll the elements
     * @throws InvalidValueException if an element is not a value
     */
    public ValueSet(Iterable<? extends Elt> coll) {
	super(coll instanceof Collection ? ((Collection<?>)coll).size() : 0);
	addAll(coll);
    }

    private ValueSet(ValueSet<? extends Elt> src, int _xor_hash) {
	super(src);
	xor_hash = _xor_hash;
    }

    /**
     * Returns a new mutable set of the given elements.
     *
     * @param elts the elements
     * @return the set
     * @throws InvalidValueException if an element is not a value
     */
    @SafeVarargs
    @NotNull
    public static <Elt> ValueSet<Elt> of(Elt... elts) {
	return new ValueSet<Elt>(Arrays.asList(elts));
    }

    /**
     * Returns a new, empty, mutable set.
     *
     * @return the set
     */
    @NotNull
    public static <Elt> ValueSet<Elt> empty() {
	return new ValueSet<Elt>();
    }

    /**
     * Returns a new mutable set containing just <code>elt</code>.
     *
     * @param elt the element
     * @return the set
     */
    @NotNull
    public static <Elt> ValueSet<Elt> singleton(Elt elt) {
	ValueSet<Elt> res = new ValueSet<Elt>(1);
	res.add(elt);
	return res;
    }

    /**
     * Returns a new mutable set containing the elements of <code>coll</code>.
     *
     * @param coll the elements
     * @return the set
     */
    @NotNull
    public static <Elt> ValueSet<Elt> copyOf(Iterable<? extends Elt> coll) {
	return new ValueSet<Elt>(coll);
    }

    public Kind kind() {
	return Kind.SET;
    }

    /**
     * Returns true if this set contains an element equal to <code>elt</code>.
     * Does not freeze <code>elt</code>.
     *
     * @param elt the value to look for
     * @return whether it is an element
     * @throws InvalidValueException if <code>elt</code> is not a value
     */
    public boolean contains(Object elt) {
	return find(elt, Values.peekHash(elt)) >= 0;
    }

    /**
     * Adds <code>elt</code> to this set, if no equal element is present.  If
     * <code>elt</code> is a container, it is frozen.  A sequence is stored as an
     * unmodifiable copy.
     *
     * @param elt the element to add
     * @return true if the set changed
     * @throws FrozenMutationException if this set is frozen
     * @throws InvalidValueException if <code>elt</code> is not a value
     * @throws CycleViolationException if <code>elt</code> is this set, or this set
     * can be reached from it
     */
    public boolean add(Elt elt) {
	checkMutable("add");
	Object val = Values.admit(elt);
	Values.checkFoundation(val, this, "element");
	return addAdmitted(val, Values.hash(val));
    }

    /**
     * Adds every element of <code>coll</code>.  All the elements are checked before
     * any is added, so on failure the set is unchanged.
     *
     * @param coll the elements to add
     * @return true if the set changed
     * @throws FrozenMutationException if this set is frozen
     * @throws InvalidValueException if an element is not a value
     * @throws CycleViolationException if an element is this set, or this set can
     * be reached from it
     */
    public boolean addAll(Iterable<? extends Elt> coll) {
	checkMutable("addAll");
	if (coll instanceof ValueSet) return addAllFrom((ValueSet<?>)coll);
	ArrayList<Object> vals = new ArrayList<Object>();
	for (Elt elt : coll) {
	    Object val = Values.admit(elt);
	    Values.checkFoundation(val, this, "element");
	    vals.add(val);
	}
	boolean changed = false;
	for (Object val : vals)
	    if (addAdmitted(val, Values.hash(val))) changed = true;
	return changed;
    }

    /**
     * Removes the element equal to <code>elt</code>, if there is one.
     *
     * @param elt the value to remove
     * @return true if the set changed
     * @throws FrozenMutationException if this set is frozen
     * @throws InvalidValueException if <code>elt</code> is not a value
     */
    public boolean remove(Object elt) {
	checkMutable("remove");
	int h = Values.peekHash(elt);
	int b = findBucket(elt, h);
	if (b < 0) return false;
	removeBucket(b);
	xor_hash ^= h;
	return true;
    }

    /**
     * Removes all elements.
     *
     * @throws FrozenMutationException if this set is frozen
     */
    public void clear() {
	checkMutable("clear");
	clearTable();
	xor_hash = 0;
    }

    /**
     * Returns the union of this set with <code>coll</code>: a new, mutable set of
     * the values that are in either or both.
     *
     * @param coll the other operand
     * @return the union
     */
    public @NotNull ValueSet<Elt> union(Iterable<? extends Elt> coll) {
	ValueSet<Elt> res = mutableCopy();
	res.addAllFrom(asValueSet(coll));
	return res;
    }

    /**
     * Returns the intersection of this set with <code>coll</code>: a new, mutable
     * set of the values that are in both.
     *
     * @param coll the other operand
     * @return the intersection
     */
    public @NotNull ValueSet<Elt> intersection(Iterable<?> coll) {
	ValueSet<?> other = asValueSet(coll);
	ValueSet<Elt> res = new ValueSet<Elt>();
	if (other.size < size) {
	    for (int i = 0; i < other.size; ++i) {
		int pos = find(other.keys[i], other.hashes[i]);
		if (pos >= 0) res.addAdmitted(keys[pos], hashes[pos]);
	    }
	} else {
	    for (int i = 0; i < size; ++i)
		if (other.find(keys[i], hashes[i]) >= 0) res.addAdmitted(keys[i], hashes[i]);
	}
	return res;
    }

    /**
     * Returns the difference of this set less <code>coll</code>: a new, mutable set
     * of the values that are in this set and not in <code>coll</code>.
     *
     * @param coll the values to leave out
     * @return the difference
     */
    public @NotNull ValueSet<Elt> difference(Iterable<?> coll) {
	ValueSet<?> other = asValueSet(coll);
	ValueSet<Elt> res = new ValueSet<Elt>();
	for (int i = 0; i < size; ++i)
	    if (other.find(keys[i], hashes[i]) < 0) res.addAdmitted(keys[i], hashes[i]);
	return res;
    }

    /**
     * Returns the symmetric difference of this set and <code>coll</code>: a new,
     * mutable set of the values that are in exactly one of the two.
     *
     * @param coll the other operand
     * @return the symmetric difference
     */
    public @NotNull ValueSet<Elt> symmetricDifference(Iterable<? extends Elt> coll) {
	ValueSet<? extends Elt> other = asValueSet(coll);
	ValueSet<Elt> res = difference(other);
	for (int i = 0; i < other.size; ++i)
	    if (find(other.keys[i], other.hashes[i]) < 0)
		res.addAdmitted(other.keys[i], other.hashes[i]);
	return res;
    }

    /**
     * Returns the set of all pairs <code>(a, b)</code>, as {@link Tuple}s, with
     * <code>a</code> in this set and <code>b</code> in <code>other</code>.  Its size
     * is the product of the operands' sizes.
     *
     * @param other the second operand
     * @return the cartesian product, a new mutable set
     */
    public @NotNull ValueSet<Tuple> cartesianProduct(ValueSet<?> other) {
	long n = (long)size * other.size;
	if (n > Integer.MAX_VALUE)
	    throw new IllegalStateException("Cartesian product would have " + n + " elements");
	ValueSet<Tuple> res = new ValueSet<Tuple>((int)n);
	for (int i = 0; i < size; ++i)
	    for (int j = 0; j < other.size; ++j) {
		Tuple pair = new Tuple(keys[i], other.keys[j]);
		res.addAdmitted(pair, pair.hashCode());
	    }
	return res;
    }

    /**
     * Returns the set of all subsets of this set, of which there are
     * 2<sup><i>n</i></sup>.  The subsets are frozen; the result is mutable.  The
     * size of this set may not exceed {@link RecSetConfig#powersetLimit()}.
     *
     * @return the power set
     * @throws CapacityExceededException if this set is too large
     */
    public @NotNull ValueSet<ValueSet<Elt>> powerset() {
	return powerset(RecSetConfig.powersetLimit());
    }

    /**
     * Returns the set of all subsets of this set, refusing if this set has more than
     * <code>max_elements</code> elements.
     *
     * @param max_elements the largest size to accept, at most
     * {@value RecSetConfig#MAX_POWERSET_LIMIT}
     * @return the power set
     * @throws CapacityExceededException if this set is larger than
     * <code>max_elements</code>
     * @throws IllegalArgumentException if <code>max_elements</code> is out of range
     */
    public @NotNull ValueSet<ValueSet<Elt>> powerset(int max_elements) {
	if (max_elements < 0 || max_elements > RecSetConfig.MAX_POWERSET_LIMIT)
	    throw new IllegalArgumentException("Powerset bound out of range: " + max_elements);
	if (size > max_elements) throw new CapacityExceededException(size, max_elements);
	int n = size;
	int[] order = canonicalOrder();
	log.debugf("Computing powerset of %d elements", n);
	ValueSet<ValueSet<Elt>> res = new ValueSet<ValueSet<Elt>>(1 << n);
	for (int bits = 0; bits < (1 << n); ++bits) {
	    ValueSet<Elt> subset = new ValueSet<Elt>(Integer.bitCount(bits));
	    for (int j = 0; j < n; ++j)
		if ((bits & (1 << j)) != 0)
		    subset.addAdmitted(keys[order[j]], hashes[order[j]]);
	    res.addAdmitted(subset, subset.hashCode());
	}
	return res;
    }

    /**
     * Returns true if every element of this set is in <code>coll</code>.  The
     * inclusion need not be proper.
     *
     * @param coll the collection to compare against
     * @return whether this set is a subset of <code>coll</code>
     */
    public boolean isSubset(Iterable<?> coll) {
	ValueSet<?> other = asValueSet(coll);
	if (size > other.size) return false;
	for (int i = 0; i < size; ++i)
	    if (other.find(keys[i], hashes[i]) < 0) return false;
	return true;
    }

    /**
     * Returns true if this set contains every element of <code>coll</code>.  The
     * inclusion need not be proper.
     *
     * @param coll the collection to compare against
     * @return whether this set is a superset of <code>coll</code>
     */
    public boolean isSuperset(Iterable<?> coll) {
	return asValueSet(coll).isSubset(this);
    }

    /**
     * Returns true if this set is a subset of <code>coll</code> and not equal to it.
     *
     * @param coll the collection to compare against
     * @return whether this set is a proper subset of <code>coll</code>
     */
    public boolean isProperSubset(Iterable<?> coll) {
	ValueSet<?> other = asValueSet(coll);
	return size < other.size && isSubset(other);
    }

    /**
     * Returns true if this set is a superset of <code>coll</code> and not equal to
     * it.
     *
     * @param coll the collection to compare against
     * @return whether this set is a proper superset of <code>coll</code>
     */
    public boolean isProperSuperset(Iterable<?> coll) {
	return asValueSet(coll).isProperSubset(this);
    }

    /**
     * Returns an element chosen uniformly at random.
     *
     * @return some element
     * @throws NoSuchElementException if the set is empty
     */
    public Elt pickRandom() {
	return pickRandom(ThreadLocalRandom.current());
    }

    /**
     * Returns an element chosen uniformly at random using <code>rand</code>.
     *
     * @param rand the source of randomness
     * @return some element
     * @throws NoSuchElementException if the set is empty
     */
    public Elt pickRandom(Random rand) {
	if (size == 0) throw new NoSuchElementException();
	return elt(rand.nextInt(size));
    }

    /**
     * Returns the least element in canonical order.
     *
     * @return the first element
     * @throws NoSuchElementException if the set is empty
     */
    public Elt first() {
	if (size == 0) throw new NoSuchElementException();
	return elt(canonicalOrder()[0]);
    }

    /**
     * Returns the greatest element in canonical order.
     *
     * @return the last element
     * @throws NoSuchElementException if the set is empty
     */
    public Elt last() {
	if (size == 0) throw new NoSuchElementException();
	return elt(canonicalOrder()[size - 1]);
    }

    /**
     * Returns a new, mutable set with the same elements as this one.  The copy
     * shares no storage with this set, and may be modified even if this set is
     * frozen.
     *
     * @return the copy
     */
    public @NotNull ValueSet<Elt> mutableCopy() {
	return new ValueSet<Elt>(this, xor_hash);
    }

    /**
     * Same as {@link #mutableCopy}.
     */
    public @NotNull ValueSet<Elt> clone() {
	return mutableCopy();
    }

    /**
     * Returns an iterator over a snapshot of the elements, in canonical order.
     * The iterator does not support <code>remove</code>.
     */
    public Iterator<Elt> iterator() {
	return new SnapshotIterator<Elt>(canonicalKeys());
    }

    /**
     * Returns the elements, in canonical order, in a new array.
     *
     * @return the elements
     */
    public Object[] toArray() {
	return canonicalKeys();
    }

    /**
     * Returns the elements, in canonical order, as an unmodifiable list.
     *
     * @return the elements
     */
    public List<Elt> toList() {
	List<Elt> list = new ArrayList<Elt>(size);
	for (Elt elt : this) list.add(elt);
	return Collections.unmodifiableList(list);
    }

    /**
     * Returns true if <code>obj</code> is a <code>ValueSet</code> with equal
     * elements.  Does not freeze either set.
     */
    public boolean equals(Object obj) {
	if (obj == this) return true;
	else if (!(obj instanceof ValueSet)) return false;
	ValueSet<?> vs = (ValueSet<?>)obj;
	if (vs.size != size || vs.xor_hash != xor_hash) return false;
	for (int i = 0; i < size; ++i)
	    if (vs.find(keys[i], hashes[i]) < 0) return false;
	return true;
    }

    public int compareTo(ValueSet<?> other) {
	return ValueComparator.Instance.compare(this, other);
    }

    public String toString() {
	StringBuilder sb = new StringBuilder("{");
	Object[] elts = canonicalKeys();
	for (int i = 0; i < elts.length; ++i) {
	    if (i > 0) sb.append(", ");
	    sb.append(Values.toString(elts[i]));
	}
	return sb.append('}').toString();
    }

    /******************************************************************************/
    /* Internals */

    // XOR of the elements' hash codes.
    private int xor_hash;

    int computeHash(boolean freeze_members) {
	// The elements were frozen when they were added.
	return xor_hash;
    }

    /*package*/ Object[] canonicalElements() {
	return canonicalKeys();
    }

    private Elt elt(int pos) {
	return (Elt)keys[pos];
    }

    // `val' must already have been admitted and hashed (hence frozen).
    private boolean addAdmitted(Object val, int h) {
	int b = findBucket(val, h);
	if (b >= 0) return false;
	insert(b, val, h);
	xor_hash ^= h;
	return true;
    }

    private boolean addAllFrom(ValueSet<?> other) {
	if (other == this) return false;
	ensureCapacity(size + other.size);
	boolean changed = false;
	for (int i = 0; i < other.size; ++i)
	    if (addAdmitted(other.keys[i], other.hashes[i])) changed = true;
	return changed;
    }

    private static <T> ValueSet<T> asValueSet(Iterable<T> coll) {
	if (coll instanceof ValueSet) return (ValueSet<T>)coll;
	else return new ValueSet<T>(coll);
    }

    /*package*/ static final class SnapshotIterator<T> implements Iterator<T> {

	SnapshotIterator(Object[] _snapshot) {
	    snapshot = _snapshot;
	}

	private final Object[] snapshot;
	private int next_index = 0;

	public boolean hasNext() {
	    return next_index < snapshot.length;
	}

	public T next() {
	    if (next_index >= snapshot.length) throw new NoSuchElementException();
	    return (T)snapshot[next_index++];
	}

	public void remove() {
	    throw new UnsupportedOperationException();
	}
    }

}
