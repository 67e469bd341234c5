/*
 * Tuple.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;
import java.util.*;

import org.jetbrains.annotations.NotNull;

/**
 * An immutable, fixed-length sequence of values.  Unlike a {@link ValueSet}, a
 * tuple is ordered: <code>(1, 2)</code> and <code>(2, 1)</code> are different
 * tuples.  This makes tuples the natural composite key, as in a transition table
 * mapping <code>(state, symbol)</code> to a state.
 *
 * <p>The constructor copies its argument, so later changes to the caller's array
 * or list have no effect on the tuple, and computes the hash code at once; this
 * freezes any container among the elements.  A tuple is therefore always frozen.
 *
 * @author Scott L. Burson
 * @see ValueContainer
 */

public final class Tuple
    implements ValueContainer, Iterable<Object>, Comparable<Tuple>
{

    /**
     * Constructs a tuple of the given elements.
     *
     * @param elts the elements, in order
     * @throws InvalidValueException if any element is not a value
     */
    public Tuple(Object... elts) {
	elements = new Object[elts.length];
	int h = 1;
	for (int i = 0; i < elts.length; ++i) {
	    elements[i] = Values.admit(elts[i]);
	    h = 31 * h + Values.hash(elements[i]);
	}
	hash_code = h;
    }

    /**
     * Returns a tuple of the given elements.
     *
     * @param elts the elements, in order
     * @return the tuple
     */
    public static @NotNull Tuple of(Object... elts) {
	return new Tuple(elts);
    }

    /**
     * Returns a tuple whose elements are those of <code>list</code>, in order.
     *
     * @param list the elements
     * @return the tuple
     */
    public static @NotNull Tuple copyOf(List<?> list) {
	return new Tuple(list.toArray());
    }

    public Kind kind() {
	return Kind.TUPLE;
    }

    /**
     * Returns the element at position <code>i</code>.
     *
     * @param i the position
     * @return the element
     * @throws IndexOutOfBoundsException if <code>i</code> is out of range
     */
    public Object get(int i) {
	return elements[i];
    }

    public int size() {
	return elements.length;
    }

    public boolean isEmpty() {
	return elements.length == 0;
    }

    /**
     * Always true.
     */
    public boolean isFrozen() {
	return true;
    }

    /**
     * Does nothing; a tuple is frozen from the start.
     */
    public void freeze() { }

    public int contentHash() {
	return hash_code;
    }

    public int hashCode() {
	return hash_code;
    }

    /**
     * Returns the elements as an unmodifiable list.
     *
     * @return the elements
     */
    public List<Object> toList() {
	return Collections.unmodifiableList(Arrays.asList(elements));
    }

    public Iterator<Object> iterator() {
	return toList().iterator();
    }

    public boolean equals(Object obj) {
	if (obj == this) return true;
	else if (!(obj instanceof Tuple)) return false;
	Tuple tup = (Tuple)obj;
	if (tup.hash_code != hash_code || tup.elements.length != elements.length)
	    return false;
	for (int i = 0; i < elements.length; ++i)
	    if (!Values.equal(elements[i], tup.elements[i])) return false;
	return true;
    }

    public int compareTo(Tuple other) {
	return ValueComparator.Instance.compare(this, other);
    }

    public String toString() {
	StringBuilder sb = new StringBuilder("(");
	for (int i = 0; i < elements.length; ++i) {
	    if (i > 0) sb.append(", ");
	    sb.append(Values.toString(elements[i]));
	}
	return sb.append(')').toString();
    }

    /*package*/ Object[] elements() {
	return elements;
    }

    private final Object[] elements;
    private final int hash_code;

}
