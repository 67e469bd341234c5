/*
 * ValueComparator.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;
import java.util.*;

/**
 * A total ordering on the value universe.  It is used to put the members of a
 * container into canonical order, for iteration and printing, and to order
 * containers among themselves.
 *
 * <p>The ordering is:
 * <ol>
 * <li>numbers, then strings, then containers;</li>
 * <li>numbers numerically (<code>-0.0</code> and <code>0</code> are equal), strings
 *     lexicographically by UTF-16 code unit;</li>
 * <li>containers first by hash code; containers whose hash codes are equal by
 *     kind (sequence, tuple, set, map); containers of the same kind with equal
 *     hash codes by size and then by their members in canonical order.</li>
 * </ol>
 * It is consistent with {@link Values#equal}: <code>compare(a, b)</code> is zero
 * exactly when <code>a</code> and <code>b</code> are equal.  Comparing never
 * freezes a container.
 *
 * @author Scott L. Burson
 */

public final class ValueComparator implements Comparator<Object> {

    /**
     * The one instance.
     */
    public static final ValueComparator Instance = new ValueComparator();

    private ValueComparator() { }

    /**
     * Compares two values.
     *
     * @param a a value
     * @param b another value
     * @return a negative number, zero, or a positive number as <code>a</code> is
     * less than, equal to, or greater than <code>b</code>
     * @throws InvalidValueException if either argument is not a value
     */
    public int compare(Object a, Object b) {
	if (a == b) return 0;
	Kind ka = Kind.of(a);
	Kind kb = Kind.of(b);
	if (!ka.isContainer() || !kb.isContainer()) {
	    if (ka != kb) return ka.compareTo(kb) < 0 ? -1 : 1;
	    else if (ka == Kind.NUMBER) {
		double x = Values.numberValue((Number)a);
		double y = Values.numberValue((Number)b);
		return x < y ? -1 : x > y ? 1 : 0;
	    } else return Integer.signum(((String)a).compareTo((String)b));
	}
	int ha = Values.peekHash(a);
	int hb = Values.peekHash(b);
	if (ha != hb) return ha < hb ? -1 : 1;
	else if (ka != kb) return ka.compareTo(kb) < 0 ? -1 : 1;
	switch (ka) {
	case SEQUENCE:
	    return compareSequences(((List<?>)a).toArray(), ((List<?>)b).toArray());
	case TUPLE:
	    return compareSequences(((Tuple)a).elements(), ((Tuple)b).elements());
	case SET:
	    return compareSets((ValueSet<?>)a, (ValueSet<?>)b);
	default:
	    return compareMaps((ValueMap<?, ?>)a, (ValueMap<?, ?>)b);
	}
    }

    /*package*/ int compareSequences(Object[] a, Object[] b) {
	if (a.length != b.length) return a.length < b.length ? -1 : 1;
	for (int i = 0; i < a.length; ++i) {
	    int comp_res = compare(a[i], b[i]);
	    if (comp_res != 0) return comp_res;
	}
	return 0;
    }

    private int compareSets(ValueSet<?> a, ValueSet<?> b) {
	if (a.size() != b.size()) return a.size() < b.size() ? -1 : 1;
	return compareSequences(a.canonicalElements(), b.canonicalElements());
    }

    private int compareMaps(ValueMap<?, ?> a, ValueMap<?, ?> b) {
	if (a.size() != b.size()) return a.size() < b.size() ? -1 : 1;
	int[] order_a = a.canonicalOrder();
	int[] order_b = b.canonicalOrder();
	for (int i = 0; i < order_a.length; ++i) {
	    int comp_res = compare(a.keyAt(order_a[i]), b.keyAt(order_b[i]));
	    if (comp_res != 0) return comp_res;
	    comp_res = compare(a.valueAt(order_a[i]), b.valueAt(order_b[i]));
	    if (comp_res != 0) return comp_res;
	}
	return 0;
    }

}
