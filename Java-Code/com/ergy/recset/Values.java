/*
 * Values.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Static operations on the value universe: admission, hashing, equality and
 * printing.  See {@link Kind} for what counts as a value.
 *
 * <p>Hash codes are deterministic 32-bit functions of content:
 * <ul>
 * <li>an integral number that fits in an <code>int</code> is run through an
 *     avalanche mix, so <code>0</code> and <code>-0.0</code> hash alike;</li>
 * <li>any other number hashes the two words of its IEEE-754 representation;</li>
 * <li>a string hashes its UTF-8 bytes with FNV-1a;</li>
 * <li>a sequence folds its members' hashes with <code>h = 31 * h + x</code>,
 *     so order matters;</li>
 * <li>a container supplies its own hash code, which freezes it.  Tuples fold
 *     like sequences; sets and maps XOR their members' hashes together, so that
 *     order does not matter.</li>
 * </ul>
 *
 * @author Scott L. Burson
 */

public final class Values {

    private Values() { }

    /**
     * Checks that <code>obj</code> is a value, and returns the form in which a
     * container should store it.  Numbers, strings and containers are returned as
     * they are.  A sequence is copied, recursively, into an unmodifiable list, so
     * that the caller's list may be changed later without corrupting the
     * container.
     *
     * @param obj the candidate value
     * @return the value to store
     * @throws InvalidValueException if <code>obj</code> is null, a NaN or infinite
     * number, a <code>long</code> beyond &plusmn;2<sup>53</sup>, or of a class outside
     * the value universe
     */
    public static Object admit(Object obj) {
	switch (Kind.of(obj)) {
	case NUMBER:
	    numberValue((Number)obj);
	    return obj;
	case SEQUENCE:
	    List<?> list = (List<?>)obj;
	    Object[] ary = new Object[list.size()];
	    int i = 0;
	    for (Object elt : list) ary[i++] = admit(elt);
	    return Collections.unmodifiableList(Arrays.asList(ary));
	default:
	    return obj;
	}
    }

    /**
     * Returns the hash code of <code>obj</code>, which must be a value.  If
     * <code>obj</code> is or contains a container, that container is frozen.
     *
     * @param obj the value to hash
     * @return its hash code
     * @throws InvalidValueException if <code>obj</code> is not a value
     */
    public static int hash(Object obj) {
	switch (Kind.of(obj)) {
	case NUMBER:
	    return hashNumber(numberValue((Number)obj));
	case STRING:
	    return hashString((String)obj);
	case SEQUENCE:
	    int h = 0;
	    for (Object elt : (List<?>)obj) h = 31 * h + hash(elt);
	    return h;
	default:
	    return obj.hashCode();
	}
    }

    /**
     * Returns the same number as {@link #hash}, but without freezing any
     * container.
     *
     * @param obj the value to hash
     * @return its current hash code
     */
    public static int peekHash(Object obj) {
	if (obj instanceof ValueContainer) return ((ValueContainer)obj).contentHash();
	else if (obj instanceof List) {
	    int h = 0;
	    for (Object elt : (List<?>)obj) h = 31 * h + peekHash(elt);
	    return h;
	} else return hash(obj);
    }

    /**
     * Returns the numeric value of <code>num</code>, which must already be known to
     * be of a number class in the value universe.  Rejects NaN and the infinities,
     * and <code>long</code>s too large to be told apart once converted to
     * <code>double</code>.
     */
    static double numberValue(Number num) {
	if (num instanceof Long) {
	    long l = num.longValue();
	    if (l > MAX_EXACT_LONG || l < -MAX_EXACT_LONG)
		throw new InvalidValueException(l + " is outside the exactly representable" +
						" range of +/-2^53");
	    return l;
	}
	double d = num.doubleValue();
	if (Double.isNaN(d))
	    throw new InvalidValueException("NaN is not a valid value");
	else if (Double.isInfinite(d))
	    throw new InvalidValueException(d + " is not a valid value");
	return d;
    }

    static final long MAX_EXACT_LONG = 1L << 53;

    static int hashNumber(double d) {
	int i = (int)d;
	if (i == d) return mix(i);
	long bits = Double.doubleToLongBits(d);
	int h = ((int)bits * 0x85ebca6b) ^ ((int)(bits >>> 32) * 0xc2b2ae35);
	return h ^ (h >>> 16);
    }

    static int mix(int h) {
	h = (h ^ (h >> 16)) * 0x45d9f3b;
	h = (h ^ (h >> 16)) * 0x45d9f3b;
	return h ^ (h >> 16);
    }

    static int hashString(String s) {
	int h = 0x811c9dc5;
	for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
	    h ^= b & 0xff;
	    h *= 0x01000193;
	}
	return h;
    }

    /**
     * Returns true if <code>a</code> and <code>b</code> are the same value.
     * Numbers are equal if they are numerically equal, whatever their classes;
     * sequences if they have equal members in the same order; containers as
     * defined by their <code>equals</code> methods.  Never freezes anything.
     *
     * @param a a value
     * @param b another value
     * @return whether they are equal
     */
    public static boolean equal(Object a, Object b) {
	if (a == b) return true;
	else if (a instanceof Number)
	    return b instanceof Number &&
		   ((Number)a).doubleValue() == ((Number)b).doubleValue();
	else if (a instanceof List) {
	    if (!(b instanceof List)) return false;
	    List<?> la = (List<?>)a, lb = (List<?>)b;
	    if (la.size() != lb.size()) return false;
	    Iterator<?> ib = lb.iterator();
	    for (Object elt : la)
		if (!equal(elt, ib.next())) return false;
	    return true;
	} else return a != null && a.equals(b);
    }

    /**
     * Returns a readable rendering of <code>obj</code>.  Not used for equality.
     *
     * @param obj a value
     * @return its printed form
     */
    public static String toString(Object obj) {
	if (obj instanceof List) {
	    StringBuilder sb = new StringBuilder("[");
	    boolean first = true;
	    for (Object elt : (List<?>)obj) {
		if (!first) sb.append(", ");
		sb.append(toString(elt));
		first = false;
	    }
	    return sb.append(']').toString();
	} else return String.valueOf(obj);
    }

    /**
     * Throws {@link CycleViolationException} if <code>target</code> is
     * <code>candidate</code> or can be reached from it through nested containers.
     * Only mutable containers and sequences are searched: everything inside a
     * frozen container is frozen, and <code>target</code>, about to be mutated, is
     * not.
     */
    static void checkFoundation(Object candidate, ValueContainer target, String role) {
	if (reaches(candidate, target))
	    throw new CycleViolationException(
		"Adding this " + role + " would make the " +
		target.getClass().getSimpleName() + " a member of itself");
    }

    static boolean reaches(Object from, Object target) {
	if (from == target) return true;
	if (!(from instanceof List || from instanceof AbstractHashContainer)) return false;
	Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<Object, Boolean>());
	ArrayDeque<Object> stack = new ArrayDeque<Object>();
	stack.push(from);
	while (!stack.isEmpty()) {
	    Object obj = stack.pop();
	    if (obj == target) return true;
	    else if (!seen.add(obj)) continue;
	    else if (obj instanceof List) {
		for (Object elt : (List<?>)obj) pushNested(stack, elt);
	    } else if (obj instanceof AbstractHashContainer) {
		AbstractHashContainer<?> ahc = (AbstractHashContainer<?>)obj;
		if (!ahc.isFrozen()) ahc.pushNested(stack);
	    }
	}
	return false;
    }

    static void pushNested(Deque<Object> stack, Object obj) {
	if (obj instanceof List || obj instanceof AbstractHashContainer) stack.push(obj);
    }

}
