/*
 * Kind.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;
import java.util.List;

/**
 * The kinds of value the containers of this package accept.  The declaration
 * order is also the rank used by {@link ValueComparator}: numbers sort before
 * strings, strings before containers, and, among containers whose hash codes
 * collide, sequences before tuples, tuples before sets, and sets before maps.
 *
 * <p>The numeric kind is shared by <code>Integer</code>, <code>Long</code>,
 * <code>Short</code>, <code>Byte</code>, <code>Double</code> and
 * <code>Float</code>; the value <code>1</code> is the same value whichever of these
 * classes carries it.  A sequence is any {@link List} whose members are values.
 *
 * @author Scott L. Burson
 */

public enum Kind {

    NUMBER,
    STRING,
    SEQUENCE,
    TUPLE,
    SET,
    MAP;

    /**
     * Returns true for the kinds that hold other values.
     *
     * @return whether this is a container kind
     */
    public boolean isContainer() {
	return this.compareTo(SEQUENCE) >= 0;
    }

    /**
     * Classifies <code>obj</code>.  Does not check numbers for finiteness; see
     * {@link Values#admit}.
     *
     * @param obj the object to classify
     * @return its kind
     * @throws InvalidValueException if <code>obj</code> is null or of a class
     * outside the value universe
     */
    public static Kind of(Object obj) {
	if (obj instanceof Integer || obj instanceof Double || obj instanceof Long ||
	    obj instanceof Short || obj instanceof Byte || obj instanceof Float)
	    return NUMBER;
	else if (obj instanceof String) return STRING;
	else if (obj instanceof ValueContainer) return ((ValueContainer)obj).kind();
	else if (obj instanceof List) return SEQUENCE;
	else if (obj == null)
	    throw new InvalidValueException("null is not a value");
	else throw new InvalidValueException("Unsupported value class: " +
					     obj.getClass().getName());
    }

}
