/*
 * CapacityExceededException.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;

/**
 * Thrown when {@link ValueSet#powerset()} is invoked on a set with more
 * elements than the configured bound, rather than allocating an exponentially
 * large result.
 *
 * @author Scott L. Burson
 * @see RecSetConfig#powersetLimit()
 */

public class CapacityExceededException extends IllegalStateException {

    /**
     * @param size the size of the set
     * @param limit the largest size allowed
     */
    public CapacityExceededException(int size, int limit) {
	super("powerset() of a set of " + size + " elements would have 2^" + size +
	      " members; the limit is " + limit + " elements");
	this.size = size;
	this.limit = limit;
    }

    public int getSize() {
	return size;
    }

    public int getLimit() {
	return limit;
    }

    private final int size;
    private final int limit;

    private static final long serialVersionUID = 1L;
}
