/*
 * FrozenMutationException.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;

/**
 * Thrown when a mutating operation is invoked on a frozen container.  A
 * container becomes frozen, permanently, once its hash code has been computed;
 * see {@link ValueContainer}.  The way back to a mutable container is
 * <code>mutableCopy()</code>, which leaves the frozen one untouched.
 *
 * @author Scott L. Burson
 */

public class FrozenMutationException extends IllegalStateException {

    /**
     * Constructs the exception for operation <code>operation</code> attempted on
     * <code>container</code>.
     *
     * @param operation the name of the rejected operation, e.g. <code>"add"</code>
     * @param container the frozen container
     */
    public FrozenMutationException(String operation, ValueContainer container) {
	super("Cannot " + operation + ": this " + container.getClass().getSimpleName() +
	      " is frozen (its hash code has been taken); use mutableCopy() to get a" +
	      " mutable copy");
	this.operation = operation;
    }

    /**
     * Returns the name of the operation that was rejected.
     *
     * @return the operation name
     */
    public String getOperation() {
	return operation;
    }

    private final String operation;

    private static final long serialVersionUID = 1L;
}
