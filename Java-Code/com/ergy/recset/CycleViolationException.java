/*
 * CycleViolationException.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;

/**
 * Thrown when an insertion would make a container a member of itself, either
 * directly or through a chain of nested containers (the Foundation axiom).
 *
 * @author Scott L. Burson
 */

public class CycleViolationException extends IllegalArgumentException {

    public CycleViolationException(String message) {
	super(message);
    }

    private static final long serialVersionUID = 1L;
}
