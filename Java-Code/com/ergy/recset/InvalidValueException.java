/*
 * InvalidValueException.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;

/**
 * Thrown when something outside the value universe is offered to a container:
 * <code>null</code>, a non-finite number (NaN or an infinity), an
 * arbitrary-precision number, or an object of an unsupported class.
 *
 * @author Scott L. Burson
 * @see Kind
 */

public class InvalidValueException extends IllegalArgumentException {

    public InvalidValueException(String message) {
	super(message);
    }

    private static final long serialVersionUID = 1L;
}
