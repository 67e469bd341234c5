/*
 * RandomValues.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates random values from a deliberately small domain, so that equal values
 * built in different ways, and hash collisions between containers, turn up often.
 */
final class RandomValues {

    private static final String[] STRINGS = { "", "a", "b", "ab", "ba", "p", "q" };
    private static final Object[] NUMBERS = { 0, -0.0, 1, 1L, 1.0, 2, -1, 0.5, 2.5f, 1e10 };

    private final Random rand;

    RandomValues(long seed) {
	rand = new Random(seed);
    }

    Object next(int depth) {
	int choice = rand.nextInt(depth <= 0 ? 2 : 7);
	switch (choice) {
	case 0:
	    return NUMBERS[rand.nextInt(NUMBERS.length)];
	case 1:
	    return STRINGS[rand.nextInt(STRINGS.length)];
	case 2: {
	    List<Object> list = new ArrayList<>();
	    for (int i = rand.nextInt(3); i > 0; --i) list.add(next(depth - 1));
	    return list;
	}
	case 3: {
	    Object[] elts = new Object[rand.nextInt(3)];
	    for (int i = 0; i < elts.length; ++i) elts[i] = next(depth - 1);
	    return Tuple.of(elts);
	}
	case 4:
	case 5: {
	    ValueSet<Object> set = new ValueSet<>();
	    for (int i = rand.nextInt(4); i > 0; --i) set.add(next(depth - 1));
	    return set;
	}
	default: {
	    ValueMap<Object, Object> map = new ValueMap<>();
	    for (int i = rand.nextInt(3); i > 0; --i) map.put(next(depth - 1), next(depth - 1));
	    return map;
	}
	}
    }

    List<Object> list(int n, int depth) {
	List<Object> res = new ArrayList<>(n);
	for (int i = 0; i < n; ++i) res.add(next(depth));
	return res;
    }

}
