/*
 * HashTableFuzzTest.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Random sequences of insertions and removals, checked against the
 * <code>java.util</code> collections and against the table invariants after every
 * step.
 */
class HashTableFuzzTest {

    private static final int N_ITERATIONS = 50;

    // A fixed seed, for repeatability.
    private final Random rand = new Random(0xdeadbeefcafeL);

    @Test
    void shouldAgreeWithHashSet() {
	for (int i = 0; i < N_ITERATIONS; ++i) {
	    ValueSet<Integer> vs = new ValueSet<>();
	    Set<Integer> hs = new HashSet<>();
	    for (int j = 0; j < 300; ++j) {
		int r = rand.nextInt(200);
		boolean adding = rand.nextInt(3) != 0;
		String before = vs.dump();
		boolean changed = adding ? vs.add(r) : vs.remove(r);
		boolean expected = adding ? hs.add(r) : hs.remove(r);
		assertThat(vs.verify())
		    .as("verification on iteration %d, %s %d to\n%s", i,
			adding ? "adding" : "removing", r, before)
		    .isTrue();
		assertThat(changed).as("result on iteration %d", i).isEqualTo(expected);
		assertThat(vs.size()).as("size on iteration %d", i).isEqualTo(hs.size());
	    }
	    for (int r = 0; r < 200; ++r)
		assertThat(vs.contains(r)).as("contains %d on iteration %d", r, i)
		    .isEqualTo(hs.contains(r));
	    assertThatIterable(vs).containsExactlyInAnyOrderElementsOf(hs);
	    assertThat(vs.contentHash()).isEqualTo(ValueSet.copyOf(hs).contentHash());
	}
    }

    @Test
    void shouldAgreeWithHashMap() {
	for (int i = 0; i < N_ITERATIONS; ++i) {
	    ValueMap<Integer, Integer> vm = new ValueMap<>();
	    Map<Integer, Integer> hm = new HashMap<>();
	    for (int j = 0; j < 300; ++j) {
		int r = rand.nextInt(200);
		if (rand.nextInt(3) != 0) {
		    int v = rand.nextInt();
		    assertThat(vm.put(r, v)).as("put on iteration %d", i).isEqualTo(hm.put(r, v));
		} else
		    assertThat(vm.remove(r)).as("remove on iteration %d", i).isEqualTo(hm.remove(r));
		assertThat(vm.verify()).as("verification on iteration %d\n%s", i, vm.dump())
		    .isTrue();
		assertThat(vm.size()).as("size on iteration %d", i).isEqualTo(hm.size());
	    }
	    for (int r = 0; r < 200; ++r)
		assertThat(vm.get(r)).as("get %d on iteration %d", r, i).isEqualTo(hm.get(r));
	    assertThatIterable(vm).isEqualTo(ValueMap.copyOf(hm));
	}
    }

    @Test
    void shouldAgreeWithHashSetAlgebra() {
	for (int i = 0; i < N_ITERATIONS; ++i) {
	    Set<Integer> hs0 = randomSet();
	    Set<Integer> hs1 = randomSet();
	    ValueSet<Integer> vs0 = ValueSet.copyOf(hs0);
	    ValueSet<Integer> vs1 = ValueSet.copyOf(hs1);

	    Set<Integer> union = new HashSet<>(hs0);
	    union.addAll(hs1);
	    Set<Integer> inter = new HashSet<>(hs0);
	    inter.retainAll(hs1);
	    Set<Integer> diff = new HashSet<>(hs0);
	    diff.removeAll(hs1);

	    ValueSet<Integer> vu = vs0.union(vs1);
	    ValueSet<Integer> vi = vs0.intersection(vs1);
	    ValueSet<Integer> vd = vs0.difference(vs1);
	    assertThat(vu.verify() && vi.verify() && vd.verify()).isTrue();
	    assertThatIterable(vu).containsExactlyInAnyOrderElementsOf(union);
	    assertThatIterable(vi).containsExactlyInAnyOrderElementsOf(inter);
	    assertThatIterable(vd).containsExactlyInAnyOrderElementsOf(diff);
	    assertThat(vs0.isSubset(vu) && vs1.isSubset(vu)).isTrue();
	    assertThat(vi.isSubset(vs0) && vi.isSubset(vs1)).isTrue();
	    assertThat(vs0.isSubset(vs1)).isEqualTo(hs1.containsAll(hs0));
	}
    }

    private Set<Integer> randomSet() {
	Set<Integer> res = new HashSet<>();
	for (int j = rand.nextInt(60); j > 0; --j) res.add(rand.nextInt(100));
	return res;
    }

}
