/*
 * ValuesTest.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Admission, hashing and equality of individual values.
 */
class ValuesTest {

    @Test
    void shouldHashZeroAndNegativeZeroAlike() {
	assertThat(Values.hash(-0.0)).isEqualTo(Values.hash(0));
	assertThat(Values.hash(0.0f)).isEqualTo(Values.hash(0L));
    }

    @Test
    void shouldHashIntegralNumbersAlikeWhateverTheirClass() {
	int h = Values.hash(42);
	assertThat(Values.hash(42L)).isEqualTo(h);
	assertThat(Values.hash(42.0)).isEqualTo(h);
	assertThat(Values.hash((short)42)).isEqualTo(h);
	assertThat(Values.hash((byte)42)).isEqualTo(h);
    }

    @Test
    void shouldMixIntegersRatherThanUseThemDirectly() {
	assertThat(Values.hash(0)).isZero();
	assertThat(Values.hash(1)).isNotEqualTo(1);
	assertThat(Values.hash(1)).isNotEqualTo(Values.hash(2));
    }

    @Test
    void shouldHashFractionsAndLargeNumbersByTheirBits() {
	assertThat(Values.hash(0.5)).isNotEqualTo(Values.hash(0));
	assertThat(Values.hash(0.5)).isNotEqualTo(Values.hash(-0.5));
	assertThat(Values.hash(1e10)).isEqualTo(Values.hash(10_000_000_000L));
	assertThat(Values.hash(1e10)).isNotEqualTo(Values.hash((int)1e10));
    }

    @Test
    void shouldHashStringsWithFnv1a() {
	assertThat(Values.hash("")).isEqualTo(0x811c9dc5);
	assertThat(Values.hash("a")).isEqualTo(0xe40c292c);
	assertThat(Values.hash("ab")).isNotEqualTo(Values.hash("ba"));
    }

    @Test
    void shouldHashSequencesInOrder() {
	assertThat(Values.hash(List.of(1, 2))).isNotEqualTo(Values.hash(List.of(2, 1)));
	assertThat(Values.hash(List.of(1, 2))).isEqualTo(Values.hash(List.of(1L, 2.0)));
	assertThat(Values.hash(List.of())).isZero();
    }

    @Test
    void shouldRejectNonFiniteNumbers() {
	assertThatThrownBy(() -> Values.admit(Double.NaN))
	    .isInstanceOf(InvalidValueException.class)
	    .hasMessageContaining("NaN");
	assertThatThrownBy(() -> Values.admit(Double.POSITIVE_INFINITY))
	    .isInstanceOf(InvalidValueException.class);
	assertThatThrownBy(() -> Values.admit(Float.NEGATIVE_INFINITY))
	    .isInstanceOf(InvalidValueException.class);
    }

    @Test
    void shouldRejectValuesOutsideTheUniverse() {
	assertThatThrownBy(() -> Values.admit(null)).isInstanceOf(InvalidValueException.class);
	assertThatThrownBy(() -> Values.admit(BigInteger.ONE))
	    .isInstanceOf(InvalidValueException.class)
	    .hasMessageContaining("BigInteger");
	assertThatThrownBy(() -> Values.admit(new Object()))
	    .isInstanceOf(InvalidValueException.class);
	assertThatThrownBy(() -> Values.admit(Arrays.asList(1, Double.NaN)))
	    .isInstanceOf(InvalidValueException.class);
    }

    @Test
    void shouldRefuseToHashValuesOutsideTheUniverse() {
	assertThatThrownBy(() -> Values.hash(BigInteger.ONE))
	    .isInstanceOf(InvalidValueException.class);
	assertThatThrownBy(() -> Values.peekHash(List.of(1, BigInteger.ONE)))
	    .isInstanceOf(InvalidValueException.class);
	assertThatThrownBy(() -> Values.hash(Double.NaN)).isInstanceOf(InvalidValueException.class);
	assertThatThrownBy(() -> Values.hash(new Object()))
	    .isInstanceOf(InvalidValueException.class);
    }

    @Test
    void shouldAdmitOnlyLongsThatSurviveConversionToDouble() {
	long edge = Values.MAX_EXACT_LONG;

	assertThat(Values.admit(edge)).isEqualTo(edge);
	assertThat(Values.admit(-edge)).isEqualTo(-edge);
	assertThatThrownBy(() -> Values.admit(edge + 1))
	    .isInstanceOf(InvalidValueException.class)
	    .hasMessageContaining("2^53");
	assertThatThrownBy(() -> Values.admit(Long.MIN_VALUE))
	    .isInstanceOf(InvalidValueException.class);
	assertThatThrownBy(() -> ValueComparator.Instance.compare(Long.MAX_VALUE, 1))
	    .isInstanceOf(InvalidValueException.class);
    }

    @Test
    void shouldCopySequencesOnAdmission() {
	List<Object> list = new ArrayList<>(List.of(1, 2));
	Object admitted = Values.admit(list);
	list.add(3);

	assertThat(admitted).isEqualTo(List.of(1, 2));
	assertThatThrownBy(() -> ((List<Object>)admitted).add(4))
	    .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldCompareNumbersByValue() {
	assertThat(Values.equal(1, 1.0)).isTrue();
	assertThat(Values.equal(0, -0.0)).isTrue();
	assertThat(Values.equal(1, 2)).isFalse();
	assertThat(Values.equal(1, "1")).isFalse();
	assertThat(Values.equal(List.of(1, 2), List.of(1.0, 2L))).isTrue();
	assertThat(Values.equal(List.of(1, 2), List.of(2, 1))).isFalse();
    }

    @Test
    void shouldClassifyValues() {
	assertThat(Kind.of(3)).isEqualTo(Kind.NUMBER);
	assertThat(Kind.of(3.5f)).isEqualTo(Kind.NUMBER);
	assertThat(Kind.of("x")).isEqualTo(Kind.STRING);
	assertThat(Kind.of(List.of())).isEqualTo(Kind.SEQUENCE);
	assertThat(Kind.of(Tuple.of())).isEqualTo(Kind.TUPLE);
	assertThat(Kind.of(new ValueSet<Object>())).isEqualTo(Kind.SET);
	assertThat(Kind.of(new ValueMap<Object, Object>())).isEqualTo(Kind.MAP);
	assertThat(Kind.SET.isContainer()).isTrue();
	assertThat(Kind.STRING.isContainer()).isFalse();
    }

    @Test
    void shouldPrintSequencesWithBrackets() {
	assertThat(Values.toString(List.of(1, "a", List.of()))).isEqualTo("[1, a, []]");
    }

    @Test
    void shouldPeekWithoutFreezing() {
	ValueSet<Integer> set = ValueSet.of(1, 2);
	int peeked = Values.peekHash(List.of(set));

	assertThat(set.isFrozen()).isFalse();
	assertThat(Values.hash(List.of(set))).isEqualTo(peeked);
	assertThat(set.isFrozen()).isTrue();
    }

}
