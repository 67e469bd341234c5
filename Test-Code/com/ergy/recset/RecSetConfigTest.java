/*
 * RecSetConfigTest.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;

import java.util.Map;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RecSetConfigTest {

    @Test
    void shouldReadTheShippedPowersetLimit() {
	assertThat(RecSetConfig.powersetLimit()).isEqualTo(RecSetConfig.DEFAULT_POWERSET_LIMIT);
	assertThat(RecSetConfig.powersetLimit()).isEqualTo(20);
    }

    @Test
    void shouldFallBackToTheDefaultWhenUnset() {
	Config config = new SmallRyeConfigBuilder().build();

	assertThat(RecSetConfig.powersetLimit(config)).isEqualTo(RecSetConfig.DEFAULT_POWERSET_LIMIT);
    }

    @Test
    void shouldLetASystemPropertyOverrideTheShippedLimit() {
	System.setProperty(RecSetConfig.POWERSET_LIMIT_KEY, "7");
	try {
	    Config config = new SmallRyeConfigBuilder().addDefaultSources().build();

	    assertThat(RecSetConfig.powersetLimit(config)).isEqualTo(7);
	} finally {
	    System.clearProperty(RecSetConfig.POWERSET_LIMIT_KEY);
	}
    }

    @Test
    void shouldTakeTheLimitFromAHigherOrdinalSource() {
	Config config = new SmallRyeConfigBuilder()
	    .addDefaultSources()
	    .withSources(new PropertiesConfigSource(
			     Map.of(RecSetConfig.POWERSET_LIMIT_KEY, "12"), "overrides", 500))
	    .build();

	assertThat(RecSetConfig.powersetLimit(config)).isEqualTo(12);
    }

    @Test
    void shouldRejectAnOutOfRangeLimitWhenRead() {
	Config config = new SmallRyeConfigBuilder()
	    .withSources(new PropertiesConfigSource(
			     Map.of(RecSetConfig.POWERSET_LIMIT_KEY,
				    String.valueOf(RecSetConfig.MAX_POWERSET_LIMIT + 1)),
			     "overrides", 500))
	    .build();

	assertThatThrownBy(() -> RecSetConfig.powersetLimit(config))
	    .isInstanceOf(IllegalArgumentException.class)
	    .hasMessageContaining(RecSetConfig.POWERSET_LIMIT_KEY);
    }

    @Test
    void shouldAcceptLimitsWithinRange() {
	assertThat(RecSetConfig.checkPowersetLimit(0)).isZero();
	assertThat(RecSetConfig.checkPowersetLimit(29)).isEqualTo(29);
    }

    @Test
    void shouldRejectLimitsOutOfRange() {
	assertThatThrownBy(() -> RecSetConfig.checkPowersetLimit(30))
	    .isInstanceOf(IllegalArgumentException.class)
	    .hasMessageContaining(RecSetConfig.POWERSET_LIMIT_KEY);
	assertThatThrownBy(() -> RecSetConfig.checkPowersetLimit(-1))
	    .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCapThePowersetAtWhatATableCanHold() {
	int largest = 1 << RecSetConfig.MAX_POWERSET_LIMIT;

	assertThat(AbstractHashContainer.bucketsFor(largest))
	    .isEqualTo(AbstractHashContainer.MAX_BUCKETS);
	assertThatThrownBy(() -> AbstractHashContainer.bucketsFor(largest * 2))
	    .isInstanceOf(IllegalStateException.class);
    }

}
