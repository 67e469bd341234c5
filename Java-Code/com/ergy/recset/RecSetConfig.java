/*
 * RecSetConfig.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

/**
 * Library settings, read through MicroProfile Config.  The defaults ship in
 * <code>META-INF/microprofile-config.properties</code>; a system property or an
 * environment variable of the same name overrides them.
 *
 * <ul>
 * <li><code>recset.powerset.max-elements</code>: the largest set on which
 *     {@link ValueSet#powerset()} may be called (default 20, at most
 *     {@value #MAX_POWERSET_LIMIT}).</li>
 * </ul>
 *
 * @author Scott L. Burson
 */

public final class RecSetConfig {

    private static final Logger log = Logger.getLogger(RecSetConfig.class);

    public static final String POWERSET_LIMIT_KEY = "recset.powerset.max-elements";
    public static final int DEFAULT_POWERSET_LIMIT = 20;
    /**
     * The largest bound that can be honored: a hash table holds at most
     * 2<sup>29</sup> entries within its load factor.
     */
    public static final int MAX_POWERSET_LIMIT = 29;

    private RecSetConfig() { }

    /**
     * Returns the configured powerset bound.  Read once, on first use.
     *
     * @return the largest set size for which <code>powerset()</code> is allowed
     * @throws IllegalArgumentException if the configured value is out of range
     */
    public static int powersetLimit() {
	if (powerset_limit < 0) powerset_limit = powersetLimit(ConfigProvider.getConfig());
	return powerset_limit;
    }

    /*package*/ static int powersetLimit(Config config) {
	int limit = config.getOptionalValue(POWERSET_LIMIT_KEY, Integer.class)
	    .orElse(DEFAULT_POWERSET_LIMIT);
	checkPowersetLimit(limit);
	log.debugf("%s = %d", POWERSET_LIMIT_KEY, limit);
	return limit;
    }

    /*package*/ static int checkPowersetLimit(int limit) {
	if (limit < 0 || limit > MAX_POWERSET_LIMIT)
	    throw new IllegalArgumentException(POWERSET_LIMIT_KEY + " must be between 0 and " +
					       MAX_POWERSET_LIMIT + ", not " + limit);
	return limit;
    }

    private static volatile int powerset_limit = -1;

}
