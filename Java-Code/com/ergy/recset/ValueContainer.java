/*
 * ValueContainer.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.recset;

/**
 * A container with value semantics: two containers are equal iff their contents
 * are recursively equal, no matter how or in what order they were built.
 *
 * <p>Every container is either <i>mutable</i> or <i>frozen</i>.  Sets and maps are
 * created mutable; tuples are born frozen.  Calling {@link #hashCode} on a
 * container freezes it, as does {@link #freeze}, and so does any operation that
 * needs its hash code: inserting it into a set or as a map key, or hashing a
 * container that holds it.  Freezing is thus transitive: once a set of sets has
 * been hashed, so have all its members.  A frozen container stays frozen; any
 * attempt to change it throws {@link FrozenMutationException}.  This guarantees
 * that the hash code of a container never changes while something depends on it.
 *
 * <p>Containers are not thread-safe.
 *
 * @author Scott L. Burson
 * @see ValueSet
 * @see ValueMap
 * @see Tuple
 */

public interface ValueContainer {

    /**
     * Returns the kind of this container.
     *
     * @return one of {@link Kind#TUPLE}, {@link Kind#SET} or {@link Kind#MAP}
     */
    Kind kind();

    /**
     * Returns the number of elements (for a map, entries) in this container.
     *
     * @return the size
     */
    int size();

    /**
     * Returns true if this container has no elements.
     *
     * @return whether the container is empty
     */
    boolean isEmpty();

    /**
     * Returns true if this container has been frozen.
     *
     * @return whether the container is frozen
     */
    boolean isFrozen();

    /**
     * Freezes this container, and with it every container nested in it.  Has no
     * effect on a container that is already frozen.
     */
    void freeze();

    /**
     * Returns the hash code of this container's contents <i>without</i> freezing
     * it.  For a frozen container this is the same as {@link #hashCode}.  For a
     * mutable one it reflects the current contents, and changes when they do.
     *
     * @return the current content hash
     */
    int contentHash();

    /**
     * Returns the content hash of this container, freezing it first.
     *
     * @return the hash code
     */
    int hashCode();

}
