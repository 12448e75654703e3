package com.groundtruth.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which entity classes to extract and how many non-null values to consider per column.
 */
public record ExtractionRequest(Set<EntityClass> entityClasses, Integer scanLimit) {

    public ExtractionRequest {
        if (entityClasses == null || entityClasses.isEmpty()) {
            throw new IllegalArgumentException("At least one entity class is required");
        }
        if (scanLimit != null && scanLimit < 1) {
            throw new IllegalArgumentException("Scan limit must be positive: " + scanLimit);
        }
        entityClasses = Collections.unmodifiableSet(EnumSet.copyOf(entityClasses));
    }

    public static ExtractionRequest all() {
        return new ExtractionRequest(EnumSet.allOf(EntityClass.class), null);
    }

    public static ExtractionRequest of(String entities, Integer scanLimit) {
        return new ExtractionRequest(EntityClass.parseList(entities), scanLimit);
    }

    public boolean includes(EntityClass entityClass) {
        return entityClasses.contains(entityClass);
    }
}
