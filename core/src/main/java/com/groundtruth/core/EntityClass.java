package com.groundtruth.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * The three families of forensic evidence the extractor reports.
 */
public enum EntityClass {
    IDENTIFIER("Identifier"),
    TEMPORAL("Temporal"),
    RELATIONAL("Relational");

    private final String label;

    EntityClass(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static EntityClass parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity class is empty");
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.label.toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity class: " + name));
    }

    /**
     * Parses a comma separated list such as {@code identifier,temporal}, or {@code all}.
     */
    public static Set<EntityClass> parseList(String names) {
        if (names == null || names.isBlank() || names.trim().equalsIgnoreCase("all")) {
            return EnumSet.allOf(EntityClass.class);
        }
        Set<EntityClass> result = EnumSet.noneOf(EntityClass.class);
        for (String name : names.split(",")) {
            if (!name.isBlank()) {
                result.add(parse(name));
            }
        }
        if (result.isEmpty()) {
            throw new IllegalArgumentException("No entity classes in: " + names);
        }
        return result;
    }
}
