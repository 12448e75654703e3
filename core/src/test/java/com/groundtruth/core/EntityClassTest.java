package com.groundtruth.core;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EntityClassTest {

    @Test
    void parsesCaseInsensitively() {
        assertEquals(EntityClass.IDENTIFIER, EntityClass.parse("identifier"));
        assertEquals(EntityClass.TEMPORAL, EntityClass.parse(" Temporal "));
        assertEquals(EntityClass.RELATIONAL, EntityClass.parse("RELATIONAL"));
    }

    @Test
    void allSelectsEveryClass() {
        assertEquals(EnumSet.allOf(EntityClass.class), EntityClass.parseList("all"));
        assertEquals(EnumSet.allOf(EntityClass.class), EntityClass.parseList(null));
    }

    @Test
    void parsesCommaList() {
        Set<EntityClass> classes = EntityClass.parseList("identifier, relational");
        assertEquals(EnumSet.of(EntityClass.IDENTIFIER, EntityClass.RELATIONAL), classes);
    }

    @Test
    void unknownClassThrows() {
        assertThrows(IllegalArgumentException.class, () -> EntityClass.parse("geolocation"));
        assertThrows(IllegalArgumentException.class, () -> EntityClass.parseList("identifier,bogus"));
        assertThrows(IllegalArgumentException.class, () -> EntityClass.parseList(" , "));
    }
}
