package com.branchprobe.agent;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProgramIdResolverTest {

    private final ProgramIdResolver withEnv = new ProgramIdResolver(Map.of("PROGRAM_NAME", "bubble_sort")::get);
    private final ProgramIdResolver noEnv = new ProgramIdResolver(name -> null);

    @Test
    void explicitValueWins() {
        assertEquals("linear_search", withEnv.resolve("linear_search"));
    }

    @Test
    void environmentWhenNoExplicitValue() {
        assertEquals("bubble_sort", withEnv.resolve(null));
        assertEquals("bubble_sort", withEnv.resolve("  "));
    }

    @Test
    void fallbackWhenNeitherIsSet() {
        assertEquals("unknown", noEnv.resolve(null));
    }

    @Test
    void blankEnvironmentValueIsIgnored() {
        ProgramIdResolver blank = new ProgramIdResolver(name -> "");
        assertEquals("unknown", blank.resolve(null));
    }
}
