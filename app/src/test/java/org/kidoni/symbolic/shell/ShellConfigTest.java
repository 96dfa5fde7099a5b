package org.kidoni.symbolic.shell;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShellConfigTest {
    @Test
    void defaults() {
        ShellConfig config = ShellConfig.from(new String[0], Map.of());

        assertEquals("x", config.variable());
        assertEquals(256, config.outputCapacity());
        assertTrue(config.bindings().isEmpty());
    }

    @Test
    void environmentOverrides() {
        ShellConfig config = ShellConfig.from(new String[0], Map.of(
                ShellConfig.DIFF_VAR_ENV, " t ",
                ShellConfig.OUTPUT_CAPACITY_ENV, "32"));

        assertEquals("t", config.variable());
        assertEquals(32, config.outputCapacity());
    }

    @Test
    void bindingsFromArguments() {
        ShellConfig config = ShellConfig.from(new String[] {"x=2", "y = -3.5", "rate=1e-3"}, Map.of());

        assertEquals(Map.of("x", 2.0, "y", -3.5, "rate", 0.001), config.bindings());
        assertThrows(UnsupportedOperationException.class, () -> config.bindings().put("z", 1.0));
    }

    @Test
    void malformedBindings() {
        assertThrows(IllegalArgumentException.class, () -> ShellConfig.from(new String[] {"x"}, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> ShellConfig.from(new String[] {"=2"}, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> ShellConfig.from(new String[] {"x=two"}, Map.of()));
    }

    @Test
    void malformedEnvironment() {
        assertThrows(IllegalArgumentException.class,
                () -> ShellConfig.from(new String[0], Map.of(ShellConfig.OUTPUT_CAPACITY_ENV, "lots")));
        assertThrows(IllegalArgumentException.class,
                () -> ShellConfig.from(new String[0], Map.of(ShellConfig.OUTPUT_CAPACITY_ENV, "0")));
        assertThrows(IllegalArgumentException.class,
                () -> ShellConfig.from(new String[0], Map.of(ShellConfig.DIFF_VAR_ENV, "  ")));
    }
}
