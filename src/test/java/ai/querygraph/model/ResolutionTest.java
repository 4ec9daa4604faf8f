package ai.querygraph.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ResolutionTest {

    @Test
    void dynamicAbsorbs() {
        assertEquals(Resolution.DYNAMIC, Resolution.merge(Resolution.STATIC, Resolution.DYNAMIC));
        assertEquals(Resolution.DYNAMIC, Resolution.merge(Resolution.DYNAMIC, Resolution.DYNAMIC));
        assertEquals(Resolution.STATIC, Resolution.merge(Resolution.STATIC, Resolution.STATIC));
    }

    @ParameterizedTest
    @EnumSource(Resolution.class)
    void mergeIsIdempotent(Resolution value) {
        assertEquals(value, Resolution.merge(value, value));
    }

    @ParameterizedTest
    @EnumSource(Resolution.class)
    void mergeIsCommutative(Resolution value) {
        for (Resolution other : Resolution.values()) {
            assertEquals(Resolution.merge(value, other), Resolution.merge(other, value));
        }
    }

    @Test
    void labels() {
        assertEquals("static", Resolution.STATIC.label());
        assertTrue(Resolution.of(true).isStatic());
        assertFalse(Resolution.of(false).isStatic());
    }
}
