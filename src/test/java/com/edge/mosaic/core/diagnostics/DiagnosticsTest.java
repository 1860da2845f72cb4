package com.edge.mosaic.core.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {

    @Test
    void testBuilder_KeepsInsertionOrder() {
        Diagnostics diagnostics = Diagnostics.builder()
            .put(Diagnostics.IMG0, "a.png")
            .put(Diagnostics.IMG1, "b.png")
            .put(Diagnostics.N_MATCH, 42)
            .put(Diagnostics.SCALE, 0.5)
            .build();

        assertEquals(List.of("img0", "img1", "n_match", "scale"), List.copyOf(diagnostics.keySet()));
        assertEquals(42, diagnostics.getInt(Diagnostics.N_MATCH));
        assertEquals(0.5, diagnostics.getDouble(Diagnostics.SCALE));
        assertEquals("a.png", diagnostics.getString(Diagnostics.IMG0));
    }

    @Test
    void testBuilder_NullValueRemovesField() {
        Diagnostics diagnostics = Diagnostics.builder()
            .put(Diagnostics.N_INLIER, 12)
            .put(Diagnostics.N_INLIER, null)
            .build();

        assertFalse(diagnostics.contains(Diagnostics.N_INLIER));
        assertThrows(IllegalArgumentException.class, () -> diagnostics.getInt(Diagnostics.N_INLIER));
    }

    @Test
    void testBuild_IsImmutableSnapshot() {
        Diagnostics.Builder builder = Diagnostics.builder().put(Diagnostics.N_MATCH, 1);
        Diagnostics first = builder.build();
        builder.put(Diagnostics.N_INLIER, 1);

        assertFalse(first.contains(Diagnostics.N_INLIER));
        assertThrows(UnsupportedOperationException.class, () -> first.asMap().put("x", 1));
    }
}
