package com.reliquary.model;

import com.reliquary.error.ModelException;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ExtensionMode}.
 */
public class ExtensionModeTest {

    @Test
    public void testIncludes_BaseAlwaysIncluded() {
        for (ExtensionMode mode : ExtensionMode.values()) {
            assertTrue(mode.includes(LocationKind.BASE));
        }
    }

    @Test
    public void testIncludes_EquipmentImpliesGuarded() {
        assertTrue(ExtensionMode.EQUIPMENT.includes(LocationKind.GUARDED));
        assertTrue(ExtensionMode.EQUIPMENT.includes(LocationKind.EQUIPMENT));
        assertTrue(ExtensionMode.GUARDED.includes(LocationKind.GUARDED));
        assertFalse(ExtensionMode.GUARDED.includes(LocationKind.EQUIPMENT));
        assertFalse(ExtensionMode.NONE.includes(LocationKind.GUARDED));
    }

    @Test
    public void testFromName() {
        assertEquals(ExtensionMode.GUARDED, ExtensionMode.fromName("guarded"));
        assertEquals(ExtensionMode.EQUIPMENT, ExtensionMode.fromName(" Equipment "));
        assertEquals(ExtensionMode.NONE, ExtensionMode.fromName(null));
        assertEquals(ExtensionMode.NONE, ExtensionMode.fromName(""));
    }

    @Test(expected = ModelException.class)
    public void testFromName_Unknown_Throws() {
        ExtensionMode.fromName("scenic");
    }
}
