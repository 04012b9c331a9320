package com.typeddsl.dag.ir;

import com.typeddsl.dag.exceptions.NameConflictException;
import org.junit.Test;

import static org.junit.Assert.*;

public class NameRegistryTest {

    @Test
    public void testDistinctNamesRegister() {
        NameRegistry registry = new NameRegistry();
        registry.register("n1");
        registry.register("n2");
        assertTrue(registry.contains("n1"));
        assertTrue(registry.contains("n2"));
        assertEquals(2, registry.size());
    }

    @Test
    public void testDuplicateNameConflicts() {
        NameRegistry registry = new NameRegistry();
        registry.register("n1");
        try {
            registry.register("n1");
            fail("Expected NameConflictException");
        } catch (NameConflictException e) {
            assertEquals("n1", e.name());
            assertTrue(e.getMessage().contains("n1"));
        }
        // The failed call leaves the registry usable
        registry.register("n2");
        assertEquals(2, registry.size());
    }

    @Test
    public void testNamesAreCaseSensitive() {
        NameRegistry registry = new NameRegistry();
        registry.register("Price");
        registry.register("price");
        assertEquals(2, registry.size());
    }

    @Test
    public void testAnonymousSentinelNeverConflicts() {
        NameRegistry registry = new NameRegistry();
        registry.register(ValueNames.ANONYMOUS);
        registry.register(ValueNames.ANONYMOUS);
        assertFalse(registry.contains(ValueNames.ANONYMOUS));
        assertEquals(0, registry.size());
    }

    @Test(expected = NameConflictException.class)
    public void testReservedPrefixRejected() {
        new NameRegistry().register(ValueNames.anonymous(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyNameRejected() {
        new NameRegistry().register("");
    }

    @Test
    public void testCheckDoesNotClaim() {
        NameRegistry registry = new NameRegistry();
        registry.check("n1");
        assertFalse(registry.contains("n1"));
        registry.register("n1");
        try {
            registry.check("n1");
            fail("Expected NameConflictException");
        } catch (NameConflictException e) {
            assertEquals("n1", e.name());
        }
        assertEquals(1, registry.size());
    }

    @Test
    public void testNamesKeepRegistrationOrder() {
        NameRegistry registry = new NameRegistry();
        registry.register("b");
        registry.register("a");
        assertArrayEquals(new String[] { "b", "a" }, registry.names().toArray());
    }
}
