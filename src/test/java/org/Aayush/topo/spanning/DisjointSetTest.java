package org.Aayush.topo.spanning;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DisjointSetTest {

    @Test
    @DisplayName("Starts with singleton sets")
    void testInitialState() {
        DisjointSet set = new DisjointSet(4);
        assertEquals(4, set.size());
        assertEquals(4, set.componentCount());
        for (int i = 0; i < 4; i++) {
            assertEquals(i, set.find(i));
            assertEquals(1, set.setSize(i));
        }
    }

    @Test
    @DisplayName("Union merges once and tracks sizes and component count")
    void testUnion() {
        DisjointSet set = new DisjointSet(5);
        assertTrue(set.union(0, 1));
        assertTrue(set.union(2, 3));
        assertFalse(set.union(1, 0));
        assertEquals(3, set.componentCount());

        assertTrue(set.union(1, 3));
        assertTrue(set.connected(0, 2));
        assertFalse(set.connected(0, 4));
        assertEquals(4, set.setSize(3));
        assertEquals(1, set.setSize(4));
        assertEquals(2, set.componentCount());
    }

    @Test
    @DisplayName("Out-of-range elements are rejected")
    void testBounds() {
        DisjointSet set = new DisjointSet(2);
        IndexOutOfBoundsException ex = assertThrows(IndexOutOfBoundsException.class, () -> set.find(2));
        assertTrue(ex.getMessage().contains("not in bounds"));
        assertThrows(IndexOutOfBoundsException.class, () -> set.union(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new DisjointSet(-1));
    }

    @Test
    @DisplayName("Empty structure has no components")
    void testEmpty() {
        DisjointSet set = new DisjointSet(0);
        assertEquals(0, set.componentCount());
        assertEquals(0, set.size());
    }

    @Test
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    @DisplayName("Long chains stay fast without recursion")
    void testLongChain() {
        int n = 1_000_000;
        DisjointSet set = new DisjointSet(n);
        for (int i = 1; i < n; i++) {
            set.union(i - 1, i);
        }
        assertEquals(1, set.componentCount());
        assertTrue(set.connected(0, n - 1));
        assertEquals(n, set.setSize(n / 2));
    }
}
