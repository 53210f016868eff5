package com.fibagent.agent.ecmp;

import com.fibagent.core.model.NextHopSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NextHopGroupIdTableTest {

    private static final NextHopSet GROUP_A = NextHopSet.ofAddresses("100::1", "100::2");
    private static final NextHopSet GROUP_B = NextHopSet.ofAddresses("100::3");

    private NextHopGroupIdTable table;

    @BeforeEach
    void setUp() {
        table = new NextHopGroupIdTable();
    }

    @Test
    void testGetOrCreate_ReusesIdForEqualSet() {
        long id = table.getOrCreate(GROUP_A);

        assertEquals(1, id);
        assertEquals(id, table.getOrCreate(NextHopSet.ofAddresses("100::2", "100::1")));
        assertEquals(1, table.size());
    }

    @Test
    void testBothDirectionsAgree() {
        long a = table.getOrCreate(GROUP_A);
        long b = table.getOrCreate(GROUP_B);

        assertEquals(Optional.of(GROUP_A), table.lookupNextHops(a));
        assertEquals(Optional.of(GROUP_B), table.lookupNextHops(b));
        assertEquals(Optional.of(b), table.lookup(GROUP_B));
        assertEquals(2, table.getNhopsToId().size());
    }

    @Test
    void testDestroy_IdNeverReissued() {
        long a = table.getOrCreate(GROUP_A);
        table.destroy(a);

        assertTrue(table.lookup(GROUP_A).isEmpty());
        assertTrue(table.lookupNextHops(a).isEmpty());
        assertEquals(2, table.getOrCreate(GROUP_A));
        assertEquals(3, table.getNextId());
    }

    @Test
    void testDestroy_UnknownIdIsViolation() {
        assertThrows(NextHopGroupInvariantException.class, () -> table.destroy(42));
    }

    @Test
    void testRestore_KeepsCounter() {
        table.getOrCreate(GROUP_A);
        Map<Long, NextHopSet> checkpoint = table.getIdToNhops();
        table.getOrCreate(GROUP_B);

        table.restore(checkpoint);

        assertEquals(1, table.size());
        assertTrue(table.lookup(GROUP_B).isEmpty());
        assertEquals(3, table.getOrCreate(GROUP_B));
    }
}
