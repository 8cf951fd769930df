package com.khoipd8.teacherdashboard.table;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JoinIndexTest {

    private final List<String[]> discipline = Arrays.asList(
            new String[]{"D1", "101"},
            new String[]{"D2", null},
            new String[]{"D3", "101"},
            new String[]{"D4", "102"});

    private final JoinIndex<String[]> byRollNo = JoinIndex.on(discipline, d -> d[1]);

    @Test
    void findOneReturnsFirstRowEveryTime() {
        assertSame(byRollNo.findOne("101").get(), byRollNo.findOne("101").get());
        assertEquals("D1", byRollNo.findOne("101").get()[0]);
    }

    @Test
    void findAllKeepsRowOrder() {
        List<String[]> matches = byRollNo.findAll("101");

        assertEquals(2, matches.size());
        assertEquals("D1", matches.get(0)[0]);
        assertEquals("D3", matches.get(1)[0]);
    }

    @Test
    void nullKeysNeverJoin() {
        assertFalse(byRollNo.findOne(null).isPresent());
        assertTrue(byRollNo.findAll(null).isEmpty());
        assertFalse(byRollNo.contains(null));
    }

    @Test
    void keysCompareExactly() {
        assertFalse(byRollNo.contains("101 "));
        assertTrue(byRollNo.findAll("999").isEmpty());
    }
}
