package com.gridcalc.util;

import com.gridcalc.api.CellRef;
import com.gridcalc.api.RangeRef;

import org.junit.Test;

import static org.junit.Assert.*;

public class CellRefsTest {

    @Test
    public void testColumnLetters() {
        assertEquals(0, CellRefs.colToIndex("A"));
        assertEquals(25, CellRefs.colToIndex("z"));
        assertEquals(26, CellRefs.colToIndex("AA"));
        assertEquals(255, CellRefs.colToIndex("IV"));
        assertEquals("A", CellRefs.indexToCol(0));
        assertEquals("AZ", CellRefs.indexToCol(51));
        assertEquals("IV", CellRefs.indexToCol(255));
        for (int i = 0; i < 1000; i++)
            assertEquals(i, CellRefs.colToIndex(CellRefs.indexToCol(i)));
    }

    @Test
    public void testParseCellRef() {
        assertEquals(new CellRef(0, 0), CellRefs.parseCellRef("A1"));
        assertEquals(new CellRef(9, 27), CellRefs.parseCellRef("ab10"));
        assertEquals(new CellRef(4, 2), CellRefs.parseCellRef("$C$5"));
        assertEquals("C5", CellRefs.makeCellRef(4, 2));
    }

    @Test
    public void testAnchors() {
        CellRefs.ParsedRef ref = CellRefs.parseAnchored("$B7");
        assertTrue(ref.colAbsolute());
        assertFalse(ref.rowAbsolute());
        assertEquals("$B7", ref.format());
        assertEquals("$D7", ref.withPosition(6, 3).format());
        assertEquals("C$3", CellRefs.parseAnchored("C$3").format());
    }

    @Test
    public void testNotCellRefs() {
        assertFalse(CellRefs.isCellRef("A0"));
        assertFalse(CellRefs.isCellRef("1A"));
        assertFalse(CellRefs.isCellRef("ABCD1"));
        assertFalse(CellRefs.isCellRef("SUM"));
        assertFalse(CellRefs.isCellRef(null));
        assertNull(CellRefs.parseAnchored("A1B"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseCellRefRejectsGarbage() {
        CellRefs.parseCellRef("hello");
    }

    @Test
    public void testParseRangeRef() {
        assertEquals(RangeRef.of(0, 0, 2, 1), CellRefs.parseRangeRef("A1:B3"));
        assertEquals(RangeRef.of(0, 0, 2, 1), CellRefs.parseRangeRef("A1..B3"));
        assertEquals(RangeRef.of(0, 0, 2, 1), CellRefs.parseRangeRef("B3:A1"));
        assertTrue(CellRefs.parseRangeRef("C4").isSingleCell());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeCoordinate() {
        CellRefs.makeCellRef(-1, 0);
    }
}
