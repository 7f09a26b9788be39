package com.gridcalc.sheet;

import com.gridcalc.api.RangeRef;
import com.gridcalc.formula.ReferenceRewriter.Axis;

import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class NamedRangesTest {

    private AtomicInteger changes;
    private NamedRanges names;

    @Before
    public void setUp() {
        changes = new AtomicInteger();
        names = new NamedRanges(changes::incrementAndGet);
    }

    @Test
    public void testValidNames() {
        assertTrue(NamedRanges.isValidName("Total"));
        assertTrue(NamedRanges.isValidName("tax_rate2"));
        assertFalse(NamedRanges.isValidName("A1"));
        assertFalse(NamedRanges.isValidName("ab12"));
        assertFalse(NamedRanges.isValidName("2x"));
        assertFalse(NamedRanges.isValidName("has space"));
        assertFalse(NamedRanges.isValidName(""));
        assertFalse(NamedRanges.isValidName(null));
    }

    @Test
    public void testDefineIsCaseInsensitive() {
        names.define("Sales", "B2:B10");
        assertEquals(RangeRef.parse("B2:B10"), names.get("SALES"));
        assertTrue(names.contains("sales"));
        assertEquals(1, names.size());
        assertEquals("SALES", names.asMap().keySet().iterator().next());
        assertEquals(1, changes.get());
    }

    @Test
    public void testLotusRangeText() {
        names.define("DATA", "A1..C3");
        assertEquals(RangeRef.parse("A1:C3"), names.get("data"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCellShapedNameRejected() {
        names.define("AB12", "A1");
    }

    @Test
    public void testRemove() {
        names.define("X_RATE", "A1");
        assertTrue(names.remove("x_rate"));
        assertFalse(names.remove("x_rate"));
        assertNull(names.get("X_RATE"));
        // the failed remove does not notify
        assertEquals(2, changes.get());
    }

    @Test
    public void testClear() {
        names.define("ONE", "A1");
        names.define("TWO", "A2");
        names.clear();
        assertEquals(0, names.size());
        assertEquals(3, changes.get());
    }

    @Test
    public void testFollowsRowInsert() {
        names.define("TOP", "A1:B1");
        names.define("BELOW", "A5:A9");
        names.adjustForInsert(Axis.ROW, 3, 65535, 255);
        assertEquals(RangeRef.parse("A1:B1"), names.get("TOP"));
        assertEquals(RangeRef.parse("A6:A10"), names.get("BELOW"));
    }

    @Test
    public void testFollowsColumnDelete() {
        names.define("WIDE", "A1:D1");
        names.define("GONE", "B1:B5");
        names.define("RIGHT", "E1");
        names.adjustForDelete(Axis.COLUMN, 1);
        assertEquals(RangeRef.parse("A1:C1"), names.get("WIDE"));
        assertNull(names.get("GONE"));
        assertEquals(RangeRef.parse("D1"), names.get("RIGHT"));
        assertEquals(2, names.size());
    }
}
