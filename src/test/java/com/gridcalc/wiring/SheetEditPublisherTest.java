package com.gridcalc.wiring;

import com.gridcalc.api.RangeRef;
import com.gridcalc.api.Value;
import com.gridcalc.engine.RecalcStats;
import com.gridcalc.sheet.Sheet;

import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class SheetEditPublisherTest {

    private Sheet sheet;

    @Before
    public void setUp() {
        sheet = new Sheet();
        sheet.setCell("C1", "=SUM(A1:B100)");
    }

    @Test
    public void testEditsAreAppliedInOrder() {
        try (SheetEditPublisher publisher = new SheetEditPublisher(sheet, 64).start()) {
            for (int i = 0; i < 100; i++)
                publisher.publish(0, 0, String.valueOf(i));
            publisher.close();
            assertEquals(100, publisher.appliedCount());
            assertEquals(0, publisher.rejectedCount());
        }
        assertEquals(Value.number(99), sheet.getValue("A1"));
        assertEquals(Value.number(99), sheet.getValue("C1"));
        assertFalse(sheet.needsRecalc());
    }

    @Test
    public void testConcurrentProducers() throws InterruptedException {
        SheetEditPublisher publisher = new SheetEditPublisher(sheet, 128).start();
        Thread[] producers = new Thread[4];
        for (int p = 0; p < producers.length; p++) {
            final int col = p % 2;
            final int base = (p / 2) * 50;
            producers[p] = new Thread(() -> {
                for (int r = 0; r < 50; r++)
                    publisher.publish(base + r, col, "1");
            });
            producers[p].start();
        }
        for (Thread t : producers)
            t.join();
        publisher.close();

        assertEquals(200, publisher.appliedCount());
        assertEquals(Value.number(200), sheet.getValue("C1"));
    }

    @Test
    public void testBatchEndTriggersCallback() throws InterruptedException {
        List<RecalcStats> passes = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        SheetEditPublisher publisher = new SheetEditPublisher(sheet, 64);
        publisher.setPostRecalcCallback((epoch, stats) -> {
            passes.add(stats);
            done.countDown();
        });
        publisher.start();
        publisher.publish(0, 0, "5", true);
        assertTrue(done.await(5, TimeUnit.SECONDS));
        publisher.close();

        assertEquals(1, passes.size());
        assertEquals(1, passes.get(0).cellsEvaluated());
        assertEquals(Value.number(5), sheet.getValue("C1"));
    }

    @Test
    public void testRejectedEditDoesNotStopConsumer() {
        sheet.setCell("D1", "1");
        sheet.setProtected(RangeRef.parse("A1:B100"), false);
        sheet.setProtectionEnabled(true);
        try (SheetEditPublisher publisher = new SheetEditPublisher(sheet).start()) {
            publisher.publish(0, 3, "2");
            publisher.publish(0, 0, "7");
            publisher.publish(100000, 0, "1");
            publisher.close();
            assertEquals(1, publisher.appliedCount());
            assertEquals(2, publisher.rejectedCount());
        }
        assertEquals(Value.number(1), sheet.getValue("D1"));
        assertEquals(Value.number(7), sheet.getValue("C1"));
    }

    @Test(expected = IllegalStateException.class)
    public void testPublishBeforeStart() {
        new SheetEditPublisher(sheet, 16).publish(0, 0, "1");
    }
}
