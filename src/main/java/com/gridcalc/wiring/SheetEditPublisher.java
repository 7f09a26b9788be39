package com.gridcalc.wiring;

import com.gridcalc.engine.RecalcStats;
import com.gridcalc.sheet.Sheet;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Sequences cell edits from any number of threads onto one sheet.
 *
 * Producers call {@link #publish}; a single consumer thread applies the edits
 * in ring-buffer order. A burst of edits that are already queued is applied
 * inside one sheet batch, and the sheet recalculates once when the consumer
 * reaches the end of the burst (or an edit marked {@code batchEnd}).
 *
 * A failing edit (bad coordinate, protected cell) is logged and skipped; it
 * never stops the consumer.
 */
public final class SheetEditPublisher implements EventHandler<SheetEditEvent>, AutoCloseable {
    private static final Logger log = LogManager.getLogger(SheetEditPublisher.class);

    private final Sheet sheet;
    private final Disruptor<SheetEditEvent> disruptor;
    private final AtomicLong seq = new AtomicLong();
    private RingBuffer<SheetEditEvent> ringBuffer;
    private PostRecalcCallback postRecalc;
    private boolean inBatch;
    private long applied, rejected;

    public SheetEditPublisher(Sheet sheet) {
        this(sheet, sheet.config().getEditRingBufferSize());
    }

    public SheetEditPublisher(Sheet sheet, int bufferSize) {
        this.sheet = sheet;
        this.disruptor = new Disruptor<>(
                SheetEditEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(this);
    }

    /** Called on the consumer thread after every batch recalculation. */
    public void setPostRecalcCallback(PostRecalcCallback cb) {
        this.postRecalc = cb;
    }

    public synchronized SheetEditPublisher start() {
        if (ringBuffer == null) {
            ringBuffer = disruptor.start();
            log.info("Edit publisher started, ring buffer size {}", ringBuffer.getBufferSize());
        }
        return this;
    }

    public void publish(int row, int col, String text) {
        publish(row, col, text, false);
    }

    /** Queues an edit; blocks while the ring buffer is full. */
    public void publish(int row, int col, String text, boolean batchEnd) {
        RingBuffer<SheetEditEvent> rb = ringBuffer;
        if (rb == null)
            throw new IllegalStateException("Publisher not started");
        long sequence = rb.next();
        try {
            rb.get(sequence).setEdit(row, col, text, batchEnd, seq.incrementAndGet());
        } finally {
            rb.publish(sequence);
        }
    }

    @Override
    public void onEvent(SheetEditEvent event, long sequence, boolean endOfBatch) {
        final boolean forceRecalc = event.isBatchEnd();
        if (!inBatch) {
            sheet.beginBatch();
            inBatch = true;
        }
        try {
            sheet.setCell(event.row(), event.col(), event.text());
            applied++;
        } catch (RuntimeException e) {
            rejected++;
            log.error("Rejected edit #{} at row {} col {}: {}", event.sequenceId(), event.row(), event.col(),
                    e.getMessage());
        } finally {
            event.clear();
        }

        if (endOfBatch || forceRecalc) {
            inBatch = false;
            RecalcStats stats = sheet.endBatch();
            if (postRecalc != null)
                postRecalc.onRecalculated(sheet.epoch(), stats);
        }
    }

    /** Edits applied so far. Read from the consumer thread or after {@link #close()}. */
    public long appliedCount() {
        return applied;
    }

    public long rejectedCount() {
        return rejected;
    }

    /** Drains every queued edit, then stops the consumer thread. */
    @Override
    public synchronized void close() {
        if (ringBuffer != null) {
            disruptor.shutdown();
            ringBuffer = null;
            log.info("Edit publisher stopped: {} applied, {} rejected", applied, rejected);
        }
    }

    /** Callback run after each recalculation driven by the publisher. */
    @FunctionalInterface
    public interface PostRecalcCallback {
        /**
         * @param epoch recalculation epoch of the sheet after the batch.
         * @param stats stats of the pass, or null when none ran (manual mode,
         *              or nothing was dirty).
         */
        void onRecalculated(long epoch, RecalcStats stats);
    }
}
