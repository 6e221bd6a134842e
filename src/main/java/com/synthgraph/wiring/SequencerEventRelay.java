package com.synthgraph.wiring;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.synthgraph.api.EventPublisher;
import com.synthgraph.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Bounded hand-off from the scheduling thread to the session's event consumer.
 *
 * <p>
 * The scheduler publishes with {@link #publish}, which never blocks: when the
 * ring buffer is full, or the relay has been shut down, the event is dropped
 * and counted. A single daemon consumer thread drains the buffer and calls the
 * downstream {@link EventPublisher}. Exceptions thrown downstream are logged
 * and do not stop the consumer.
 */
public final class SequencerEventRelay implements EventPublisher, AutoCloseable {
    private static final Logger log = LogManager.getLogger(SequencerEventRelay.class);

    private final Disruptor<SequencerEvent> disruptor;
    private final RingBuffer<SequencerEvent> ringBuffer;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final AtomicLong dropped = new AtomicLong();
    private final ErrorRateLimiter dropWarnings = new ErrorRateLimiter(log, 1000);

    /**
     * @param bufferSize ring buffer capacity, must be a power of two
     * @param downstream receives each event on the relay's consumer thread
     */
    public SequencerEventRelay(int bufferSize, EventPublisher downstream) {
        this.disruptor = new Disruptor<>(
                SequencerEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(new Forwarder(downstream));
        this.ringBuffer = disruptor.start();
    }

    @Override
    public void publish(String sessionId, String eventType, Map<String, Object> payload) {
        if (!open.get()) {
            dropped.incrementAndGet();
            return;
        }
        boolean accepted = ringBuffer.tryPublishEvent(
                (event, seq, s, t, p) -> event.set(s, t, p), sessionId, eventType, payload);
        if (!accepted) {
            dropped.incrementAndGet();
            dropWarnings.warn("Sequencer event buffer full, dropping " + eventType, null);
        }
    }

    /** Events rejected because the buffer was full or the relay was closed. */
    public long droppedCount() {
        return dropped.get();
    }

    public boolean isOpen() {
        return open.get();
    }

    /** Stops accepting events and waits for the consumer to drain what was queued. */
    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            disruptor.shutdown();
            log.debug("Sequencer event relay closed, {} events dropped", dropped.get());
        }
    }

    private static final class Forwarder implements EventHandler<SequencerEvent> {
        private final EventPublisher downstream;

        Forwarder(EventPublisher downstream) {
            this.downstream = downstream;
        }

        @Override
        public void onEvent(SequencerEvent event, long sequence, boolean endOfBatch) {
            try {
                downstream.publish(event.sessionId(), event.type(), event.payload());
            } catch (RuntimeException e) {
                // Keep the consumer thread alive.
                log.error("Event consumer failed for {} of session {}: {}",
                        event.type(), event.sessionId(), e.getMessage(), e);
            } finally {
                event.clear();
            }
        }
    }
}
