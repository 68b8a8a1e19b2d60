package com.simsci.cvd.orchestrator;

import com.simsci.cvd.api.ArtifactStore;
import com.simsci.cvd.paf.DrawOutput;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.EventTranslatorTwoArg;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Funnels draw outputs from any number of job threads into a single writer
 * thread through an LMAX Disruptor ring buffer.
 *
 * <p>
 * Producers call {@link #write(DrawOutput)} and get a future that completes
 * once the draw is persisted, or exceptionally if the store rejected it. A
 * job counts as done only after its future completes, so a draw is never
 * reported complete before it is on disk.
 */
public final class ArtifactWriter implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(ArtifactWriter.class);

    private static final EventTranslatorTwoArg<DrawOutputEvent, DrawOutput, CompletableFuture<Void>> TRANSLATOR =
            (event, sequence, output, ack) -> event.set(output, ack);

    private final Disruptor<DrawOutputEvent> disruptor;
    private final RingBuffer<DrawOutputEvent> ringBuffer;
    private final ArtifactStore store;
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public ArtifactWriter(ArtifactStore store, int ringBufferSize) {
        this.store = store;
        this.disruptor = new Disruptor<>(
                DrawOutputEvent::new,
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new StoreHandler());
        this.ringBuffer = disruptor.start();
    }

    /** Queues a draw for persistence. Blocks while the ring buffer is full. */
    public CompletableFuture<Void> write(DrawOutput output) {
        CompletableFuture<Void> ack = new CompletableFuture<>();
        ringBuffer.publishEvent(TRANSLATOR, output, ack);
        return ack;
    }

    public long writtenCount() {
        return written.get();
    }

    public long rejectedCount() {
        return rejected.get();
    }

    /** Drains queued events, then stops the writer thread. */
    @Override
    public void close() {
        disruptor.shutdown();
        log.info("Artifact writer stopped: {} draws written, {} rejected", written.get(), rejected.get());
    }

    private final class StoreHandler implements EventHandler<DrawOutputEvent> {
        @Override
        public void onEvent(DrawOutputEvent event, long sequence, boolean endOfBatch) {
            DrawOutput out = event.output();
            CompletableFuture<Void> ack = event.ack();
            try {
                store.writeDraw(out);
                written.incrementAndGet();
                ack.complete(null);
            } catch (Exception e) {
                // Keep the writer thread alive; the producer sees the failure on its future
                rejected.incrementAndGet();
                log.error("Failed to store draw {} of {}: {}", out.draw(), out.location(), e.getMessage(), e);
                ack.completeExceptionally(e);
            } finally {
                event.clear();
            }
        }
    }
}
