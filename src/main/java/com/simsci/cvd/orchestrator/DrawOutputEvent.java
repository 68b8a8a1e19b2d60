package com.simsci.cvd.orchestrator;

import com.simsci.cvd.paf.DrawOutput;

import java.util.concurrent.CompletableFuture;

/**
 * Mutable ring-buffer slot carrying one draw output to the artifact writer.
 * Slots are pre-allocated and reused; {@link #clear()} drops the references
 * once the event is handled.
 */
public final class DrawOutputEvent {
    private DrawOutput output;
    private CompletableFuture<Void> ack;

    void set(DrawOutput output, CompletableFuture<Void> ack) {
        this.output = output;
        this.ack = ack;
    }

    public DrawOutput output() {
        return output;
    }

    public CompletableFuture<Void> ack() {
        return ack;
    }

    void clear() {
        output = null;
        ack = null;
    }
}
