package com.purchasingpower.concierge.memory.extraction;

import com.purchasingpower.concierge.memory.Fact;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Cancellation token and completion signal for one scheduled extraction.
 */
public class ExtractionHandle {

    private final String conversationId;
    private final ScheduledFuture<?> task;
    private final CompletableFuture<List<Fact>> completion;

    ExtractionHandle(String conversationId, ScheduledFuture<?> task, CompletableFuture<List<Fact>> completion) {
        this.conversationId = conversationId;
        this.task = task;
        this.completion = completion;
    }

    public String getConversationId() {
        return conversationId;
    }

    /**
     * Completes with the ingested facts, exceptionally on failure, or is cancelled.
     */
    public CompletableFuture<List<Fact>> completion() {
        return completion;
    }

    /**
     * Cancel if not started yet. A running extraction finishes.
     */
    public boolean cancel() {
        boolean cancelled = task.cancel(false);
        if (cancelled) {
            completion.cancel(false);
        }
        return cancelled;
    }

    public boolean isCancelled() {
        return completion.isCancelled();
    }
}
