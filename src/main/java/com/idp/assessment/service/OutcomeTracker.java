package com.idp.assessment.service;

import com.idp.assessment.model.RunMetadata;
import com.idp.assessment.model.TaskOutcome;
import com.idp.assessment.model.TaskStatus;
import com.idp.assessment.model.TokenUsage;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-run accumulator of task outcomes.
 *
 * <p>All counters are atomics, so outcomes may be recorded from worker threads without locking.
 * One instance per run; create it when the run starts so the elapsed time covers the whole run.
 */
public final class OutcomeTracker {

    static final int MAX_LISTED_ERRORS = 5;
    static final int MAX_PARSING_ERRORS = 10;

    private final long startNanos = System.nanoTime();

    private final AtomicInteger total = new AtomicInteger();
    private final AtomicInteger successful = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger timedOut = new AtomicInteger();
    private final AtomicInteger fromCache = new AtomicInteger();
    private final AtomicLong inputTokens = new AtomicLong();
    private final AtomicLong outputTokens = new AtomicLong();
    private final ConcurrentLinkedQueue<String> errors = new ConcurrentLinkedQueue<>();

    // ── Accumulation ─────────────────────────────────────────────────────────

    public void record(TaskOutcome outcome) {
        total.incrementAndGet();
        inputTokens.addAndGet(outcome.usage().inputTokens());
        outputTokens.addAndGet(outcome.usage().outputTokens());
        if (outcome.fromCache()) {
            fromCache.incrementAndGet();
        }
        if (outcome.succeeded()) {
            successful.incrementAndGet();
            return;
        }
        failed.incrementAndGet();
        if (outcome.status() == TaskStatus.TIMED_OUT) {
            timedOut.incrementAndGet();
        }
        errors.add("Task " + outcome.taskId() + ": " + outcome.error());
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    public int tasksFailed() {
        return failed.get();
    }

    public TokenUsage tokenUsage() {
        return new TokenUsage(inputTokens.get(), outputTokens.get());
    }

    /**
     * Snapshot of the counters as run metadata.
     *
     * @param granularUsed whether the run used the granular strategy
     */
    public RunMetadata toMetadata(boolean granularUsed) {
        double elapsed = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        String summary = summarizeErrors(new ArrayList<>(errors));
        return new RunMetadata(
                total.get(),
                successful.get(),
                failed.get(),
                timedOut.get(),
                fromCache.get(),
                elapsed,
                granularUsed,
                false,
                tokenUsage(),
                summary.isEmpty() ? null : summary);
    }

    /**
     * Joins error messages into one line: all of them when there are few, the first one plus a
     * count when there are many, and a dedicated summary past ten parsing errors.
     */
    static String summarizeErrors(List<String> messages) {
        if (messages.isEmpty()) {
            return "";
        }
        long parsing = messages.stream()
                .filter(m -> m.toLowerCase(Locale.ROOT).contains("parsing"))
                .count();
        if (parsing > MAX_PARSING_ERRORS) {
            return "Multiple parsing errors occurred: " + parsing + " parsing errors, "
                    + (messages.size() - parsing) + " other errors. "
                    + "This suggests document complexity or token limit issues.";
        }
        if (messages.size() > MAX_LISTED_ERRORS) {
            return messages.get(0) + " and " + (messages.size() - 1) + " more errors";
        }
        return String.join("; ", messages);
    }
}
