package com.idp.assessment.service;

import com.idp.assessment.agent.AssessmentInvoker;
import com.idp.assessment.exception.ConfigurationException;
import com.idp.assessment.exception.InvocationException;
import com.idp.assessment.exception.InvocationTimeoutException;
import com.idp.assessment.exception.ThrottlingException;
import com.idp.assessment.model.AssessmentContext;
import com.idp.assessment.model.AssessmentTask;
import com.idp.assessment.model.ContentPart;
import com.idp.assessment.model.DynamicSegment;
import com.idp.assessment.model.LeafPath;
import com.idp.assessment.model.RawResponse;
import com.idp.assessment.model.RetryPolicy;
import com.idp.assessment.model.StaticSegment;
import com.idp.assessment.model.TaskExecution;
import com.idp.assessment.model.TaskKind;
import com.idp.assessment.model.TaskStatus;
import com.idp.assessment.model.TokenUsage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static com.idp.assessment.TestFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for bounded parallel dispatch.
 */
class AssessmentSchedulerTest {

    private static final RetryPolicy FAST_RETRY = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5));

    private final AssessmentScheduler scheduler = new AssessmentScheduler();
    private final AssessmentContext context = new AssessmentContext(
            new StaticSegment(List.of(new ContentPart.Text("static"))),
            task -> new DynamicSegment(task.id()));

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    private static List<AssessmentTask> tasks(int count) {
        List<AssessmentTask> tasks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            tasks.add(new AssessmentTask("t" + i, TaskKind.SIMPLE_BATCH, List.of(LeafPath.of("f" + i)),
                    LeafPath.ROOT, List.of(), json("{}"), null, null));
        }
        return tasks;
    }

    private static RawResponse ok(String id) {
        return new RawResponse("{\"" + id + "\": {\"confidence\": 0.9}}", new TokenUsage(10, 2));
    }

    /**
     * One failing task out of ten leaves the other nine successful.
     */
    @Test
    void failureIsIsolatedToItsTask() {
        AssessmentInvoker invoker = (s, dynamic, kind) -> {
            if (dynamic.text().equals("t4")) {
                throw new InvocationException("model error");
            }
            return ok(dynamic.text());
        };

        List<TaskExecution> results = scheduler.run(tasks(10), context, invoker, 3);

        assertThat(results).hasSize(10);
        assertThat(results).filteredOn(r -> r.outcome().succeeded()).hasSize(9);
        TaskExecution failed = results.get(4);
        assertThat(failed.outcome().status()).isEqualTo(TaskStatus.FAILED);
        assertThat(failed.outcome().error()).isEqualTo("model error");
        assertThat(failed.response()).isNull();
    }

    @Test
    void resultsKeepTaskOrder() {
        AssessmentInvoker invoker = (s, dynamic, kind) -> {
            int index = Integer.parseInt(dynamic.text().substring(1));
            try {
                Thread.sleep(30L - index * 5L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ok(dynamic.text());
        };

        List<TaskExecution> results = scheduler.run(tasks(6), context, invoker, 6);

        assertThat(results).extracting(r -> r.task().id()).containsExactly("t0", "t1", "t2", "t3", "t4", "t5");
    }

    @Test
    void concurrencyStaysWithinMaxWorkers() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        AssessmentInvoker invoker = (s, dynamic, kind) -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return ok(dynamic.text());
        };

        scheduler.run(tasks(12), context, invoker, 2);

        assertThat(peak.get()).isBetween(1, 2);
    }

    /**
     * Throttled calls are retried with backoff and succeed once the service accepts them.
     */
    @Test
    void throttlingIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        AssessmentInvoker invoker = (s, dynamic, kind) -> {
            if (calls.incrementAndGet() < 3) {
                throw new ThrottlingException("429 Too Many Requests");
            }
            return ok(dynamic.text());
        };

        List<TaskExecution> results = scheduler.run(tasks(1), context, invoker, 1, null, FAST_RETRY, e -> { });

        assertThat(results.get(0).outcome().succeeded()).isTrue();
        assertThat(results.get(0).outcome().attempts()).isEqualTo(3);
        assertThat(results.get(0).outcome().usage()).isEqualTo(new TokenUsage(10, 2));
    }

    @Test
    void throttlingGivesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        AssessmentInvoker invoker = (s, dynamic, kind) -> {
            calls.incrementAndGet();
            throw new ThrottlingException("ThrottlingException: rate exceeded");
        };

        List<TaskExecution> results = scheduler.run(tasks(1), context, invoker, 1, null, FAST_RETRY, e -> { });

        assertThat(calls.get()).isEqualTo(3);
        assertThat(results.get(0).outcome().status()).isEqualTo(TaskStatus.FAILED);
        assertThat(results.get(0).outcome().error()).startsWith("throttled after 3 attempts");
    }

    @Test
    void timeoutIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        AssessmentInvoker invoker = (s, dynamic, kind) -> {
            calls.incrementAndGet();
            throw new InvocationTimeoutException("read timed out");
        };

        List<TaskExecution> results = scheduler.run(tasks(1), context, invoker, 1, null, FAST_RETRY, e -> { });

        assertThat(calls.get()).isEqualTo(1);
        assertThat(results.get(0).outcome().status()).isEqualTo(TaskStatus.TIMED_OUT);
        assertThat(results.get(0).outcome().attempts()).isEqualTo(1);
    }

    /**
     * Once the deadline has passed, queued tasks are reported without being dispatched.
     */
    @Test
    void elapsedDeadlineStopsDispatch() {
        AtomicInteger calls = new AtomicInteger();
        AssessmentInvoker invoker = (s, dynamic, kind) -> {
            calls.incrementAndGet();
            return ok(dynamic.text());
        };

        List<TaskExecution> results = scheduler.run(tasks(4), context, invoker, 2, Duration.ZERO, FAST_RETRY, e -> { });

        assertThat(calls.get()).isZero();
        assertThat(results).allSatisfy(r -> {
            assertThat(r.outcome().status()).isEqualTo(TaskStatus.FAILED);
            assertThat(r.outcome().error()).isEqualTo(AssessmentScheduler.DEADLINE_ELAPSED);
            assertThat(r.outcome().attempts()).isZero();
        });
    }

    @Test
    void completionCallbackSeesEveryTaskWithCallerMdc() {
        MDC.put("assessmentRun", "run-42");
        Set<String> runIds = ConcurrentHashMap.newKeySet();
        List<String> completed = new CopyOnWriteArrayList<>();
        AssessmentInvoker invoker = (s, dynamic, kind) -> {
            runIds.add(String.valueOf(MDC.get("assessmentRun")));
            return ok(dynamic.text());
        };

        scheduler.run(tasks(5), context, invoker, 3, null, FAST_RETRY, e -> completed.add(e.task().id()));

        assertThat(completed).containsExactlyInAnyOrder("t0", "t1", "t2", "t3", "t4");
        assertThat(runIds).containsExactly("run-42");
    }

    @Test
    void failingCallbackDoesNotLoseTheResult() {
        List<TaskExecution> results = scheduler.run(tasks(2), context, (s, d, k) -> ok(d.text()), 2, null,
                FAST_RETRY, e -> {
                    throw new IllegalStateException("handler bug");
                });

        assertThat(results).allSatisfy(r -> assertThat(r.outcome().succeeded()).isTrue());
    }

    @Test
    void nonPositiveWorkerCountIsRejected() {
        assertThrows(ConfigurationException.class,
                () -> scheduler.run(tasks(1), context, (s, d, k) -> ok(d.text()), 0));
    }

    @Test
    void noTasksMeansNoDispatch() {
        assertThat(scheduler.run(List.of(), context, (s, d, k) -> ok(d.text()), 4)).isEmpty();
    }
}
