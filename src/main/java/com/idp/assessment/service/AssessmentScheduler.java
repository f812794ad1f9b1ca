package com.idp.assessment.service;

import com.idp.assessment.agent.AssessmentInvoker;
import com.idp.assessment.exception.ConfigurationException;
import com.idp.assessment.exception.InvocationTimeoutException;
import com.idp.assessment.exception.ThrottlingException;
import com.idp.assessment.model.AssessmentContext;
import com.idp.assessment.model.AssessmentTask;
import com.idp.assessment.model.DynamicSegment;
import com.idp.assessment.model.RawResponse;
import com.idp.assessment.model.RetryPolicy;
import com.idp.assessment.model.TaskExecution;
import com.idp.assessment.model.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs assessment tasks on a bounded worker pool.
 * <p>
 * At most {@code maxWorkers} invocations are in flight; the rest wait in the pool queue. A task
 * failure is recorded in its outcome and never stops the other tasks. Throttled calls are retried
 * with exponential backoff, timeouts are not retried. Once the run deadline has passed no queued
 * task is started any more; tasks already running are allowed to finish.
 * <p>
 * Results are returned in task order, whatever order they completed in.
 */
@Service
public class AssessmentScheduler {

    private static final Logger log = LoggerFactory.getLogger(AssessmentScheduler.class);

    static final String DEADLINE_ELAPSED = "deadline elapsed before dispatch";

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    /**
     * Runs tasks with the default retry policy, no deadline and no completion callback.
     */
    public List<TaskExecution> run(List<AssessmentTask> tasks, AssessmentContext context,
                                   AssessmentInvoker invoker, int maxWorkers) {
        return run(tasks, context, invoker, maxWorkers, null, RetryPolicy.DEFAULT, execution -> { });
    }

    /**
     * Runs tasks and blocks until every dispatched task has finished.
     *
     * @param tasks      tasks in dispatch order
     * @param context    shared request context
     * @param invoker    inference client
     * @param maxWorkers maximum concurrent invocations, at least 1
     * @param deadline   time after which queued tasks are no longer started, {@code null} for none
     * @param retry      backoff policy for throttled calls
     * @param onComplete called on the worker thread as soon as a task has finished
     * @return one execution per task, in task order
     * @throws ConfigurationException if {@code maxWorkers} is not positive
     */
    public List<TaskExecution> run(List<AssessmentTask> tasks, AssessmentContext context, AssessmentInvoker invoker,
                                   int maxWorkers, Duration deadline, RetryPolicy retry,
                                   Consumer<TaskExecution> onComplete) {
        if (maxWorkers < 1) {
            throw new ConfigurationException("max_workers must be at least 1, got " + maxWorkers);
        }
        if (tasks.isEmpty()) {
            return List.of();
        }
        RetryPolicy policy = retry != null ? retry : RetryPolicy.DEFAULT;
        Long deadlineAt = deadline == null ? null : System.nanoTime() + deadline.toNanos();
        int poolSize = Math.min(maxWorkers, tasks.size());
        log.info("AssessmentScheduler: dispatching {} tasks on {} workers", tasks.size(), poolSize);

        ExecutorService executor = Executors.newFixedThreadPool(poolSize, workerThreadFactory());
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        List<Future<TaskExecution>> futures = new ArrayList<>(tasks.size());
        try {
            for (AssessmentTask task : tasks) {
                futures.add(executor.submit(withMdc(callerMdc, () -> {
                    TaskExecution execution = execute(task, context, invoker, policy, deadlineAt);
                    notifyCompletion(onComplete, execution);
                    return execution;
                })));
            }
            return collect(tasks, futures, executor);
        } finally {
            executor.shutdown();
        }
    }

    private List<TaskExecution> collect(List<AssessmentTask> tasks, List<Future<TaskExecution>> futures,
                                        ExecutorService executor) {
        List<TaskExecution> results = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            AssessmentTask task = tasks.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
                log.warn("AssessmentScheduler: interrupted, {} tasks left unfinished", tasks.size() - i);
                for (int j = i; j < tasks.size(); j++) {
                    results.add(new TaskExecution(tasks.get(j),
                            TaskOutcome.failed(tasks.get(j).id(), "run interrupted", Duration.ZERO, 0), null));
                }
                return results;
            } catch (ExecutionException e) {
                log.error("AssessmentScheduler: task {} crashed", task.id(), e.getCause());
                results.add(new TaskExecution(task,
                        TaskOutcome.failed(task.id(), String.valueOf(e.getCause()), Duration.ZERO, 0), null));
            }
        }
        return results;
    }

    private TaskExecution execute(AssessmentTask task, AssessmentContext context, AssessmentInvoker invoker,
                                  RetryPolicy retry, Long deadlineAt) {
        long start = System.nanoTime();
        if (reached(deadlineAt, start)) {
            log.warn("AssessmentScheduler: task {} not started, {}", task.id(), DEADLINE_ELAPSED);
            return new TaskExecution(task, TaskOutcome.failed(task.id(), DEADLINE_ELAPSED, Duration.ZERO, 0), null);
        }

        DynamicSegment dynamic;
        try {
            dynamic = context.dynamicFor(task);
        } catch (RuntimeException e) {
            log.warn("AssessmentScheduler: task {} could not be rendered: {}", task.id(), e.getMessage());
            return new TaskExecution(task, TaskOutcome.failed(task.id(), e.getMessage(), elapsed(start), 0), null);
        }

        for (int attempt = 1; ; attempt++) {
            try {
                RawResponse response = invoker.invoke(context.staticSegment(), dynamic, task.kind());
                log.debug("AssessmentScheduler: task {} answered after {} attempt(s)", task.id(), attempt);
                return new TaskExecution(task,
                        TaskOutcome.succeeded(task.id(), elapsed(start), response.usage(), attempt), response);
            } catch (ThrottlingException e) {
                if (attempt >= retry.maxAttempts()) {
                    log.warn("AssessmentScheduler: task {} throttled {} times, giving up", task.id(), attempt);
                    return failed(task, "throttled after " + attempt + " attempts: " + e.getMessage(), start, attempt);
                }
                Duration backoff = retry.backoffAfter(attempt);
                if (reached(deadlineAt, System.nanoTime() + backoff.toNanos())) {
                    log.warn("AssessmentScheduler: task {} throttled, no time left before the deadline", task.id());
                    return failed(task, "throttled, deadline leaves no time to retry: " + e.getMessage(), start, attempt);
                }
                log.warn("AssessmentScheduler: task {} throttled (attempt {}/{}), retrying in {}ms",
                        task.id(), attempt, retry.maxAttempts(), backoff.toMillis());
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return failed(task, "interrupted while backing off", start, attempt);
                }
            } catch (InvocationTimeoutException e) {
                log.warn("AssessmentScheduler: task {} timed out: {}", task.id(), e.getMessage());
                return new TaskExecution(task,
                        TaskOutcome.timedOut(task.id(), e.getMessage(), elapsed(start), attempt), null);
            } catch (RuntimeException e) {
                log.warn("AssessmentScheduler: task {} failed: {}", task.id(), e.getMessage());
                return failed(task, e.getMessage(), start, attempt);
            }
        }
    }

    private static TaskExecution failed(AssessmentTask task, String error, long start, int attempts) {
        return new TaskExecution(task, TaskOutcome.failed(task.id(), error, elapsed(start), attempts), null);
    }

    private static void notifyCompletion(Consumer<TaskExecution> onComplete, TaskExecution execution) {
        try {
            onComplete.accept(execution);
        } catch (RuntimeException e) {
            log.error("AssessmentScheduler: completion handler failed for task {}", execution.task().id(), e);
        }
    }

    private static boolean reached(Long deadlineAt, long nanos) {
        return deadlineAt != null && nanos - deadlineAt >= 0;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static <T> Callable<T> withMdc(Map<String, String> mdc, Callable<T> callable) {
        return () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return callable.call();
            } finally {
                MDC.clear();
            }
        };
    }

    private static ThreadFactory workerThreadFactory() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("assessment-" + pool + "-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
