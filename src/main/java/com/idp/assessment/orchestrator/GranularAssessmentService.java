package com.idp.assessment.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.idp.assessment.agent.AssessmentInvoker;
import com.idp.assessment.config.AssessmentProperties;
import com.idp.assessment.exception.ConfigurationException;
import com.idp.assessment.exception.InvalidBatchSizeException;
import com.idp.assessment.exception.ParsingException;
import com.idp.assessment.model.AssessmentContext;
import com.idp.assessment.model.AssessmentOutcome;
import com.idp.assessment.model.AssessmentSettings;
import com.idp.assessment.model.AssessmentTask;
import com.idp.assessment.model.ConfidenceEntry;
import com.idp.assessment.model.DocumentContext;
import com.idp.assessment.model.GroupAttribute;
import com.idp.assessment.model.LeafPath;
import com.idp.assessment.model.RawResponse;
import com.idp.assessment.model.RunMetadata;
import com.idp.assessment.model.TaskExecution;
import com.idp.assessment.model.TaskOutcome;
import com.idp.assessment.service.AssessmentCollector;
import com.idp.assessment.service.AssessmentScheduler;
import com.idp.assessment.service.ContextBuilder;
import com.idp.assessment.service.OutcomeTracker;
import com.idp.assessment.service.ResponseParser;
import com.idp.assessment.service.ResultAggregator;
import com.idp.assessment.service.SchemaAnalyzer;
import com.idp.assessment.service.SchemaParser;
import com.idp.assessment.service.TaskBuilder;
import com.idp.assessment.service.TaskResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Granular assessment pipeline.
 * Pipeline:
 * 1. Configuration check and schema parsing
 * 2. Leaf discovery in the extraction result
 * 3. Task partitioning (or a single document task when granular mode is off)
 * 4. Request context (static segment + per-task template)
 * 5. Cached results reuse, then parallel dispatch of the remaining tasks
 * 6. Aggregation, alerts and cache bookkeeping
 */
@Service
public class GranularAssessmentService {

    private static final Logger log = LoggerFactory.getLogger(GranularAssessmentService.class);

    public static final String MDC_RUN_ID = "assessmentRun";

    private final SchemaParser schemaParser;
    private final SchemaAnalyzer schemaAnalyzer;
    private final TaskBuilder taskBuilder;
    private final ContextBuilder contextBuilder;
    private final AssessmentScheduler scheduler;
    private final ResponseParser responseParser;
    private final ResultAggregator resultAggregator;
    private final AssessmentInvoker invoker;
    private final TaskResultCache taskResultCache;
    private final AssessmentSettings defaultSettings;

    public GranularAssessmentService(SchemaParser schemaParser,
                                     SchemaAnalyzer schemaAnalyzer,
                                     TaskBuilder taskBuilder,
                                     ContextBuilder contextBuilder,
                                     AssessmentScheduler scheduler,
                                     ResponseParser responseParser,
                                     ResultAggregator resultAggregator,
                                     AssessmentInvoker invoker,
                                     TaskResultCache taskResultCache,
                                     AssessmentProperties properties) {
        this.schemaParser = schemaParser;
        this.schemaAnalyzer = schemaAnalyzer;
        this.taskBuilder = taskBuilder;
        this.contextBuilder = contextBuilder;
        this.scheduler = scheduler;
        this.responseParser = responseParser;
        this.resultAggregator = resultAggregator;
        this.invoker = invoker;
        this.taskResultCache = taskResultCache;
        this.defaultSettings = properties.toSettings();
    }

    public AssessmentSettings defaultSettings() {
        return defaultSettings;
    }

    /**
     * Assesses with the configured settings, optionally overridden per request.
     */
    public AssessmentOutcome assess(DocumentContext document, JsonNode schema, JsonNode extraction,
                                    AssessmentSettings.Overrides overrides) {
        return assess(document, schema, extraction, defaultSettings.merge(overrides));
    }

    /**
     * Runs one assessment.
     *
     * @param document   document the extraction was produced from
     * @param schema     JSON Schema of the document class
     * @param extraction extraction result to assess
     * @param settings   effective settings of this run
     * @return aggregated assessment, run metadata, alerts and per-task outcomes
     * @throws com.idp.assessment.exception.ConfigurationException  on invalid settings or prompt template
     * @throws com.idp.assessment.exception.SchemaMismatchException if the extraction does not fit the schema
     * @throws com.idp.assessment.exception.EmptySchemaException    if there is nothing to assess
     */
    public AssessmentOutcome assess(DocumentContext document, JsonNode schema, JsonNode extraction,
                                    AssessmentSettings settings) {
        if (!settings.enabled()) {
            log.info("Assessment disabled, skipping section {}", document.sectionId());
            return AssessmentOutcome.skipped();
        }

        String previousRunId = MDC.get(MDC_RUN_ID);
        MDC.put(MDC_RUN_ID, UUID.randomUUID().toString().substring(0, 8));
        try {
            return run(document, schema, extraction, settings);
        } finally {
            if (previousRunId != null) {
                MDC.put(MDC_RUN_ID, previousRunId);
            } else {
                MDC.remove(MDC_RUN_ID);
            }
        }
    }

    private AssessmentOutcome run(DocumentContext document, JsonNode schema, JsonNode extraction,
                                  AssessmentSettings settings) {
        OutcomeTracker tracker = new OutcomeTracker();
        log.info("═══════════════════════════════════════════════");
        log.info("Starting assessment of document {} section {} (class '{}', granular={})",
                document.documentId(), document.sectionId(), document.classLabel(), settings.granular());
        log.info("═══════════════════════════════════════════════");

        // ── Step 1: Configuration + schema ──
        log.info("[1/6] Validating configuration and parsing schema...");
        validate(settings);
        GroupAttribute root = schemaParser.parse(schema);
        log.info("[1/6] Schema parsed: {} root attributes", root.children().size());

        // ── Step 2: Leaf discovery ──
        log.info("[2/6] Analyzing extraction result...");
        List<LeafPath> leaves = schemaAnalyzer.analyze(root, extraction);
        log.info("[2/6] {} assessable leaves", leaves.size());

        // ── Step 3: Tasks ──
        log.info("[3/6] Building tasks...");
        List<AssessmentTask> tasks = settings.granular()
                ? taskBuilder.build(leaves, root, extraction, settings)
                : List.of(taskBuilder.buildDocumentTask(leaves, root, extraction));
        log.info("[3/6] {} tasks built", tasks.size());

        // ── Step 4: Request context ──
        log.info("[4/6] Building request context...");
        AssessmentContext context = contextBuilder.build(document, root, settings);
        log.info("[4/6] Static segment: {} parts, {} images",
                context.staticSegment().parts().size(), context.staticSegment().images().size());

        // ── Step 5: Cache + dispatch ──
        AssessmentCollector collector = new AssessmentCollector();
        Map<String, TaskOutcome> outcomes = new ConcurrentHashMap<>();
        Map<String, RawResponse> cached = taskResultCache.load(document.documentId(), document.sectionId());
        List<AssessmentTask> pending = new ArrayList<>();
        for (AssessmentTask task : tasks) {
            RawResponse response = cached.get(task.id());
            if (response != null && restoreFromCache(task, response, collector)) {
                outcomes.put(task.id(), TaskOutcome.cached(task.id(), response.usage()));
            } else {
                pending.add(task);
            }
        }
        log.info("[5/6] Dispatching {} tasks ({} restored from cache, max {} workers)...",
                pending.size(), tasks.size() - pending.size(), settings.maxWorkers());

        List<TaskExecution> executions = scheduler.run(pending, context, invoker, settings.maxWorkers(),
                settings.deadline(), settings.retry(), execution -> complete(execution, collector, outcomes));

        List<TaskExecution> succeeded = new ArrayList<>();
        for (TaskExecution execution : executions) {
            TaskOutcome outcome = outcomes.get(execution.task().id());
            if (outcome == null) {
                outcome = execution.outcome().succeeded()
                        ? execution.outcome().asFailure("result handling failed")
                        : execution.outcome();
                outcomes.put(execution.task().id(), outcome);
            }
            if (outcome.succeeded()) {
                succeeded.add(execution);
            }
        }
        List<TaskOutcome> ordered = tasks.stream().map(task -> outcomes.get(task.id())).toList();
        ordered.forEach(tracker::record);
        log.info("[5/6] Dispatch completed: {}/{} tasks failed", tracker.tasksFailed(), tasks.size());

        // ── Step 6: Aggregation ──
        log.info("[6/6] Aggregating results...");
        ResultAggregator.Aggregation aggregation =
                resultAggregator.aggregate(root, extraction, collector, settings.thresholds());
        if (tracker.tasksFailed() > 0) {
            taskResultCache.store(document.documentId(), document.sectionId(), succeeded);
        } else if (!cached.isEmpty()) {
            taskResultCache.evict(document.documentId(), document.sectionId());
        }
        RunMetadata metadata = tracker.toMetadata(settings.granular());
        log.info("[6/6] Aggregation completed: {} alerts", aggregation.alerts().size());

        log.info("═══════════════════════════════════════════════");
        log.info("Assessment completed: {} tasks, {} successful, {} failed, {} tokens, {}s",
                metadata.tasksTotal(), metadata.tasksSuccessful(), metadata.tasksFailed(),
                metadata.tokenUsage().totalTokens(), String.format("%.2f", metadata.elapsedSeconds()));
        log.info("═══════════════════════════════════════════════");

        return new AssessmentOutcome(aggregation.assessment(), metadata, aggregation.alerts(), ordered);
    }

    /** Runs on the worker thread that finished the task. */
    private void complete(TaskExecution execution, AssessmentCollector collector, Map<String, TaskOutcome> outcomes) {
        AssessmentTask task = execution.task();
        TaskOutcome outcome = execution.outcome();
        if (!outcome.succeeded()) {
            collector.markUnavailable(task, outcome.error());
            outcomes.put(task.id(), outcome);
            return;
        }
        try {
            Map<LeafPath, ConfidenceEntry> entries = responseParser.parse(task, execution.response());
            collector.record(task.id(), entries);
        } catch (ParsingException e) {
            String reason = "Parsing error: " + e.getMessage();
            log.warn("Task {} answered but could not be parsed: {}", task.id(), e.getMessage());
            collector.markUnavailable(task, reason);
            outcome = outcome.asFailure(reason);
        }
        outcomes.put(task.id(), outcome);
    }

    private boolean restoreFromCache(AssessmentTask task, RawResponse response, AssessmentCollector collector) {
        try {
            collector.record(task.id(), responseParser.parse(task, response));
            return true;
        } catch (ParsingException e) {
            log.warn("Cached result of task {} is unusable, dispatching again: {}", task.id(), e.getMessage());
            return false;
        }
    }

    private static void validate(AssessmentSettings settings) {
        if (settings.maxWorkers() < 1) {
            throw new ConfigurationException("max_workers must be at least 1, got " + settings.maxWorkers());
        }
        if (settings.simpleBatchSize() <= 0) {
            throw new InvalidBatchSizeException("simple_batch_size", settings.simpleBatchSize());
        }
        if (settings.listBatchSize() <= 0) {
            throw new InvalidBatchSizeException("list_batch_size", settings.listBatchSize());
        }
    }
}
