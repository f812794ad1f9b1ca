package com.idp.assessment.controller;

import com.idp.assessment.exception.ConfigurationException;
import com.idp.assessment.exception.EmptySchemaException;
import com.idp.assessment.exception.SchemaMismatchException;
import com.idp.assessment.model.AssessmentOutcome;
import com.idp.assessment.model.AssessmentRequest;
import com.idp.assessment.model.RunMetadata;
import com.idp.assessment.orchestrator.GranularAssessmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for confidence assessment of extraction results.
 */
@RestController
@RequestMapping("/api")
public class AssessmentController {

    private static final Logger log = LoggerFactory.getLogger(AssessmentController.class);

    private final GranularAssessmentService assessmentService;

    public AssessmentController(GranularAssessmentService assessmentService) {
        this.assessmentService = assessmentService;
    }

    /**
     * Assesses an extraction result against its source document.
     *
     * <p>Endpoint: POST /api/assess
     * <p>Content-Type: application/json
     */
    @PostMapping(value = "/assess", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> assess(@RequestBody AssessmentRequest request) {
        // ── Input validation ──
        if (request.schema() == null || !request.schema().isObject()) {
            return badRequest("Missing schema. Provide the JSON Schema of the document class.");
        }
        if (request.extraction() == null || !request.extraction().isObject()) {
            return badRequest("Missing extraction. Provide the extraction result as a JSON object.");
        }

        log.info("Received assessment request for document {} section {}", request.documentId(), request.sectionId());

        try {
            AssessmentOutcome outcome = assessmentService.assess(request.toDocumentContext(),
                    request.schema(), request.extraction(), request.settings());
            RunMetadata metadata = outcome.metadata();
            log.info("Token usage: {}in/{}out (tot {})", metadata.tokenUsage().inputTokens(),
                    metadata.tokenUsage().outputTokens(), metadata.tokenUsage().totalTokens());
            return ResponseEntity.ok()
                    .headers(responseHeaders(metadata))
                    .body(outcome);

        } catch (ConfigurationException | SchemaMismatchException | EmptySchemaException e) {
            log.warn("Rejected assessment of document {}: {}", request.documentId(), e.getMessage());
            return ResponseEntity.badRequest()
                    .body(Map.of(
                            "error", "Invalid assessment request",
                            "message", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()
                    ));
        } catch (Exception e) {
            log.error("Error during assessment of document {}", request.documentId(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during assessment",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "granular-assessment"
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    private HttpHeaders responseHeaders(RunMetadata metadata) {
        HttpHeaders h = new HttpHeaders();
        h.set("X-Assessment-Tasks-Total", String.valueOf(metadata.tasksTotal()));
        h.set("X-Assessment-Tasks-Failed", String.valueOf(metadata.tasksFailed()));
        h.set("X-Input-Tokens", String.valueOf(metadata.tokenUsage().inputTokens()));
        h.set("X-Output-Tokens", String.valueOf(metadata.tokenUsage().outputTokens()));
        return h;
    }
}
