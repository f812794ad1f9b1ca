package com.idp.assessment.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.idp.assessment.model.AggregatedAssessment;
import com.idp.assessment.model.AssessmentTree;
import com.idp.assessment.model.AttributeNode;
import com.idp.assessment.model.ConfidenceAlert;
import com.idp.assessment.model.ConfidenceEntry;
import com.idp.assessment.model.GroupAttribute;
import com.idp.assessment.model.LeafPath;
import com.idp.assessment.model.ListAttribute;
import com.idp.assessment.model.SimpleAttribute;
import com.idp.assessment.model.ThresholdConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the explainability tree from the collected per-leaf results.
 * <p>
 * The tree mirrors the extraction result. Each assessed leaf gets its resolved threshold:
 * the configured attribute threshold (exact path, then schema path), else the threshold declared
 * on the leaf or its nearest annotated ancestor in the schema, else the global threshold.
 */
@Service
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    static final String NOT_ASSESSED = "no task covered this attribute";

    /**
     * @param assessment aggregated tree
     * @param alerts     assessed leaves below their threshold, in tree order
     */
    public record Aggregation(AggregatedAssessment assessment, List<ConfidenceAlert> alerts) {
    }

    public Aggregation aggregate(GroupAttribute schema, JsonNode extraction,
                                 AssessmentCollector collector, ThresholdConfig thresholds) {
        List<ConfidenceAlert> alerts = new ArrayList<>();
        AssessmentTree.Branch root = group(schema, extraction, LeafPath.ROOT, List.of(schema),
                collector, thresholds, alerts);
        log.info("ResultAggregator: {} leaves aggregated, {} below threshold", collector.size(), alerts.size());
        return new Aggregation(new AggregatedAssessment(root), alerts);
    }

    private AssessmentTree.Branch group(GroupAttribute group, JsonNode value, LeafPath path, List<AttributeNode> lineage,
                                        AssessmentCollector collector, ThresholdConfig thresholds,
                                        List<ConfidenceAlert> alerts) {
        Map<String, AssessmentTree> children = new LinkedHashMap<>();
        for (AttributeNode child : group.children()) {
            JsonNode childValue = value.get(child.name());
            if (childValue == null) {
                continue;
            }
            children.put(child.name(), node(child, childValue, path.child(child.name()), extend(lineage, child),
                    collector, thresholds, alerts));
        }
        return new AssessmentTree.Branch(children);
    }

    private AssessmentTree node(AttributeNode attribute, JsonNode value, LeafPath path, List<AttributeNode> lineage,
                                AssessmentCollector collector, ThresholdConfig thresholds,
                                List<ConfidenceAlert> alerts) {
        if (attribute instanceof SimpleAttribute) {
            return leaf(path, lineage, collector, thresholds, alerts);
        }
        if (value.isNull()) {
            return AssessmentTree.Empty.INSTANCE;
        }
        if (attribute instanceof GroupAttribute group) {
            return group(group, value, path, lineage, collector, thresholds, alerts);
        }
        ListAttribute list = (ListAttribute) attribute;
        AttributeNode template = list.itemTemplate();
        List<AssessmentTree> items = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            items.add(node(template, value.get(i), path.child(i), extend(lineage, template),
                    collector, thresholds, alerts));
        }
        return new AssessmentTree.Sequence(items);
    }

    private AssessmentTree leaf(LeafPath path, List<AttributeNode> lineage, AssessmentCollector collector,
                                ThresholdConfig thresholds, List<ConfidenceAlert> alerts) {
        AssessmentTree collected = collector.get(path);
        if (collected == null) {
            log.warn("ResultAggregator: no result for {}", path);
            return new AssessmentTree.Unavailable(null, NOT_ASSESSED);
        }
        if (!(collected instanceof AssessmentTree.Assessed assessed)) {
            return collected;
        }
        Double threshold = resolveThreshold(path, lineage, thresholds);
        ConfidenceEntry entry = assessed.entry().withThreshold(threshold);
        if (threshold != null && entry.confidence() < threshold) {
            alerts.add(new ConfidenceAlert(path.toString(), entry.confidence(), threshold));
        }
        return new AssessmentTree.Assessed(entry);
    }

    static Double resolveThreshold(LeafPath path, List<AttributeNode> lineage, ThresholdConfig thresholds) {
        Double configured = thresholds.attributeThreshold(path);
        if (configured != null) {
            return configured;
        }
        for (int i = lineage.size() - 1; i >= 0; i--) {
            Double declared = lineage.get(i).confidenceThreshold();
            if (declared != null) {
                return declared;
            }
        }
        return thresholds.globalThreshold();
    }

    private static List<AttributeNode> extend(List<AttributeNode> lineage, AttributeNode node) {
        List<AttributeNode> next = new ArrayList<>(lineage.size() + 1);
        next.addAll(lineage);
        next.add(node);
        return next;
    }
}
