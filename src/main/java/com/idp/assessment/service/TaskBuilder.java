package com.idp.assessment.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.idp.assessment.exception.EmptySchemaException;
import com.idp.assessment.exception.InvalidBatchSizeException;
import com.idp.assessment.model.AssessmentSettings;
import com.idp.assessment.model.AssessmentTask;
import com.idp.assessment.model.AttributeNode;
import com.idp.assessment.model.GroupAttribute;
import com.idp.assessment.model.LeafPath;
import com.idp.assessment.model.ListAttribute;
import com.idp.assessment.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Partitions the leaves of an extraction result into assessment tasks.
 * <p>
 * Every leaf ends up in exactly one task:
 * <ul>
 *   <li>leaves of root-level simple attributes are batched into {@link TaskKind#SIMPLE_BATCH} tasks;</li>
 *   <li>leaves below a root-level group, but not below a list, form one {@link TaskKind#GROUP} task per group;</li>
 *   <li>leaves below a list are grouped by item of the outermost list into {@link TaskKind#LIST_ITEM} tasks.</li>
 * </ul>
 * Tasks come out as simple batches, then groups, then list items, each in schema order.
 */
@Service
public class TaskBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaskBuilder.class);

    static final String DOCUMENT_TASK_ID = "document";

    /**
     * Builds the granular task list.
     *
     * @param leafPaths  leaves returned by {@link SchemaAnalyzer}, in schema order
     * @param schema     root group
     * @param extraction extraction result the leaves were taken from
     * @param settings   batch sizes
     * @return tasks in dispatch order
     * @throws InvalidBatchSizeException if a batch size is not positive
     * @throws EmptySchemaException      if there is nothing to assess
     */
    public List<AssessmentTask> build(List<LeafPath> leafPaths, GroupAttribute schema,
                                      JsonNode extraction, AssessmentSettings settings) {
        validateBatchSizes(settings);
        if (leafPaths.isEmpty()) {
            throw new EmptySchemaException("No assessable attributes found in extraction result");
        }

        List<LeafPath> rootSimple = new ArrayList<>();
        Map<String, List<LeafPath>> byGroup = new LinkedHashMap<>();
        Map<LeafPath, TreeMap<Integer, List<LeafPath>>> byList = new LinkedHashMap<>();

        for (LeafPath leaf : leafPaths) {
            int indexStep = SchemaPaths.firstIndexStep(leaf);
            if (indexStep >= 0) {
                LeafPath listPath = new LeafPath(leaf.steps().subList(0, indexStep));
                int item = ((LeafPath.Index) leaf.steps().get(indexStep)).value();
                byList.computeIfAbsent(listPath, k -> new TreeMap<>())
                        .computeIfAbsent(item, k -> new ArrayList<>())
                        .add(leaf);
            } else if (leaf.depth() == 1) {
                rootSimple.add(leaf);
            } else {
                String group = ((LeafPath.Key) leaf.steps().get(0)).name();
                byGroup.computeIfAbsent(group, k -> new ArrayList<>()).add(leaf);
            }
        }

        List<AssessmentTask> tasks = new ArrayList<>();
        int counter = 0;

        int batchSize = settings.simpleBatchSize();
        for (int start = 0; start < rootSimple.size(); start += batchSize) {
            List<LeafPath> batch = rootSimple.subList(start, Math.min(start + batchSize, rootSimple.size()));
            tasks.add(simpleBatchTask("simple_batch_" + counter++, batch, schema, extraction));
        }
        int simpleBatches = tasks.size();

        for (Map.Entry<String, List<LeafPath>> entry : byGroup.entrySet()) {
            tasks.add(groupTask("group_" + counter++, entry.getKey(), entry.getValue(), schema, extraction));
        }

        for (Map.Entry<LeafPath, TreeMap<Integer, List<LeafPath>>> entry : byList.entrySet()) {
            tasks.addAll(listItemTasks(entry.getKey(), entry.getValue(), settings.listBatchSize(), schema, extraction));
        }

        log.info("TaskBuilder: {} leaves -> {} tasks ({} simple batches, {} groups, {} list item tasks)",
                leafPaths.size(), tasks.size(), simpleBatches, byGroup.size(),
                tasks.size() - simpleBatches - byGroup.size());
        return tasks;
    }

    /**
     * Builds the single task used when granular assessment is switched off.
     */
    public AssessmentTask buildDocumentTask(List<LeafPath> leafPaths, GroupAttribute schema, JsonNode extraction) {
        if (leafPaths.isEmpty()) {
            throw new EmptySchemaException("No assessable attributes found in extraction result");
        }
        return new AssessmentTask(DOCUMENT_TASK_ID, TaskKind.DOCUMENT, leafPaths, LeafPath.ROOT,
                schema.children(), extraction, null, null);
    }

    static void validateBatchSizes(AssessmentSettings settings) {
        if (settings.simpleBatchSize() <= 0) {
            throw new InvalidBatchSizeException("simple_batch_size", settings.simpleBatchSize());
        }
        if (settings.listBatchSize() <= 0) {
            throw new InvalidBatchSizeException("list_batch_size", settings.listBatchSize());
        }
    }

    private AssessmentTask simpleBatchTask(String id, List<LeafPath> batch, GroupAttribute schema, JsonNode extraction) {
        ObjectNode slice = JsonNodeFactory.instance.objectNode();
        List<AttributeNode> attributes = new ArrayList<>(batch.size());
        for (LeafPath leaf : batch) {
            String name = ((LeafPath.Key) leaf.steps().get(0)).name();
            slice.set(name, extraction.get(name));
            attributes.add(schema.child(name));
        }
        return new AssessmentTask(id, TaskKind.SIMPLE_BATCH, batch, LeafPath.ROOT, attributes, slice, null, null);
    }

    private AssessmentTask groupTask(String id, String groupName, List<LeafPath> leaves,
                                     GroupAttribute schema, JsonNode extraction) {
        GroupAttribute group = SchemaPaths.withoutLists((GroupAttribute) schema.child(groupName));
        ObjectNode slice = JsonNodeFactory.instance.objectNode();
        slice.set(groupName, withoutLists(group, extraction.get(groupName)));
        return new AssessmentTask(id, TaskKind.GROUP, leaves, LeafPath.of(groupName), List.of(group), slice, null, null);
    }

    private List<AssessmentTask> listItemTasks(LeafPath listPath, TreeMap<Integer, List<LeafPath>> items, int batchSize,
                                               GroupAttribute schema, JsonNode extraction) {
        List<AttributeNode> lineage = SchemaPaths.lineage(schema, listPath);
        ListAttribute list = (ListAttribute) lineage.get(lineage.size() - 1);
        JsonNode listValue = valueAt(extraction, listPath);
        String prefix = "list_" + listPath.schemaPath();

        List<Integer> indices = new ArrayList<>(items.keySet());
        List<AssessmentTask> tasks = new ArrayList<>();
        for (int start = 0; start < indices.size(); start += batchSize) {
            List<Integer> chunk = indices.subList(start, Math.min(start + batchSize, indices.size()));
            int first = chunk.get(0);
            int end = chunk.get(chunk.size() - 1) + 1;

            List<LeafPath> leaves = new ArrayList<>();
            ArrayNode slice = JsonNodeFactory.instance.arrayNode();
            for (int index : chunk) {
                leaves.addAll(items.get(index));
            }
            for (int index = first; index < end; index++) {
                slice.add(listValue.get(index));
            }
            String id = chunk.size() == 1
                    ? prefix + "_item_" + first
                    : prefix + "_items_" + first + "-" + (end - 1);
            tasks.add(new AssessmentTask(id, TaskKind.LIST_ITEM, leaves, listPath, List.of(list), slice, first, end));
        }
        return tasks;
    }

    private static JsonNode withoutLists(GroupAttribute group, JsonNode value) {
        if (value == null || !value.isObject()) {
            return value;
        }
        ObjectNode copy = JsonNodeFactory.instance.objectNode();
        for (AttributeNode child : group.children()) {
            JsonNode childValue = value.get(child.name());
            if (childValue == null) {
                continue;
            }
            copy.set(child.name(), child instanceof GroupAttribute nested ? withoutLists(nested, childValue) : childValue);
        }
        return copy;
    }

    static JsonNode valueAt(JsonNode root, LeafPath path) {
        JsonNode current = root;
        for (LeafPath.Step step : path.steps()) {
            if (current == null) {
                return null;
            }
            current = step instanceof LeafPath.Key key
                    ? current.get(key.name())
                    : current.get(((LeafPath.Index) step).value());
        }
        return current;
    }
}
