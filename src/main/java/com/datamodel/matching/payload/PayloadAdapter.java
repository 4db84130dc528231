package com.datamodel.matching.payload;

import com.datamodel.matching.core.model.ColumnStatistics;
import com.datamodel.matching.core.model.LogicalAttribute;
import com.datamodel.matching.core.model.LogicalEntity;
import com.datamodel.matching.core.model.LogicalModel;
import com.datamodel.matching.core.model.PhysicalColumn;
import com.datamodel.matching.core.model.PhysicalTable;
import com.datamodel.matching.core.model.RelationshipProposal;
import com.datamodel.matching.exception.ModelValidationException;
import com.datamodel.matching.relationship.ForeignKeyHint;
import com.datamodel.matching.relationship.SourceProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts loosely-typed JSON payloads from the surrounding system into the engine's
 * value records.
 *
 * <p>This is the only place that deals with payload shape. Conversion is tolerant:
 * a missing or wrongly-typed field becomes null or its default, and a list element
 * that is not an object is skipped. Only {@link #parseObject(String)} rejects input,
 * because a model that is not a JSON object cannot be analyzed at all.</p>
 */
public class PayloadAdapter {
    private static final Logger log = LoggerFactory.getLogger(PayloadAdapter.class);

    private final ObjectMapper objectMapper;

    public PayloadAdapter() {
        this(new ObjectMapper());
    }

    public PayloadAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses JSON text that must be a JSON object.
     *
     * @throws ModelValidationException if the text is not JSON or not an object
     */
    public ObjectNode parseObject(String json) {
        if (json == null || json.isBlank()) {
            throw new ModelValidationException("Model JSON is empty.");
        }
        JsonNode node;
        try {
            node = objectMapper.readerFor(JsonNode.class)
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readValue(json);
        } catch (JsonProcessingException e) {
            throw new ModelValidationException("Model JSON is not valid: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ModelValidationException("Model JSON must be a JSON object.");
        }
        return (ObjectNode) node;
    }

    /**
     * Reads a model of the form {@code {"entities": [{"name": ..., "attributes": [...]}]}}.
     * Attributes may be objects or plain names. Entities and attributes without a
     * name are skipped.
     */
    public LogicalModel toLogicalModel(JsonNode root) {
        List<LogicalEntity> entities = new ArrayList<>();
        for (JsonNode entityNode : elements(root != null ? root.get("entities") : null)) {
            if (!entityNode.isObject()) {
                continue;
            }
            String name = text(entityNode, "name");
            if (name == null) {
                continue;
            }
            List<LogicalAttribute> attributes = new ArrayList<>();
            for (JsonNode attributeNode : elements(entityNode.get("attributes"))) {
                if (attributeNode.isTextual() && !attributeNode.asText().isBlank()) {
                    attributes.add(LogicalAttribute.named(attributeNode.asText().trim()));
                } else if (attributeNode.isObject()) {
                    LogicalAttribute attribute = toAttribute(attributeNode);
                    if (!attribute.name().isBlank()) {
                        attributes.add(attribute);
                    }
                }
            }
            entities.add(new LogicalEntity(text(entityNode, "id"), name.trim(), attributes));
        }
        return new LogicalModel(entities);
    }

    /**
     * Reads attribute payloads: {@code {id, name, datatype|data_type, semantic_type, required}}.
     */
    public List<LogicalAttribute> toAttributes(JsonNode array) {
        List<LogicalAttribute> attributes = new ArrayList<>();
        for (JsonNode node : elements(array)) {
            if (node.isObject()) {
                attributes.add(toAttribute(node));
            }
        }
        return attributes;
    }

    /**
     * Reads source payloads: {@code {id, name, schema_json: {col: dtype}, stats_json: {col: stats}, row_count}}.
     * Column order follows {@code schema_json}.
     */
    public List<PhysicalTable> toTables(JsonNode array) {
        List<PhysicalTable> tables = new ArrayList<>();
        for (JsonNode node : elements(array)) {
            if (!node.isObject()) {
                continue;
            }
            JsonNode stats = node.get("stats_json");
            List<PhysicalColumn> columns = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> schema = fields(node.get("schema_json"));
            while (schema.hasNext()) {
                Map.Entry<String, JsonNode> column = schema.next();
                String dtype = column.getValue().isValueNode() && !column.getValue().isNull()
                        ? column.getValue().asText()
                        : "";
                JsonNode columnStats = stats != null && stats.isObject() ? stats.get(column.getKey()) : null;
                columns.add(new PhysicalColumn(column.getKey(), dtype, toStatistics(columnStats)));
            }
            tables.add(new PhysicalTable(text(node, "id"), text(node, "name"), columns,
                    longValue(node, "row_count")));
        }
        return tables;
    }

    /**
     * Reads a profiling statistics object. Numeric and text values are kept; nested
     * values, booleans and nulls are dropped.
     */
    public ColumnStatistics toStatistics(JsonNode node) {
        if (node == null || !node.isObject()) {
            return ColumnStatistics.empty();
        }
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            JsonNode value = field.getValue();
            if (value.isNumber()) {
                values.put(field.getKey(), value.numberValue());
            } else if (value.isTextual()) {
                values.put(field.getKey(), value.asText());
            }
        }
        return ColumnStatistics.of(values);
    }

    /**
     * Reads profiling summaries: {@code {name, row_count, foreign_keys: [...]}}.
     */
    public List<SourceProfile> toSourceProfiles(JsonNode array) {
        List<SourceProfile> profiles = new ArrayList<>();
        for (JsonNode node : elements(array)) {
            if (!node.isObject()) {
                continue;
            }
            List<ForeignKeyHint> hints = new ArrayList<>();
            for (JsonNode fk : elements(node.get("foreign_keys"))) {
                if (!fk.isObject()) {
                    continue;
                }
                Long matches = longValue(fk, "match_count", "matches");
                hints.add(new ForeignKeyHint(
                        text(fk, "column", "from_column"),
                        text(fk, "referenced_source", "to_source"),
                        text(fk, "referenced_column", "to_column"),
                        matches != null ? matches : 0L,
                        text(fk, "relationship_type", "type"),
                        text(fk, "description")
                ));
            }
            Long rowCount = longValue(node, "row_count");
            profiles.add(new SourceProfile(text(node, "name"), rowCount != null ? rowCount : 0L, hints));
        }
        return profiles;
    }

    /**
     * Reads relationship proposals, either a bare array or an object holding
     * {@code proposed_relationships}.
     */
    public List<RelationshipProposal> toRelationshipProposals(JsonNode node) {
        JsonNode array = node != null && node.isObject() ? node.get("proposed_relationships") : node;
        List<RelationshipProposal> proposals = new ArrayList<>();
        for (JsonNode item : elements(array)) {
            if (item.isObject()) {
                proposals.add(new RelationshipProposal(
                        text(item, "from"),
                        text(item, "to"),
                        text(item, "type"),
                        text(item, "rule")));
            }
        }
        return proposals;
    }

    private LogicalAttribute toAttribute(JsonNode node) {
        JsonNode required = node.get("required");
        return new LogicalAttribute(
                text(node, "id"),
                text(node, "name"),
                text(node, "datatype", "data_type"),
                text(node, "semantic_type"),
                required != null && required.asBoolean(false)
        );
    }

    /**
     * First non-blank scalar value among {@code keys}, as text.
     */
    private static String text(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && (value.isTextual() || value.isNumber()) && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private static Long longValue(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value == null) {
                continue;
            }
            if (value.isNumber()) {
                return Math.max(value.asLong(), 0L);
            }
            if (value.isTextual()) {
                try {
                    return Math.max(Long.parseLong(value.asText().trim()), 0L);
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-numeric {}='{}'", key, value.asText());
                }
            }
        }
        return null;
    }

    private static Iterable<JsonNode> elements(JsonNode node) {
        return node != null && node.isArray() ? node : List.of();
    }

    private static Iterator<Map.Entry<String, JsonNode>> fields(JsonNode node) {
        return node != null && node.isObject() ? node.fields() : Collections.emptyIterator();
    }
}
