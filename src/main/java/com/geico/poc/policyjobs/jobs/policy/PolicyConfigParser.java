package com.geico.poc.policyjobs.jobs.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.geico.poc.policyjobs.config.PolicyJobsConfig;
import com.geico.poc.policyjobs.errors.JobException;
import com.geico.poc.policyjobs.routine.RoutineName;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a job's config document into its typed {@link PolicyConfig}.
 *
 * Only the shape of the document is checked here. Whether the hypertable,
 * index or aggregate it names exists is checked by the policy itself, every
 * time it is validated or run.
 */
@Component
public class PolicyConfigParser {

    public static final String HYPERTABLE_ID = "hypertable_id";
    public static final String MAT_HYPERTABLE_ID = "mat_hypertable_id";
    public static final String DROP_AFTER = "drop_after";
    public static final String INDEX_NAME = "index_name";
    public static final String COMPRESS_AFTER = "compress_after";
    public static final String START_OFFSET = "start_offset";
    public static final String END_OFFSET = "end_offset";

    @Autowired
    private PolicyJobsConfig config;

    public PolicyConfigParser() {
    }

    public PolicyConfigParser(PolicyJobsConfig config) {
        this.config = config;
    }

    public PolicyKind kindOf(RoutineName routine) {
        return PolicyKind.forRoutine(config.getInternalSchema(), routine);
    }

    public PolicyConfig parse(RoutineName routine, JsonNode document) {
        return parse(kindOf(routine), document);
    }

    public PolicyConfig parse(PolicyKind kind, JsonNode document) {
        if (kind == PolicyKind.CUSTOM) {
            return new CustomConfig(isNull(document) ? null : document.deepCopy());
        }
        if (isNull(document)) {
            throw JobException.invalidParameter("config must not be NULL");
        }
        if (!document.isObject()) {
            throw JobException.invalidParameter("config must be a JSON object",
                "Got a JSON " + document.getNodeType().name().toLowerCase() + ".", null);
        }

        switch (kind) {
            case RETENTION:
                return new RetentionConfig(
                    requireInt(document, HYPERTABLE_ID),
                    requireOffset(document, DROP_AFTER));
            case REORDER:
                return new ReorderConfig(
                    requireInt(document, HYPERTABLE_ID),
                    requireText(document, INDEX_NAME));
            case COMPRESSION:
                return new CompressionConfig(
                    requireInt(document, HYPERTABLE_ID),
                    requireOffset(document, COMPRESS_AFTER));
            case CONTINUOUS_AGG_REFRESH:
                return new ContinuousAggRefreshConfig(
                    requireInt(document, MAT_HYPERTABLE_ID),
                    optionalOffset(document, START_OFFSET),
                    optionalOffset(document, END_OFFSET));
            default:
                throw new IllegalStateException("unhandled policy kind " + kind);
        }
    }

    private static int requireInt(JsonNode document, String field) {
        JsonNode node = requireField(document, field);
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw invalidValue(field, node);
            }
        }
        throw invalidValue(field, node);
    }

    private static String requireText(JsonNode document, String field) {
        JsonNode node = requireField(document, field);
        if (!node.isTextual() || node.textValue().isEmpty()) {
            throw invalidValue(field, node);
        }
        return node.textValue();
    }

    private static TimeOffset requireOffset(JsonNode document, String field) {
        return toOffset(field, requireField(document, field));
    }

    private static TimeOffset optionalOffset(JsonNode document, String field) {
        JsonNode node = document.get(field);
        return isNull(node) ? null : toOffset(field, node);
    }

    private static TimeOffset toOffset(String field, JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return TimeOffset.ofInteger(node.longValue());
        }
        if (node.isTextual()) {
            return TimeOffset.parse(node.textValue());
        }
        throw invalidValue(field, node);
    }

    private static JsonNode requireField(JsonNode document, String field) {
        JsonNode node = document.get(field);
        if (isNull(node)) {
            throw JobException.invalidParameter(String.format("could not find \"%s\" in config for job", field));
        }
        return node;
    }

    private static JobException invalidValue(String field, JsonNode node) {
        return JobException.invalidParameter(
            String.format("invalid value for \"%s\" in config for job", field),
            "Got " + node + ".", null);
    }

    static boolean isNull(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
