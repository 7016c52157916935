package com.strategylab.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strategylab.domain.enums.BatchJobStatus;
import com.strategylab.domain.model.BatchJobSummary;
import com.strategylab.domain.model.VariableDetail;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds a server snapshot into the client's mirror of a job.
 *
 * <p>The server is authoritative, but its responses are read defensively: a field that is
 * present and well-formed replaces the mirrored value, a field that is absent, null or of
 * the wrong shape leaves it alone. On top of that:
 * <ul>
 *   <li>{@code status} is matched case-insensitively and never moves off a terminal value</li>
 *   <li>{@code completed} never decreases</li>
 *   <li>{@code durationMs} falls back to the timestamps, then to the previous value</li>
 * </ul>
 */
public class BatchJobReconciler {

    private static final Logger log = LoggerFactory.getLogger(BatchJobReconciler.class);

    private final ObjectMapper objectMapper;

    public BatchJobReconciler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param previous the mirror as stored, or null if the client has never seen the job
     * @param response the server snapshot, envelope already removed
     * @param now      merge time, used for the duration of running jobs
     * @return a new mirror; {@code previous} is not modified
     */
    public BatchJobMirror merge(BatchJobMirror previous, JsonNode response, Instant now) {
        BatchJobMirror base = previous != null ? previous : new BatchJobMirror();
        BatchJobMirror.BatchJobMirrorBuilder merged = base.toBuilder().lastSyncedAt(now);
        if (response == null || !response.isObject()) {
            log.warn("Ignoring batch job snapshot that is not a JSON object: {}", response);
            return merged.build();
        }

        if (base.getId() == null) {
            String id = text(response, "jobId");
            merged.id(id != null ? id : text(response, "id"));
        }

        String name = text(response, "name");
        if (name != null) {
            merged.name(name);
        }

        BatchJobStatus status = mergeStatus(base.getStatus(), text(response, "status"));
        merged.status(status);

        Integer total = nonNegativeInt(response, "total");
        if (total != null) {
            merged.total(total);
        }
        Integer completed = nonNegativeInt(response, "completed");
        if (completed != null) {
            merged.completed(Math.max(base.getCompleted(), completed));
        }
        Integer failedRuns = nonNegativeInt(response, "failedRuns");
        if (failedRuns != null) {
            merged.failedRuns(Math.max(base.getFailedRuns(), failedRuns));
        }

        JsonNode truncated = response.get("truncated");
        if (truncated != null && truncated.isBoolean()) {
            merged.truncated(truncated.booleanValue());
        }

        List<VariableDetail> detail = detail(response.get("detail"), base.getDetail());
        if (detail != null) {
            merged.detail(detail);
        }

        Instant createdAt = firstNonNull(instant(response, "createdAt"), base.getCreatedAt());
        Instant completedAt = firstNonNull(instant(response, "completedAt"), base.getCompletedAt());
        merged.createdAt(createdAt)
                .completedAt(completedAt)
                .updatedAt(firstNonNull(instant(response, "updatedAt"), base.getUpdatedAt()))
                .startedAt(firstNonNull(instant(response, "startedAt"), base.getStartedAt()));

        String error = text(response, "error");
        if (error != null) {
            merged.error(error);
        }

        String viewRef = firstNonNull(text(response, "viewRef"), text(response, "viewUrl"));
        if (viewRef != null) {
            merged.viewRef(viewRef);
        }
        String csvRef = firstNonNull(text(response, "csvRef"), text(response, "csvUrl"));
        if (csvRef != null) {
            merged.csvRef(csvRef);
        }

        BatchJobSummary summary = summary(response.get("summary"));
        if (summary != null) {
            merged.summary(summary);
        }

        merged.durationMs(duration(response, status, createdAt, completedAt, base.getDurationMs(), now));
        return merged.build();
    }

    /** Case-insensitive parse; unknown values keep the previous status, terminal ones are final. */
    static BatchJobStatus mergeStatus(BatchJobStatus previous, String raw) {
        BatchJobStatus parsed = BatchJobStatus.fromValue(raw);
        if (parsed == null) {
            return previous != null ? previous : BatchJobStatus.QUEUED;
        }
        if (previous != null && previous.isTerminal()) {
            return previous;
        }
        if (previous != null && parsed.ordinal() < previous.ordinal()) {
            return previous;
        }
        return parsed;
    }

    private static Long duration(
            JsonNode response,
            BatchJobStatus status,
            Instant createdAt,
            Instant completedAt,
            Long previous,
            Instant now) {
        JsonNode server = response.get("durationMs");
        if (server != null && server.isNumber()) {
            double value = server.doubleValue();
            if (Double.isFinite(value) && value >= 0) {
                return (long) value;
            }
        }
        if (createdAt != null) {
            if (status != null && status.isTerminal()) {
                if (completedAt != null && !completedAt.isBefore(createdAt)) {
                    return Duration.between(createdAt, completedAt).toMillis();
                }
            } else if (!now.isBefore(createdAt)) {
                return Duration.between(createdAt, now).toMillis();
            }
        }
        return previous;
    }

    /**
     * Reads the detail array. Entries carrying only {@code name} and {@code count} reuse
     * the values already mirrored under the same name.
     */
    private static List<VariableDetail> detail(JsonNode node, List<VariableDetail> previous) {
        if (node == null || !node.isArray()) {
            return null;
        }
        Map<String, VariableDetail> known = new HashMap<>();
        if (previous != null) {
            previous.forEach(d -> known.put(d.getName(), d));
        }
        List<VariableDetail> result = new ArrayList<>();
        for (JsonNode entry : node) {
            String name = text(entry, "name");
            if (name == null) {
                return null;
            }
            List<String> values = new ArrayList<>();
            JsonNode valuesNode = entry.get("values");
            if (valuesNode != null && valuesNode.isArray()) {
                valuesNode.forEach(v -> values.add(v.asText()));
            } else if (known.containsKey(name) && known.get(name).getValues() != null) {
                values.addAll(known.get(name).getValues());
            }
            Integer count = nonNegativeInt(entry, "count");
            result.add(VariableDetail.builder()
                    .name(name)
                    .values(List.copyOf(values))
                    .count(count != null ? count : values.size())
                    .label(text(entry, "label"))
                    .build());
        }
        return result;
    }

    private BatchJobSummary summary(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, BatchJobSummary.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Ignoring malformed summary: {}", e.getMessage());
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private static Integer nonNegativeInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber() || !value.canConvertToInt()) {
            return null;
        }
        double number = value.doubleValue();
        if (!Double.isFinite(number) || number < 0) {
            return null;
        }
        return value.intValue();
    }

    /** ISO-8601 text or epoch milliseconds. */
    private static Instant instant(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return Instant.ofEpochMilli(value.longValue());
        }
        if (!value.isTextual()) {
            return null;
        }
        String raw = value.asText().trim();
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(raw).toInstant();
            } catch (DateTimeParseException ignored) {
                log.debug("Ignoring malformed {} '{}'", field, raw);
                return null;
            }
        }
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }
}
