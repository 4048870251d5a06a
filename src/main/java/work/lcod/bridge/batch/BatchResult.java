package work.lcod.bridge.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of a batched operation. Per-target failures are collected in {@code errors}
 * and never abort the batch unless stop-on-error was requested.
 */
public record BatchResult(
    int totalCount,
    int successCount,
    int errorCount,
    List<Map<String, Object>> results,
    List<Map<String, Object>> errors,
    boolean stoppedEarly
) {
    public BatchResult {
        results = Collections.unmodifiableList(List.copyOf(results));
        errors = Collections.unmodifiableList(List.copyOf(errors));
    }

    public int processedCount() {
        return successCount + errorCount;
    }

    public Map<String, Object> toResponseFields() {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("totalCount", totalCount);
        fields.put("processedCount", processedCount());
        fields.put("successCount", successCount);
        fields.put("errorCount", errorCount);
        fields.put("stoppedEarly", stoppedEarly);
        fields.put("results", results);
        if (!errors.isEmpty()) {
            fields.put("errors", errors);
        }
        return fields;
    }
}
