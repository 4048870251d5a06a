package work.lcod.bridge.batch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.bridge.error.ErrorEnvelopes;
import work.lcod.bridge.resolve.LiveObjectResolver;
import work.lcod.bridge.shared.WildcardPatterns;

/**
 * Resolves pattern-selected target sets and runs one operation per target, collecting errors.
 */
public final class BatchExecutor {
    public static final int DEFAULT_MAX_RESULTS = 1000;

    private static final Logger LOG = LoggerFactory.getLogger(BatchExecutor.class);

    private final LiveObjectResolver liveObjects;
    private final int defaultMaxResults;

    public BatchExecutor(LiveObjectResolver liveObjects) {
        this(liveObjects, DEFAULT_MAX_RESULTS);
    }

    public BatchExecutor(LiveObjectResolver liveObjects, int defaultMaxResults) {
        this.liveObjects = Objects.requireNonNull(liveObjects, "liveObjects");
        this.defaultMaxResults = defaultMaxResults > 0 ? defaultMaxResults : DEFAULT_MAX_RESULTS;
    }

    public int defaultMaxResults() {
        return defaultMaxResults;
    }

    /**
     * Enumerates live objects matching the pattern in enumeration order, keeping at most
     * {@code maxResults} of them. Non-positive limits fall back to the configured default.
     */
    public TargetSelection resolveTargets(String pattern, boolean useRegex, int maxResults) {
        var compiled = WildcardPatterns.compile(pattern, useRegex);
        int limit = maxResults > 0 ? maxResults : defaultMaxResults;
        List<Object> matches = liveObjects.findMatching(compiled);
        int total = matches.size();
        if (total <= limit) {
            return new TargetSelection(matches, total, false);
        }
        LOG.debug("Pattern '{}' matched {} objects, truncating to {}", pattern, total, limit);
        return new TargetSelection(matches.subList(0, limit), total, true);
    }

    public BatchResult runBatched(List<?> targets, BatchOperation operation, boolean stopOnError) {
        Objects.requireNonNull(operation, "operation");
        var results = new ArrayList<Map<String, Object>>();
        var errors = new ArrayList<Map<String, Object>>();
        int total = targets == null ? 0 : targets.size();
        boolean stopped = false;
        for (int i = 0; i < total; i++) {
            Object target = targets.get(i);
            try {
                var result = operation.apply(target);
                results.add(result == null ? Map.of() : result);
            } catch (Exception ex) {
                errors.add(errorEntry(target, ex));
                if (stopOnError) {
                    stopped = i < total - 1;
                    break;
                }
            }
        }
        return new BatchResult(total, results.size(), errors.size(), results, errors, stopped);
    }

    private Map<String, Object> errorEntry(Object target, Exception ex) {
        var entry = new LinkedHashMap<String, Object>();
        entry.put("target", liveObjects.pathOf(target).orElse(String.valueOf(target)));
        entry.put("error", ErrorEnvelopes.messageOf(ex));
        entry.put("errorType", ErrorEnvelopes.kindOf(ex).wireName());
        return entry;
    }
}
