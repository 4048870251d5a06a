package work.lcod.bridge.member;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate of a multi-member update. A member lands in exactly one of the two collections.
 */
public record MemberApplyResult(Set<String> updated, Map<String, String> failed) {
    public MemberApplyResult {
        updated = Collections.unmodifiableSet(new LinkedHashSet<>(updated));
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }

    public static MemberApplyResult of(List<MemberOutcome> outcomes) {
        var updated = new LinkedHashSet<String>();
        var failed = new LinkedHashMap<String, String>();
        for (MemberOutcome outcome : outcomes) {
            if (outcome.isApplied()) {
                failed.remove(outcome.member());
                updated.add(outcome.member());
            } else {
                updated.remove(outcome.member());
                failed.put(outcome.member(), outcome.message());
            }
        }
        return new MemberApplyResult(updated, failed);
    }

    public boolean partialSuccess() {
        return !updated.isEmpty() && !failed.isEmpty();
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    /**
     * Response entries: {@code updated} always, {@code failed} and {@code partialSuccess} when something failed.
     */
    public Map<String, Object> toResponseFields() {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("updated", List.copyOf(updated));
        if (!failed.isEmpty()) {
            fields.put("failed", new LinkedHashMap<>(failed));
            fields.put("partialSuccess", partialSuccess());
        }
        return fields;
    }
}
