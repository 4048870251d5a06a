package work.lcod.bridge.batch;

import java.util.List;

/**
 * Targets matched by a pattern, capped at the requested maximum.
 * {@code totalCount} is the number of matches before the cap.
 */
public record TargetSelection(List<Object> targets, int totalCount, boolean truncated) {
    public TargetSelection {
        targets = List.copyOf(targets);
    }
}
