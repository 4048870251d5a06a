package work.lcod.bridge.api;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration shared by the handler pipeline and batch resolution.
 */
public record BridgeConfiguration(
    String bridgeName,
    String bridgeVersion,
    Set<String> readOnlyOperations,
    String sideEffectKey,
    int defaultMaxResults
) {
    public static final Set<String> DEFAULT_READ_ONLY_OPERATIONS =
        Set.of("inspect", "list", "find", "findMultiple", "inspectMultiple");

    public BridgeConfiguration {
        Objects.requireNonNull(bridgeName, "bridgeName");
        Objects.requireNonNull(bridgeVersion, "bridgeVersion");
        Objects.requireNonNull(readOnlyOperations, "readOnlyOperations");
        Objects.requireNonNull(sideEffectKey, "sideEffectKey");
        if (sideEffectKey.isBlank()) {
            throw new IllegalArgumentException("sideEffectKey must not be blank");
        }
        if (defaultMaxResults <= 0) {
            throw new IllegalArgumentException("defaultMaxResults must be positive");
        }
        readOnlyOperations = Collections.unmodifiableSet(new LinkedHashSet<>(readOnlyOperations));
    }

    public static BridgeConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String bridgeName = "lcod-bridge";
        private String bridgeVersion = "0.1.0";
        private Set<String> readOnlyOperations = DEFAULT_READ_ONLY_OPERATIONS;
        private String sideEffectKey = "sideEffectWait";
        private int defaultMaxResults = 1000;

        public Builder bridgeName(String bridgeName) {
            this.bridgeName = bridgeName;
            return this;
        }

        public Builder bridgeVersion(String bridgeVersion) {
            this.bridgeVersion = bridgeVersion;
            return this;
        }

        public Builder readOnlyOperations(Collection<String> readOnlyOperations) {
            this.readOnlyOperations = readOnlyOperations == null ? Set.of() : new LinkedHashSet<>(readOnlyOperations);
            return this;
        }

        public Builder sideEffectKey(String sideEffectKey) {
            this.sideEffectKey = sideEffectKey;
            return this;
        }

        public Builder defaultMaxResults(int defaultMaxResults) {
            this.defaultMaxResults = defaultMaxResults;
            return this;
        }

        public BridgeConfiguration build() {
            return new BridgeConfiguration(bridgeName, bridgeVersion, readOnlyOperations, sideEffectKey, defaultMaxResults);
        }
    }
}
