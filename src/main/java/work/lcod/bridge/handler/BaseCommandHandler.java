package work.lcod.bridge.handler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.bridge.error.BridgeException;
import work.lcod.bridge.error.ErrorEnvelopes;
import work.lcod.bridge.error.ErrorKind;
import work.lcod.bridge.error.OperationNotSupportedException;
import work.lcod.bridge.error.TargetNotFoundException;
import work.lcod.bridge.error.ValidationException;
import work.lcod.bridge.shared.Payloads;
import work.lcod.bridge.types.TypeDescriptor;

/**
 * Template for command handlers: validates the payload, checks the operation, dispatches to
 * {@link #executeOperation}, runs the side-effect wait for mutating operations and wraps the
 * outcome in the response envelope. {@link #execute} never throws.
 */
public abstract class BaseCommandHandler implements CommandHandler {
    private static final Logger LOG = LoggerFactory.getLogger(BaseCommandHandler.class);

    protected final BridgeContext context;
    private final PayloadValidator validator;

    protected BaseCommandHandler(BridgeContext context) {
        this(context, PayloadValidator.ACCEPT_ALL);
    }

    protected BaseCommandHandler(BridgeContext context, PayloadValidator validator) {
        this.context = Objects.requireNonNull(context, "context");
        this.validator = validator == null ? PayloadValidator.ACCEPT_ALL : validator;
    }

    @Override
    public final Map<String, Object> execute(Map<String, Object> payload) {
        var trace = new StageTrace();
        try {
            var response = new LinkedHashMap<String, Object>();
            response.put("success", true);
            response.putAll(run(payload, trace));
            enter(trace, PipelineStage.COMPLETED);
            return response;
        } catch (Throwable ex) {
            PipelineStage failedAt = trace.current;
            try {
                enter(trace, PipelineStage.FAILED);
            } catch (RuntimeException hook) {
                ex.addSuppressed(hook);
            }
            if (ex instanceof BridgeException be && be.kind() != ErrorKind.HANDLER_EXECUTION) {
                LOG.debug("{} handler rejected request while {}: {}", category(), failedAt, ex.getMessage());
            } else {
                LOG.warn("{} handler failed while {}", category(), failedAt, ex);
            }
            return ErrorEnvelopes.fromThrowable(ex, category());
        }
    }

    /**
     * Called on every stage transition of a single {@link #execute} call. Stages are tracked per call;
     * the handler instance holds none.
     */
    protected void onStage(PipelineStage from, PipelineStage to) {
    }

    protected abstract Map<String, Object> executeOperation(String operation, Map<String, Object> payload) throws Exception;

    /**
     * Operations exempt from the side-effect wait.
     */
    protected boolean isReadOnly(String operation) {
        return context.configuration().readOnlyOperations().contains(operation);
    }

    private Map<String, Object> run(Map<String, Object> payload, StageTrace trace) throws Exception {
        enter(trace, PipelineStage.VALIDATING);
        if (payload == null) {
            throw new ValidationException("Payload cannot be null");
        }
        var working = new LinkedHashMap<String, Object>(payload);
        String operation = Payloads.getString(working, "operation", null);
        if (operation == null || operation.isBlank()) {
            throw new ValidationException("Operation parameter is required");
        }
        var validation = validator.validate(working, operation);
        if (validation == null || !validation.valid()) {
            var errors = validation == null ? List.<String>of() : validation.errors();
            throw new ValidationException(String.join("; ", errors));
        }
        if (validation.normalizedPayload() != null) {
            working.putAll(validation.normalizedPayload());
        }
        var supported = supportedOperations();
        if (!supported.contains(operation)) {
            throw new OperationNotSupportedException(
                "Operation '" + operation + "' is not supported. Supported operations: " + String.join(", ", supported)
            );
        }

        enter(trace, PipelineStage.DISPATCHING);
        var result = executeOperation(operation, working);
        var merged = result == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<>(result);

        if (!isReadOnly(operation)) {
            enter(trace, PipelineStage.AWAITING_SIDE_EFFECT);
            context.sideEffects().await(operation)
                .ifPresent(wait -> merged.put(context.configuration().sideEffectKey(), wait));
        }
        return merged;
    }

    private void enter(StageTrace trace, PipelineStage next) {
        PipelineStage previous = trace.current;
        LOG.debug("{} handler: {} -> {}", category(), previous, next);
        trace.current = next;
        onStage(previous, next);
    }

    protected String getString(Map<String, Object> payload, String key, String fallback) {
        return Payloads.getString(payload, key, fallback);
    }

    protected boolean getBool(Map<String, Object> payload, String key, boolean fallback) {
        return Payloads.getBool(payload, key, fallback);
    }

    protected int getInt(Map<String, Object> payload, String key, int fallback) {
        return Payloads.getInt(payload, key, fallback);
    }

    protected double getDouble(Map<String, Object> payload, String key, double fallback) {
        return Payloads.getDouble(payload, key, fallback);
    }

    protected Map<String, Object> getMap(Map<String, Object> payload, String key) {
        return Payloads.getMap(payload, key);
    }

    protected List<Object> getList(Map<String, Object> payload, String key) {
        return Payloads.getList(payload, key);
    }

    protected String requireString(Map<String, Object> payload, String key) {
        String value = getString(payload, key, null);
        if (value == null || value.isBlank()) {
            throw new ValidationException(key + " parameter is required");
        }
        return value;
    }

    protected Map<String, Object> successResponse(String message) {
        var map = new LinkedHashMap<String, Object>();
        map.put("success", true);
        if (message != null) {
            map.put("message", message);
        }
        return map;
    }

    /**
     * Soft failure reported by the handler itself; overrides the pipeline's {@code success:true}.
     */
    protected Map<String, Object> failureResponse(ErrorKind kind, String message) {
        return ErrorEnvelopes.failure(kind, message, category());
    }

    /**
     * Live object addressed by {@code targetId}, falling back to {@code targetPath}.
     */
    protected Object resolveTarget(Map<String, Object> payload) {
        var liveObjects = context.liveObjects();
        String id = getString(payload, "targetId", null);
        if (id != null && !id.isBlank()) {
            var byId = liveObjects.tryResolveById(id);
            if (byId.isPresent()) {
                return byId.get();
            }
        }
        String path = getString(payload, "targetPath", null);
        if (path != null && !path.isBlank()) {
            var byPath = liveObjects.tryResolve(path);
            if (byPath.isPresent()) {
                return byPath.get();
            }
        }
        if ((id == null || id.isBlank()) && (path == null || path.isBlank())) {
            throw new ValidationException("targetId or targetPath parameter is required");
        }
        String identifier = id != null && !id.isBlank() ? id : path;
        throw new TargetNotFoundException("Target not found: '" + identifier + "'", identifier);
    }

    protected Object resolveAsset(String identifier) {
        return context.assets().resolve(identifier);
    }

    protected TypeDescriptor resolveType(String name) {
        return context.types().resolve(name);
    }

    private static final class StageTrace {
        private PipelineStage current = PipelineStage.IDLE;
    }
}
