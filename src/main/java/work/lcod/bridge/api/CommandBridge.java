package work.lcod.bridge.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.bridge.error.ErrorEnvelopes;
import work.lcod.bridge.error.ErrorKind;
import work.lcod.bridge.error.ValidationException;
import work.lcod.bridge.handler.BridgeContext;
import work.lcod.bridge.registry.BridgeRegistry;
import work.lcod.bridge.registry.CommandRegistry;

/**
 * Entry point for remote callers: routes a request to the registered tool and returns the
 * response envelope. Never throws for request-level problems.
 */
public final class CommandBridge {
    private static final Logger LOG = LoggerFactory.getLogger(CommandBridge.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final String ROUTING_CATEGORY = "bridge";

    private final CommandRegistry registry;
    private final BridgeContext context;

    public CommandBridge(CommandRegistry registry, BridgeContext context) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Bridge over the default handler set.
     */
    public static CommandBridge create(BridgeContext context) {
        return new CommandBridge(BridgeRegistry.create(context), context);
    }

    public CommandRegistry registry() {
        return registry;
    }

    public BridgeContext context() {
        return context;
    }

    public OperationResult execute(OperationRequest request) {
        if (request == null) {
            return new OperationResult(ErrorEnvelopes.failure(ErrorKind.VALIDATION, "Request cannot be null", ROUTING_CATEGORY));
        }
        var entry = registry.tryGet(request.toolName());
        if (entry.isEmpty()) {
            String message = "Unknown tool '" + request.toolName() + "'. Registered tools: " + String.join(", ", registry.names());
            LOG.debug(message);
            return new OperationResult(ErrorEnvelopes.failure(ErrorKind.UNSUPPORTED_OPERATION, message, ROUTING_CATEGORY));
        }
        Map<String, Object> payload;
        try {
            payload = request.dispatchPayload();
        } catch (ValidationException ex) {
            return new OperationResult(ErrorEnvelopes.fromThrowable(ex, entry.get().category()));
        }
        LOG.debug("Dispatching {}.{}", request.toolName(), payload.get("operation"));
        return new OperationResult(entry.get().handler().execute(payload));
    }

    /**
     * JSON in, JSON out. The request object carries {@code tool} and the payload entries,
     * either inline or under {@code payload}.
     */
    public String executeJson(String requestJson) {
        Map<String, Object> request;
        try {
            request = requestJson == null ? null : context.json().readValue(requestJson, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            return new OperationResult(ErrorEnvelopes.failure(
                ErrorKind.VALIDATION, "Malformed request JSON: " + ex.getOriginalMessage(), ROUTING_CATEGORY
            )).toJson();
        }
        if (request == null) {
            return new OperationResult(ErrorEnvelopes.failure(ErrorKind.VALIDATION, "Request cannot be null", ROUTING_CATEGORY)).toJson();
        }
        Object tool = request.get("tool");
        Map<String, Object> payload;
        if (request.get("payload") instanceof Map<?, ?> nested) {
            payload = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : nested.entrySet()) {
                payload.put(String.valueOf(e.getKey()), e.getValue());
            }
            if (request.get("operation") != null) {
                payload.putIfAbsent("operation", request.get("operation"));
            }
        } else {
            payload = new LinkedHashMap<>(request);
            payload.remove("tool");
        }
        return execute(OperationRequest.of(tool == null ? null : tool.toString(), payload)).toJson();
    }

    public Map<String, Object> statistics() {
        return registry.statistics();
    }
}
