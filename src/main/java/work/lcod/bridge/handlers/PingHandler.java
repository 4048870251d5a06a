package work.lcod.bridge.handlers;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.bridge.handler.BaseCommandHandler;
import work.lcod.bridge.handler.BridgeContext;

/**
 * Connectivity check reporting the bridge identity.
 */
public final class PingHandler extends BaseCommandHandler {
    public static final String TOOL_NAME = "ping";

    public PingHandler(BridgeContext context) {
        super(context);
    }

    @Override
    public List<String> supportedOperations() {
        return List.of("ping");
    }

    @Override
    public String category() {
        return "utility";
    }

    @Override
    protected boolean isReadOnly(String operation) {
        return true;
    }

    @Override
    protected Map<String, Object> executeOperation(String operation, Map<String, Object> payload) {
        var config = context.configuration();
        var response = new LinkedHashMap<String, Object>();
        response.put("message", "pong");
        response.put("bridge", config.bridgeName());
        response.put("version", config.bridgeVersion());
        response.put("timestamp", Instant.now().toString());
        return response;
    }
}
