package work.lcod.bridge.handler;

import java.util.List;
import java.util.Map;

/**
 * Capability implemented by every tool: one entry point, a closed set of named operations.
 */
public interface CommandHandler {
    Map<String, Object> execute(Map<String, Object> payload);

    List<String> supportedOperations();

    String category();

    default String version() {
        return "1.0.0";
    }
}
