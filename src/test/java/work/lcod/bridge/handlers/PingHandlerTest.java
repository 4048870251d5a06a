package work.lcod.bridge.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.bridge.api.BridgeConfiguration;
import work.lcod.bridge.handler.BridgeContext;

class PingHandlerTest {
    @Test
    void reportsBridgeIdentity() {
        var config = BridgeConfiguration.builder().bridgeName("scene-bridge").bridgeVersion("2.1.0").build();
        var handler = new PingHandler(BridgeContext.builder().configuration(config).build());

        var response = handler.execute(Map.of("operation", "ping"));

        assertEquals(true, response.get("success"));
        assertEquals("pong", response.get("message"));
        assertEquals("scene-bridge", response.get("bridge"));
        assertEquals("2.1.0", response.get("version"));
        assertNotNull(response.get("timestamp"));
    }
}
