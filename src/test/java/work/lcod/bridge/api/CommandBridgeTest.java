package work.lcod.bridge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.bridge.handlers.MemberCommandHandler;
import work.lcod.bridge.resolve.InMemoryObjectGraph;
import work.lcod.bridge.support.BridgeTestSupport;
import work.lcod.bridge.support.BridgeTestSupport.Light;

class CommandBridgeTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final InMemoryObjectGraph graph = BridgeTestSupport.scene(3);
    private final CommandBridge bridge = CommandBridge.create(BridgeTestSupport.context(graph));

    @Test
    void routesRequestsToTheRegisteredTool() {
        var result = bridge.execute(OperationRequest.of(MemberCommandHandler.TOOL_NAME, Map.of(
            "operation", "update",
            "targetPath", "Scene/Lights/Light0",
            "members", Map.of("intensity", 0.25)
        )));

        assertTrue(result.success());
        assertFalse(result.partialSuccess());
        assertEquals(0.25f, ((Light) graph.resolve("Scene/Lights/Light0")).getIntensity());
    }

    @Test
    void unknownToolIsAnUnsupportedOperation() {
        var result = bridge.execute(OperationRequest.of("teleport", Map.of("operation", "go")));

        assertFalse(result.success());
        assertEquals("UnsupportedOperationError", result.errorType());
        assertTrue(result.error().contains("memberManage"));
        assertTrue(result.error().contains("ping"));
    }

    @Test
    void operationNameIsFilledInWhenThePayloadOmitsIt() {
        var result = bridge.execute(new OperationRequest("ping", "ping", Map.of()));
        assertTrue(result.success());
        assertEquals("pong", result.get("message"));
    }

    @Test
    void mismatchedOperationIsAValidationError() {
        var result = bridge.execute(new OperationRequest("ping", "ping", Map.of("operation", "other")));
        assertFalse(result.success());
        assertEquals("ValidationError", result.errorType());
        assertEquals("utility", result.get("category"));
    }

    @Test
    void jsonRoundTrip() throws Exception {
        var json = bridge.executeJson(
            "{\"tool\":\"memberManage\",\"operation\":\"update\",\"targetId\":\"light-1\",\"members\":{\"range\":3,\"nope\":1}}"
        );
        Map<String, Object> response = JSON.readValue(json, new TypeReference<Map<String, Object>>() {});

        assertEquals(true, response.get("success"));
        assertEquals(true, response.get("partialSuccess"));
        assertEquals(List.of("range"), response.get("updated"));
        assertEquals(3, ((Light) graph.resolve("Scene/Lights/Light1")).getRange());
    }

    @Test
    void jsonPayloadMayBeNested() throws Exception {
        var json = bridge.executeJson("{\"tool\":\"valueConvert\",\"operation\":\"convert\",\"payload\":{\"type\":\"float\",\"value\":\"1.5\"}}");
        Map<String, Object> response = JSON.readValue(json, new TypeReference<Map<String, Object>>() {});
        assertEquals(1.5, response.get("value"));
    }

    @Test
    void malformedJsonIsReportedNotThrown() throws Exception {
        var json = bridge.executeJson("{not json");
        Map<String, Object> response = JSON.readValue(json, new TypeReference<Map<String, Object>>() {});
        assertEquals(false, response.get("success"));
        assertEquals("ValidationError", response.get("errorType"));
    }

    @Test
    void statisticsDescribeEveryTool() {
        var stats = bridge.statistics();
        assertEquals(3, stats.get("totalHandlers"));
        @SuppressWarnings("unchecked")
        var entries = (List<Map<String, Object>>) stats.get("entries");
        assertEquals("memberManage", entries.get(0).get("name"));
        assertEquals(
            List.of("update", "inspect", "updateMultiple", "inspectMultiple", "find"),
            entries.get(0).get("supportedOperations")
        );
    }

    @Test
    void resultsAlwaysCarrySuccess() {
        assertFalse(new OperationResult(Map.of()).success());
        assertEquals("{\"success\":true}", new OperationResult(Map.of("success", true)).toJson());
    }
}
