package work.lcod.bridge.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.bridge.resolve.InMemoryObjectGraph;
import work.lcod.bridge.support.BridgeTestSupport;
import work.lcod.bridge.support.BridgeTestSupport.Light;

class MemberCommandHandlerTest {
    private final InMemoryObjectGraph graph = BridgeTestSupport.scene(10);
    private final MemberCommandHandler handler = new MemberCommandHandler(BridgeTestSupport.context(graph));

    @Test
    void updateReportsPartialSuccess() {
        var members = new LinkedHashMap<String, Object>();
        members.put("intensity", 4);
        members.put("color", Map.of("r", 1));
        members.put("mode", "spot");
        members.put("missing", 1);

        var response = handler.execute(Map.of(
            "operation", "update",
            "targetPath", "Scene/Lights/Light3",
            "members", members
        ));

        assertEquals(true, response.get("success"));
        assertEquals("Scene/Lights/Light3", response.get("target"));
        assertEquals(List.of("intensity", "color", "mode"), response.get("updated"));
        assertEquals(Map.of("missing", "Member 'missing' not found on type Light"), response.get("failed"));
        assertEquals(true, response.get("partialSuccess"));

        var light = (Light) graph.resolve("Scene/Lights/Light3");
        assertEquals(4f, light.getIntensity());
        assertEquals(1f, light.getColor().getR());
    }

    @Test
    void corruptFieldDoesNotBlockTheOthers() {
        var members = new LinkedHashMap<String, Object>();
        members.put("name", "Renamed");
        members.put("range", "not-a-number");
        members.put("enabled", false);

        var response = handler.execute(Map.of("operation", "update", "targetId", "light-2", "members", members));

        assertEquals(true, response.get("success"));
        assertEquals(true, response.get("partialSuccess"));
        @SuppressWarnings("unchecked")
        var failed = (Map<String, Object>) response.get("failed");
        assertTrue(failed.containsKey("range"));
        assertEquals("Renamed", ((Light) graph.resolve("Scene/Lights/Light2")).getName());
    }

    @Test
    void updateRequiresMembersAndTarget() {
        var noMembers = handler.execute(Map.of("operation", "update", "targetPath", "Scene/Lights/Light0"));
        assertEquals(false, noMembers.get("success"));
        assertEquals("ValidationError", noMembers.get("errorType"));
        assertEquals("Required parameter 'members' is missing", noMembers.get("error"));

        var noTarget = handler.execute(Map.of("operation", "update", "targetPath", "Nope", "members", Map.of("name", "x")));
        assertEquals("TargetNotFoundError", noTarget.get("errorType"));
        assertEquals("member", noTarget.get("category"));
    }

    @Test
    void inspectReturnsVisibleMembers() {
        var response = handler.execute(Map.of(
            "operation", "inspect",
            "targetPath", "Scene/Lights/Light1",
            "members", List.of("name", "mode", "cacheSlot")
        ));

        assertEquals(true, response.get("success"));
        assertEquals("Light", response.get("type"));
        assertEquals(Map.of("name", "Light1", "mode", "Point"), response.get("members"));
    }

    @Test
    void updateMultipleTruncatesAndAggregates() {
        var response = handler.execute(Map.of(
            "operation", "updateMultiple",
            "pattern", "Light*",
            "maxResults", 4,
            "members", Map.of("range", 50)
        ));

        assertEquals(true, response.get("success"));
        assertEquals(10, response.get("totalCount"));
        assertEquals(true, response.get("truncated"));
        assertEquals(4, ((List<?>) response.get("results")).size());
        assertEquals(4, response.get("successCount"));
        assertEquals(0, response.get("errorCount"));
        assertEquals(50, ((Light) graph.resolve("Scene/Lights/Light3")).getRange());
        assertEquals(10, ((Light) graph.resolve("Scene/Lights/Light4")).getRange());
    }

    @Test
    void updateMultipleCollectsTargetsWhereNothingApplied() {
        var response = handler.execute(Map.of(
            "operation", "updateMultiple",
            "pattern", "Scene/*",
            "members", Map.of("range", 5)
        ));

        assertEquals(true, response.get("success"));
        assertEquals(11, response.get("totalCount"));
        assertEquals(10, response.get("successCount"));
        assertEquals(1, response.get("errorCount"));
        @SuppressWarnings("unchecked")
        var errors = (List<Map<String, Object>>) response.get("errors");
        assertEquals("Scene/Pivot", errors.get(0).get("target"));
        assertEquals("ValidationError", errors.get(0).get("errorType"));
    }

    @Test
    void stopOnErrorEndsTheBatchEarly() {
        var ordered = new InMemoryObjectGraph()
            .add("Pivot", new BridgeTestSupport.SceneNode())
            .add("Lamp0", new Light())
            .add("Lamp1", new Light());
        var scoped = new MemberCommandHandler(BridgeTestSupport.context(ordered));

        var response = scoped.execute(Map.of(
            "operation", "updateMultiple",
            "pattern", "^(Pivot|Lamp\\d)$",
            "useRegex", true,
            "stopOnError", true,
            "members", Map.of("range", 5)
        ));

        assertEquals(true, response.get("success"));
        assertEquals(3, response.get("totalCount"));
        assertEquals(0, response.get("successCount"));
        assertEquals(1, response.get("errorCount"));
        assertEquals(1, response.get("processedCount"));
        assertEquals(true, response.get("stoppedEarly"));
        assertEquals(10, ((Light) ordered.resolve("Lamp0")).getRange());
    }

    @Test
    void findListsMatchingPaths() {
        var response = handler.execute(Map.of("operation", "find", "pattern", "light[0-2]", "useRegex", true));

        assertEquals(3, response.get("count"));
        assertEquals(false, response.get("truncated"));
        @SuppressWarnings("unchecked")
        var matches = (List<Map<String, Object>>) response.get("matches");
        assertEquals(Map.of("path", "Scene/Lights/Light0", "type", "Light"), matches.get(0));
    }

    @Test
    void invalidRegexIsReportedAsValidationError() {
        var response = handler.execute(Map.of("operation", "find", "pattern", "(", "useRegex", true));
        assertEquals(false, response.get("success"));
        assertEquals("ValidationError", response.get("errorType"));
        assertTrue(((String) response.get("error")).startsWith("Invalid regex pattern"));
    }

    @Test
    void inspectMultipleSerializesEachTarget() {
        var response = handler.execute(Map.of(
            "operation", "inspectMultiple",
            "pattern", "Light?",
            "maxResults", 2,
            "members", List.of("name")
        ));

        @SuppressWarnings("unchecked")
        var results = (List<Map<String, Object>>) response.get("results");
        assertEquals(2, results.size());
        assertEquals(Map.of("name", "Light1"), results.get(1).get("members"));
        assertFalse(response.containsKey("sideEffectWait"));
    }
}
