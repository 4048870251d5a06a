package work.lcod.bridge.handlers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.bridge.handler.BridgeContext;
import work.lcod.bridge.support.BridgeTestSupport;

class ConvertCommandHandlerTest {
    private final List<String> waits = new ArrayList<>();
    private final ConvertCommandHandler handler = new ConvertCommandHandler(BridgeContext.builder()
        .liveObjects(BridgeTestSupport.scene(1))
        .types(BridgeTestSupport.catalog())
        .sideEffects(operation -> {
            waits.add(operation);
            return Optional.empty();
        })
        .build());

    @Test
    void convertsIntoCatalogTypes() {
        var response = handler.execute(Map.of("operation", "convert", "type", "Color", "value", Map.of("g", "0.5")));

        assertEquals(true, response.get("success"));
        assertEquals("Color", response.get("type"));
        assertEquals(true, response.get("converted"));
        assertEquals(Map.of("r", 0f, "g", 0.5f, "b", 0f, "a", 1f), response.get("value"));
        assertTrue(waits.isEmpty());
    }

    @Test
    void primitiveNamesResolveWithoutRegistration() {
        var response = handler.execute(Map.of("operation", "convert", "type", "int", "value", 9.99));
        assertEquals(9, response.get("value"));

        var enumResponse = handler.execute(Map.of("operation", "convert", "type", "LightMode", "value", 42));
        assertEquals(42, enumResponse.get("value"));
    }

    @Test
    void failedConversionReportsTheDefault() {
        var response = handler.execute(Map.of("operation", "convert", "type", "bool", "value", "perhaps"));

        assertEquals(true, response.get("success"));
        assertEquals(false, response.get("converted"));
        assertEquals(false, response.get("value"));
        assertTrue(((String) response.get("conversionError")).contains("perhaps"));
    }

    @Test
    void unknownTypeIsTargetNotFound() {
        var response = handler.execute(Map.of("operation", "convert", "type", "Quaternion", "value", 1));
        assertEquals(false, response.get("success"));
        assertEquals("TargetNotFoundError", response.get("errorType"));
        assertEquals("Type not found: 'Quaternion'", response.get("error"));
    }

    @Test
    void listTypesReturnsCatalogNames() {
        var response = handler.execute(Map.of("operation", "listTypes"));
        assertEquals(List.of("LightMode", "Color", "SceneNode", "Light"), response.get("types"));
        assertEquals(4, response.get("count"));
        assertFalse(response.containsKey("sideEffectWait"));
    }
}
