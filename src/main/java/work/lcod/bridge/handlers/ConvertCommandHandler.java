package work.lcod.bridge.handlers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.bridge.handler.BaseCommandHandler;
import work.lcod.bridge.handler.BridgeContext;
import work.lcod.bridge.handler.OperationSchema;
import work.lcod.bridge.handler.OperationSchema.ParamType;
import work.lcod.bridge.handler.StandardPayloadValidator;

/**
 * Exposes the coercion engine directly: converts a payload value into a catalog type and
 * returns its serialized form.
 */
public final class ConvertCommandHandler extends BaseCommandHandler {
    public static final String TOOL_NAME = "valueConvert";

    public ConvertCommandHandler(BridgeContext context) {
        super(context, validator());
    }

    private static StandardPayloadValidator validator() {
        return new StandardPayloadValidator()
            .register("convert", OperationSchema.builder()
                .description("Coerce a value into a named type")
                .require("type", ParamType.STRING)
                .optional("value", ParamType.ANY)
                .build());
    }

    @Override
    public List<String> supportedOperations() {
        return List.of("convert", "listTypes");
    }

    @Override
    public String category() {
        return "conversion";
    }

    @Override
    protected boolean isReadOnly(String operation) {
        return true;
    }

    @Override
    protected Map<String, Object> executeOperation(String operation, Map<String, Object> payload) {
        return switch (operation) {
            case "convert" -> convert(payload);
            case "listTypes" -> listTypes();
            default -> throw new IllegalStateException("Unhandled operation " + operation);
        };
    }

    private Map<String, Object> convert(Map<String, Object> payload) {
        var type = resolveType(requireString(payload, "type"));
        var conversion = context.coercion().tryConvert(payload.get("value"), type);
        var response = new LinkedHashMap<String, Object>();
        response.put("type", type.displayName());
        response.put("converted", conversion.succeeded());
        response.put("value", context.serializer().serialize(conversion.value(), type));
        if (!conversion.succeeded()) {
            response.put("conversionError", conversion.error());
        }
        return response;
    }

    private Map<String, Object> listTypes() {
        var names = new ArrayList<>(context.types().typeNames());
        var response = new LinkedHashMap<String, Object>();
        response.put("types", names);
        response.put("count", names.size());
        return response;
    }
}
