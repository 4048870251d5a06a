package work.lcod.bridge.handlers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import work.lcod.bridge.batch.BatchResult;
import work.lcod.bridge.batch.TargetSelection;
import work.lcod.bridge.error.ValidationException;
import work.lcod.bridge.handler.BaseCommandHandler;
import work.lcod.bridge.handler.BridgeContext;
import work.lcod.bridge.handler.OperationSchema;
import work.lcod.bridge.handler.OperationSchema.ParamType;
import work.lcod.bridge.handler.StandardPayloadValidator;
import work.lcod.bridge.member.MemberApplyResult;
import work.lcod.bridge.types.CompositeType;

/**
 * Reads and writes members of live objects, one target at a time or pattern-selected in batches.
 */
public final class MemberCommandHandler extends BaseCommandHandler {
    public static final String TOOL_NAME = "memberManage";

    public MemberCommandHandler(BridgeContext context) {
        super(context, validator(context.configuration().defaultMaxResults()));
    }

    private static StandardPayloadValidator validator(int defaultMaxResults) {
        var validator = new StandardPayloadValidator()
            .register("update", OperationSchema.builder()
                .description("Apply member values to one target")
                .require("members", ParamType.MAP)
                .build())
            .register("inspect", OperationSchema.builder()
                .description("Read the visible members of one target")
                .optional("members", ParamType.LIST)
                .build());
        validator.register("updateMultiple", batchSchema(defaultMaxResults)
            .description("Apply member values to every matching target")
            .require("members", ParamType.MAP)
            .build());
        validator.register("inspectMultiple", batchSchema(defaultMaxResults)
            .description("Read the visible members of every matching target")
            .optional("members", ParamType.LIST)
            .build());
        validator.register("find", batchSchema(defaultMaxResults)
            .description("List the paths of matching targets")
            .build());
        return validator;
    }

    private static OperationSchema.Builder batchSchema(int defaultMaxResults) {
        return OperationSchema.builder()
            .require("pattern", ParamType.STRING)
            .optional("useRegex", ParamType.BOOL, false)
            .optional("maxResults", ParamType.INT, defaultMaxResults)
            .optional("stopOnError", ParamType.BOOL, false);
    }

    @Override
    public List<String> supportedOperations() {
        return List.of("update", "inspect", "updateMultiple", "inspectMultiple", "find");
    }

    @Override
    public String category() {
        return "member";
    }

    @Override
    protected Map<String, Object> executeOperation(String operation, Map<String, Object> payload) throws Exception {
        return switch (operation) {
            case "update" -> update(payload);
            case "inspect" -> inspect(payload);
            case "updateMultiple" -> updateMultiple(payload);
            case "inspectMultiple" -> inspectMultiple(payload);
            case "find" -> find(payload);
            default -> throw new IllegalStateException("Unhandled operation " + operation);
        };
    }

    private Map<String, Object> update(Map<String, Object> payload) {
        var target = resolveTarget(payload);
        var applied = context.members().applyMembers(target, getMap(payload, "members"));
        var response = new LinkedHashMap<String, Object>();
        response.put("target", pathOf(target));
        response.putAll(applied.toResponseFields());
        return response;
    }

    private Map<String, Object> inspect(Map<String, Object> payload) {
        var target = resolveTarget(payload);
        var response = new LinkedHashMap<String, Object>();
        response.put("target", pathOf(target));
        response.putAll(describe(target, memberFilter(payload)));
        return response;
    }

    private Map<String, Object> updateMultiple(Map<String, Object> payload) {
        var members = getMap(payload, "members");
        var selection = select(payload);
        BatchResult result = context.batch().runBatched(selection.targets(), target -> {
            MemberApplyResult applied = context.members().applyMembers(target, members);
            if (applied.updated().isEmpty() && applied.hasFailures()) {
                throw new ValidationException("No members applied: " + String.join("; ", applied.failed().values()));
            }
            var entry = new LinkedHashMap<String, Object>();
            entry.put("target", pathOf(target));
            entry.putAll(applied.toResponseFields());
            return entry;
        }, getBool(payload, "stopOnError", false));
        return batchResponse(selection, result);
    }

    private Map<String, Object> inspectMultiple(Map<String, Object> payload) {
        var filter = memberFilter(payload);
        var selection = select(payload);
        BatchResult result = context.batch().runBatched(selection.targets(), target -> {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("target", pathOf(target));
            entry.putAll(describe(target, filter));
            return entry;
        }, getBool(payload, "stopOnError", false));
        return batchResponse(selection, result);
    }

    private Map<String, Object> find(Map<String, Object> payload) {
        var selection = select(payload);
        var matches = new ArrayList<Map<String, Object>>();
        for (Object target : selection.targets()) {
            var match = new LinkedHashMap<String, Object>();
            match.put("path", pathOf(target));
            match.put("type", context.types().describe(target.getClass())
                .map(CompositeType::displayName)
                .orElse(target.getClass().getSimpleName()));
            matches.add(match);
        }
        var response = new LinkedHashMap<String, Object>();
        response.put("matches", matches);
        response.put("count", matches.size());
        response.put("totalCount", selection.totalCount());
        response.put("truncated", selection.truncated());
        return response;
    }

    private TargetSelection select(Map<String, Object> payload) {
        return context.batch().resolveTargets(
            requireString(payload, "pattern"),
            getBool(payload, "useRegex", false),
            getInt(payload, "maxResults", 0)
        );
    }

    private Map<String, Object> batchResponse(TargetSelection selection, BatchResult result) {
        var response = new LinkedHashMap<String, Object>(result.toResponseFields());
        response.put("totalCount", selection.totalCount());
        response.put("truncated", selection.truncated());
        return response;
    }

    private Map<String, Object> describe(Object target, LinkedHashSet<String> filter) {
        var type = context.types().describe(target.getClass())
            .orElseThrow(() -> new ValidationException("Type " + target.getClass().getSimpleName() + " has no registered member table"));
        var values = context.serializer().serializeMembers(target, type);
        if (filter != null) {
            values.keySet().retainAll(filter);
        }
        var fields = new LinkedHashMap<String, Object>();
        fields.put("type", type.displayName());
        fields.put("members", values);
        return fields;
    }

    private LinkedHashSet<String> memberFilter(Map<String, Object> payload) {
        var requested = getList(payload, "members");
        if (requested == null) {
            return null;
        }
        var filter = new LinkedHashSet<String>();
        for (Object name : requested) {
            if (name != null) {
                filter.add(name.toString());
            }
        }
        return filter;
    }

    private String pathOf(Object target) {
        return context.liveObjects().pathOf(target).orElse(null);
    }
}
