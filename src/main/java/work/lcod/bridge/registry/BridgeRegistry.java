package work.lcod.bridge.registry;

import work.lcod.bridge.handler.BridgeContext;
import work.lcod.bridge.handlers.ConvertCommandHandler;
import work.lcod.bridge.handlers.MemberCommandHandler;
import work.lcod.bridge.handlers.PingHandler;

/**
 * Shared registry bootstrap so the bridge facade and tests use the same handler set.
 */
public final class BridgeRegistry {
    private BridgeRegistry() {}

    public static CommandRegistry create(BridgeContext context) {
        var registry = new CommandRegistry();
        initializer(registry, context).initialize();
        return registry;
    }

    public static CommandRegistryInitializer initializer(CommandRegistry registry, BridgeContext context) {
        return new CommandRegistryInitializer(registry, target -> registerDefaults(target, context));
    }

    public static void registerDefaults(CommandRegistry registry, BridgeContext context) {
        registry.register(PingHandler.TOOL_NAME, new PingHandler(context));
        registry.register(MemberCommandHandler.TOOL_NAME, new MemberCommandHandler(context));
        registry.register(ConvertCommandHandler.TOOL_NAME, new ConvertCommandHandler(context));
    }
}
