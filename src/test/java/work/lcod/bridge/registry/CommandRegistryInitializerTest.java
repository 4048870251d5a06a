package work.lcod.bridge.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import work.lcod.bridge.handler.BridgeContext;
import work.lcod.bridge.handlers.ConvertCommandHandler;
import work.lcod.bridge.handlers.MemberCommandHandler;
import work.lcod.bridge.handlers.PingHandler;

class CommandRegistryInitializerTest {
    @Test
    void registersOnceAndClearsStaleEntries() {
        var registry = new CommandRegistry();
        registry.register("stale", new CommandRegistryTest.StubHandler("old"));
        var passes = new AtomicInteger();
        var initializer = new CommandRegistryInitializer(registry, target -> {
            passes.incrementAndGet();
            target.register("fresh", new CommandRegistryTest.StubHandler("new"));
        });

        assertTrue(initializer.initialize());
        assertFalse(initializer.initialize());

        assertEquals(1, passes.get());
        assertEquals(List.of("fresh"), registry.names());
        assertTrue(initializer.isInitialized());
    }

    @Test
    void nestedInitializationIsIgnored() {
        var registry = new CommandRegistry();
        var nested = new AtomicReference<Boolean>();
        var holder = new AtomicReference<CommandRegistryInitializer>();
        holder.set(new CommandRegistryInitializer(registry, target -> nested.set(holder.get().initialize())));

        assertTrue(holder.get().initialize());
        assertEquals(Boolean.FALSE, nested.get());
    }

    @Test
    void failedPassLeavesInitializerRearmed() {
        var registry = new CommandRegistry();
        var attempts = new AtomicInteger();
        var initializer = new CommandRegistryInitializer(registry, target -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("broken handler");
            }
            target.register("ok", new CommandRegistryTest.StubHandler("ok"));
        });

        assertFalse(initializer.initialize());
        assertFalse(initializer.isInitialized());
        assertTrue(initializer.initialize());
        assertEquals(List.of("ok"), registry.names());
    }

    @Test
    void resetAllowsAnotherPass() {
        var registry = new CommandRegistry();
        var passes = new AtomicInteger();
        var initializer = new CommandRegistryInitializer(registry, target -> passes.incrementAndGet());
        initializer.initialize();
        initializer.reset();
        initializer.initialize();
        assertEquals(2, passes.get());
    }

    @Test
    void defaultBootstrapRegistersReferenceHandlers() {
        var registry = BridgeRegistry.create(BridgeContext.builder().build());
        assertEquals(
            List.of(PingHandler.TOOL_NAME, MemberCommandHandler.TOOL_NAME, ConvertCommandHandler.TOOL_NAME).stream().sorted().toList(),
            registry.names()
        );
        assertEquals("member", registry.tryGet(MemberCommandHandler.TOOL_NAME).orElseThrow().category());
    }
}
