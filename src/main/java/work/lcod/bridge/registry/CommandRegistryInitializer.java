package work.lcod.bridge.registry;

import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the registration pass for a registry exactly once. The registry is cleared first; nested
 * or repeated calls are ignored until {@link #reset()}.
 */
public final class CommandRegistryInitializer {
    private static final Logger LOG = LoggerFactory.getLogger(CommandRegistryInitializer.class);

    private final CommandRegistry registry;
    private final Consumer<CommandRegistry> registrations;
    private boolean initialized;
    private boolean initializing;

    public CommandRegistryInitializer(CommandRegistry registry, Consumer<CommandRegistry> registrations) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.registrations = Objects.requireNonNull(registrations, "registrations");
    }

    /**
     * @return true when this call performed the registration pass
     */
    public synchronized boolean initialize() {
        if (initialized || initializing) {
            return false;
        }
        initializing = true;
        try {
            registry.clear();
            registrations.accept(registry);
            initialized = true;
            LOG.info("Registered {} command handlers: {}", registry.size(), registry.names());
            return true;
        } catch (RuntimeException ex) {
            LOG.error("Command handler registration failed", ex);
            return false;
        } finally {
            initializing = false;
        }
    }

    public synchronized boolean isInitialized() {
        return initialized;
    }

    public synchronized void reset() {
        initialized = false;
    }

    public CommandRegistry registry() {
        return registry;
    }
}
