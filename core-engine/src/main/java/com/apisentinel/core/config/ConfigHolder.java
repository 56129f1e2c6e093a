package com.apisentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Publishes the current {@link EngineConfig} snapshot.
 *
 * <p>
 * Readers call {@link #current()} once per unit of work and keep that
 * snapshot until the work finishes. {@link #reload()} swaps the reference
 * atomically; a source that fails to load or validate leaves the previous
 * snapshot in place.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigHolder {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigHolder.class);

    private final Supplier<EngineConfig> source;
    private final AtomicReference<EngineConfig> current;

    /**
     * @param source loads and validates a fresh configuration; called now and on
     *               every {@link #reload()}
     * @throws IllegalStateException if the initial load fails
     */
    public ConfigHolder(Supplier<EngineConfig> source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.current = new AtomicReference<>(Objects.requireNonNull(source.get(),
                "Initial configuration must not be null"));
    }

    /**
     * Holder around a fixed configuration; {@link #reload()} re-validates it.
     */
    public static ConfigHolder of(EngineConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();
        return new ConfigHolder(() -> config);
    }

    public EngineConfig current() {
        return current.get();
    }

    /**
     * Re-read the source and publish the result.
     *
     * @return {@code true} if a new snapshot was published
     */
    public boolean reload() {
        EngineConfig fresh;
        try {
            fresh = source.get();
        } catch (RuntimeException e) {
            LOG.warn("Configuration reload failed, keeping previous configuration: {}", e.getMessage());
            return false;
        }
        if (fresh == null) {
            LOG.warn("Configuration reload produced nothing, keeping previous configuration");
            return false;
        }
        current.set(fresh);
        LOG.info("Configuration reloaded: {}", fresh);
        return true;
    }
}
