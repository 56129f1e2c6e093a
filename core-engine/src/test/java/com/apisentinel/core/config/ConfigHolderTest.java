package com.apisentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigHolder}.
 */
class ConfigHolderTest {

    @Test
    @DisplayName("Reload publishes a fresh snapshot")
    void shouldPublishReloadedConfig() {
        EngineConfig first = new EngineConfig();
        EngineConfig second = new EngineConfig();
        Deque<EngineConfig> sources = new ArrayDeque<>();
        sources.add(first);
        sources.add(second);
        ConfigHolder holder = new ConfigHolder(sources::poll);

        assertThat(holder.current()).isSameAs(first);
        assertThat(holder.reload()).isTrue();
        assertThat(holder.current()).isSameAs(second);
    }

    @Test
    @DisplayName("A failing reload keeps the previous snapshot")
    void shouldKeepConfigOnFailedReload() {
        EngineConfig initial = new EngineConfig();
        boolean[] fail = { false };
        Supplier<EngineConfig> source = () -> {
            if (fail[0]) {
                throw new IllegalStateException("Engine configuration validation failed");
            }
            return initial;
        };
        ConfigHolder holder = new ConfigHolder(source);

        fail[0] = true;

        assertThat(holder.reload()).isFalse();
        assertThat(holder.current()).isSameAs(initial);
    }

    @Test
    @DisplayName("A fixed configuration is validated up front")
    void shouldValidateFixedConfig() {
        EngineConfig invalid = new EngineConfig();
        invalid.getCorrelation().setWindowSeconds(0);

        assertThatThrownBy(() -> ConfigHolder.of(invalid))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("correlation.windowSeconds");
    }
}
