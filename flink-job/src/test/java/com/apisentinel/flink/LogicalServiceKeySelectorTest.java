package com.apisentinel.flink;

import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.MetricSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LogicalServiceKeySelectorTest {

    @Test
    @DisplayName("APIs of one logical service share a key across environments")
    void shouldKeyByLogicalService() throws Exception {
        EngineConfig config = new EngineConfig();
        config.setLogicalServices(Map.of("orders", List.of("orders-api", "orders-api-v2")));
        LogicalServiceKeySelector selector = new LogicalServiceKeySelector(config);

        assertThat(selector.getKey(sample("orders-api", "aws"))).isEqualTo("orders");
        assertThat(selector.getKey(sample("orders-api-v2", "azure"))).isEqualTo("orders");
        assertThat(selector.getKey(sample("billing-api", "aws"))).isEqualTo("billing-api");
    }

    private static MetricSample sample(String apiId, String env) {
        return MetricSample.builder()
                .apiId(apiId)
                .environment(env)
                .metricKind(MetricKind.RESPONSE_TIME)
                .value(100)
                .timestamp(Instant.parse("2026-03-02T10:00:00Z"))
                .build();
    }
}
