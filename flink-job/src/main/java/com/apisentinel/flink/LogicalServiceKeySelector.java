package com.apisentinel.flink;

import com.apisentinel.core.config.EngineConfig;
import com.apisentinel.core.model.MetricSample;
import org.apache.flink.api.java.functions.KeySelector;

import java.util.Objects;

/**
 * Keys samples by logical service, so every environment of a service lands in
 * the same engine instance and can be correlated.
 */
public class LogicalServiceKeySelector implements KeySelector<MetricSample, String> {

    private static final long serialVersionUID = 1L;

    private final EngineConfig config;

    public LogicalServiceKeySelector(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public String getKey(MetricSample sample) {
        String apiId = sample.getApiId();
        return apiId == null ? "__unknown__" : config.logicalServiceOf(apiId);
    }
}
