package com.apisentinel.flink;

import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.MetricSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSerializationSchemaTest {

    @Test
    @DisplayName("Wire names and ISO-8601 timestamps are written")
    void shouldWriteReadableJson() {
        MetricSample sample = MetricSample.builder()
                .apiId("orders-api")
                .environment("aws")
                .metricKind(MetricKind.RESPONSE_TIME)
                .value(120)
                .timestamp(Instant.parse("2026-03-02T10:00:00Z"))
                .build();

        String json = new String(new JsonSerializationSchema<MetricSample>().serialize(sample),
                StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"metricKind\":\"response_time\"")
                .contains("\"timestamp\":\"2026-03-02T10:00:00Z\"")
                .doesNotContain("seriesKey");
    }
}
