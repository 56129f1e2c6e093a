package com.apisentinel.flink;

import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.MetricSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class MetricSampleDeserializationSchemaTest {

    private final MetricSampleDeserializationSchema schema = new MetricSampleDeserializationSchema();

    @Test
    @DisplayName("Collector JSON is decoded, unknown fields ignored")
    void shouldDecodeSample() throws Exception {
        String json = "{\"apiId\":\"orders-api\",\"environment\":\"aws\",\"metricKind\":\"response_time\","
                + "\"value\":120.5,\"timestamp\":\"2026-03-02T10:00:00Z\",\"region\":\"eu-west-1\"}";

        MetricSample sample = schema.deserialize(json.getBytes(StandardCharsets.UTF_8));

        assertThat(sample).isNotNull();
        assertThat(sample.getMetricKind()).isEqualTo(MetricKind.RESPONSE_TIME);
        assertThat(sample.getValue()).isEqualTo(120.5);
        assertThat(sample.getTimestamp()).isEqualTo(Instant.parse("2026-03-02T10:00:00Z"));
        assertThat(sample.getRequestCount()).isEqualTo(1);
        assertThat(sample.validationError()).isEmpty();
    }

    @Test
    @DisplayName("Error-rate sample keeps its request count")
    void shouldDecodeErrorRate() throws Exception {
        String json = "{\"apiId\":\"orders-api\",\"environment\":\"azure\",\"metricKind\":\"error-rate\","
                + "\"value\":0.02,\"requestCount\":500,\"timestamp\":\"2026-03-02T10:01:00Z\"}";

        MetricSample sample = schema.deserialize(json.getBytes(StandardCharsets.UTF_8));

        assertThat(sample.getMetricKind()).isEqualTo(MetricKind.ERROR_RATE);
        assertThat(sample.errorCount()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Garbage and unknown metric kinds are skipped, not thrown")
    void shouldSkipBadRecords() throws Exception {
        assertThat(schema.deserialize("not json".getBytes(StandardCharsets.UTF_8))).isNull();
        assertThat(schema.deserialize(
                "{\"apiId\":\"a\",\"metricKind\":\"cpu\"}".getBytes(StandardCharsets.UTF_8))).isNull();
        assertThat(schema.deserialize(new byte[0])).isNull();
        assertThat(schema.deserialize(null)).isNull();
        assertThat(schema.isEndOfStream(null)).isFalse();
    }
}
