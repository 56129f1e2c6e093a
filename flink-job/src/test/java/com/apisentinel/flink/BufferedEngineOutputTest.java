package com.apisentinel.flink;

import com.apisentinel.core.model.AnomalyCandidate;
import com.apisentinel.core.model.AnomalyCategory;
import com.apisentinel.core.model.MetricKind;
import com.apisentinel.core.model.NotificationIntent;
import com.apisentinel.core.sink.EngineRecord;
import com.apisentinel.core.sink.RecordType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BufferedEngineOutputTest {

    @Test
    @DisplayName("Drain hands buffered records over exactly once")
    void shouldDrainOnce() {
        BufferedEngineOutput buffer = new BufferedEngineOutput();
        buffer.append(EngineRecord.anomaly(AnomalyCandidate.builder()
                .apiId("orders-api")
                .environment("aws")
                .metricKind(MetricKind.RESPONSE_TIME)
                .category(AnomalyCategory.LATENCY_SPIKE)
                .detectorSource("response_time")
                .deviationScore(95)
                .timestamp(Instant.parse("2026-03-02T10:00:00Z"))
                .build()));
        List<EngineRecord> records = new ArrayList<>();
        List<NotificationIntent> intents = new ArrayList<>();

        int drained = buffer.drain(records::add, intents::add);
        int second = buffer.drain(records::add, intents::add);

        assertThat(drained).isZero();
        assertThat(second).isZero();
        assertThat(records).extracting(EngineRecord::getType).containsExactly(RecordType.ANOMALY);
        assertThat(intents).isEmpty();
    }
}
