package com.apisentinel.flink;

import com.apisentinel.core.model.NotificationIntent;
import com.apisentinel.core.sink.EngineRecord;
import com.apisentinel.core.sink.NotificationSink;
import com.apisentinel.core.sink.RecordSink;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Collects engine output during one Flink callback so it can be emitted to
 * the collector and the side output afterwards.
 *
 * <p>
 * Used with synchronous delivery: the engine calls the sinks on the task
 * thread, the process function drains once the call returns.
 * </p>
 */
final class BufferedEngineOutput implements RecordSink, NotificationSink {

    private final List<EngineRecord> records = new ArrayList<>();
    private final List<NotificationIntent> intents = new ArrayList<>();

    @Override
    public void append(EngineRecord record) {
        records.add(record);
    }

    @Override
    public void deliver(NotificationIntent intent) {
        intents.add(intent);
    }

    /**
     * Hand everything buffered to the consumers and clear the buffer.
     *
     * @return number of notification intents drained
     */
    int drain(Consumer<EngineRecord> recordConsumer, Consumer<NotificationIntent> intentConsumer) {
        records.forEach(recordConsumer);
        intents.forEach(intentConsumer);
        int drained = intents.size();
        records.clear();
        intents.clear();
        return drained;
    }
}
