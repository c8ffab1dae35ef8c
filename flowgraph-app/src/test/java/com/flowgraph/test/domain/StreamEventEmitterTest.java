package com.flowgraph.test.domain;

import com.flowgraph.domain.execution.model.valobj.StreamEvent;
import com.flowgraph.domain.execution.service.StreamEventEmitter;
import com.flowgraph.types.enums.StreamEventTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class StreamEventEmitterTest {

    @Test
    public void shouldAssignIncreasingSequence() {
        StreamEventEmitter emitter = new StreamEventEmitter();

        emitter.emit(StreamEventTypeEnum.WORKFLOW_START, Map.of());
        emitter.emit(StreamEventTypeEnum.NODE_START, "a", "A", null);
        emitter.emit(StreamEventTypeEnum.NODE_END, "a", "A", Map.of("k", "v"));

        List<StreamEvent> events = emitter.getEvents();
        Assertions.assertEquals(List.of(1L, 2L, 3L), events.stream().map(StreamEvent::getSequence).toList());
        Assertions.assertTrue(events.get(1).getPayload().isEmpty());
        Assertions.assertNotNull(events.get(2).getTimestamp());
        Assertions.assertEquals(1, emitter.getEvents(StreamEventTypeEnum.NODE_END).size());
    }

    @Test
    public void shouldIsolateFailingObserver() {
        StreamEventEmitter emitter = new StreamEventEmitter();
        List<StreamEvent> received = new ArrayList<>();
        emitter.subscribe(event -> {
            throw new IllegalStateException("client gone");
        });
        emitter.subscribe(received::add);

        emitter.emit(StreamEventTypeEnum.TOKEN, "llm", "LLM", Map.of("content", "hi"));

        Assertions.assertEquals(1, received.size());
        Assertions.assertEquals("hi", received.get(0).getPayload().get("content"));
    }

    @Test
    public void shouldCopyPayload() {
        StreamEventEmitter emitter = new StreamEventEmitter();
        Map<String, Object> payload = new HashMap<>();
        payload.put("status", "running");

        StreamEvent event = emitter.emit(StreamEventTypeEnum.STATE_UPDATE, payload);
        payload.put("status", "changed");

        Assertions.assertEquals("running", event.getPayload().get("status"));
    }
}
