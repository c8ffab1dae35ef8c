package com.flowgraph.domain.execution.service;

import com.flowgraph.domain.execution.model.valobj.StreamEvent;
import com.flowgraph.types.enums.StreamEventTypeEnum;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 单次运行的事件流：同步发射、按序记录、逐个分发给观察者。
 * 观察者抛出的异常只记录日志，不影响运行和其他观察者。
 */
@Slf4j
public class StreamEventEmitter {

    private final List<StreamEvent> events;
    private final List<Consumer<StreamEvent>> observers;
    private final AtomicLong sequence;

    public StreamEventEmitter() {
        this.events = Collections.synchronizedList(new ArrayList<>());
        this.observers = new CopyOnWriteArrayList<>();
        this.sequence = new AtomicLong(0L);
    }

    public void subscribe(Consumer<StreamEvent> observer) {
        if (observer != null) {
            observers.add(observer);
        }
    }

    public StreamEvent emit(StreamEventTypeEnum eventType, String nodeId, String nodeName, Map<String, Object> payload) {
        StreamEvent event = StreamEvent.builder()
                .sequence(sequence.incrementAndGet())
                .eventType(eventType)
                .nodeId(nodeId)
                .nodeName(nodeName)
                .payload(payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload))
                .timestamp(LocalDateTime.now())
                .build();
        events.add(event);
        for (Consumer<StreamEvent> observer : observers) {
            try {
                observer.accept(event);
            } catch (Exception ex) {
                log.warn("Stream observer dispatch failed. eventType={}, nodeId={}, error={}",
                        eventType == null ? null : eventType.getCode(), nodeId, ex.getMessage());
            }
        }
        return event;
    }

    public StreamEvent emit(StreamEventTypeEnum eventType, Map<String, Object> payload) {
        return emit(eventType, null, null, payload);
    }

    public List<StreamEvent> getEvents() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public List<StreamEvent> getEvents(StreamEventTypeEnum eventType) {
        List<StreamEvent> matched = new ArrayList<>();
        for (StreamEvent event : getEvents()) {
            if (event.getEventType() == eventType) {
                matched.add(event);
            }
        }
        return matched;
    }
}
