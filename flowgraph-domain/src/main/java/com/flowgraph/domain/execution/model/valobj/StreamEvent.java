package com.flowgraph.domain.execution.model.valobj;

import com.flowgraph.types.enums.StreamEventTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 运行生命周期事件。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamEvent {

    /** 运行内递增序号 */
    private long sequence;
    private StreamEventTypeEnum eventType;
    private String nodeId;
    private String nodeName;
    private Map<String, Object> payload;
    private LocalDateTime timestamp;
}
