package com.flowgraph.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 运行事件。
 */
@Data
public class StreamEventDTO {

    private Long sequence;
    private String type;
    private String nodeId;
    private String nodeName;
    private Map<String, Object> payload;
    private String timestamp;
}
