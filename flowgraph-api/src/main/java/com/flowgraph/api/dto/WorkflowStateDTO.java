package com.flowgraph.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 线程状态快照。
 */
@Data
public class WorkflowStateDTO {

    private String workflowId;
    private String threadId;
    private String checkpointId;
    private Integer stepIndex;
    private List<Map<String, Object>> messages;
    private Map<String, Object> variables;
    private String currentAgent;
    private Integer iterationCount;
    private String humanFeedback;
    private String finalOutput;
    private Map<String, Object> metadata;
    private List<String> nextNodes;
    private String createdAt;
}
