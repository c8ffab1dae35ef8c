package com.flowgraph.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 运行结果。
 */
@Data
public class WorkflowRunResponseDTO {

    private String workflowId;
    private String threadId;
    /** ready / running / suspended / completed / failed */
    private String status;
    private String output;
    private List<String> pendingNodes;
    private Integer steps;
    private String errorCode;
    private String errorMessage;
    private Map<String, Object> variables;
    private List<StreamEventDTO> events;
}
