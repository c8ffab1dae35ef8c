package com.flowgraph.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 恢复请求：向挂起线程注入人工反馈。
 */
@Data
public class WorkflowResumeRequestDTO {

    private String threadId;
    private String feedback;
    private Map<String, Object> definition;
}
