package com.flowgraph.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 运行请求。definition 为空时按路径中的 workflowId 读取已注册定义。
 */
@Data
public class WorkflowRunRequestDTO {

    private String threadId;
    private String userId;
    private Map<String, Object> inputs;
    private Map<String, Object> definition;
}
