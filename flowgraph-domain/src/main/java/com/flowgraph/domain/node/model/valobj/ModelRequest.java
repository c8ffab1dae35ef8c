package com.flowgraph.domain.node.model.valobj;

import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 模型调用请求。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelRequest {

    private String modelId;
    private String systemPrompt;
    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();
    private Double temperature;
    /** Agent 节点可用工具 */
    @Builder.Default
    private List<String> toolIds = new ArrayList<>();
    /** 工具调用最大轮次，null 表示使用模型默认 */
    private Integer maxIterations;
}
