package com.flowgraph.domain.execution.service;

import com.flowgraph.domain.execution.adapter.repository.ICheckpointRepository;
import com.flowgraph.domain.node.service.NodeRuntimeServices;
import lombok.Builder;
import lombok.Getter;

/**
 * 单次运行的显式上下文。
 * <p>
 * 持有检查点存储句柄、事件流和协作者，沿调用链传递，不依赖全局注册表。
 * 子工作流使用派生上下文：独立的 workflowId/threadId，共享事件流与存储句柄。
 * </p>
 */
@Getter
@Builder(toBuilder = true)
public class ExecutionContext {

    private final String workflowId;
    private final String threadId;
    private final String userId;
    private final ICheckpointRepository checkpointRepository;
    private final StreamEventEmitter emitter;
    private final NodeRuntimeServices runtimeServices;
    private final SubgraphRunner subgraphRunner;
    /** 子工作流嵌套深度，顶层为 0 */
    private final int depth;

    public ExecutionContext child(String childWorkflowId, String childThreadId) {
        return toBuilder()
                .workflowId(childWorkflowId)
                .threadId(childThreadId)
                .depth(depth + 1)
                .build();
    }
}
