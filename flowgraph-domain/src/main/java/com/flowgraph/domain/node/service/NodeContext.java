package com.flowgraph.domain.node.service;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.RunResult;
import com.flowgraph.domain.execution.service.ExecutionContext;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.adapter.gateway.ICodeSandbox;
import com.flowgraph.domain.node.adapter.gateway.IModelGateway;
import com.flowgraph.domain.node.adapter.gateway.IToolGateway;
import com.flowgraph.types.enums.StreamEventTypeEnum;

import java.util.Map;

/**
 * 单次节点调用的上下文：运行上下文 + 当前节点身份。
 */
public class NodeContext {

    private final ExecutionContext executionContext;
    private final NodeSpec node;

    public NodeContext(ExecutionContext executionContext, NodeSpec node) {
        this.executionContext = executionContext;
        this.node = node;
    }

    public String getWorkflowId() {
        return executionContext.getWorkflowId();
    }

    public String getThreadId() {
        return executionContext.getThreadId();
    }

    public String getUserId() {
        return executionContext.getUserId();
    }

    public ExecutionContext getExecutionContext() {
        return executionContext;
    }

    public void emit(StreamEventTypeEnum eventType, Map<String, Object> payload) {
        executionContext.getEmitter().emit(eventType, node.getId(), node.displayName(), payload);
    }

    public IModelGateway models() {
        return executionContext.getRuntimeServices().modelGateway();
    }

    public IToolGateway tools() {
        return executionContext.getRuntimeServices().toolGateway();
    }

    public ICodeSandbox codeSandbox() {
        return executionContext.getRuntimeServices().codeSandbox();
    }

    /**
     * 同步运行子工作流，子运行失败时返回 FAILED 结果而不是抛出。
     */
    public RunResult runSubgraph(String subWorkflowId, ExecutionState initialState) {
        return executionContext.getSubgraphRunner().runSubgraph(executionContext, subWorkflowId, initialState);
    }
}
