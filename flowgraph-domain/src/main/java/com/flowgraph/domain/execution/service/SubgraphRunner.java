package com.flowgraph.domain.execution.service;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.RunResult;

/**
 * 子工作流运行入口。
 */
@FunctionalInterface
public interface SubgraphRunner {

    RunResult runSubgraph(ExecutionContext parent, String subWorkflowId, ExecutionState initialState);

}
