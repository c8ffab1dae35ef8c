/**
 * Execution 领域 - 工作流执行域
 *
 * <p>职责：按步推进可执行图、状态归并、检查点持久化、挂起与恢复、事件推送</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>ExecutionState：节点共享的状态，按字段归并部分更新</li>
 *   <li>Checkpoint：每步之后的状态快照，以 (workflowId, threadId) 为键只追加</li>
 *   <li>StreamEvent：运行期间按序产生的事件</li>
 * </ul>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>{@link com.flowgraph.domain.execution.model.entity.CheckpointEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>GraphExecutionEngine - 执行引擎，同时负责子工作流运行</li>
 *   <li>StateReducers - 状态字段归并规则</li>
 *   <li>StreamEventEmitter - 单次运行的事件流</li>
 * </ul>
 *
 * @author flowgraph
 * @since 2026-03-02
 */
package com.flowgraph.domain.execution;
