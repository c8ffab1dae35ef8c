/**
 * Node 领域 - 节点运行时
 *
 * <p>职责：节点类型注册、节点行为实现，以及模型、工具、代码沙箱等外部能力的端口定义</p>
 *
 * @author flowgraph
 * @since 2026-03-02
 */
package com.flowgraph.domain.node;
