/**
 * Graph 领域 - 工作流定义与编译域
 *
 * <p>职责：解析编辑器导出的 JSON 定义、拓扑分析、结构校验、编译为可执行图</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>GraphSpec：类型化的节点与边，note 节点和悬空边在解析阶段丢弃</li>
 *   <li>GraphTopology：邻接关系、入口、终止节点、中断节点与回边</li>
 *   <li>CompiledGraph：不可变的可执行图，固定步数上限</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.flowgraph.domain.graph.model.aggregate.CompiledGraph}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>GraphSpecParser - 解析、拓扑分析与校验</li>
 *   <li>GraphCompiler - 编译与路由表构建</li>
 * </ul>
 *
 * @author flowgraph
 * @since 2026-03-02
 */
package com.flowgraph.domain.graph;
