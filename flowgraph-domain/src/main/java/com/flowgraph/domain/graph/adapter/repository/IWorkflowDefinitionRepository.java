package com.flowgraph.domain.graph.adapter.repository;

import java.util.List;
import java.util.Map;

/**
 * 工作流定义仓储接口。
 * <p>
 * 定义以原始 Map 形式保存（nodes/edges），由 GraphSpecParser 在每次运行前解析。
 * 子工作流节点通过该接口按 id 查找嵌套定义。
 * </p>
 */
public interface IWorkflowDefinitionRepository {

    /**
     * 按 id 查找定义，不存在返回 null。
     */
    Map<String, Object> findById(String workflowId);

    /**
     * 注册或替换定义。
     */
    void save(String workflowId, Map<String, Object> definition);

    List<String> listIds();

}
