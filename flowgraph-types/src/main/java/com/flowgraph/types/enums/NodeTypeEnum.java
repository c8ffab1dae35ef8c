package com.flowgraph.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流节点类型枚举。
 * <p>
 * 节点类型集合是封闭的，未知类型在解析阶段被丢弃并记录告警。
 * router 标记表示该类型在运行时通过路由函数动态决定后继节点。
 * </p>
 *
 * @author flowgraph
 * @since 2026-03-02
 */
public enum NodeTypeEnum {

    /** 入口节点 */
    START("start", "Start", false),

    /** 结束节点 */
    END("end", "End", false),

    /** 条件分支 */
    CONDITION("condition", "Condition", true),

    /** 循环控制 */
    LOOP("loop", "Loop", true),

    /** 自我评估与重试 */
    REFLECTION("reflection", "Reflection", true),

    /** 多 Agent 调度 */
    SUPERVISOR("supervisor", "Supervisor", true),

    /** 人工介入 */
    HUMAN("human", "Human Input", false),

    /** 并行 Map-Reduce */
    MAP_REDUCE("map_reduce", "Map-Reduce", false),

    /** 嵌套子工作流 */
    SUBGRAPH("subgraph", "Sub-Graph", false),

    /** 工具调用 Agent */
    AGENT("agent", "Agent", false),

    /** 单次模型调用 */
    LLM("llm", "LLM", false),

    /** 单个工具调用 */
    TOOL("tool", "Tool", false),

    /** 代码执行 */
    CODE("code", "Code", false);

    private final String code;
    private final String label;
    private final boolean router;

    NodeTypeEnum(String code, String label, boolean router) {
        this.code = code;
        this.label = label;
        this.router = router;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public boolean isRouter() {
        return router;
    }

    /**
     * 按类型标识查找，未知类型返回 null。
     */
    public static NodeTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (NodeTypeEnum type : NodeTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        return null;
    }
}
