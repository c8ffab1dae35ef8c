package com.flowgraph.domain.node.adapter.gateway;

/**
 * 工具调用网关。
 */
public interface IToolGateway {

    /**
     * 调用工具。
     *
     * @param toolId 工具标识
     * @param input Map 或字符串形式的入参
     * @return 工具结果文本
     */
    String invoke(String toolId, Object input);

}
