package com.flowgraph.domain.node.adapter.gateway;

import java.util.Map;

/**
 * 隔离代码执行。
 * <p>
 * 代码定义 main(**kwargs) 时以 kwargs 调用并返回其结果；
 * 未定义 main 时返回脚本中定义的非下划线变量。
 * </p>
 */
public interface ICodeSandbox {

    Object execute(String code, Map<String, Object> kwargs);

}
