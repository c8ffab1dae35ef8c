package com.flowgraph.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 0xxx 为通用响应码，1xxx 为图编译与执行相关错误。
 * </p>
 *
 * @author flowgraph
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 图配置错误：缺少入口节点、路由引用未声明的目标等 */
    GRAPH_CONFIG_ERROR("1001", "图配置错误"),

    /** 路由函数返回了未注册的目标 */
    ROUTING_ERROR("1002", "路由错误"),

    /** 超过步数上限 */
    STEP_BOUND_EXCEEDED("1003", "超过最大执行步数"),

    /** 节点执行失败 */
    NODE_EXECUTION_ERROR("1004", "节点执行失败"),

    /** 线程不存在 */
    THREAD_NOT_FOUND("1005", "线程不存在"),

    /** 运行未处于挂起状态 */
    RUN_NOT_SUSPENDED("1006", "运行未挂起"),

    /** 工作流定义不存在 */
    WORKFLOW_NOT_FOUND("1007", "工作流不存在"),

    /** 同一线程已有运行中的执行 */
    THREAD_BUSY("1008", "线程正在执行");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
