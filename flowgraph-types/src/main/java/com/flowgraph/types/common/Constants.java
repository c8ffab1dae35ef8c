package com.flowgraph.types.common;

/**
 * 全局常量定义类。
 *
 * @author flowgraph
 * @since 2026-03-02
 */
public class Constants {

    /** 虚拟起点 */
    public final static String START = "__start__";

    /** 虚拟终点，路由函数返回该值表示运行结束 */
    public final static String END = "__end__";

    /** 变量引用分隔符：nodeId.key */
    public final static String VARIABLE_SEPARATOR = ".";

    /** 运行输入在 variables 中的命名空间 */
    public final static String INPUT_NAMESPACE = "input";

    /** 日期时间格式 */
    public final static String DATE_TIME_PATTERN = "yyyy-MM-dd HH:mm:ss";

}
