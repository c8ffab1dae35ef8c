package com.flowgraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * SSE 流式运行线程池配置，前缀 flowgraph.stream-executor。
 *
 * @author flowgraph
 * @since 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "flowgraph.stream-executor", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认8 */
    private Integer corePoolSize = 8;

    /** 最大线程数，默认32 */
    private Integer maxPoolSize = 32;

    /** 空闲线程最大存活时间（秒） */
    private Long keepAliveTime = 60L;

    /** 阻塞队列容量 */
    private Integer blockQueueSize = 200;

    /**
     * 拒绝策略，默认AbortPolicy。
     * <ul>
     *   <li>AbortPolicy：拒绝并抛出RejectedExecutionException，SSE 端返回 error 事件</li>
     *   <li>DiscardPolicy：直接丢弃</li>
     *   <li>DiscardOldestPolicy：丢弃队列中最早的任务</li>
     *   <li>CallerRunsPolicy：由请求线程执行</li>
     * </ul>
     */
    private String policy = "AbortPolicy";

    /** 线程名前缀 */
    private String threadNamePrefix = "workflow-stream-";

}
