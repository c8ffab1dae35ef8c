package com.flowgraph.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置。
 * <p>
 * workflowStreamExecutor 承载 SSE 流式运行：请求线程立即返回 SseEmitter，
 * 图在池内线程上逐步执行并推送事件。
 * </p>
 *
 * @author flowgraph
 * @since 2026-03-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "workflowStreamExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "workflowStreamExecutor")
    public ThreadPoolExecutor workflowStreamExecutor(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        int maxSize = Math.max(properties.getMaxPoolSize(), coreSize);
        AtomicInteger threadIndex = new AtomicInteger(0);
        String prefix = properties.getThreadNamePrefix();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        log.info("Workflow stream executor created. coreSize={}, maxSize={}, queueSize={}, policy={}",
                coreSize, maxSize, properties.getBlockQueueSize(), properties.getPolicy());
        return new ThreadPoolExecutor(
                coreSize,
                maxSize,
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                threadFactory,
                buildRejectedExecutionHandler(properties.getPolicy()));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
