package com.flowgraph;

import org.springframework.beans.factory.annotation.Configurable;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * FlowGraph 工作流引擎启动类。
 * <p>
 * 位于顶层包路径，扫描 domain/infrastructure/trigger 各模块组件。
 * </p>
 *
 * @author flowgraph
 * @since 2026-03-02
 */
@SpringBootApplication
@Configurable
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
