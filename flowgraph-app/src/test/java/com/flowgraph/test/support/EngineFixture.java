package com.flowgraph.test.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flowgraph.domain.execution.model.valobj.EngineSettings;
import com.flowgraph.domain.execution.service.GraphExecutionEngine;
import com.flowgraph.domain.graph.service.GraphCompiler;
import com.flowgraph.domain.graph.service.GraphSpecParser;
import com.flowgraph.domain.node.adapter.gateway.ICodeSandbox;
import com.flowgraph.domain.node.adapter.gateway.IModelGateway;
import com.flowgraph.domain.node.adapter.gateway.IToolGateway;
import com.flowgraph.domain.node.service.NodeBehaviorRegistry;
import com.flowgraph.domain.node.service.NodeRuntimeServices;
import com.flowgraph.infrastructure.repository.checkpoint.InMemoryCheckpointRepository;
import com.flowgraph.infrastructure.util.JsonCodec;

/**
 * 组装内存检查点存储与脚本化网关的执行引擎。
 */
public class EngineFixture {

    private final InMemoryWorkflowDefinitionRepository definitions = new InMemoryWorkflowDefinitionRepository();
    private final InMemoryCheckpointRepository checkpoints = new InMemoryCheckpointRepository(jsonCodec());
    private final GraphSpecParser parser = new GraphSpecParser();
    private final NodeBehaviorRegistry registry = new NodeBehaviorRegistry();
    private final GraphExecutionEngine engine;

    public EngineFixture(IModelGateway modelGateway) {
        this(modelGateway, null, null, EngineSettings.defaults());
    }

    public EngineFixture(IModelGateway modelGateway, IToolGateway toolGateway, ICodeSandbox codeSandbox,
                         EngineSettings settings) {
        this.engine = new GraphExecutionEngine(new GraphCompiler(parser, registry, settings), checkpoints, definitions,
                new NodeRuntimeServices(modelGateway, toolGateway, codeSandbox), settings);
    }

    public static JsonCodec jsonCodec() {
        return new JsonCodec(new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    public GraphExecutionEngine engine() {
        return engine;
    }

    public InMemoryWorkflowDefinitionRepository definitions() {
        return definitions;
    }

    public InMemoryCheckpointRepository checkpoints() {
        return checkpoints;
    }

    public GraphSpecParser parser() {
        return parser;
    }

    public NodeBehaviorRegistry registry() {
        return registry;
    }
}
