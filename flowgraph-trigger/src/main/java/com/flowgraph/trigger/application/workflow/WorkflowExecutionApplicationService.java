package com.flowgraph.trigger.application.workflow;

import com.flowgraph.domain.execution.model.valobj.RunResult;
import com.flowgraph.domain.execution.model.valobj.StateSnapshot;
import com.flowgraph.domain.execution.model.valobj.StreamEvent;
import com.flowgraph.domain.execution.service.GraphExecutionEngine;
import com.flowgraph.domain.graph.adapter.repository.IWorkflowDefinitionRepository;
import com.flowgraph.domain.graph.model.valobj.ValidationReport;
import com.flowgraph.domain.graph.service.GraphSpecParser;
import com.flowgraph.domain.node.service.NodeBehaviorRegistry;
import com.flowgraph.types.enums.ResponseCode;
import com.flowgraph.types.enums.RunStatusEnum;
import com.flowgraph.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 工作流执行应用服务：引擎调用 + 运行指标。
 */
@Slf4j
@Service
public class WorkflowExecutionApplicationService {

    private final GraphExecutionEngine graphExecutionEngine;
    private final GraphSpecParser graphSpecParser;
    private final NodeBehaviorRegistry nodeBehaviorRegistry;
    private final IWorkflowDefinitionRepository workflowDefinitionRepository;
    private final MeterRegistry meterRegistry;
    private final Counter runCounter;
    private final Counter runFailedCounter;

    public WorkflowExecutionApplicationService(GraphExecutionEngine graphExecutionEngine,
                                               GraphSpecParser graphSpecParser,
                                               NodeBehaviorRegistry nodeBehaviorRegistry,
                                               IWorkflowDefinitionRepository workflowDefinitionRepository,
                                               ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.graphExecutionEngine = graphExecutionEngine;
        this.graphSpecParser = graphSpecParser;
        this.nodeBehaviorRegistry = nodeBehaviorRegistry;
        this.workflowDefinitionRepository = workflowDefinitionRepository;
        this.meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.runCounter = Counter.builder("flowgraph.run.total").register(meterRegistry);
        this.runFailedCounter = Counter.builder("flowgraph.run.failed.total").register(meterRegistry);
    }

    public RunResult run(String workflowId, Map<String, Object> definition, String threadId,
                         String userId, Map<String, Object> inputs) {
        return stream(workflowId, definition, threadId, userId, inputs, null);
    }

    public RunResult stream(String workflowId, Map<String, Object> definition, String threadId,
                            String userId, Map<String, Object> inputs, Consumer<StreamEvent> observer) {
        requireWorkflowId(workflowId);
        return measure("run", () -> graphExecutionEngine.stream(workflowId, definition, threadId, userId, inputs, observer));
    }

    public RunResult resume(String workflowId, Map<String, Object> definition, String threadId,
                            String feedback, Consumer<StreamEvent> observer) {
        requireWorkflowId(workflowId);
        if (StringUtils.isBlank(threadId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "threadId is required");
        }
        return measure("resume", () -> graphExecutionEngine.resume(workflowId, definition, threadId, feedback, observer));
    }

    public StateSnapshot getState(String workflowId, String threadId) {
        requireThread(workflowId, threadId);
        return graphExecutionEngine.getState(workflowId, threadId);
    }

    public List<StateSnapshot> getHistory(String workflowId, String threadId, int limit) {
        requireThread(workflowId, threadId);
        return graphExecutionEngine.getHistory(workflowId, threadId, limit);
    }

    public ValidationReport validate(Map<String, Object> definition) {
        if (definition == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "definition is required");
        }
        return graphSpecParser.validate(definition);
    }

    public List<Map<String, Object>> nodeTypes() {
        return nodeBehaviorRegistry.catalog();
    }

    /**
     * 注册定义前先做结构校验，存在错误时拒绝。
     */
    public ValidationReport registerDefinition(String workflowId, Map<String, Object> definition) {
        requireWorkflowId(workflowId);
        ValidationReport report = validate(definition);
        if (!report.isValid()) {
            throw new AppException(ResponseCode.GRAPH_CONFIG_ERROR, String.join("; ", report.getErrors()));
        }
        workflowDefinitionRepository.save(workflowId, definition);
        return report;
    }

    private RunResult measure(String operation, Supplier<RunResult> action) {
        Timer.Sample sample = Timer.start(meterRegistry);
        runCounter.increment();
        String status = RunStatusEnum.FAILED.getCode();
        try {
            RunResult result = action.get();
            status = result.getStatus().getCode();
            if (result.getStatus() == RunStatusEnum.FAILED) {
                runFailedCounter.increment();
            }
            return result;
        } catch (RuntimeException ex) {
            runFailedCounter.increment();
            throw ex;
        } finally {
            sample.stop(Timer.builder("flowgraph.run.duration")
                    .tag("operation", operation)
                    .tag("status", status)
                    .register(meterRegistry));
        }
    }

    private void requireWorkflowId(String workflowId) {
        if (StringUtils.isBlank(workflowId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "workflowId is required");
        }
    }

    private void requireThread(String workflowId, String threadId) {
        requireWorkflowId(workflowId);
        if (StringUtils.isBlank(threadId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "threadId is required");
        }
    }
}
