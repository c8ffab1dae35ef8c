package com.flowgraph.domain.execution.service;

import com.flowgraph.domain.execution.adapter.repository.ICheckpointRepository;
import com.flowgraph.domain.execution.model.entity.CheckpointEntity;
import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.EngineSettings;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.RunResult;
import com.flowgraph.domain.execution.model.valobj.StateSnapshot;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.execution.model.valobj.StreamEvent;
import com.flowgraph.domain.graph.adapter.repository.IWorkflowDefinitionRepository;
import com.flowgraph.domain.graph.model.aggregate.CompiledGraph;
import com.flowgraph.domain.graph.service.GraphCompiler;
import com.flowgraph.domain.node.service.NodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import com.flowgraph.domain.node.service.NodeRuntimeServices;
import com.flowgraph.types.common.Constants;
import com.flowgraph.types.enums.ResponseCode;
import com.flowgraph.types.enums.RunStatusEnum;
import com.flowgraph.types.enums.StreamEventTypeEnum;
import com.flowgraph.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * 工作流执行引擎。
 * <p>
 * 单线程逐步推进：门控 → 执行 → 归并 → 保存检查点 → 路由 → 步数检查。
 * 中断节点在执行前挂起；resume 注入反馈后从挂起节点继续。
 * 节点异常、路由异常和步数超限都以 FAILED 结果返回，最后一个检查点保持不变。
 * </p>
 */
@Slf4j
@Service
public class GraphExecutionEngine implements SubgraphRunner {

    private final GraphCompiler graphCompiler;
    private final ICheckpointRepository checkpointRepository;
    private final IWorkflowDefinitionRepository workflowDefinitionRepository;
    private final NodeRuntimeServices runtimeServices;
    private final EngineSettings engineSettings;

    /** 正在执行的 workflowId:threadId */
    private final Set<String> activeThreads = ConcurrentHashMap.newKeySet();

    public GraphExecutionEngine(GraphCompiler graphCompiler,
                                ICheckpointRepository checkpointRepository,
                                IWorkflowDefinitionRepository workflowDefinitionRepository,
                                NodeRuntimeServices runtimeServices,
                                EngineSettings engineSettings) {
        this.graphCompiler = graphCompiler;
        this.checkpointRepository = checkpointRepository;
        this.workflowDefinitionRepository = workflowDefinitionRepository;
        this.runtimeServices = runtimeServices;
        this.engineSettings = engineSettings;
    }

    public RunResult run(String workflowId, Map<String, Object> definition, String threadId,
                         String userId, Map<String, Object> inputs) {
        return stream(workflowId, definition, threadId, userId, inputs, null);
    }

    /**
     * 运行工作流，事件在产生时同步推送给 observer。
     *
     * @param definition 为 null 时按 workflowId 从定义仓储加载
     */
    public RunResult stream(String workflowId, Map<String, Object> definition, String threadId,
                            String userId, Map<String, Object> inputs, Consumer<StreamEvent> observer) {
        CompiledGraph graph = graphCompiler.compile(workflowId, resolveDefinition(workflowId, definition));
        String resolvedThreadId = StringUtils.isBlank(threadId) ? UUID.randomUUID().toString() : threadId;
        ExecutionContext context = newContext(workflowId, resolvedThreadId, userId, observer);

        acquire(workflowId, resolvedThreadId);
        try {
            log.info("Workflow run started. workflowId={}, threadId={}, stepBound={}",
                    workflowId, resolvedThreadId, graph.getStepBound());
            emitWorkflowStart(context);
            RunResult result = drive(graph, context, initialState(inputs), graph.getEntryId(), 0, null);
            return finish(context, result);
        } finally {
            release(workflowId, resolvedThreadId);
        }
    }

    public RunResult resume(String workflowId, Map<String, Object> definition, String threadId, String feedback) {
        return resume(workflowId, definition, threadId, feedback, null);
    }

    /**
     * 向挂起的线程注入人工反馈并从挂起节点继续执行。
     */
    public RunResult resume(String workflowId, Map<String, Object> definition, String threadId,
                            String feedback, Consumer<StreamEvent> observer) {
        if (StringUtils.isBlank(threadId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "threadId is required for resume");
        }
        CompiledGraph graph = graphCompiler.compile(workflowId, resolveDefinition(workflowId, definition));
        acquire(workflowId, threadId);
        try {
            CheckpointEntity latest = checkpointRepository.findLatest(workflowId, threadId);
            if (latest == null) {
                throw new AppException(ResponseCode.THREAD_NOT_FOUND, "Thread not found: " + threadId);
            }
            if (!latest.isInterrupted() || latest.getPendingNodes().isEmpty()) {
                throw new AppException(ResponseCode.RUN_NOT_SUSPENDED, "Thread is not suspended: " + threadId);
            }
            CheckpointEntity injected = checkpointRepository.injectValue(workflowId, threadId,
                    StateUpdate.builder().humanFeedback(feedback == null ? "" : feedback).build());
            String pendingNode = injected.getPendingNodes().get(0);

            ExecutionContext context = newContext(workflowId, threadId, stringMetadata(injected.getState(), "user_id"), observer);
            log.info("Workflow resumed. workflowId={}, threadId={}, pendingNode={}, stepIndex={}",
                    workflowId, threadId, pendingNode, injected.getStepIndex());
            emitWorkflowStart(context);
            RunResult result = drive(graph, context, injected.getState(), pendingNode, injected.getStepIndex(), pendingNode);
            return finish(context, result);
        } finally {
            release(workflowId, threadId);
        }
    }

    public StateSnapshot getState(String workflowId, String threadId) {
        CheckpointEntity latest = checkpointRepository.findLatest(workflowId, threadId);
        if (latest == null) {
            throw new AppException(ResponseCode.THREAD_NOT_FOUND, "Thread not found: " + threadId);
        }
        return toSnapshot(latest);
    }

    /**
     * 检查点历史，按时间倒序。
     */
    public List<StateSnapshot> getHistory(String workflowId, String threadId, int limit) {
        int resolvedLimit = limit <= 0 ? engineSettings.getHistoryLimit() : limit;
        List<StateSnapshot> snapshots = new ArrayList<>();
        for (CheckpointEntity checkpoint : checkpointRepository.findHistory(workflowId, threadId, resolvedLimit)) {
            snapshots.add(toSnapshot(checkpoint));
        }
        return snapshots;
    }

    @Override
    public RunResult runSubgraph(ExecutionContext parent, String subWorkflowId, ExecutionState initialState) {
        if (parent.getDepth() + 1 > engineSettings.getMaxSubgraphDepth()) {
            return RunResult.builder()
                    .workflowId(subWorkflowId)
                    .status(RunStatusEnum.FAILED)
                    .errorCode(ResponseCode.GRAPH_CONFIG_ERROR.getCode())
                    .errorMessage("Sub-workflow nesting exceeds max depth " + engineSettings.getMaxSubgraphDepth())
                    .build();
        }
        Map<String, Object> definition = workflowDefinitionRepository.findById(subWorkflowId);
        if (definition == null) {
            throw new AppException(ResponseCode.WORKFLOW_NOT_FOUND, "Sub-workflow " + subWorkflowId + " not found");
        }
        CompiledGraph graph = graphCompiler.compile(subWorkflowId, definition);
        String childThreadId = childThreadId(parent.getThreadId(), subWorkflowId);
        ExecutionContext child = parent.child(subWorkflowId, childThreadId);
        log.info("Sub-workflow started. parentWorkflowId={}, subWorkflowId={}, threadId={}, depth={}",
                parent.getWorkflowId(), subWorkflowId, childThreadId, child.getDepth());
        ExecutionState state = initialState == null ? ExecutionState.initial() : initialState;
        return drive(graph, child, state, graph.getEntryId(), 0, null);
    }

    /**
     * 首次进入为 parent:sub:id；同一父线程再次进入（如位于循环内）时追加访问序号 :2、:3，
     * 每次子运行各有独立的检查点历史。
     */
    private String childThreadId(String parentThreadId, String subWorkflowId) {
        String base = parentThreadId + ":sub:" + subWorkflowId;
        String candidate = base;
        for (int visit = 2; checkpointRepository.findLatest(subWorkflowId, candidate) != null; visit++) {
            candidate = base + ":" + visit;
        }
        return candidate;
    }

    private RunResult drive(CompiledGraph graph, ExecutionContext context, ExecutionState startState,
                            String startNode, int startSteps, String resumedNode) {
        ExecutionState state = startState;
        String current = startNode;
        String gateBypass = resumedNode;
        int steps = startSteps;

        while (!Constants.END.equals(current)) {
            NodeBehavior behavior = graph.getBehavior(current);
            if (behavior == null) {
                return fail(context, state, steps, ResponseCode.ROUTING_ERROR, "Unknown node: " + current, current);
            }

            if (graph.isInterrupt(current) && !current.equals(gateBypass)) {
                return suspend(context, behavior, state, steps);
            }
            gateBypass = null;

            context.getEmitter().emit(StreamEventTypeEnum.NODE_START, current, behavior.getName(),
                    payloadOf("node_type", behavior.getType().getCode()));
            StateUpdate update;
            try {
                update = behavior.execute(new NodeContext(context, behavior.getSpec()), state);
            } catch (Exception ex) {
                log.error("Node execution failed. workflowId={}, threadId={}, nodeId={}",
                        context.getWorkflowId(), context.getThreadId(), current, ex);
                return fail(context, state, steps, ResponseCode.NODE_EXECUTION_ERROR,
                        "Node " + current + " failed: " + ex.getMessage(), current);
            }

            state = StateReducers.apply(state, update);
            context.getEmitter().emit(StreamEventTypeEnum.NODE_END, current, behavior.getName(),
                    payloadOf("node_type", behavior.getType().getCode()));
            context.getEmitter().emit(StreamEventTypeEnum.STATE_UPDATE, current, behavior.getName(), stateUpdatePayload(update, state));

            String next = null;
            AppException routingError = null;
            try {
                next = graph.resolveNext(current, state);
            } catch (AppException ex) {
                routingError = ex;
            }
            steps++;
            persist(context, state, steps, current, next == null ? Collections.emptyList() : pendingOf(next), false);
            if (routingError != null) {
                return fail(context, state, steps, ResponseCode.ROUTING_ERROR, routingError.getInfo(), current);
            }
            if (!Constants.END.equals(next) && steps >= graph.getStepBound()) {
                return fail(context, state, steps, ResponseCode.STEP_BOUND_EXCEEDED,
                        "Step bound exceeded: " + graph.getStepBound(), current);
            }
            current = next;
        }

        return RunResult.builder()
                .workflowId(context.getWorkflowId())
                .threadId(context.getThreadId())
                .status(RunStatusEnum.COMPLETED)
                .output(outputOf(state))
                .pendingNodes(new ArrayList<>())
                .steps(steps)
                .state(state)
                .build();
    }

    private RunResult suspend(ExecutionContext context, NodeBehavior behavior, ExecutionState state, int steps) {
        String nodeId = behavior.getId();
        persist(context, state, steps, null, pendingOf(nodeId), true);
        context.getEmitter().emit(StreamEventTypeEnum.HUMAN_INPUT, nodeId, behavior.getName(), behavior.interruptRequest(state));
        log.info("Workflow suspended. workflowId={}, threadId={}, nodeId={}, steps={}",
                context.getWorkflowId(), context.getThreadId(), nodeId, steps);
        return RunResult.builder()
                .workflowId(context.getWorkflowId())
                .threadId(context.getThreadId())
                .status(RunStatusEnum.SUSPENDED)
                .output(outputOf(state))
                .pendingNodes(pendingOf(nodeId))
                .steps(steps)
                .state(state)
                .build();
    }

    private RunResult fail(ExecutionContext context, ExecutionState state, int steps,
                           ResponseCode code, String message, String nodeId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error_code", code.getCode());
        payload.put("error", message);
        context.getEmitter().emit(StreamEventTypeEnum.ERROR, nodeId, null, payload);
        log.warn("Workflow run failed. workflowId={}, threadId={}, nodeId={}, code={}, error={}",
                context.getWorkflowId(), context.getThreadId(), nodeId, code.getCode(), message);
        return RunResult.builder()
                .workflowId(context.getWorkflowId())
                .threadId(context.getThreadId())
                .status(RunStatusEnum.FAILED)
                .output(outputOf(state))
                .pendingNodes(new ArrayList<>())
                .steps(steps)
                .errorCode(code.getCode())
                .errorMessage(message)
                .state(state)
                .build();
    }

    private void persist(ExecutionContext context, ExecutionState state, int steps, String sourceNodeId,
                         List<String> pendingNodes, boolean interrupted) {
        CheckpointEntity saved = context.getCheckpointRepository().append(CheckpointEntity.builder()
                .workflowId(context.getWorkflowId())
                .threadId(context.getThreadId())
                .stepIndex(steps)
                .sourceNodeId(sourceNodeId)
                .state(state)
                .pendingNodes(pendingNodes)
                .interrupted(interrupted)
                .build());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("checkpoint_id", saved.getCheckpointId());
        payload.put("step_index", saved.getStepIndex());
        payload.put("pending_nodes", saved.getPendingNodes());
        context.getEmitter().emit(StreamEventTypeEnum.CHECKPOINT, sourceNodeId, null, payload);
    }

    private RunResult finish(ExecutionContext context, RunResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", result.getStatus().getCode());
        payload.put("output", result.getOutput());
        payload.put("steps", result.getSteps());
        if (result.getErrorCode() != null) {
            payload.put("error_code", result.getErrorCode());
        }
        context.getEmitter().emit(StreamEventTypeEnum.WORKFLOW_END, payload);
        log.info("Workflow run finished. workflowId={}, threadId={}, status={}, steps={}",
                context.getWorkflowId(), context.getThreadId(), result.getStatus().getCode(), result.getSteps());
        result.setEvents(context.getEmitter().getEvents());
        return result;
    }

    private void emitWorkflowStart(ExecutionContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflow_id", context.getWorkflowId());
        payload.put("thread_id", context.getThreadId());
        context.getEmitter().emit(StreamEventTypeEnum.WORKFLOW_START, payload);
    }

    private ExecutionContext newContext(String workflowId, String threadId, String userId, Consumer<StreamEvent> observer) {
        StreamEventEmitter emitter = new StreamEventEmitter();
        emitter.subscribe(observer);
        return ExecutionContext.builder()
                .workflowId(workflowId)
                .threadId(threadId)
                .userId(userId)
                .checkpointRepository(checkpointRepository)
                .emitter(emitter)
                .runtimeServices(runtimeServices)
                .subgraphRunner(this)
                .depth(0)
                .build();
    }

    private Map<String, Object> resolveDefinition(String workflowId, Map<String, Object> definition) {
        if (definition != null && !definition.isEmpty()) {
            return definition;
        }
        Map<String, Object> stored = workflowDefinitionRepository.findById(workflowId);
        if (stored == null) {
            throw new AppException(ResponseCode.WORKFLOW_NOT_FOUND, "Workflow not found: " + workflowId);
        }
        return stored;
    }

    /**
     * inputs.message 作为首条人类消息，全部 inputs 放入 input 命名空间。
     */
    private ExecutionState initialState(Map<String, Object> inputs) {
        ExecutionState state = ExecutionState.initial();
        if (inputs == null || inputs.isEmpty()) {
            return state;
        }
        Object message = inputs.get("message");
        if (message != null && StringUtils.isNotBlank(String.valueOf(message))) {
            state.getMessages().add(ChatMessage.human(String.valueOf(message)));
        }
        state.getVariables().put(Constants.INPUT_NAMESPACE, new LinkedHashMap<>(inputs));
        return state;
    }

    private void acquire(String workflowId, String threadId) {
        if (!activeThreads.add(workflowId + ":" + threadId)) {
            throw new AppException(ResponseCode.THREAD_BUSY, "Thread is already running: " + threadId);
        }
    }

    private void release(String workflowId, String threadId) {
        activeThreads.remove(workflowId + ":" + threadId);
    }

    private StateSnapshot toSnapshot(CheckpointEntity checkpoint) {
        return StateSnapshot.builder()
                .workflowId(checkpoint.getWorkflowId())
                .threadId(checkpoint.getThreadId())
                .checkpointId(checkpoint.getCheckpointId())
                .stepIndex(checkpoint.getStepIndex())
                .values(checkpoint.getState())
                .nextNodes(checkpoint.getPendingNodes() == null ? new ArrayList<>() : new ArrayList<>(checkpoint.getPendingNodes()))
                .createdAt(checkpoint.getCreatedAt())
                .build();
    }

    private Map<String, Object> stateUpdatePayload(StateUpdate update, ExecutionState state) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("variables", update == null || update.getVariables() == null ? Collections.emptyMap() : update.getVariables());
        payload.put("iteration_count", state.getIterationCount());
        payload.put("current_agent", state.getCurrentAgent());
        return payload;
    }

    private Map<String, Object> payloadOf(String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(key, value);
        return payload;
    }

    private List<String> pendingOf(String nodeId) {
        List<String> pending = new ArrayList<>();
        if (nodeId != null && !Constants.END.equals(nodeId)) {
            pending.add(nodeId);
        }
        return pending;
    }

    private String outputOf(ExecutionState state) {
        if (state.getFinalOutput() != null) {
            return state.getFinalOutput();
        }
        ChatMessage last = state.lastMessage();
        return last == null ? "" : last.getContent();
    }

    private String stringMetadata(ExecutionState state, String key) {
        Object value = state.getMetadata() == null ? null : state.getMetadata().get(key);
        return value == null ? null : String.valueOf(value);
    }
}
