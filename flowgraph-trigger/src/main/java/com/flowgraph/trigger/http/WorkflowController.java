package com.flowgraph.trigger.http;

import com.flowgraph.api.dto.NodeTypeDTO;
import com.flowgraph.api.dto.StreamEventDTO;
import com.flowgraph.api.dto.ValidationReportDTO;
import com.flowgraph.api.dto.WorkflowResumeRequestDTO;
import com.flowgraph.api.dto.WorkflowRunRequestDTO;
import com.flowgraph.api.dto.WorkflowRunResponseDTO;
import com.flowgraph.api.dto.WorkflowStateDTO;
import com.flowgraph.api.response.Response;
import com.flowgraph.domain.execution.model.valobj.RunResult;
import com.flowgraph.domain.execution.model.valobj.StateSnapshot;
import com.flowgraph.domain.execution.model.valobj.StreamEvent;
import com.flowgraph.domain.graph.model.valobj.ValidationReport;
import com.flowgraph.trigger.application.common.WorkflowViewAssembler;
import com.flowgraph.trigger.application.workflow.WorkflowExecutionApplicationService;
import com.flowgraph.types.enums.ResponseCode;
import com.flowgraph.types.enums.StreamEventTypeEnum;
import com.flowgraph.types.exception.AppException;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 工作流运行 API：同步运行、SSE 流式运行、恢复、状态查询与结构校验。
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private static final long SSE_TIMEOUT_MS = 30L * 60L * 1000L;

    private final WorkflowExecutionApplicationService workflowExecutionApplicationService;
    private final WorkflowViewAssembler workflowViewAssembler;
    private final Executor workflowStreamExecutor;

    public WorkflowController(WorkflowExecutionApplicationService workflowExecutionApplicationService,
                              WorkflowViewAssembler workflowViewAssembler,
                              @Qualifier("workflowStreamExecutor") Executor workflowStreamExecutor) {
        this.workflowExecutionApplicationService = workflowExecutionApplicationService;
        this.workflowViewAssembler = workflowViewAssembler;
        this.workflowStreamExecutor = workflowStreamExecutor;
    }

    @PostMapping("/{id}/run")
    public Response<WorkflowRunResponseDTO> run(@PathVariable("id") String workflowId,
                                                @RequestBody(required = false) WorkflowRunRequestDTO request) {
        WorkflowRunRequestDTO body = request == null ? new WorkflowRunRequestDTO() : request;
        RunResult result = workflowExecutionApplicationService.run(workflowId, body.getDefinition(),
                body.getThreadId(), body.getUserId(), body.getInputs());
        return success(workflowViewAssembler.toRunResponse(result));
    }

    @PostMapping("/{id}/invoke")
    public Response<WorkflowRunResponseDTO> invoke(@PathVariable("id") String workflowId,
                                                   @RequestBody(required = false) WorkflowRunRequestDTO request) {
        return run(workflowId, request);
    }

    @PostMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable("id") String workflowId,
                             @RequestBody(required = false) WorkflowRunRequestDTO request,
                             HttpServletResponse response) {
        WorkflowRunRequestDTO body = request == null ? new WorkflowRunRequestDTO() : request;
        applySseResponseHeaders(response);
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        AtomicBoolean closed = new AtomicBoolean(false);
        emitter.onCompletion(() -> closed.set(true));
        emitter.onTimeout(() -> {
            closed.set(true);
            log.info("WORKFLOW_STREAM_TIMEOUT workflowId={}, threadId={}", workflowId, body.getThreadId());
        });
        emitter.onError(ex -> {
            closed.set(true);
            log.debug("WORKFLOW_STREAM_EMITTER_ERROR workflowId={}, error={}",
                    workflowId, ex == null ? "unknown" : ex.getMessage());
        });

        Consumer<StreamEvent> observer = event -> send(emitter, closed, workflowViewAssembler.toEvent(event));
        try {
            workflowStreamExecutor.execute(() -> {
                try {
                    workflowExecutionApplicationService.stream(workflowId, body.getDefinition(),
                            body.getThreadId(), body.getUserId(), body.getInputs(), observer);
                } catch (AppException ex) {
                    log.warn("WORKFLOW_STREAM_REJECTED workflowId={}, errorCode={}, error={}",
                            workflowId, ex.getCode(), ex.getInfo());
                    send(emitter, closed, errorEvent(ex.getCode(), ex.getInfo()));
                } catch (Exception ex) {
                    log.error("WORKFLOW_STREAM_FAILED workflowId={}", workflowId, ex);
                    send(emitter, closed, errorEvent(ResponseCode.UN_ERROR.getCode(), ex.getMessage()));
                } finally {
                    complete(emitter, closed);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.warn("WORKFLOW_STREAM_EXECUTOR_FULL workflowId={}, error={}", workflowId, ex.getMessage());
            send(emitter, closed, errorEvent(ResponseCode.UN_ERROR.getCode(), "stream executor is saturated"));
            complete(emitter, closed);
        }
        return emitter;
    }

    @PostMapping("/{id}/resume")
    public Response<WorkflowRunResponseDTO> resume(@PathVariable("id") String workflowId,
                                                   @RequestBody WorkflowResumeRequestDTO request) {
        RunResult result = workflowExecutionApplicationService.resume(workflowId, request.getDefinition(),
                request.getThreadId(), request.getFeedback(), null);
        return success(workflowViewAssembler.toRunResponse(result));
    }

    @GetMapping("/{id}/state")
    public Response<WorkflowStateDTO> state(@PathVariable("id") String workflowId,
                                            @RequestParam("threadId") String threadId) {
        StateSnapshot snapshot = workflowExecutionApplicationService.getState(workflowId, threadId);
        return success(workflowViewAssembler.toState(snapshot));
    }

    @GetMapping("/{id}/history")
    public Response<List<WorkflowStateDTO>> history(@PathVariable("id") String workflowId,
                                                    @RequestParam("threadId") String threadId,
                                                    @RequestParam(value = "limit", required = false, defaultValue = "0") int limit) {
        List<WorkflowStateDTO> data = new ArrayList<>();
        for (StateSnapshot snapshot : workflowExecutionApplicationService.getHistory(workflowId, threadId, limit)) {
            data.add(workflowViewAssembler.toState(snapshot));
        }
        return success(data);
    }

    @PostMapping("/validate")
    public Response<ValidationReportDTO> validate(@RequestBody Map<String, Object> definition) {
        ValidationReport report = workflowExecutionApplicationService.validate(definition);
        return success(workflowViewAssembler.toValidation(report));
    }

    @GetMapping("/node-types")
    public Response<List<NodeTypeDTO>> nodeTypes() {
        List<NodeTypeDTO> data = new ArrayList<>();
        for (Map<String, Object> item : workflowExecutionApplicationService.nodeTypes()) {
            data.add(workflowViewAssembler.toNodeType(item));
        }
        return success(data);
    }

    @PutMapping("/{id}/definition")
    public Response<ValidationReportDTO> registerDefinition(@PathVariable("id") String workflowId,
                                                            @RequestBody Map<String, Object> definition) {
        ValidationReport report = workflowExecutionApplicationService.registerDefinition(workflowId, definition);
        return success(workflowViewAssembler.toValidation(report));
    }

    private void send(SseEmitter emitter, AtomicBoolean closed, StreamEventDTO event) {
        if (closed.get()) {
            return;
        }
        try {
            SseEmitter.SseEventBuilder builder = SseEmitter.event()
                    .name(event.getType())
                    .data(event);
            if (event.getSequence() != null) {
                builder.id(String.valueOf(event.getSequence()));
            }
            emitter.send(builder);
        } catch (IOException | IllegalStateException ex) {
            closed.set(true);
            log.debug("WORKFLOW_STREAM_SEND_FAILED eventType={}, error={}", event.getType(), ex.getMessage());
        }
    }

    private void complete(SseEmitter emitter, AtomicBoolean closed) {
        if (closed.compareAndSet(false, true)) {
            emitter.complete();
        }
    }

    private StreamEventDTO errorEvent(String code, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error_code", code);
        payload.put("error", StringUtils.defaultString(message));
        StreamEventDTO dto = new StreamEventDTO();
        dto.setType(StreamEventTypeEnum.ERROR.getCode());
        dto.setPayload(payload);
        dto.setTimestamp(LocalDateTime.now().toString());
        return dto;
    }

    private void applySseResponseHeaders(HttpServletResponse response) {
        if (response == null) {
            return;
        }
        response.setHeader("Cache-Control", "no-cache, no-transform");
        response.setHeader("X-Accel-Buffering", "no");
        response.setHeader("Connection", "keep-alive");
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
