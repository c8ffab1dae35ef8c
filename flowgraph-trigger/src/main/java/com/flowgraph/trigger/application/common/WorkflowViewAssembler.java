package com.flowgraph.trigger.application.common;

import com.flowgraph.api.dto.NodeTypeDTO;
import com.flowgraph.api.dto.StreamEventDTO;
import com.flowgraph.api.dto.ValidationReportDTO;
import com.flowgraph.api.dto.WorkflowRunResponseDTO;
import com.flowgraph.api.dto.WorkflowStateDTO;
import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.RunResult;
import com.flowgraph.domain.execution.model.valobj.StateSnapshot;
import com.flowgraph.domain.execution.model.valobj.StreamEvent;
import com.flowgraph.domain.graph.model.valobj.ValidationReport;
import com.flowgraph.types.common.Constants;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 领域对象 → 接口 DTO。
 */
@Component
public class WorkflowViewAssembler {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern(Constants.DATE_TIME_PATTERN);

    public WorkflowRunResponseDTO toRunResponse(RunResult result) {
        WorkflowRunResponseDTO dto = new WorkflowRunResponseDTO();
        dto.setWorkflowId(result.getWorkflowId());
        dto.setThreadId(result.getThreadId());
        dto.setStatus(result.getStatus() == null ? null : result.getStatus().getCode());
        dto.setOutput(result.getOutput());
        dto.setPendingNodes(result.getPendingNodes() == null ? new ArrayList<>() : new ArrayList<>(result.getPendingNodes()));
        dto.setSteps(result.getSteps());
        dto.setErrorCode(result.getErrorCode());
        dto.setErrorMessage(result.getErrorMessage());
        dto.setVariables(result.getState() == null ? new LinkedHashMap<>() : result.getState().getVariables());
        List<StreamEventDTO> events = new ArrayList<>();
        if (result.getEvents() != null) {
            for (StreamEvent event : result.getEvents()) {
                events.add(toEvent(event));
            }
        }
        dto.setEvents(events);
        return dto;
    }

    public StreamEventDTO toEvent(StreamEvent event) {
        StreamEventDTO dto = new StreamEventDTO();
        dto.setSequence(event.getSequence());
        dto.setType(event.getEventType() == null ? null : event.getEventType().getCode());
        dto.setNodeId(event.getNodeId());
        dto.setNodeName(event.getNodeName());
        dto.setPayload(event.getPayload());
        dto.setTimestamp(event.getTimestamp() == null ? null : event.getTimestamp().format(TIME_FORMATTER));
        return dto;
    }

    public WorkflowStateDTO toState(StateSnapshot snapshot) {
        WorkflowStateDTO dto = new WorkflowStateDTO();
        dto.setWorkflowId(snapshot.getWorkflowId());
        dto.setThreadId(snapshot.getThreadId());
        dto.setCheckpointId(snapshot.getCheckpointId());
        dto.setStepIndex(snapshot.getStepIndex());
        dto.setNextNodes(snapshot.getNextNodes());
        dto.setCreatedAt(snapshot.getCreatedAt() == null ? null : snapshot.getCreatedAt().format(TIME_FORMATTER));
        ExecutionState values = snapshot.getValues();
        if (values != null) {
            List<Map<String, Object>> messages = new ArrayList<>();
            for (ChatMessage message : values.getMessages()) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("id", message.getId());
                item.put("role", message.getRole() == null ? null : message.getRole().getCode());
                item.put("content", message.getContent());
                if (message.getName() != null) {
                    item.put("name", message.getName());
                }
                messages.add(item);
            }
            dto.setMessages(messages);
            dto.setVariables(values.getVariables());
            dto.setCurrentAgent(values.getCurrentAgent());
            dto.setIterationCount(values.getIterationCount());
            dto.setHumanFeedback(values.getHumanFeedback());
            dto.setFinalOutput(values.getFinalOutput());
            dto.setMetadata(values.getMetadata());
        }
        return dto;
    }

    public ValidationReportDTO toValidation(ValidationReport report) {
        ValidationReportDTO dto = new ValidationReportDTO();
        dto.setValid(report.isValid());
        dto.setNodeCount(report.getNodeCount());
        dto.setEdgeCount(report.getEdgeCount());
        dto.setErrors(report.getErrors());
        dto.setWarnings(report.getWarnings());
        return dto;
    }

    @SuppressWarnings("unchecked")
    public NodeTypeDTO toNodeType(Map<String, Object> item) {
        NodeTypeDTO dto = new NodeTypeDTO();
        dto.setType((String) item.get("type"));
        dto.setLabel((String) item.get("label"));
        dto.setRouter(Boolean.TRUE.equals(item.get("router")));
        dto.setInterrupt(Boolean.TRUE.equals(item.get("interrupt")));
        dto.setConfigKeys((List<String>) item.get("configKeys"));
        return dto;
    }
}
