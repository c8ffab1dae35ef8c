package com.flowgraph.domain.execution.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 线程当前状态快照。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateSnapshot {

    private String workflowId;
    private String threadId;
    private String checkpointId;
    private int stepIndex;
    private ExecutionState values;
    private List<String> nextNodes;
    private LocalDateTime createdAt;
}
