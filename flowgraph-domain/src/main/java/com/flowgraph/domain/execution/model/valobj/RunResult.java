package com.flowgraph.domain.execution.model.valobj;

import com.flowgraph.types.enums.RunStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 一次 run/resume 的结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResult {

    private String workflowId;
    private String threadId;
    private RunStatusEnum status;
    /** finalOutput，缺省时取最后一条消息 */
    private String output;
    /** 挂起时等待的节点 */
    private List<String> pendingNodes;
    /** 执行的节点步数 */
    private int steps;
    private String errorCode;
    private String errorMessage;
    private ExecutionState state;
    private List<StreamEvent> events;
}
