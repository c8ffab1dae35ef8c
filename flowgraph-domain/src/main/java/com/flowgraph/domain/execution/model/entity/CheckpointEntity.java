package com.flowgraph.domain.execution.model.entity;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 检查点实体。
 * <p>
 * (workflowId, threadId) 范围内只追加，不覆盖。sequence 由存储分配，
 * stepIndex 为保存时已执行的节点步数（挂起与注入反馈时会出现相同步数）。
 * </p>
 *
 * @author flowgraph
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointEntity {

    private String checkpointId;
    private String workflowId;
    private String threadId;
    /** 存储内单调递增序号 */
    private long sequence;
    /** 已执行步数 */
    private int stepIndex;
    /** 产生该检查点的节点，注入反馈时为 null */
    private String sourceNodeId;
    private ExecutionState state;
    /** 待执行节点 */
    private List<String> pendingNodes;
    /** 是否停在中断节点前等待反馈 */
    private boolean interrupted;
    private LocalDateTime createdAt;

    public void validate() {
        if (StringUtils.isBlank(workflowId)) {
            throw new IllegalArgumentException("workflowId cannot be blank");
        }
        if (StringUtils.isBlank(threadId)) {
            throw new IllegalArgumentException("threadId cannot be blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (pendingNodes == null) {
            pendingNodes = new ArrayList<>();
        }
    }
}
