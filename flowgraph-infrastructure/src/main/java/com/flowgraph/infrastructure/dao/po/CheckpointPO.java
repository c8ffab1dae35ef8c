package com.flowgraph.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Checkpoint PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointPO {

    private Long id;
    private String checkpointId;
    private String workflowId;
    private String threadId;
    private Integer stepIndex;
    private String sourceNodeId;
    private String stateJson;
    private String pendingNodes;
    private Boolean interrupted;
    private LocalDateTime createdAt;
}
