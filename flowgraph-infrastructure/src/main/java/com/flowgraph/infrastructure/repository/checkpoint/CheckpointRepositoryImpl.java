package com.flowgraph.infrastructure.repository.checkpoint;

import com.flowgraph.domain.execution.model.entity.CheckpointEntity;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.infrastructure.dao.CheckpointDao;
import com.flowgraph.infrastructure.dao.po.CheckpointPO;
import com.flowgraph.infrastructure.util.JsonCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.stream.Collectors;

/**
 * PostgreSQL 检查点仓储实现（flowgraph_checkpoint 表，状态与待执行节点为 JSONB 列）。
 */
@Repository
@ConditionalOnProperty(prefix = "flowgraph.checkpoint", name = "store", havingValue = "postgres")
public class CheckpointRepositoryImpl extends AbstractCheckpointRepository {

    private final CheckpointDao checkpointDao;
    private final JsonCodec jsonCodec;

    public CheckpointRepositoryImpl(CheckpointDao checkpointDao, JsonCodec jsonCodec) {
        this.checkpointDao = checkpointDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public CheckpointEntity append(CheckpointEntity checkpoint) {
        checkpoint.validate();
        Lock lock = lockFor(checkpoint.getWorkflowId(), checkpoint.getThreadId());
        lock.lock();
        try {
            checkpoint.setCheckpointId(UUID.randomUUID().toString());
            checkpoint.setCreatedAt(LocalDateTime.now());
            CheckpointPO po = toPO(checkpoint);
            checkpointDao.insert(po);
            return toEntity(po);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CheckpointEntity findLatest(String workflowId, String threadId) {
        CheckpointPO po = checkpointDao.selectLatest(workflowId, threadId);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<CheckpointEntity> findHistory(String workflowId, String threadId, int limit) {
        return checkpointDao.selectHistory(workflowId, threadId, limit <= 0 ? Integer.MAX_VALUE : limit)
                .stream().map(this::toEntity).collect(Collectors.toList());
    }

    private CheckpointEntity toEntity(CheckpointPO po) {
        CheckpointEntity entity = new CheckpointEntity();
        entity.setCheckpointId(po.getCheckpointId());
        entity.setWorkflowId(po.getWorkflowId());
        entity.setThreadId(po.getThreadId());
        entity.setSequence(po.getId() == null ? 0L : po.getId());
        entity.setStepIndex(po.getStepIndex() == null ? 0 : po.getStepIndex());
        entity.setSourceNodeId(po.getSourceNodeId());
        entity.setState(jsonCodec.readValue(po.getStateJson(), ExecutionState.class));
        List<String> pending = jsonCodec.readStringList(po.getPendingNodes());
        entity.setPendingNodes(pending == null ? new ArrayList<>() : pending);
        entity.setInterrupted(Boolean.TRUE.equals(po.getInterrupted()));
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private CheckpointPO toPO(CheckpointEntity entity) {
        CheckpointPO po = CheckpointPO.builder()
                .checkpointId(entity.getCheckpointId())
                .workflowId(entity.getWorkflowId())
                .threadId(entity.getThreadId())
                .stepIndex(entity.getStepIndex())
                .sourceNodeId(entity.getSourceNodeId())
                .interrupted(entity.isInterrupted())
                .createdAt(entity.getCreatedAt())
                .build();
        po.setStateJson(jsonCodec.writeValue(entity.getState()));
        po.setPendingNodes(jsonCodec.writeValue(entity.getPendingNodes()));
        return po;
    }
}
