package com.flowgraph.infrastructure.repository.checkpoint;

import com.flowgraph.domain.execution.model.entity.CheckpointEntity;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;

/**
 * 进程内检查点存储，默认实现。快照写入与读取时都做深拷贝。
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "flowgraph.checkpoint", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryCheckpointRepository extends AbstractCheckpointRepository {

    private final Map<String, List<CheckpointEntity>> checkpoints = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0L);
    private final JsonCodec jsonCodec;

    public InMemoryCheckpointRepository(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    @Override
    public CheckpointEntity append(CheckpointEntity checkpoint) {
        checkpoint.validate();
        Lock lock = lockFor(checkpoint.getWorkflowId(), checkpoint.getThreadId());
        lock.lock();
        try {
            CheckpointEntity stored = copyOf(checkpoint);
            stored.setSequence(sequence.incrementAndGet());
            stored.setCheckpointId(UUID.randomUUID().toString());
            stored.setCreatedAt(LocalDateTime.now());
            checkpoints.computeIfAbsent(key(checkpoint.getWorkflowId(), checkpoint.getThreadId()),
                    ignored -> new CopyOnWriteArrayList<>()).add(stored);
            log.debug("Checkpoint appended. workflowId={}, threadId={}, stepIndex={}, pending={}",
                    stored.getWorkflowId(), stored.getThreadId(), stored.getStepIndex(), stored.getPendingNodes());
            return copyOf(stored);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CheckpointEntity findLatest(String workflowId, String threadId) {
        List<CheckpointEntity> history = checkpoints.get(key(workflowId, threadId));
        if (history == null || history.isEmpty()) {
            return null;
        }
        return copyOf(history.get(history.size() - 1));
    }

    @Override
    public List<CheckpointEntity> findHistory(String workflowId, String threadId, int limit) {
        List<CheckpointEntity> history = checkpoints.get(key(workflowId, threadId));
        List<CheckpointEntity> result = new ArrayList<>();
        if (history == null) {
            return result;
        }
        List<CheckpointEntity> snapshot = new ArrayList<>(history);
        for (int i = snapshot.size() - 1; i >= 0 && (limit <= 0 || result.size() < limit); i--) {
            result.add(copyOf(snapshot.get(i)));
        }
        return result;
    }

    private CheckpointEntity copyOf(CheckpointEntity source) {
        return CheckpointEntity.builder()
                .checkpointId(source.getCheckpointId())
                .workflowId(source.getWorkflowId())
                .threadId(source.getThreadId())
                .sequence(source.getSequence())
                .stepIndex(source.getStepIndex())
                .sourceNodeId(source.getSourceNodeId())
                .state(jsonCodec.deepCopy(source.getState(), ExecutionState.class))
                .pendingNodes(source.getPendingNodes() == null ? new ArrayList<>() : new ArrayList<>(source.getPendingNodes()))
                .interrupted(source.isInterrupted())
                .createdAt(source.getCreatedAt())
                .build();
    }
}
