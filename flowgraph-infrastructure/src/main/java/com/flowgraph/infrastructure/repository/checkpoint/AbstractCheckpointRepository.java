package com.flowgraph.infrastructure.repository.checkpoint;

import com.flowgraph.domain.execution.adapter.repository.ICheckpointRepository;
import com.flowgraph.domain.execution.model.entity.CheckpointEntity;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.execution.service.StateReducers;
import com.flowgraph.types.enums.ResponseCode;
import com.flowgraph.types.exception.AppException;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;

import java.util.ArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 检查点存储公共部分：每个 (workflowId, threadId) 独立一把锁，以及 injectValue 的合并语义。
 * <p>
 * 锁按精确 key 缓存（弱引用值），不同 threadId 的写入互不阻塞；无人持有的锁可被回收。
 * </p>
 */
public abstract class AbstractCheckpointRepository implements ICheckpointRepository {

    private final LoadingCache<String, Lock> threadLocks = CacheBuilder.newBuilder()
            .weakValues()
            .build(CacheLoader.from(key -> new ReentrantLock()));

    protected Lock lockFor(String workflowId, String threadId) {
        return threadLocks.getUnchecked(key(workflowId, threadId));
    }

    protected String key(String workflowId, String threadId) {
        return workflowId + "::" + threadId;
    }

    @Override
    public CheckpointEntity injectValue(String workflowId, String threadId, StateUpdate update) {
        Lock lock = lockFor(workflowId, threadId);
        lock.lock();
        try {
            CheckpointEntity latest = findLatest(workflowId, threadId);
            if (latest == null) {
                throw new AppException(ResponseCode.THREAD_NOT_FOUND, "Thread not found: " + threadId);
            }
            ExecutionState merged = StateReducers.apply(latest.getState(), update);
            return append(CheckpointEntity.builder()
                    .workflowId(workflowId)
                    .threadId(threadId)
                    .stepIndex(latest.getStepIndex())
                    .state(merged)
                    .pendingNodes(latest.getPendingNodes() == null ? new ArrayList<>() : new ArrayList<>(latest.getPendingNodes()))
                    .interrupted(latest.isInterrupted())
                    .build());
        } finally {
            lock.unlock();
        }
    }
}
