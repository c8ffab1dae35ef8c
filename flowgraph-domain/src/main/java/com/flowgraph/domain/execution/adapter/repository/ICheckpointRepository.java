package com.flowgraph.domain.execution.adapter.repository;

import com.flowgraph.domain.execution.model.entity.CheckpointEntity;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;

import java.util.List;

/**
 * 检查点仓储接口。
 * <p>
 * 以 (workflowId, threadId) 为键只追加保存。同一线程的写入严格有序，
 * 不同线程之间互不阻塞。
 * </p>
 */
public interface ICheckpointRepository {

    /**
     * 追加检查点，由存储分配 sequence、checkpointId 与 createdAt。
     * 保存的是状态的深拷贝。
     */
    CheckpointEntity append(CheckpointEntity checkpoint);

    /**
     * 最新检查点，不存在返回 null。
     */
    CheckpointEntity findLatest(String workflowId, String threadId);

    /**
     * 历史检查点，按时间倒序，最多 limit 条。
     */
    List<CheckpointEntity> findHistory(String workflowId, String threadId, int limit);

    /**
     * 不执行节点直接向最新状态合并更新，追加为新检查点，待执行节点保持不变。
     *
     * @throws com.flowgraph.types.exception.AppException 线程不存在时抛出 THREAD_NOT_FOUND
     */
    CheckpointEntity injectValue(String workflowId, String threadId, StateUpdate update);

}
