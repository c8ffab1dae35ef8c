package com.flowgraph.infrastructure.dao;

import com.flowgraph.infrastructure.dao.po.CheckpointPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * Checkpoint DAO。
 */
@Mapper
public interface CheckpointDao {

    int insert(CheckpointPO po);

    CheckpointPO selectLatest(@Param("workflowId") String workflowId,
                              @Param("threadId") String threadId);

    List<CheckpointPO> selectHistory(@Param("workflowId") String workflowId,
                                     @Param("threadId") String threadId,
                                     @Param("limit") int limit);
}
