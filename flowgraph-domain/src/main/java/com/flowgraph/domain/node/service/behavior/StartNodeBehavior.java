package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import com.flowgraph.types.common.Constants;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 入口节点：以字面量配置初始化自身命名空间，并写入运行元数据。
 * 配置键 current_time 替换为当前时间。
 */
public class StartNodeBehavior extends AbstractNodeBehavior {

    public static final String CURRENT_TIME_KEY = "current_time";

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern(Constants.DATE_TIME_PATTERN);

    public StartNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        Map<String, Object> initVars = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : config().entrySet()) {
            if (CURRENT_TIME_KEY.equals(entry.getKey())) {
                initVars.put(entry.getKey(), LocalDateTime.now().format(TIME_FORMATTER));
            } else if (entry.getValue() != null) {
                initVars.put(entry.getKey(), entry.getValue());
            }
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("workflow_id", context.getWorkflowId());
        metadata.put("user_id", context.getUserId());
        metadata.put("start_time", LocalDateTime.now().toString());

        StateUpdate update = StateUpdate.namespace(getId(), initVars);
        update.setMetadata(metadata);
        return update;
    }
}
