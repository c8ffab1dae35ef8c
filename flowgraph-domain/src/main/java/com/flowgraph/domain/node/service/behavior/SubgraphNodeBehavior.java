package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.RunResult;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import com.flowgraph.types.enums.ResponseCode;
import com.flowgraph.types.enums.RunStatusEnum;
import com.flowgraph.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 子工作流节点：按 input_mapping 构造子状态，同步运行子图，再按 output_mapping 回写。
 * <p>
 * 子运行失败或挂起都不会中断父运行，错误以文本写入本节点的 output_key。
 * </p>
 */
@Slf4j
public class SubgraphNodeBehavior extends AbstractNodeBehavior {

    public SubgraphNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        String outputKey = configString("output_key", "output");
        String subWorkflowId = configString("sub_workflow_id", "");
        if (StringUtils.isBlank(subWorkflowId)) {
            return setVariable(outputKey, "Error: No sub-workflow configured");
        }

        ExecutionState childState = ExecutionState.initial();
        for (Map.Entry<String, Object> entry : configMap("input_mapping").entrySet()) {
            String childKey = stringify(entry.getValue());
            Object value = getVariable(state, entry.getKey());
            if ("messages".equals(childKey)) {
                if (value != null) {
                    childState.getMessages().add(ChatMessage.human(stringify(value)));
                }
            } else if (StringUtils.isNotBlank(childKey)) {
                childState.getVariables().put(childKey, value);
            }
        }

        RunResult result;
        try {
            result = context.runSubgraph(subWorkflowId, childState);
        } catch (AppException ex) {
            if (ex.is(ResponseCode.WORKFLOW_NOT_FOUND)) {
                log.warn("Sub-workflow not found. nodeId={}, subWorkflowId={}", getId(), subWorkflowId);
                return setVariable(outputKey, "Error: " + ex.getInfo());
            }
            log.error("Sub-workflow run failed. nodeId={}, subWorkflowId={}, error={}", getId(), subWorkflowId, ex.getMessage());
            return setVariable(outputKey, "SubGraph error: " + ex.getMessage());
        } catch (Exception ex) {
            log.error("Sub-workflow run failed. nodeId={}, subWorkflowId={}, error={}", getId(), subWorkflowId, ex.getMessage());
            return setVariable(outputKey, "SubGraph error: " + ex.getMessage());
        }
        if (result == null || result.getStatus() != RunStatusEnum.COMPLETED) {
            String message = result == null ? "no result" : describeFailure(result);
            log.warn("Sub-workflow finished with failure. nodeId={}, subWorkflowId={}, error={}", getId(), subWorkflowId, message);
            return setVariable(outputKey, "SubGraph error: " + message);
        }

        ExecutionState finalState = result.getState() == null ? ExecutionState.initial() : result.getState();
        Map<String, Object> outputs = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : configMap("output_mapping").entrySet()) {
            String parentKey = stringify(entry.getValue());
            Object value = finalState.resolveVariable(entry.getKey());
            if (value == null && "final_output".equals(entry.getKey())) {
                value = finalState.getFinalOutput();
            }
            if (value != null && StringUtils.isNotBlank(parentKey)) {
                outputs.put(parentKey, value);
            }
        }
        if (outputs.isEmpty()) {
            outputs.put(outputKey, finalState.getFinalOutput() == null ? stringify(result.getOutput()) : finalState.getFinalOutput());
        }
        return StateUpdate.namespace(getId(), outputs);
    }

    private String describeFailure(RunResult result) {
        if (result.getStatus() == RunStatusEnum.SUSPENDED) {
            return "Sub-workflow suspended at " + result.getPendingNodes();
        }
        return result.getErrorMessage();
    }
}
