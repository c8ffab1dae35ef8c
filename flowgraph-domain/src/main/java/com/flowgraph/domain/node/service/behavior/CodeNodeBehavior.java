package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 用户代码节点。返回 Map 时整体作为本节点命名空间，否则写入 output_key。
 */
@Slf4j
public class CodeNodeBehavior extends AbstractNodeBehavior {

    public CodeNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        String outputKey = configString("output_key", "output");
        String code = configString("code", "");
        if (StringUtils.isBlank(code)) {
            return setVariable(outputKey, "");
        }

        Map<String, Object> kwargs = new LinkedHashMap<>();
        for (Object input : configList("code_input")) {
            if (!(input instanceof Map<?, ?> item)) {
                continue;
            }
            String key = stringify(item.get("key"));
            String ref = stringify(item.get("ref"));
            if (StringUtils.isEmpty(key)) {
                continue;
            }
            kwargs.put(key, StringUtils.isNotEmpty(ref) ? getVariable(state, ref) : valueOrEmpty(item.get("value")));
        }

        Object result;
        try {
            result = context.codeSandbox().execute(code, kwargs);
        } catch (Exception ex) {
            log.error("Code execution failed. nodeId={}, error={}", getId(), ex.getMessage(), ex);
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", ex.getMessage());
            result = error;
        }

        if (result instanceof Map<?, ?> map) {
            Map<String, Object> outputs = new LinkedHashMap<>();
            map.forEach((key, value) -> outputs.put(String.valueOf(key), value));
            return StateUpdate.namespace(getId(), outputs);
        }
        return setVariable(outputKey, result);
    }

    private Object valueOrEmpty(Object value) {
        return value == null ? "" : value;
    }
}
