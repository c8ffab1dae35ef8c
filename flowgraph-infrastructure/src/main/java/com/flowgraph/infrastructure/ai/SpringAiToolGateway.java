package com.flowgraph.infrastructure.ai;

import com.flowgraph.domain.node.adapter.gateway.IToolGateway;
import com.flowgraph.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.resolution.ToolCallbackResolver;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通过 ToolCallbackResolver 按名称解析并直接调用工具。
 * 字符串入参不是 JSON 对象时包装为 {"input": text}。
 */
@Slf4j
@Component
public class SpringAiToolGateway implements IToolGateway {

    private final ToolCallbackResolver toolCallbackResolver;
    private final JsonCodec jsonCodec;

    public SpringAiToolGateway(ToolCallbackResolver toolCallbackResolver, JsonCodec jsonCodec) {
        this.toolCallbackResolver = toolCallbackResolver;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public String invoke(String toolId, Object input) {
        if (StringUtils.isBlank(toolId)) {
            throw new IllegalArgumentException("toolId cannot be blank");
        }
        ToolCallback callback = toolCallbackResolver.resolve(toolId);
        if (callback == null) {
            throw new IllegalArgumentException("Tool not found: " + toolId);
        }
        String arguments = toArguments(input);
        log.debug("Tool invoke. toolId={}, arguments={}", toolId, arguments);
        return callback.call(arguments);
    }

    private String toArguments(Object input) {
        if (input == null) {
            return "{}";
        }
        if (input instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
                return trimmed;
            }
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("input", text);
            return jsonCodec.writeValue(wrapped);
        }
        return jsonCodec.writeValue(input);
    }
}
