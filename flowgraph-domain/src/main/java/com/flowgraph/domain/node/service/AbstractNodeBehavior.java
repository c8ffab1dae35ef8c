package com.flowgraph.domain.node.service;

import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.types.common.Constants;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 节点行为基类：配置读取、变量引用与模板插值。
 * <p>
 * 模板语法为 {{#nodeId.key#}}，无法解析的引用替换为空字符串。
 * </p>
 */
public abstract class AbstractNodeBehavior implements NodeBehavior {

    private static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\{\\{#([^#]+)#\\}\\}");

    protected final NodeSpec spec;

    protected AbstractNodeBehavior(NodeSpec spec) {
        this.spec = spec;
    }

    @Override
    public NodeSpec getSpec() {
        return spec;
    }

    protected Map<String, Object> config() {
        return spec.getConfig() == null ? Collections.emptyMap() : spec.getConfig();
    }

    protected Object configValue(String key) {
        return config().get(key);
    }

    protected String configString(String key, String defaultValue) {
        Object value = configValue(key);
        if (value == null) {
            return defaultValue;
        }
        String text = String.valueOf(value);
        return StringUtils.isEmpty(text) ? defaultValue : text;
    }

    protected int configInt(String key, int defaultValue) {
        Object value = configValue(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && StringUtils.isNotBlank(text)) {
            try {
                return (int) Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    protected Double configDouble(String key, Double defaultValue) {
        Object value = configValue(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && StringUtils.isNotBlank(text)) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    protected boolean configBoolean(String key, boolean defaultValue) {
        Object value = configValue(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text && StringUtils.isNotBlank(text)) {
            return Boolean.parseBoolean(text.trim());
        }
        return defaultValue;
    }

    protected List<Object> configList(String key) {
        Object value = configValue(key);
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return new ArrayList<>();
    }

    protected List<String> configStringList(String key) {
        Object value = configValue(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && StringUtils.isNotBlank(String.valueOf(item))) {
                    result.add(String.valueOf(item).trim());
                }
            }
        } else if (value instanceof String text && StringUtils.isNotBlank(text)) {
            for (String part : text.split(",")) {
                if (StringUtils.isNotBlank(part)) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    protected Map<String, Object> configMap(String key) {
        Object value = configValue(key);
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() != null) {
                    result.put(String.valueOf(entry.getKey()), entry.getValue());
                }
            }
            return result;
        }
        return new LinkedHashMap<>();
    }

    /**
     * 按 nodeId.key 引用读取变量。
     */
    protected Object getVariable(ExecutionState state, String reference) {
        return state == null ? null : state.resolveVariable(reference);
    }

    protected String resolveTemplate(String template, ExecutionState state) {
        if (StringUtils.isEmpty(template) || !template.contains("{{#")) {
            return template == null ? "" : template;
        }
        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            Object value = getVariable(state, matcher.group(1));
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(value == null ? "" : String.valueOf(value)));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    protected StateUpdate setVariable(String key, Object value) {
        return StateUpdate.variable(getId(), key, value);
    }

    protected String lastMessageText(ExecutionState state) {
        ChatMessage last = state == null ? null : state.lastMessage();
        return last == null || last.getContent() == null ? "" : last.getContent();
    }

    /**
     * 配置的 target 已声明时返回它，否则返回 fallback。
     */
    protected String declaredOr(String configured, List<String> targets, String fallback) {
        if (StringUtils.isNotBlank(configured) && targets != null && targets.contains(configured)) {
            return configured;
        }
        return fallback;
    }

    protected String firstTarget(List<String> targets) {
        return targets == null || targets.isEmpty() ? Constants.END : targets.get(0);
    }

    protected String lastTarget(List<String> targets) {
        return targets == null || targets.isEmpty() ? Constants.END : targets.get(targets.size() - 1);
    }

    protected static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
