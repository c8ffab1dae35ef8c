package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.model.valobj.ModelRequest;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 反思节点：评估上游产出，给出 ACCEPT 或 RETRY: feedback。
 * <p>
 * 迭代计数达到 max_reflections 时无论评估结论如何都路由到 accept_target。
 * 评估调用失败按 ACCEPT 处理。
 * </p>
 */
@Slf4j
public class ReflectionNodeBehavior extends AbstractNodeBehavior {

    public static final int DEFAULT_MAX_REFLECTIONS = 3;
    public static final String ACCEPT = "ACCEPT";

    private static final String EVALUATOR_SYSTEM_PROMPT = "You are a quality evaluator. Be strict but fair.";

    public ReflectionNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        String outputKey = configString("output_key", "evaluation");
        String content = resolveContent(state);
        String prompt = buildPrompt(state, content);

        String evaluation;
        try {
            ModelRequest request = ModelRequest.builder()
                    .modelId(configString("model_id", null))
                    .systemPrompt(EVALUATOR_SYSTEM_PROMPT)
                    .messages(List.of(ChatMessage.human(prompt)))
                    .temperature(0.0)
                    .build();
            evaluation = StringUtils.trimToEmpty(context.models().chat(request));
        } catch (Exception ex) {
            log.error("Reflection evaluation failed, accept by default. nodeId={}, error={}", getId(), ex.getMessage());
            evaluation = ACCEPT;
        }

        boolean accepted = evaluation.toUpperCase().startsWith(ACCEPT);
        String feedback = evaluation.contains(":")
                ? evaluation.substring(evaluation.indexOf(':') + 1).trim()
                : evaluation;

        Map<String, Object> values = new LinkedHashMap<>();
        values.put(outputKey, evaluation);
        values.put("accepted", accepted);
        values.put("feedback", feedback);
        StateUpdate update = StateUpdate.namespace(getId(), values);
        update.setIterationCount(1);
        update.setMessages(List.of(ChatMessage.ai("Reflection: " + evaluation)));
        return update;
    }

    @Override
    public String route(ExecutionState state, List<String> targets) {
        int maxReflections = configInt("max_reflections", DEFAULT_MAX_REFLECTIONS);
        boolean accepted = Boolean.TRUE.equals(getVariable(state, getId() + ".accepted"));
        if (state.getIterationCount() >= maxReflections) {
            accepted = true;
        }
        if (accepted) {
            return declaredOr(configString("accept_target", ""), targets, lastTarget(targets));
        }
        return declaredOr(configString("retry_target", ""), targets, firstTarget(targets));
    }

    @Override
    public Set<String> referencedTargets() {
        Set<String> referenced = new LinkedHashSet<>();
        for (String key : List.of("retry_target", "accept_target")) {
            String target = configString(key, "");
            if (StringUtils.isNotBlank(target)) {
                referenced.add(target);
            }
        }
        return referenced;
    }

    private String resolveContent(ExecutionState state) {
        String inputVariable = configString("input_variable", "");
        String content = "";
        if (StringUtils.isNotBlank(inputVariable)) {
            content = stringify(getVariable(state, inputVariable));
        }
        if (content.isEmpty()) {
            content = lastMessageText(state);
        }
        return content;
    }

    private String buildPrompt(ExecutionState state, String content) {
        String evaluationPrompt = configString("evaluation_prompt", "");
        if (StringUtils.isBlank(evaluationPrompt)) {
            String threshold = configString("quality_threshold", "The output should be accurate and complete.");
            return "Evaluate the following content against this criteria: " + threshold + "\n\n"
                    + "Content to evaluate:\n" + content + "\n\n"
                    + "Respond with EXACTLY one of:\n"
                    + "- \"ACCEPT\" if the content meets the criteria\n"
                    + "- \"RETRY: <feedback>\" if the content needs improvement, "
                    + "including specific feedback for improvement";
        }
        return resolveTemplate(evaluationPrompt, state).replace("{{content}}", content);
    }
}
