package com.flowgraph.domain.node.service.behavior;

import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.domain.graph.model.valobj.NodeSpec;
import com.flowgraph.domain.node.model.valobj.ModelRequest;
import com.flowgraph.domain.node.service.AbstractNodeBehavior;
import com.flowgraph.domain.node.service.NodeContext;
import com.flowgraph.types.common.Constants;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 多 Agent 调度节点。
 * <p>
 * 每次访问询问调度模型下一个执行的 Agent 或 FINISH，结果写入 currentAgent；
 * 轮次达到 max_rounds 时直接结束。路由时 currentAgent 为已声明 target 则前往，
 * 否则取第一个 target。
 * </p>
 */
@Slf4j
public class SupervisorNodeBehavior extends AbstractNodeBehavior {

    public static final int DEFAULT_MAX_ROUNDS = 10;
    public static final String FINISH = "FINISH";

    private static final int CONTEXT_MESSAGES = 10;

    public SupervisorNodeBehavior(NodeSpec spec) {
        super(spec);
    }

    @Override
    public StateUpdate execute(NodeContext context, ExecutionState state) {
        List<String> agentNodes = configStringList("agent_nodes");
        if (agentNodes.isEmpty()) {
            return StateUpdate.builder()
                    .currentAgent("")
                    .finalOutput("No agents configured")
                    .build();
        }
        int maxRounds = configInt("max_rounds", DEFAULT_MAX_ROUNDS);
        if (state.getIterationCount() >= maxRounds) {
            log.info("Supervisor reached max rounds. nodeId={}, maxRounds={}", getId(), maxRounds);
            return StateUpdate.builder()
                    .currentAgent(Constants.END)
                    .iterationCount(1)
                    .build();
        }

        String decision;
        try {
            decision = StringUtils.trimToEmpty(context.models().chat(buildRequest(state, agentNodes)));
        } catch (Exception ex) {
            log.error("Supervisor decision failed, finish by default. nodeId={}, error={}", getId(), ex.getMessage());
            decision = FINISH;
        }
        String nextAgent = resolveAgent(decision, agentNodes);
        return StateUpdate.builder()
                .currentAgent(nextAgent)
                .iterationCount(1)
                .messages(List.of(ChatMessage.ai("Supervisor routed to: " + nextAgent)))
                .build();
    }

    @Override
    public String route(ExecutionState state, List<String> targets) {
        String current = state.getCurrentAgent();
        if (StringUtils.isBlank(current) || Constants.END.equals(current)) {
            return Constants.END;
        }
        if (targets.contains(current)) {
            return current;
        }
        return firstTarget(targets);
    }

    private ModelRequest buildRequest(ExecutionState state, List<String> agentNodes) {
        String agentNames = String.join(", ", agentNodes);
        String systemPrompt = configString("system_prompt", "");
        if (StringUtils.isBlank(systemPrompt)) {
            systemPrompt = "You are a supervisor managing these agents: [" + agentNames + "]. "
                    + "Based on the conversation, decide which agent should act next. "
                    + "Respond with ONLY the agent name, or \"FINISH\" if the task is complete. "
                    + "Available agents: " + agentNames;
        } else {
            systemPrompt = resolveTemplate(systemPrompt, state);
        }
        List<ChatMessage> messages = new ArrayList<>(state.recentMessages(CONTEXT_MESSAGES));
        if (messages.isEmpty()) {
            messages.add(ChatMessage.human("What should we do next?"));
        }
        return ModelRequest.builder()
                .modelId(configString("model_id", null))
                .systemPrompt(systemPrompt)
                .messages(messages)
                .temperature(0.0)
                .build();
    }

    /**
     * 先按 id 完全匹配，再看回复中是否包含某个 Agent id，都不匹配时取第一个 Agent。
     */
    private String resolveAgent(String decision, List<String> agentNodes) {
        String normalized = decision.toUpperCase(Locale.ROOT);
        if (FINISH.equals(normalized) || Constants.END.toUpperCase(Locale.ROOT).equals(normalized)) {
            return Constants.END;
        }
        for (String agentId : agentNodes) {
            if (agentId.equalsIgnoreCase(decision)) {
                return agentId;
            }
        }
        for (String agentId : agentNodes) {
            if (normalized.contains(agentId.toUpperCase(Locale.ROOT))) {
                return agentId;
            }
        }
        return agentNodes.get(0);
    }
}
