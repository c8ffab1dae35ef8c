package com.flowgraph.infrastructure.ai;

import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.node.adapter.gateway.IModelGateway;
import com.flowgraph.domain.node.model.valobj.ModelRequest;
import com.flowgraph.types.enums.MessageRoleEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.function.Consumer;

/**
 * 基于 Spring AI ChatClient 的模型网关。
 * <p>
 * modelId 为 ChatModel Bean 名称时使用该 Bean，否则使用默认 ChatModel 并把 modelId 作为模型名。
 * 工具调用循环由 Spring AI 按 toolIds 解析的工具完成。
 * </p>
 */
@Slf4j
@Component
public class SpringAiModelGateway implements IModelGateway {

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final ListableBeanFactory beanFactory;

    public SpringAiModelGateway(ObjectProvider<ChatModel> chatModelProvider, ListableBeanFactory beanFactory) {
        this.chatModelProvider = chatModelProvider;
        this.beanFactory = beanFactory;
    }

    @Override
    public String chat(ModelRequest request) {
        return prompt(request).call().content();
    }

    @Override
    public String streamChat(ModelRequest request, Consumer<String> onToken) {
        Flux<String> tokens = prompt(request).stream().content();
        StringBuilder text = new StringBuilder();
        tokens.doOnNext(token -> {
            text.append(token);
            if (onToken != null) {
                onToken.accept(token);
            }
        }).blockLast();
        return text.toString();
    }

    private ChatClient.ChatClientRequestSpec prompt(ModelRequest request) {
        ChatClient.ChatClientRequestSpec spec = ChatClient.builder(resolveChatModel(request.getModelId()))
                .build()
                .prompt();
        if (StringUtils.isNotBlank(request.getSystemPrompt())) {
            spec = spec.system(request.getSystemPrompt());
        }
        spec = spec.messages(toMessages(request.getMessages()));
        spec = spec.options(buildOptions(request));
        if (request.getMaxIterations() != null) {
            log.debug("Tool loop delegated to Spring AI. modelId={}, maxIterations={}",
                    request.getModelId(), request.getMaxIterations());
        }
        return spec;
    }

    private OpenAiChatOptions buildOptions(ModelRequest request) {
        OpenAiChatOptions options = new OpenAiChatOptions();
        if (StringUtils.isNotBlank(request.getModelId()) && !isChatModelBean(request.getModelId())) {
            options.setModel(request.getModelId());
        }
        if (request.getTemperature() != null) {
            options.setTemperature(request.getTemperature());
        }
        if (request.getToolIds() != null && !request.getToolIds().isEmpty()) {
            options.setToolNames(new HashSet<>(request.getToolIds()));
        }
        return options;
    }

    private ChatModel resolveChatModel(String modelId) {
        if (isChatModelBean(modelId)) {
            return beanFactory.getBean(modelId, ChatModel.class);
        }
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new IllegalStateException("No ChatModel configured");
        }
        return chatModel;
    }

    private boolean isChatModelBean(String modelId) {
        return StringUtils.isNotBlank(modelId)
                && beanFactory.containsBean(modelId)
                && beanFactory.isTypeMatch(modelId, ChatModel.class);
    }

    private List<Message> toMessages(List<ChatMessage> messages) {
        List<Message> result = new ArrayList<>();
        if (messages == null) {
            return result;
        }
        for (ChatMessage message : messages) {
            String content = message.getContent() == null ? "" : message.getContent();
            MessageRoleEnum role = message.getRole() == null ? MessageRoleEnum.HUMAN : message.getRole();
            switch (role) {
                case AI -> result.add(new AssistantMessage(content));
                case SYSTEM -> result.add(new SystemMessage(content));
                default -> result.add(new UserMessage(content));
            }
        }
        return result;
    }
}
