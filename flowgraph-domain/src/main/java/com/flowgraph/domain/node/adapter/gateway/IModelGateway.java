package com.flowgraph.domain.node.adapter.gateway;

import com.flowgraph.domain.node.model.valobj.ModelRequest;

import java.util.function.Consumer;

/**
 * 模型调用网关。
 */
public interface IModelGateway {

    /**
     * 阻塞调用，返回完整文本。
     */
    String chat(ModelRequest request);

    /**
     * 流式调用，每个片段回调一次，返回拼接后的完整文本。
     */
    default String streamChat(ModelRequest request, Consumer<String> onToken) {
        String text = chat(request);
        if (onToken != null && text != null) {
            onToken.accept(text);
        }
        return text;
    }

}
