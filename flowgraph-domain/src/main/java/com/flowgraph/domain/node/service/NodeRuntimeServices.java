package com.flowgraph.domain.node.service;

import com.flowgraph.domain.node.adapter.gateway.ICodeSandbox;
import com.flowgraph.domain.node.adapter.gateway.IModelGateway;
import com.flowgraph.domain.node.adapter.gateway.IToolGateway;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 节点可用的外部协作者。
 */
@Component
public class NodeRuntimeServices {

    private final IModelGateway modelGateway;
    private final IToolGateway toolGateway;
    private final ICodeSandbox codeSandbox;

    public NodeRuntimeServices(IModelGateway modelGateway, IToolGateway toolGateway, ICodeSandbox codeSandbox) {
        this.modelGateway = modelGateway;
        this.toolGateway = toolGateway;
        this.codeSandbox = codeSandbox;
    }

    @Autowired
    public NodeRuntimeServices(ObjectProvider<IModelGateway> modelGatewayProvider,
                               ObjectProvider<IToolGateway> toolGatewayProvider,
                               ObjectProvider<ICodeSandbox> codeSandboxProvider) {
        this(modelGatewayProvider.getIfAvailable(),
                toolGatewayProvider.getIfAvailable(),
                codeSandboxProvider.getIfAvailable());
    }

    public IModelGateway modelGateway() {
        if (modelGateway == null) {
            throw new IllegalStateException("Model gateway is not configured");
        }
        return modelGateway;
    }

    public IToolGateway toolGateway() {
        if (toolGateway == null) {
            throw new IllegalStateException("Tool gateway is not configured");
        }
        return toolGateway;
    }

    public ICodeSandbox codeSandbox() {
        if (codeSandbox == null) {
            throw new IllegalStateException("Code sandbox is not configured");
        }
        return codeSandbox;
    }
}
