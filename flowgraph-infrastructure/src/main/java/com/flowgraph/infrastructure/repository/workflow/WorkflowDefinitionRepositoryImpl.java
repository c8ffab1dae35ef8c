package com.flowgraph.infrastructure.repository.workflow;

import com.flowgraph.domain.graph.adapter.repository.IWorkflowDefinitionRepository;
import com.flowgraph.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Repository;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 工作流定义仓储实现。
 * <p>
 * 启动时从 classpath 目录加载 JSON 定义，id 取文件中的 id 字段，缺省为文件名；
 * 运行期可以注册或替换定义。
 * </p>
 */
@Slf4j
@Repository
public class WorkflowDefinitionRepositoryImpl implements IWorkflowDefinitionRepository {

    private final Map<String, Map<String, Object>> definitions = new ConcurrentHashMap<>();
    private final JsonCodec jsonCodec;

    public WorkflowDefinitionRepositoryImpl(JsonCodec jsonCodec,
                                            @Value("${flowgraph.workflow.location:classpath*:workflows/*.json}") String location) {
        this.jsonCodec = jsonCodec;
        load(location);
    }

    @Override
    public Map<String, Object> findById(String workflowId) {
        if (StringUtils.isBlank(workflowId)) {
            return null;
        }
        Map<String, Object> definition = definitions.get(workflowId);
        return definition == null ? null : jsonCodec.readMap(jsonCodec.writeValue(definition));
    }

    @Override
    public void save(String workflowId, Map<String, Object> definition) {
        if (StringUtils.isBlank(workflowId)) {
            throw new IllegalArgumentException("workflowId cannot be blank");
        }
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        definitions.put(workflowId, jsonCodec.readMap(jsonCodec.writeValue(definition)));
        log.info("Workflow definition registered. workflowId={}", workflowId);
    }

    @Override
    public List<String> listIds() {
        List<String> ids = new ArrayList<>(definitions.keySet());
        ids.sort(String::compareTo);
        return ids;
    }

    private void load(String location) {
        if (StringUtils.isBlank(location)) {
            return;
        }
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(location);
        } catch (IOException ex) {
            log.warn("Workflow definition location unavailable. location={}, error={}", location, ex.getMessage());
            return;
        }
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                Map<String, Object> definition = jsonCodec.readMap(StreamUtils.copyToString(in, StandardCharsets.UTF_8));
                if (definition == null) {
                    continue;
                }
                String workflowId = definition.get("id") == null
                        ? StringUtils.removeEnd(resource.getFilename(), ".json")
                        : String.valueOf(definition.get("id"));
                definitions.put(workflowId, definition);
                log.info("Workflow definition loaded. workflowId={}, resource={}", workflowId, resource.getFilename());
            } catch (IOException ex) {
                log.warn("Failed to load workflow definition. resource={}, error={}", resource.getFilename(), ex.getMessage());
            }
        }
    }
}
