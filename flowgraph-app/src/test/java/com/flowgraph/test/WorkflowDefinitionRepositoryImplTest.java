package com.flowgraph.test;

import com.flowgraph.infrastructure.repository.workflow.WorkflowDefinitionRepositoryImpl;
import com.flowgraph.test.support.EngineFixture;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class WorkflowDefinitionRepositoryImplTest {

    private final WorkflowDefinitionRepositoryImpl repository =
            new WorkflowDefinitionRepositoryImpl(EngineFixture.jsonCodec(), "classpath*:workflows/*.json");

    @Test
    public void shouldLoadBundledDefinitions() {
        Assertions.assertEquals(List.of("draft-review", "research-pipeline", "summarize-items"), repository.listIds());
        Assertions.assertTrue(repository.findById("summarize-items").get("nodes") instanceof List<?>);
        Assertions.assertNull(repository.findById("absent"));
        Assertions.assertNull(repository.findById(" "));
    }

    @Test
    public void shouldSaveDetachedCopies() {
        Map<String, Object> definition = new LinkedHashMap<>();
        definition.put("nodes", List.of());
        repository.save("custom", definition);
        definition.put("edges", List.of());

        Map<String, Object> loaded = repository.findById("custom");
        loaded.put("mutated", true);

        Assertions.assertFalse(repository.findById("custom").containsKey("edges"));
        Assertions.assertFalse(repository.findById("custom").containsKey("mutated"));
    }

    @Test
    public void shouldRejectBlankId() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> repository.save(" ", Map.of()));
        Assertions.assertThrows(IllegalArgumentException.class, () -> repository.save("wf", null));
    }
}
