package com.flowgraph.domain.graph.model.valobj;

import com.flowgraph.types.enums.NodeTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 节点描述。
 * <p>
 * config 由 group_params[].params[].{key, value} 展平而来，每个节点只解析一次。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeSpec {

    private String id;
    private NodeTypeEnum type;
    private String name;
    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
