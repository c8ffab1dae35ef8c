package com.flowgraph.domain.graph.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 解析结果：邻接关系与节点角色分类。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphTopology {

    /** source → 声明顺序的 target 列表 */
    @Builder.Default
    private Map<String, List<String>> targetMap = new LinkedHashMap<>();

    /** target → source 列表 */
    @Builder.Default
    private Map<String, List<String>> sourceMap = new LinkedHashMap<>();

    private String entryId;

    @Builder.Default
    private Set<String> terminalIds = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> interruptIds = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> routerIds = new LinkedHashSet<>();

    /** 回边 id 列表 */
    @Builder.Default
    private Set<String> backEdgeIds = new LinkedHashSet<>();

    private int nodeCount;

    public boolean hasBackEdge() {
        return backEdgeIds != null && !backEdgeIds.isEmpty();
    }
}
