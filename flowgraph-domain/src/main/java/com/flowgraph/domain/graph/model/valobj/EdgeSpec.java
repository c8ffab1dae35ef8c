package com.flowgraph.domain.graph.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 边描述。backEdge 标记闭合循环的边，仅用于步数上限计算。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeSpec {

    private String id;
    private String source;
    private String target;
    private boolean backEdge;
    private Object condition;
}
