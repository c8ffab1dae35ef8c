package com.flowgraph.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 节点类型目录项。
 */
@Data
public class NodeTypeDTO {

    private String type;
    private String label;
    private Boolean router;
    private Boolean interrupt;
    private List<String> configKeys;
}
