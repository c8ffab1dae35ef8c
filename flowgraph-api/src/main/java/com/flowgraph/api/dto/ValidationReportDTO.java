package com.flowgraph.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 结构校验结果。
 */
@Data
public class ValidationReportDTO {

    private Boolean valid;
    private Integer nodeCount;
    private Integer edgeCount;
    private List<String> errors;
    private List<String> warnings;
}
