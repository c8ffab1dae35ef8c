package com.flowgraph.domain.graph.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 结构校验报告。errors 非空即不可运行，warnings 仅提示。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    private int nodeCount;
    private int edgeCount;

    public boolean isValid() {
        return errors == null || errors.isEmpty();
    }
}
