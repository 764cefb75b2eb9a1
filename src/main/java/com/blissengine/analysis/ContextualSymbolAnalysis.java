package com.blissengine.analysis;

import com.blissengine.classify.RoleAssignment;
import com.blissengine.classify.SymbolType;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 单个符号的释义与类型，可附带其上下文组合的角色划分。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextualSymbolAnalysis(
    SymbolGlosses symbol,
    SymbolType type,
    RoleAssignment contextClassification
) {
}
