package com.blissengine.analysis;

import com.blissengine.classify.RoleAssignment;
import com.blissengine.semantics.SemanticFact;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 组合分析结果。分类失败时 error 为首条分类错误，details 保留完整的角色划分。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompositionAnalysis(
    List<String> originalComposition,
    String classifier,
    GlossInfo classifierInfo,
    List<String> specifiers,
    List<GlossInfo> specifierInfo,
    List<SemanticFact> semantics,
    List<String> indicators,
    List<String> modifiers,
    String error,
    RoleAssignment details
) {
    public static CompositionAnalysis failed(List<String> originalComposition, RoleAssignment details) {
        return new CompositionAnalysis(originalComposition, null, null, List.of(), List.of(), List.of(),
            List.of(), List.of(), details.errors().get(0), details);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
