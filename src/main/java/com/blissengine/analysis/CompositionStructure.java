package com.blissengine.analysis;

import com.blissengine.classify.RoleAssignment;

import java.util.List;

/**
 * 组合的结构拆解：角色划分及其英文释义解读。
 */
public record CompositionStructure(
    List<String> originalComposition,
    RoleAssignment structure,
    Interpretation interpretation
) {
    public record Interpretation(
        GlossInfo classifierGlosses,
        List<GlossInfo> specifierGlosses,
        int indicatorCount,
        int modifierCount
    ) {
    }
}
