package com.blissengine.classify;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 决策表中的一行：守卫条件命中时由动作给出整条组合的角色划分。
 */
public record ClassificationRule(
    String name,
    Predicate<List<String>> guard,
    Function<List<String>, RoleAssignment> action
) {
    public boolean matches(List<String> symbolIds) {
        return guard.test(symbolIds);
    }

    public RoleAssignment apply(List<String> symbolIds) {
        return action.apply(symbolIds);
    }
}
