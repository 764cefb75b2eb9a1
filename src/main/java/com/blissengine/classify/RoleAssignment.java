package com.blissengine.classify;

import java.util.ArrayList;
import java.util.List;

/**
 * 组合中各符号的功能角色划分。
 *
 * 各列表保持过滤后输入中的首次出现顺序；errors 非空时仍可能带有部分角色结果。
 */
public record RoleAssignment(
    String classifier,
    List<String> specifiers,
    List<String> indicators,
    List<String> modifiers,
    List<String> errors
) {
    public RoleAssignment {
        specifiers = List.copyOf(specifiers);
        indicators = List.copyOf(indicators);
        modifiers = List.copyOf(modifiers);
        errors = List.copyOf(errors);
    }

    public static RoleAssignment failed(String error) {
        return new RoleAssignment(null, List.of(), List.of(), List.of(), List.of(error));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasClassifier() {
        return classifier != null;
    }

    /**
     * 分类过程中逐步累积角色的可变构建器。
     */
    static final class Builder {
        private String classifier;
        private final List<String> specifiers = new ArrayList<>();
        private final List<String> indicators = new ArrayList<>();
        private final List<String> modifiers = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();

        Builder classifier(String symbolId) {
            this.classifier = symbolId;
            return this;
        }

        String classifier() {
            return classifier;
        }

        Builder specifier(String symbolId) {
            specifiers.add(symbolId);
            return this;
        }

        Builder indicator(String symbolId) {
            indicators.add(symbolId);
            return this;
        }

        Builder modifier(String symbolId) {
            modifiers.add(symbolId);
            return this;
        }

        Builder error(String message) {
            errors.add(message);
            return this;
        }

        /**
         * 将符号从其余角色列表中移除，用于提升为分类符。
         */
        Builder detach(String symbolId) {
            specifiers.removeIf(symbolId::equals);
            modifiers.removeIf(symbolId::equals);
            return this;
        }

        /**
         * 分类符在组合中重复出现时，只保留分类符角色。
         */
        Builder detachClassifier() {
            return classifier == null ? this : detach(classifier);
        }

        RoleAssignment build() {
            return new RoleAssignment(classifier, specifiers, indicators, modifiers, errors);
        }
    }
}
