package com.blissengine.compose;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 语义规格：分类符释义、限定符释义与语义项（每项形如 {"NUMBER": "plural"}）。
 *
 * classifier 为 null 表示规格缺少该字段。列表中的 null 元素保留，合成时记为告警。
 */
public record CompositionSpec(
    String classifier,
    List<String> specifiers,
    List<Map<String, String>> semantics
) {
    public CompositionSpec {
        specifiers = copyOf(specifiers);
        semantics = copyOf(semantics);
    }

    private static <T> List<T> copyOf(List<T> items) {
        return items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static CompositionSpec of(String classifier) {
        return new CompositionSpec(classifier, List.of(), List.of());
    }
}
