package com.blissengine.compose;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 组合结果：成功时携带符号序列与非致命告警，失败时只携带错误且序列为空。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompositionResult(
    List<String> composition,
    List<String> warnings,
    CompositionError error
) {
    public CompositionResult {
        composition = List.copyOf(composition);
        warnings = List.copyOf(warnings);
    }

    public static CompositionResult success(List<String> composition, List<String> warnings) {
        return new CompositionResult(composition, warnings, null);
    }

    public static CompositionResult failure(CompositionError error) {
        return new CompositionResult(List.of(), List.of(), error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
