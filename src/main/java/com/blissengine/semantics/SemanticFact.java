package com.blissengine.semantics;

/**
 * 从单个指示符或修饰符中提取的语义单元。
 */
public record SemanticFact(
    String symbolId,
    SymbolRole role,
    SemanticDescriptor descriptor
) {
}
