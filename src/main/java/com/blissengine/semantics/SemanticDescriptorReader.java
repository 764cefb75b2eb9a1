package com.blissengine.semantics;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 将 JSON 语义描述（{"type","value"} / {"or":[...]} / {"and":[...]}）转换为封闭的 SemanticDescriptor。
 */
public final class SemanticDescriptorReader {

    private static final String OR_KEY = "or";
    private static final String AND_KEY = "and";
    private static final String TYPE_KEY = "type";
    private static final String VALUE_KEY = "value";

    private SemanticDescriptorReader() {
    }

    /**
     * 按 or、and、简单事实的顺序识别形状；无法识别时返回空。
     */
    public static Optional<SemanticDescriptor> read(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        if (node.has(OR_KEY)) {
            return readPairs(node.get(OR_KEY)).map(SemanticDescriptor.Alternatives::new);
        }
        if (node.has(AND_KEY)) {
            return readPairs(node.get(AND_KEY)).map(SemanticDescriptor.Combination::new);
        }
        return readPair(node).map(pair -> new SemanticDescriptor.Simple(pair.type(), pair.value()));
    }

    private static Optional<List<SemanticDescriptor.SemanticPair>> readPairs(JsonNode arrayNode) {
        if (arrayNode == null || !arrayNode.isArray()) {
            return Optional.empty();
        }
        List<SemanticDescriptor.SemanticPair> pairs = new ArrayList<>(arrayNode.size());
        for (JsonNode element : arrayNode) {
            Optional<SemanticDescriptor.SemanticPair> pair = readPair(element);
            if (pair.isEmpty()) {
                return Optional.empty();
            }
            pairs.add(pair.get());
        }
        return Optional.of(pairs);
    }

    private static Optional<SemanticDescriptor.SemanticPair> readPair(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode type = node.get(TYPE_KEY);
        JsonNode value = node.get(VALUE_KEY);
        if (type == null || !type.isTextual() || value == null || !value.isValueNode() || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new SemanticDescriptor.SemanticPair(type.asText(), value.asText()));
    }
}
