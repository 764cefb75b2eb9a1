package com.blissengine.semantics;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Locale;

/**
 * 符号携带的语义事实：单一事实、"或"关系的候选集合、"与"关系的组合集合。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SemanticDescriptor.Simple.class, name = "simple"),
    @JsonSubTypes.Type(value = SemanticDescriptor.Alternatives.class, name = "alternatives"),
    @JsonSubTypes.Type(value = SemanticDescriptor.Combination.class, name = "combination")
})
public sealed interface SemanticDescriptor permits SemanticDescriptor.Simple,
        SemanticDescriptor.Alternatives, SemanticDescriptor.Combination {

    /**
     * 判断描述中是否存在类型相同、取值忽略大小写相等的事实。
     */
    boolean matches(String type, String value);

    /** 单个 {type, value} 事实 */
    record SemanticPair(String type, String value) {

        public boolean matches(String expectedType, String expectedValue) {
            if (type == null || value == null || expectedValue == null) {
                return false;
            }
            return type.equals(expectedType)
                && value.toLowerCase(Locale.ROOT).equals(expectedValue.toLowerCase(Locale.ROOT));
        }

        public String path() {
            return type + ":" + value;
        }
    }

    record Simple(String type, String value) implements SemanticDescriptor {

        public SemanticPair pair() {
            return new SemanticPair(type, value);
        }

        @Override
        public boolean matches(String expectedType, String expectedValue) {
            return pair().matches(expectedType, expectedValue);
        }
    }

    /** "or"：任一候选均可能是所指含义 */
    record Alternatives(List<SemanticPair> options) implements SemanticDescriptor {

        public Alternatives {
            options = List.copyOf(options);
        }

        @Override
        public boolean matches(String expectedType, String expectedValue) {
            return options.stream().anyMatch(option -> option.matches(expectedType, expectedValue));
        }
    }

    /** "and"：所有事实同时成立 */
    record Combination(List<SemanticPair> parts) implements SemanticDescriptor {

        public Combination {
            parts = List.copyOf(parts);
        }

        @Override
        public boolean matches(String expectedType, String expectedValue) {
            return parts.stream().anyMatch(part -> part.matches(expectedType, expectedValue));
        }
    }
}
