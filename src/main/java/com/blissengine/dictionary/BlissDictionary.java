package com.blissengine.dictionary;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 只读符号词典：符号 ID 到符号定义。
 *
 * 迭代顺序固定为插入顺序（即词典 JSON 中的顺序），反向索引与释义回退搜索都依赖该顺序。
 */
public final class BlissDictionary {

    private final Map<String, SymbolRecord> symbols;

    private BlissDictionary(Map<String, SymbolRecord> symbols) {
        this.symbols = Collections.unmodifiableMap(symbols);
    }

    public static BlissDictionary of(Collection<SymbolRecord> records) {
        Builder builder = builder();
        records.forEach(builder::add);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<SymbolRecord> find(String symbolId) {
        if (symbolId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(symbols.get(symbolId));
    }

    public boolean contains(String symbolId) {
        return symbolId != null && symbols.containsKey(symbolId);
    }

    public int size() {
        return symbols.size();
    }

    public Collection<SymbolRecord> symbols() {
        return symbols.values();
    }

    public long characterCount() {
        return symbols.values().stream().filter(SymbolRecord::character).count();
    }

    public static final class Builder {
        private final Map<String, SymbolRecord> symbols = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 追加符号；重复 ID 时后者覆盖前者但保留原位置。
         */
        public Builder add(SymbolRecord record) {
            Objects.requireNonNull(record, "record");
            Objects.requireNonNull(record.id(), "record.id");
            symbols.put(record.id(), record);
            return this;
        }

        public BlissDictionary build() {
            return new BlissDictionary(new LinkedHashMap<>(symbols));
        }
    }
}
