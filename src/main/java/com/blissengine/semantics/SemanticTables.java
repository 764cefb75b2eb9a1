package com.blissengine.semantics;

import com.blissengine.config.Constants;
import com.blissengine.dictionary.DictionaryFormatException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 修饰符语义表与指示符语义表，两表键集合互不相交，构建后只读。
 *
 * JSON 格式：{"indicators": {id: 描述}, "modifiers": {id: 描述}}
 */
public final class SemanticTables {
    private static final Logger logger = LoggerFactory.getLogger(SemanticTables.class);

    private static final String INDICATORS_KEY = "indicators";
    private static final String MODIFIERS_KEY = "modifiers";

    private final Map<String, SemanticDescriptor> indicatorSemantics;
    private final Map<String, SemanticDescriptor> modifierSemantics;

    private SemanticTables(Map<String, SemanticDescriptor> indicatorSemantics,
                           Map<String, SemanticDescriptor> modifierSemantics) {
        this.indicatorSemantics = indicatorSemantics;
        this.modifierSemantics = modifierSemantics;
    }

    /**
     * 由两张表创建实例，保留迭代顺序；键重叠时拒绝。
     */
    public static SemanticTables of(Map<String, SemanticDescriptor> indicatorSemantics,
                                    Map<String, SemanticDescriptor> modifierSemantics) {
        Map<String, SemanticDescriptor> indicators = Collections.unmodifiableMap(new LinkedHashMap<>(indicatorSemantics));
        Map<String, SemanticDescriptor> modifiers = Collections.unmodifiableMap(new LinkedHashMap<>(modifierSemantics));
        for (String symbolId : indicators.keySet()) {
            if (modifiers.containsKey(symbolId)) {
                throw new IllegalArgumentException("符号同时出现在指示符表与修饰符表中: " + symbolId);
            }
        }
        return new SemanticTables(indicators, modifiers);
    }

    /**
     * 加载类路径内置语义表。
     */
    public static SemanticTables defaults() {
        String resource = Constants.DEFAULT_SEMANTICS_RESOURCE;
        try (InputStream inputStream = SemanticTables.class.getClassLoader().getResourceAsStream(resource)) {
            if (inputStream == null) {
                throw new IllegalStateException("类路径中缺少语义表: " + resource);
            }
            return read(new ObjectMapper().readTree(inputStream), resource);
        } catch (IOException ioException) {
            throw new IllegalStateException("读取内置语义表失败: " + resource, ioException);
        }
    }

    /**
     * 从外部 JSON 文件加载语义表。
     */
    public static SemanticTables load(Path path) throws IOException {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return read(new ObjectMapper().readTree(inputStream), path.toString());
        }
    }

    static SemanticTables read(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new DictionaryFormatException("语义表根节点必须是 JSON 对象", source);
        }
        Map<String, SemanticDescriptor> indicators = readTable(root.get(INDICATORS_KEY), INDICATORS_KEY, source);
        Map<String, SemanticDescriptor> modifiers = readTable(root.get(MODIFIERS_KEY), MODIFIERS_KEY, source);
        try {
            SemanticTables tables = of(indicators, modifiers);
            logger.info("已加载语义表 {}: {} 个指示符, {} 个修饰符", source, indicators.size(), modifiers.size());
            return tables;
        } catch (IllegalArgumentException exception) {
            throw new DictionaryFormatException(exception.getMessage(), source, exception);
        }
    }

    private static Map<String, SemanticDescriptor> readTable(JsonNode tableNode, String tableName, String source) {
        Map<String, SemanticDescriptor> table = new LinkedHashMap<>();
        if (tableNode == null || tableNode.isNull()) {
            return table;
        }
        if (!tableNode.isObject()) {
            throw new DictionaryFormatException("语义表 " + tableName + " 必须是 JSON 对象", source);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = tableNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            SemanticDescriptor descriptor = SemanticDescriptorReader.read(field.getValue())
                .orElseThrow(() -> new DictionaryFormatException(
                    "无法识别的语义描述: " + tableName + "." + field.getKey(), source));
            table.put(field.getKey(), descriptor);
        }
        return table;
    }

    public Optional<SemanticDescriptor> indicator(String symbolId) {
        return Optional.ofNullable(indicatorSemantics.get(symbolId));
    }

    public Optional<SemanticDescriptor> modifier(String symbolId) {
        return Optional.ofNullable(modifierSemantics.get(symbolId));
    }

    /**
     * 按角色查询语义描述。
     */
    public Optional<SemanticDescriptor> lookup(String symbolId, SymbolRole role) {
        return role == SymbolRole.INDICATOR ? indicator(symbolId) : modifier(symbolId);
    }

    public boolean isIndicator(String symbolId) {
        return indicatorSemantics.containsKey(symbolId);
    }

    public boolean isModifier(String symbolId) {
        return modifierSemantics.containsKey(symbolId);
    }

    public Set<String> indicatorIds() {
        return indicatorSemantics.keySet();
    }

    public Set<String> modifierIds() {
        return modifierSemantics.keySet();
    }

    /**
     * 按加载顺序遍历的指示符表（只读视图）。
     */
    public Map<String, SemanticDescriptor> indicatorSemantics() {
        return indicatorSemantics;
    }

    public Map<String, SemanticDescriptor> modifierSemantics() {
        return modifierSemantics;
    }
}
