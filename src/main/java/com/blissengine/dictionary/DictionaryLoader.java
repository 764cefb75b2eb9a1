package com.blissengine.dictionary;

import com.blissengine.semantics.SemanticDescriptor;
import com.blissengine.semantics.SemanticDescriptorReader;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 读取多语言词典 JSON：{"<id>": {"pos", "isCharacter", "glosses", "explanation", "semantics"}}
 */
public class DictionaryLoader {
    private static final Logger logger = LoggerFactory.getLogger(DictionaryLoader.class);

    private final ObjectMapper mapper;

    public DictionaryLoader() {
        this(new ObjectMapper());
    }

    public DictionaryLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public BlissDictionary load(Path path) throws IOException {
        try (InputStream inputStream = Files.newInputStream(path)) {
            BlissDictionary dictionary = read(mapper.readTree(inputStream), path.toString());
            logger.info("已加载词典 {}: {} 个符号", path, dictionary.size());
            return dictionary;
        }
    }

    public BlissDictionary parse(String json) {
        try {
            return read(mapper.readTree(json), "<inline>");
        } catch (JsonProcessingException exception) {
            throw new DictionaryFormatException("词典 JSON 解析失败: " + exception.getOriginalMessage(), "<inline>", exception);
        }
    }

    /**
     * 根节点必须是对象；单条记录的语义描述无法识别时记录告警并忽略该描述。
     */
    BlissDictionary read(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new DictionaryFormatException("词典根节点必须是 JSON 对象", source);
        }
        BlissDictionary.Builder builder = BlissDictionary.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.add(readRecord(field.getKey(), field.getValue(), source));
        }
        return builder.build();
    }

    private SymbolRecord readRecord(String symbolId, JsonNode node, String source) {
        if (!node.isObject()) {
            throw new DictionaryFormatException("符号定义必须是 JSON 对象: " + symbolId, source);
        }
        PosCategory pos = PosCategory.parse(node.path("pos").asText(null));
        boolean character = node.path("isCharacter").asBoolean(false);
        String explanation = node.path("explanation").asText("");
        Map<String, List<String>> glosses = readGlosses(symbolId, node.get("glosses"), source);

        SemanticDescriptor semantics = null;
        JsonNode semanticsNode = node.get("semantics");
        if (semanticsNode != null && !semanticsNode.isNull() && !semanticsNode.isEmpty()) {
            semantics = SemanticDescriptorReader.read(semanticsNode).orElse(null);
            if (semantics == null) {
                logger.warn("忽略无法识别的语义描述: symbol={}, source={}", symbolId, source);
            }
        }
        return new SymbolRecord(symbolId, pos, character, glosses, explanation, semantics);
    }

    private Map<String, List<String>> readGlosses(String symbolId, JsonNode glossesNode, String source) {
        Map<String, List<String>> glosses = new LinkedHashMap<>();
        if (glossesNode == null || glossesNode.isNull()) {
            return glosses;
        }
        if (!glossesNode.isObject()) {
            throw new DictionaryFormatException("glosses 必须是 JSON 对象: " + symbolId, source);
        }
        Iterator<Map.Entry<String, JsonNode>> languages = glossesNode.fields();
        while (languages.hasNext()) {
            Map.Entry<String, JsonNode> language = languages.next();
            if (!language.getValue().isArray()) {
                continue;
            }
            List<String> values = new ArrayList<>(language.getValue().size());
            for (JsonNode gloss : language.getValue()) {
                if (gloss.isTextual()) {
                    values.add(gloss.asText());
                }
            }
            glosses.put(language.getKey(), values);
        }
        return glosses;
    }
}
