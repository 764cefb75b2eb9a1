package com.blissengine.classify;

import com.blissengine.config.Constants;
import com.blissengine.dictionary.BlissDictionary;
import com.blissengine.dictionary.PosCategory;
import com.blissengine.dictionary.SymbolRecord;
import com.blissengine.semantics.SemanticDescriptor;
import com.blissengine.semantics.SemanticTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 将组合中的符号划分为分类符、限定符、指示符与修饰符。
 *
 * 规则按优先级组成决策表，自上而下求值，首个命中的规则决定整条组合：
 * <ol>
 *   <li>指示符锚定：分类符位于第一个指示符之前；</li>
 *   <li>词性颜色：第一个有色符号为分类符；</li>
 *   <li>全灰白回退：首个灰白符号提升为分类符。</li>
 * </ol>
 */
public class SymbolClassifier {
    private static final Logger logger = LoggerFactory.getLogger(SymbolClassifier.class);

    private static final Pattern SYMBOL_ID_PATTERN = Pattern.compile("[0-9]+");

    private final BlissDictionary dictionary;
    private final SemanticTables semanticTables;
    private final Set<String> modifiers;
    private final Set<String> indicators;
    private final List<ClassificationRule> rules;

    public SymbolClassifier(BlissDictionary dictionary, SemanticTables semanticTables) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.semanticTables = Objects.requireNonNull(semanticTables, "semanticTables");
        this.modifiers = Set.copyOf(semanticTables.modifierIds());
        this.indicators = Set.copyOf(semanticTables.indicatorIds());
        this.rules = List.of(
            new ClassificationRule("no-valid-ids", List::isEmpty,
                symbolIds -> RoleAssignment.failed(Constants.ERROR_NO_VALID_IDS)),
            new ClassificationRule("indicator-anchored", this::containsIndicator, this::classifyByIndicator),
            new ClassificationRule("part-of-speech", this::containsHeadSymbol, this::classifyByPartOfSpeech),
            new ClassificationRule("all-satellite", symbolIds -> true, this::classifyAllSatellite)
        );
    }

    /**
     * 过滤渲染标记后按决策表分类。
     */
    public RoleAssignment classify(List<String> tokens) {
        List<String> symbolIds = filterSymbolIds(tokens);
        ClassificationRule rule = selectRule(symbolIds);
        logger.debug("组合 {} 命中规则 {}", symbolIds, rule.name());
        return rule.apply(symbolIds);
    }

    /**
     * 返回过滤后的组合所命中的规则名称。
     */
    public String matchingRule(List<String> tokens) {
        return selectRule(filterSymbolIds(tokens)).name();
    }

    public List<ClassificationRule> rules() {
        return rules;
    }

    /**
     * 仅保留纯数字的符号 ID，"/"、";" 等渲染标记被静默丢弃。
     */
    public static List<String> filterSymbolIds(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        List<String> symbolIds = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            if (isSymbolId(token)) {
                symbolIds.add(token);
            }
        }
        return List.copyOf(symbolIds);
    }

    public static boolean isSymbolId(String token) {
        return token != null && SYMBOL_ID_PATTERN.matcher(token).matches();
    }

    public boolean isClassifier(String symbolId) {
        return dictionary.find(symbolId).map(record -> record.pos().isHeadBearing()).orElse(false);
    }

    public boolean isModifier(String symbolId) {
        return modifiers.contains(symbolId);
    }

    public boolean isIndicator(String symbolId) {
        return indicators.contains(symbolId);
    }

    /**
     * 任何词典中存在的符号都可以充当限定符。
     */
    public boolean isSpecifier(String symbolId) {
        return dictionary.contains(symbolId);
    }

    /**
     * 查询符号的词典信息与角色类型，修饰符优先于指示符判定。
     */
    public SymbolInfo symbolInfo(String symbolId) {
        Optional<SymbolRecord> found = dictionary.find(symbolId);
        if (found.isEmpty()) {
            return SymbolInfo.notFound(symbolId);
        }
        SymbolRecord record = found.get();
        SymbolType type;
        SemanticDescriptor semantics = null;
        if (isModifier(symbolId)) {
            type = SymbolType.MODIFIER;
            semantics = semanticTables.modifier(symbolId).orElse(null);
        } else if (isIndicator(symbolId)) {
            type = SymbolType.INDICATOR;
            semantics = semanticTables.indicator(symbolId).orElse(null);
        } else {
            type = SymbolType.CHARACTER_OR_WORD;
        }
        return new SymbolInfo(
            symbolId,
            record.pos(),
            record.glosses(),
            record.character(),
            record.explanation(),
            record.semantics(),
            type,
            semantics,
            null
        );
    }

    private ClassificationRule selectRule(List<String> symbolIds) {
        for (ClassificationRule rule : rules) {
            if (rule.matches(symbolIds)) {
                return rule;
            }
        }
        throw new IllegalStateException("决策表缺少兜底规则");
    }

    private boolean containsIndicator(List<String> symbolIds) {
        return firstIndicatorIndex(symbolIds) >= 0;
    }

    private boolean containsHeadSymbol(List<String> symbolIds) {
        return symbolIds.stream().anyMatch(this::isHeadSymbol);
    }

    /**
     * 不在修饰符表中的有色符号。
     */
    private boolean isHeadSymbol(String symbolId) {
        return !isModifier(symbolId) && isClassifier(symbolId);
    }

    private int firstIndicatorIndex(List<String> symbolIds) {
        for (int index = 0; index < symbolIds.size(); index++) {
            if (isIndicator(symbolIds.get(index))) {
                return index;
            }
        }
        return -1;
    }

    /**
     * 规则 1：分类符取自第一个指示符之前的锚定窗口。
     * 窗口内第一个有色非修饰符号优先，否则取指示符紧前的符号；分类符之前均为前缀修饰符。
     */
    private RoleAssignment classifyByIndicator(List<String> symbolIds) {
        int indicatorIndex = firstIndicatorIndex(symbolIds);
        RoleAssignment.Builder builder = new RoleAssignment.Builder();
        if (indicatorIndex == 0) {
            return builder.error(Constants.ERROR_INDICATOR_FIRST).build();
        }

        int classifierIndex = indicatorIndex - 1;
        for (int index = 0; index < indicatorIndex; index++) {
            if (isHeadSymbol(symbolIds.get(index))) {
                classifierIndex = index;
                break;
            }
        }

        builder.classifier(symbolIds.get(classifierIndex));
        for (int index = 0; index < classifierIndex; index++) {
            builder.modifier(symbolIds.get(index));
        }
        for (int index = classifierIndex + 1; index < symbolIds.size(); index++) {
            assignTrailing(symbolIds.get(index), builder);
        }
        return builder.detachClassifier().build();
    }

    private void assignTrailing(String symbolId, RoleAssignment.Builder builder) {
        if (isIndicator(symbolId)) {
            builder.indicator(symbolId);
        } else if (isModifier(symbolId)) {
            builder.modifier(symbolId);
        } else {
            builder.specifier(symbolId);
        }
    }

    /**
     * 规则 2：只有第一个有色符号可以成为分类符，之后的有色符号降级为限定符。
     */
    private RoleAssignment classifyByPartOfSpeech(List<String> symbolIds) {
        return walkPartOfSpeech(symbolIds).detachClassifier().build();
    }

    private RoleAssignment.Builder walkPartOfSpeech(List<String> symbolIds) {
        RoleAssignment.Builder builder = new RoleAssignment.Builder();
        for (String symbolId : symbolIds) {
            if (isModifier(symbolId)) {
                builder.modifier(symbolId);
            } else if (isClassifier(symbolId) && builder.classifier() == null) {
                builder.classifier(symbolId);
            } else {
                builder.specifier(symbolId);
            }
        }
        return builder;
    }

    /**
     * 规则 3：组合中没有有色符号时，首个灰白符号提升为分类符。
     */
    private RoleAssignment classifyAllSatellite(List<String> symbolIds) {
        RoleAssignment.Builder builder = walkPartOfSpeech(symbolIds);
        String firstId = symbolIds.get(0);
        Optional<SymbolRecord> first = dictionary.find(firstId);
        if (first.isEmpty()) {
            return builder.error(String.format(Constants.ERROR_SYMBOL_NOT_IN_GRAPH, firstId)).build();
        }
        PosCategory pos = first.get().pos();
        if (!pos.isSatellite()) {
            return builder.error(Constants.ERROR_NO_CLASSIFIER).build();
        }
        return builder.detach(firstId).classifier(firstId).build();
    }
}
