package com.blissengine.config;

/**
 * 全局常量定义
 *
 * 包含默认语言、资源路径、分类错误信息与组合告警参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 语言参数 ====================
    /** 默认释义语言 */
    public static final String DEFAULT_LANGUAGE = "en";
    /** 请求语言缺失时的回退语言，同时也是反向索引的主语言 */
    public static final String FALLBACK_LANGUAGE = "en";
    /** 未知符号的占位释义 */
    public static final String UNKNOWN_GLOSS = "(unknown)";

    // ==================== 资源路径 ====================
    /** 默认词典文件路径 */
    public static final String DEFAULT_DICTIONARY_PATH = "./data/bliss_dict_multi_langs.json";
    /** 类路径内置语义表 */
    public static final String DEFAULT_SEMANTICS_RESOURCE = "bliss-semantics.json";

    // ==================== 分类错误信息 ====================
    public static final String ERROR_NO_VALID_IDS = "no valid symbol ids found";
    public static final String ERROR_INDICATOR_FIRST = "first symbol is an indicator; no classifier found before it";
    public static final String ERROR_NO_CLASSIFIER = "no classifier found in composition";
    /** 格式参数：符号 ID */
    public static final String ERROR_SYMBOL_NOT_IN_GRAPH = "symbol %s not found in knowledge graph";

    // ==================== 组合参数 ====================
    /** 语义路径分隔符，形如 TYPE:value */
    public static final String SEMANTIC_PATH_SEPARATOR = ":";
    /** 渲染标记：间隔 */
    public static final String SPACE_MARKER = "/";
    /** 渲染标记：分隔 */
    public static final String SEPARATOR_MARKER = ";";

    // ==================== CLI参数 ====================
    /** 单次组合输入允许的最大 token 数 */
    public static final int MAX_COMPOSITION_TOKENS = 64;
}
