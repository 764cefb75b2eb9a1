package com.blissengine.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class EngineConfig {
    private Path dictionaryPath = Paths.get(Constants.DEFAULT_DICTIONARY_PATH);
    private Path semanticsPath;
    private String language = Constants.DEFAULT_LANGUAGE;
    private int maxCompositionTokens = Constants.MAX_COMPOSITION_TOKENS;

    public Path getDictionaryPath() {
        return dictionaryPath;
    }

    public void setDictionaryPath(Path dictionaryPath) {
        this.dictionaryPath = dictionaryPath;
    }

    /**
     * 外部语义表路径，为 null 时使用类路径内置语义表
     */
    public Path getSemanticsPath() {
        return semanticsPath;
    }

    public void setSemanticsPath(Path semanticsPath) {
        this.semanticsPath = semanticsPath;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public int getMaxCompositionTokens() {
        return maxCompositionTokens;
    }

    public void setMaxCompositionTokens(int maxCompositionTokens) {
        this.maxCompositionTokens = maxCompositionTokens;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}
