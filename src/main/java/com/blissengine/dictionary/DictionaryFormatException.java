package com.blissengine.dictionary;

/**
 * 词典或语义表内容不符合预期结构时抛出。
 */
public class DictionaryFormatException extends RuntimeException {
    private final String source;

    public DictionaryFormatException(String message, String source) {
        super(buildMessage(message, source));
        this.source = source;
    }

    public DictionaryFormatException(String message, String source, Throwable cause) {
        super(buildMessage(message, source), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    private static String buildMessage(String message, String source) {
        return message + " (source: " + source + ")";
    }
}
