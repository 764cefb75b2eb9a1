package com.blissengine.engine;

public record DictionaryStats(
    int symbols,
    long characters,
    long composedWords,
    String description
) {
}
