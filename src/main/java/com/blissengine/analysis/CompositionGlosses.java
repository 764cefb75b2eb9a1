package com.blissengine.analysis;

import java.util.List;

public record CompositionGlosses(
    List<String> composition,
    List<SymbolGlosses> components
) {
}
