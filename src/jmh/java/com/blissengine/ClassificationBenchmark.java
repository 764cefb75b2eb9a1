package com.blissengine;

import com.blissengine.classify.RoleAssignment;
import com.blissengine.compose.CompositionResult;
import com.blissengine.compose.CompositionSpec;
import com.blissengine.dictionary.BlissDictionary;
import com.blissengine.dictionary.PosCategory;
import com.blissengine.dictionary.SymbolRecord;
import com.blissengine.engine.BlissEngine;
import com.blissengine.semantics.SemanticDescriptor;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 分类与合成性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ClassificationBenchmark {

    private static final PosCategory[] COLORS = {
        PosCategory.YELLOW, PosCategory.RED, PosCategory.GREEN, PosCategory.BLUE, PosCategory.GREY
    };

    @State(Scope.Benchmark)
    public static class EngineState {
        BlissEngine engine;
        List<String> anchoredComposition;
        List<String> partOfSpeechComposition;
        CompositionSpec spec;

        @Setup
        public void setup() {
            BlissDictionary.Builder builder = BlissDictionary.builder();
            builder.add(new SymbolRecord("14647", PosCategory.WHITE, false,
                Map.of("en", List.of("many")), "", new SemanticDescriptor.Simple("QUANTIFIER", "many")));
            builder.add(new SymbolRecord("9011", PosCategory.WHITE, false,
                Map.of("en", List.of("plural")), "", new SemanticDescriptor.Simple("NUMBER", "plural")));

            // 生成50000个带释义的符号
            for (int i = 0; i < 50_000; i++) {
                String symbolId = String.valueOf(100_000 + i);
                builder.add(new SymbolRecord(symbolId, COLORS[i % COLORS.length], i % 3 == 0,
                    Map.of("en", List.of("gloss" + i), "sv", List.of("ord" + i)), "", null));
            }
            engine = new BlissEngine(builder.build());

            anchoredComposition = List.of("14647", "/", "100001", ";", "100002", "/", "9011");
            List<String> longComposition = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                longComposition.add(String.valueOf(100_000 + i));
            }
            partOfSpeechComposition = List.copyOf(longComposition);
            spec = new CompositionSpec("gloss49999", List.of("ord1200"),
                List.of(Map.of("NUMBER", "plural"), Map.of("QUANTIFIER", "many")));
        }
    }

    @Benchmark
    public RoleAssignment classifyIndicatorAnchored(EngineState state) {
        return state.engine.classify(state.anchoredComposition);
    }

    @Benchmark
    public RoleAssignment classifyPartOfSpeech(EngineState state) {
        return state.engine.classify(state.partOfSpeechComposition);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public CompositionResult composeFromSpec(EngineState state) {
        return state.engine.composeFromSpec(state.spec);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(ClassificationBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
