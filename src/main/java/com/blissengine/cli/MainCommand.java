package com.blissengine.cli;

import com.blissengine.analysis.CompositionAnalysis;
import com.blissengine.analysis.GlossInfo;
import com.blissengine.analysis.SymbolGlosses;
import com.blissengine.classify.RoleAssignment;
import com.blissengine.classify.SymbolInfo;
import com.blissengine.compose.CompositionResult;
import com.blissengine.compose.CompositionSpec;
import com.blissengine.config.Constants;
import com.blissengine.config.EngineConfig;
import com.blissengine.engine.BlissEngine;
import com.blissengine.engine.DictionaryStats;
import com.blissengine.semantics.SemanticFact;
import com.blissengine.text.CompositionTokenizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "bliss",
    description = "🔣 Blissymbolics 组合分析与合成引擎",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ClassifySubcommand.class,
        MainCommand.AnalyzeSubcommand.class,
        MainCommand.GlossesSubcommand.class,
        MainCommand.InfoSubcommand.class,
        MainCommand.ComposeSubcommand.class,
        MainCommand.ComposeIdsSubcommand.class,
        MainCommand.StatsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Option(names = {"--dictionary", "-d"}, description = "词典 JSON 文件路径", defaultValue = Constants.DEFAULT_DICTIONARY_PATH)
    private Path dictionaryPath;

    @Option(names = {"--semantics"}, description = "外部语义表 JSON 文件路径（默认使用内置语义表）")
    private Path semanticsPath;

    @Option(names = {"--lang", "-l"}, description = "释义语言代码", defaultValue = Constants.DEFAULT_LANGUAGE)
    private String language;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔣 Blissymbolics 组合分析与合成引擎");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    EngineConfig buildConfig() {
        EngineConfig config = EngineConfig.defaults();
        if (dictionaryPath != null) {
            config.setDictionaryPath(dictionaryPath);
        }
        config.setSemanticsPath(semanticsPath);
        if (language != null && !language.isBlank()) {
            config.setLanguage(language.trim());
        }
        return config;
    }

    private BlissEngine loadEngine() throws IOException {
        return BlissEngine.load(buildConfig());
    }

    private String effectiveLanguage() {
        return buildConfig().getLanguage();
    }

    /**
     * 超出长度限制时抛出参数异常，由 picocli 打印用法并以用法错误码退出。
     */
    private List<String> parseComposition(List<String> rawParts, CommandSpec spec) {
        String joined = rawParts == null ? "" : String.join(" ", rawParts);
        List<String> tokens = new CompositionTokenizer().texts(joined);
        int limit = buildConfig().getMaxCompositionTokens();
        if (tokens.size() > limit) {
            CommandLine commandLine = spec != null ? spec.commandLine() : new CommandLine(this);
            throw new CommandLine.ParameterException(commandLine,
                "组合长度超过限制（最大 " + limit + " 个 token）");
        }
        return tokens;
    }

    private static void printJson(Object value) throws IOException {
        System.out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    private static boolean isJson(String format) {
        return "json".equalsIgnoreCase(format);
    }

    @Command(name = "classify", description = "🏷️ 划分组合中各符号的角色")
    static class ClassifySubcommand implements Callable<Integer> {

        @Parameters(description = "组合中的符号 ID（可含 / 与 ; 渲染标记）", arity = "1..*")
        private List<String> composition;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() {
            List<String> symbolIds = main.parseComposition(composition, spec);
            try {
                BlissEngine engine = main.loadEngine();
                RoleAssignment assignment = engine.classify(symbolIds);
                if (isJson(format)) {
                    printJson(assignment);
                } else {
                    printAssignment(assignment);
                }
                return assignment.hasErrors() ? 1 : 0;
            } catch (Exception exception) {
                System.err.println("❌ 分类失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printAssignment(RoleAssignment assignment) {
            System.out.println("🏷️ 分类符: " + (assignment.hasClassifier() ? assignment.classifier() : "-"));
            System.out.println("   限定符: " + assignment.specifiers());
            System.out.println("   指示符: " + assignment.indicators());
            System.out.println("   修饰符: " + assignment.modifiers());
            for (String error : assignment.errors()) {
                System.out.println("⚠️ " + error);
            }
        }
    }

    @Command(name = "analyze", description = "🔍 分析组合并提取语义")
    static class AnalyzeSubcommand implements Callable<Integer> {

        @Parameters(description = "组合中的符号 ID（可含 / 与 ; 渲染标记）", arity = "1..*")
        private List<String> composition;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() {
            List<String> symbolIds = main.parseComposition(composition, spec);
            try {
                BlissEngine engine = main.loadEngine();
                CompositionAnalysis analysis = engine.analyzeComposition(symbolIds, main.effectiveLanguage());
                if (isJson(format)) {
                    printJson(analysis);
                } else {
                    printAnalysis(analysis);
                }
                return analysis.isFailed() ? 1 : 0;
            } catch (Exception exception) {
                System.err.println("❌ 分析失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printAnalysis(CompositionAnalysis analysis) {
            if (analysis.isFailed()) {
                System.out.println("⚠️ " + analysis.error());
                return;
            }
            System.out.println("🔍 组合: " + analysis.originalComposition());
            System.out.println("─────────────────────────────────");
            if (analysis.classifierInfo() != null) {
                System.out.println("分类符 " + describe(analysis.classifierInfo()));
            }
            for (GlossInfo specifier : analysis.specifierInfo()) {
                System.out.println("限定符 " + describe(specifier));
            }
            for (SemanticFact fact : analysis.semantics()) {
                System.out.println(fact.role().label() + " " + fact.symbolId() + ": " + fact.descriptor());
            }
        }

        private String describe(GlossInfo info) {
            return info.id() + " " + info.gloss();
        }
    }

    @Command(name = "glosses", description = "📖 查询符号释义")
    static class GlossesSubcommand implements Callable<Integer> {

        @Parameters(description = "符号 ID", arity = "1")
        private String symbolId;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                SymbolGlosses glosses = main.loadEngine().symbolGlosses(symbolId, main.effectiveLanguage());
                printJson(glosses);
                return glosses.found() ? 0 : 1;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "info", description = "ℹ️ 查看符号详细信息")
    static class InfoSubcommand implements Callable<Integer> {

        @Parameters(description = "符号 ID", arity = "1")
        private String symbolId;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                SymbolInfo info = main.loadEngine().symbolInfo(symbolId);
                printJson(info);
                return info.found() ? 0 : 1;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "compose", description = "🧩 由语义规格合成组合")
    static class ComposeSubcommand implements Callable<Integer> {

        @Option(names = {"--spec"}, description = "语义规格 JSON 文件")
        private Path specFile;

        @Option(names = {"--json"}, description = "内联语义规格 JSON")
        private String specJson;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            if (specFile == null && (specJson == null || specJson.isBlank())) {
                System.err.println("❌ 请通过 --spec 或 --json 提供语义规格");
                return 1;
            }
            try {
                CompositionSpec spec = specFile != null
                    ? MAPPER.readValue(specFile.toFile(), CompositionSpec.class)
                    : MAPPER.readValue(specJson, CompositionSpec.class);
                CompositionResult result = main.loadEngine().composeFromSpec(spec);
                printJson(result);
                return result.isSuccess() ? 0 : 1;
            } catch (Exception exception) {
                System.err.println("❌ 合成失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "compose-ids", description = "🧱 由符号 ID 直接合成组合")
    static class ComposeIdsSubcommand implements Callable<Integer> {

        @Option(names = {"--classifier", "-c"}, description = "分类符 ID", required = true)
        private String classifierId;

        @Option(names = {"--specifier", "-s"}, description = "限定符 ID（可多次指定）")
        private List<String> specifierIds;

        @Option(names = {"--modifier", "-m"}, description = "修饰符 ID（可多次指定）")
        private List<String> modifierIds;

        @Option(names = {"--indicator", "-i"}, description = "指示符 ID（可多次指定）")
        private List<String> indicatorIds;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                CompositionResult result = main.loadEngine().composeWithIds(
                    classifierId,
                    specifierIds == null ? List.of() : specifierIds,
                    modifierIds == null ? List.of() : modifierIds,
                    indicatorIds == null ? List.of() : indicatorIds);
                printJson(result);
                return result.isSuccess() ? 0 : 1;
            } catch (Exception exception) {
                System.err.println("❌ 合成失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "stats", description = "📊 查看词典统计信息")
    static class StatsSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                DictionaryStats stats = main.loadEngine().dictionaryStats();
                System.out.println("📊 词典状态");
                System.out.println("═══════════");
                System.out.println("📁 词典文件: " + main.buildConfig().getDictionaryPath());
                System.out.println("🔣 符号总数: " + stats.symbols());
                System.out.println("🔤 字符数: " + stats.characters());
                System.out.println("🧩 组合词数: " + stats.composedWords());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
