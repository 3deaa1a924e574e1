package com.docindex.cli;

import com.docindex.config.EngineConfig;
import com.docindex.index.IndexBuilder;
import com.docindex.index.IndexingException;
import com.docindex.index.SearchEngine;
import com.docindex.query.QueryEngine;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.Callable;

@Command(
    name = "doc-indexer",
    description = "📚 并发构建内存全文索引，并从标准输入读取词项按 tf-idf 排序输出",
    mixinStandardHelpOptions = true,
    version = "1.0.0"
)
public class MainCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "1", description = "要索引的根目录")
    private Path directory;

    @Option(names = {"-w", "--workers"}, description = "工作线程数（默认按CPU数量自动计算）")
    private Integer workers;

    @Option(names = {"--min-workers"}, description = "自动模式下的最少工作线程数")
    private Integer minWorkers;

    @Option(names = {"--max-workers"}, description = "工作线程上限")
    private Integer maxWorkers;

    @Option(names = {"--workers-per-cpu"}, description = "每个CPU核心的工作线程数")
    private Integer workersPerCpu;

    @Option(names = {"-c", "--config"}, description = "properties 配置文件路径")
    private Path configFile;

    @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
    private String format;

    private final InputStream stdin;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public MainCommand() {
        this(System.in, System.out, System.err);
    }

    MainCommand(InputStream stdin, PrintStream stdout, PrintStream stderr) {
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        EngineConfig config;
        OutputFormat outputFormat;
        try {
            config = resolveConfig();
            outputFormat = parseFormat(format);
        } catch (IOException | IllegalArgumentException exception) {
            stderr.println("❌ 配置错误: " + exception.getMessage());
            return 1;
        }

        if (!Files.exists(directory)) {
            stderr.println("❌ 错误: 路径不存在: " + directory);
            return 1;
        }
        if (!Files.isDirectory(directory)) {
            stderr.println("❌ 错误: " + directory + " 不是目录");
            return 1;
        }

        SearchEngine engine;
        try {
            engine = new IndexBuilder(config).build(directory);
        } catch (IOException exception) {
            stderr.println("❌ 扫描目录失败: " + exception.getMessage());
            return 1;
        } catch (IndexingException exception) {
            stderr.println("❌ 索引失败: " + exception.getMessage());
            return 1;
        }

        Reader reader = new InputStreamReader(stdin, StandardCharsets.UTF_8);
        Writer writer = new BufferedWriter(new OutputStreamWriter(stdout, StandardCharsets.UTF_8));
        try {
            new QueryLoop(new QueryEngine(engine), outputFormat).run(new BufferedReader(reader), writer);
            writer.flush();
            return 0;
        } catch (IOException exception) {
            stderr.println("❌ 查询失败: " + exception.getMessage());
            return 1;
        }
    }

    /**
     * 先加载配置文件，再用命令行参数覆盖。
     */
    EngineConfig resolveConfig() throws IOException {
        EngineConfig config = configFile == null ? EngineConfig.defaults() : loadConfig(configFile);
        if (workers != null) {
            config.setWorkerCount(workers);
        }
        if (minWorkers != null) {
            config.setMinWorkers(minWorkers);
        }
        if (maxWorkers != null) {
            config.setMaxWorkers(maxWorkers);
        }
        if (workersPerCpu != null) {
            config.setWorkersPerCpu(workersPerCpu);
        }
        config.validate();
        if (workers != null && workers > config.getMaxWorkers()) {
            stderr.printf("⚠️ 线程数 %d 超过安全上限 %d，已自动限制%n", workers, config.getMaxWorkers());
        }
        return config;
    }

    private static EngineConfig loadConfig(Path path) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return EngineConfig.fromProperties(properties);
    }

    static OutputFormat parseFormat(String rawFormat) {
        try {
            return OutputFormat.valueOf(rawFormat.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exception) {
            throw new IllegalArgumentException("不支持的输出格式: " + rawFormat + "（可选 text|json）", exception);
        }
    }
}
