package com.docindex;

import com.docindex.config.EngineConfig;
import com.docindex.document.FileCollector;
import com.docindex.index.IndexBuilder;
import com.docindex.index.SearchEngine;
import com.docindex.query.QueryEngine;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 索引性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IndexBenchmark {

    @State(Scope.Thread)
    public static class IndexState {
        @Param({"1", "4", "32"})
        int workers;

        Path tempDir;
        List<Path> files;
        IndexBuilder builder;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("benchmark");
            Path sourceDir = Files.createDirectories(tempDir.resolve("source"));

            // 创建1000个测试文件
            for (int i = 0; i < 1000; i++) {
                Files.writeString(sourceDir.resolve("doc" + i + ".txt"), generateDocument(i));
            }
            files = FileCollector.collect(sourceDir);

            EngineConfig config = EngineConfig.defaults();
            config.setWorkerCount(workers);
            builder = new IndexBuilder(config);
        }

        @TearDown
        public void tearDown() throws IOException {
            deleteDirectory(tempDir);
        }

        private String generateDocument(int index) {
            return "Document " + index + " content.\n" +
                   "Hearing I ask from the holy races, from Heimdall's sons, both high and low;\n" +
                   "Thou wilt, Valfather, that well I relate old tales I remember of men long ago.\n" +
                   " repeated text to increase size.".repeat(5);
        }
    }

    @Benchmark
    public int indexThroughput(IndexState state) {
        return state.builder.build(state.files).documentCount();
    }

    @State(Scope.Benchmark)
    public static class QueryLatencyState {
        Path tempDir;
        QueryEngine queryEngine;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("benchmark");
            Path sourceDir = Files.createDirectories(tempDir.resolve("source"));

            // 创建10000个测试文件
            for (int i = 0; i < 10000; i++) {
                String content = "Document " + i + " about " +
                    (i % 10 == 0 ? "Odin and the ravens" :
                     i % 10 == 1 ? "Thor and the serpent" :
                     i % 10 == 2 ? "the world tree" :
                     "general content") +
                    " with various keywords for search testing.";
                Files.writeString(sourceDir.resolve("doc" + i + ".txt"), content);
            }

            SearchEngine engine = new IndexBuilder(EngineConfig.defaults()).build(sourceDir);
            queryEngine = new QueryEngine(engine);
        }

        @TearDown
        public void tearDown() throws IOException {
            deleteDirectory(tempDir);
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public int queryLatencyRareTerm(QueryLatencyState state) {
        return state.queryEngine.search("odin").totalMatches();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public int queryLatencyCommonTerm(QueryLatencyState state) {
        return state.queryEngine.search("the").totalMatches();
    }

    private static void deleteDirectory(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException exception) {
                    throw new UncheckedIOException(exception);
                }
            });
        }
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IndexBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
