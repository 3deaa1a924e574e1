package com.docindex.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.docindex.config.EngineConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;
    private StringWriter usageErrors;

    @BeforeEach
    void setUp() throws Exception {
        sourceDir = Files.createDirectories(tempDir.resolve("source"));
        Files.writeString(sourceDir.resolve("doc1.txt"), "the cat sat");
        Files.writeString(sourceDir.resolve("doc2.txt"), "the dog sat");
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
        usageErrors = new StringWriter();
    }

    @Test
    void testHelpOptionReturnsZero() {
        assertEquals(0, execute("", "--help"));
    }

    @Test
    void testMissingArgumentIsUsageError() {
        int exitCode = execute("");

        assertNotEquals(0, exitCode);
        assertTrue(usageErrors.toString().contains("Missing required parameter"));
        assertEquals("", stdout());
    }

    @Test
    void testNonExistentPathFails() {
        int exitCode = execute("", tempDir.resolve("missing").toString());

        assertEquals(1, exitCode);
        assertTrue(stderr().contains("路径不存在"));
        assertEquals("", stdout());
    }

    @Test
    void testRegularFileIsNotADirectory() {
        int exitCode = execute("", sourceDir.resolve("doc1.txt").toString());

        assertEquals(1, exitCode);
        assertTrue(stderr().contains("不是目录"));
    }

    @Test
    void testIndexAndAnswerQueries() {
        int exitCode = execute("cat\nsat\n\nnonexistent\n", sourceDir.toString());

        assertEquals(0, exitCode);
        String doc1 = sourceDir.resolve("doc1.txt").toString();
        String doc2 = sourceDir.resolve("doc2.txt").toString();
        assertEquals(String.join("\n",
            "== cat (1)",
            doc1 + ",0.000000",
            "== sat (2)",
            doc1 + ",-0.135155",
            doc2 + ",-0.135155",
            "== nonexistent (0)",
            ""), stdout());
    }

    @Test
    void testBinaryFileIndexedAsEmptyDocument() throws Exception {
        Files.write(sourceDir.resolve("binary.bin"), new byte[] {(byte) 0xC3, (byte) 0x28});

        int exitCode = execute("cat\n", sourceDir.toString(), "--workers", "2");

        assertEquals(0, exitCode);
        assertEquals("== cat (1)\n" + sourceDir.resolve("doc1.txt") + ",0.135155\n", stdout());
    }

    @Test
    void testDotRelativeDirectoryPrintsCleanPaths() {
        Path relative = Path.of("").toAbsolutePath().relativize(sourceDir);

        int exitCode = execute("cat\n", "./" + relative);

        assertEquals(0, exitCode);
        assertEquals("== cat (1)\n" + relative.resolve("doc1.txt") + ",0.000000\n", stdout());
    }

    @Test
    void testJsonFormat() throws Exception {
        int exitCode = execute("dog\n", sourceDir.toString(), "--format", "JSON");

        assertEquals(0, exitCode);
        String output = stdout();
        assertTrue(output.endsWith("}\n"));
        JsonNode result = new ObjectMapper().readTree(output);
        assertEquals("dog", result.get("term").asText());
        assertEquals(1, result.get("totalMatches").asInt());
        assertEquals(sourceDir.resolve("doc2.txt").toString(), result.get("hits").get(0).get("document").asText());
    }

    @Test
    void testUnknownFormatFails() {
        assertEquals(1, execute("", sourceDir.toString(), "--format", "xml"));
        assertTrue(stderr().contains("不支持的输出格式"));
    }

    @Test
    void testConfigFileAndOverrides() throws Exception {
        Path configFile = Files.writeString(tempDir.resolve("indexer.properties"),
            "index.workers=3\nindex.maxWorkers=8\nindex.resultQueueCapacity=2\n");
        MainCommand command = new MainCommand(new ByteArrayInputStream(new byte[0]),
            new PrintStream(stdout, true, StandardCharsets.UTF_8),
            new PrintStream(stderr, true, StandardCharsets.UTF_8));
        new CommandLine(command).parseArgs(sourceDir.toString(), "--config", configFile.toString(), "--max-workers", "6");

        EngineConfig config = command.resolveConfig();

        assertEquals(3, config.getWorkerCount());
        assertEquals(6, config.getMaxWorkers());
        assertEquals(2, config.getResultQueueCapacity());
        assertEquals(0, execute("sat\n", sourceDir.toString(), "--config", configFile.toString()));
    }

    @Test
    void testWorkerCountAboveLimitWarns() throws Exception {
        MainCommand command = new MainCommand(new ByteArrayInputStream(new byte[0]),
            new PrintStream(stdout, true, StandardCharsets.UTF_8),
            new PrintStream(stderr, true, StandardCharsets.UTF_8));
        new CommandLine(command).parseArgs(sourceDir.toString(), "--workers", "500");

        EngineConfig config = command.resolveConfig();

        assertEquals(500, config.getWorkerCount());
        assertTrue(stderr().contains("超过安全上限"));
    }

    @Test
    void testInvalidConfigFails() throws Exception {
        Path configFile = Files.writeString(tempDir.resolve("bad.properties"), "index.minWorkers=lots\n");

        assertEquals(1, execute("", sourceDir.toString(), "--config", configFile.toString()));
        assertTrue(stderr().contains("配置错误"));
        assertEquals(1, execute("", sourceDir.toString(), "--config", tempDir.resolve("absent.properties").toString()));
        assertEquals(1, execute("", sourceDir.toString(), "--min-workers", "0"));
    }

    @Test
    void testParseFormat() {
        assertEquals(OutputFormat.TEXT, MainCommand.parseFormat(" text "));
        assertEquals(OutputFormat.JSON, MainCommand.parseFormat("Json"));
        assertThrows(IllegalArgumentException.class, () -> MainCommand.parseFormat("csv"));
    }

    @Test
    void testEmptyDirectoryAnswersWithZeroCounts() throws Exception {
        Path emptyDir = Files.createDirectories(tempDir.resolve("empty"));

        assertEquals(0, execute("anything\n", emptyDir.toString()));
        assertEquals("== anything (0)\n", stdout());
        assertFalse(stderr().contains("❌"));
    }

    private int execute(String input, String... args) {
        MainCommand command = new MainCommand(
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(stdout, true, StandardCharsets.UTF_8),
            new PrintStream(stderr, true, StandardCharsets.UTF_8));
        CommandLine commandLine = new CommandLine(command);
        commandLine.setErr(new PrintWriter(usageErrors, true));
        commandLine.setOut(new PrintWriter(new StringWriter(), true));
        return commandLine.execute(args);
    }

    private String stdout() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return stderr.toString(StandardCharsets.UTF_8);
    }
}
