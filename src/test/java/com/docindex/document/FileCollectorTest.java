package com.docindex.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCollectorTest {

    @TempDir
    Path tempDir;

    @Test
    void testCollectRecursesAndSorts() throws IOException {
        Files.createDirectories(tempDir.resolve("b/nested"));
        Files.createDirectories(tempDir.resolve("a"));
        Files.createDirectories(tempDir.resolve("empty"));
        Files.writeString(tempDir.resolve("b/nested/deep.txt"), "deep");
        Files.writeString(tempDir.resolve("a/one.txt"), "one");
        Files.writeString(tempDir.resolve("root.txt"), "root");

        List<Path> files = FileCollector.collect(tempDir);

        assertEquals(List.of(
            tempDir.resolve("a/one.txt"),
            tempDir.resolve("b/nested/deep.txt"),
            tempDir.resolve("root.txt")
        ), files);
    }

    @Test
    void testCollectNormalizesRoot() throws IOException {
        Files.createDirectories(tempDir.resolve("a"));
        Files.createDirectories(tempDir.resolve("b"));
        Files.writeString(tempDir.resolve("b/doc1.txt"), "doc");

        List<Path> files = FileCollector.collect(tempDir.resolve("./a/../b"));

        assertEquals(List.of(tempDir.resolve("b/doc1.txt")), files);
        assertEquals(tempDir.resolve("b/doc1.txt").toString(), files.get(0).toString());
    }

    @Test
    void testCollectDotRelativeRootDropsPrefix() throws IOException {
        Files.writeString(tempDir.resolve("doc1.txt"), "doc");
        Path relative = Path.of("").toAbsolutePath().relativize(tempDir);

        List<Path> files = FileCollector.collect(Path.of("./" + relative));

        assertEquals(List.of(relative.resolve("doc1.txt").toString()),
            files.stream().map(Path::toString).toList());
    }

    @Test
    void testCollectEmptyDirectory() throws IOException {
        assertTrue(FileCollector.collect(tempDir).isEmpty());
    }

    @Test
    void testCollectSkipsSymbolicLinks() throws IOException {
        Path target = Files.writeString(tempDir.resolve("target.txt"), "target");
        try {
            Files.createSymbolicLink(tempDir.resolve("link.txt"), target);
        } catch (UnsupportedOperationException | IOException exception) {
            Assumptions.assumeTrue(false, "文件系统不支持符号链接");
        }

        assertEquals(List.of(target), FileCollector.collect(tempDir));
    }

    @Test
    void testCollectMissingRootFails() {
        assertThrows(NoSuchFileException.class, () -> FileCollector.collect(tempDir.resolve("missing")));
    }
}
