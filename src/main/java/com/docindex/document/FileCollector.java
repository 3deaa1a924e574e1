package com.docindex.document;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 递归列出目录下的全部普通文件。
 *
 * 不跟随符号链接，符号链接本身也会被跳过。
 */
public final class FileCollector {
    private FileCollector() {
    }

    /**
     * 收集根目录下的普通文件，按路径字典序返回。
     *
     * 根路径先规范化，去掉 "./" 与 ".." 片段；根为 "." 时返回不带前缀的相对路径。
     *
     * @param root 根目录
     * @return 文件路径列表
     * @throws IOException 遍历过程中任一目录或文件访问失败时抛出
     */
    public static List<Path> collect(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root.normalize(), new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attributes) {
                if (attributes.isRegularFile()) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exception) throws IOException {
                throw exception;
            }
        });
        Collections.sort(files);
        return List.copyOf(files);
    }
}
