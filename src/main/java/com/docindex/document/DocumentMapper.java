package com.docindex.document;

import com.docindex.text.Token;
import com.docindex.text.Tokenizer;
import com.docindex.text.WordTokenizer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * 文档映射器：逐行读取文件并统计词频。
 *
 * 无共享状态，可在不同路径上并发调用。
 */
public class DocumentMapper {
    private final Tokenizer tokenizer;

    public DocumentMapper() {
        this(new WordTokenizer());
    }

    public DocumentMapper(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * 读取文件并返回其词频统计。
     *
     * 按 UTF-8 解码，非法字节替换为 U+FFFD（非字母，起分隔作用），其余内容照常统计。
     *
     * @param path 普通文件路径
     * @return 以路径字符串为标识的文档
     * @throws IOException 打开或读取失败时抛出
     */
    public Document map(Path path) throws IOException {
        Map<String, Integer> frequencies = new HashMap<>();
        int totalTerms = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                for (Token token : tokenizer.tokenize(line)) {
                    frequencies.merge(token.term(), 1, Integer::sum);
                    totalTerms++;
                }
            }
        }
        return new Document(path.toString(), frequencies, totalTerms);
    }
}
