package com.docindex.cli;

import com.docindex.config.Constants;
import com.docindex.index.ScoredDocument;
import com.docindex.query.QueryEngine;
import com.docindex.query.SearchResult;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.Locale;

/**
 * 逐行读取查询词并输出排序结果，直到输入结束。空行忽略。
 */
public class QueryLoop {
    private static final String SCORE_FORMAT = "%s,%." + Constants.SCORE_DECIMALS + "f";

    private final QueryEngine queryEngine;
    private final OutputFormat format;
    private final ObjectMapper mapper = new ObjectMapper();

    public QueryLoop(QueryEngine queryEngine, OutputFormat format) {
        this.queryEngine = queryEngine;
        this.format = format;
    }

    /**
     * 执行查询循环，每个查询输出后立即 flush。
     *
     * @return 处理的查询数量
     * @throws IOException 读写失败时抛出
     */
    public int run(BufferedReader input, Writer output) throws IOException {
        int answered = 0;
        String line;
        while ((line = input.readLine()) != null) {
            String term = QueryEngine.normalize(line);
            if (term.isEmpty()) {
                continue;
            }
            SearchResult result = queryEngine.search(term);
            if (format == OutputFormat.JSON) {
                writeJson(result, output);
            } else {
                writeText(result, output);
            }
            output.flush();
            answered++;
        }
        return answered;
    }

    private void writeText(SearchResult result, Writer output) throws IOException {
        output.write(String.format(Locale.ROOT, Constants.RESULT_HEADER_FORMAT, result.term(), result.totalMatches()));
        output.write('\n');
        for (ScoredDocument hit : result.hits()) {
            output.write(String.format(Locale.ROOT, SCORE_FORMAT, hit.document(), hit.score()));
            output.write('\n');
        }
    }

    private void writeJson(SearchResult result, Writer output) throws IOException {
        output.write(mapper.writeValueAsString(result));
        output.write('\n');
    }
}
