package com.docindex.index;

import com.docindex.document.Document;

import java.nio.file.Path;

/**
 * 单个文件的映射结果，成功时携带文档，失败时携带异常或错误，始终标记来源路径。
 */
public record MapResult(Path path, Document document, Throwable error) {

    public static MapResult success(Path path, Document document) {
        return new MapResult(path, document, null);
    }

    public static MapResult failure(Path path, Throwable error) {
        return new MapResult(path, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
