package com.docindex.cli;

/**
 * 查询结果输出格式。
 */
public enum OutputFormat {
    /** 头部行加 "路径,分数" 行 */
    TEXT,
    /** 每个查询一行 JSON */
    JSON
}
