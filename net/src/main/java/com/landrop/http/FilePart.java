package com.landrop.http;

import lombok.Value;

import java.nio.file.Path;

/**
 * multipart 中的文件字段，内容已暂存到临时文件
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Value
public class FilePart {

    /**
     * 表单字段名
     */
    String fieldName;

    /**
     * 客户端提交的原始文件名，可能包含路径
     */
    String filename;

    /**
     * 暂存文件
     */
    Path spool;

    /**
     * 文件内容字节数
     */
    long size;

}
