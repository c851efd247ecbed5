package com.landrop.transfer;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * 某一时刻的上传进度快照
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
@Value
@JsonPropertyOrder({"total", "uploaded"})
public class ProgressSnapshot {

    /**
     * 未知会话（尚未开始或已结束）返回的零值
     */
    public static final ProgressSnapshot UNKNOWN = new ProgressSnapshot(0, 0);

    long total;

    long uploaded;

}
