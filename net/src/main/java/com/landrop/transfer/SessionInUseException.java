package com.landrop.transfer;

/**
 * 会话 ID 已被进行中的上传占用
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
public class SessionInUseException extends IllegalStateException {

    private final String sessionId;

    public SessionInUseException(String sessionId) {
        super("Upload session id in use: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

}
