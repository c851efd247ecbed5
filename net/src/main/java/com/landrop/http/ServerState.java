package com.landrop.http;

/**
 * 传输服务状态
 *
 * @author ZhangBoyuan
 * @since 2026-10-19
 */
public enum ServerState {

    STOPPED,

    STARTING,

    RUNNING

}
