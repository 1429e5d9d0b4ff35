package org.lupenghan.holodsm.backend.transport;

/**
 * 流类型
 */
public enum StreamType {
    // 控制面：租约、所有权、数组元数据、失效通知
    CONTROL,
    // 数据面：页面请求与推送
    DATA
}
