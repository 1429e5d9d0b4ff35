package org.lupenghan.holodsm.backend.utils;

import lombok.Getter;

/**
 * DSM错误分类
 */
@Getter
public enum ErrorType {
    // 租约冲突，调用方应退避后重试
    CONFLICT(0, true),
    // 未知的数组、租约或页面所有者
    NOT_FOUND(1, false),
    // 租约已过期，需要重新获取
    EXPIRED(2, true),
    // 页面访问越界，属于编程错误
    OUT_OF_BOUNDS(3, false),
    // 远程节点不可达
    UNREACHABLE(4, true),
    // 远程请求超时
    TIMEOUT(5, true),
    // 协议错误：页面大小不一致、报文格式错误等
    PROTOCOL(6, false),
    // 调用线程在等待时被中断
    CANCELLED(7, false);

    private final int value;
    private final boolean retryable;

    ErrorType(int value, boolean retryable) {
        this.value = value;
        this.retryable = retryable;
    }

    public static ErrorType fromValue(int value) {
        for (ErrorType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid error type value: " + value);
    }
}
