package org.lupenghan.holodsm.backend.utils;

import lombok.Getter;

/**
 * DSM操作失败时抛出的异常
 * 携带错误类型以及数组ID、页面ID、租约ID，方便调用方精确重试
 */
@Getter
public class DSMException extends Exception {

    public static final int NO_PAGE = -1;

    private final ErrorType errorType;

    private final String arrayId;

    private final int pageId;

    private final String leaseId;

    /**
     * 创建不带上下文的异常
     * @param errorType 错误类型
     * @param message 异常消息
     */
    public DSMException(ErrorType errorType, String message) {
        this(errorType, message, null, NO_PAGE, null);
    }

    /**
     * 创建带原因的异常
     * @param errorType 错误类型
     * @param message 异常消息
     * @param cause 原始异常
     */
    public DSMException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.arrayId = null;
        this.pageId = NO_PAGE;
        this.leaseId = null;
    }

    /**
     * 创建带页面上下文的异常
     * @param errorType 错误类型
     * @param message 异常消息
     * @param arrayId 数组ID，可以为null
     * @param pageId 页面ID，不适用时为 {@link #NO_PAGE}
     * @param leaseId 租约ID，可以为null
     */
    public DSMException(ErrorType errorType, String message, String arrayId, int pageId, String leaseId) {
        super(message);
        this.errorType = errorType;
        this.arrayId = arrayId;
        this.pageId = pageId;
        this.leaseId = leaseId;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DSMException[").append(errorType).append("]: ").append(getMessage());
        if (arrayId != null) {
            sb.append(" (array=").append(arrayId);
            if (pageId != NO_PAGE) {
                sb.append(", page=").append(pageId);
            }
            if (leaseId != null) {
                sb.append(", lease=").append(leaseId);
            }
            sb.append(')');
        } else if (leaseId != null) {
            sb.append(" (lease=").append(leaseId).append(')');
        }
        return sb.toString();
    }
}
