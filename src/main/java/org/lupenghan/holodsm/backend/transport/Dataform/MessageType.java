package org.lupenghan.holodsm.backend.transport.Dataform;

import lombok.Getter;
import org.lupenghan.holodsm.backend.transport.StreamType;

/**
 * 消息类型
 */
@Getter
public enum MessageType {
    // 数据面
    PAGE_REQUEST(1, StreamType.DATA),
    PAGE_RESPONSE(2, StreamType.DATA),
    PAGE_PUSH(3, StreamType.DATA),

    // 租约
    LEASE_ACQUIRE(10, StreamType.CONTROL),
    LEASE_GRANT(11, StreamType.CONTROL),
    LEASE_RELEASE(12, StreamType.CONTROL),
    LEASE_REVOKE(13, StreamType.CONTROL),

    // 页面所有权
    OWNER_LOOKUP(20, StreamType.CONTROL),
    OWNER_CLAIM(21, StreamType.CONTROL),
    OWNER_INFO(22, StreamType.CONTROL),

    // 数组元数据与同步
    ARRAY_ANNOUNCE(30, StreamType.CONTROL),
    ARRAY_DELETE(31, StreamType.CONTROL),
    ARRAY_SYNC(32, StreamType.CONTROL),
    ARRAY_VERSION(33, StreamType.CONTROL),
    INVALIDATE(34, StreamType.CONTROL),

    // 通用应答
    ACK(90, StreamType.CONTROL),
    ERROR(91, StreamType.CONTROL);

    private final int value;
    private final StreamType streamType;

    MessageType(int value, StreamType streamType) {
        this.value = value;
        this.streamType = streamType;
    }

    public static MessageType fromValue(int value) {
        for (MessageType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid message type value: " + value);
    }
}
