package org.lupenghan.holodsm.backend.PageManager.Dataform;

import lombok.Getter;

/**
 * 数组元素类型
 */
@Getter
public enum ElementType {
    // 64位整数
    INT64(0, Long.BYTES),
    // 32位浮点数
    FLOAT32(1, Float.BYTES);

    private final int value;
    private final int size;     // 每个元素占用的字节数

    ElementType(int value, int size) {
        this.value = value;
        this.size = size;
    }

    public static ElementType fromValue(int value) {
        for (ElementType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid element type value: " + value);
    }
}
