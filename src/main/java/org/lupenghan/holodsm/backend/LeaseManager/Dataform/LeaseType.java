package org.lupenghan.holodsm.backend.LeaseManager.Dataform;

import lombok.Getter;

@Getter
public enum LeaseType {
    // 读租约，可与其他读租约共存
    READ(0),
    // 写租约，独占
    WRITE(1);

    private final int value;
    LeaseType(int value) {
        this.value = value;
    }

    public static LeaseType fromValue(int value) {
        for (LeaseType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid lease type value: " + value);
    }
}
