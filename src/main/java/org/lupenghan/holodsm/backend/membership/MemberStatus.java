package org.lupenghan.holodsm.backend.membership;

/**
 * 成员状态
 */
public enum MemberStatus {
    // 存活
    ALIVE,
    // 疑似失效
    SUSPECT,
    // 确认失效
    DEAD
}
