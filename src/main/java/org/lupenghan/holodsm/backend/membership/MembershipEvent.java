package org.lupenghan.holodsm.backend.membership;

import lombok.Getter;

/**
 * 成员变更事件，由外部成员管理组件发布
 */
@Getter
public class MembershipEvent {

    public enum Kind {
        JOIN,
        LEAVE,
        STATUS_CHANGE
    }

    private final Kind kind;
    private final String nodeId;
    private final MemberStatus oldStatus;   // 仅STATUS_CHANGE有意义
    private final MemberStatus newStatus;
    private final long timestamp;

    private MembershipEvent(Kind kind, String nodeId, MemberStatus oldStatus, MemberStatus newStatus) {
        this.kind = kind;
        this.nodeId = nodeId;
        this.oldStatus = oldStatus;
        this.newStatus = newStatus;
        this.timestamp = System.currentTimeMillis();
    }

    public static MembershipEvent join(String nodeId) {
        return new MembershipEvent(Kind.JOIN, nodeId, null, MemberStatus.ALIVE);
    }

    public static MembershipEvent leave(String nodeId) {
        return new MembershipEvent(Kind.LEAVE, nodeId, null, null);
    }

    public static MembershipEvent statusChange(String nodeId, MemberStatus oldStatus, MemberStatus newStatus) {
        return new MembershipEvent(Kind.STATUS_CHANGE, nodeId, oldStatus, newStatus);
    }

    /**
     * 节点是否已不可用：离开集群或被确认失效
     */
    public boolean isNodeGone() {
        return kind == Kind.LEAVE || (kind == Kind.STATUS_CHANGE && newStatus == MemberStatus.DEAD);
    }

    @Override
    public String toString() {
        return "MembershipEvent{kind=" + kind + ", nodeId=" + nodeId
                + (kind == Kind.STATUS_CHANGE ? ", " + oldStatus + " -> " + newStatus : "") + "}";
    }
}
