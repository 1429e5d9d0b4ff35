package org.lupenghan.holodsm.backend.LeaseManager.Dataform;

import lombok.Getter;

/**
 * 页面租约，作用于唯一的 (数组, 页面)
 * 超过 expiresAt 的租约在逻辑上已失效，即使尚未被清理
 */
@Getter
public class Lease {
    // 持有者ID中节点ID与读者标识的分隔符，例如 node-a#<租约ID>
    public static final char HOLDER_SEPARATOR = '#';

    private final String leaseId;     // 租约ID
    private final String arrayId;     // 数组ID
    private final int pageId;         // 页号
    private final LeaseType type;     // 租约类型
    private final String owner;       // 持有者（节点或客户端ID）
    private final long version;       // 签发时的页面版本
    private volatile long expiresAt;  // 过期时间（毫秒）

    public Lease(String leaseId, String arrayId, int pageId, LeaseType type,
                 String owner, long version, long expiresAt) {
        this.leaseId = leaseId;
        this.arrayId = arrayId;
        this.pageId = pageId;
        this.type = type;
        this.owner = owner;
        this.version = version;
        this.expiresAt = expiresAt;
    }

    /**
     * 续期
     * @param expiresAt 新的过期时间
     */
    public void refresh(long expiresAt) {
        this.expiresAt = expiresAt;
    }

    public boolean isExpired(long now) {
        return now > expiresAt;
    }

    /**
     * 租约是否属于指定节点，包括该节点上各个读者的租约
     * @param nodeId 节点ID
     */
    public boolean isHeldBy(String nodeId) {
        return owner.equals(nodeId) || owner.startsWith(nodeId + HOLDER_SEPARATOR);
    }

    @Override
    public String toString() {
        return "Lease{id=" + leaseId + ", arrayId=" + arrayId + ", pageId=" + pageId
                + ", type=" + type + ", owner=" + owner + ", version=" + version
                + ", expiresAt=" + expiresAt + "}";
    }
}
