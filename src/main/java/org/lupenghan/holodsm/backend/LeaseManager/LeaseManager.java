package org.lupenghan.holodsm.backend.LeaseManager;

import org.lupenghan.holodsm.backend.LeaseManager.Dataform.Lease;
import org.lupenghan.holodsm.backend.LeaseManager.Dataform.LeaseType;
import org.lupenghan.holodsm.backend.utils.DSMException;

import java.util.List;

/**
 * 租约管理接口 - 按 (数组, 页面) 签发、校验、撤销读写租约，保证单写多读
 */
public interface LeaseManager {
    /**
     * 获取租约
     * 已有写租约时任何请求都冲突；已有读租约时写请求冲突；
     * 同一持有者重复申请读租约时只续期已有租约
     * @param arrayId 数组ID
     * @param pageId 页号
     * @param type 租约类型
     * @param owner 持有者
     * @param version 页面版本
     * @return 租约
     * @throws DSMException 冲突时抛出CONFLICT
     */
    Lease acquireLease(String arrayId, int pageId, LeaseType type, String owner, long version) throws DSMException;

    /**
     * 以调用方提议的租约ID获取租约，远程申请被取消后可以按此ID释放
     * @param leaseId 提议的租约ID
     * @param arrayId 数组ID
     * @param pageId 页号
     * @param type 租约类型
     * @param owner 持有者
     * @param version 页面版本
     * @return 租约；续期已有读租约时返回的租约ID可能与提议的不同
     * @throws DSMException 冲突时抛出CONFLICT
     */
    Lease acquireLease(String leaseId, String arrayId, int pageId, LeaseType type, String owner, long version)
            throws DSMException;

    /**
     * 释放租约
     * @param leaseId 租约ID
     * @throws DSMException 租约不存在时抛出NOT_FOUND
     */
    void releaseLease(String leaseId) throws DSMException;

    /**
     * 校验租约
     * @param leaseId 租约ID
     * @return 有效的租约
     * @throws DSMException 不存在时抛出NOT_FOUND，已过期时抛出EXPIRED
     */
    Lease validateLease(String leaseId) throws DSMException;

    /**
     * 页面上是否存在未过期的写租约
     */
    boolean hasWriteLease(String arrayId, int pageId);

    /**
     * 无条件清除页面上的全部租约，幂等
     * @param arrayId 数组ID
     * @param pageId 页号
     */
    void revokeLease(String arrayId, int pageId);

    /**
     * 清除某个节点持有的全部租约（节点被判定死亡时使用），包括该节点上各个读者的租约
     * @param owner 节点ID
     * @return 清除的租约数量
     */
    int revokeLeasesHeldBy(String owner);

    /**
     * 清除某个数组的全部租约（数组被删除时使用）
     * @param arrayId 数组ID
     * @return 清除的租约数量
     */
    int revokeLeases(String arrayId);

    /**
     * 清理全部过期租约
     * @return 清理的租约数量
     */
    int cleanupExpiredLeases();

    /**
     * 页面上当前登记的租约（包括尚未清理的过期租约）
     */
    List<Lease> getLeases(String arrayId, int pageId);

    /**
     * 租约表中的租约总数（包括尚未清理的过期租约）
     */
    int getLeaseCount();
}
