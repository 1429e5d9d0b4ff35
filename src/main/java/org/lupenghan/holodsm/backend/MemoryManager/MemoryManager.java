package org.lupenghan.holodsm.backend.MemoryManager;

import org.lupenghan.holodsm.backend.LeaseManager.Dataform.Lease;
import org.lupenghan.holodsm.backend.LeaseManager.Dataform.LeaseType;
import org.lupenghan.holodsm.backend.LeaseManager.LeaseManager;
import org.lupenghan.holodsm.backend.MemoryManager.Dataform.SharedArray;
import org.lupenghan.holodsm.backend.PageManager.Dataform.ElementType;
import org.lupenghan.holodsm.backend.PageManager.Page;
import org.lupenghan.holodsm.backend.PageManager.PageCache;
import org.lupenghan.holodsm.backend.utils.DSMException;

import java.util.Collection;

/**
 * 内存管理接口 - 创建和删除数组，解析页面所有权，提供本地页面，在未命中时向远端请求页面
 * 标注“归属节点侧”的方法只在数组的归属节点上执行，其余节点通过控制消息调用
 */
public interface MemoryManager {

    String getLocalNodeId();

    /**
     * 集群统一的页面大小（字节）
     */
    int getPageSize();

    PageCache getPageCache();

    LeaseManager getLeaseManager();

    // ---- 数组 ----

    /**
     * 创建64位整数数组，不会立即创建页面
     * @param length 元素个数
     * @return 数组描述符
     */
    SharedArray createArray(long length);

    /**
     * 创建指定元素类型的数组
     * @param length 元素个数
     * @param elementType 元素类型
     * @return 数组描述符
     */
    SharedArray createArray(long length, ElementType elementType);

    /**
     * 按ID查找数组
     * @throws DSMException 数组不存在时抛出NOT_FOUND
     */
    SharedArray getArray(String arrayId) throws DSMException;

    /**
     * 删除数组并通知其他节点
     * @throws DSMException 数组不存在时抛出NOT_FOUND
     */
    void deleteArray(String arrayId) throws DSMException;

    /**
     * 登记其他节点创建的数组
     * @param array 数组描述符
     */
    void registerArray(SharedArray array);

    /**
     * 丢弃其他节点已删除的数组的本地状态
     * @return 本地是否知道该数组
     */
    boolean forgetArray(String arrayId);

    Collection<SharedArray> getArrays();

    // ---- 页面 ----

    /**
     * 请求页面：所有者是本地节点时从本地存储提供（必要时创建），否则先查缓存再向所有者请求
     * @param arrayId 数组ID
     * @param pageId 页号
     * @param version 请求的版本
     * @return 页面
     * @throws DSMException 页面尚无所有者时抛出NOT_FOUND；远程失败时抛出UNREACHABLE/TIMEOUT
     */
    Page requestPage(String arrayId, int pageId, long version) throws DSMException;

    /**
     * 获取本地页面，不存在时创建；重复调用返回同一实例
     */
    Page getLocalPage(String arrayId, int pageId, long version) throws DSMException;

    /**
     * 所有者侧：为远端请求提供本地页面
     * @throws DSMException 本节点不是页面所有者时抛出NOT_FOUND
     */
    Page servePage(String arrayId, int pageId, long version) throws DSMException;

    /**
     * 所有者侧：接收写者刷新过来的页面镜像
     * @param leaseId 写者持有的写租约，本节点同时是归属节点时校验
     * @throws DSMException 镜像大小不一致时抛出PROTOCOL；租约无效时抛出NOT_FOUND/EXPIRED
     */
    void storePage(String arrayId, int pageId, byte[] image, long version, String leaseId) throws DSMException;

    /**
     * 把写者的工作副本刷新到页面所有者，成功后页面被标记为干净
     * @param arrayId 数组ID
     * @param page 工作副本
     * @param leaseId 写租约ID
     * @throws DSMException 所有者不可达等
     */
    void flushPage(String arrayId, Page page, String leaseId) throws DSMException;

    int getLocalPageCount();

    // ---- 所有权 ----

    /**
     * 解析页面所有者：先查本地映射，未知时询问归属节点
     * @return 所有者节点ID，尚未分配时返回null
     */
    String resolveOwner(String arrayId, int pageId) throws DSMException;

    /**
     * 为本节点申请页面所有权；页面已有所有者时返回现有所有者
     * @return 实际的所有者
     */
    String claimOwnership(String arrayId, int pageId) throws DSMException;

    /**
     * 归属节点侧：查询所有者
     */
    String lookupOwner(String arrayId, int pageId) throws DSMException;

    /**
     * 归属节点侧：页面无所有者时分配给指定节点
     */
    String assignOwner(String arrayId, int pageId, String nodeId) throws DSMException;

    // ---- 租约 ----

    /**
     * 以本节点身份获取租约，请求发往数组的归属节点
     * 读租约的持有者是本节点上的一个读者（节点ID#租约ID），写租约的持有者是本节点
     * @throws DSMException 冲突时抛出CONFLICT；超时或取消时不会留下半成品租约
     */
    Lease acquireLease(String arrayId, int pageId, LeaseType type) throws DSMException;

    /**
     * 释放本节点持有的租约
     */
    void releaseLease(Lease lease) throws DSMException;

    /**
     * 归属节点侧：签发租约，写租约同时为无主页面分配所有者
     */
    Lease grantLease(String leaseId, String arrayId, int pageId, LeaseType type, String owner, long version)
            throws DSMException;

    // ---- 同步 ----

    /**
     * 使本地缓存中的页面失效，并通知所有其他节点
     */
    void invalidate(String arrayId, Collection<Integer> pageIds);

    /**
     * 仅使本地缓存中的页面失效
     * @return 实际移除的页面数
     */
    int invalidateLocal(String arrayId, int[] pageIds);

    /**
     * 请求归属节点递增数组版本
     * @return 新版本
     */
    long bumpVersion(String arrayId) throws DSMException;

    /**
     * 归属节点侧：递增数组版本并通知除请求方外的节点
     * @param requester 发起同步的节点
     * @return 新版本
     */
    long advanceArrayVersion(String arrayId, String requester) throws DSMException;

    /**
     * 采用归属节点通知的新版本
     */
    void applyArrayVersion(String arrayId, long version);

    // ---- 故障处理 ----

    /**
     * 节点失效：撤销其租约，清除指向它的所有权记录和缓存页面
     * @param nodeId 失效节点
     */
    void handleNodeFailure(String nodeId);
}
