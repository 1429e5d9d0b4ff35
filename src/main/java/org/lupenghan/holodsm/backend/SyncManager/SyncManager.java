package org.lupenghan.holodsm.backend.SyncManager;

import org.lupenghan.holodsm.backend.PageManager.Page;
import org.lupenghan.holodsm.backend.SyncManager.Dataform.SyncState;
import org.lupenghan.holodsm.backend.utils.DSMException;

/**
 * 同步管理接口 - 维护本节点的写租约和工作副本，执行同步屏障
 * 只有“写入、同步、读取”的顺序才保证能读到其他节点的写入
 */
public interface SyncManager {

    /**
     * 页面读取回调
     */
    interface PageReader<T> {
        T read(Page page) throws DSMException;
    }

    /**
     * 读取页面：本节点持有有效写租约时读工作副本，否则在读租约保护下读取
     * 页面尚无所有者时先由本节点认领
     * @param arrayId 数组ID
     * @param pageId 页号
     * @param reader 读取回调
     * @return 回调的结果
     * @throws DSMException 租约冲突、远程失败等
     */
    <T> T read(String arrayId, int pageId, PageReader<T> reader) throws DSMException;

    /**
     * 获取页面的写租约并返回可写的工作副本，已持有时直接复用
     * @param arrayId 数组ID
     * @param pageId 页号
     * @return 工作副本
     * @throws DSMException 冲突时抛出CONFLICT；已持有的写租约过期时丢弃工作副本并抛出EXPIRED
     */
    Page acquireForWrite(String arrayId, int pageId) throws DSMException;

    /**
     * 获取工作副本
     * @return 工作副本，未持有写租约时返回null
     */
    Page workingCopy(String arrayId, int pageId);

    /**
     * 同步屏障：刷新脏页，释放写租约，使各节点缓存失效，递增数组版本
     * @param arrayId 数组ID
     * @throws DSMException 有脏页因写租约过期被丢弃时在其余步骤完成后抛出EXPIRED；
     *         刷新失败时保留该页的写租约和工作副本，不递增版本，抛出刷新的错误，可以重试
     */
    void sync(String arrayId) throws DSMException;

    /**
     * 关闭数组：释放本节点持有的全部租约并丢弃缓存页面，未同步的修改被丢弃
     */
    void close(String arrayId) throws DSMException;

    /**
     * 数组已被删除，直接丢弃本地写集合
     */
    void discard(String arrayId);

    SyncState getState(String arrayId);

    /**
     * 本节点在数组上持有的写租约数量
     */
    int getHeldWriteLeaseCount(String arrayId);
}
