package org.lupenghan.holodsm.backend.MemoryManager.Impl;

import org.lupenghan.holodsm.backend.LeaseManager.Dataform.Lease;
import org.lupenghan.holodsm.backend.LeaseManager.Dataform.LeaseType;
import org.lupenghan.holodsm.backend.LeaseManager.LeaseManager;
import org.lupenghan.holodsm.backend.MemoryManager.Dataform.SharedArray;
import org.lupenghan.holodsm.backend.MemoryManager.MemoryManager;
import org.lupenghan.holodsm.backend.PageManager.Dataform.ElementType;
import org.lupenghan.holodsm.backend.PageManager.Dataform.PageKey;
import org.lupenghan.holodsm.backend.PageManager.Impl.PageImpl;
import org.lupenghan.holodsm.backend.PageManager.Page;
import org.lupenghan.holodsm.backend.PageManager.PageCache;
import org.lupenghan.holodsm.backend.conf.DSMConfig;
import org.lupenghan.holodsm.backend.transport.Dataform.Message;
import org.lupenghan.holodsm.backend.transport.Dataform.MessageType;
import org.lupenghan.holodsm.backend.transport.Messenger;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * 内存管理器实现
 * 本地存储保存本节点拥有的页面，缓存保存从其他节点取来的只读副本
 */
public class MemoryManagerImpl implements MemoryManager {
    private static final Logger LOGGER = Logger.getLogger(MemoryManagerImpl.class.getName());

    private final String localNodeId;
    private final int pageSize;
    private final PageCache pageCache;
    private final LeaseManager leaseManager;
    private final Messenger messenger;

    // 已知数组
    private final Map<String, SharedArray> arrays;

    // 本节点拥有的页面
    private final Map<PageKey, Page> localPages;

    public MemoryManagerImpl(String localNodeId, DSMConfig config, PageCache pageCache,
                             LeaseManager leaseManager, Messenger messenger) {
        this.localNodeId = localNodeId;
        this.pageSize = config.getPageSize();
        this.pageCache = pageCache;
        this.leaseManager = leaseManager;
        this.messenger = messenger;
        this.arrays = new ConcurrentHashMap<>();
        this.localPages = new ConcurrentHashMap<>();
    }

    @Override
    public String getLocalNodeId() {
        return localNodeId;
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public PageCache getPageCache() {
        return pageCache;
    }

    @Override
    public LeaseManager getLeaseManager() {
        return leaseManager;
    }

    // ---- 数组 ----

    @Override
    public SharedArray createArray(long length) {
        return createArray(length, ElementType.INT64);
    }

    @Override
    public SharedArray createArray(long length, ElementType elementType) {
        SharedArray array = new SharedArray(UUID.randomUUID().toString(), length, elementType, pageSize, localNodeId);
        arrays.put(array.getId(), array);
        LOGGER.info("创建数组 " + array);

        int notified = messenger.broadcast(Message.createArrayAnnounce(array.getId(), length, elementType,
                pageSize, array.getVersion(), localNodeId));
        LOGGER.fine("数组 " + array.getId() + " 已通告给 " + notified + " 个节点");
        return array;
    }

    @Override
    public SharedArray getArray(String arrayId) throws DSMException {
        SharedArray array = arrays.get(arrayId);
        if (array == null) {
            throw new DSMException(ErrorType.NOT_FOUND, "数组不存在", arrayId, DSMException.NO_PAGE, null);
        }
        return array;
    }

    @Override
    public void deleteArray(String arrayId) throws DSMException {
        SharedArray array = arrays.remove(arrayId);
        if (array == null) {
            throw new DSMException(ErrorType.NOT_FOUND, "数组不存在", arrayId, DSMException.NO_PAGE, null);
        }
        dropArrayState(arrayId);
        messenger.broadcast(Message.createArrayDelete(arrayId));
        LOGGER.info("删除数组 " + arrayId);
    }

    @Override
    public void registerArray(SharedArray array) {
        if (arrays.putIfAbsent(array.getId(), array) == null) {
            LOGGER.fine("登记数组 " + array);
        }
    }

    @Override
    public boolean forgetArray(String arrayId) {
        SharedArray array = arrays.remove(arrayId);
        dropArrayState(arrayId);
        return array != null;
    }

    @Override
    public Collection<SharedArray> getArrays() {
        return new ArrayList<>(arrays.values());
    }

    private void dropArrayState(String arrayId) {
        localPages.keySet().removeIf(key -> key.getArrayId().equals(arrayId));
        pageCache.removeIf(key -> key.getArrayId().equals(arrayId));
        leaseManager.revokeLeases(arrayId);
    }

    // ---- 页面 ----

    @Override
    public Page requestPage(String arrayId, int pageId, long version) throws DSMException {
        SharedArray array = getArray(arrayId);
        array.checkPage(pageId);

        String owner = resolveOwner(arrayId, pageId);
        if (owner == null) {
            throw new DSMException(ErrorType.NOT_FOUND, "页面尚未分配所有者", arrayId, pageId, null);
        }
        if (owner.equals(localNodeId)) {
            return getLocalPage(arrayId, pageId, version);
        }

        Page cached = pageCache.get(arrayId, pageId);
        if (cached != null) {
            return cached;
        }
        return fetchRemotePage(array, pageId, owner, version);
    }

    /**
     * 向所有者请求页面，成功后放入缓存；失败时缓存不变
     */
    private Page fetchRemotePage(SharedArray array, int pageId, String owner, long version) throws DSMException {
        Message response = messenger.request(owner,
                Message.createPageRequest(array.getId(), pageId, version), MessageType.PAGE_RESPONSE);
        byte[] image = response.getData();
        if (image.length != array.getPageSize()) {
            throw new DSMException(ErrorType.PROTOCOL,
                    "页面大小不一致: " + image.length + "，期望 " + array.getPageSize(),
                    array.getId(), pageId, null);
        }
        Page page = new PageImpl(new PageKey(array.getId(), pageId), array.getPageSize(), response.getVersion(), image);
        pageCache.put(array.getId(), pageId, page);
        LOGGER.fine("从节点 " + owner + " 取得页面 " + page.getKey());
        return page;
    }

    @Override
    public Page getLocalPage(String arrayId, int pageId, long version) throws DSMException {
        SharedArray array = getArray(arrayId);
        array.checkPage(pageId);
        return localPages.computeIfAbsent(new PageKey(arrayId, pageId),
                key -> new PageImpl(key, array.getPageSize(), version));
    }

    @Override
    public Page servePage(String arrayId, int pageId, long version) throws DSMException {
        SharedArray array = getArray(arrayId);
        array.checkPage(pageId);
        Page page = localPages.get(new PageKey(arrayId, pageId));
        if (page != null) {
            return page;
        }
        if (!localNodeId.equals(array.getPageOwner(pageId))) {
            throw new DSMException(ErrorType.NOT_FOUND, "本节点不是页面所有者", arrayId, pageId, null);
        }
        return getLocalPage(arrayId, pageId, version);
    }

    @Override
    public void storePage(String arrayId, int pageId, byte[] image, long version, String leaseId)
            throws DSMException {
        SharedArray array = getArray(arrayId);
        array.checkPage(pageId);

        String owner = array.getPageOwner(pageId);
        if (owner != null && !owner.equals(localNodeId)) {
            throw new DSMException(ErrorType.NOT_FOUND, "本节点不是页面所有者，所有者为 " + owner,
                    arrayId, pageId, leaseId);
        }
        if (leaseId != null && array.isHomedAt(localNodeId)) {
            Lease lease = leaseManager.validateLease(leaseId);
            if (lease.getType() != LeaseType.WRITE || lease.getPageId() != pageId
                    || !lease.getArrayId().equals(arrayId)) {
                throw new DSMException(ErrorType.CONFLICT, "刷新页面需要该页面的写租约", arrayId, pageId, leaseId);
            }
        }

        Page page = getLocalPage(arrayId, pageId, version);
        page.load(image, version);
        if (owner == null) {
            array.claimPageOwner(pageId, localNodeId);
        }
        pageCache.remove(arrayId, pageId);
        LOGGER.fine("写入页面 " + page.getKey() + " 版本 " + version);
    }

    @Override
    public void flushPage(String arrayId, Page page, String leaseId) throws DSMException {
        int pageId = page.getKey().getPageId();
        long newVersion = page.getVersion() + 1;

        String owner = resolveOwner(arrayId, pageId);
        if (owner == null) {
            // 所有者已失效被清除，由本节点接管
            owner = claimOwnership(arrayId, pageId);
        }

        if (owner.equals(localNodeId)) {
            Page local = getLocalPage(arrayId, pageId, newVersion);
            if (local != page) {
                local.load(page.snapshot(), newVersion);
            }
        } else {
            messenger.request(owner,
                    Message.createPagePush(arrayId, pageId, newVersion, page.snapshot(), leaseId), MessageType.ACK);
        }
        page.setVersion(newVersion);
        page.setDirty(false);
        LOGGER.fine("刷新页面 " + page.getKey() + " 到节点 " + owner + "，版本 " + newVersion);
    }

    @Override
    public int getLocalPageCount() {
        return localPages.size();
    }

    // ---- 所有权 ----

    @Override
    public String resolveOwner(String arrayId, int pageId) throws DSMException {
        SharedArray array = getArray(arrayId);
        array.checkPage(pageId);
        String owner = array.getPageOwner(pageId);
        if (owner != null || array.isHomedAt(localNodeId)) {
            return owner;
        }
        Message info = messenger.request(array.getHomeNodeId(),
                Message.createOwnerLookup(arrayId, pageId), MessageType.OWNER_INFO);
        if (info.getNodeId() != null) {
            array.setPageOwner(pageId, info.getNodeId());
        }
        return info.getNodeId();
    }

    @Override
    public String claimOwnership(String arrayId, int pageId) throws DSMException {
        SharedArray array = getArray(arrayId);
        String owner;
        if (array.isHomedAt(localNodeId)) {
            owner = assignOwner(arrayId, pageId, localNodeId);
        } else {
            Message info = messenger.request(array.getHomeNodeId(),
                    Message.createOwnerClaim(arrayId, pageId, localNodeId), MessageType.OWNER_INFO);
            owner = info.getNodeId();
            array.setPageOwner(pageId, owner);
        }
        if (localNodeId.equals(owner)) {
            getLocalPage(arrayId, pageId, array.getVersion());
        }
        return owner;
    }

    @Override
    public String lookupOwner(String arrayId, int pageId) throws DSMException {
        SharedArray array = homedArray(arrayId);
        array.checkPage(pageId);
        return array.getPageOwner(pageId);
    }

    @Override
    public String assignOwner(String arrayId, int pageId, String nodeId) throws DSMException {
        SharedArray array = homedArray(arrayId);
        array.checkPage(pageId);
        String owner = array.claimPageOwner(pageId, nodeId);
        if (owner.equals(nodeId)) {
            LOGGER.fine("页面 " + arrayId + ":" + pageId + " 的所有者为 " + owner);
        }
        return owner;
    }

    /**
     * 只有归属节点才能回答所有权和租约请求
     */
    private SharedArray homedArray(String arrayId) throws DSMException {
        SharedArray array = getArray(arrayId);
        if (!array.isHomedAt(localNodeId)) {
            throw new DSMException(ErrorType.NOT_FOUND,
                    "本节点不是数组的归属节点，归属节点为 " + array.getHomeNodeId(), arrayId, DSMException.NO_PAGE, null);
        }
        return array;
    }

    // ---- 租约 ----

    @Override
    public Lease acquireLease(String arrayId, int pageId, LeaseType type) throws DSMException {
        SharedArray array = getArray(arrayId);
        array.checkPage(pageId);
        String leaseId = UUID.randomUUID().toString();
        // 每次读取使用独立的读者身份，同一节点上的并发读各自持有读租约
        String holder = type == LeaseType.READ ? localNodeId + Lease.HOLDER_SEPARATOR + leaseId : localNodeId;

        if (array.isHomedAt(localNodeId)) {
            return grantLease(leaseId, arrayId, pageId, type, holder, array.getVersion());
        }

        Message grant;
        try {
            grant = messenger.request(array.getHomeNodeId(),
                    Message.createLeaseAcquire(leaseId, arrayId, pageId, type, holder, array.getVersion()),
                    MessageType.LEASE_GRANT);
        } catch (DSMException e) {
            if (e.getErrorType() == ErrorType.TIMEOUT || e.getErrorType() == ErrorType.CANCELLED) {
                abandonLease(array.getHomeNodeId(), leaseId, e);
            }
            throw e;
        }

        if (grant.getNodeId() != null) {
            array.setPageOwner(pageId, grant.getNodeId());
        }
        return grant.toLease();
    }

    /**
     * 申请超时或被取消后，归属节点可能已经签发了租约，按申请时的ID尽力释放
     */
    private void abandonLease(String homeNodeId, String leaseId, DSMException cause) {
        // 暂时清除中断标志，否则释放请求会立即失败
        boolean interrupted = Thread.interrupted();
        try {
            messenger.request(homeNodeId, Message.createLeaseRelease(leaseId));
        } catch (DSMException e) {
            if (e.getErrorType() != ErrorType.NOT_FOUND) {
                cause.addSuppressed(e);
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void releaseLease(Lease lease) throws DSMException {
        SharedArray array = arrays.get(lease.getArrayId());
        if (array == null || array.isHomedAt(localNodeId)) {
            leaseManager.releaseLease(lease.getLeaseId());
            return;
        }
        messenger.request(array.getHomeNodeId(), Message.createLeaseRelease(lease.getLeaseId()), MessageType.ACK);
    }

    @Override
    public Lease grantLease(String leaseId, String arrayId, int pageId, LeaseType type, String owner, long version)
            throws DSMException {
        SharedArray array = homedArray(arrayId);
        array.checkPage(pageId);
        Lease lease = leaseManager.acquireLease(leaseId, arrayId, pageId, type, owner, version);
        if (type == LeaseType.WRITE) {
            array.claimPageOwner(pageId, owner);
        }
        return lease;
    }

    // ---- 同步 ----

    @Override
    public void invalidate(String arrayId, Collection<Integer> pageIds) {
        int[] ids = pageIds.stream().mapToInt(Integer::intValue).toArray();
        invalidateLocal(arrayId, ids);
        int acked = messenger.broadcast(Message.createInvalidate(arrayId, ids));
        LOGGER.fine("数组 " + arrayId + " 失效 " + ids.length + " 个页面，" + acked + " 个节点确认");
    }

    @Override
    public int invalidateLocal(String arrayId, int[] pageIds) {
        int removed = 0;
        for (int pageId : pageIds) {
            if (pageCache.remove(arrayId, pageId)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public long bumpVersion(String arrayId) throws DSMException {
        SharedArray array = getArray(arrayId);
        if (array.isHomedAt(localNodeId)) {
            return advanceArrayVersion(arrayId, localNodeId);
        }
        Message reply = messenger.request(array.getHomeNodeId(),
                Message.createArraySync(arrayId), MessageType.ARRAY_VERSION);
        array.advanceVersion(reply.getVersion());
        return reply.getVersion();
    }

    @Override
    public long advanceArrayVersion(String arrayId, String requester) throws DSMException {
        SharedArray array = homedArray(arrayId);
        long version = array.incrementVersion();
        messenger.broadcastExcept(Message.createArrayVersion(arrayId, version), requester);
        LOGGER.fine("数组 " + arrayId + " 版本更新为 " + version);
        return version;
    }

    @Override
    public void applyArrayVersion(String arrayId, long version) {
        SharedArray array = arrays.get(arrayId);
        if (array != null) {
            array.advanceVersion(version);
        }
    }

    // ---- 故障处理 ----

    @Override
    public void handleNodeFailure(String nodeId) {
        int revoked = leaseManager.revokeLeasesHeldBy(nodeId);
        int cleared = 0;
        for (SharedArray array : arrays.values()) {
            List<Integer> lost = array.clearOwner(nodeId);
            if (!lost.isEmpty()) {
                String arrayId = array.getId();
                pageCache.removeIf(key -> key.getArrayId().equals(arrayId) && lost.contains(key.getPageId()));
                cleared += lost.size();
            }
            if (array.isHomedAt(nodeId)) {
                LOGGER.warning("数组 " + array.getId() + " 的归属节点 " + nodeId + " 已失效");
            }
        }
        LOGGER.info("节点 " + nodeId + " 失效：撤销 " + revoked + " 个租约，清除 " + cleared + " 个页面所有权");
    }
}
