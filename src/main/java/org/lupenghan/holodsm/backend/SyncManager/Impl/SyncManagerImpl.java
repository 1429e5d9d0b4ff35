package org.lupenghan.holodsm.backend.SyncManager.Impl;

import org.lupenghan.holodsm.backend.LeaseManager.Dataform.Lease;
import org.lupenghan.holodsm.backend.LeaseManager.Dataform.LeaseType;
import org.lupenghan.holodsm.backend.MemoryManager.Dataform.SharedArray;
import org.lupenghan.holodsm.backend.MemoryManager.MemoryManager;
import org.lupenghan.holodsm.backend.PageManager.Page;
import org.lupenghan.holodsm.backend.SyncManager.Dataform.SyncState;
import org.lupenghan.holodsm.backend.SyncManager.SyncManager;
import org.lupenghan.holodsm.backend.SyncManager.WriteSet;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * 同步管理器实现
 * 同步与写租约获取互斥；不同页面的写租约获取可以并发，同一页面串行
 */
public class SyncManagerImpl implements SyncManager {
    private static final Logger LOGGER = Logger.getLogger(SyncManagerImpl.class.getName());

    private final MemoryManager memoryManager;
    private final Clock clock;

    private final Map<String, WriteSet> writeSets;
    private final Map<String, SyncState> states;

    public SyncManagerImpl(MemoryManager memoryManager, Clock clock) {
        this.memoryManager = memoryManager;
        this.clock = clock;
        this.writeSets = new ConcurrentHashMap<>();
        this.states = new ConcurrentHashMap<>();
    }

    private WriteSet writeSet(String arrayId) {
        return writeSets.computeIfAbsent(arrayId, WriteSet::new);
    }

    @Override
    public <T> T read(String arrayId, int pageId, PageReader<T> reader) throws DSMException {
        Page working = workingCopy(arrayId, pageId);
        if (working != null) {
            return reader.read(working);
        }

        SharedArray array = memoryManager.getArray(arrayId);
        Lease lease = memoryManager.acquireLease(arrayId, pageId, LeaseType.READ);
        T result;
        try {
            if (memoryManager.resolveOwner(arrayId, pageId) == null) {
                memoryManager.claimOwnership(arrayId, pageId);
            }
            Page page = memoryManager.requestPage(arrayId, pageId, array.getVersion());
            result = reader.read(page);
        } catch (DSMException e) {
            releaseAfterFailure(lease, e);
            throw e;
        }
        try {
            memoryManager.releaseLease(lease);
        } catch (DSMException e) {
            // 读租约已被撤销或过期清理
            if (e.getErrorType() != ErrorType.NOT_FOUND) {
                throw e;
            }
        }
        return result;
    }

    @Override
    public Page acquireForWrite(String arrayId, int pageId) throws DSMException {
        WriteSet writeSet = writeSet(arrayId);
        writeSet.getBarrier().readLock().lock();
        try {
            synchronized (writeSet.pageLock(pageId)) {
                return acquireHeld(writeSet, arrayId, pageId);
            }
        } finally {
            writeSet.getBarrier().readLock().unlock();
        }
    }

    /**
     * 调用方持有屏障读锁和页面锁
     */
    private Page acquireHeld(WriteSet writeSet, String arrayId, int pageId) throws DSMException {
        WriteSet.Entry held = writeSet.get(pageId);
        if (held != null) {
            if (!held.getLease().isExpired(clock.millis())) {
                return held.getPage();
            }
            writeSet.remove(pageId);
            DSMException expired = new DSMException(ErrorType.EXPIRED,
                    "写租约已过期，未同步的修改已丢弃", arrayId, pageId, held.getLease().getLeaseId());
            releaseAfterFailure(held.getLease(), expired);
            LOGGER.warning(expired.toString());
            throw expired;
        }

        SharedArray array = memoryManager.getArray(arrayId);
        Lease lease = memoryManager.acquireLease(arrayId, pageId, LeaseType.WRITE);
        Page page;
        try {
            // 写入只落在副本上，同步时才刷新到所有者
            String owner = memoryManager.resolveOwner(arrayId, pageId);
            if (memoryManager.getLocalNodeId().equals(owner)) {
                page = memoryManager.getLocalPage(arrayId, pageId, array.getVersion()).copy();
            } else {
                // 缓存副本可能早于上一个写者的刷新，从所有者重新获取
                memoryManager.getPageCache().remove(arrayId, pageId);
                page = memoryManager.requestPage(arrayId, pageId, array.getVersion()).copy();
            }
        } catch (DSMException e) {
            releaseAfterFailure(lease, e);
            throw e;
        }
        writeSet.put(lease, page);
        states.put(arrayId, SyncState.ACTIVE);
        LOGGER.fine("获得写租约 " + lease.getLeaseId() + "，页面 " + arrayId + ":" + pageId);
        return page;
    }

    @Override
    public Page workingCopy(String arrayId, int pageId) {
        WriteSet writeSet = writeSets.get(arrayId);
        if (writeSet == null) {
            return null;
        }
        WriteSet.Entry held = writeSet.get(pageId);
        if (held == null || held.getLease().isExpired(clock.millis())) {
            return null;
        }
        return held.getPage();
    }

    @Override
    public void sync(String arrayId) throws DSMException {
        memoryManager.getArray(arrayId);
        WriteSet writeSet = writeSet(arrayId);
        writeSet.getBarrier().writeLock().lock();
        try {
            states.put(arrayId, SyncState.FLUSHING);
            List<WriteSet.Entry> entries = writeSet.drain();
            Set<Integer> touched = new LinkedHashSet<>();
            DSMException expired = null;
            DSMException failure = null;

            // 1. 刷新脏页
            long now = clock.millis();
            for (WriteSet.Entry entry : entries) {
                touched.add(entry.getPageId());
                if (!entry.getPage().isDirty()) {
                    continue;
                }
                if (entry.getLease().isExpired(now)) {
                    DSMException e = new DSMException(ErrorType.EXPIRED, "写租约在刷新前过期，丢弃脏页",
                            arrayId, entry.getPageId(), entry.getLease().getLeaseId());
                    LOGGER.warning(e.toString());
                    expired = chain(expired, e);
                    continue;
                }
                try {
                    memoryManager.flushPage(arrayId, entry.getPage(), entry.getLease().getLeaseId());
                } catch (DSMException e) {
                    failure = chain(failure, e);
                    // 保留租约和工作副本，调用方可以重试同步
                    writeSet.put(entry.getLease(), entry.getPage());
                }
            }

            // 2. 释放已刷新页面的写租约
            for (WriteSet.Entry entry : entries) {
                if (writeSet.get(entry.getPageId()) != null) {
                    continue;
                }
                try {
                    memoryManager.releaseLease(entry.getLease());
                } catch (DSMException e) {
                    if (e.getErrorType() == ErrorType.NOT_FOUND || e.getErrorType() == ErrorType.EXPIRED) {
                        LOGGER.fine("写租约已不存在: " + entry.getLease().getLeaseId());
                    } else {
                        failure = chain(failure, e);
                    }
                }
            }

            // 3. 失效各节点缓存
            states.put(arrayId, SyncState.INVALIDATING);
            if (!touched.isEmpty()) {
                memoryManager.invalidate(arrayId, touched);
            }

            // 4. 递增版本，前面的步骤失败时同步未完成，版本不变
            if (failure == null) {
                try {
                    long version = memoryManager.bumpVersion(arrayId);
                    LOGGER.info("数组 " + arrayId + " 同步完成，页面 " + touched.size() + " 个，版本 " + version);
                } catch (DSMException e) {
                    failure = e;
                }
            } else {
                LOGGER.warning("数组 " + arrayId + " 同步未完成，保留 " + writeSet.size() + " 个写租约，版本不变");
            }

            states.put(arrayId, failure == null ? SyncState.SYNCED : SyncState.ACTIVE);
            if (failure != null) {
                throw failure;
            }
            if (expired != null) {
                throw expired;
            }
        } finally {
            writeSet.getBarrier().writeLock().unlock();
        }
    }

    @Override
    public void close(String arrayId) throws DSMException {
        WriteSet writeSet = writeSets.remove(arrayId);
        states.remove(arrayId);
        DSMException failure = null;
        if (writeSet != null) {
            List<WriteSet.Entry> entries;
            writeSet.getBarrier().writeLock().lock();
            try {
                entries = writeSet.drain();
            } finally {
                writeSet.getBarrier().writeLock().unlock();
            }
            for (WriteSet.Entry entry : entries) {
                if (entry.getPage().isDirty()) {
                    LOGGER.warning("关闭数组时丢弃未同步的页面 " + arrayId + ":" + entry.getPageId());
                }
                try {
                    memoryManager.releaseLease(entry.getLease());
                } catch (DSMException e) {
                    if (e.getErrorType() != ErrorType.NOT_FOUND) {
                        failure = chain(failure, e);
                    }
                }
            }
        }
        int dropped = memoryManager.getPageCache().removeIf(key -> key.getArrayId().equals(arrayId));
        LOGGER.fine("关闭数组 " + arrayId + "，丢弃缓存页面 " + dropped + " 个");
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void discard(String arrayId) {
        writeSets.remove(arrayId);
        states.remove(arrayId);
    }

    @Override
    public SyncState getState(String arrayId) {
        return states.getOrDefault(arrayId, SyncState.ACTIVE);
    }

    @Override
    public int getHeldWriteLeaseCount(String arrayId) {
        WriteSet writeSet = writeSets.get(arrayId);
        return writeSet == null ? 0 : writeSet.size();
    }

    /**
     * 失败路径上释放租约，释放失败附加到原异常上
     */
    private void releaseAfterFailure(Lease lease, DSMException cause) {
        try {
            memoryManager.releaseLease(lease);
        } catch (DSMException e) {
            if (e.getErrorType() != ErrorType.NOT_FOUND) {
                cause.addSuppressed(e);
            }
        }
    }

    private static DSMException chain(DSMException first, DSMException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }
}
