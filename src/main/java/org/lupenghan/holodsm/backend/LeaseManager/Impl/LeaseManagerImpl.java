package org.lupenghan.holodsm.backend.LeaseManager.Impl;

import org.lupenghan.holodsm.backend.LeaseManager.Dataform.Lease;
import org.lupenghan.holodsm.backend.LeaseManager.Dataform.LeaseType;
import org.lupenghan.holodsm.backend.LeaseManager.LeaseManager;
import org.lupenghan.holodsm.backend.PageManager.Dataform.PageKey;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * 租约管理器实现
 * 冲突矩阵本身就是全部的一致性约束：同一页面最多一个写租约，读写租约不共存
 */
public class LeaseManagerImpl implements LeaseManager {
    private static final Logger LOGGER = Logger.getLogger(LeaseManagerImpl.class.getName());

    // 租约表：页面 -> (租约ID -> 租约)
    private final Map<PageKey, Map<String, Lease>> leaseTable;

    // 租约ID索引
    private final Map<String, Lease> leasesById;

    // 租约有效期（毫秒）
    private final long ttlMillis;

    private final Clock clock;

    // 租约表的读写锁
    private final ReadWriteLock lock;

    /**
     * 创建租约管理器
     * @param ttlMillis 租约有效期（毫秒）
     */
    public LeaseManagerImpl(long ttlMillis) {
        this(ttlMillis, Clock.systemUTC());
    }

    /**
     * 创建租约管理器
     * @param ttlMillis 租约有效期（毫秒）
     * @param clock 时钟
     */
    public LeaseManagerImpl(long ttlMillis, Clock clock) {
        if (ttlMillis <= 0) {
            throw new IllegalArgumentException("租约有效期必须大于0: " + ttlMillis);
        }
        this.leaseTable = new HashMap<>();
        this.leasesById = new HashMap<>();
        this.ttlMillis = ttlMillis;
        this.clock = clock;
        this.lock = new ReentrantReadWriteLock();
    }

    @Override
    public Lease acquireLease(String arrayId, int pageId, LeaseType type, String owner, long version)
            throws DSMException {
        return acquireLease(UUID.randomUUID().toString(), arrayId, pageId, type, owner, version);
    }

    @Override
    public Lease acquireLease(String leaseId, String arrayId, int pageId, LeaseType type, String owner, long version)
            throws DSMException {
        PageKey key = new PageKey(arrayId, pageId);
        lock.writeLock().lock();
        try {
            long now = clock.millis();

            // 同一ID的重复申请（例如超时重试）直接返回已有租约
            Lease existing = leasesById.get(leaseId);
            if (existing != null) {
                if (existing.isExpired(now)) {
                    leasesById.remove(leaseId);
                    detach(existing);
                } else {
                    if (!key.equals(new PageKey(existing.getArrayId(), existing.getPageId()))
                            || existing.getType() != type || !existing.getOwner().equals(owner)) {
                        throw new DSMException(ErrorType.CONFLICT, "租约ID已被占用", arrayId, pageId, leaseId);
                    }
                    return existing;
                }
            }

            Map<String, Lease> holders = leaseTable.get(key);
            if (holders != null) {
                // 过期租约在逻辑上已失效，先清除
                purgeExpired(key, holders, now);

                for (Lease held : holders.values()) {
                    if (held.getType() == LeaseType.WRITE) {
                        throw new DSMException(ErrorType.CONFLICT,
                                "页面上已有写租约，持有者 " + held.getOwner(), arrayId, pageId, held.getLeaseId());
                    }
                }

                if (type == LeaseType.WRITE && !holders.isEmpty()) {
                    throw new DSMException(ErrorType.CONFLICT,
                            "页面上已有 " + holders.size() + " 个读租约，无法获取写租约", arrayId, pageId, null);
                }

                // 同一持有者续期已有的读租约
                for (Lease held : holders.values()) {
                    if (held.getOwner().equals(owner)) {
                        held.refresh(now + ttlMillis);
                        LOGGER.fine("续期读租约: " + held);
                        return held;
                    }
                }
            }

            Lease lease = new Lease(leaseId, arrayId, pageId, type, owner, version, now + ttlMillis);
            leaseTable.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(leaseId, lease);
            leasesById.put(leaseId, lease);
            LOGGER.fine("签发租约: " + lease);
            return lease;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void releaseLease(String leaseId) throws DSMException {
        lock.writeLock().lock();
        try {
            Lease lease = leasesById.remove(leaseId);
            if (lease == null) {
                throw new DSMException(ErrorType.NOT_FOUND, "租约不存在", null, DSMException.NO_PAGE, leaseId);
            }
            detach(lease);
            LOGGER.fine("释放租约: " + lease);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Lease validateLease(String leaseId) throws DSMException {
        lock.readLock().lock();
        try {
            Lease lease = leasesById.get(leaseId);
            if (lease == null) {
                throw new DSMException(ErrorType.NOT_FOUND, "租约不存在", null, DSMException.NO_PAGE, leaseId);
            }
            if (lease.isExpired(clock.millis())) {
                throw new DSMException(ErrorType.EXPIRED, "租约已过期",
                        lease.getArrayId(), lease.getPageId(), leaseId);
            }
            return lease;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean hasWriteLease(String arrayId, int pageId) {
        lock.readLock().lock();
        try {
            Map<String, Lease> holders = leaseTable.get(new PageKey(arrayId, pageId));
            if (holders == null) {
                return false;
            }
            long now = clock.millis();
            for (Lease lease : holders.values()) {
                if (lease.getType() == LeaseType.WRITE && !lease.isExpired(now)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void revokeLease(String arrayId, int pageId) {
        lock.writeLock().lock();
        try {
            Map<String, Lease> holders = leaseTable.remove(new PageKey(arrayId, pageId));
            if (holders == null) {
                return;
            }
            for (Lease lease : holders.values()) {
                leasesById.remove(lease.getLeaseId());
                LOGGER.fine("撤销租约: " + lease);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int revokeLeasesHeldBy(String owner) {
        int revoked = removeWhere(lease -> lease.isHeldBy(owner));
        if (revoked > 0) {
            LOGGER.info("撤销持有者 " + owner + " 的 " + revoked + " 个租约");
        }
        return revoked;
    }

    @Override
    public int revokeLeases(String arrayId) {
        return removeWhere(lease -> lease.getArrayId().equals(arrayId));
    }

    @Override
    public int cleanupExpiredLeases() {
        long now = clock.millis();
        int removed = removeWhere(lease -> lease.isExpired(now));
        if (removed > 0) {
            LOGGER.fine("清理过期租约 " + removed + " 个");
        }
        return removed;
    }

    @Override
    public List<Lease> getLeases(String arrayId, int pageId) {
        lock.readLock().lock();
        try {
            Map<String, Lease> holders = leaseTable.get(new PageKey(arrayId, pageId));
            return holders == null ? new ArrayList<>() : new ArrayList<>(holders.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int getLeaseCount() {
        lock.readLock().lock();
        try {
            return leasesById.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 删除满足条件的租约
     */
    private int removeWhere(Predicate<Lease> condition) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            Iterator<Lease> it = leasesById.values().iterator();
            while (it.hasNext()) {
                Lease lease = it.next();
                if (condition.test(lease)) {
                    it.remove();
                    detach(lease);
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 从页面的租约集合中摘除租约，调用方持有写锁
     */
    private void detach(Lease lease) {
        PageKey key = new PageKey(lease.getArrayId(), lease.getPageId());
        Map<String, Lease> holders = leaseTable.get(key);
        if (holders != null) {
            holders.remove(lease.getLeaseId());
            if (holders.isEmpty()) {
                leaseTable.remove(key);
            }
        }
    }

    private void purgeExpired(PageKey key, Map<String, Lease> holders, long now) {
        Iterator<Lease> it = holders.values().iterator();
        while (it.hasNext()) {
            Lease lease = it.next();
            if (lease.isExpired(now)) {
                it.remove();
                leasesById.remove(lease.getLeaseId());
                LOGGER.fine("丢弃过期租约: " + lease);
            }
        }
        if (holders.isEmpty()) {
            leaseTable.remove(key);
        }
    }
}
