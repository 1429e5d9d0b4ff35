package org.lupenghan.holodsm.backend.MemoryManager.Dataform;

import lombok.Getter;
import org.lupenghan.holodsm.backend.PageManager.Dataform.ElementType;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 共享数组描述符
 * 数组由若干定长页面组成，维护页号到所有者节点的映射和数组版本。
 * 每个页号要么没有所有者，要么同一时刻只属于一个节点
 */
public class SharedArray {
    // 新数组的初始版本
    public static final long INITIAL_VERSION = 1;

    @Getter
    private final String id;            // 数组ID
    @Getter
    private final long length;          // 元素个数
    @Getter
    private final ElementType elementType;
    @Getter
    private final int pageSize;         // 页面大小（字节）
    @Getter
    private final int numPages;         // 页面数量
    @Getter
    private final String homeNodeId;    // 归属节点：持有权威的所有权映射、版本和租约表

    private final Map<Integer, String> pageOwners;  // 页号 -> 所有者节点
    private long version;
    private final ReadWriteLock lock;

    public SharedArray(String id, long length, ElementType elementType, int pageSize, String homeNodeId) {
        this(id, length, elementType, pageSize, homeNodeId, INITIAL_VERSION);
    }

    public SharedArray(String id, long length, ElementType elementType, int pageSize, String homeNodeId,
                       long version) {
        if (length < 0) {
            throw new IllegalArgumentException("数组长度不能为负数: " + length);
        }
        if (pageSize <= 0 || pageSize % elementType.getSize() != 0) {
            throw new IllegalArgumentException("页面大小必须是元素大小的正整数倍: " + pageSize);
        }
        this.id = id;
        this.length = length;
        this.elementType = elementType;
        this.pageSize = pageSize;
        this.numPages = computePageCount(length, elementType.getSize(), pageSize);
        this.homeNodeId = homeNodeId;
        this.pageOwners = new HashMap<>();
        this.version = version;
        this.lock = new ReentrantReadWriteLock();
    }

    /**
     * 计算页面数量：总字节数除以页面大小，向上取整
     * @param length 元素个数
     * @param elementSize 元素字节数
     * @param pageSize 页面字节数
     * @return 页面数量
     */
    public static int computePageCount(long length, int elementSize, int pageSize) {
        long bytes = length * elementSize;
        long pages = (bytes + pageSize - 1) / pageSize;
        if (pages > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("数组过大: " + length + " 个元素");
        }
        return (int) pages;
    }

    /**
     * 元素所在的页号
     */
    public int pageOf(long elementIndex) {
        return (int) (elementIndex * elementType.getSize() / pageSize);
    }

    /**
     * 元素在页内的下标
     */
    public int indexInPage(long elementIndex) {
        return (int) ((elementIndex * elementType.getSize()) % pageSize / elementType.getSize());
    }

    /**
     * 每页可容纳的元素个数
     */
    public int elementsPerPage() {
        return pageSize / elementType.getSize();
    }

    /**
     * 检查页号范围
     * @param pageId 页号
     * @throws DSMException 页号不在 [0, numPages) 内时抛出OUT_OF_BOUNDS
     */
    public void checkPage(int pageId) throws DSMException {
        if (pageId < 0 || pageId >= numPages) {
            throw new DSMException(ErrorType.OUT_OF_BOUNDS,
                    "页号越界: " + pageId + "，数组共 " + numPages + " 页", id, pageId, null);
        }
    }

    public boolean isHomedAt(String nodeId) {
        return homeNodeId.equals(nodeId);
    }

    public long getVersion() {
        lock.readLock().lock();
        try {
            return version;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 版本加一，仅在一次同步完成时调用
     * @return 新版本
     */
    public long incrementVersion() {
        lock.writeLock().lock();
        try {
            return ++version;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 采用归属节点通知的版本，版本只增不减
     */
    public void advanceVersion(long newVersion) {
        lock.writeLock().lock();
        try {
            if (newVersion > version) {
                version = newVersion;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 获取页面所有者
     * @param pageId 页号
     * @return 所有者节点ID，未分配时返回null
     */
    public String getPageOwner(int pageId) {
        lock.readLock().lock();
        try {
            return pageOwners.get(pageId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 记录页面所有者
     */
    public void setPageOwner(int pageId, String nodeId) {
        lock.writeLock().lock();
        try {
            pageOwners.put(pageId, nodeId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 页面未分配所有者时分配给指定节点
     * @param pageId 页号
     * @param nodeId 申请的节点
     * @return 实际的所有者
     */
    public String claimPageOwner(int pageId, String nodeId) {
        lock.writeLock().lock();
        try {
            String current = pageOwners.putIfAbsent(pageId, nodeId);
            return current == null ? nodeId : current;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 清除指向某节点的所有权记录
     * @param nodeId 失效节点
     * @return 被清除的页号
     */
    public List<Integer> clearOwner(String nodeId) {
        lock.writeLock().lock();
        try {
            List<Integer> cleared = new ArrayList<>();
            Iterator<Map.Entry<Integer, String>> it = pageOwners.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Integer, String> entry = it.next();
                if (entry.getValue().equals(nodeId)) {
                    cleared.add(entry.getKey());
                    it.remove();
                }
            }
            return cleared;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 已分配所有者的页面数量
     */
    public int getOwnedPageCount() {
        lock.readLock().lock();
        try {
            return pageOwners.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "SharedArray{id=" + id + ", length=" + length + ", elementType=" + elementType
                + ", numPages=" + numPages + ", home=" + homeNodeId + ", version=" + getVersion() + "}";
    }
}
