package org.lupenghan.holodsm.backend.SyncManager;

import lombok.Getter;
import org.lupenghan.holodsm.backend.LeaseManager.Dataform.Lease;
import org.lupenghan.holodsm.backend.PageManager.Page;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 本节点在一个数组上持有的写租约及其工作副本
 * 工作副本不在页面缓存中，不会被淘汰
 * 获取写租约时持有屏障读锁和页面锁，不同页面互不阻塞；同步持有屏障写锁
 */
public class WriteSet {

    @Getter
    public static class Entry {
        private final Lease lease;
        private final Page page;

        Entry(Lease lease, Page page) {
            this.lease = lease;
            this.page = page;
        }

        public int getPageId() {
            return page.getKey().getPageId();
        }
    }

    @Getter
    private final String arrayId;

    // 页号 -> 写租约和工作副本
    private final Map<Integer, Entry> entries;

    // 同步屏障锁
    @Getter
    private final ReadWriteLock barrier;

    // 页号 -> 页面锁
    private final Map<Integer, Object> pageLocks;

    public WriteSet(String arrayId) {
        this.arrayId = arrayId;
        this.entries = new LinkedHashMap<>();
        this.barrier = new ReentrantReadWriteLock();
        this.pageLocks = new ConcurrentHashMap<>();
    }

    /**
     * 同一页面的写租约获取互斥
     * @param pageId 页号
     * @return 页面锁
     */
    public Object pageLock(int pageId) {
        return pageLocks.computeIfAbsent(pageId, id -> new Object());
    }

    public synchronized Entry get(int pageId) {
        return entries.get(pageId);
    }

    public synchronized void put(Lease lease, Page page) {
        entries.put(page.getKey().getPageId(), new Entry(lease, page));
    }

    public synchronized Entry remove(int pageId) {
        return entries.remove(pageId);
    }

    /**
     * 取出全部条目并清空
     * @return 按加入顺序排列的条目
     */
    public synchronized List<Entry> drain() {
        List<Entry> drained = new ArrayList<>(entries.values());
        entries.clear();
        return drained;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }
}
