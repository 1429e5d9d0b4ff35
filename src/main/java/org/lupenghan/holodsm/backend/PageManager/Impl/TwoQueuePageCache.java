package org.lupenghan.holodsm.backend.PageManager.Impl;

import org.lupenghan.holodsm.backend.PageManager.Dataform.PageKey;
import org.lupenghan.holodsm.backend.PageManager.Page;
import org.lupenghan.holodsm.backend.PageManager.PageCache;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * 2Q页面缓存
 * once队列保存只访问过一次的页面，frequent队列保存被再次访问的页面。
 * 淘汰时先淘汰once队列中最久未访问的页面，once队列为空时才淘汰frequent队列
 */
public class TwoQueuePageCache implements PageCache {
    private static final Logger LOGGER = Logger.getLogger(TwoQueuePageCache.class.getName());

    private final int capacity;
    // LinkedHashMap按插入顺序迭代：头部是最久未访问的，尾部是最近访问的
    private final LinkedHashMap<PageKey, CacheEntry> onceQueue;
    private final LinkedHashMap<PageKey, CacheEntry> frequentQueue;
    private final Map<PageKey, CacheEntry> index;   // 页面标识到缓存条目的索引
    private final ReadWriteLock lock;

    /**
     * 创建指定容量的缓存
     * @param capacity 最多缓存的页面数量
     */
    public TwoQueuePageCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("缓存容量必须大于0: " + capacity);
        }
        this.capacity = capacity;
        this.onceQueue = new LinkedHashMap<>();
        this.frequentQueue = new LinkedHashMap<>();
        this.index = new HashMap<>();
        this.lock = new ReentrantReadWriteLock();
    }

    @Override
    public Page get(String arrayId, int pageId) {
        PageKey key = new PageKey(arrayId, pageId);
        // 命中会调整队列顺序，需要写锁
        lock.writeLock().lock();
        try {
            CacheEntry entry = index.get(key);
            if (entry == null) {
                return null;
            }
            touch(entry);
            return entry.page;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void put(String arrayId, int pageId, Page page) {
        PageKey key = new PageKey(arrayId, pageId);
        lock.writeLock().lock();
        try {
            CacheEntry entry = index.get(key);
            if (entry != null) {
                entry.page = page;
                touch(entry);
                return;
            }

            entry = new CacheEntry(key, page);
            onceQueue.put(key, entry);
            index.put(key, entry);

            while (index.size() > capacity) {
                evict();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean remove(String arrayId, int pageId) {
        PageKey key = new PageKey(arrayId, pageId);
        lock.writeLock().lock();
        try {
            CacheEntry entry = index.remove(key);
            if (entry == null) {
                return false;
            }
            queueOf(entry).remove(key);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int removeIf(Predicate<PageKey> filter) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            Iterator<Map.Entry<PageKey, CacheEntry>> it = index.entrySet().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next().getValue();
                if (filter.test(entry.key)) {
                    queueOf(entry).remove(entry.key);
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean contains(String arrayId, int pageId) {
        lock.readLock().lock();
        try {
            return index.containsKey(new PageKey(arrayId, pageId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return index.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    /**
     * 第二次访问把页面从once队列提升到frequent队列，已在frequent队列的移到最近位置
     */
    private void touch(CacheEntry entry) {
        if (!entry.frequent) {
            onceQueue.remove(entry.key);
            entry.frequent = true;
        } else {
            frequentQueue.remove(entry.key);
        }
        frequentQueue.put(entry.key, entry);
    }

    /**
     * 淘汰一个页面
     */
    private void evict() {
        LinkedHashMap<PageKey, CacheEntry> victimQueue = onceQueue.isEmpty() ? frequentQueue : onceQueue;
        Iterator<CacheEntry> it = victimQueue.values().iterator();
        if (!it.hasNext()) {
            return;
        }
        CacheEntry victim = it.next();
        it.remove();
        index.remove(victim.key);
        LOGGER.fine("淘汰缓存页面: " + victim.key + (victim.frequent ? " (frequent)" : " (once)"));
    }

    private LinkedHashMap<PageKey, CacheEntry> queueOf(CacheEntry entry) {
        return entry.frequent ? frequentQueue : onceQueue;
    }

    /**
     * 缓存条目，不持有任何租约状态
     */
    private static class CacheEntry {
        final PageKey key;
        Page page;
        boolean frequent;   // 是否已被再次访问

        CacheEntry(PageKey key, Page page) {
            this.key = key;
            this.page = page;
            this.frequent = false;
        }
    }
}
