package org.lupenghan.holodsm.backend.PageManager.Impl;

import org.lupenghan.holodsm.backend.PageManager.Dataform.PageKey;
import org.lupenghan.holodsm.backend.PageManager.Page;
import org.lupenghan.holodsm.backend.PageManager.PageStorage;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 页面的具体实现类
 */
public class PageImpl implements Page {
    private final PageKey key;
    private final PageStorage storage;
    private final ReadWriteLock lock;   // 保护存储内容和元数据
    private long version;
    private boolean dirty;

    /**
     * 创建新的空页面
     * @param key 页面标识
     * @param pageSize 页面大小
     * @param version 初始版本
     */
    public PageImpl(PageKey key, int pageSize, long version) {
        this.key = key;
        this.storage = new PageStorage(pageSize);
        this.lock = new ReentrantReadWriteLock();
        this.version = version;
        this.dirty = false;
    }

    /**
     * 从现有镜像创建页面
     * @param key 页面标识
     * @param pageSize 页面大小
     * @param version 镜像版本
     * @param image 页面镜像
     * @throws DSMException 镜像大小不一致时抛出PROTOCOL
     */
    public PageImpl(PageKey key, int pageSize, long version, byte[] image) throws DSMException {
        this(key, pageSize, version);
        storage.load(image);
    }

    @Override
    public PageKey getKey() {
        return key;
    }

    @Override
    public long getVersion() {
        lock.readLock().lock();
        try {
            return version;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void setVersion(long version) {
        lock.writeLock().lock();
        try {
            this.version = version;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int getSize() {
        return storage.size();
    }

    @Override
    public long getLong(int elementIndex) throws DSMException {
        int offset = offsetOf(elementIndex, Long.BYTES);
        lock.readLock().lock();
        try {
            return storage.getLong(offset);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void setLong(int elementIndex, long value) throws DSMException {
        int offset = offsetOf(elementIndex, Long.BYTES);
        lock.writeLock().lock();
        try {
            storage.putLong(offset, value);
            dirty = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public float getFloat(int elementIndex) throws DSMException {
        int offset = offsetOf(elementIndex, Float.BYTES);
        lock.readLock().lock();
        try {
            return storage.getFloat(offset);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void setFloat(int elementIndex, float value) throws DSMException {
        int offset = offsetOf(elementIndex, Float.BYTES);
        lock.writeLock().lock();
        try {
            storage.putFloat(offset, value);
            dirty = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isDirty() {
        lock.readLock().lock();
        try {
            return dirty;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void setDirty(boolean dirty) {
        lock.writeLock().lock();
        try {
            this.dirty = dirty;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public byte[] snapshot() {
        lock.readLock().lock();
        try {
            return storage.toByteArray();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void load(byte[] image, long version) throws DSMException {
        lock.writeLock().lock();
        try {
            storage.load(image);
            this.version = version;
            this.dirty = false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Page copy() {
        lock.readLock().lock();
        try {
            PageImpl copy = new PageImpl(key, storage.size(), version);
            copy.storage.load(storage.toByteArray());
            copy.dirty = dirty;
            return copy;
        } catch (DSMException e) {
            // 同一页面大小的镜像不会不一致
            throw new IllegalStateException(e);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 元素下标换算为字节偏移
     */
    private int offsetOf(int elementIndex, int width) throws DSMException {
        long offset = (long) elementIndex * width;
        if (elementIndex < 0 || offset + width > storage.size()) {
            throw new DSMException(ErrorType.OUT_OF_BOUNDS,
                    "元素下标越界: " + elementIndex + " (宽度 " + width + ")",
                    key.getArrayId(), key.getPageId(), null);
        }
        return (int) offset;
    }

    @Override
    public String toString() {
        return "PageImpl{" + key + ", version=" + getVersion() + ", dirty=" + isDirty() + "}";
    }
}
