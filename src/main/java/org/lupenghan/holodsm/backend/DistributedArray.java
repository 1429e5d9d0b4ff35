package org.lupenghan.holodsm.backend;

import lombok.Getter;
import org.lupenghan.holodsm.backend.MemoryManager.Dataform.SharedArray;
import org.lupenghan.holodsm.backend.PageManager.Dataform.ElementType;
import org.lupenghan.holodsm.backend.PageManager.Page;
import org.lupenghan.holodsm.backend.SyncManager.Dataform.SyncState;
import org.lupenghan.holodsm.backend.SyncManager.SyncManager;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

/**
 * 分布式数组句柄
 * 单次读写不保证看到其他节点的并发写入，写入方同步之后的读取才能看到
 */
public class DistributedArray implements AutoCloseable {

    @Getter
    private final SharedArray array;
    private final SyncManager syncManager;

    // 切片在底层数组中的起始下标和长度
    private final long offset;
    private final long length;

    DistributedArray(SharedArray array, SyncManager syncManager) {
        this(array, syncManager, 0, array.getLength());
    }

    private DistributedArray(SharedArray array, SyncManager syncManager, long offset, long length) {
        this.array = array;
        this.syncManager = syncManager;
        this.offset = offset;
        this.length = length;
    }

    public String getId() {
        return array.getId();
    }

    public long length() {
        return length;
    }

    public ElementType getElementType() {
        return array.getElementType();
    }

    public long getVersion() {
        return array.getVersion();
    }

    public SyncState getSyncState() {
        return syncManager.getState(array.getId());
    }

    /**
     * 读取64位整数元素
     * @param index 元素下标
     * @return 元素值
     * @throws DSMException 下标越界时抛出OUT_OF_BOUNDS
     */
    public long getLong(long index) throws DSMException {
        requireType(ElementType.INT64);
        long element = toElement(index);
        int slot = array.indexInPage(element);
        return syncManager.read(array.getId(), array.pageOf(element), page -> page.getLong(slot));
    }

    /**
     * 写入64位整数元素，同步后对其他节点可见
     * @param index 元素下标
     * @param value 元素值
     * @throws DSMException 写租约冲突时抛出CONFLICT
     */
    public void setLong(long index, long value) throws DSMException {
        requireType(ElementType.INT64);
        long element = toElement(index);
        Page page = syncManager.acquireForWrite(array.getId(), array.pageOf(element));
        page.setLong(array.indexInPage(element), value);
    }

    public float getFloat(long index) throws DSMException {
        requireType(ElementType.FLOAT32);
        long element = toElement(index);
        int slot = array.indexInPage(element);
        return syncManager.read(array.getId(), array.pageOf(element), page -> page.getFloat(slot));
    }

    public void setFloat(long index, float value) throws DSMException {
        requireType(ElementType.FLOAT32);
        long element = toElement(index);
        Page page = syncManager.acquireForWrite(array.getId(), array.pageOf(element));
        page.setFloat(array.indexInPage(element), value);
    }

    /**
     * 创建切片视图，与原数组共享页面
     * @param begin 起始下标（包含）
     * @param end 结束下标（不包含）
     * @return 下标从0开始的切片
     */
    public DistributedArray slice(long begin, long end) {
        if (begin < 0 || end > length || begin > end) {
            throw new IllegalArgumentException("非法切片范围 [" + begin + ", " + end + ")，长度 " + length);
        }
        return new DistributedArray(array, syncManager, offset + begin, end - begin);
    }

    /**
     * 同步屏障，刷新本节点的写入并使其他节点的缓存失效
     */
    public void sync() throws DSMException {
        syncManager.sync(array.getId());
    }

    /**
     * 释放本节点在该数组上的租约和缓存页面，未同步的写入被丢弃
     */
    @Override
    public void close() throws DSMException {
        syncManager.close(array.getId());
    }

    private long toElement(long index) throws DSMException {
        if (index < 0 || index >= length) {
            throw new DSMException(ErrorType.OUT_OF_BOUNDS,
                    "下标越界: " + index + "，长度 " + length, array.getId(), DSMException.NO_PAGE, null);
        }
        return offset + index;
    }

    private void requireType(ElementType expected) {
        if (array.getElementType() != expected) {
            throw new IllegalArgumentException("数组元素类型为 " + array.getElementType() + "，不是 " + expected);
        }
    }

    @Override
    public String toString() {
        return "DistributedArray{id=" + array.getId() + ", offset=" + offset + ", length=" + length + "}";
    }
}
