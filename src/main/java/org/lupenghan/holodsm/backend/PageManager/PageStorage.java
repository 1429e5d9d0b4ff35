package org.lupenghan.holodsm.backend.PageManager;

import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * 页面字节存储
 * 小端、定长编码，所有访问都做边界检查。本身不做并发控制，由所属页面独占
 */
public class PageStorage {
    private final byte[] data;
    private final ByteBuffer buffer;

    /**
     * 创建指定大小的空存储
     * @param size 字节数
     */
    public PageStorage(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("页面大小必须大于0: " + size);
        }
        this.data = new byte[size];
        this.buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    public int size() {
        return data.length;
    }

    public long getLong(int offset) throws DSMException {
        checkBounds(offset, Long.BYTES);
        return buffer.getLong(offset);
    }

    public void putLong(int offset, long value) throws DSMException {
        checkBounds(offset, Long.BYTES);
        buffer.putLong(offset, value);
    }

    public float getFloat(int offset) throws DSMException {
        checkBounds(offset, Float.BYTES);
        return buffer.getFloat(offset);
    }

    public void putFloat(int offset, float value) throws DSMException {
        checkBounds(offset, Float.BYTES);
        buffer.putFloat(offset, value);
    }

    /**
     * 用完整的页面镜像覆盖当前内容
     * @param image 页面镜像，长度必须等于页面大小
     * @throws DSMException 长度不一致时抛出PROTOCOL错误
     */
    public void load(byte[] image) throws DSMException {
        if (image.length != data.length) {
            throw new DSMException(ErrorType.PROTOCOL,
                    "页面大小不一致: 期望 " + data.length + " 字节，实际 " + image.length + " 字节");
        }
        System.arraycopy(image, 0, data, 0, data.length);
    }

    /**
     * 复制当前内容
     * @return 页面镜像的副本
     */
    public byte[] toByteArray() {
        byte[] copy = new byte[data.length];
        System.arraycopy(data, 0, copy, 0, data.length);
        return copy;
    }

    private void checkBounds(int offset, int width) throws DSMException {
        if (offset < 0 || (long) offset + width > data.length) {
            throw new DSMException(ErrorType.OUT_OF_BOUNDS,
                    "偏移量越界: " + offset + " (宽度 " + width + ", 页面大小 " + data.length + ")");
        }
    }
}
