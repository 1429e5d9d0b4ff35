package org.lupenghan.holodsm.backend.PageManager;

import org.lupenghan.holodsm.backend.PageManager.Dataform.PageKey;
import org.lupenghan.holodsm.backend.utils.DSMException;

/**
 * 页面接口 - 数组的一个定长、带版本的分块
 */
public interface Page {
    /**
     * 获取页面标识
     * @return 页面标识
     */
    PageKey getKey();

    /**
     * 获取页面版本
     * @return 版本号
     */
    long getVersion();

    /**
     * 设置页面版本
     * @param version 新版本号
     */
    void setVersion(long version);

    /**
     * 获取页面大小
     * @return 字节数
     */
    int getSize();

    /**
     * 读取指定元素下标处的64位整数
     * @param elementIndex 页内元素下标
     * @return 元素值
     * @throws DSMException 越界时抛出OUT_OF_BOUNDS
     */
    long getLong(int elementIndex) throws DSMException;

    /**
     * 写入64位整数，页面被标记为脏页
     * @param elementIndex 页内元素下标
     * @param value 元素值
     * @throws DSMException 越界时抛出OUT_OF_BOUNDS
     */
    void setLong(int elementIndex, long value) throws DSMException;

    /**
     * 读取指定元素下标处的32位浮点数
     * @param elementIndex 页内元素下标
     * @return 元素值
     * @throws DSMException 越界时抛出OUT_OF_BOUNDS
     */
    float getFloat(int elementIndex) throws DSMException;

    /**
     * 写入32位浮点数，页面被标记为脏页
     * @param elementIndex 页内元素下标
     * @param value 元素值
     * @throws DSMException 越界时抛出OUT_OF_BOUNDS
     */
    void setFloat(int elementIndex, float value) throws DSMException;

    /**
     * 判断页面是否有未刷新的修改
     * @return 是否为脏页
     */
    boolean isDirty();

    /**
     * 设置脏页标志
     * @param dirty 是否为脏页
     */
    void setDirty(boolean dirty);

    /**
     * 获取页面内容的副本，用于网络传输
     * @return 页面镜像
     */
    byte[] snapshot();

    /**
     * 用远端传来的镜像覆盖页面内容
     * @param image 页面镜像
     * @param version 镜像对应的版本
     * @throws DSMException 镜像大小与页面大小不一致时抛出PROTOCOL
     */
    void load(byte[] image, long version) throws DSMException;

    /**
     * 创建一个内容独立的副本
     * @return 页面副本
     */
    Page copy();
}
