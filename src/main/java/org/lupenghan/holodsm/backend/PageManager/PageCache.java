package org.lupenghan.holodsm.backend.PageManager;

import org.lupenghan.holodsm.backend.PageManager.Dataform.PageKey;

import java.util.function.Predicate;

/**
 * 页面缓存接口 - 节点本地的有界页面缓存
 * 缓存未命中只意味着需要重新获取，不意味着数据丢失
 */
public interface PageCache {
    /**
     * 从缓存获取页面，命中时更新访问顺序
     * @param arrayId 数组ID
     * @param pageId 页号
     * @return 缓存的页面，未命中返回null
     */
    Page get(String arrayId, int pageId);

    /**
     * 放入页面，超出容量时淘汰
     * @param arrayId 数组ID
     * @param pageId 页号
     * @param page 页面
     */
    void put(String arrayId, int pageId, Page page);

    /**
     * 从缓存移除页面
     * @param arrayId 数组ID
     * @param pageId 页号
     * @return 页面原先是否在缓存中
     */
    boolean remove(String arrayId, int pageId);

    /**
     * 移除满足条件的所有页面
     * @param filter 过滤条件
     * @return 移除的页面数量
     */
    int removeIf(Predicate<PageKey> filter);

    /**
     * 判断页面是否在缓存中，不影响访问顺序
     * @param arrayId 数组ID
     * @param pageId 页号
     * @return 是否在缓存中
     */
    boolean contains(String arrayId, int pageId);

    /**
     * 当前缓存的页面数量
     */
    int size();

    /**
     * 缓存容量
     */
    int capacity();
}
