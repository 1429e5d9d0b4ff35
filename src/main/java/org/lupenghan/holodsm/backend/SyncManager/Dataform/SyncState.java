package org.lupenghan.holodsm.backend.SyncManager.Dataform;

/**
 * 数组的同步状态
 */
public enum SyncState {
    ACTIVE,         // 正常读写
    FLUSHING,       // 正在刷新脏页并释放写租约
    INVALIDATING,   // 正在使各节点缓存失效并更新版本
    SYNCED          // 同步完成，下一次写入后回到ACTIVE
}
