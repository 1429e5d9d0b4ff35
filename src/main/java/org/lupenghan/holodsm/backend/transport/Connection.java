package org.lupenghan.holodsm.backend.transport;

import org.lupenghan.holodsm.backend.utils.DSMException;

/**
 * 到远程节点的连接
 */
public interface Connection extends AutoCloseable {
    /**
     * 获取远程节点ID
     * @return 节点ID
     */
    String getRemoteNodeId();

    /**
     * 打开指定类型的流
     * @param type 流类型
     * @return 新的流
     * @throws DSMException 对端不可达时抛出UNREACHABLE
     */
    Stream openStream(StreamType type) throws DSMException;

    /**
     * 关闭连接
     */
    @Override
    void close();
}
