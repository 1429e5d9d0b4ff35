package org.lupenghan.holodsm.backend.transport;

import org.lupenghan.holodsm.backend.utils.DSMException;

import java.util.Collection;

/**
 * 传输层能力接口
 * 一致性引擎只依赖这个接口，不依赖具体传输实现
 */
public interface Transport extends AutoCloseable {
    /**
     * 本地节点ID
     */
    String getLocalNodeId();

    /**
     * 当前已知的其他节点
     * @return 节点ID集合，不包括本地节点
     */
    Collection<String> getPeers();

    /**
     * 连接远程节点
     * @param nodeId 节点ID
     * @return 连接
     * @throws DSMException 节点不可达时抛出UNREACHABLE
     */
    Connection connect(String nodeId) throws DSMException;

    /**
     * 注册入站消息处理器
     * @param handler 处理器
     */
    void registerHandler(MessageHandler handler);

    /**
     * 关闭传输层
     */
    @Override
    void close();
}
