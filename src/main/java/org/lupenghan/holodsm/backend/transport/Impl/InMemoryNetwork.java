package org.lupenghan.holodsm.backend.transport.Impl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * 进程内网络，连接同一JVM中的多个节点
 * 用于测试和单机演示，可以断开节点来模拟故障
 */
public class InMemoryNetwork {
    private static final Logger LOGGER = Logger.getLogger(InMemoryNetwork.class.getName());

    // 节点ID -> 传输端点
    private final ConcurrentHashMap<String, InMemoryTransport> endpoints = new ConcurrentHashMap<>();

    // 被断开的节点
    private final Set<String> disconnected = ConcurrentHashMap.newKeySet();

    /**
     * 创建并注册一个节点端点
     * @param nodeId 节点ID
     * @return 传输端点
     */
    public InMemoryTransport join(String nodeId) {
        InMemoryTransport transport = new InMemoryTransport(this, nodeId);
        if (endpoints.putIfAbsent(nodeId, transport) != null) {
            transport.close();
            throw new IllegalArgumentException("节点ID已存在: " + nodeId);
        }
        return transport;
    }

    /**
     * 断开节点，之后所有到达或来自该节点的连接都会失败
     */
    public void disconnect(String nodeId) {
        disconnected.add(nodeId);
        LOGGER.info("断开节点: " + nodeId);
    }

    /**
     * 恢复被断开的节点
     */
    public void reconnect(String nodeId) {
        disconnected.remove(nodeId);
        LOGGER.info("恢复节点: " + nodeId);
    }

    public boolean isReachable(String nodeId) {
        return endpoints.containsKey(nodeId) && !disconnected.contains(nodeId);
    }

    InMemoryTransport endpoint(String nodeId) {
        return endpoints.get(nodeId);
    }

    Collection<String> peersOf(String nodeId) {
        Collection<String> peers = new ArrayList<>();
        for (String id : endpoints.keySet()) {
            if (!id.equals(nodeId)) {
                peers.add(id);
            }
        }
        return peers;
    }

    /**
     * 端点关闭时注销，只注销登记的就是这个端点的节点
     */
    void leave(String nodeId, InMemoryTransport transport) {
        if (endpoints.remove(nodeId, transport)) {
            disconnected.remove(nodeId);
        }
    }
}
