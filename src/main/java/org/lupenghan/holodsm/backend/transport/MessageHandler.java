package org.lupenghan.holodsm.backend.transport;

import org.lupenghan.holodsm.backend.utils.DSMException;

/**
 * 入站消息处理接口
 */
public interface MessageHandler {
    /**
     * 处理一条入站消息，应答写回同一条流
     * @param connection 入站连接，远程节点ID即请求方
     * @param stream 入站流
     * @param data 消息字节
     * @throws DSMException 应答无法写回时抛出
     */
    void handleMessage(Connection connection, Stream stream, byte[] data) throws DSMException;
}
