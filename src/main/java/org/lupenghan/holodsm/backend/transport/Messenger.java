package org.lupenghan.holodsm.backend.transport;

import org.lupenghan.holodsm.backend.transport.Dataform.Message;
import org.lupenghan.holodsm.backend.transport.Dataform.MessageType;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * 请求/应答客户端，建立在传输层接口之上
 * 失败立即返回给调用方，重试策略由调用方决定
 */
public class Messenger {
    private static final Logger LOGGER = Logger.getLogger(Messenger.class.getName());

    private final Transport transport;
    private final long timeoutMillis;   // 单次请求超时（毫秒）

    public Messenger(Transport transport, long timeoutMillis) {
        this.transport = transport;
        this.timeoutMillis = timeoutMillis;
    }

    public String getLocalNodeId() {
        return transport.getLocalNodeId();
    }

    public List<String> getPeers() {
        return new ArrayList<>(transport.getPeers());
    }

    /**
     * 发送请求并等待应答
     * @param nodeId 目标节点
     * @param request 请求消息
     * @return 应答消息，不会是ERROR
     * @throws DSMException 对端返回的错误、不可达、超时或协议错误
     */
    public Message request(String nodeId, Message request) throws DSMException {
        try (Connection connection = transport.connect(nodeId);
             Stream stream = connection.openStream(request.getType().getStreamType())) {
            stream.writeMessage(request.serialize());
            byte[] reply = stream.readMessage(timeoutMillis, TimeUnit.MILLISECONDS);
            Message response = Message.deserialize(reply);
            if (response.getType() == MessageType.ERROR) {
                throw response.toException();
            }
            return response;
        }
    }

    /**
     * 发送请求并检查应答类型
     * @param nodeId 目标节点
     * @param request 请求消息
     * @param expected 期望的应答类型
     * @return 应答消息
     * @throws DSMException 请求失败或应答类型不符时抛出
     */
    public Message request(String nodeId, Message request, MessageType expected) throws DSMException {
        Message response = request(nodeId, request);
        if (response.getType() != expected) {
            throw new DSMException(ErrorType.PROTOCOL,
                    "节点 " + nodeId + " 对 " + request.getType() + " 的应答类型错误: " + response.getType()
                            + "，期望 " + expected);
        }
        return response;
    }

    /**
     * 向所有其他节点发送请求，单个节点失败只记录警告
     * @param request 请求消息
     * @return 成功应答的节点数
     */
    public int broadcast(Message request) {
        return broadcastExcept(request, null);
    }

    /**
     * 向除指定节点外的所有其他节点发送请求
     * @param request 请求消息
     * @param excludedNodeId 不发送的节点，可以为null
     * @return 成功应答的节点数
     */
    public int broadcastExcept(Message request, String excludedNodeId) {
        int delivered = 0;
        for (String peer : getPeers()) {
            if (peer.equals(excludedNodeId)) {
                continue;
            }
            try {
                request(peer, request);
                delivered++;
            } catch (DSMException e) {
                LOGGER.warning("向节点 " + peer + " 广播 " + request.getType() + " 失败: " + e);
            }
        }
        return delivered;
    }
}
