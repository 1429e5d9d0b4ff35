package org.lupenghan.holodsm.backend.transport.Impl;

import org.lupenghan.holodsm.backend.transport.Connection;
import org.lupenghan.holodsm.backend.transport.MessageHandler;
import org.lupenghan.holodsm.backend.transport.Stream;
import org.lupenghan.holodsm.backend.transport.StreamType;
import org.lupenghan.holodsm.backend.transport.Transport;
import org.lupenghan.holodsm.backend.utils.DSMException;
import org.lupenghan.holodsm.backend.utils.ErrorType;

import java.util.Collection;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 进程内传输端点
 * 每条流由一对阻塞队列组成，入站流在本节点的线程池中交给消息处理器
 */
public class InMemoryTransport implements Transport {
    private static final Logger LOGGER = Logger.getLogger(InMemoryTransport.class.getName());

    // 服务端等待请求帧的时间（秒）
    private static final long SERVE_READ_TIMEOUT_SECONDS = 30;

    private final InMemoryNetwork network;
    private final String nodeId;
    private final ExecutorService executor;
    private volatile MessageHandler handler;
    private volatile boolean closed = false;

    InMemoryTransport(InMemoryNetwork network, String nodeId) {
        this.network = network;
        this.nodeId = nodeId;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "transport-" + nodeId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String getLocalNodeId() {
        return nodeId;
    }

    @Override
    public Collection<String> getPeers() {
        return network.peersOf(nodeId);
    }

    @Override
    public Connection connect(String remoteNodeId) throws DSMException {
        checkReachable(remoteNodeId);
        return new InMemoryConnection(remoteNodeId);
    }

    @Override
    public void registerHandler(MessageHandler handler) {
        this.handler = handler;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        network.leave(nodeId, this);
        executor.shutdownNow();
    }

    private void checkReachable(String remoteNodeId) throws DSMException {
        if (closed || !network.isReachable(nodeId)) {
            throw new DSMException(ErrorType.UNREACHABLE, "本地节点 " + nodeId + " 已离开网络");
        }
        if (!network.isReachable(remoteNodeId)) {
            throw new DSMException(ErrorType.UNREACHABLE, "节点不可达: " + remoteNodeId);
        }
    }

    /**
     * 接收远端打开的流
     */
    private void accept(String fromNodeId, QueueStream serverStream) throws DSMException {
        MessageHandler current = handler;
        if (closed || current == null) {
            serverStream.close();
            throw new DSMException(ErrorType.UNREACHABLE, "节点 " + nodeId + " 未在服务");
        }
        try {
            executor.execute(() -> serve(fromNodeId, serverStream, current));
        } catch (RejectedExecutionException e) {
            serverStream.close();
            throw new DSMException(ErrorType.UNREACHABLE, "节点 " + nodeId + " 已关闭", e);
        }
    }

    private void serve(String fromNodeId, QueueStream serverStream, MessageHandler current) {
        try {
            byte[] request = serverStream.readMessage(SERVE_READ_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            current.handleMessage(new InMemoryConnection(fromNodeId), serverStream, request);
        } catch (DSMException e) {
            LOGGER.log(Level.WARNING, "节点 " + nodeId + " 处理来自 " + fromNodeId + " 的请求失败", e);
        } finally {
            serverStream.close();
        }
    }

    /**
     * 从本节点看到的到远端节点的连接
     */
    private class InMemoryConnection implements Connection {
        private final String remoteNodeId;

        InMemoryConnection(String remoteNodeId) {
            this.remoteNodeId = remoteNodeId;
        }

        @Override
        public String getRemoteNodeId() {
            return remoteNodeId;
        }

        @Override
        public Stream openStream(StreamType type) throws DSMException {
            checkReachable(remoteNodeId);
            InMemoryTransport remote = network.endpoint(remoteNodeId);
            if (remote == null) {
                throw new DSMException(ErrorType.UNREACHABLE, "节点不可达: " + remoteNodeId);
            }

            BlockingQueue<byte[]> toRemote = new LinkedBlockingQueue<>();
            BlockingQueue<byte[]> toLocal = new LinkedBlockingQueue<>();
            QueueStream clientStream = new QueueStream(toLocal, toRemote);
            QueueStream serverStream = new QueueStream(toRemote, toLocal);
            remote.accept(nodeId, serverStream);
            return clientStream;
        }

        @Override
        public void close() {
            // 进程内连接没有需要释放的资源
        }
    }

    /**
     * 由两个阻塞队列组成的流
     */
    private static class QueueStream implements Stream {
        private final BlockingQueue<byte[]> inbound;
        private final BlockingQueue<byte[]> outbound;
        private volatile boolean closed = false;

        QueueStream(BlockingQueue<byte[]> inbound, BlockingQueue<byte[]> outbound) {
            this.inbound = inbound;
            this.outbound = outbound;
        }

        @Override
        public byte[] readMessage(long timeout, TimeUnit unit) throws DSMException {
            try {
                byte[] data = inbound.poll(timeout, unit);
                if (data == null) {
                    throw new DSMException(ErrorType.TIMEOUT, "等待消息超时: " + unit.toMillis(timeout) + "ms");
                }
                return data;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DSMException(ErrorType.CANCELLED, "等待消息时线程被中断", e);
            }
        }

        @Override
        public void writeMessage(byte[] data) throws DSMException {
            if (closed) {
                throw new DSMException(ErrorType.UNREACHABLE, "流已关闭");
            }
            outbound.offer(data);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
