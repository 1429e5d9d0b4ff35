package org.lupenghan.holodsm.backend.transport;

import org.lupenghan.holodsm.backend.utils.DSMException;

import java.util.concurrent.TimeUnit;

/**
 * 双向消息流
 */
public interface Stream extends AutoCloseable {
    /**
     * 读取一条消息，阻塞直到收到消息或超时
     * @param timeout 超时时间
     * @param unit 时间单位
     * @return 消息字节
     * @throws DSMException 超时抛出TIMEOUT，线程被中断抛出CANCELLED，流已关闭抛出UNREACHABLE
     */
    byte[] readMessage(long timeout, TimeUnit unit) throws DSMException;

    /**
     * 写入一条消息
     * @param data 消息字节
     * @throws DSMException 流已关闭时抛出UNREACHABLE
     */
    void writeMessage(byte[] data) throws DSMException;

    /**
     * 关闭流
     */
    @Override
    void close();
}
