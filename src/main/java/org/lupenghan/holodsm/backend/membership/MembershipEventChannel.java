package org.lupenghan.holodsm.backend.membership;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 成员事件通道
 * 发布方只投递事件，不直接调用消费者；由单独的分发线程按顺序交给所有监听者
 */
public class MembershipEventChannel implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(MembershipEventChannel.class.getName());

    private final BlockingQueue<MembershipEvent> queue;
    private final List<MembershipListener> listeners;
    private final ExecutorService dispatcher;
    private final AtomicLong published;
    private final AtomicLong delivered;
    private volatile boolean running = false;

    public MembershipEventChannel() {
        this.queue = new LinkedBlockingQueue<>();
        this.listeners = new CopyOnWriteArrayList<>();
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "membership-dispatcher");
            t.setDaemon(true);
            return t;
        });
        this.published = new AtomicLong();
        this.delivered = new AtomicLong();
    }

    public void subscribe(MembershipListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(MembershipListener listener) {
        listeners.remove(listener);
    }

    /**
     * 启动分发线程
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatcher.execute(this::dispatchLoop);
    }

    /**
     * 投递事件
     * @param event 成员事件
     */
    public void publish(MembershipEvent event) {
        published.incrementAndGet();
        queue.offer(event);
    }

    /**
     * 等待已投递的事件全部分发完成
     * @param timeout 超时时间
     * @param unit 时间单位
     * @return 是否在超时前分发完成
     * @throws InterruptedException 等待时被中断
     */
    public boolean awaitDelivered(long timeout, TimeUnit unit) throws InterruptedException {
        long target = published.get();
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (delivered) {
            while (delivered.get() < target) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(delivered, remaining);
            }
        }
        return true;
    }

    private void dispatchLoop() {
        while (running) {
            MembershipEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            LOGGER.fine("分发成员事件: " + event);
            for (MembershipListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "成员事件处理失败: " + event, e);
                }
            }
            synchronized (delivered) {
                delivered.incrementAndGet();
                delivered.notifyAll();
            }
        }
    }

    @Override
    public synchronized void close() {
        running = false;
        dispatcher.shutdownNow();
    }
}
