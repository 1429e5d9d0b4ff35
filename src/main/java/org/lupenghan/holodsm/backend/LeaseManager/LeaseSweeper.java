package org.lupenghan.holodsm.backend.LeaseManager;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 过期租约清理器
 * 按固定周期清理过期租约，使失联持有者的租约不会无限期阻塞其他请求
 */
public class LeaseSweeper {
    private static final Logger LOGGER = Logger.getLogger(LeaseSweeper.class.getName());

    // 租约管理器
    private final LeaseManager leaseManager;

    // 调度执行器
    private final ScheduledExecutorService executor;

    // 是否运行中
    private boolean running = false;

    public LeaseSweeper(LeaseManager leaseManager) {
        this.leaseManager = leaseManager;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lease-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 启动清理器
     * @param initialDelay 初始延迟
     * @param period 周期
     * @param unit 时间单位
     */
    public synchronized void start(long initialDelay, long period, TimeUnit unit) {
        if (running) {
            return;
        }

        running = true;
        executor.scheduleAtFixedRate(this::sweep, initialDelay, period, unit);
    }

    /**
     * 停止清理器
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdownNow();
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * 执行一次清理
     */
    private void sweep() {
        try {
            leaseManager.cleanupExpiredLeases();
        } catch (RuntimeException e) {
            // 异常会终止周期任务，这里记录后继续下一轮
            LOGGER.log(Level.WARNING, "过期租约清理失败", e);
        }
    }
}
