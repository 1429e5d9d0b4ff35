package org.lupenghan.holodsm.backend;

import lombok.Getter;
import org.lupenghan.holodsm.backend.LeaseManager.Impl.LeaseManagerImpl;
import org.lupenghan.holodsm.backend.LeaseManager.LeaseManager;
import org.lupenghan.holodsm.backend.LeaseManager.LeaseSweeper;
import org.lupenghan.holodsm.backend.MemoryManager.Dataform.SharedArray;
import org.lupenghan.holodsm.backend.MemoryManager.Impl.MemoryManagerImpl;
import org.lupenghan.holodsm.backend.MemoryManager.MemoryManager;
import org.lupenghan.holodsm.backend.PageManager.Dataform.ElementType;
import org.lupenghan.holodsm.backend.PageManager.Impl.TwoQueuePageCache;
import org.lupenghan.holodsm.backend.PageManager.PageCache;
import org.lupenghan.holodsm.backend.SyncManager.Impl.SyncManagerImpl;
import org.lupenghan.holodsm.backend.SyncManager.SyncManager;
import org.lupenghan.holodsm.backend.conf.DSMConfig;
import org.lupenghan.holodsm.backend.membership.MembershipEventChannel;
import org.lupenghan.holodsm.backend.membership.NodeFailureHandler;
import org.lupenghan.holodsm.backend.transport.Messenger;
import org.lupenghan.holodsm.backend.transport.Transport;
import org.lupenghan.holodsm.backend.utils.DSMException;

import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * DSM节点，整合租约管理器、页面缓存、内存管理器和同步管理器
 * 同一进程内可以创建多个节点，各自持有独立的状态
 */
public class DSMSystem implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(DSMSystem.class.getName());

    @Getter
    private final DSMConfig config;
    @Getter
    private final String nodeId;

    private final Transport transport;

    @Getter
    private final LeaseManager leaseManager;
    @Getter
    private final PageCache pageCache;
    @Getter
    private final MemoryManager memoryManager;
    @Getter
    private final SyncManager syncManager;
    @Getter
    private final MembershipEventChannel membershipChannel;

    private final LeaseSweeper leaseSweeper;
    private final NodeFailureHandler failureHandler;

    // 事件通道由本节点创建时随节点关闭
    private final boolean ownsChannel;

    /**
     * 使用系统时钟和节点自己的成员事件通道创建节点
     * @param config 节点配置
     * @param transport 传输层
     */
    public DSMSystem(DSMConfig config, Transport transport) {
        this(config, transport, Clock.systemUTC(), new MembershipEventChannel(), true);
    }

    /**
     * 创建节点
     * @param config 节点配置
     * @param transport 传输层
     * @param clock 租约使用的时钟
     * @param membershipChannel 成员事件通道，由调用方负责关闭
     */
    public DSMSystem(DSMConfig config, Transport transport, Clock clock, MembershipEventChannel membershipChannel) {
        this(config, transport, clock, membershipChannel, false);
    }

    private DSMSystem(DSMConfig config, Transport transport, Clock clock,
                      MembershipEventChannel membershipChannel, boolean ownsChannel) {
        config.validate();
        this.config = config;
        this.transport = transport;
        this.nodeId = transport.getLocalNodeId();
        this.membershipChannel = membershipChannel;
        this.ownsChannel = ownsChannel;

        this.leaseManager = new LeaseManagerImpl(config.getLeaseTtlMillis(), clock);
        this.pageCache = new TwoQueuePageCache(config.getCacheCapacity());
        Messenger messenger = new Messenger(transport, config.getRequestTimeoutMillis());
        this.memoryManager = new MemoryManagerImpl(nodeId, config, pageCache, leaseManager, messenger);
        this.syncManager = new SyncManagerImpl(memoryManager, clock);

        transport.registerHandler(new NodeRequestHandler(memoryManager));

        this.leaseSweeper = new LeaseSweeper(leaseManager);
        leaseSweeper.start(config.getLeaseSweepIntervalMillis(), config.getLeaseSweepIntervalMillis(),
                TimeUnit.MILLISECONDS);

        this.failureHandler = new NodeFailureHandler(memoryManager);
        membershipChannel.subscribe(failureHandler);
        membershipChannel.start();

        LOGGER.info("DSM节点 " + nodeId + " 启动，页面大小 " + config.getPageSize()
                + "，缓存容量 " + config.getCacheCapacity() + "，租约有效期 " + config.getLeaseTtlMillis() + "ms");
    }

    /**
     * 创建64位整数数组，本节点成为它的归属节点
     * @param length 元素个数
     * @return 数组句柄
     */
    public DistributedArray createArray(long length) {
        return createArray(length, ElementType.INT64);
    }

    public DistributedArray createArray(long length, ElementType elementType) {
        return new DistributedArray(memoryManager.createArray(length, elementType), syncManager);
    }

    /**
     * 打开其他节点创建的数组
     * @param arrayId 数组ID
     * @return 数组句柄
     * @throws DSMException 本节点不知道该数组时抛出NOT_FOUND
     */
    public DistributedArray openArray(String arrayId) throws DSMException {
        SharedArray array = memoryManager.getArray(arrayId);
        return new DistributedArray(array, syncManager);
    }

    /**
     * 删除数组，所有节点上的页面、缓存和租约随之丢弃
     * @throws DSMException 数组不存在时抛出NOT_FOUND
     */
    public void deleteArray(String arrayId) throws DSMException {
        memoryManager.deleteArray(arrayId);
        syncManager.discard(arrayId);
    }

    /**
     * 缓存中的页面数量
     */
    public int getCacheSize() {
        return pageCache.size();
    }

    public int getCacheCapacity() {
        return pageCache.capacity();
    }

    /**
     * 关闭节点
     */
    @Override
    public void close() {
        LOGGER.info("关闭DSM节点 " + nodeId + "...");
        leaseSweeper.stop();
        membershipChannel.unsubscribe(failureHandler);
        if (ownsChannel) {
            membershipChannel.close();
        }
        transport.close();
        LOGGER.info("DSM节点 " + nodeId + " 已关闭");
    }
}
