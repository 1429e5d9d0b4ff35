package backend;

import org.lupenghan.holodsm.backend.DSMSystem;
import org.lupenghan.holodsm.backend.conf.DSMConfig;
import org.lupenghan.holodsm.backend.membership.MembershipEventChannel;
import org.lupenghan.holodsm.backend.transport.Impl.InMemoryNetwork;

import java.util.ArrayList;
import java.util.List;

/**
 * 进程内的多节点集群，所有节点共用一个时钟
 * 页面只有64字节（8个int64元素），方便构造跨页的场景
 */
public class TestCluster implements AutoCloseable {
    public static final int PAGE_SIZE = 64;

    private final InMemoryNetwork network = new InMemoryNetwork();
    private final MutableClock clock = new MutableClock(1_000_000);
    private final List<DSMSystem> nodes = new ArrayList<>();
    private final List<MembershipEventChannel> channels = new ArrayList<>();
    private final DSMConfig config;

    public TestCluster(long leaseTtlMillis) {
        this.config = DSMConfig.builder()
                .pageSize(PAGE_SIZE)
                .cacheCapacity(16)
                .leaseTtlMillis(leaseTtlMillis)
                .leaseSweepIntervalMillis(60_000)
                .requestTimeoutMillis(2_000)
                .build();
    }

    public TestCluster() {
        this(60_000);
    }

    public DSMSystem addNode(String nodeId) {
        return addNode(nodeId, config);
    }

    public DSMSystem addNode(String nodeId, DSMConfig nodeConfig) {
        MembershipEventChannel channel = new MembershipEventChannel();
        DSMSystem node = new DSMSystem(nodeConfig, network.join(nodeId), clock, channel);
        nodes.add(node);
        channels.add(channel);
        return node;
    }

    public InMemoryNetwork getNetwork() {
        return network;
    }

    public MutableClock getClock() {
        return clock;
    }

    public DSMConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        for (DSMSystem node : nodes) {
            node.close();
        }
        for (MembershipEventChannel channel : channels) {
            channel.close();
        }
    }
}
