package org.lupenghan.holodsm.backend.membership;

import org.lupenghan.holodsm.backend.MemoryManager.MemoryManager;

import java.util.logging.Logger;

/**
 * 节点失效处理：节点离开或被确认失效时撤销它的租约，清除指向它的所有权和缓存页面
 * 可疑状态不做处理，由租约过期兜底
 */
public class NodeFailureHandler implements MembershipListener {
    private static final Logger LOGGER = Logger.getLogger(NodeFailureHandler.class.getName());

    private final MemoryManager memoryManager;

    public NodeFailureHandler(MemoryManager memoryManager) {
        this.memoryManager = memoryManager;
    }

    @Override
    public void onEvent(MembershipEvent event) {
        if (!event.isNodeGone()) {
            return;
        }
        if (event.getNodeId().equals(memoryManager.getLocalNodeId())) {
            LOGGER.warning("收到本节点失效的事件，忽略: " + event);
            return;
        }
        LOGGER.info("节点不可用: " + event);
        memoryManager.handleNodeFailure(event.getNodeId());
    }
}
