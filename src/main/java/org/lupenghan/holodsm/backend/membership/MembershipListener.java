package org.lupenghan.holodsm.backend.membership;

/**
 * 成员事件消费者
 */
public interface MembershipListener {
    /**
     * 处理成员事件，在事件通道的分发线程中调用
     * @param event 成员事件
     */
    void onEvent(MembershipEvent event);
}
