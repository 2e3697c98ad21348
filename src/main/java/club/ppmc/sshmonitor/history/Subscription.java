/**
 * Subscription.java
 *
 * 一个观察者在某个会话历史上的订阅句柄。
 * 它记录最后一次投递的序列号（游标），保证同一个片段不会被投递两次；
 * 它只持有对 BroadcastHub 的引用以便取消订阅，对会话的生命周期没有任何影响。
 */
package club.ppmc.sshmonitor.history;

import club.ppmc.sshmonitor.model.OutputChunk;

public final class Subscription {

    private final BroadcastHub hub;
    private final HistoryObserver observer;
    private volatile long lastDeliveredSequence = -1;
    private volatile boolean active = true;

    Subscription(BroadcastHub hub, HistoryObserver observer) {
        this.hub = hub;
        this.observer = observer;
    }

    /**
     * 投递一个片段。已经投递过的序列号会被忽略。
     * 只在历史缓冲区的锁内调用，因此对同一订阅是串行的。
     */
    void deliver(OutputChunk chunk) {
        if (chunk.sequence() <= lastDeliveredSequence) {
            return;
        }
        observer.onChunk(chunk);
        lastDeliveredSequence = chunk.sequence();
    }

    void complete(Throwable cause) {
        if (!active) {
            return;
        }
        active = false;
        if (cause == null) {
            observer.onComplete();
        } else {
            observer.onError(cause);
        }
    }

    void deactivate() {
        active = false;
    }

    /**
     * 停止接收后续片段。幂等，不影响会话和其他观察者。
     */
    public void detach() {
        hub.detach(this);
    }

    public boolean isActive() {
        return active;
    }

    /**
     * @return 最后一次投递的序列号；还未投递任何片段时为 -1。
     */
    public long lastDeliveredSequence() {
        return lastDeliveredSequence;
    }

    public String sessionName() {
        return hub.sessionName();
    }
}
