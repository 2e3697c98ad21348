/**
 * BroadcastHub.java
 *
 * 将一个会话新追加的历史片段扇出给所有订阅者，并为新加入的订阅者提供“先回放、再实时”的无缝切换。
 *
 * <p>attach 与 append 共享 HistoryBuffer 的锁：回放快照的获取、回放的投递以及注册在同一个临界区内完成，
 * 因此快照之后追加的片段一定会以实时方式投递，且不会重复。所有订阅者按相同的序列号顺序收到片段。
 *
 * <p>BroadcastHub 属于会话，只持有订阅句柄的非拥有注册，不引用会话本身。
 */
package club.ppmc.sshmonitor.history;

import club.ppmc.sshmonitor.model.OutputChunk;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class BroadcastHub {

    private final String sessionName;
    private final HistoryBuffer buffer;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private boolean closed;
    private Throwable failure;

    BroadcastHub(String sessionName, HistoryBuffer buffer) {
        this.sessionName = sessionName;
        this.buffer = buffer;
    }

    /**
     * 订阅会话历史：同步投递当前的完整回放，然后注册接收后续片段。
     * 如果会话已经结束，只投递最终回放，然后立即发出流结束信号，返回的订阅处于非活动状态。
     */
    public Subscription attach(HistoryObserver observer) {
        synchronized (buffer.monitor()) {
            var subscription = new Subscription(this, observer);
            for (OutputChunk chunk : buffer.replay()) {
                subscription.deliver(chunk);
            }
            if (closed) {
                subscription.complete(failure);
                return subscription;
            }
            subscriptions.add(subscription);
            log.debug("会话 {} 新增观察者，已回放到序列号 {}，当前观察者数: {}",
                    sessionName, subscription.lastDeliveredSequence(), subscriptions.size());
            return subscription;
        }
    }

    /**
     * 取消订阅。幂等。
     */
    public void detach(Subscription subscription) {
        synchronized (buffer.monitor()) {
            if (subscriptions.remove(subscription)) {
                log.debug("会话 {} 移除观察者，剩余观察者数: {}", sessionName, subscriptions.size());
            }
            subscription.deactivate();
        }
    }

    /** 由 HistoryBuffer 在锁内调用。 */
    void publish(OutputChunk chunk) {
        for (Subscription subscription : subscriptions) {
            try {
                subscription.deliver(chunk);
            } catch (RuntimeException e) {
                log.warn("会话 {} 的观察者处理片段 {} 时出错，将移除该观察者: {}",
                        sessionName, chunk.sequence(), e.getMessage());
                subscriptions.remove(subscription);
                subscription.deactivate();
            }
        }
    }

    /**
     * 会话正常关闭：所有订阅者收到 onComplete，之后的 attach 只得到最终回放。
     */
    public void close() {
        terminate(null);
    }

    /**
     * 会话失败：所有订阅者收到 onError，之后的 attach 只得到最终回放和同一个错误。
     */
    public void fail(Throwable cause) {
        terminate(cause);
    }

    private void terminate(Throwable cause) {
        synchronized (buffer.monitor()) {
            if (closed) {
                return;
            }
            closed = true;
            failure = cause;
            for (Subscription subscription : subscriptions) {
                try {
                    subscription.complete(cause);
                } catch (RuntimeException e) {
                    log.warn("会话 {} 的观察者处理流结束信号时出错: {}", sessionName, e.getMessage());
                }
            }
            subscriptions.clear();
        }
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public String sessionName() {
        return sessionName;
    }
}
