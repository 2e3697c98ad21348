/**
 * MonitorService.java
 *
 * 管理 WebSocket 监控客户端对会话终端历史的订阅。
 * 每个监控连接可以同时观察多个会话；连接断开时，它的所有订阅都会被解除，
 * 监控客户端的进出对会话本身没有任何影响。
 */
package club.ppmc.sshmonitor.service;

import club.ppmc.sshmonitor.history.HistoryObserver;
import club.ppmc.sshmonitor.history.Subscription;
import club.ppmc.sshmonitor.model.MonitorFrame;
import club.ppmc.sshmonitor.model.OutputChunk;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class MonitorService {

    private final SessionRegistry sessionRegistry;
    private final WebSocketNotificationService notificationService;

    /** 监控连接ID -> (会话名 -> 订阅)。 */
    private final Map<String, Map<String, Subscription>> monitors = new ConcurrentHashMap<>();

    public MonitorService(SessionRegistry sessionRegistry, WebSocketNotificationService notificationService) {
        this.sessionRegistry = sessionRegistry;
        this.notificationService = notificationService;
    }

    /**
     * 让一个监控连接开始观察一个会话。已经在观察时先解除旧的订阅，重新回放完整历史。
     */
    public Subscription attach(String connectionId, String sessionName) {
        detach(connectionId, sessionName);
        Subscription subscription = sessionRegistry.attachMonitor(
                sessionName, new StompObserver(connectionId, sessionName));
        Map<String, Subscription> subscriptions = monitors.computeIfAbsent(connectionId, id -> new ConcurrentHashMap<>());
        subscriptions.put(sessionName, subscription);
        // 会话可能在 attachMonitor 返回后、登记之前结束，此时 onComplete 已经执行过，需要在这里补上清理
        if (!subscription.isActive()) {
            subscriptions.remove(sessionName, subscription);
        }
        log.info("监控连接 {} 开始观察会话 {}，已回放到序列号 {}",
                connectionId, sessionName, subscription.lastDeliveredSequence());
        return subscription;
    }

    public void detach(String connectionId, String sessionName) {
        Map<String, Subscription> subscriptions = monitors.get(connectionId);
        if (subscriptions == null) {
            return;
        }
        Subscription subscription = subscriptions.remove(sessionName);
        if (subscription != null) {
            subscription.detach();
            log.info("监控连接 {} 停止观察会话 {}", connectionId, sessionName);
        }
    }

    /**
     * 监控连接断开时解除它的所有订阅。
     */
    public void detachAll(String connectionId) {
        Map<String, Subscription> subscriptions = monitors.remove(connectionId);
        if (subscriptions != null) {
            subscriptions.values().forEach(Subscription::detach);
            log.info("监控连接 {} 已断开，解除 {} 个订阅", connectionId, subscriptions.size());
        }
    }

    public int monitorCount(String connectionId) {
        Map<String, Subscription> subscriptions = monitors.get(connectionId);
        return subscriptions == null ? 0 : subscriptions.size();
    }

    private void forget(String connectionId, String sessionName) {
        Map<String, Subscription> subscriptions = monitors.get(connectionId);
        if (subscriptions != null) {
            subscriptions.remove(sessionName);
        }
    }

    /** 将历史片段转换为 STOMP 帧的观察者。 */
    private final class StompObserver implements HistoryObserver {

        private final String connectionId;
        private final String sessionName;

        StompObserver(String connectionId, String sessionName) {
            this.connectionId = connectionId;
            this.sessionName = sessionName;
        }

        @Override
        public void onChunk(OutputChunk chunk) {
            notificationService.sendMonitorFrame(connectionId, MonitorFrame.chunk(sessionName, chunk));
        }

        @Override
        public void onComplete() {
            forget(connectionId, sessionName);
            notificationService.sendMonitorFrame(connectionId, MonitorFrame.end(sessionName));
        }

        @Override
        public void onError(Throwable cause) {
            forget(connectionId, sessionName);
            notificationService.sendMonitorFrame(connectionId, MonitorFrame.error(sessionName, cause.getMessage()));
        }
    }
}
