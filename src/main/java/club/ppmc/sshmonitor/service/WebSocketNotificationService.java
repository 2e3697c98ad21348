/**
 * WebSocketNotificationService.java
 *
 * 一个统一的WebSocket消息发送服务。
 * 该服务为应用提供一个单一、清晰的WebSocket通信出口，封装了 SimpMessagingTemplate 的使用细节。
 * 监控帧使用 Gson 手动序列化后发送到每个监控连接专属的主题上。
 */
package club.ppmc.sshmonitor.service;

import club.ppmc.sshmonitor.model.MonitorFrame;
import com.google.gson.Gson;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class WebSocketNotificationService {

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    /**
     * 发送一个监控帧到特定监控连接。
     *
     * @param connectionId 监控客户端的 WebSocket 会话ID。
     * @param frame 要发送的帧。
     */
    public void sendMonitorFrame(String connectionId, MonitorFrame frame) {
        sendMessage(destination(connectionId, frame.sessionName()), gson.toJson(frame));
    }

    /**
     * @return 某个监控连接订阅某个会话时使用的主题。
     */
    public static String destination(String connectionId, String sessionName) {
        return String.format("/topic/monitor/%s/%s", connectionId, sessionName);
    }

    /**
     * 向指定的WebSocket主题发送一个通用载荷(payload)。
     *
     * @param destination 目标WebSocket主题
     * @param payload 要发送的对象
     */
    public void sendMessage(String destination, Object payload) {
        messagingTemplate.convertAndSend(destination, payload);
    }
}
