/**
 * MonitorController.java
 *
 * 这是一个WebSocket控制器，专门处理终端监控客户端的订阅请求。
 * 它不处理HTTP请求，而是监听来自客户端的STOMP消息，并响应WebSocket断开事件。
 * 它与 MonitorService 协作来建立和解除对会话终端历史的订阅。
 */
package club.ppmc.sshmonitor.controller;

import club.ppmc.sshmonitor.exception.SessionException;
import club.ppmc.sshmonitor.model.MonitorFrame;
import club.ppmc.sshmonitor.service.MonitorService;
import club.ppmc.sshmonitor.service.WebSocketNotificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Controller
@Slf4j
public class MonitorController {

    private final MonitorService monitorService;
    private final WebSocketNotificationService notificationService;

    public MonitorController(MonitorService monitorService, WebSocketNotificationService notificationService) {
        this.monitorService = monitorService;
        this.notificationService = notificationService;
    }

    /**
     * 监听WebSocket断开连接事件，解除该连接的全部监控订阅。
     *
     * @param event 断开连接事件对象。
     */
    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        String connectionId = event.getSessionId();
        if (connectionId != null) {
            monitorService.detachAll(connectionId);
        }
    }

    /**
     * 开始观察一个会话。客户端应先订阅 /topic/monitor/{连接ID}/{会话名}，再发送本消息。
     *
     * @param sessionName 要观察的会话名称。
     * @param headerAccessor 消息头访问器，用于获取连接ID。
     */
    @MessageMapping("/monitor/attach")
    public void attach(@Payload String sessionName, SimpMessageHeaderAccessor headerAccessor) {
        String connectionId = headerAccessor.getSessionId();
        if (connectionId == null) {
            return;
        }
        String name = sessionName.trim();
        try {
            monitorService.attach(connectionId, name);
        } catch (SessionException e) {
            log.warn("监控连接 {} 无法观察会话 {}: {}", connectionId, name, e.getMessage());
            notificationService.sendMonitorFrame(connectionId, MonitorFrame.error(name, e.getMessage()));
        }
    }

    /**
     * 停止观察一个会话。
     */
    @MessageMapping("/monitor/detach")
    public void detach(@Payload String sessionName, SimpMessageHeaderAccessor headerAccessor) {
        String connectionId = headerAccessor.getSessionId();
        if (connectionId != null) {
            monitorService.detach(connectionId, sessionName.trim());
        }
    }
}
