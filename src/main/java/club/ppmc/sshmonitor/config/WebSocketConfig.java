/**
 * WebSocketConfig.java
 *
 * 配置Spring WebSocket和STOMP消息代理，供终端监控客户端使用。
 * 客户端连接 /ws 端点，订阅 /topic/monitor/{连接ID}/{会话名}，
 * 然后向 /app/monitor/attach 发送会话名称，即可先收到完整历史回放，再收到实时输出。
 */
package club.ppmc.sshmonitor.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    /**
     * 配置消息代理（Message Broker）。
     *
     * <p>/topic 用于监控帧的推送，/app 是客户端发送 attach/detach 请求的前缀。
     * STOMP 心跳为 10 秒，用于检测已经离开的监控客户端，以便及时解除它们的订阅。
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        var taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("ws-heartbeat-thread-");
        taskScheduler.initialize();

        config.enableSimpleBroker("/topic")
                .setHeartbeatValue(new long[] {10000, 10000})
                .setTaskScheduler(taskScheduler);
        config.setApplicationDestinationPrefixes("/app");
    }

    /**
     * 注册STOMP端点。启用 SockJS 作为不支持原生 WebSocket 时的回退。
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws").setAllowedOriginPatterns("*").withSockJS().setHeartbeatTime(25000);
    }
}
