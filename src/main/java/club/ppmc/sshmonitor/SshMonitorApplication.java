/**
 * SshMonitorApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动整个应用程序：SSH 会话管理、命令执行以及基于 WebSocket 的终端历史监控。
 * @EnableWebSocketMessageBroker 注解用于启用 WebSocket 和 STOMP 消息代理功能，供监控客户端订阅终端输出。
 */
package club.ppmc.sshmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;

@SpringBootApplication
@EnableWebSocketMessageBroker
public class SshMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SshMonitorApplication.class, args);
    }
}
