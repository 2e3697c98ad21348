/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义应用级别的Bean：用于序列化 WebSocket 消息的 Gson，以及从 application.properties 读取的 SSH 设置。
 */
package club.ppmc.sshmonitor.config;

import com.google.gson.Gson;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * 定义一个全局的 Gson Bean。
     * 在WebSocket服务中用于将监控帧转换为JSON字符串，确保与前端的兼容性。
     *
     * @return 一个新的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new Gson();
    }

    /**
     * 根据 application.properties 构建 SSH 设置。未配置的项保留 SshSettings 中的默认值。
     */
    @Bean
    public SshSettings sshSettings(
            @Value("${app.ssh.connect-timeout-ms:10000}") long connectTimeoutMs,
            @Value("${app.ssh.auth-timeout-ms:10000}") long authTimeoutMs,
            @Value("${app.ssh.shell-ready-timeout-ms:15000}") long shellReadyTimeoutMs,
            @Value("${app.ssh.pty.type:xterm}") String ptyType,
            @Value("${app.ssh.pty.columns:250}") int ptyColumns,
            @Value("${app.ssh.pty.lines:50}") int ptyLines,
            @Value("${app.ssh.command-timeout-ms:15000}") long commandTimeoutMs,
            @Value("${app.ssh.max-capture-bytes:8388608}") long maxCaptureBytes,
            @Value("${app.ssh.close-timeout-ms:5000}") long closeTimeoutMs,
            @Value("${app.ssh.command-history-size:100}") int commandHistorySize) {
        var settings = new SshSettings();
        settings.setConnectTimeoutMs(connectTimeoutMs);
        settings.setAuthTimeoutMs(authTimeoutMs);
        settings.setShellReadyTimeoutMs(shellReadyTimeoutMs);
        settings.setPtyType(ptyType);
        settings.setPtyColumns(ptyColumns);
        settings.setPtyLines(ptyLines);
        settings.setCommandTimeoutMs(commandTimeoutMs);
        settings.setMaxCaptureBytes(maxCaptureBytes);
        settings.setCloseTimeoutMs(closeTimeoutMs);
        settings.setCommandHistorySize(commandHistorySize);
        return settings;
    }
}
