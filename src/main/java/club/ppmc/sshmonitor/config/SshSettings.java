/**
 * SshSettings.java
 *
 * 该文件定义了一个POJO，用于承载 SSH 会话和命令执行相关的所有可配置项。
 * 默认值即为应用的推荐值；AppConfig 会用 application.properties 中 app.ssh.* 的值覆盖它们。
 */
package club.ppmc.sshmonitor.config;

import lombok.Data;

@Data
public class SshSettings {

    // --- 连接 ---
    /** 建立 TCP 连接的超时时间（毫秒）。 */
    private long connectTimeoutMs = 10_000;

    /** 认证超时时间（毫秒）。 */
    private long authTimeoutMs = 10_000;

    /**
     * 等待远程 shell 出现第一个注入提示符的超时时间（毫秒）。
     * 超时视为连接失败。
     */
    private long shellReadyTimeoutMs = 15_000;

    // --- 伪终端 ---
    private String ptyType = "xterm";

    /** 终端宽度。设置得较宽，以减少长命令在回显时被折行。 */
    private int ptyColumns = 250;

    private int ptyLines = 50;

    // --- 命令执行 ---
    /** 命令的默认超时时间（毫秒）。 */
    private long commandTimeoutMs = 15_000;

    /** 单条命令最多捕获的字节数，超过仍未出现提示符时按超时处理。 */
    private long maxCaptureBytes = 8L * 1024 * 1024;

    /** 关闭会话时等待正在执行的命令结束的最长时间（毫秒）。 */
    private long closeTimeoutMs = 5_000;

    /** 每个会话保留的命令历史条数。 */
    private int commandHistorySize = 100;
}
