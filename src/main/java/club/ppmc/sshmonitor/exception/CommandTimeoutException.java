/**
 * CommandTimeoutException.java
 *
 * 命令在期限内没有等到提示符。会话仍然可用，远程通道不会被关闭。
 * 当提示符匹配器在字节预算内找不到边界时（PromptAmbiguityException），同样以该异常报告给调用方。
 */
package club.ppmc.sshmonitor.exception;

public class CommandTimeoutException extends SessionException {

    public CommandTimeoutException(String sessionName, String command, long timeoutMs) {
        super(
                String.format("命令 '%s' 在 %d ms 内没有完成。", command, timeoutMs),
                ErrorType.TIMEOUT,
                sessionName);
    }

    public CommandTimeoutException(String sessionName, String command, PromptAmbiguityException cause) {
        super(
                String.format("命令 '%s' 的输出中无法确认提示符边界: %s", command, cause.getMessage()),
                ErrorType.TIMEOUT,
                sessionName,
                cause);
    }
}
