/**
 * SessionBusyException.java
 *
 * 会话中已有一条命令在执行时再次提交命令。调用方可以稍后重试。
 */
package club.ppmc.sshmonitor.exception;

public class SessionBusyException extends SessionException {

    public SessionBusyException(String sessionName, String runningCommand) {
        super(
                String.format("会话 '%s' 正在执行命令 '%s'，请稍后重试。", sessionName, runningCommand),
                ErrorType.BUSY,
                sessionName);
    }
}
