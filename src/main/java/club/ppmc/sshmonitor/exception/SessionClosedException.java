/**
 * SessionClosedException.java
 *
 * 对一个已关闭或已失败的会话进行操作。
 */
package club.ppmc.sshmonitor.exception;

public class SessionClosedException extends SessionException {

    public SessionClosedException(String sessionName) {
        super(String.format("会话 '%s' 已关闭。", sessionName), ErrorType.SESSION_CLOSED, sessionName);
    }

    public SessionClosedException(String sessionName, Throwable cause) {
        super(
                String.format("会话 '%s' 已失败: %s", sessionName, cause.getMessage()),
                ErrorType.SESSION_CLOSED,
                sessionName,
                cause);
    }
}
