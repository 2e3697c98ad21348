/**
 * SessionNotFoundException.java
 *
 * 按名称找不到会话。
 */
package club.ppmc.sshmonitor.exception;

public class SessionNotFoundException extends SessionException {

    public SessionNotFoundException(String sessionName) {
        super(String.format("会话 '%s' 不存在。", sessionName), ErrorType.SESSION_NOT_FOUND, sessionName);
    }
}
