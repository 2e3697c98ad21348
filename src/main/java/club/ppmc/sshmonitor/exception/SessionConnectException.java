/**
 * SessionConnectException.java
 *
 * 建立 SSH 连接、认证或初始化远程 shell 失败。对本次连接尝试是致命的，内部不会重试。
 */
package club.ppmc.sshmonitor.exception;

public class SessionConnectException extends SessionException {

    public SessionConnectException(String sessionName, String message, Throwable cause) {
        super(message, ErrorType.CONNECT_ERROR, sessionName, cause);
    }

    public SessionConnectException(String sessionName, String message) {
        super(message, ErrorType.CONNECT_ERROR, sessionName);
    }
}
