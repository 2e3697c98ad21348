/**
 * SessionException.java
 *
 * 所有会话相关错误的基类（运行时异常）。
 * 它携带一个错误类型和相关的会话名称，Controller 层通过 toErrorData() 将其转换为对前端友好的结构化响应。
 */
package club.ppmc.sshmonitor.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

@Getter
public class SessionException extends RuntimeException {

    /** 错误分类，同时决定 REST 层返回的 HTTP 状态码。 */
    public enum ErrorType {
        CONNECT_ERROR(502),
        BUSY(409),
        TIMEOUT(504),
        SESSION_CLOSED(410),
        SESSION_NOT_FOUND(404);

        private final int httpStatus;

        ErrorType(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    private final ErrorType type;

    /** 出错的会话名称，可能为 null。 */
    private final String sessionName;

    public SessionException(String message, ErrorType type, String sessionName) {
        super(message);
        this.type = type;
        this.sessionName = sessionName;
    }

    public SessionException(String message, ErrorType type, String sessionName, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.sessionName = sessionName;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("type", type.name());
        data.put("message", getMessage());
        data.put("sessionName", sessionName != null ? sessionName : "");
        return data;
    }
}
