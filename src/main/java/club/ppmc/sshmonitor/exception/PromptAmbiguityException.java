/**
 * PromptAmbiguityException.java
 *
 * 内部错误：在限定的字节预算内没有找到提示符边界。
 * 不直接暴露给调用方，而是作为 CommandTimeoutException 的 cause。
 */
package club.ppmc.sshmonitor.exception;

public class PromptAmbiguityException extends SessionException {

    public PromptAmbiguityException(String sessionName, long capturedBytes, long budget) {
        super(
                String.format("已捕获 %d 字节（上限 %d）仍未出现提示符。", capturedBytes, budget),
                ErrorType.TIMEOUT,
                sessionName);
    }
}
