/**
 * PromptMatcher.java
 *
 * 在会话输出字节流中识别提示符边界的状态机。
 * 只有出现在行首（流的开头或紧跟在 CR/LF 之后）且与注入的字面格式完全一致的文本才被认为是提示符；
 * 输出中间出现的类似提示符的子串不会被误判。跨两次 feed 调用被切开的提示符通过内部的携带缓冲区拼接，
 * 该缓冲区最多保留一个提示符的最大长度。匹配器从不合成边界，只报告在字节流中真实看到的提示符。
 *
 * <p>这是一个启发式方法：如果命令输出在行首逐字重现了注入的提示符，仍然会被识别为边界。
 *
 * <p>非线程安全，应只由会话的读取线程调用。
 */
package club.ppmc.sshmonitor.prompt;

import java.util.ArrayList;
import java.util.List;

public class PromptMatcher {

    private final PromptTemplate template;
    private final byte[] carry;
    private int carryLength;
    private long carryStart = -1;
    private long offset;
    private boolean atLineStart = true;

    public PromptMatcher(PromptTemplate template) {
        this.template = template;
        this.carry = new byte[template.maxLength()];
    }

    public List<PromptBoundary> feed(byte[] data) {
        return feed(data, 0, data.length);
    }

    /**
     * 处理一段新到达的字节。
     *
     * @return 本次调用中完成的所有提示符边界（按出现顺序）。
     */
    public List<PromptBoundary> feed(byte[] data, int from, int length) {
        List<PromptBoundary> found = new ArrayList<>(1);
        for (int i = from; i < from + length; i++) {
            PromptBoundary boundary = accept(data[i], offset++);
            if (boundary != null) {
                found.add(boundary);
            }
        }
        return found;
    }

    private PromptBoundary accept(byte b, long position) {
        if (carryStart >= 0) {
            carry[carryLength++] = b;
            switch (template.match(carry, carryLength)) {
                case PARTIAL:
                    return null;
                case COMPLETE:
                    var boundary = new PromptBoundary(carryStart, position + 1);
                    resetCarry();
                    atLineStart = false;
                    return boundary;
                case MISMATCH:
                default:
                    resetCarry();
                    atLineStart = isLineTerminator(b);
                    return null;
            }
        }
        if (atLineStart && b == template.firstByte()) {
            carryStart = position;
            carry[carryLength++] = b;
            return null;
        }
        atLineStart = isLineTerminator(b);
        return null;
    }

    private void resetCarry() {
        carryStart = -1;
        carryLength = 0;
    }

    private static boolean isLineTerminator(byte b) {
        return b == '\n' || b == '\r';
    }

    /**
     * @return 目前为止消费的总字节数，即下一个字节的流偏移量。
     */
    public long offset() {
        return offset;
    }

    /**
     * @return 当前携带的、可能属于一个未完成提示符的字节数。
     */
    public int pendingBytes() {
        return carryLength;
    }
}
