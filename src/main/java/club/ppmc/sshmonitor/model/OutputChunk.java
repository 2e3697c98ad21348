/**
 * OutputChunk.java
 *
 * 该文件定义了终端历史中的一个不可变片段。
 * 每个片段都携带一个会话内单调递增、无间隙的序列号（从0开始），以及从远程通道原样收到的字节。
 * 如果片段以一个已确认的提示符结束，promptBoundary 标志为 true。
 */
package club.ppmc.sshmonitor.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;

/**
 * 终端输出片段。
 *
 * @param sequence 会话内的序列号。
 * @param bytes 原始字节（构造和读取时都会复制，保证不可变）。
 * @param promptBoundary 片段末尾是否为一个提示符边界。
 * @param receivedAt 片段被追加到历史中的时间。
 */
public record OutputChunk(long sequence, byte[] bytes, boolean promptBoundary, Instant receivedAt) {

    public OutputChunk {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    /**
     * 以 UTF-8 解码片段内容。片段可能在多字节字符中间被切开，因此只适用于展示和日志。
     */
    public String text() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OutputChunk other)) {
            return false;
        }
        return sequence == other.sequence
                && promptBoundary == other.promptBoundary
                && Arrays.equals(bytes, other.bytes)
                && receivedAt.equals(other.receivedAt);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(sequence) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "OutputChunk[sequence=" + sequence + ", length=" + bytes.length
                + ", promptBoundary=" + promptBoundary + "]";
    }
}
