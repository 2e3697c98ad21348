/**
 * MonitorFrame.java
 *
 * 通过 STOMP 推送给监控客户端的消息帧。
 * type 为 "chunk" 时携带一个历史片段（data 为 Base64 编码的原始字节），
 * 为 "end" 或 "error" 时表示该监控流已经结束。
 */
package club.ppmc.sshmonitor.model;

import java.util.Base64;

public record MonitorFrame(
        String sessionName, String type, long sequence, String data, boolean promptBoundary, String message) {

    public static MonitorFrame chunk(String sessionName, OutputChunk chunk) {
        return new MonitorFrame(
                sessionName,
                "chunk",
                chunk.sequence(),
                Base64.getEncoder().encodeToString(chunk.bytes()),
                chunk.promptBoundary(),
                null);
    }

    public static MonitorFrame end(String sessionName) {
        return new MonitorFrame(sessionName, "end", -1, null, false, null);
    }

    public static MonitorFrame error(String sessionName, String message) {
        return new MonitorFrame(sessionName, "error", -1, null, false, message);
    }
}
