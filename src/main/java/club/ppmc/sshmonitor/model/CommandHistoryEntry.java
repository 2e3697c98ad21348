/**
 * CommandHistoryEntry.java
 *
 * 会话中一条已结束命令的记录，用于 /api/sessions/{name}/commands 查询。
 * 每个会话只保留最近的若干条（见 app.ssh.command-history-size）。
 */
package club.ppmc.sshmonitor.model;

import java.time.Instant;

public record CommandHistoryEntry(
        String command, Instant startedAt, long durationMs, int exitCode, Status status) {

    public enum Status {
        SUCCESS,
        FAILURE,
        TIMEOUT,
        ERROR
    }
}
