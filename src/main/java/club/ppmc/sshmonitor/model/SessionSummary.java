/**
 * SessionSummary.java
 *
 * 会话列表 (listSessions) 中返回的会话概要信息。
 */
package club.ppmc.sshmonitor.model;

import java.time.Instant;

public record SessionSummary(
        String name, SessionState status, Instant createdAt, String host, String username) {}
