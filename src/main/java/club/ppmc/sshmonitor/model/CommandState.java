/**
 * CommandState.java
 *
 * 一个待执行命令 (PendingCommand) 的状态机。
 * AWAITING_STATUS 表示用户命令已经结束，正在等待隐藏的退出码查询命令返回。
 */
package club.ppmc.sshmonitor.model;

public enum CommandState {
    QUEUED,
    SENT,
    AWAITING_PROMPT,
    AWAITING_STATUS,
    COMPLETED,
    TIMED_OUT,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == TIMED_OUT || this == FAILED;
    }
}
