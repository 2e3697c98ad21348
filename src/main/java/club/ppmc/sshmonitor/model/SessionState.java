/**
 * SessionState.java
 *
 * 定义一个SSH终端会话的生命周期状态。
 * 正常路径为 CONNECTING -> READY <-> EXECUTING -> CLOSING -> CLOSED，
 * 远程通道出现不可恢复的错误时，任何状态都可能进入 FAILED。
 */
package club.ppmc.sshmonitor.model;

public enum SessionState {
    CONNECTING,
    READY,
    EXECUTING,
    CLOSING,
    CLOSED,
    FAILED;

    /**
     * @return 如果会话已经终止（不会再接受任何命令），返回 true。
     */
    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}
