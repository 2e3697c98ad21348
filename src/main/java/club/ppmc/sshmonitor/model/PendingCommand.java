/**
 * PendingCommand.java
 *
 * 一条已提交、尚未结束的命令。
 * 它在内部由 CommandExecutor 创建和管理，所有可变字段都只在 CommandExecutor 的锁内访问。
 */
package club.ppmc.sshmonitor.model;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import lombok.Getter;
import lombok.Setter;

@Getter
public class PendingCommand {

    /** 执行器内单调递增的编号，用于标记该命令的退出码查询。 */
    private final long id;

    private final String command;
    private final Instant submittedAt;
    private final long timeoutMs;
    private final CompletableFuture<CommandResult> future = new CompletableFuture<>();

    @Setter
    private CommandState state = CommandState.QUEUED;

    /** 用户命令从回显到提示符的原始字节。 */
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    /** 隐藏的退出码查询命令的原始字节，不进入终端历史。 */
    private final ByteArrayOutputStream statusOutput = new ByteArrayOutputStream();

    @Setter
    private String stdout;

    @Setter
    private ScheduledFuture<?> timeoutTask;

    public PendingCommand(long id, String command, Instant submittedAt, long timeoutMs) {
        this.id = id;
        this.command = command;
        this.submittedAt = submittedAt;
        this.timeoutMs = timeoutMs;
    }

    public void captureOutput(byte[] bytes) {
        output.writeBytes(bytes);
    }

    public void captureStatus(byte[] bytes) {
        statusOutput.writeBytes(bytes);
    }
}
