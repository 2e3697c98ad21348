/**
 * CommandExecutor.java
 *
 * 针对一个会话的远程通道串行执行命令：任意时刻最多只有一条命令在执行。
 *
 * <p>执行过程：写入命令和换行符，等待提交之后出现的第一个提示符边界，此时用户命令结束；
 * 随后写入一条隐藏的退出码查询命令，它的回显、输出和重新出现的提示符都只交给本执行器，不进入终端历史。
 * 该查询命令的提示符才是真正的完成信号。可见的 stdout 是回显命令行与其后提示符之间的字节。
 *
 * <p>并发提交不会排队：已有命令在执行时，submit 立即以 SessionBusyException 失败。
 * 超时后释放互斥锁，但远程通道保持打开，远程进程可能仍在运行。
 * 超时命令迟早会输出的那个提示符被记为“欠下的提示符”，它出现时不会被当作下一条命令的结束。
 */
package club.ppmc.sshmonitor.service;

import club.ppmc.sshmonitor.channel.RemoteChannel;
import club.ppmc.sshmonitor.config.SshSettings;
import club.ppmc.sshmonitor.exception.CommandTimeoutException;
import club.ppmc.sshmonitor.exception.PromptAmbiguityException;
import club.ppmc.sshmonitor.exception.SessionBusyException;
import club.ppmc.sshmonitor.exception.SessionClosedException;
import club.ppmc.sshmonitor.exception.SessionException;
import club.ppmc.sshmonitor.model.CommandResult;
import club.ppmc.sshmonitor.model.CommandState;
import club.ppmc.sshmonitor.model.OutputChunk;
import club.ppmc.sshmonitor.model.PendingCommand;
import club.ppmc.sshmonitor.prompt.PromptBoundary;
import club.ppmc.sshmonitor.prompt.PromptTemplate;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class CommandExecutor {

    private final String sessionName;
    private final RemoteChannel channel;
    private final PromptTemplate template;
    private final ScheduledExecutorService scheduler;
    private final SshSettings settings;

    private PendingCommand current;
    private long nextCommandId;
    /** 在等待提示符时超时的命令数，它们的提示符还没有出现。 */
    private int stalePrompts;
    private boolean discardUntilPrompt;
    private SessionException closedCause;

    public CommandExecutor(
            String sessionName,
            RemoteChannel channel,
            PromptTemplate template,
            ScheduledExecutorService scheduler,
            SshSettings settings) {
        this.sessionName = sessionName;
        this.channel = channel;
        this.template = template;
        this.scheduler = scheduler;
        this.settings = settings;
    }

    /**
     * 提交一条命令，使用配置的默认超时时间。
     */
    public CompletableFuture<CommandResult> submit(String commandText) {
        return submit(commandText, null);
    }

    /**
     * 提交一条命令。
     *
     * @param commandText 单行命令文本。
     * @param timeout 超时时间，为 null 时使用 app.ssh.command-timeout-ms。
     * @return 命令结束时完成的 Future；超时时以 CommandTimeoutException 异常完成。
     * @throws SessionBusyException 已有命令在执行。
     * @throws SessionClosedException 会话已关闭。
     * @throws IllegalArgumentException 命令为空、包含换行符或会结束远程 shell。
     */
    public CompletableFuture<CommandResult> submit(String commandText, Duration timeout) {
        validate(commandText);
        long timeoutMs = timeout != null ? timeout.toMillis() : settings.getCommandTimeoutMs();
        synchronized (this) {
            if (closedCause != null) {
                throw closedCause;
            }
            if (current != null) {
                log.warn("会话 {} 拒绝命令 '{}'：命令 '{}' 仍在执行", sessionName, commandText, current.getCommand());
                throw new SessionBusyException(sessionName, current.getCommand());
            }
            var pending = new PendingCommand(++nextCommandId, commandText, Instant.now(), timeoutMs);
            current = pending;
            try {
                pending.setState(CommandState.SENT);
                channel.write((commandText + "\n").getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.error("会话 {} 写入命令 '{}' 失败: {}", sessionName, commandText, e.getMessage());
                finish(pending, CommandState.FAILED);
                pending.getFuture().completeExceptionally(new SessionClosedException(sessionName, e));
                return pending.getFuture();
            }
            pending.setState(CommandState.AWAITING_PROMPT);
            pending.setTimeoutTask(
                    scheduler.schedule(() -> expire(pending), timeoutMs, TimeUnit.MILLISECONDS));
            log.debug("会话 {} 已发送命令 '{}'，超时 {} ms", sessionName, commandText, timeoutMs);
            return pending.getFuture();
        }
    }

    /**
     * 读取线程为每个即将进入终端历史的片段先调用此方法。
     * 如果片段属于隐藏的退出码查询，由执行器消费并返回 true，调用方不得再将其追加到历史中。
     */
    public synchronized boolean offerPrivate(byte[] segment, PromptBoundary boundary) {
        PendingCommand pending = current;
        if (pending != null && pending.getState() == CommandState.AWAITING_STATUS) {
            pending.captureStatus(segment);
            if (boundary != null) {
                completeStatus(pending);
            }
            return true;
        }
        if (discardUntilPrompt) {
            if (boundary != null) {
                discardUntilPrompt = false;
            }
            return true;
        }
        return false;
    }

    /**
     * 读取线程在片段追加到历史之后调用。
     *
     * @param chunk 刚追加的片段。
     * @param boundary 片段末尾的提示符边界，没有时为 null。
     */
    public synchronized void onOutput(OutputChunk chunk, PromptBoundary boundary) {
        PendingCommand pending = current;
        if (pending == null || pending.getState() != CommandState.AWAITING_PROMPT) {
            if (boundary != null && stalePrompts > 0) {
                stalePrompts--;
                log.debug("会话 {} 收到超时命令迟到的提示符，剩余 {} 个", sessionName, stalePrompts);
            }
            return;
        }
        pending.captureOutput(chunk.bytes());
        if (boundary != null) {
            if (stalePrompts > 0) {
                // 之前捕获的字节属于超时的命令
                stalePrompts--;
                pending.getOutput().reset();
                log.debug("会话 {} 的命令 '{}' 跳过超时命令迟到的提示符", sessionName, pending.getCommand());
                return;
            }
            completeUserCommand(pending, boundary);
            return;
        }
        long captured = pending.getOutput().size();
        if (captured > settings.getMaxCaptureBytes()) {
            var ambiguity = new PromptAmbiguityException(sessionName, captured, settings.getMaxCaptureBytes());
            log.warn("会话 {} 的命令 '{}' 无法确认提示符: {}", sessionName, pending.getCommand(), ambiguity.getMessage());
            finish(pending, CommandState.TIMED_OUT);
            stalePrompts++;
            pending.getFuture().completeExceptionally(
                    new CommandTimeoutException(sessionName, pending.getCommand(), ambiguity));
        }
    }

    private void completeUserCommand(PendingCommand pending, PromptBoundary boundary) {
        pending.setStdout(extractStdout(pending.getOutput().toByteArray(), boundary.length()));
        pending.setState(CommandState.AWAITING_STATUS);
        try {
            channel.write((template.statusQueryCommand(pending.getId()) + "\n").getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("会话 {} 写入退出码查询失败: {}", sessionName, e.getMessage());
            finish(pending, CommandState.FAILED);
            pending.getFuture().completeExceptionally(new SessionClosedException(sessionName, e));
        }
    }

    /**
     * 在退出码查询阶段遇到提示符时调用。只有输出中已经出现本命令编号的标记时才算完成，
     * 否则继续等待，直到标记出现或超时。
     */
    private void completeStatus(PendingCommand pending) {
        String statusText = pending.getStatusOutput().toString(StandardCharsets.ISO_8859_1);
        Matcher matcher = Pattern.compile(Pattern.quote(template.statusMarker(pending.getId())) + "(\\d+)")
                .matcher(statusText);
        if (!matcher.find()) {
            log.warn("会话 {} 的命令 '{}' 遇到提示符，但还没有看到它的退出码标记", sessionName, pending.getCommand());
            return;
        }
        int exitCode = Integer.parseInt(matcher.group(1));
        Instant completedAt = Instant.now();
        long durationMs = Duration.between(pending.getSubmittedAt(), completedAt).toMillis();
        finish(pending, CommandState.COMPLETED);
        log.info("会话 {} 命令 '{}' 完成，退出码 {}，耗时 {} ms", sessionName, pending.getCommand(), exitCode, durationMs);
        pending.getFuture().complete(
                new CommandResult(pending.getCommand(), pending.getStdout(), exitCode, durationMs, completedAt));
    }

    private synchronized void expire(PendingCommand pending) {
        if (current != pending || pending.getState().isFinished()) {
            return;
        }
        if (pending.getState() == CommandState.AWAITING_STATUS) {
            // 退出码查询的输出稍后仍可能到达，直到下一个提示符为止都不能进入历史
            discardUntilPrompt = true;
        } else if (pending.getState() == CommandState.AWAITING_PROMPT) {
            stalePrompts++;
        }
        log.warn("会话 {} 命令 '{}' 在 {} ms 内没有完成", sessionName, pending.getCommand(), pending.getTimeoutMs());
        finish(pending, CommandState.TIMED_OUT);
        pending.getFuture().completeExceptionally(
                new CommandTimeoutException(sessionName, pending.getCommand(), pending.getTimeoutMs()));
    }

    private void finish(PendingCommand pending, CommandState state) {
        pending.setState(state);
        if (pending.getTimeoutTask() != null) {
            pending.getTimeoutTask().cancel(false);
        }
        if (current == pending) {
            current = null;
        }
    }

    /**
     * 会话关闭或失败时调用：之后的 submit 都以给定的异常失败，正在执行的命令也以该异常结束。
     */
    public synchronized void shutdown(SessionException cause) {
        closedCause = cause;
        PendingCommand pending = current;
        if (pending != null) {
            finish(pending, CommandState.FAILED);
            pending.getFuture().completeExceptionally(cause);
        }
    }

    /**
     * 等待正在执行的命令结束。
     *
     * @return 在期限内空闲返回 true。
     */
    public boolean awaitIdle(long timeoutMs) {
        CompletableFuture<CommandResult> future;
        synchronized (this) {
            if (current == null) {
                return true;
            }
            future = current.getFuture();
        }
        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (ExecutionException e) {
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public synchronized boolean isBusy() {
        return current != null;
    }

    public synchronized Optional<String> currentCommand() {
        return Optional.ofNullable(current).map(PendingCommand::getCommand);
    }

    /**
     * 从“回显行 + 输出 + 提示符”中取出输出部分：去掉第一个 LF（含）之前的回显行和末尾的提示符。
     */
    static String extractStdout(byte[] captured, int promptLength) {
        int end = Math.max(0, captured.length - promptLength);
        int start = 0;
        while (start < end && captured[start] != '\n') {
            start++;
        }
        if (start >= end) {
            return "";
        }
        start++;
        return new String(captured, start, end - start, StandardCharsets.UTF_8);
    }

    static void validate(String commandText) {
        if (commandText == null || commandText.isBlank()) {
            throw new IllegalArgumentException("命令不能为空。");
        }
        if (commandText.indexOf('\n') >= 0 || commandText.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("只支持单行命令。");
        }
        String trimmed = commandText.trim();
        if (trimmed.equals("exit") || trimmed.startsWith("exit ") || trimmed.equals("logout")) {
            throw new IllegalArgumentException("命令 '" + trimmed + "' 会结束远程 shell 会话。");
        }
    }
}
