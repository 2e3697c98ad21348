/**
 * TerminalSession.java
 *
 * 一个SSH终端会话：绑定一个远程通道、一个提示符匹配器、一个历史缓冲区（及其广播中心）和一个命令执行器，
 * 是生命周期管理和对外寻址的基本单位。
 *
 * <p>每个会话有一个读取任务，顺序地消费远程输出：匹配提示符、追加到历史、通知观察者和执行器都在同一条路径上完成，
 * 从而保证顺序。连接后会注入固定格式的提示符，初始化命令及其之前的所有输出都不进入历史，
 * 历史从第一个真实出现的注入提示符开始。
 */
package club.ppmc.sshmonitor.service;

import club.ppmc.sshmonitor.channel.RemoteChannel;
import club.ppmc.sshmonitor.channel.RemoteChannelFactory;
import club.ppmc.sshmonitor.config.SshSettings;
import club.ppmc.sshmonitor.exception.CommandTimeoutException;
import club.ppmc.sshmonitor.exception.SessionBusyException;
import club.ppmc.sshmonitor.exception.SessionClosedException;
import club.ppmc.sshmonitor.exception.SessionConnectException;
import club.ppmc.sshmonitor.history.HistoryBuffer;
import club.ppmc.sshmonitor.history.HistoryObserver;
import club.ppmc.sshmonitor.history.Subscription;
import club.ppmc.sshmonitor.model.CommandHistoryEntry;
import club.ppmc.sshmonitor.model.CommandResult;
import club.ppmc.sshmonitor.model.SessionState;
import club.ppmc.sshmonitor.model.SessionSummary;
import club.ppmc.sshmonitor.model.SshTarget;
import club.ppmc.sshmonitor.prompt.PromptBoundary;
import club.ppmc.sshmonitor.prompt.PromptMatcher;
import club.ppmc.sshmonitor.prompt.PromptTemplate;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class TerminalSession {

    /** 初始化阶段缓存的输出超过该大小时只保留末尾。 */
    private static final int PREAMBLE_LIMIT = 64 * 1024;

    private final String name;
    private final SshTarget target;
    private final Instant createdAt = Instant.now();
    private final SshSettings settings;
    private final RemoteChannelFactory channelFactory;
    private final ExecutorService readerPool;
    private final ScheduledExecutorService scheduler;

    private final PromptTemplate template;
    private final PromptMatcher matcher;
    private final HistoryBuffer history;
    private final Deque<CommandHistoryEntry> commandHistory = new ArrayDeque<>();
    private final String readyToken = UUID.randomUUID().toString().replace("-", "");
    private final CompletableFuture<Void> ready = new CompletableFuture<>();

    private volatile SessionState state = SessionState.CONNECTING;
    private volatile RemoteChannel channel;
    private volatile CommandExecutor executor;

    // 以下字段只由读取线程访问
    private boolean initialized;
    private final ByteArrayOutputStream preamble = new ByteArrayOutputStream();
    private long preambleStart;
    private long readyOffset = -1;

    public TerminalSession(
            String name,
            SshTarget target,
            SshSettings settings,
            RemoteChannelFactory channelFactory,
            ExecutorService readerPool,
            ScheduledExecutorService scheduler) {
        this.name = name;
        this.target = target;
        this.settings = settings;
        this.channelFactory = channelFactory;
        this.readerPool = readerPool;
        this.scheduler = scheduler;
        this.template = PromptTemplate.forTarget(target.getUsername(), target.getHost());
        this.matcher = new PromptMatcher(template);
        this.history = new HistoryBuffer(name);
    }

    /**
     * 打开远程通道，注入提示符格式，并等待第一个注入的提示符出现。
     *
     * @throws SessionConnectException 连接失败，或远程 shell 没有在期限内出现提示符。
     */
    public void open() {
        try {
            channel = channelFactory.open(name, target);
        } catch (SessionConnectException e) {
            state = SessionState.FAILED;
            throw e;
        }
        executor = new CommandExecutor(name, channel, template, scheduler, settings);
        readerPool.submit(this::readLoop);
        try {
            channel.write((template.initializationCommand(readyToken) + "\n").getBytes(StandardCharsets.UTF_8));
            ready.get(settings.getShellReadyTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (IOException | ExecutionException | TimeoutException e) {
            Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
            log.error("会话 {} 初始化远程 shell 失败: {}", name, cause.toString());
            fail(cause);
            throw new SessionConnectException(name, "远程 shell 初始化失败: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(e);
            throw new SessionConnectException(name, "等待远程 shell 初始化时被中断。", e);
        }
        synchronized (this) {
            if (state != SessionState.CONNECTING) {
                throw new SessionConnectException(name, "会话在初始化期间已被关闭。");
            }
            state = SessionState.READY;
        }
        log.info("会话 {} 已就绪，提示符格式: {}", name, template.render("<dir>", false));
    }

    /**
     * 在远程 shell 中执行一条命令。
     *
     * @param command 单行命令。
     * @param timeout 超时时间，为 null 时使用默认值。
     */
    public CompletableFuture<CommandResult> submit(String command, Duration timeout) {
        SessionState current = state;
        if (current == SessionState.CLOSING || current.isTerminal()) {
            throw new SessionClosedException(name);
        }
        if (current == SessionState.CONNECTING) {
            throw new SessionBusyException(name, "<shell 初始化>");
        }
        Instant startedAt = Instant.now();
        return executor.submit(command, timeout)
                .whenComplete((result, error) -> recordCommand(command, startedAt, result, error));
    }

    /**
     * 订阅终端历史：先回放，再实时推送。
     */
    public Subscription attach(HistoryObserver observer) {
        return history.hub().attach(observer);
    }

    public List<CommandHistoryEntry> commandHistory() {
        synchronized (commandHistory) {
            return List.copyOf(commandHistory);
        }
    }

    private void recordCommand(String command, Instant startedAt, CommandResult result, Throwable error) {
        CommandHistoryEntry entry;
        if (result != null) {
            entry = new CommandHistoryEntry(
                    command,
                    startedAt,
                    result.durationMs(),
                    result.exitCode(),
                    result.exitCode() == 0 ? CommandHistoryEntry.Status.SUCCESS : CommandHistoryEntry.Status.FAILURE);
        } else {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            entry = new CommandHistoryEntry(
                    command,
                    startedAt,
                    Duration.between(startedAt, Instant.now()).toMillis(),
                    -1,
                    cause instanceof CommandTimeoutException
                            ? CommandHistoryEntry.Status.TIMEOUT
                            : CommandHistoryEntry.Status.ERROR);
        }
        synchronized (commandHistory) {
            commandHistory.addLast(entry);
            while (commandHistory.size() > settings.getCommandHistorySize()) {
                commandHistory.removeFirst();
            }
        }
    }

    private void readLoop() {
        byte[] buffer = new byte[8192];
        int read;
        try (InputStream in = channel.readStream()) {
            while ((read = in.read(buffer)) != -1) {
                if (read > 0) {
                    onBytes(buffer, read);
                }
            }
            onStreamEnd(null);
        } catch (IOException | RuntimeException e) {
            onStreamEnd(e);
        } finally {
            log.info("会话 {} 的远程输出流已关闭。", name);
        }
    }

    /**
     * 处理一段远程输出：按提示符边界切分，每一段依次交给历史和执行器。
     */
    void onBytes(byte[] data, int length) {
        long base = matcher.offset();
        List<PromptBoundary> boundaries = matcher.feed(data, 0, length);
        int cursor = 0;
        for (PromptBoundary boundary : boundaries) {
            int end = (int) (boundary.end() - base);
            dispatch(data, cursor, end, boundary);
            cursor = end;
        }
        if (cursor < length) {
            dispatch(data, cursor, length, null);
        }
    }

    private void dispatch(byte[] data, int from, int to, PromptBoundary boundary) {
        if (!initialized) {
            collectPreamble(data, from, to, boundary);
            return;
        }
        byte[] segment = Arrays.copyOfRange(data, from, to);
        if (executor.offerPrivate(segment, boundary)) {
            return;
        }
        var chunk = history.append(segment, boundary != null);
        executor.onOutput(chunk, boundary);
    }

    /**
     * 初始化阶段：缓存输出，先等待就绪标记，再等待其后的第一个提示符。
     * 该提示符作为历史的第一个片段，之前的横幅、旧提示符和初始化命令的回显全部丢弃。
     */
    private void collectPreamble(byte[] data, int from, int to, PromptBoundary boundary) {
        preamble.write(data, from, to - from);
        if (readyOffset < 0) {
            String marker = template.readyMarker(readyToken);
            int index = preamble.toString(StandardCharsets.ISO_8859_1).indexOf(marker);
            if (index >= 0) {
                readyOffset = preambleStart + index + marker.length();
            }
        }
        if (boundary != null && readyOffset >= 0 && boundary.start() >= readyOffset) {
            byte[] buffered = preamble.toByteArray();
            int promptFrom = (int) (boundary.start() - preambleStart);
            preamble.reset();
            initialized = true;
            history.append(Arrays.copyOfRange(buffered, promptFrom, buffered.length), true);
            ready.complete(null);
            return;
        }
        if (preamble.size() > PREAMBLE_LIMIT) {
            byte[] buffered = preamble.toByteArray();
            int keep = template.maxLength() + 64;
            preamble.reset();
            preamble.write(buffered, buffered.length - keep, keep);
            preambleStart += buffered.length - keep;
        }
    }

    private void onStreamEnd(Throwable error) {
        SessionState current = state;
        if (current == SessionState.CLOSING || current.isTerminal()) {
            return;
        }
        Throwable cause = error != null ? error : new EOFException("远程 shell 已关闭输出流");
        log.warn("会话 {} 的远程通道意外结束: {}", name, cause.toString());
        fail(cause);
    }

    private void fail(Throwable cause) {
        synchronized (this) {
            if (state == SessionState.CLOSING || state.isTerminal()) {
                return;
            }
            state = SessionState.FAILED;
        }
        ready.completeExceptionally(cause);
        if (executor != null) {
            executor.shutdown(new SessionClosedException(name, cause));
        }
        history.hub().fail(cause);
        if (channel != null) {
            channel.close();
        }
    }

    /**
     * 关闭会话：等待正在执行的命令结束（最多 app.ssh.close-timeout-ms），然后强制关闭通道，
     * 并向所有观察者发出流结束信号。幂等。
     */
    public void close() {
        synchronized (this) {
            if (state == SessionState.CLOSING || state.isTerminal()) {
                return;
            }
            state = SessionState.CLOSING;
        }
        log.info("正在关闭会话 {}。", name);
        if (executor != null) {
            if (!executor.awaitIdle(settings.getCloseTimeoutMs())) {
                log.warn("会话 {} 的命令 '{}' 在关闭期限内没有结束，将强制关闭。",
                        name, executor.currentCommand().orElse(""));
            }
            executor.shutdown(new SessionClosedException(name));
        }
        if (channel != null) {
            channel.close();
        }
        ready.completeExceptionally(new SessionClosedException(name));
        history.hub().close();
        synchronized (this) {
            state = SessionState.CLOSED;
        }
    }

    /**
     * @return 当前状态；就绪且有命令在执行时为 EXECUTING。
     */
    public SessionState getState() {
        SessionState current = state;
        if (current == SessionState.READY && executor != null && executor.isBusy()) {
            return SessionState.EXECUTING;
        }
        return current;
    }

    public SessionSummary summary() {
        return new SessionSummary(name, getState(), createdAt, target.getHost(), target.getUsername());
    }

    public String getName() {
        return name;
    }

    public HistoryBuffer getHistory() {
        return history;
    }
}
