/**
 * SessionRegistry.java
 *
 * 进程范围内唯一的会话注册表，按名称管理所有SSH终端会话。
 * 它有显式的 init/shutdown 生命周期，并以引用的方式注入到 Controller 层，而不是作为全局状态访问。
 * 对外提供 connect、exec、listSessions、disconnect 和 attachMonitor 等操作。
 */
package club.ppmc.sshmonitor.service;

import club.ppmc.sshmonitor.channel.RemoteChannelFactory;
import club.ppmc.sshmonitor.config.SshSettings;
import club.ppmc.sshmonitor.exception.SessionException;
import club.ppmc.sshmonitor.exception.SessionNotFoundException;
import club.ppmc.sshmonitor.history.HistoryObserver;
import club.ppmc.sshmonitor.history.Subscription;
import club.ppmc.sshmonitor.model.CommandHistoryEntry;
import club.ppmc.sshmonitor.model.CommandResult;
import club.ppmc.sshmonitor.model.OutputChunk;
import club.ppmc.sshmonitor.model.SessionSummary;
import club.ppmc.sshmonitor.model.SshTarget;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class SessionRegistry {

    private final RemoteChannelFactory channelFactory;
    private final SshSettings settings;
    private final Map<String, TerminalSession> sessions = new ConcurrentHashMap<>();
    private ExecutorService readerPool;
    private ScheduledExecutorService scheduler;

    public SessionRegistry(RemoteChannelFactory channelFactory, SshSettings settings) {
        this.channelFactory = channelFactory;
        this.settings = settings;
    }

    @PostConstruct
    public void init() {
        readerPool = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        log.info("会话注册表已初始化。");
    }

    /**
     * 创建并连接一个新会话。同名的会话只有在已经关闭或失败时才会被替换。
     *
     * @return 就绪后的会话概要。
     * @throws IllegalArgumentException 会话名称无效或已存在。
     */
    public SessionSummary connect(String name, SshTarget target) {
        validateSessionName(name);
        var session = new TerminalSession(name, target, settings, channelFactory, readerPool, scheduler);
        TerminalSession existing = sessions.putIfAbsent(name, session);
        if (existing != null) {
            if (!existing.getState().isTerminal() || !sessions.replace(name, existing, session)) {
                throw new IllegalArgumentException("会话 '" + name + "' 已存在。");
            }
            log.info("替换已结束的会话 {}", name);
        }
        try {
            session.open();
        } catch (RuntimeException e) {
            sessions.remove(name, session);
            throw e;
        }
        return session.summary();
    }

    /**
     * 异步提交一条命令。
     */
    public CompletableFuture<CommandResult> submit(String name, String command, Duration timeout) {
        return get(name).submit(command, timeout);
    }

    /**
     * 执行一条命令并等待结果。
     *
     * @throws SessionException 会话忙、超时、已关闭等。
     */
    public CommandResult exec(String name, String command, Duration timeout) {
        CompletableFuture<CommandResult> future = submit(name, command, timeout);
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("等待命令 '" + command + "' 的结果时被中断。", e);
        }
    }

    public List<SessionSummary> listSessions() {
        return sessions.values().stream()
                .map(TerminalSession::summary)
                .sorted(Comparator.comparing(SessionSummary::createdAt))
                .toList();
    }

    /**
     * 关闭并移除会话。
     *
     * @return 会话存在并已关闭时返回 true。
     * @throws SessionNotFoundException 会话不存在。
     */
    public boolean disconnect(String name) {
        TerminalSession session = sessions.remove(name);
        if (session == null) {
            throw new SessionNotFoundException(name);
        }
        session.close();
        log.info("会话 {} 已断开。", name);
        return true;
    }

    /**
     * 以观察者身份订阅会话的终端历史。
     */
    public Subscription attachMonitor(String name, HistoryObserver observer) {
        return get(name).attach(observer);
    }

    /**
     * @return 从给定序列号（含）开始的终端历史片段。
     */
    public List<OutputChunk> history(String name, long fromSequence) {
        return get(name).getHistory().replayFrom(fromSequence);
    }

    public List<CommandHistoryEntry> commandHistory(String name) {
        return get(name).commandHistory();
    }

    public TerminalSession get(String name) {
        TerminalSession session = name != null ? sessions.get(name) : null;
        if (session == null) {
            throw new SessionNotFoundException(name);
        }
        return session;
    }

    private static void validateSessionName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("会话名称不能为空。");
        }
        if (name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("会话名称不能包含空白字符。");
        }
        if (name.contains("@")) {
            throw new IllegalArgumentException("会话名称不能包含 '@' 字符。");
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭会话注册表，将断开 {} 个会话。", sessions.size());
        sessions.keySet().forEach(name -> {
            TerminalSession session = sessions.remove(name);
            if (session != null) {
                session.close();
            }
        });
        scheduler.shutdownNow();
        readerPool.shutdown();
        try {
            if (!readerPool.awaitTermination(1, TimeUnit.SECONDS)) {
                readerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            readerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
