/**
 * SessionController.java
 *
 * 该控制器处理SSH会话的HTTP请求：连接、列出、执行命令、断开，以及查询终端历史和命令历史。
 * 所有操作都委托给 SessionRegistry；会话错误被转换为带有错误类型的结构化JSON响应。
 */
package club.ppmc.sshmonitor.controller;

import club.ppmc.sshmonitor.exception.SessionException;
import club.ppmc.sshmonitor.model.CommandHistoryEntry;
import club.ppmc.sshmonitor.model.CommandResult;
import club.ppmc.sshmonitor.model.ConnectRequest;
import club.ppmc.sshmonitor.model.ExecRequest;
import club.ppmc.sshmonitor.model.OutputChunk;
import club.ppmc.sshmonitor.model.SessionSummary;
import club.ppmc.sshmonitor.service.SessionRegistry;
import jakarta.validation.Valid;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
@Slf4j
public class SessionController {

    private final SessionRegistry sessionRegistry;

    public SessionController(SessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    /**
     * 创建一个会话并等待远程 shell 就绪。
     */
    @PostMapping
    public ResponseEntity<SessionSummary> connect(@Valid @RequestBody ConnectRequest request) {
        log.info("收到会话 {} 的连接请求: {}@{}", request.name(), request.username(), request.host());
        return ResponseEntity.ok(sessionRegistry.connect(request.name(), request.toTarget()));
    }

    @GetMapping
    public ResponseEntity<List<SessionSummary>> listSessions() {
        return ResponseEntity.ok(sessionRegistry.listSessions());
    }

    /**
     * 在会话中执行一条命令并返回 {stdout, exitCode, durationMs}。
     */
    @PostMapping("/{name}/exec")
    public ResponseEntity<Map<String, Object>> exec(
            @PathVariable String name, @Valid @RequestBody ExecRequest request) {
        Duration timeout = request.timeoutMs() != null ? Duration.ofMillis(request.timeoutMs()) : null;
        CommandResult result = sessionRegistry.exec(name, request.command(), timeout);
        return ResponseEntity.ok(Map.of(
                "stdout", result.stdout(),
                "exitCode", result.exitCode(),
                "durationMs", result.durationMs()));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Map<String, Boolean>> disconnect(@PathVariable String name) {
        return ResponseEntity.ok(Map.of("success", sessionRegistry.disconnect(name)));
    }

    /**
     * 获取会话的终端历史。每个片段的 data 为 Base64 编码的原始字节，text 为整段历史的 UTF-8 文本。
     *
     * @param from 起始序列号（含），默认从0开始。
     */
    @GetMapping("/{name}/history")
    public ResponseEntity<Map<String, Object>> history(
            @PathVariable String name, @RequestParam(defaultValue = "0") long from) {
        List<OutputChunk> chunks = sessionRegistry.history(name, from);
        var encoder = Base64.getEncoder();
        // 多字节字符可能跨片段，拼接后再统一解码
        var text = new ByteArrayOutputStream();
        List<Map<String, Object>> body = chunks.stream()
                .map(chunk -> {
                    text.writeBytes(chunk.bytes());
                    return Map.<String, Object>of(
                            "sequence", chunk.sequence(),
                            "data", encoder.encodeToString(chunk.bytes()),
                            "promptBoundary", chunk.promptBoundary());
                })
                .toList();
        return ResponseEntity.ok(Map.of("sessionName", name, "chunks", body, "text", text.toString(StandardCharsets.UTF_8)));
    }

    @GetMapping("/{name}/commands")
    public ResponseEntity<List<CommandHistoryEntry>> commandHistory(@PathVariable String name) {
        return ResponseEntity.ok(sessionRegistry.commandHistory(name));
    }

    @ExceptionHandler(SessionException.class)
    public ResponseEntity<Map<String, Object>> handleSessionException(SessionException e) {
        log.warn("会话请求失败 [{}]: {}", e.getType(), e.getMessage());
        return ResponseEntity.status(e.getType().httpStatus()).body(e.toErrorData());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(Map.of("type", "INVALID_REQUEST", "message", String.valueOf(e.getMessage())));
    }
}
