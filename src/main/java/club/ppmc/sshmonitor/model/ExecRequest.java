/**
 * ExecRequest.java
 *
 * POST /api/sessions/{name}/exec 的请求体。
 */
package club.ppmc.sshmonitor.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * @param command 要执行的单行命令。
 * @param timeoutMs 超时时间（毫秒），为空时使用配置的默认值。
 */
public record ExecRequest(@NotBlank String command, @Positive Long timeoutMs) {}
