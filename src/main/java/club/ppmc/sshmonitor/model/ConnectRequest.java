/**
 * ConnectRequest.java
 *
 * POST /api/sessions 的请求体，封装会话名称和 SSH 目标。
 */
package club.ppmc.sshmonitor.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * @param name 调用方指定的唯一会话名称，不能包含空白字符或 '@'。
 * @param host 远程主机。
 * @param port 远程端口，为空时使用 22。
 * @param username 登录用户名。
 * @param password 密码（可选）。
 * @param privateKey 私钥文本（可选，优先于私钥文件和密码）。
 * @param privateKeyPath 私钥文件路径（可选，优先于密码），支持以 ~ 开头。
 * @param passphrase 私钥口令（可选）。
 */
public record ConnectRequest(
        @NotBlank @Pattern(regexp = "[^\\s@]+", message = "会话名称不能包含空白字符或 '@'") String name,
        @NotBlank String host,
        @Min(1) @Max(65535) Integer port,
        @NotBlank String username,
        String password,
        String privateKey,
        String privateKeyPath,
        String passphrase) {

    public SshTarget toTarget() {
        return SshTarget.builder()
                .host(host)
                .port(port != null ? port : 22)
                .username(username)
                .password(password)
                .privateKey(privateKey)
                .privateKeyPath(privateKeyPath)
                .passphrase(passphrase)
                .build();
    }
}
