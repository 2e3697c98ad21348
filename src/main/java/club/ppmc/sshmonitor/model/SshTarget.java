/**
 * SshTarget.java
 *
 * 描述一个 SSH 连接目标以及登录所需的凭据。
 * 认证细节完全交给 SSH 库处理：优先使用内联私钥 privateKey，其次是私钥文件 privateKeyPath，最后是密码。
 */
package club.ppmc.sshmonitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SshTarget {

    private String host;

    @Builder.Default
    private int port = 22;

    private String username;

    @ToString.Exclude
    private String password;

    /** PEM 或 OpenSSH 格式的私钥文本。 */
    @ToString.Exclude
    private String privateKey;

    private String privateKeyPath;

    @ToString.Exclude
    private String passphrase;
}
