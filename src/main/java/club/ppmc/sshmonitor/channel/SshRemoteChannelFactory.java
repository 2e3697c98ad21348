/**
 * SshRemoteChannelFactory.java
 *
 * 基于 Apache MINA SSHD 的远程通道工厂。
 * 它在应用启动时创建并启动一个共享的 SshClient，为每个会话建立一个 ClientSession 和一个带伪终端的 shell 通道。
 * 输入回显只由远程伪终端产生，本地不做任何回显或换行转换。
 */
package club.ppmc.sshmonitor.channel;

import club.ppmc.sshmonitor.config.SshSettings;
import club.ppmc.sshmonitor.exception.SessionConnectException;
import club.ppmc.sshmonitor.model.SshTarget;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import lombok.extern.slf4j.Slf4j;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.channel.ChannelShell;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.NamedResource;
import org.apache.sshd.common.config.keys.FilePasswordProvider;
import org.apache.sshd.common.keyprovider.FileKeyPairProvider;
import org.apache.sshd.common.util.security.SecurityUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@Slf4j
public class SshRemoteChannelFactory implements RemoteChannelFactory {

    private final SshSettings settings;
    private SshClient client;

    public SshRemoteChannelFactory(SshSettings settings) {
        this.settings = settings;
    }

    @PostConstruct
    public void start() {
        client = SshClient.setUpDefaultClient();
        // 主机密钥校验不在本服务的职责范围内
        client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
        client.start();
        log.info("SSH 客户端已启动。");
    }

    @Override
    public RemoteChannel open(String sessionName, SshTarget target) {
        if (client == null || !client.isStarted()) {
            throw new SessionConnectException(sessionName, "SSH 客户端尚未启动。");
        }
        long startTime = System.currentTimeMillis();
        ClientSession session = null;
        try {
            log.debug("会话 {} 正在连接 {}@{}:{}", sessionName, target.getUsername(), target.getHost(), target.getPort());
            session = client.connect(target.getUsername(), target.getHost(), target.getPort())
                    .verify(settings.getConnectTimeoutMs())
                    .getSession();

            addIdentity(session, target);
            session.auth().verify(settings.getAuthTimeoutMs());

            ChannelShell shell = session.createShellChannel();
            shell.setPtyType(settings.getPtyType());
            shell.setPtyColumns(settings.getPtyColumns());
            shell.setPtyLines(settings.getPtyLines());
            shell.open().verify(settings.getConnectTimeoutMs());

            log.info("会话 {} 已在 {} ms 内建立到 {} 的 shell 通道",
                    sessionName, System.currentTimeMillis() - startTime, target.getHost());
            return new SshRemoteChannel(session, shell);
        } catch (IOException | GeneralSecurityException e) {
            log.error("会话 {} 连接 {}:{} 失败: {}", sessionName, target.getHost(), target.getPort(), e.getMessage());
            if (session != null) {
                session.close(true);
            }
            throw new SessionConnectException(
                    sessionName, "无法连接到 " + target.getHost() + ": " + e.getMessage(), e);
        }
    }

    /**
     * 凭据优先级：内联私钥 > 私钥文件 > 密码。
     */
    private void addIdentity(ClientSession session, SshTarget target)
            throws IOException, GeneralSecurityException {
        FilePasswordProvider passwordProvider = StringUtils.hasText(target.getPassphrase())
                ? FilePasswordProvider.of(target.getPassphrase())
                : FilePasswordProvider.EMPTY;
        if (StringUtils.hasText(target.getPrivateKey())) {
            Iterable<KeyPair> keyPairs;
            try (InputStream in = new ByteArrayInputStream(target.getPrivateKey().getBytes(StandardCharsets.UTF_8))) {
                keyPairs = SecurityUtils.loadKeyPairIdentities(
                        session, NamedResource.ofName("inline-key"), in, passwordProvider);
            }
            addKeyPairs(session, keyPairs, "内联私钥");
        } else if (StringUtils.hasText(target.getPrivateKeyPath())) {
            var keyProvider = new FileKeyPairProvider(Paths.get(expandHome(target.getPrivateKeyPath())));
            keyProvider.setPasswordFinder(passwordProvider);
            addKeyPairs(session, keyProvider.loadKeys(session), target.getPrivateKeyPath());
        } else if (target.getPassword() != null) {
            session.addPasswordIdentity(target.getPassword());
        }
    }

    private static void addKeyPairs(ClientSession session, Iterable<KeyPair> keyPairs, String source)
            throws GeneralSecurityException {
        int count = 0;
        if (keyPairs != null) {
            for (KeyPair keyPair : keyPairs) {
                session.addPublicKeyIdentity(keyPair);
                count++;
            }
        }
        if (count == 0) {
            throw new GeneralSecurityException("未能从" + source + "中读取任何密钥");
        }
    }

    /** 将开头的 ~ 展开为当前用户的主目录。 */
    static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }

    @PreDestroy
    public void stop() {
        if (client != null) {
            log.info("正在关闭 SSH 客户端。");
            client.stop();
        }
    }

    /** 一个 ClientSession 加上其上的 shell 通道。关闭通道时一并关闭 SSH 会话。 */
    private static final class SshRemoteChannel implements RemoteChannel {

        private final ClientSession session;
        private final ChannelShell shell;
        private final OutputStream input;

        SshRemoteChannel(ClientSession session, ChannelShell shell) {
            this.session = session;
            this.shell = shell;
            this.input = shell.getInvertedIn();
        }

        @Override
        public synchronized void write(byte[] data) throws IOException {
            input.write(data);
            input.flush();
        }

        @Override
        public InputStream readStream() {
            return shell.getInvertedOut();
        }

        @Override
        public void close() {
            shell.close(true);
            session.close(true);
        }
    }
}
