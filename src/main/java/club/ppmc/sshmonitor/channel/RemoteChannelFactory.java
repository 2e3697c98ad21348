/**
 * RemoteChannelFactory.java
 *
 * 打开远程通道的工厂。生产环境使用 SshRemoteChannelFactory，测试中可以替换为内存中的模拟 shell。
 */
package club.ppmc.sshmonitor.channel;

import club.ppmc.sshmonitor.exception.SessionConnectException;
import club.ppmc.sshmonitor.model.SshTarget;

public interface RemoteChannelFactory {

    /**
     * 连接、认证并打开一个交互式 shell 通道。
     *
     * @param sessionName 发起连接的会话名称，仅用于错误信息和日志。
     * @param target 连接目标和凭据。
     * @return 已打开的通道。
     * @throws SessionConnectException 传输或认证失败。
     */
    RemoteChannel open(String sessionName, SshTarget target);
}
