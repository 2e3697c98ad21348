/**
 * RemoteChannel.java
 *
 * 一个到远程 shell 的已连接、已认证的双工字节通道。
 * 写入的是原始输入字节，readStream() 返回远程 shell 的原始输出字节流，
 * 通道关闭或出错时该流结束（返回 -1 或抛出 IOException）。
 */
package club.ppmc.sshmonitor.channel;

import java.io.IOException;
import java.io.InputStream;

public interface RemoteChannel extends AutoCloseable {

    /**
     * 将原始字节写入远程 shell 的输入端并立即刷新。
     */
    void write(byte[] data) throws IOException;

    /**
     * @return 远程输出的字节流。整个通道生命周期内只应被一个读取者消费。
     */
    InputStream readStream();

    /**
     * 关闭通道，幂等。
     */
    @Override
    void close();
}
