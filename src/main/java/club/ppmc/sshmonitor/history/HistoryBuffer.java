/**
 * HistoryBuffer.java
 *
 * 一个会话终端输出的权威、有序记录，用于回放和实时推送。
 * 它是只追加的：每次 append 分配下一个序列号（从0开始，无间隙、不复用），
 * 并在返回之前同步通知 BroadcastHub，因此已订阅的观察者永远不会落后于缓冲区本身。
 * 字节按远程通道发出的样子保存，这一层不做换行转换，也从不追加本地回显或合成的提示符。
 */
package club.ppmc.sshmonitor.history;

import club.ppmc.sshmonitor.model.OutputChunk;
import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

public class HistoryBuffer {

    private final Object monitor = new Object();
    private final List<OutputChunk> chunks = new ArrayList<>();
    private final BroadcastHub hub;
    private final Clock clock;
    private long totalBytes;

    public HistoryBuffer(String sessionName) {
        this(sessionName, Clock.systemUTC());
    }

    public HistoryBuffer(String sessionName, Clock clock) {
        this.clock = clock;
        this.hub = new BroadcastHub(sessionName, this);
    }

    /**
     * 追加一段输出并通知所有当前的观察者。
     *
     * @param bytes 原始字节，会被复制。
     * @param promptBoundary 该片段是否以一个已确认的提示符结束。
     * @return 新追加的片段。
     */
    public OutputChunk append(byte[] bytes, boolean promptBoundary) {
        synchronized (monitor) {
            var chunk = new OutputChunk(chunks.size(), bytes, promptBoundary, clock.instant());
            chunks.add(chunk);
            totalBytes += chunk.length();
            hub.publish(chunk);
            return chunk;
        }
    }

    /**
     * @return 从序列号0到最新的全部片段，按顺序排列。
     */
    public List<OutputChunk> replay() {
        synchronized (monitor) {
            return List.copyOf(chunks);
        }
    }

    /**
     * @return 从给定序列号（含）开始的片段。
     */
    public List<OutputChunk> replayFrom(long sequence) {
        synchronized (monitor) {
            int from = (int) Math.max(0, Math.min(sequence, chunks.size()));
            return new ArrayList<>(chunks.subList(from, chunks.size()));
        }
    }

    /**
     * @return 全部历史拼接后的字节。
     */
    public byte[] snapshot() {
        synchronized (monitor) {
            var out = new ByteArrayOutputStream((int) Math.min(totalBytes, Integer.MAX_VALUE));
            for (OutputChunk chunk : chunks) {
                out.writeBytes(chunk.bytes());
            }
            return out.toByteArray();
        }
    }

    public int size() {
        synchronized (monitor) {
            return chunks.size();
        }
    }

    /**
     * @return 最新片段的序列号；为空时为 -1。
     */
    public long lastSequence() {
        synchronized (monitor) {
            return chunks.size() - 1L;
        }
    }

    public long totalBytes() {
        synchronized (monitor) {
            return totalBytes;
        }
    }

    public BroadcastHub hub() {
        return hub;
    }

    Object monitor() {
        return monitor;
    }
}
