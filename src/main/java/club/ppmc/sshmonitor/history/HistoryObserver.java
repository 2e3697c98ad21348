/**
 * HistoryObserver.java
 *
 * 会话终端历史的订阅者。先收到完整的历史回放，然后按序列号顺序收到实时追加的片段。
 * 对同一个观察者的回调总是串行的；会话结束时一定会收到 onComplete 或 onError 之一。
 */
package club.ppmc.sshmonitor.history;

import club.ppmc.sshmonitor.model.OutputChunk;

public interface HistoryObserver {

    void onChunk(OutputChunk chunk);

    /** 会话正常关闭，不会再有新的片段。 */
    default void onComplete() {}

    /** 会话因远程通道错误而失败，不会再有新的片段。 */
    default void onError(Throwable cause) {}
}
