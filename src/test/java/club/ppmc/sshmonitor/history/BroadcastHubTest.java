package club.ppmc.sshmonitor.history;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.sshmonitor.model.OutputChunk;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * 回放与实时推送的衔接测试
 */
class BroadcastHubTest {

    private final HistoryBuffer buffer = new HistoryBuffer("test");
    private final BroadcastHub hub = buffer.hub();
    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private void append(String text) {
        buffer.append(text.getBytes(StandardCharsets.UTF_8), false);
    }

    @Test
    void shouldReplayThenDeliverLiveChunks() {
        append("a");
        append("b");
        var observer = new RecordingObserver();

        Subscription subscription = hub.attach(observer);
        append("c");

        assertThat(observer.sequences()).containsExactly(0L, 1L, 2L);
        assertThat(subscription.lastDeliveredSequence()).isEqualTo(2);
        assertThat(hub.subscriberCount()).isEqualTo(1);
    }

    @Test
    void shouldDeliverEveryChunkExactlyOnceWhenAttachingDuringAppends() throws Exception {
        int total = 2_000;
        var start = new CountDownLatch(1);
        Future<?> writer = pool.submit(() -> {
            start.await();
            for (int i = 0; i < total; i++) {
                append("chunk" + i);
            }
            return null;
        });
        List<RecordingObserver> observers = new ArrayList<>();
        List<Future<?>> attaches = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            var observer = new RecordingObserver();
            observers.add(observer);
            attaches.add(pool.submit(() -> {
                start.await();
                Thread.sleep(1);
                return hub.attach(observer);
            }));
        }

        start.countDown();
        writer.get(10, TimeUnit.SECONDS);
        for (Future<?> attach : attaches) {
            attach.get(10, TimeUnit.SECONDS);
        }

        List<Long> expected = LongStream.range(0, total).boxed().toList();
        for (RecordingObserver observer : observers) {
            assertThat(observer.sequences()).isEqualTo(expected);
        }
    }

    @Test
    void shouldReplayIdenticalHistoryAfterDetachAndReattach() {
        append("[alice@web01 ~]$ ");
        var first = new RecordingObserver();
        Subscription subscription = hub.attach(first);
        append("pwd\r\n/home/alice\r\n");
        subscription.detach();
        subscription.detach();
        append("[alice@web01 ~]$ ");

        var second = new RecordingObserver();
        hub.attach(second);

        assertThat(first.sequences()).containsExactly(0L, 1L);
        assertThat(subscription.isActive()).isFalse();
        assertThat(second.chunks).isEqualTo(buffer.replay());
        assertThat(second.chunks.subList(0, 2)).isEqualTo(first.chunks);
    }

    @Test
    void shouldSignalEndToSubscribersWhenClosed() {
        var observer = new RecordingObserver();
        Subscription subscription = hub.attach(observer);

        hub.close();
        hub.close();

        assertThat(observer.completed).isTrue();
        assertThat(observer.error).isNull();
        assertThat(subscription.isActive()).isFalse();
        assertThat(hub.subscriberCount()).isZero();
    }

    @Test
    void shouldReplayOnceThenEndWhenAttachingToClosedHub() {
        append("a");
        append("b");
        hub.close();
        var observer = new RecordingObserver();

        Subscription subscription = hub.attach(observer);

        assertThat(observer.sequences()).containsExactly(0L, 1L);
        assertThat(observer.completed).isTrue();
        assertThat(subscription.isActive()).isFalse();
        assertThat(hub.subscriberCount()).isZero();
    }

    @Test
    void shouldPropagateFailureToCurrentAndLateSubscribers() {
        var early = new RecordingObserver();
        hub.attach(early);
        var cause = new IOException("connection reset");

        hub.fail(cause);
        var late = new RecordingObserver();
        hub.attach(late);

        assertThat(early.error).isSameAs(cause);
        assertThat(late.error).isSameAs(cause);
        assertThat(late.completed).isFalse();
    }

    @Test
    void shouldRemoveObserverThatThrowsWithoutAffectingOthers() {
        var healthy = new RecordingObserver();
        hub.attach(healthy);
        hub.attach(new HistoryObserver() {
            @Override
            public void onChunk(OutputChunk chunk) {
                throw new IllegalStateException("client went away");
            }
        });

        append("a");
        append("b");

        assertThat(healthy.sequences()).containsExactly(0L, 1L);
        assertThat(hub.subscriberCount()).isEqualTo(1);
    }
}
