package club.ppmc.sshmonitor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.sshmonitor.channel.ScriptedShellFactory;
import club.ppmc.sshmonitor.config.SshSettings;
import club.ppmc.sshmonitor.exception.SessionClosedException;
import club.ppmc.sshmonitor.exception.SessionConnectException;
import club.ppmc.sshmonitor.exception.SessionNotFoundException;
import club.ppmc.sshmonitor.model.CommandHistoryEntry;
import club.ppmc.sshmonitor.model.CommandResult;
import club.ppmc.sshmonitor.model.SessionState;
import club.ppmc.sshmonitor.model.SessionSummary;
import club.ppmc.sshmonitor.model.SshTarget;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionRegistryTest {

    private final ScriptedShellFactory factory = new ScriptedShellFactory();
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        var settings = new SshSettings();
        settings.setShellReadyTimeoutMs(3_000);
        settings.setCommandTimeoutMs(3_000);
        settings.setCloseTimeoutMs(500);
        registry = new SessionRegistry(factory, settings);
        registry.init();
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    private static SshTarget target(String host, String user) {
        return SshTarget.builder().host(host).username(user).password("secret").build();
    }

    @Test
    void shouldConnectAndExecuteByName() {
        SessionSummary summary = registry.connect("web", target("web01", "alice"));

        assertThat(summary.name()).isEqualTo("web");
        assertThat(summary.status()).isEqualTo(SessionState.READY);
        CommandResult result = registry.exec("web", "echo \"testing terminal fix\"", null);
        assertThat(result.stdout()).isEqualTo("testing terminal fix\r\n");
        assertThat(result.durationMs()).isNotNegative();
    }

    @Test
    void shouldKeepSessionsIndependent() {
        registry.connect("web", target("web01", "alice"));
        registry.connect("db", target("db01", "root"));

        registry.exec("web", "cd /var", null);

        assertThat(registry.exec("db", "whoami", null).stdout()).isEqualTo("root\r\n");
        assertThat(registry.get("db").getHistory().replay().get(0).text()).isEqualTo("[root@db01 ~]# ");
        assertThat(registry.listSessions()).extracting(SessionSummary::name).containsExactlyInAnyOrder("web", "db");
    }

    @Test
    void shouldRejectDuplicateOrInvalidNames() {
        registry.connect("web", target("web01", "alice"));

        assertThatThrownBy(() -> registry.connect("web", target("web02", "alice")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.connect("my web", target("web01", "alice")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.connect("alice@web", target("web01", "alice")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.connect("", target("web01", "alice")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldNotRegisterSessionsThatFailToConnect() {
        assertThatThrownBy(() -> registry.connect("web", target("unreachable", "alice")))
                .isInstanceOf(SessionConnectException.class);

        assertThat(registry.listSessions()).isEmpty();
        assertThat(registry.connect("web", target("web01", "alice")).status()).isEqualTo(SessionState.READY);
    }

    @Test
    void shouldRemoveSessionOnDisconnect() {
        registry.connect("web", target("web01", "alice"));
        TerminalSession session = registry.get("web");

        assertThat(registry.disconnect("web")).isTrue();

        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThatThrownBy(() -> session.submit("whoami", null)).isInstanceOf(SessionClosedException.class);
        assertThatThrownBy(() -> registry.exec("web", "whoami", null)).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> registry.disconnect("web")).isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void shouldReplaceSessionThatHasFailed() throws Exception {
        registry.connect("web", target("web01", "alice"));
        factory.channel("web").dropConnection();
        TerminalSession failed = registry.get("web");
        long deadline = System.currentTimeMillis() + 5_000;
        while (failed.getState() != SessionState.FAILED && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertThat(registry.connect("web", target("web01", "alice")).status()).isEqualTo(SessionState.READY);
        assertThat(registry.get("web")).isNotSameAs(failed);
    }

    @Test
    void shouldExposeCommandHistory() throws Exception {
        registry.connect("web", target("web01", "alice"));
        CompletableFuture<CommandResult> pending = registry.submit("web", "false", null);
        pending.get();

        assertThat(registry.commandHistory("web"))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.command()).isEqualTo("false");
                    assertThat(entry.status()).isEqualTo(CommandHistoryEntry.Status.FAILURE);
                });
        assertThat(registry.history("web", 0)).isNotEmpty();
    }

    @Test
    void shouldFailLookupsForUnknownSessions() {
        assertThatThrownBy(() -> registry.get("nope")).isInstanceOf(SessionNotFoundException.class);
        assertThatThrownBy(() -> registry.attachMonitor("nope", chunk -> {}))
                .isInstanceOf(SessionNotFoundException.class);
    }
}
