package club.ppmc.sshmonitor.channel;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 内存中的模拟 bash：像真实的 pty 一样回显输入行（以 CRLF 结尾），执行一小组命令，并在每条命令后输出提示符。
 *
 * <p>支持 echo、pwd、whoami、true、false、cd、printf '%s%s\n'、sleep（单位为毫秒）以及初始化命令中的 PS1 赋值。
 * sleep 期间输入的行会被缓存，直到 sleep 结束后再处理。
 */
public class ScriptedShellChannel implements RemoteChannel {

    private static final byte[] EOF = new byte[0];
    private static final Pattern PS1_PATTERN = Pattern.compile("PS1='\\[([^@]+)@([^ ]+) ");
    private static final Pattern PRINTF_PATTERN = Pattern.compile("printf '%s%s\\\\n' (\\S+) (\\S+)");

    private final String user;
    private final BlockingQueue<byte[]> output = new LinkedBlockingQueue<>();
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private final StringBuilder lineBuffer = new StringBuilder();
    private final Deque<String> typeahead = new ArrayDeque<>();
    private final List<String> received = new ArrayList<>();

    private volatile boolean open = true;
    private volatile boolean splitBytes;
    private String promptUser;
    private String promptHost;
    private String directory = "~";
    private int lastStatus;
    private boolean sleeping;

    public ScriptedShellChannel(String user) {
        this.user = user;
        emit("Last login: Mon Oct 19 09:00:00 2026 from 10.0.0.1\r\n");
        emit(user + "@remote:~$ ");
    }

    /** 之后的每个输出字节都作为单独的一次读取交付。 */
    public ScriptedShellChannel splitBytes() {
        this.splitBytes = true;
        return this;
    }

    @Override
    public synchronized void write(byte[] data) throws IOException {
        if (!open) {
            throw new IOException("channel closed");
        }
        for (char c : new String(data, StandardCharsets.UTF_8).toCharArray()) {
            if (c == '\n') {
                String line = lineBuffer.toString();
                lineBuffer.setLength(0);
                received.add(line);
                if (sleeping) {
                    typeahead.addLast(line);
                } else {
                    execute(line);
                }
            } else {
                lineBuffer.append(c);
            }
        }
    }

    private void execute(String line) {
        emit(line + "\r\n");
        String command = line.trim();
        if (command.startsWith("unset PROMPT_COMMAND")) {
            Matcher ps1 = PS1_PATTERN.matcher(command);
            if (ps1.find()) {
                promptUser = ps1.group(1);
                promptHost = ps1.group(2);
            }
            printf(command);
        } else if (command.startsWith("printf ")) {
            printf(command);
        } else if (command.startsWith("echo")) {
            emit(command.substring(4).trim().replace("\"", "").replace("'", "") + "\r\n");
            lastStatus = 0;
        } else if (command.equals("pwd")) {
            emit((directory.equals("~") ? "/home/" + user : directory) + "\r\n");
            lastStatus = 0;
        } else if (command.equals("whoami")) {
            emit(user + "\r\n");
            lastStatus = 0;
        } else if (command.equals("true")) {
            lastStatus = 0;
        } else if (command.equals("false")) {
            lastStatus = 1;
        } else if (command.startsWith("cd ")) {
            String target = command.substring(3).trim();
            directory = target.equals("/") ? "/" : target.substring(target.lastIndexOf('/') + 1);
            lastStatus = 0;
        } else if (command.startsWith("sleep ")) {
            sleeping = true;
            long millis = Long.parseLong(command.substring(6).trim());
            timer.schedule(this::wakeUp, millis, TimeUnit.MILLISECONDS);
            return;
        } else {
            emit("bash: " + command.split(" ")[0] + ": command not found\r\n");
            lastStatus = 127;
        }
        emit(prompt());
    }

    private synchronized void wakeUp() {
        sleeping = false;
        lastStatus = 0;
        emit(prompt());
        while (!sleeping && !typeahead.isEmpty()) {
            execute(typeahead.removeFirst());
        }
    }

    private void printf(String command) {
        Matcher matcher = PRINTF_PATTERN.matcher(command);
        if (matcher.find()) {
            String second = matcher.group(2).equals("$?") ? String.valueOf(lastStatus) : matcher.group(2);
            emit(matcher.group(1) + second + "\r\n");
        }
        lastStatus = 0;
    }

    private String prompt() {
        if (promptUser == null) {
            return user + "@remote:" + directory + "$ ";
        }
        return "[" + promptUser + "@" + promptHost + " " + directory + (user.equals("root") ? "]# " : "]$ ");
    }

    /** 直接向输出流写入任意字节，模拟远程进程自行产生的输出。 */
    public void emit(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (splitBytes) {
            for (byte b : bytes) {
                output.add(new byte[] {b});
            }
        } else {
            output.add(bytes);
        }
    }

    /** 模拟远程端断开连接。 */
    public void dropConnection() {
        open = false;
        output.add(EOF);
    }

    public synchronized List<String> receivedLines() {
        return List.copyOf(received);
    }

    @Override
    public InputStream readStream() {
        return new InputStream() {
            private byte[] current;
            private int position;

            @Override
            public int read() throws IOException {
                byte[] one = new byte[1];
                int n = read(one, 0, 1);
                return n == -1 ? -1 : one[0] & 0xff;
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                if (current == null || position >= current.length) {
                    try {
                        current = output.take();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IOException("interrupted", e);
                    }
                    position = 0;
                    if (current == EOF) {
                        output.add(EOF);
                        return -1;
                    }
                }
                int n = Math.min(len, current.length - position);
                System.arraycopy(current, position, b, off, n);
                position += n;
                return n;
            }
        };
    }

    @Override
    public void close() {
        if (open) {
            open = false;
            output.add(EOF);
        }
        timer.shutdownNow();
    }
}
