/**
 * PromptTemplate.java
 *
 * 会话连接时根据用户名和主机名实例化的提示符模板。
 * 连接后会通过一条一次性的初始化命令把远程 shell 的 PS1 强制设为固定的字面格式
 * "[user@host 目录]$ "（root 用户为 "]# "），其中只有目录部分由 shell 展开。
 * 用户名和主机名以字面量注入，而不是使用 bash 的用户名和主机名转义序列，因此与远程主机自身的主机名无关。
 */
package club.ppmc.sshmonitor.prompt;

import java.nio.charset.StandardCharsets;
import java.util.List;

public final class PromptTemplate {

    /** 目录部分 (\W) 的最大长度，超过后放弃当前候选。 */
    static final int MAX_DIRECTORY_LENGTH = 255;

    private static final String READY_MARKER = "__sshmon_ready_";
    private static final String STATUS_MARKER = "__sshmon_rc_";

    private final String user;
    private final String host;
    private final byte[] prefix;
    private final List<byte[]> suffixes;
    private final int maxLength;

    private PromptTemplate(String user, String host) {
        this.user = user;
        this.host = host;
        this.prefix = ("[" + user + "@" + host + " ").getBytes(StandardCharsets.US_ASCII);
        this.suffixes = List.of(
                "]$ ".getBytes(StandardCharsets.US_ASCII), "]# ".getBytes(StandardCharsets.US_ASCII));
        this.maxLength = prefix.length + MAX_DIRECTORY_LENGTH + 3;
    }

    /**
     * 为一个连接目标创建模板。不安全的字符会被替换为 '_'，以免破坏 PS1 的引号或转义。
     */
    public static PromptTemplate forTarget(String user, String host) {
        return new PromptTemplate(sanitize(user), sanitize(host));
    }

    private static String sanitize(String value) {
        if (value == null || value.isBlank()) {
            return "_";
        }
        return value.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    /**
     * @return 注入远程 shell 的 PS1 值。
     */
    public String ps1() {
        return "[" + user + "@" + host + " \\W]\\$ ";
    }

    /**
     * 构建一次性的初始化命令行（不含换行符）。
     * 以空格开头，使其在 HISTCONTROL=ignorespace 时不进入远程 shell 的历史。
     * 末尾的 printf 以两个参数拼出就绪标记，这样回显的命令行本身不会包含完整的标记。
     *
     * @param readyToken 每个会话唯一的随机令牌。
     */
    public String initializationCommand(String readyToken) {
        return " unset PROMPT_COMMAND; bind 'set enable-bracketed-paste off' 2>/dev/null; PS1='"
                + ps1() + "'; printf '%s%s\\n' " + READY_MARKER + " " + readyToken;
    }

    /**
     * @return 初始化命令执行后远程 shell 输出的就绪标记。
     */
    public String readyMarker(String readyToken) {
        return READY_MARKER + readyToken;
    }

    /**
     * 构建查询上一条命令退出码的隐藏命令行（不含换行符）。
     * 标记中带有命令编号，输出形如 "__sshmon_rc_7_0"，因此不会与其他命令的查询结果混淆。
     *
     * @param commandId 执行器为每条命令分配的编号。
     */
    public String statusQueryCommand(long commandId) {
        return " printf '%s%s\\n' " + statusMarker(commandId) + " $?";
    }

    /**
     * @return 某条命令的退出码标记前缀，后面紧跟退出码数字。
     */
    public String statusMarker(long commandId) {
        return STATUS_MARKER + commandId + "_";
    }

    /**
     * 按远程 shell 的方式渲染提示符，例如 render("~", false) 得到 "[alice@web01 ~]$ "。
     */
    public String render(String directory, boolean root) {
        return "[" + user + "@" + host + " " + directory + (root ? "]# " : "]$ ");
    }

    /**
     * @return 一个完整提示符可能的最大字节数，即匹配器跨调用保留的最大字节数。
     */
    public int maxLength() {
        return maxLength;
    }

    /**
     * 判断一个从行首开始的候选字节序列是否是（或可能成为）一个提示符。
     * 调用方每追加一个字节调用一次，因此只需要检查最后一个字节。
     */
    Match match(byte[] candidate, int length) {
        int last = length - 1;
        if (length <= prefix.length) {
            return candidate[last] == prefix[last] ? Match.PARTIAL : Match.MISMATCH;
        }
        byte b = candidate[last];
        if (b == '\r' || b == '\n') {
            return Match.MISMATCH;
        }
        for (byte[] suffix : suffixes) {
            if (length >= prefix.length + suffix.length + 1 && endsWith(candidate, length, suffix)) {
                return Match.COMPLETE;
            }
        }
        return length < maxLength ? Match.PARTIAL : Match.MISMATCH;
    }

    private static boolean endsWith(byte[] candidate, int length, byte[] suffix) {
        int offset = length - suffix.length;
        for (int i = 0; i < suffix.length; i++) {
            if (candidate[offset + i] != suffix[i]) {
                return false;
            }
        }
        return true;
    }

    byte firstByte() {
        return prefix[0];
    }

    enum Match {
        PARTIAL,
        COMPLETE,
        MISMATCH
    }
}
