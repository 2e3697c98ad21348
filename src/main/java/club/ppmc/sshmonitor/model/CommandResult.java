/**
 * CommandResult.java
 *
 * 一条远程命令执行完成后的结果。
 * stdout 是回显命令行与下一个提示符之间的原始输出（保留远程 shell 的 CRLF 行结束符）。
 */
package club.ppmc.sshmonitor.model;

import java.time.Instant;

/**
 * @param command 提交的命令文本。
 * @param stdout 命令的可见输出，不包含命令回显和提示符。
 * @param exitCode 通过隐藏的状态查询得到的退出码；无法解析时为 -1。
 * @param durationMs 从提交到完成的耗时（毫秒）。
 * @param completedAt 完成时间。
 */
public record CommandResult(
        String command, String stdout, int exitCode, long durationMs, Instant completedAt) {}
