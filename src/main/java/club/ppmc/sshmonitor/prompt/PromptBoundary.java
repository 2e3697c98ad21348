/**
 * PromptBoundary.java
 *
 * 字节流中一个已确认的提示符的位置。偏移量相对于会话输出流的起点（包括初始化阶段被丢弃的字节）。
 */
package club.ppmc.sshmonitor.prompt;

/**
 * @param start 提示符第一个字节的偏移量。
 * @param end 提示符最后一个字节之后的偏移量。
 */
public record PromptBoundary(long start, long end) {

    public int length() {
        return (int) (end - start);
    }
}
