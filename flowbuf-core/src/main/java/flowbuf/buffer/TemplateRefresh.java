package flowbuf.buffer;

import lombok.Getter;

/**
 * When an exporter writes templates again. Templates are always written before
 * their first use.
 */
public class TemplateRefresh {

    private static final TemplateRefresh ONCE = new TemplateRefresh(0);
    private static final TemplateRefresh EVERY_MESSAGE = new TemplateRefresh(1);

    /**
     * Messages between two refreshes, 0 for never.
     */
    @Getter
    private final int interval;

    private TemplateRefresh(int interval) {
        this.interval = interval;
    }

    public static TemplateRefresh oncePerSession() {
        return ONCE;
    }

    public static TemplateRefresh everyMessage() {
        return EVERY_MESSAGE;
    }

    public static TemplateRefresh everyMessages(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Invalid refresh interval " + count);
        }
        return count == 1 ? EVERY_MESSAGE : new TemplateRefresh(count);
    }

    boolean isDue(long messagesSent) {
        return interval > 0 && messagesSent % interval == 0;
    }

    @Override
    public String toString() {
        return interval == 0 ? "once per session" : "every " + interval + " messages";
    }

}
