package com.ivamare.agentqueue.model;

/**
 * Logical priority tier. P0 is the most urgent.
 *
 * <p>Logical tiers map onto AMQP priorities 9, 6, 3 and 0 so that a higher
 * logical urgency is always served first by the broker.
 */
public enum Priority {
    P0(0, 9),
    P1(1, 6),
    P2(2, 3),
    P3(3, 0);

    /** Highest AMQP priority declared on request queues (x-max-priority). */
    public static final int MAX_TRANSPORT_PRIORITY = 10;

    private final int level;
    private final int transportPriority;

    Priority(int level, int transportPriority) {
        this.level = level;
        this.transportPriority = transportPriority;
    }

    public int level() {
        return level;
    }

    public int transportPriority() {
        return transportPriority;
    }

    /**
     * One level toward lower urgency, saturating at P3.
     */
    public Priority demote() {
        return of(Math.min(level + 1, P3.level));
    }

    public boolean isMoreUrgentThan(Priority other) {
        return level < other.level;
    }

    public static Priority of(int level) {
        if (level < 0 || level > 3) {
            throw new IllegalArgumentException("Priority level must be 0..3: " + level);
        }
        return values()[level];
    }

    /**
     * Parse user-provided priority ("P1", "p1", "1", " 2 ").
     * Out-of-range numbers are clamped to 0..3, anything unparseable becomes P2.
     *
     * @param raw user input, may be null
     * @return parsed priority
     */
    public static Priority parse(Object raw) {
        if (raw instanceof Priority priority) {
            return priority;
        }
        if (raw instanceof Number number) {
            return clamp(number.longValue());
        }
        if (raw == null) {
            return P2;
        }
        String text = raw.toString().trim();
        if (text.length() > 1 && (text.charAt(0) == 'P' || text.charAt(0) == 'p')) {
            text = text.substring(1);
        }
        try {
            return clamp(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return P2;
        }
    }

    private static Priority clamp(long level) {
        return of((int) Math.max(0, Math.min(3, level)));
    }
}
