package com.regimetrader.oms;

/**
 * Builds exchange order ids of the form {@code ORD_{botName}_{step}_{sequence}}, where the
 * sequence is the number of orders sent so far. Unique per session because the sequence
 * only grows.
 */
public class OrderIdGenerator {

    private static final String PREFIX = "ORD";

    private final String botName;

    public OrderIdGenerator(String botName) {
        this.botName = sanitize(botName);
    }

    public String generate(long step, long sequence) {
        return PREFIX + "_" + botName + "_" + step + "_" + sequence;
    }

    public String getBotName() {
        return botName;
    }

    /** Whitespace would break log parsing of the id; replace it with '-'. */
    private static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return "BOT";
        }
        return name.trim().replaceAll("\\s+", "-");
    }
}
