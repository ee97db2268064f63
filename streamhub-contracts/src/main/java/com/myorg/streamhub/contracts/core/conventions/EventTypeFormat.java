package com.myorg.streamhub.contracts.core.conventions;

public final class EventTypeFormat {
    private EventTypeFormat() {}

    // <domain>.<action>, e.g. order.created -> stream events:orders
    public static final String RECOMMENDED_PATTERN = "<domain>.<action>";
    public static final char SEPARATOR = '.';

    /**
     * @return true when the type has a non-empty domain and a non-empty remainder
     */
    public static boolean isValid(String eventType) {
        if (eventType == null || eventType.isBlank()) return false;
        int dot = eventType.indexOf(SEPARATOR);
        return dot > 0 && dot < eventType.length() - 1;
    }
}
