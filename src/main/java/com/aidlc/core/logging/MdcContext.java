package com.aidlc.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing AI-DLC MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setIntent(String intentId) {
        MDC.put("intentId", intentId);
    }

    public static void setUnit(String intentId, String unitId) {
        MDC.put("intentId", intentId);
        MDC.put("unitId", unitId);
    }

    public static void setStrategy(String intentId, String strategy) {
        MDC.put("intentId", intentId);
        MDC.put("strategy", strategy);
    }

    public static void clear() {
        MDC.remove("intentId");
        MDC.remove("unitId");
        MDC.remove("strategy");
    }
}
