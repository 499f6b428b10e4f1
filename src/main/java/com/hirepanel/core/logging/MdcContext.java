package com.hirepanel.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing evaluation MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, String candidate) {
        MDC.put("runId", runId);
        MDC.put("candidate", candidate);
    }

    public static void setPersona(String runId, String persona) {
        MDC.put("runId", runId);
        MDC.put("persona", persona);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("candidate");
        MDC.remove("persona");
    }
}
