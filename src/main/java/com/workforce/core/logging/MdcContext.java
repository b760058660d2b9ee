package com.workforce.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing workforce-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String COMPANY_ID = "companyId";
    public static final String AGENT_ID = "agentId";

    private MdcContext() {}

    public static void setRun(String runId, String companyId) {
        MDC.put(RUN_ID, runId);
        MDC.put(COMPANY_ID, companyId);
    }

    public static void setAgent(String agentId) {
        MDC.put(AGENT_ID, agentId);
    }

    public static void clearAgent() {
        MDC.remove(AGENT_ID);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(COMPANY_ID);
        MDC.remove(AGENT_ID);
    }
}
