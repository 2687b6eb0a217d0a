package com.flagship.finance_ledger.observability;

import org.slf4j.MDC;

import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MDC keys carried by every log line of a ledger request, and the helpers
 * that open and close them.
 *
 * correlationId is set per HTTP request by {@link CorrelationIdFilter};
 * command, saleId and accountId are narrower scopes set by the command
 * endpoint and the orchestrators while they work on one record.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String COMMAND_MDC_KEY = "command";
    public static final String SALE_ID_MDC_KEY = "saleId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    private static final List<String> COMMAND_SCOPED_KEYS =
        List.of(COMMAND_MDC_KEY, SALE_ID_MDC_KEY, ACCOUNT_ID_MDC_KEY);

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private CorrelationContext() {
    }

    /**
     * Starts a request scope. A caller-supplied id is reused when it is a
     * short token; anything else is replaced by a generated id.
     *
     * @return the id in effect for the request
     */
    public static String begin(String requestedId) {
        String id = requestedId != null && ACCEPTED_ID.matcher(requestedId).matches()
            ? requestedId
            : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Correlation id of the current request, "none" outside one.
     */
    public static String getCorrelationId() {
        String id = MDC.get(CORRELATION_ID_MDC_KEY);
        return id != null ? id : "none";
    }

    public static void clearCommandScope() {
        COMMAND_SCOPED_KEYS.forEach(MDC::remove);
    }

    public static void end() {
        clearCommandScope();
        MDC.remove(CORRELATION_ID_MDC_KEY);
    }

    static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
