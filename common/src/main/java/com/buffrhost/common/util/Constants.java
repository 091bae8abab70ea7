package com.buffrhost.common.util;

/**
 * Constants shared by the core services.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    /** Caller's property scope. Entities outside it are reported as not found. */
    public static final String PROPERTY_HEADER = "X-Property-Id";
    /** Staff member or system component performing the mutation, recorded in audit rows. */
    public static final String ACTOR_HEADER = "X-Actor";
    public static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    public static final String SYSTEM_ACTOR = "system";

    public static final String LOCK_PREFIX = "lock:resource:";

    public static final int DEFAULT_HISTORY_LIMIT = 50;
    public static final int MAX_HISTORY_LIMIT = 500;
    public static final int MAX_PAGE_SIZE = 200;
}
