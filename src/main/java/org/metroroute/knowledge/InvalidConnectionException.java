package org.metroroute.knowledge;

import org.metroroute.core.TransitRoutingException;

/**
 * Thrown when a connection is rejected at registration time.
 *
 * <p>Invalid values are never clamped; the knowledge base is left untouched.</p>
 */
public final class InvalidConnectionException extends TransitRoutingException {
    public static final String REASON_NEGATIVE_DISTANCE = "KB_NEGATIVE_DISTANCE";
    public static final String REASON_NEGATIVE_TIME = "KB_NEGATIVE_TIME";
    public static final String REASON_NON_FINITE_VALUE = "KB_NON_FINITE_VALUE";
    public static final String REASON_ENDPOINT_REQUIRED = "KB_ENDPOINT_REQUIRED";
    public static final String REASON_SELF_LOOP = "KB_SELF_LOOP";

    public InvalidConnectionException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
