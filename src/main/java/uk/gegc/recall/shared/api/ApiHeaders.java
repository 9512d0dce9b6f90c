package uk.gegc.recall.shared.api;

/**
 * Request headers shared by every controller. The caller's identity is resolved upstream and
 * forwarded as {@link #USER_ID}.
 */
public final class ApiHeaders {

    public static final String USER_ID = "X-User-Id";

    private ApiHeaders() {
    }
}
