package info.mouts.checkout.util;

/**
 * Identity headers forwarded by the upstream gateway after authenticating the
 * caller.
 */
public final class RequestHeaders {
    public static final String USER_ID = "X-User-Id";
    public static final String USER_ROLE = "X-User-Role";

    private RequestHeaders() {
    }
}
