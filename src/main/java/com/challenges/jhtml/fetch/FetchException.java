package com.challenges.jhtml.fetch;

/**
 * A document could not be retrieved. This is never used to signal "no match".
 */
public class FetchException extends Exception {
    /** Status reported when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final String url;
    private final int statusCode;

    public FetchException(String message, String url, int statusCode, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public String url() {
        return url;
    }

    public int statusCode() {
        return statusCode;
    }
}
