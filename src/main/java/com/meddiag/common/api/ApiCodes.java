package com.meddiag.common.api;

/**
 * Business error codes carried in {@link Result#code()}. The first three digits follow the HTTP status.
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** Invalid parameters / failed business validation */
    public static final int BAD_REQUEST = 40000;

    /** Missing or invalid credential */
    public static final int UNAUTHORIZED = 40100;

    /** Authenticated, but the role is not allowed here */
    public static final int FORBIDDEN = 40300;

    public static final int NOT_FOUND = 40400;

    /** Sliding window full */
    public static final int TOO_MANY_REQUESTS = 42900;

    /** Temporarily blocked after repeated abuse */
    public static final int TOO_MANY_REQUESTS_BLOCKED = 42901;

    /** Unexpected server-side failure */
    public static final int INTERNAL_ERROR = 50000;
}
