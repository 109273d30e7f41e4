package com.meddiag.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Uniform JSON envelope of every HTTP response.
 *
 * <ul>
 *   <li>ok: business success, independent of the HTTP status</li>
 *   <li>code: 0 on success, one of {@link ApiCodes} otherwise</li>
 *   <li>message: short reason, safe to show</li>
 *   <li>data: payload on success</li>
 *   <li>ts: server time in epoch millis</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Result<T>(
        boolean ok,
        int code,
        String message,
        T data,
        long ts
) {

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, 0, "ok", data, System.currentTimeMillis());
    }

    /**
     * Success without payload. Not named {@code ok()}: the record already has that accessor.
     */
    public static <T> Result<T> okVoid() {
        return new Result<>(true, 0, "ok", null, System.currentTimeMillis());
    }

    public static <T> Result<T> fail(int code, String message) {
        return new Result<>(false, code, message, null, System.currentTimeMillis());
    }
}
