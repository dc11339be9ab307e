package com.reportpull.auth.api;

/**
 * Outcome of one API call. {@code status} is 0 when no HTTP response was received,
 * in which case {@code error} says why.
 */
public record ApiResponse(int status, String body, String error) {

    public static ApiResponse http(int status, String body) {
        return new ApiResponse(status, body, status >= 200 && status < 300 ? null : "HTTP " + status);
    }

    public static ApiResponse failure(String error) {
        return new ApiResponse(0, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
