package com.reportpull.auth.api;

public record ConnectionTestResult(
    boolean success,
    String error,
    String details,
    Organization organization,
    String instanceUrl
) {

    public record Organization(String id, String name) {}

    static ConnectionTestResult failed(String error, String details, String instanceUrl) {
        return new ConnectionTestResult(false, error, details, null, instanceUrl);
    }
}
