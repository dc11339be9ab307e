package com.reportpull.auth;

/**
 * Notified whenever a manager's current record changes. {@code current} is null after the
 * credentials were cleared.
 */
@FunctionalInterface
public interface TokenRecordListener {

    void onTokenRecordChanged(String serviceId, TokenRecord current);
}
