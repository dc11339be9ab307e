package com.reportpull.auth;

import java.util.List;

import lombok.Getter;

@Getter
public class ConfigIncompleteException extends AuthException {

    private final String serviceId;
    private final List<String> missingFields;

    public ConfigIncompleteException(String serviceId, List<String> missingFields) {
        super(AuthErrorKind.CONFIG_INCOMPLETE,
            "Configuration for service '" + serviceId + "' is incomplete, missing: " + String.join(", ", missingFields));
        this.serviceId = serviceId;
        this.missingFields = List.copyOf(missingFields);
    }
}
