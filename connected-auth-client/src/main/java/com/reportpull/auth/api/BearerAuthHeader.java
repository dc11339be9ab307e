package com.reportpull.auth.api;

import org.apache.hc.core5.http.HttpRequest;

import com.reportpull.auth.AuthCache;

public record BearerAuthHeader(String headerName) {

    public BearerAuthHeader(String headerName) {
        this.headerName = (headerName == null || headerName.isBlank())
            ? "Authorization"
            : headerName;
    }

    public BearerAuthHeader() {
        this(null);
    }

    public <R extends HttpRequest> R add(R request, AuthCache.AuthInfo auth) {
        request.setHeader(headerName, "Bearer " + auth.accessToken());
        return request;
    }

}
