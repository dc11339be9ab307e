package com.reportpull.auth.session;

import java.time.Instant;

public record SessionStats(
    String contextId,
    Instant createdAt,
    boolean closed,
    boolean ownerActive,
    int maxTotal,
    int maxPerRoute
) {}
