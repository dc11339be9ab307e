package com.reportpull.auth.pkce;

public enum ListenerState {
    IDLE,
    PORT_BOUND,
    BROWSER_OPENED,
    AWAITING_CALLBACK,
    CODE_RECEIVED,
    ERROR_RECEIVED,
    MALFORMED,
    FAILED,
    TIMEOUT
}
