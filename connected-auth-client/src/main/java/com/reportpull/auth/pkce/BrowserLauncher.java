package com.reportpull.auth.pkce;

import java.io.IOException;
import java.net.URI;

@FunctionalInterface
public interface BrowserLauncher {

    void open(URI uri) throws IOException;
}
