package com.reportpull.auth.pkce;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;

/**
 * Opens the system browser through AWT. Fails on headless hosts.
 */
public class DesktopBrowserLauncher implements BrowserLauncher {

    @Override
    public void open(URI uri) throws IOException {
        if (GraphicsEnvironment.isHeadless()
            || !Desktop.isDesktopSupported()
            || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            throw new IOException("No desktop browser available; open " + uri + " manually or use the JWT bearer flow");
        }
        Desktop.getDesktop().browse(uri);
    }
}
