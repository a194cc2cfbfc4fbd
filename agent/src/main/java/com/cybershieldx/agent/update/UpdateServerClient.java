package com.cybershieldx.agent.update;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Talks to the update server
 */
public interface UpdateServerClient {

    UpdateInfo fetchUpdateInfo(UpdateQuery query) throws IOException;

    /**
     * Download a package to {@code target}, replacing any existing file
     */
    void download(String url, Path target, UpdateQuery query) throws IOException;
}
