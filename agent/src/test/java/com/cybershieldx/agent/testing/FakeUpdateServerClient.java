package com.cybershieldx.agent.testing;

import com.cybershieldx.agent.update.UpdateInfo;
import com.cybershieldx.agent.update.UpdateQuery;
import com.cybershieldx.agent.update.UpdateServerClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Update server stand-in serving a package from a local file
 */
public class FakeUpdateServerClient implements UpdateServerClient {

    private volatile UpdateInfo info;
    private volatile Path packageFile;
    private volatile IOException checkFailure;
    private final List<UpdateQuery> queries = new CopyOnWriteArrayList<>();
    private final List<String> downloads = new CopyOnWriteArrayList<>();

    public FakeUpdateServerClient offer(UpdateInfo info, Path packageFile) {
        this.info = info;
        this.packageFile = packageFile;
        return this;
    }

    public FakeUpdateServerClient failChecks(IOException failure) {
        this.checkFailure = failure;
        return this;
    }

    @Override
    public UpdateInfo fetchUpdateInfo(UpdateQuery query) throws IOException {
        queries.add(query);
        if (checkFailure != null) {
            throw checkFailure;
        }
        return info != null ? info : UpdateInfo.none(query.getCurrentVersion());
    }

    @Override
    public void download(String url, Path target, UpdateQuery query) throws IOException {
        downloads.add(url);
        if (packageFile == null) {
            throw new IOException("404 Not Found");
        }
        Files.copy(packageFile, target, StandardCopyOption.REPLACE_EXISTING);
    }

    public List<UpdateQuery> queries() {
        return queries;
    }

    public List<String> downloads() {
        return downloads;
    }
}
