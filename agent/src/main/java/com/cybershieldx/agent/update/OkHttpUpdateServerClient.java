package com.cybershieldx.agent.update;

import com.cybershieldx.agent.util.Jsons;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Update server client over OkHttp
 */
public class OkHttpUpdateServerClient implements UpdateServerClient {
    private static final Logger log = LoggerFactory.getLogger(OkHttpUpdateServerClient.class);

    private static final long DOWNLOAD_READ_TIMEOUT_SECONDS = 120;

    private final String updateUrl;
    private final OkHttpClient checkClient;
    private final OkHttpClient downloadClient;

    public OkHttpUpdateServerClient(String updateUrl, Duration checkTimeout) {
        this.updateUrl = updateUrl;
        this.checkClient = new OkHttpClient.Builder()
                .connectTimeout(checkTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(checkTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .callTimeout(checkTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .build();
        this.downloadClient = checkClient.newBuilder()
                .readTimeout(DOWNLOAD_READ_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .callTimeout(0, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public UpdateInfo fetchUpdateInfo(UpdateQuery query) throws IOException {
        HttpUrl base = HttpUrl.parse(updateUrl);
        if (base == null) {
            throw new IOException("Invalid update URL: " + updateUrl);
        }
        HttpUrl.Builder url = base.newBuilder()
                .addQueryParameter("version", query.getCurrentVersion())
                .addQueryParameter("platform", query.getPlatform())
                .addQueryParameter("arch", query.getArch());
        if (query.getTargetVersion() != null) {
            url.addQueryParameter("targetVersion", query.getTargetVersion());
        }

        Request request = authorized(new Request.Builder().url(url.build()).get(), query).build();
        log.debug("Checking for updates at {}", base);

        try (Response response = checkClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Update server responded with status " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Update server sent an empty response");
            }
            return UpdateInfo.fromJson(Jsons.mapper().readTree(body.string()), query.getCurrentVersion());
        }
    }

    @Override
    public void download(String url, Path target, UpdateQuery query) throws IOException {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IOException("Invalid download URL: " + url);
        }
        Request request = authorized(new Request.Builder().url(parsed).get(), query).build();
        log.info("Downloading update from {}", parsed.host());

        try (Response response = downloadClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Download failed with status " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Download returned no content");
            }
            try (InputStream in = body.byteStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }

    private static Request.Builder authorized(Request.Builder builder, UpdateQuery query) {
        builder.header("User-Agent", query.userAgent());
        if (query.getAgentId() != null) {
            builder.header("X-Agent-Id", query.getAgentId());
        }
        if (query.getServerToken() != null && !query.getServerToken().isEmpty()) {
            builder.header("Authorization", "Bearer " + query.getServerToken());
        }
        return builder;
    }
}
