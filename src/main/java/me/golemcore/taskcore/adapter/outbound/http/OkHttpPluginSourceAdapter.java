package me.golemcore.taskcore.adapter.outbound.http;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.taskcore.port.outbound.PluginSourcePort;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Downloads plugin sources with the shared {@link OkHttpClient}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OkHttpPluginSourceAdapter implements PluginSourcePort {

    private static final long MAX_SOURCE_BYTES = 1024L * 1024L;

    private final OkHttpClient okHttpClient;

    @Override
    public String fetch(String url) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "text/plain, */*")
                .get()
                .build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Empty response from " + url);
            }
            long length = body.contentLength();
            if (length > MAX_SOURCE_BYTES) {
                throw new IOException("Plugin source too large: " + length + " bytes");
            }
            String text = body.string();
            log.debug("[PluginInstall] fetched {} chars from {}", text.length(), url);
            return text;
        }
    }
}
