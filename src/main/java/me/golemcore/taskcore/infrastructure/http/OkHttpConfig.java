package me.golemcore.taskcore.infrastructure.http;

import me.golemcore.taskcore.infrastructure.config.TaskCoreProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} with pooled connections and timeouts from
 * {@code taskcore.http.*}. Used to fetch plugin sources on install.
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final TaskCoreProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        TaskCoreProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .followRedirects(true)
                .retryOnConnectionFailure(true)
                .build();
    }
}
