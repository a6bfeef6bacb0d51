/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.toolrunner.infrastructure.http;

import me.golemcore.toolrunner.infrastructure.config.ToolRunnerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for the model provider adapter.
 *
 * <p>
 * Streaming completions can run for minutes, so no call timeout is set; the
 * read timeout from {@code toolrunner.http.read-timeout} bounds the silence
 * between two streamed chunks instead. Every request carries the
 * {@value #USER_AGENT} agent string unless the caller sets its own.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    static final String USER_AGENT = "golemcore-toolrunner";

    private final ToolRunnerProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        ToolRunnerProperties.HttpProperties http = properties.getHttp();
        log.debug("[HTTP] connect {}ms, read {}ms, write {}ms, pool {}", http.getConnectTimeout(),
                http.getReadTimeout(), http.getWriteTimeout(), http.getMaxIdleConnections());
        return new OkHttpClient.Builder()
                .addInterceptor(userAgent())
                .connectTimeout(Duration.ofMillis(http.getConnectTimeout()))
                .readTimeout(Duration.ofMillis(http.getReadTimeout()))
                .writeTimeout(Duration.ofMillis(http.getWriteTimeout()))
                .callTimeout(Duration.ZERO)
                .connectionPool(new ConnectionPool(http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(), TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(true)
                .build();
    }

    private static Interceptor userAgent() {
        return chain -> {
            if (chain.request().header("User-Agent") != null) {
                return chain.proceed(chain.request());
            }
            return chain.proceed(chain.request().newBuilder()
                    .header("User-Agent", USER_AGENT)
                    .build());
        };
    }
}
