package io.feedpercolator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;

@Configuration
public class PipelineConfig {

    /**
     * Shared by every fetch of every run. The client pools connections and is immutable once built.
     */
    @Bean
    public HttpClient feedHttpClient(PercolatorConfig config) {
        return HttpClient.newBuilder()
                .connectTimeout(config.http().connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
