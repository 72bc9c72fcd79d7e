package com.searchgate.upstream.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 上游模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.searchgate.upstream")
@EnableConfigurationProperties(UpstreamProperties.class)
public class UpstreamModuleConfig {

    @Bean
    public OkHttpClient upstreamHttpClient(UpstreamProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(10))
                .followRedirects(false)
                .build();
    }
}
