package com.searchgate.web.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web 模块配置。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.searchgate.web")
@EnableConfigurationProperties(WebProperties.class)
@RequiredArgsConstructor
public class WebModuleConfig implements WebMvcConfigurer {

    private final AdminAccessInterceptor adminAccessInterceptor;
    private final WebProperties properties;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (properties.isDevOpenAdmin()) {
            log.warn("已开启 dev-open-admin，管理接口不做鉴权，仅限本地开发使用");
        } else if (properties.getAdminToken() == null || properties.getAdminToken().isEmpty()) {
            log.warn("未配置 searchgate.web.admin-token，管理接口将全部拒绝");
        }
        registry.addInterceptor(adminAccessInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns("/api/public/**", "/api/token/**");
    }
}
