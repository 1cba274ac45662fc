package com.cloudgov.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * 设计器前端跨域配置。
 * <p>
 * 云厂商层级与 CIDR 解析为只读目录接口，仅放行 GET；设计会话接口放行全部编辑方法，
 * 并暴露链路头供前端关联日志。
 * </p>
 */
@Configuration
public class WebCorsConfig implements WebMvcConfigurer {

    @Value("${designer.cors.allowed-origin-patterns:http://localhost:4200,http://127.0.0.1:4200}")
    private String[] allowedOriginPatterns;

    @Value("${designer.cors.max-age-seconds:1800}")
    private long maxAgeSeconds;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/landing-zones/*/designer/**")
                .allowedOriginPatterns(allowedOriginPatterns)
                .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("Content-Type", "X-Trace-Id", "X-Request-Id")
                .exposedHeaders("X-Trace-Id", "X-Request-Id")
                .maxAge(maxAgeSeconds);
        for (String catalogPath : new String[]{"/api/providers/**", "/api/ipam/**"}) {
            registry.addMapping(catalogPath)
                    .allowedOriginPatterns(allowedOriginPatterns)
                    .allowedMethods("GET", "OPTIONS")
                    .exposedHeaders("X-Trace-Id", "X-Request-Id")
                    .maxAge(maxAgeSeconds);
        }
    }
}
