package com.cloudgov.config;

import com.cloudgov.domain.hierarchy.model.entity.HierarchyDesignSessionEntity;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 * <p>
 * 设计会话保存在进程内缓存中，按访问时间淘汰。
 * </p>
 */
@Slf4j
@Configuration
public class GuavaConfig {

    @Bean(name = "designSessionCache")
    public Cache<String, HierarchyDesignSessionEntity> designSessionCache(DesignerSessionProperties properties) {
        long expireMinutes = Math.max(properties.getExpireAfterAccessMinutes(), 1L);
        long maximumSize = Math.max(properties.getMaximumSize(), 1L);
        log.info("DESIGN_SESSION_CACHE_CONFIGURED expireAfterAccessMinutes={}, maximumSize={}", expireMinutes, maximumSize);
        return CacheBuilder.newBuilder()
                .expireAfterAccess(expireMinutes, TimeUnit.MINUTES)
                .maximumSize(maximumSize)
                .removalListener(notification -> {
                    if (notification.wasEvicted()) {
                        log.info("DESIGN_SESSION_EVICTED zoneId={}, cause={}", notification.getKey(), notification.getCause());
                    }
                })
                .build();
    }

}
