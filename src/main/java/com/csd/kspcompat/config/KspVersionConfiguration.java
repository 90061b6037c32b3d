package com.csd.kspcompat.config;

import com.csd.kspcompat.service.KspVersionJsonModule;
import com.csd.kspcompat.service.KspVersionService;
import com.csd.kspcompat.service.VersionCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(VersionCacheProperties.class)
public class KspVersionConfiguration {

    @Bean
    public VersionCache versionCache(VersionCacheProperties properties) {
        log.info("KSP version cache enabled={}, maxEntries={}",
                properties.isEnabled(), properties.getMaxEntries() == 0 ? "unbounded" : properties.getMaxEntries());
        return new VersionCache(properties.isEnabled(), properties.getMaxEntries());
    }

    // Spring Boot registers Module beans on the auto-configured ObjectMapper
    @Bean
    public KspVersionJsonModule kspVersionJsonModule(KspVersionService versionService) {
        return new KspVersionJsonModule(versionService);
    }
}
