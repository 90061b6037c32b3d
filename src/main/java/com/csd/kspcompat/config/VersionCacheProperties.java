package com.csd.kspcompat.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ksp.version.cache")
public class VersionCacheProperties {

    private boolean enabled = true;

    // per cache; 0 = unbounded
    private int maxEntries = 0;
}
