package com.sqlstage.sqlstage.config;

import com.sqlstage.sqlstage.asset.AssetCatalog;
import com.sqlstage.sqlstage.cache.CacheLayout;
import com.sqlstage.sqlstage.db.EngineCatalog;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Enables binding of {@link SqlStageProperties} and builds the read-only catalogs from it.
 */
@Configuration
@EnableConfigurationProperties(SqlStageProperties.class)
public class SqlStageConfig {

    @Bean
    public CacheLayout cacheLayout(SqlStageProperties properties) {
        return CacheLayout.under(Path.of(properties.getCache().getRoot()));
    }

    @Bean
    public AssetCatalog assetCatalog(SqlStageProperties properties) {
        return AssetCatalog.fromProperties(properties);
    }

    @Bean
    public EngineCatalog engineCatalog(SqlStageProperties properties) {
        return EngineCatalog.fromProperties(properties);
    }
}
