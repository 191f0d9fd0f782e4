package com.example.boundedcache.config;

import com.example.boundedcache.core.BoundedCache;
import com.example.boundedcache.core.CacheConfigurationException;
import com.example.boundedcache.core.EvictionListener;
import com.example.boundedcache.eviction.EvictionPolicy;
import com.example.boundedcache.memory.MemoryEstimator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers a {@link BoundedCache} built from {@link CacheProperties}. The cache is closed, and
 * its sweeper stopped, with the application context.
 *
 * <p>Applications can contribute their own {@link EvictionPolicy}, {@link MemoryEstimator} or
 * {@link EvictionListener} beans; the defaults back off.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "bounded-cache", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CacheProperties.class)
public class BoundedCacheAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(EvictionListener.class)
    public LoggingEvictionListener loggingEvictionListener() {
        return new LoggingEvictionListener();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(BoundedCache.class)
    public BoundedCache<Object> boundedCache(
        CacheProperties properties,
        ObjectProvider<EvictionPolicy> evictionPolicy,
        ObjectProvider<MemoryEstimator> memoryEstimator,
        ObjectProvider<EvictionListener<Object>> evictionListener
    ) throws CacheConfigurationException {
        BoundedCache<Object> cache = new BoundedCache<>(
            properties.toOptions(memoryEstimator.getIfAvailable(MemoryEstimator::standard)),
            evictionPolicy.getIfAvailable());
        evictionListener.ifAvailable(cache::setEvictionListener);
        return cache;
    }
}
