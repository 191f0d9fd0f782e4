package com.example.boundedcache.config;

import com.example.boundedcache.core.EvictionListener;
import com.example.boundedcache.core.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default listener of the auto-configured cache: logs every removal at debug level.
 */
public class LoggingEvictionListener implements EvictionListener<Object> {

    private static final Logger log = LoggerFactory.getLogger(LoggingEvictionListener.class);

    @Override
    public void onEviction(String key, Object value, RemovalCause cause) {
        log.debug("Removed {} from cache ({})", key, cause);
    }
}
