package com.example.dbmonitor.config;

import com.example.dbmonitor.cache.CaffeineContextCacheStore;
import com.example.dbmonitor.cache.ContextCacheStore;
import com.example.dbmonitor.cache.RedisContextCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Selects the context cache store from {@code db-monitor.cache.type}.
 */
@Slf4j
@Configuration
public class CacheStoreConfig {

    @Configuration
    @ConditionalOnProperty(prefix = "db-monitor.cache", name = "type", havingValue = "redis")
    static class RedisStoreConfig {

        @Bean
        public RedisConnectionFactory redisConnectionFactory(MonitorProperties properties) {
            MonitorProperties.CacheConfig.RedisConfig redis = properties.getCache().getRedis();
            RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
            config.setHostName(redis.getHost());
            config.setPort(redis.getPort());
            config.setDatabase(redis.getDatabase());

            if (redis.getPassword() != null && !redis.getPassword().isEmpty()) {
                config.setPassword(redis.getPassword());
            }

            LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                    .commandTimeout(Duration.ofSeconds(redis.getCommandTimeoutSeconds()))
                    .build();
            return new LettuceConnectionFactory(config, clientConfig);
        }

        @Bean
        public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
            RedisTemplate<String, String> template = new RedisTemplate<>();
            template.setConnectionFactory(connectionFactory);
            template.setKeySerializer(new StringRedisSerializer());
            template.setValueSerializer(new StringRedisSerializer());
            template.afterPropertiesSet();
            return template;
        }

        @Bean
        public ContextCacheStore contextCacheStore(RedisTemplate<String, String> redisTemplate,
                                                   MonitorProperties properties) {
            log.info("Context cache backed by Redis at {}:{}",
                    properties.getCache().getRedis().getHost(), properties.getCache().getRedis().getPort());
            return new RedisContextCacheStore(redisTemplate);
        }
    }

    @Bean
    @ConditionalOnProperty(prefix = "db-monitor.cache", name = "type", havingValue = "memory", matchIfMissing = true)
    public ContextCacheStore inMemoryContextCacheStore(MonitorProperties properties) {
        log.info("Context cache backed by in-process Caffeine store");
        return new CaffeineContextCacheStore(properties.getCache().getMaxEntries());
    }
}
