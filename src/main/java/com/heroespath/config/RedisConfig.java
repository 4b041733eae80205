package com.heroespath.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * discovery.cache.type=redis일 때만 로컬 캐시용 RedisTemplate 구성
 */
@Configuration
@ConditionalOnProperty(name = "discovery.cache.type", havingValue = "redis")
public class RedisConfig {

    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory connectionFactory) {
        logger.info("[RedisConfig] Creating RedisTemplate for discovery cache, factory: {}",
                connectionFactory.getClass().getName());

        try {
            connectionFactory.getConnection().ping();
            logger.info("[RedisConfig] Redis connection test: SUCCESS");
        } catch (Exception e) {
            // 캐시는 원격 저장소 장애 대비용이므로 기동은 계속한다
            logger.error("[RedisConfig] Redis connection test: FAILED - {}", e.getMessage());
        }

        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        // 키와 집합 멤버는 문자열, 값은 JSON
        template.setKeySerializer(new StringRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());

        GenericJackson2JsonRedisSerializer serializer = new GenericJackson2JsonRedisSerializer(new ObjectMapper());
        template.setValueSerializer(serializer);
        template.setHashValueSerializer(serializer);
        template.setDefaultSerializer(serializer);

        template.afterPropertiesSet();
        return template;
    }
}
