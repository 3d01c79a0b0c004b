package com.momentumquant.rebalancer.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis cache for loaded price history.
 */
@Configuration
@EnableCaching
public class RedisConfig {

        public static final String PRICE_HISTORY_CACHE = "priceHistory";

        @Bean
        public RedisCacheManager cacheManager(RedisConnectionFactory connectionFactory) {
                RedisSerializationContext.SerializationPair<Object> values = RedisSerializationContext.SerializationPair
                                .fromSerializer(valueSerializer());

                // Default cache configuration (1 hour TTL)
                RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
                                .entryTtl(Duration.ofHours(1))
                                .serializeKeysWith(
                                                RedisSerializationContext.SerializationPair
                                                                .fromSerializer(new StringRedisSerializer()))
                                .serializeValuesWith(values)
                                .disableCachingNullValues();

                // Price history is re-ingested during the day, keep it short (10 minutes TTL)
                RedisCacheConfiguration priceHistoryConfig = defaultConfig.entryTtl(Duration.ofMinutes(10));

                return RedisCacheManager.builder(connectionFactory)
                                .cacheDefaults(defaultConfig)
                                .withCacheConfiguration(PRICE_HISTORY_CACHE, priceHistoryConfig)
                                .transactionAware()
                                .build();
        }

        private static GenericJackson2JsonRedisSerializer valueSerializer() {
                ObjectMapper mapper = new ObjectMapper();
                mapper.registerModule(new JavaTimeModule());
                mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
                mapper.activateDefaultTyping(mapper.getPolymorphicTypeValidator(),
                                ObjectMapper.DefaultTyping.NON_FINAL, JsonTypeInfo.As.PROPERTY);
                return new GenericJackson2JsonRedisSerializer(mapper);
        }
}
