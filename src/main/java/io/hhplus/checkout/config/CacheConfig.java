package io.hhplus.checkout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.hhplus.checkout.application.cart.dto.CartResponse;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.interceptor.SimpleCacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Spring Cache 설정 (Redis 기반)
 *
 * 캐시 전략: Cache-Aside
 * - 조회 시: 캐시 확인 → 없으면 DB 조회 → 캐시 저장
 * - 갱신 시: DB 갱신 → 캐시 무효화 (@CacheEvict)
 *
 * 캐시:
 * - carts: 1일 (장바구니는 사용자별 격리, 모든 변경에서 무효화)
 *
 * 주문 생성처럼 장바구니를 직접 비우는 경로도 같은 키를 무효화해야 한다.
 *
 * Note: test, inmemory 프로필에서는 비활성화
 */
@Configuration
@EnableCaching
@Profile("!test & !inmemory")
public class CacheConfig {

    public static final String CARTS = "carts";

    private ObjectMapper cartObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * 장바구니 캐시 설정: DTO 타입을 고정해 직렬화한다.
     */
    private RedisCacheConfiguration cartCacheConfig() {
        return RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(Duration.ofDays(1))
                .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                                new StringRedisSerializer()
                        )
                )
                .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                                new Jackson2JsonRedisSerializer<>(cartObjectMapper(), CartResponse.class)
                        )
                )
                .disableCachingNullValues();
    }

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(cartCacheConfig())
                .withCacheConfiguration(CARTS, cartCacheConfig())
                .transactionAware()  // 트랜잭션 커밋 후 캐시 갱신
                .build();
    }

    /**
     * 캐시 역직렬화 오류 시 해당 키를 제거해 반복 오류를 방지한다.
     */
    @Bean
    public CacheErrorHandler cacheErrorHandler() {
        return new SimpleCacheErrorHandler() {
            @Override
            public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
                cache.evict(key);
                super.handleCacheGetError(exception, cache, key);
            }
        };
    }
}
