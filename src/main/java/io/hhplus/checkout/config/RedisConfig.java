package io.hhplus.checkout.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis 및 Redisson 설정
 *
 * - Lettuce: 웹훅 이벤트 멱등성 기록(SET NX), 장바구니 캐시
 * - Redisson: 분산 락 (결제 의도 생성, 환불)
 *
 * 모든 명령에 타임아웃을 둔다. Redis 장애 시 요청 스레드가 무한정 대기하지 않는다.
 */
@Configuration
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.timeout:2000ms}")
    private Duration commandTimeout;

    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
        config.setHostName(redisHost);
        config.setPort(redisPort);

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .commandTimeout(commandTimeout)
                .build();
        return new LettuceConnectionFactory(config, clientConfig);
    }

    /**
     * 사용처:
     * - RedisProcessedEventStore (webhook:processed:{eventId})
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    /**
     * Redisson 클라이언트 설정
     *
     * 사용처:
     * - 분산 락 (DistributedLockAspect)
     */
    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();

        config.useSingleServer()
                .setAddress("redis://" + redisHost + ":" + redisPort)
                .setConnectionPoolSize(32)          // 커넥션 풀 크기
                .setConnectionMinimumIdleSize(8)    // 최소 유휴 커넥션
                .setRetryAttempts(3)                // 재시도 횟수
                .setRetryInterval(1500)             // 재시도 간격 (ms)
                .setTimeout((int) commandTimeout.toMillis())
                .setPingConnectionInterval(30000);  // Ping 간격 (30초)

        return Redisson.create(config);
    }
}
