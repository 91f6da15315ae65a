package io.hhplus.checkout.infrastructure.redis;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * 분산락 어노테이션 (Redisson RLock)
 *
 * 사용 예시:
 * <pre>
 * {@code
 * @DistributedLock(key = "'lock:payment:order:' + #orderId")
 * public RefundResponse refund(Long orderId, ...) { ... }
 * }
 * </pre>
 *
 * 주의사항:
 * - 락 획득 실패 시 BusinessException(CONCURRENT_REQUEST)
 * - 락 → 트랜잭션 → 커밋 → 락 해제 순서가 되도록 트랜잭션 바깥 메서드에 붙인다
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    /**
     * 락 키 (SpEL 표현식)
     */
    String key();

    /**
     * 락 획득 대기 시간 (기본 5초)
     */
    long waitTime() default 5L;

    /**
     * 락 임대 시간 (기본 30초). 대행사 타임아웃보다 길어야 한다.
     */
    long leaseTime() default 30L;

    TimeUnit timeUnit() default TimeUnit.SECONDS;
}
