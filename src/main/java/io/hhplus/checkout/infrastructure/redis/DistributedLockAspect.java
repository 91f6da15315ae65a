package io.hhplus.checkout.infrastructure.redis;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

/**
 * 분산락 AOP
 *
 * 동작 흐름:
 * 1. SpEL 표현식으로 락 키 생성
 * 2. Redisson RLock.tryLock(wait, lease)
 * 3. 성공 시 비즈니스 로직 실행, 실패 시 CONCURRENT_REQUEST
 * 4. finally에서 현재 스레드가 보유한 경우만 해제
 *
 * 트랜잭션 어드바이스보다 먼저 실행되어야 커밋 이후에 락이 풀린다 (HIGHEST_PRECEDENCE).
 */
@Slf4j
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class DistributedLockAspect {

    private final RedissonClient redissonClient;
    private final ExpressionParser parser = new SpelExpressionParser();

    @Around("@annotation(io.hhplus.checkout.infrastructure.redis.DistributedLock)")
    public Object lock(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        DistributedLock distributedLock = method.getAnnotation(DistributedLock.class);

        String lockKey = parseLockKey(distributedLock.key(), signature, joinPoint.getArgs());
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean isLocked = lock.tryLock(
                distributedLock.waitTime(),
                distributedLock.leaseTime(),
                distributedLock.timeUnit()
            );

            if (!isLocked) {
                log.warn("락 획득 실패: key={}, waitTime={}{}", lockKey, distributedLock.waitTime(), distributedLock.timeUnit());
                throw new BusinessException(
                    ErrorCode.CONCURRENT_REQUEST,
                    "다른 동일 요청이 처리 중입니다. 잠시 후 다시 시도해주세요. (lockKey: " + lockKey + ")"
                );
            }

            log.debug("락 획득 성공: key={}", lockKey);
            return joinPoint.proceed();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.CONCURRENT_REQUEST, "락 대기 중 인터럽트 발생: " + lockKey, e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("락 해제: key={}", lockKey);
            }
        }
    }

    /**
     * 메서드 파라미터를 SpEL Context에 등록하고 표현식을 평가한다.
     * 예: "'lock:payment:order:' + #orderId" → "lock:payment:order:42"
     */
    private String parseLockKey(String keyExpression, MethodSignature signature, Object[] args) {
        StandardEvaluationContext context = new StandardEvaluationContext();

        String[] parameterNames = signature.getParameterNames();
        for (int i = 0; i < parameterNames.length; i++) {
            context.setVariable(parameterNames[i], args[i]);
        }

        return parser.parseExpression(keyExpression).getValue(context, String.class);
    }
}
