package io.hhplus.checkout.application.usecase;

import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * 여러 애플리케이션 서비스를 묶어 하나의 흐름을 조율하는 진입점 (예: CreateOrderUseCase)
 * <p>
 * 트랜잭션 경계는 UseCase가 아니라 UseCase가 호출하는 서비스가 가진다.
 * 락과 보상 처리는 트랜잭션 바깥인 UseCase에서 한다.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface UseCase {
    String value() default "";
}
