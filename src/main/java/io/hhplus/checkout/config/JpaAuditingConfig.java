package io.hhplus.checkout.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * JPA Auditing 설정
 *
 * BaseTimeEntity, BaseEntity의 @CreatedDate, @LastModifiedDate를 채운다.
 * 서버 기본 시간대와 무관하게 checkout.time-zone 기준 시각을 기록한다.
 */
@Configuration
@EnableJpaAuditing(dateTimeProviderRef = "auditingDateTimeProvider")
public class JpaAuditingConfig {

    @Bean
    public DateTimeProvider auditingDateTimeProvider(@Value("${checkout.time-zone:Asia/Seoul}") String timeZone) {
        ZoneId zoneId = ZoneId.of(timeZone);
        return () -> Optional.of(LocalDateTime.now(zoneId));
    }
}
