package io.hhplus.checkout.infrastructure.webhook;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * 결제 대행사 웹훅 서명 검증
 *
 * 헤더 형식: t=<unix seconds>,v1=<hex hmac-sha256>[,v1=...]
 * 서명 대상: "<t>.<raw payload>"
 *
 * - 타임스탬프가 허용 범위(tolerance)를 벗어나면 재전송 공격으로 보고 거부한다
 * - v1이 여러 개면 하나라도 일치하면 통과 (시크릿 교체 기간)
 * - 비교는 상수 시간 (MessageDigest.isEqual)
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String TIMESTAMP_KEY = "t";
    private static final String SIGNATURE_KEY = "v1";

    private final byte[] secret;
    private final long toleranceSeconds;
    private final Clock clock;

    @Autowired
    public WebhookSignatureVerifier(@Value("${checkout.webhook.secret:}") String secret,
                                    @Value("${checkout.webhook.tolerance-seconds:300}") long toleranceSeconds) {
        this(secret, toleranceSeconds, Clock.systemUTC());
    }

    public WebhookSignatureVerifier(String secret, long toleranceSeconds, Clock clock) {
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.toleranceSeconds = toleranceSeconds;
        this.clock = clock;
    }

    /**
     * @throws BusinessException SIGNATURE_INVALID
     */
    public void verify(String payload, String signatureHeader) {
        if (secret.length == 0) {
            log.error("Webhook secret is not configured (checkout.webhook.secret). Rejecting all webhook events");
            throw invalid("웹훅 시크릿이 설정되지 않았습니다");
        }

        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String element : signatureHeader.split(",")) {
            String[] pair = element.trim().split("=", 2);
            if (pair.length != 2) {
                continue;
            }
            if (TIMESTAMP_KEY.equals(pair[0])) {
                timestamp = parseTimestamp(pair[1]);
            } else if (SIGNATURE_KEY.equals(pair[0])) {
                signatures.add(pair[1]);
            }
        }

        if (timestamp == null || signatures.isEmpty()) {
            throw invalid("서명 헤더 형식이 올바르지 않습니다");
        }

        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - timestamp) > toleranceSeconds) {
            throw invalid(String.format("서명 타임스탬프가 허용 범위를 벗어났습니다. t=%d, now=%d", timestamp, now));
        }

        byte[] expected = computeSignature(timestamp, payload).getBytes(StandardCharsets.UTF_8);
        boolean matched = signatures.stream()
            .anyMatch(candidate -> MessageDigest.isEqual(expected, candidate.getBytes(StandardCharsets.UTF_8)));

        if (!matched) {
            throw invalid("서명이 일치하지 않습니다");
        }
    }

    /**
     * 서명 헤더 생성 (대행사와 같은 방식)
     */
    public String sign(String payload, long timestamp) {
        return TIMESTAMP_KEY + "=" + timestamp + "," + SIGNATURE_KEY + "=" + computeSignature(timestamp, payload);
    }

    private String computeSignature(long timestamp, String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            byte[] digest = mac.doFinal((timestamp + "." + payload).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }

    private Long parseTimestamp(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw invalid("서명 타임스탬프가 올바르지 않습니다: " + value);
        }
    }

    private BusinessException invalid(String message) {
        return new BusinessException(ErrorCode.SIGNATURE_INVALID, message);
    }
}
