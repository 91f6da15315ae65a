package io.hhplus.checkout.application.webhook.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResolveFailedEventRequest(
    @NotBlank(message = "조치 내용은 필수입니다")
    @Size(max = 500, message = "조치 내용은 500자 이하여야 합니다")
    String note
) {}
