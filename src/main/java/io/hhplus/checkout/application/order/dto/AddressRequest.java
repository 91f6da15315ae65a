package io.hhplus.checkout.application.order.dto;

import io.hhplus.checkout.domain.order.Address;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AddressRequest(
    @NotBlank(message = "수령인 이름은 필수입니다")
    @Size(max = 100, message = "수령인 이름은 100자 이하여야 합니다")
    String recipientName,

    @NotBlank(message = "주소는 필수입니다")
    @Size(max = 200, message = "주소는 200자 이하여야 합니다")
    String line1,

    @Size(max = 200, message = "상세 주소는 200자 이하여야 합니다")
    String line2,

    @NotBlank(message = "도시는 필수입니다")
    @Size(max = 100, message = "도시는 100자 이하여야 합니다")
    String city,

    @Size(max = 100, message = "주/도는 100자 이하여야 합니다")
    String state,

    @NotBlank(message = "우편번호는 필수입니다")
    @Size(max = 20, message = "우편번호는 20자 이하여야 합니다")
    String postalCode,

    @NotBlank(message = "국가 코드는 필수입니다")
    @Size(min = 2, max = 2, message = "국가 코드는 2자리여야 합니다")
    String country,

    @Size(max = 30, message = "전화번호는 30자 이하여야 합니다")
    String phone
) {
    public Address toAddress() {
        return Address.of(recipientName, line1, line2, city, state, postalCode, country, phone);
    }
}
