package io.hhplus.checkout.domain.order;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 배송지/청구지 (값 객체)
 * 주문 시점의 주소를 그대로 보존한다.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Address {

    @Column(name = "recipient_name", length = 100)
    private String recipientName;

    @Column(name = "line1", length = 200)
    private String line1;

    @Column(name = "line2", length = 200)
    private String line2;

    @Column(name = "city", length = 100)
    private String city;

    @Column(name = "state", length = 100)
    private String state;

    @Column(name = "postal_code", length = 20)
    private String postalCode;

    @Column(name = "country", length = 2)
    private String country;

    @Column(name = "phone", length = 30)
    private String phone;

    public static Address of(String recipientName, String line1, String line2, String city,
                             String state, String postalCode, String country, String phone) {
        return new Address(recipientName, line1, line2, city, state, postalCode, country, phone);
    }

    public Address copy() {
        return new Address(recipientName, line1, line2, city, state, postalCode, country, phone);
    }
}
