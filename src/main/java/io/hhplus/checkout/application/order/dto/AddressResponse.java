package io.hhplus.checkout.application.order.dto;

import io.hhplus.checkout.domain.order.Address;

public record AddressResponse(
    String recipientName,
    String line1,
    String line2,
    String city,
    String state,
    String postalCode,
    String country,
    String phone
) {
    public static AddressResponse from(Address address) {
        if (address == null) {
            return null;
        }
        return new AddressResponse(
            address.getRecipientName(),
            address.getLine1(),
            address.getLine2(),
            address.getCity(),
            address.getState(),
            address.getPostalCode(),
            address.getCountry(),
            address.getPhone()
        );
    }
}
