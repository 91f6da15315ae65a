package io.hhplus.checkout.domain.payment;

import java.util.List;

public interface RefundRepository {

    Refund save(Refund refund);

    List<Refund> findByOrderId(Long orderId);
}
