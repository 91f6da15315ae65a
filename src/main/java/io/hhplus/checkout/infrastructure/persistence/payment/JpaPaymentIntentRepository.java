package io.hhplus.checkout.infrastructure.persistence.payment;

import io.hhplus.checkout.domain.payment.PaymentIntent;
import io.hhplus.checkout.domain.payment.PaymentIntentRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@Primary
public interface JpaPaymentIntentRepository extends JpaRepository<PaymentIntent, Long>, PaymentIntentRepository {

    @Override
    Optional<PaymentIntent> findById(Long id);

    @Override
    PaymentIntent save(PaymentIntent paymentIntent);

    @Override
    Optional<PaymentIntent> findByOrderId(Long orderId);

    @Override
    Optional<PaymentIntent> findByGatewayIntentId(String gatewayIntentId);
}
