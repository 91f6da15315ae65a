package io.hhplus.checkout.infrastructure.persistence.payment;

import io.hhplus.checkout.domain.payment.Refund;
import io.hhplus.checkout.domain.payment.RefundRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@Primary
public interface JpaRefundRepository extends JpaRepository<Refund, Long>, RefundRepository {

    @Override
    Refund save(Refund refund);

    @Override
    @Query("SELECT r FROM Refund r WHERE r.orderId = :orderId ORDER BY r.id ASC")
    List<Refund> findByOrderId(@Param("orderId") Long orderId);
}
