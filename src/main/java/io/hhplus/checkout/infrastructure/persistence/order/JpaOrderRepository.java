package io.hhplus.checkout.infrastructure.persistence.order;

import io.hhplus.checkout.domain.order.Order;
import io.hhplus.checkout.domain.order.OrderRepository;
import io.hhplus.checkout.domain.order.OrderStatus;
import io.hhplus.checkout.domain.order.PaymentStatus;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@Primary
public interface JpaOrderRepository extends JpaRepository<Order, Long>, OrderRepository {

    // Explicitly declare methods to resolve ambiguity with OrderRepository
    @Override
    Optional<Order> findById(Long id);

    @Override
    Order save(Order order);

    @Override
    Optional<Order> findByOrderNumber(String orderNumber);

    /**
     * 사용자 주문 목록 (idx_user_created, idx_user_status 사용)
     */
    @Override
    @Query(value = "SELECT o FROM Order o " +
                   "WHERE o.userId = :userId AND (:status IS NULL OR o.status = :status) " +
                   "ORDER BY o.createdAt DESC, o.id DESC",
           countQuery = "SELECT COUNT(o) FROM Order o " +
                        "WHERE o.userId = :userId AND (:status IS NULL OR o.status = :status)")
    Page<Order> findByUserIdAndStatus(@Param("userId") Long userId,
                                      @Param("status") OrderStatus status,
                                      Pageable pageable);

    @Override
    @Query(value = "SELECT o FROM Order o " +
                   "WHERE (:status IS NULL OR o.status = :status) " +
                   "AND (:paymentStatus IS NULL OR o.paymentStatus = :paymentStatus) " +
                   "AND (:userId IS NULL OR o.userId = :userId) " +
                   "ORDER BY o.createdAt DESC, o.id DESC",
           countQuery = "SELECT COUNT(o) FROM Order o " +
                        "WHERE (:status IS NULL OR o.status = :status) " +
                        "AND (:paymentStatus IS NULL OR o.paymentStatus = :paymentStatus) " +
                        "AND (:userId IS NULL OR o.userId = :userId)")
    Page<Order> search(@Param("status") OrderStatus status,
                       @Param("paymentStatus") PaymentStatus paymentStatus,
                       @Param("userId") Long userId,
                       Pageable pageable);
}
