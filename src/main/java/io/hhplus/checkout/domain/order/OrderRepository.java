package io.hhplus.checkout.domain.order;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.Optional;

public interface OrderRepository {

    Optional<Order> findById(Long id);

    Optional<Order> findByOrderNumber(String orderNumber);

    /**
     * 사용자 주문 목록 (최신순). status가 null이면 전체
     */
    Page<Order> findByUserIdAndStatus(Long userId, OrderStatus status, Pageable pageable);

    /**
     * 전체 주문 검색 (관리자, 최신순). null 조건은 적용하지 않는다
     */
    Page<Order> search(OrderStatus status, PaymentStatus paymentStatus, Long userId, Pageable pageable);

    Order save(Order order);

    default Order findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.ORDER_NOT_FOUND,
                "주문을 찾을 수 없습니다. orderId: " + id
            ));
    }
}
