package io.hhplus.checkout.application.inventory;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.product.InventoryLowEvent;
import io.hhplus.checkout.domain.product.Product;
import io.hhplus.checkout.domain.product.ProductRepository;
import io.hhplus.checkout.infrastructure.metrics.MetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 재고 원장 (예약/해제)
 *
 * 동시성 제어: 조건부 원자적 UPDATE
 * - UPDATE products SET stock = stock - :qty WHERE id = :id AND stock >= :qty
 * - 같은 상품에 대한 예약은 DB 행 단위로 직렬화되고, 다른 상품은 병렬로 진행된다
 * - 영향받은 행이 0이면 재고 부족 (재고는 음수가 되지 않는다)
 *
 * 예약은 호출마다 독립 트랜잭션으로 커밋된다.
 * 주문 저장이 실패하면 호출 측(CreateOrderUseCase)이 release로 보상한다.
 */
@Slf4j
@Service
public class InventoryService {

    private final ProductRepository productRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsCollector metricsCollector;
    private final int lowStockThreshold;

    public InventoryService(ProductRepository productRepository,
                            ApplicationEventPublisher eventPublisher,
                            MetricsCollector metricsCollector,
                            @Value("${checkout.inventory.low-stock-threshold:10}") int lowStockThreshold) {
        this.productRepository = productRepository;
        this.eventPublisher = eventPublisher;
        this.metricsCollector = metricsCollector;
        this.lowStockThreshold = lowStockThreshold;
    }

    /**
     * 재고 예약 (차감)
     *
     * @throws BusinessException PRODUCT_NOT_FOUND, PRODUCT_UNAVAILABLE, INSUFFICIENT_STOCK, INVALID_QUANTITY
     */
    @Transactional
    public void reserve(Long productId, int quantity) {
        validateQuantity(quantity);

        Product product = productRepository.findByIdOrThrow(productId);
        if (!product.isActive()) {
            throw new BusinessException(
                ErrorCode.PRODUCT_UNAVAILABLE,
                "판매 중지된 상품입니다. productId: " + productId
            );
        }

        int updated = productRepository.decreaseStockIfAvailable(productId, quantity);
        if (updated == 0) {
            metricsCollector.recordStockError();
            int currentStock = productRepository.findStockById(productId).orElse(0);
            log.warn("재고 예약 실패: productId={}, requested={}, currentStock={}", productId, quantity, currentStock);
            throw new BusinessException(
                ErrorCode.INSUFFICIENT_STOCK,
                String.format("재고가 부족합니다. 상품: %s, 요청: %d, 재고: %d", product.getName(), quantity, currentStock)
            );
        }

        int remainingStock = productRepository.findStockById(productId).orElse(0);
        log.debug("재고 예약: productId={}, quantity={}, remainingStock={}", productId, quantity, remainingStock);

        // 임계치를 위에서 아래로 넘는 예약에서만 발행
        int previousStock = remainingStock + quantity;
        if (previousStock > lowStockThreshold && remainingStock <= lowStockThreshold) {
            log.info("재고 부족 임계치 도달: productId={}, remainingStock={}, threshold={}",
                productId, remainingStock, lowStockThreshold);
            eventPublisher.publishEvent(
                new InventoryLowEvent(productId, product.getName(), remainingStock, lowStockThreshold)
            );
        }
    }

    /**
     * 재고 해제 (복원). 예약 보상과 주문 취소에서 사용한다.
     */
    @Transactional
    public void release(Long productId, int quantity) {
        validateQuantity(quantity);

        int updated = productRepository.increaseStock(productId, quantity);
        if (updated == 0) {
            throw new BusinessException(
                ErrorCode.PRODUCT_NOT_FOUND,
                "재고를 복원할 상품을 찾을 수 없습니다. productId: " + productId
            );
        }
        log.debug("재고 해제: productId={}, quantity={}", productId, quantity);
    }

    @Transactional(readOnly = true)
    public int getAvailableStock(Long productId) {
        return productRepository.findStockById(productId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.PRODUCT_NOT_FOUND,
                "상품을 찾을 수 없습니다. productId: " + productId
            ));
    }

    private void validateQuantity(int quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
    }
}
