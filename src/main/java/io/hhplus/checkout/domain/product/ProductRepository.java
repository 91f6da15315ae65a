package io.hhplus.checkout.domain.product;

import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;

import java.util.List;
import java.util.Optional;

public interface ProductRepository {

    Optional<Product> findById(Long id);

    List<Product> findAllById(Iterable<Long> ids);

    Product save(Product product);

    /**
     * 조건부 원자적 차감
     * stock >= quantity 인 경우에만 차감하고 변경된 행 수(0 또는 1)를 반환한다.
     */
    int decreaseStockIfAvailable(Long productId, int quantity);

    int increaseStock(Long productId, int quantity);

    Optional<Integer> findStockById(Long productId);

    default Product findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.PRODUCT_NOT_FOUND,
                "상품을 찾을 수 없습니다. productId: " + id
            ));
    }
}
