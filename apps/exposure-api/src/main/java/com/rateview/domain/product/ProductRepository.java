package com.rateview.domain.product;

import java.util.Optional;

/**
 * Product 읽기 전용 Repository 인터페이스.
 */
public interface ProductRepository {

    Optional<Product> findById(Long productId);
}
