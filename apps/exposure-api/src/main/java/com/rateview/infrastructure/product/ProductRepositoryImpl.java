package com.rateview.infrastructure.product;

import com.rateview.domain.product.Product;
import com.rateview.domain.product.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * ProductRepository의 JPA 구현체.
 */
@Component
@RequiredArgsConstructor
public class ProductRepositoryImpl implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;

    @Override
    public Optional<Product> findById(Long productId) {
        return productJpaRepository.findById(productId)
            .filter(product -> !product.isDeleted());
    }
}
