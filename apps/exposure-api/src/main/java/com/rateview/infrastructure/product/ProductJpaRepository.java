package com.rateview.infrastructure.product;

import com.rateview.domain.product.Product;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Product JPA Repository.
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {
}
