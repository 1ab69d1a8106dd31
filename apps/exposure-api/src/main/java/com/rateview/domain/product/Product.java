package com.rateview.domain.product;

import com.rateview.domain.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 상품 카탈로그 읽기 모델.
 * <p>
 * 상품 생성/수정은 카탈로그 모듈의 책임이며, 이 엔진은 카테고리, 가격, 재고를 읽기만 합니다.
 * </p>
 *
 * @author Rateview
 * @version 1.0
 */
@Entity
@Table(name = "product")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class Product extends BaseEntity {

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "price", nullable = false, precision = 14, scale = 2)
    private BigDecimal price;

    @Column(name = "stock", nullable = false)
    private Integer stock;

    @Column(name = "category_id")
    private Long categoryId;

    public Product(String name, BigDecimal price, Integer stock, Long categoryId) {
        this.name = name;
        this.price = price;
        this.stock = stock;
        this.categoryId = categoryId;
    }

    public static Product of(String name, BigDecimal price, Integer stock, Long categoryId) {
        return new Product(name, price, stock, categoryId);
    }
}
