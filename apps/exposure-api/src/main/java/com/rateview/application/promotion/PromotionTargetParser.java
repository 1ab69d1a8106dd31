package com.rateview.application.promotion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rateview.domain.promotion.CategoryPromotionTarget;
import com.rateview.domain.promotion.CustomerPromotionTarget;
import com.rateview.domain.promotion.ProductPromotionTarget;
import com.rateview.domain.promotion.Promotion;
import com.rateview.domain.promotion.PromotionTarget;
import com.rateview.support.error.CoreException;
import com.rateview.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

/**
 * 프로모션 조건 JSON을 타입이 있는 {@link PromotionTarget}으로 변환합니다.
 * <ul>
 *   <li>CATEGORY: {@code {"category_ids": [..]}} (생략 또는 빈 배열이면 전체 카테고리)</li>
 *   <li>PRODUCT: promotion_product 목록 + {@code {"product_ids": [..]}}, 하나 이상 필요</li>
 *   <li>CUSTOMER: promotion_customer 목록, 선택적으로 {@code {"min_order_total": 숫자}}</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class PromotionTargetParser {

    private final ObjectMapper objectMapper;

    /**
     * @param promotion 프로모션
     * @return 적용 대상
     * @throws CoreException 조건 JSON이 형식에 맞지 않는 경우 BAD_REQUEST
     */
    public PromotionTarget parse(Promotion promotion) {
        JsonNode criteria = readCriteria(promotion);
        return switch (promotion.getType()) {
            case CATEGORY -> new CategoryPromotionTarget(readIds(criteria, "category_ids", promotion));
            case PRODUCT -> {
                Set<Long> productIds = new HashSet<>(promotion.getProductIds());
                productIds.addAll(readIds(criteria, "product_ids", promotion));
                if (productIds.isEmpty()) {
                    throw malformed(promotion, "대상 상품이 없습니다.");
                }
                yield new ProductPromotionTarget(productIds);
            }
            case CUSTOMER -> new CustomerPromotionTarget(promotion.getCustomerIds(), readMinOrderTotal(criteria, promotion));
        };
    }

    private JsonNode readCriteria(Promotion promotion) {
        String json = promotion.getCriteriaJson();
        if (json == null || json.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.isObject()) {
                throw malformed(promotion, "조건은 JSON 객체여야 합니다.");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw malformed(promotion, "조건 JSON을 해석할 수 없습니다.");
        }
    }

    private Set<Long> readIds(JsonNode criteria, String field, Promotion promotion) {
        JsonNode node = criteria.get(field);
        if (node == null || node.isNull()) {
            return Set.of();
        }
        if (!node.isArray()) {
            throw malformed(promotion, field + "는 배열이어야 합니다.");
        }
        Set<Long> ids = new HashSet<>();
        for (JsonNode element : node) {
            if (element.isIntegralNumber()) {
                if (!element.canConvertToLong()) {
                    throw malformed(promotion, field + "에 범위를 벗어난 ID가 있습니다: " + element);
                }
                ids.add(element.asLong());
            } else if (element.isTextual() && element.asText().matches("\\d+")) {
                ids.add(parseTextualId(element.asText(), field, promotion));
            } else {
                throw malformed(promotion, field + "에 숫자가 아닌 값이 있습니다: " + element);
            }
        }
        return ids;
    }

    private long parseTextualId(String text, String field, Promotion promotion) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw malformed(promotion, field + "에 범위를 벗어난 ID가 있습니다: " + text);
        }
    }

    private BigDecimal readMinOrderTotal(JsonNode criteria, Promotion promotion) {
        JsonNode node = criteria.get("min_order_total");
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber() || node.decimalValue().signum() < 0) {
            throw malformed(promotion, "min_order_total은 0 이상의 숫자여야 합니다.");
        }
        return node.decimalValue();
    }

    private CoreException malformed(Promotion promotion, String detail) {
        return new CoreException(ErrorType.BAD_REQUEST,
            String.format("프로모션 조건 형식 오류 (promotionId: %d): %s", promotion.getId(), detail));
    }
}
