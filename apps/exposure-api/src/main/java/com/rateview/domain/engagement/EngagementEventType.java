package com.rateview.domain.engagement;

import com.rateview.support.error.CoreException;
import com.rateview.support.error.ErrorType;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * 참여 이벤트 유형.
 */
@Getter
@RequiredArgsConstructor
public enum EngagementEventType {
    VIEW("view"),
    CLICK("click"),
    ADD_TO_CART("add_to_cart"),
    PURCHASE("purchase");

    private final String code;

    /**
     * 외부 표기(view, click, add_to_cart, purchase)로부터 유형을 찾습니다.
     *
     * @param code 이벤트 유형 코드
     * @return 이벤트 유형
     * @throws CoreException 알 수 없는 코드인 경우 BAD_REQUEST
     */
    public static EngagementEventType from(String code) {
        return Arrays.stream(values())
            .filter(type -> type.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new CoreException(ErrorType.BAD_REQUEST,
                String.format("지원하지 않는 이벤트 유형입니다. (eventType: %s)", code)));
    }
}
