package com.example.brite.util;

import com.example.brite.constants.ApiMessages;
import com.example.brite.exception.ValidationException;

/**
 * 문자열 필드 길이 검증 유틸리티
 * 컬럼 길이를 넘는 값은 저장 단계의 제약 위반(500) 대신 400으로 거부합니다.
 */
public final class FieldLengthValidator {

    private FieldLengthValidator() {
        // 인스턴스화 방지
    }

    /**
     * 값이 최대 길이를 넘으면 예외 (null은 통과)
     *
     * @param field     응답 메시지에 쓸 필드명 (예: "product_data.name")
     * @param value     검사할 값
     * @param maxLength 컬럼 최대 길이
     * @throws ValidationException 최대 길이 초과
     */
    public static void checkMaxLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new ValidationException(String.format(ApiMessages.FIELD_TOO_LONG, field, maxLength));
        }
    }
}
