package com.example.brite.exception;

/**
 * 사용자 입력 검증 실패 (400)
 * 메시지는 {@link com.example.brite.constants.ApiMessages}의 고정 문구를 사용합니다.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
