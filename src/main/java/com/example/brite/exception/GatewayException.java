package com.example.brite.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 외부 장소 검색 서비스(Google Maps) 호출 실패
 * 업스트림이 요청 자체를 거절한 경우 400, 업스트림 장애/타임아웃은 502로 응답합니다.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final HttpStatus status;

    public GatewayException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public GatewayException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public static GatewayException rejected(String message) {
        return new GatewayException(HttpStatus.BAD_REQUEST, message);
    }

    public static GatewayException unavailable(String message, Throwable cause) {
        return new GatewayException(HttpStatus.BAD_GATEWAY, message, cause);
    }
}
