package com.example.brite.exception;

/**
 * 조회 대상이 존재하지 않음 (404)
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
