package com.example.brite.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 공통 설정 프로퍼티
 */
@Component
@Getter
@Setter
@ConfigurationProperties(prefix = "brite")
public class BriteProperties {

    /**
     * X-API-Key 헤더로 검사할 키 (비어 있으면 검사하지 않음)
     */
    private String apiKey;

    /**
     * 통화 미지정 시 사용할 기본 통화 코드
     */
    private String defaultCurrency = "JMD";
}
