package com.example.brite.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 엑셀 가격 일괄 등록 결과 리포트 DTO
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PriceUploadResult {

    /**
     * 전체 처리된 행 수
     */
    private int totalCount;

    private int successCount;

    private int failureCount;

    @Builder.Default
    private List<SuccessItem> successItems = new ArrayList<>();

    @Builder.Default
    private List<FailureItem> failureItems = new ArrayList<>();

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class SuccessItem {
        /**
         * 엑셀 행 번호 (1부터 시작, 헤더 포함)
         */
        private Integer rowNumber;

        private String productName;
        private Long productId;
        private Long storeId;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class FailureItem {
        private Integer rowNumber;

        /**
         * 상품명 (파싱 가능한 경우)
         */
        private String productName;

        private String errorMessage;

        /**
         * 에러 타입 (VALIDATION_ERROR, INTERNAL_ERROR)
         */
        private String errorType;
    }
}
