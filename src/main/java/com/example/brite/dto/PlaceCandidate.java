package com.example.brite.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 장소 후보 DTO
 * 매장 검색 결과이자 상품 등록 요청의 store_info 형식
 * (카탈로그 빌더는 매장명을 "store" 키로 보내므로 별칭 허용)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlaceCandidate {

    private String placeId;

    @JsonAlias("store")
    private String name;

    private String address;
    private Double latitude;
    private Double longitude;

    // 온라인 매장 등록용 선택 필드
    private String link;
    private Boolean online;
}
