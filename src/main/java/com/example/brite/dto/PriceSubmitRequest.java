package com.example.brite.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 기존 상품에 매장 가격 등록 요청 DTO (POST /products/{id}/prices)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PriceSubmitRequest {

    private String placeId;

    @JsonAlias("store")
    private String name;

    private String address;
    private Double latitude;
    private Double longitude;
    private String link;
    private Boolean online;

    private Object price;
    private String currency;

    public PlaceCandidate toPlaceCandidate() {
        return PlaceCandidate.builder()
                .placeId(placeId)
                .name(name)
                .address(address)
                .latitude(latitude)
                .longitude(longitude)
                .link(link)
                .online(online)
                .build();
    }
}
