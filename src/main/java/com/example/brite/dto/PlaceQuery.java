package com.example.brite.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 장소 검색 조건
 * name 또는 address 중 하나만 지정합니다.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlaceQuery {

    private String name;
    private String address;

    /**
     * 검색 중심 좌표 "lat,lng" (이름 검색 전용, 선택)
     */
    private String location;

    /**
     * 검색 반경 (미터, 이름 검색 전용, 선택)
     */
    private Integer radius;

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public boolean hasAddress() {
        return address != null && !address.isBlank();
    }
}
