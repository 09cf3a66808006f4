package com.example.brite.platform;

import com.example.brite.dto.PlaceCandidate;
import com.example.brite.dto.PlaceQuery;

import java.util.List;

/**
 * 외부 장소 검색 서비스 인터페이스
 * 구현체(Google Maps 등)는 조회만 수행하며 저장소를 변경하지 않습니다.
 */
public interface PlaceLookupGateway {

    /**
     * 장소 후보 검색
     *
     * @param query name 또는 address 중 정확히 하나
     * @return 장소 후보 목록 (결과가 없으면 빈 목록, 오류 아님)
     * @throws com.example.brite.exception.ValidationException name/address가 둘 다 없거나 둘 다 있는 경우
     * @throws com.example.brite.exception.GatewayException 외부 서비스 거절/장애/타임아웃
     */
    List<PlaceCandidate> search(PlaceQuery query);
}
