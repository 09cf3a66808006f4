package com.example.brite.controller;

import com.example.brite.constants.ApiMessages;
import com.example.brite.domain.Store;
import com.example.brite.dto.PlaceCandidate;
import com.example.brite.dto.PlaceQuery;
import com.example.brite.dto.StoreProductCount;
import com.example.brite.dto.StoreVisibilityRequest;
import com.example.brite.exception.ValidationException;
import com.example.brite.platform.PlaceLookupGateway;
import com.example.brite.service.StoreService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 매장 조회/검색 REST API
 */
@Tag(name = "매장", description = "매장 조회, 외부 장소 검색, 노출 여부 관리 API")
@Slf4j
@RestController
@RequestMapping("/stores")
@RequiredArgsConstructor
public class StoreController {

    private final StoreService storeService;
    private final PlaceLookupGateway placeLookupGateway;

    @Operation(summary = "매장 목록 조회", description = "등록된 전체 매장을 이름순으로 반환합니다.")
    @GetMapping
    public ResponseEntity<List<Store>> getStores() {
        return ResponseEntity.ok(storeService.getAllStores());
    }

    @Operation(summary = "매장별 상품 수", description = "가격이 등록된 상품 수가 많은 매장부터 반환합니다.")
    @GetMapping("/summary")
    public ResponseEntity<List<StoreProductCount>> getStoreSummary() {
        return ResponseEntity.ok(storeService.getStoreSummary());
    }

    @Operation(summary = "매장 단건 조회")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "매장 없음")
    })
    @GetMapping("/{id}")
    public ResponseEntity<Store> getStore(@PathVariable Long id) {
        return ResponseEntity.ok(storeService.getStore(id));
    }

    /**
     * 외부 장소 검색 (name 또는 address 중 하나)
     * 결과가 없으면 404와 빈 stores 목록을 반환합니다.
     */
    @Operation(
            summary = "매장 후보 검색",
            description = "Google Maps로 매장 후보를 검색합니다. name 검색은 최대 10건, " +
                    "address 검색은 지오코딩 결과 1건(이름 없음)을 반환합니다."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "검색 성공"),
            @ApiResponse(responseCode = "400", description = "검색 조건 누락 또는 외부 서비스의 요청 거절"),
            @ApiResponse(responseCode = "404", description = "검색 결과 없음"),
            @ApiResponse(responseCode = "502", description = "외부 서비스 장애/타임아웃")
    })
    @GetMapping("/search")
    public ResponseEntity<Map<String, Object>> searchStores(
            @Parameter(description = "매장명") @RequestParam(required = false) String name,
            @Parameter(description = "주소") @RequestParam(required = false) String address,
            @Parameter(description = "검색 중심 좌표 (lat,lng)", example = "18.0179,-76.8099")
            @RequestParam(required = false) String location,
            @Parameter(description = "검색 반경 (미터)") @RequestParam(required = false) Integer radius) {
        log.info("매장 검색 요청: name={}, address={}, location={}, radius={}", name, address, location, radius);

        PlaceQuery query = PlaceQuery.builder()
                .name(name)
                .address(address)
                .location(location)
                .radius(radius)
                .build();
        List<PlaceCandidate> stores = placeLookupGateway.search(query);

        if (stores.isEmpty()) {
            String message = query.hasName()
                    ? "No store found with name: " + name
                    : "No location found for address: " + address;
            log.warn("매장 검색 결과 없음: {}", message);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", message);
            body.put("stores", Collections.emptyList());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
        return ResponseEntity.ok(Map.of("stores", stores));
    }

    @Operation(summary = "매장 노출 여부 변경", description = "숨김 매장은 가격 목록/최저가/바코드 조회에서 제외됩니다.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "변경 성공"),
            @ApiResponse(responseCode = "400", description = "visible 누락"),
            @ApiResponse(responseCode = "404", description = "매장 없음")
    })
    @PutMapping("/{id}/visibility")
    public ResponseEntity<Store> updateVisibility(@PathVariable Long id,
                                                  @RequestBody(required = false) StoreVisibilityRequest request) {
        if (request == null) {
            throw new ValidationException(ApiMessages.VISIBLE_REQUIRED);
        }
        return ResponseEntity.ok(storeService.updateVisibility(id, request.getVisible()));
    }
}
