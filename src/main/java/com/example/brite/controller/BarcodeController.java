package com.example.brite.controller;

import com.example.brite.domain.BarcodeMapping;
import com.example.brite.dto.BarcodeLinkRequest;
import com.example.brite.dto.BarcodeLookupResult;
import com.example.brite.service.BarcodeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 바코드 스캔 매핑 REST API
 */
@Tag(name = "바코드", description = "바코드 → 상품 매핑 조회/연결/해제 API")
@Slf4j
@RestController
@RequestMapping("/barcodes")
@RequiredArgsConstructor
public class BarcodeController {

    private final BarcodeService barcodeService;

    @Operation(summary = "바코드로 상품 조회")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "연결된 상품 있음"),
            @ApiResponse(responseCode = "404", description = "매핑 없음 ({\"found\": false})")
    })
    @GetMapping("/{barcode}")
    public ResponseEntity<BarcodeLookupResult> lookup(@PathVariable String barcode) {
        BarcodeLookupResult result = barcodeService.lookup(barcode);
        return ResponseEntity.status(result.isFound() ? HttpStatus.OK : HttpStatus.NOT_FOUND).body(result);
    }

    @Operation(summary = "바코드를 상품에 연결", description = "이미 연결된 바코드는 새 상품으로 덮어씁니다.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "연결 성공"),
            @ApiResponse(responseCode = "400", description = "product_id 누락"),
            @ApiResponse(responseCode = "404", description = "상품 없음")
    })
    @PostMapping("/{barcode}")
    public ResponseEntity<Map<String, Object>> link(@PathVariable String barcode,
                                                    @RequestBody(required = false) BarcodeLinkRequest request) {
        BarcodeMapping mapping = barcodeService.link(barcode, request != null ? request.getProductId() : null);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Barcode linked");
        body.put("barcode", mapping.getBarcode());
        body.put("product_id", mapping.getProductId());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @Operation(summary = "바코드 연결 해제")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "해제 성공"),
            @ApiResponse(responseCode = "404", description = "매핑 없음")
    })
    @DeleteMapping("/{barcode}")
    public ResponseEntity<Map<String, Object>> unlink(@PathVariable String barcode) {
        barcodeService.unlink(barcode);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Barcode unlinked");
        body.put("barcode", barcode);
        return ResponseEntity.ok(body);
    }
}
