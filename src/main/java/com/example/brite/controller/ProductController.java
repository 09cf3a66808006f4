package com.example.brite.controller;

import com.example.brite.domain.Price;
import com.example.brite.domain.Product;
import com.example.brite.dto.PriceSubmitRequest;
import com.example.brite.dto.PriceUploadResult;
import com.example.brite.dto.PriceView;
import com.example.brite.dto.ProductCreateRequest;
import com.example.brite.dto.ProductCreationResult;
import com.example.brite.service.ExcelService;
import com.example.brite.service.PriceService;
import com.example.brite.service.PriceUploadService;
import com.example.brite.service.ProductCreationService;
import com.example.brite.service.ProductService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 상품/가격 REST API
 * 카탈로그 빌더와 모바일 앱이 상품 등록, 가격 제출, 가격 비교 조회에 사용합니다.
 */
@Tag(name = "상품", description = "상품 등록, 조회, 매장별 가격 API")
@Slf4j
@RestController
@RequestMapping("/products")
@RequiredArgsConstructor
public class ProductController {

    static final String XLSX_CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private final ProductCreationService productCreationService;
    private final ProductService productService;
    private final PriceService priceService;
    private final PriceUploadService priceUploadService;
    private final ExcelService excelService;

    /**
     * 상품 등록
     * 매장 확정 → 상품 확정 → 가격 반영. 같은 요청을 다시 보내면 같은 ID를 반환하고 가격만 갱신됩니다.
     */
    @Operation(
            summary = "상품 등록",
            description = "store_info의 place_id로 매장을, product_data.name으로 상품을 찾거나 생성한 뒤 " +
                    "(상품, 매장) 가격을 등록/갱신하고 추정 가격을 재계산합니다."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "등록 성공"),
            @ApiResponse(responseCode = "400", description = "필수 값 누락 (상품명, 매장 정보, place_id, 가격)"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @PostMapping
    public ResponseEntity<Map<String, Object>> createProduct(
            @RequestBody(required = false) ProductCreateRequest request) {
        ProductCreationResult result = productCreationService.createProduct(request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Product created successfully");
        body.put("product_id", result.getProduct().getId());
        body.put("store_id", result.getStore().getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @Operation(
            summary = "상품 목록 조회",
            description = "name이 없으면 최근 수정 순(기본 100건), 있으면 상품명 부분 일치(대소문자 무시, 기본 50건)"
    )
    @GetMapping
    public ResponseEntity<List<Product>> getProducts(
            @Parameter(description = "상품명 검색어") @RequestParam(required = false) String name,
            @Parameter(description = "최대 건수 (최대 100)") @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(productService.listProducts(name, limit));
    }

    @Operation(summary = "상품 단건 조회")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "상품 없음")
    })
    @GetMapping("/{id}")
    public ResponseEntity<Product> getProduct(@PathVariable Long id) {
        return ResponseEntity.ok(productService.getProduct(id));
    }

    @Operation(summary = "상품 가격 목록", description = "매장 정보를 포함한 가격 목록 (금액 오름차순, 숨김 매장 제외)")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "상품 없음")
    })
    @GetMapping("/{id}/prices")
    public ResponseEntity<List<PriceView>> getPrices(@PathVariable Long id) {
        return ResponseEntity.ok(priceService.getPricesForProduct(id));
    }

    @Operation(summary = "상품 최저가 조회")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "404", description = "상품 또는 가격 없음")
    })
    @GetMapping("/{id}/prices/lowest")
    public ResponseEntity<PriceView> getLowestPrice(@PathVariable Long id) {
        return ResponseEntity.ok(priceService.getLowestPrice(id));
    }

    @Operation(summary = "매장 가격 제출", description = "매장을 찾거나 생성한 뒤 (상품, 매장) 가격을 등록/갱신합니다.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "등록 성공"),
            @ApiResponse(responseCode = "400", description = "필수 값 누락 또는 가격 오류"),
            @ApiResponse(responseCode = "404", description = "상품 없음")
    })
    @PostMapping("/{id}/prices")
    public ResponseEntity<Map<String, Object>> submitPrice(@PathVariable Long id,
                                                           @RequestBody(required = false) PriceSubmitRequest request) {
        Price price = priceService.submitStorePrice(id, request);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("price_id", price.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    /**
     * 엑셀 파일로 가격 일괄 등록
     *
     * @param file 엑셀 파일 (.xlsx)
     * @return 행별 성공/실패 리포트
     */
    @Operation(
            summary = "엑셀 파일로 가격 일괄 등록",
            description = "엑셀 파일(.xlsx)의 각 행을 상품 등록 요청으로 처리합니다. " +
                    "한 행이 실패해도 나머지 행은 계속 처리합니다. " +
                    "필수 컬럼: product_name, place_id, store, price"
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "처리 완료",
                    content = @Content(schema = @Schema(implementation = PriceUploadResult.class))
            ),
            @ApiResponse(responseCode = "400", description = "빈 파일, 형식 오류, 데이터 행 없음")
    })
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PriceUploadResult> uploadPrices(
            @Parameter(description = "엑셀 파일 (.xlsx)", required = true)
            @RequestParam("file") MultipartFile file) {
        log.info("가격 일괄 등록 요청: fileName={}, size={}", file.getOriginalFilename(), file.getSize());
        return ResponseEntity.ok(priceUploadService.uploadPrices(file));
    }

    @Operation(summary = "가격 일괄 등록 템플릿 다운로드")
    @GetMapping("/upload/template")
    public ResponseEntity<byte[]> downloadTemplate() throws IOException {
        byte[] template = excelService.createPriceUploadTemplate();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(XLSX_CONTENT_TYPE));
        headers.setContentDisposition(ContentDisposition.attachment().filename("price-upload-template.xlsx").build());
        return new ResponseEntity<>(template, headers, HttpStatus.OK);
    }
}
