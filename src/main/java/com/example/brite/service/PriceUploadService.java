package com.example.brite.service;

import com.example.brite.constants.ApiMessages;
import com.example.brite.constants.UploadColumns;
import com.example.brite.dto.PriceUploadResult;
import com.example.brite.dto.ProductCreateRequest;
import com.example.brite.dto.ProductCreationResult;
import com.example.brite.exception.NotFoundException;
import com.example.brite.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 엑셀 가격 일괄 등록 서비스
 * 각 행을 상품 등록 요청으로 바꿔 독립적으로 처리합니다 (한 행의 실패가 다른 행을 막지 않음).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceUploadService {

    public static final String ERROR_TYPE_VALIDATION = "VALIDATION_ERROR";
    public static final String ERROR_TYPE_NOT_FOUND = "NOT_FOUND";
    public static final String ERROR_TYPE_INTERNAL = "INTERNAL_ERROR";

    private final ExcelService excelService;
    private final ExcelToProductConverter excelToProductConverter;
    private final ProductCreationService productCreationService;

    /**
     * 업로드 파일 검증 후 행별 등록
     *
     * @throws ValidationException 빈 파일, xlsx가 아님, 데이터 행 없음, 읽기 실패
     */
    public PriceUploadResult uploadPrices(MultipartFile file) {
        validateFile(file);

        List<Map<String, Object>> rows;
        try (InputStream inputStream = file.getInputStream()) {
            rows = excelService.parseRows(inputStream, file.getOriginalFilename());
        } catch (IOException | RuntimeException e) {
            // POI는 손상된 파일에 대해 런타임 예외를 던지기도 함
            log.warn("엑셀 읽기 실패: fileName={}, error={}", file.getOriginalFilename(), e.getMessage());
            throw new ValidationException(ApiMessages.UPLOAD_UNREADABLE);
        }

        if (rows.isEmpty()) {
            throw new ValidationException(ApiMessages.UPLOAD_NO_DATA);
        }
        return processRows(rows);
    }

    /**
     * 파싱된 행 목록 처리
     */
    public PriceUploadResult processRows(List<Map<String, Object>> rows) {
        log.info("가격 일괄 등록 시작: 총 {}개 행", rows.size());

        List<PriceUploadResult.SuccessItem> successItems = new ArrayList<>();
        List<PriceUploadResult.FailureItem> failureItems = new ArrayList<>();

        for (Map<String, Object> rowData : rows) {
            Integer rowNumber = (Integer) rowData.getOrDefault(UploadColumns.ROW_NUMBER, 0);
            String productName = null;
            try {
                ProductCreateRequest request = excelToProductConverter.convert(rowData);
                productName = request.getProductData().getName();

                ProductCreationResult result = productCreationService.createProduct(request);
                successItems.add(PriceUploadResult.SuccessItem.builder()
                        .rowNumber(rowNumber)
                        .productName(productName)
                        .productId(result.getProduct().getId())
                        .storeId(result.getStore().getId())
                        .build());

            } catch (IllegalArgumentException e) {
                log.warn("행 {} 등록 실패 (검증): productName={}, error={}", rowNumber, productName, e.getMessage());
                failureItems.add(failure(rowNumber, productName, e.getMessage(), ERROR_TYPE_VALIDATION));

            } catch (NotFoundException e) {
                log.warn("행 {} 등록 실패 (조회): productName={}, error={}", rowNumber, productName, e.getMessage());
                failureItems.add(failure(rowNumber, productName, e.getMessage(), ERROR_TYPE_NOT_FOUND));

            } catch (RuntimeException e) {
                log.error("행 {} 등록 실패: productName={}", rowNumber, productName, e);
                failureItems.add(failure(rowNumber, productName, ApiMessages.INTERNAL_ERROR, ERROR_TYPE_INTERNAL));
            }
        }

        PriceUploadResult result = PriceUploadResult.builder()
                .totalCount(rows.size())
                .successCount(successItems.size())
                .failureCount(failureItems.size())
                .successItems(successItems)
                .failureItems(failureItems)
                .build();

        log.info("가격 일괄 등록 완료: 총 {}개, 성공 {}개, 실패 {}개",
                result.getTotalCount(), result.getSuccessCount(), result.getFailureCount());
        return result;
    }

    private void validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ValidationException(ApiMessages.UPLOAD_FILE_EMPTY);
        }
        String fileName = file.getOriginalFilename();
        if (fileName == null || !fileName.toLowerCase(Locale.ROOT).endsWith(".xlsx")) {
            throw new ValidationException(ApiMessages.UPLOAD_FILE_TYPE_INVALID);
        }
    }

    private PriceUploadResult.FailureItem failure(Integer rowNumber, String productName, String message, String type) {
        return PriceUploadResult.FailureItem.builder()
                .rowNumber(rowNumber)
                .productName(productName)
                .errorMessage(message)
                .errorType(type)
                .build();
    }
}
