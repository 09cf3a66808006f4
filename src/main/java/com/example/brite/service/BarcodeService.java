package com.example.brite.service;

import com.example.brite.constants.ApiMessages;
import com.example.brite.domain.BarcodeMapping;
import com.example.brite.domain.Product;
import com.example.brite.dto.BarcodeLookupResult;
import com.example.brite.exception.NotFoundException;
import com.example.brite.exception.ValidationException;
import com.example.brite.repository.BarcodeMappingRepository;
import com.example.brite.repository.ProductRepository;
import com.example.brite.util.FieldLengthValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 바코드 매핑 서비스
 * 사용자가 스캔한 바코드를 기존 상품에 연결합니다 (바코드당 매핑 1건, 재연결 시 덮어씀).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BarcodeService {

    private final BarcodeMappingRepository barcodeMappingRepository;
    private final ProductRepository productRepository;
    private final PriceService priceService;

    /**
     * 바코드로 상품 조회
     *
     * @return 매핑이 없거나 연결된 상품이 삭제된 경우 found=false
     */
    @Transactional(readOnly = true)
    public BarcodeLookupResult lookup(String barcode) {
        Optional<Product> product = barcodeMappingRepository.findByBarcode(barcode)
                .flatMap(mapping -> productRepository.findById(mapping.getProductId()));
        if (product.isEmpty()) {
            log.debug("바코드 매핑 없음: barcode={}", barcode);
            return BarcodeLookupResult.notFound();
        }

        return BarcodeLookupResult.builder()
                .found(true)
                .barcode(barcode)
                .product(product.get())
                .prices(priceService.getPricesForProduct(product.get().getId()))
                .build();
    }

    /**
     * 바코드를 상품에 연결 (기존 매핑이 있으면 덮어씀)
     *
     * @param barcode   바코드
     * @param productId 상품 ID 문자열
     * @return 저장된 매핑
     */
    public BarcodeMapping link(String barcode, String productId) {
        if (productId == null || productId.isBlank()) {
            throw new ValidationException(ApiMessages.PRODUCT_ID_REQUIRED);
        }
        FieldLengthValidator.checkMaxLength("barcode", barcode, BarcodeMapping.BARCODE_MAX_LENGTH);
        Product product = parseProductId(productId.trim())
                .flatMap(productRepository::findById)
                .orElseThrow(() -> new NotFoundException(ApiMessages.PRODUCT_NOT_FOUND));

        BarcodeMapping mapping = barcodeMappingRepository.findByBarcode(barcode)
                .orElseGet(() -> BarcodeMapping.builder().barcode(barcode).build());
        apply(mapping, product);

        try {
            BarcodeMapping saved = barcodeMappingRepository.saveAndFlush(mapping);
            log.info("바코드 연결: barcode={}, productId={}", barcode, product.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.info("바코드 동시 연결 감지, 기존 매핑 덮어쓰기: barcode={}", barcode);
            BarcodeMapping winner = barcodeMappingRepository.findByBarcode(barcode)
                    .orElseThrow(() -> e);
            apply(winner, product);
            return barcodeMappingRepository.saveAndFlush(winner);
        }
    }

    @Transactional
    public void unlink(String barcode) {
        BarcodeMapping mapping = barcodeMappingRepository.findByBarcode(barcode)
                .orElseThrow(() -> new NotFoundException(ApiMessages.BARCODE_MAPPING_NOT_FOUND));
        barcodeMappingRepository.delete(mapping);
        log.info("바코드 연결 해제: barcode={}, productId={}", barcode, mapping.getProductId());
    }

    private void apply(BarcodeMapping mapping, Product product) {
        mapping.setProductId(product.getId());
        mapping.setProductName(product.getName());
        mapping.setSource(BarcodeMapping.SOURCE_USER_SCAN);
        mapping.setCreatedAt(LocalDateTime.now());
    }

    private Optional<Long> parseProductId(String productId) {
        try {
            return Optional.of(Long.valueOf(productId));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
