package com.example.brite.service;

import com.example.brite.constants.ApiMessages;
import com.example.brite.domain.Product;
import com.example.brite.dto.ProductData;
import com.example.brite.exception.NotFoundException;
import com.example.brite.exception.ValidationException;
import com.example.brite.repository.PriceRepository;
import com.example.brite.repository.ProductRepository;
import com.example.brite.util.FieldLengthValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 상품 카탈로그 서비스
 * 상품명(대소문자 구분, 정확히 일치)으로 상품을 찾거나 생성하고 추정 가격을 관리합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductService {

    public static final int DEFAULT_LIST_LIMIT = 100;
    public static final int DEFAULT_SEARCH_LIMIT = 50;

    private final ProductRepository productRepository;
    private final PriceRepository priceRepository;

    /**
     * 상품명으로 상품을 찾고, 없으면 생성 (먼저 등록한 쪽이 유지됨)
     * <p>
     * 이름이 없고 match_key가 있으면 같은 match_key를 가진 기존 상품을 사용합니다.
     * 트랜잭션 밖에서 호출해야 합니다 ({@link StoreService#resolveOrCreateStore} 참고).
     *
     * @param data 상품 데이터 (name 필수)
     * @return 기존 또는 새로 생성된 상품
     * @throws ValidationException name 누락 또는 길이 초과
     */
    public Product resolveOrCreateProduct(ProductData data) {
        validateProductData(data);

        String name = data.getName();
        Optional<Product> existing = productRepository.findByName(name);
        if (existing.isPresent()) {
            log.debug("기존 상품 사용: id={}, name={}", existing.get().getId(), name);
            return existing.get();
        }

        if (data.getMatchKey() != null && !data.getMatchKey().isBlank()) {
            Optional<Product> matched = productRepository.findFirstByMatchKeyOrderByIdAsc(data.getMatchKey());
            if (matched.isPresent()) {
                log.info("match_key로 기존 상품 연결: id={}, matchKey={}, 요청 상품명={}",
                        matched.get().getId(), data.getMatchKey(), name);
                return matched.get();
            }
        }

        Product product = Product.builder()
                .name(name)
                .description(data.getDescription())
                .brand(data.getBrand())
                .size(data.getSize())
                .category(data.getCategory())
                .imageUrl(data.getImageUrl())
                .productUrl(data.getProductUrl())
                .matchKey(data.getMatchKey())
                .build();

        try {
            Product saved = productRepository.saveAndFlush(product);
            log.info("상품 생성: id={}, name={}", saved.getId(), name);
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.info("상품 동시 생성 감지, 먼저 저장된 상품을 재조회: name={}", name);
            return productRepository.findByName(name)
                    .orElseThrow(() -> e);
        }
    }

    /**
     * 상품 데이터 필수 값과 컬럼 길이 검증 (쓰기 전에 호출)
     */
    public void validateProductData(ProductData data) {
        if (data == null || data.getName() == null || data.getName().isBlank()) {
            throw new ValidationException(ApiMessages.PRODUCT_NAME_REQUIRED);
        }
        FieldLengthValidator.checkMaxLength("product_data.name", data.getName(), Product.NAME_MAX_LENGTH);
        FieldLengthValidator.checkMaxLength("product_data.description", data.getDescription(), Product.DESCRIPTION_MAX_LENGTH);
        FieldLengthValidator.checkMaxLength("product_data.brand", data.getBrand(), Product.SHORT_TEXT_MAX_LENGTH);
        FieldLengthValidator.checkMaxLength("product_data.size", data.getSize(), Product.SHORT_TEXT_MAX_LENGTH);
        FieldLengthValidator.checkMaxLength("product_data.category", data.getCategory(), Product.SHORT_TEXT_MAX_LENGTH);
        FieldLengthValidator.checkMaxLength("product_data.match_key", data.getMatchKey(), Product.SHORT_TEXT_MAX_LENGTH);
        FieldLengthValidator.checkMaxLength("product_data.image_url", data.getImageUrl(), Product.URL_MAX_LENGTH);
        FieldLengthValidator.checkMaxLength("product_data.product_url", data.getProductUrl(), Product.URL_MAX_LENGTH);
    }

    /**
     * 가격 원장 전체의 평균으로 추정 가격 재계산 (가격이 없으면 null)
     * 여러 번 호출해도 결과가 같으며, 동시 호출 시 마지막 쓰기가 반영됩니다.
     *
     * @param productId 상품 ID
     * @return 재계산된 추정 가격
     */
    @Transactional
    public BigDecimal recomputeEstimatedPrice(Long productId) {
        List<BigDecimal> amounts = priceRepository.findAmountsByProductId(productId);

        BigDecimal estimatedPrice = null;
        if (!amounts.isEmpty()) {
            BigDecimal sum = amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            estimatedPrice = sum.divide(BigDecimal.valueOf(amounts.size()), 2, RoundingMode.HALF_UP);
        }

        int updated = productRepository.updateEstimatedPrice(productId, estimatedPrice, LocalDateTime.now());
        if (updated == 0) {
            throw new NotFoundException(ApiMessages.PRODUCT_NOT_FOUND);
        }

        log.info("추정 가격 재계산: productId={}, 가격 {}건, estimatedPrice={}", productId, amounts.size(), estimatedPrice);
        return estimatedPrice;
    }

    @Transactional(readOnly = true)
    public Product getProduct(Long id) {
        return productRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(ApiMessages.PRODUCT_NOT_FOUND));
    }

    /**
     * 상품 목록 조회
     * 이름이 없으면 최근 수정 순, 있으면 이름 부분 일치 (대소문자 무시)
     */
    @Transactional(readOnly = true)
    public List<Product> listProducts(String name, Integer limit) {
        if (name == null || name.isBlank()) {
            return productRepository.findAllByOrderByUpdatedAtDesc(PageRequest.of(0, normalizeLimit(limit, DEFAULT_LIST_LIMIT)));
        }
        return productRepository.findByNameContainingIgnoreCaseOrderByNameAsc(
                name.trim(), PageRequest.of(0, normalizeLimit(limit, DEFAULT_SEARCH_LIMIT)));
    }

    @Transactional(readOnly = true)
    public List<String> getCategories() {
        return productRepository.findDistinctCategories();
    }

    private int normalizeLimit(Integer limit, int defaultLimit) {
        if (limit == null || limit <= 0) {
            return defaultLimit;
        }
        return Math.min(limit, DEFAULT_LIST_LIMIT);
    }
}
