package com.example.brite.service;

import com.example.brite.config.BriteProperties;
import com.example.brite.constants.ApiMessages;
import com.example.brite.domain.Price;
import com.example.brite.domain.Product;
import com.example.brite.domain.Store;
import com.example.brite.dto.PriceSubmitRequest;
import com.example.brite.dto.PriceView;
import com.example.brite.exception.NotFoundException;
import com.example.brite.exception.ValidationException;
import com.example.brite.repository.PriceRepository;
import com.example.brite.repository.ProductRepository;
import com.example.brite.repository.StoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 가격 원장 서비스
 * (상품, 매장) 쌍마다 가격 한 행을 유지하고, 변경 후 상품의 추정 가격을 재계산합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceService {

    private final PriceRepository priceRepository;
    private final ProductRepository productRepository;
    private final StoreRepository storeRepository;
    private final ProductService productService;
    private final StoreService storeService;
    private final BriteProperties briteProperties;

    /**
     * 요청 본문의 가격 값을 금액으로 변환
     * JSON 숫자만 허용합니다 (문자열 "250", boolean 등은 거부).
     *
     * @throws ValidationException 누락, 숫자가 아님, 0 이하, 최대 금액 초과
     */
    public static BigDecimal parseAmount(Object price) {
        if (!(price instanceof Number)) {
            throw new ValidationException(ApiMessages.PRICE_REQUIRED);
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(price.toString());
        } catch (NumberFormatException e) {
            // NaN, Infinity
            throw new ValidationException(ApiMessages.PRICE_REQUIRED);
        }
        return normalizeAmount(amount);
    }

    /**
     * 금액을 저장 단위(소수 둘째 자리, 반올림)로 맞춘 뒤 범위 검증
     * 반올림 결과가 0이 되는 금액(예: 0.004)도 거부합니다.
     */
    public static BigDecimal normalizeAmount(BigDecimal amount) {
        if (amount == null) {
            throw new ValidationException(ApiMessages.PRICE_REQUIRED);
        }
        BigDecimal normalized = amount.setScale(Price.AMOUNT_SCALE, RoundingMode.HALF_UP);
        if (normalized.signum() <= 0) {
            throw new ValidationException(ApiMessages.PRICE_MUST_BE_POSITIVE);
        }
        if (normalized.compareTo(Price.MAX_AMOUNT) > 0) {
            throw new ValidationException(ApiMessages.PRICE_TOO_LARGE);
        }
        return normalized;
    }

    /**
     * 통화 코드 정규화 (생략 시 기본 통화)
     */
    public String normalizeCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            return briteProperties.getDefaultCurrency();
        }
        String normalized = currency.trim().toUpperCase(Locale.ROOT);
        if (!normalized.matches("[A-Z]{3}")) {
            throw new ValidationException(ApiMessages.CURRENCY_INVALID);
        }
        return normalized;
    }

    /**
     * (상품, 매장) 가격 등록 또는 덮어쓰기 후 추정 가격 재계산
     * <p>
     * 가격 저장이 커밋된 뒤 재계산이 실행되도록 트랜잭션 밖에서 호출해야 합니다.
     *
     * @param productId 상품 ID
     * @param storeId   매장 ID
     * @param rawAmount 금액 (양수, 소수 둘째 자리로 반올림)
     * @param currency  통화 코드 (null이면 기본 통화)
     * @return 저장된 가격
     */
    public Price upsertPrice(Long productId, Long storeId, BigDecimal rawAmount, String currency) {
        BigDecimal amount = normalizeAmount(rawAmount);
        String normalizedCurrency = normalizeCurrency(currency);

        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new NotFoundException(ApiMessages.PRODUCT_NOT_FOUND));
        Store store = storeRepository.findById(storeId)
                .orElseThrow(() -> new NotFoundException(ApiMessages.STORE_NOT_FOUND));

        Price saved;
        Optional<Price> existing = priceRepository.findByProductIdAndStoreId(productId, storeId);
        if (existing.isPresent()) {
            saved = overwrite(existing.get(), amount, normalizedCurrency);
        } else {
            Price price = Price.builder()
                    .product(product)
                    .store(store)
                    .amount(amount)
                    .currency(normalizedCurrency)
                    .lastUpdated(LocalDateTime.now())
                    .build();
            try {
                saved = priceRepository.saveAndFlush(price);
                log.info("가격 등록: id={}, productId={}, storeId={}, amount={} {}",
                        saved.getId(), productId, storeId, amount, normalizedCurrency);
            } catch (DataIntegrityViolationException e) {
                log.info("가격 동시 등록 감지, 기존 행 덮어쓰기: productId={}, storeId={}", productId, storeId);
                Price winner = priceRepository.findByProductIdAndStoreId(productId, storeId)
                        .orElseThrow(() -> e);
                saved = overwrite(winner, amount, normalizedCurrency);
            }
        }

        productService.recomputeEstimatedPrice(productId);
        return saved;
    }

    /**
     * 기존 상품에 매장 가격 등록 (매장이 없으면 생성)
     */
    public Price submitStorePrice(Long productId, PriceSubmitRequest request) {
        if (!productRepository.existsById(productId)) {
            throw new NotFoundException(ApiMessages.PRODUCT_NOT_FOUND);
        }
        if (request == null) {
            throw new ValidationException(ApiMessages.STORE_INFO_REQUIRED);
        }
        BigDecimal amount = parseAmount(request.getPrice());
        String currency = normalizeCurrency(request.getCurrency());

        Store store = storeService.resolveOrCreateStore(request.toPlaceCandidate());
        return upsertPrice(productId, store.getId(), amount, currency);
    }

    /**
     * 상품의 가격 목록 (금액 오름차순, 숨김 매장 제외)
     */
    @Transactional(readOnly = true)
    public List<PriceView> getPricesForProduct(Long productId) {
        if (!productRepository.existsById(productId)) {
            throw new NotFoundException(ApiMessages.PRODUCT_NOT_FOUND);
        }
        return priceRepository.findWithStoreByProductId(productId).stream()
                .filter(price -> price.getStore().isVisible())
                .map(PriceView::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public PriceView getLowestPrice(Long productId) {
        return getPricesForProduct(productId).stream()
                .findFirst()
                .orElseThrow(() -> new NotFoundException(ApiMessages.PRICE_NOT_FOUND));
    }

    private Price overwrite(Price price, BigDecimal amount, String currency) {
        BigDecimal previous = price.getAmount();
        price.setAmount(amount);
        price.setCurrency(currency);
        price.setLastUpdated(LocalDateTime.now());
        Price saved = priceRepository.saveAndFlush(price);
        log.info("가격 갱신: id={}, amount {} -> {} {}", saved.getId(), previous, amount, currency);
        return saved;
    }
}
