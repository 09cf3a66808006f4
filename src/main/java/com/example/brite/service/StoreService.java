package com.example.brite.service;

import com.example.brite.constants.ApiMessages;
import com.example.brite.domain.Store;
import com.example.brite.dto.PlaceCandidate;
import com.example.brite.dto.StoreProductCount;
import com.example.brite.exception.NotFoundException;
import com.example.brite.exception.ValidationException;
import com.example.brite.repository.PriceRepository;
import com.example.brite.repository.StoreRepository;
import com.example.brite.util.FieldLengthValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 매장 디렉터리 서비스
 * place_id 기준으로 매장을 찾거나 생성합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoreService {

    private final StoreRepository storeRepository;
    private final PriceRepository priceRepository;

    /**
     * place_id로 매장을 찾고, 없으면 후보 정보로 새로 생성
     * <p>
     * 이미 존재하면 저장된 값을 그대로 반환합니다 (들어온 후보 값으로 덮어쓰지 않음).
     * 동시 생성 경합에서 진 쪽은 유니크 제약 위반 후 먼저 저장된 행을 다시 읽습니다.
     * 제약 위반이 바깥 트랜잭션을 rollback-only로 만들지 않도록 트랜잭션 밖에서 호출해야 합니다.
     *
     * @param candidate 장소 후보 (place_id, name 필수)
     * @return 기존 또는 새로 생성된 매장
     * @throws ValidationException place_id 또는 name 누락
     */
    public Store resolveOrCreateStore(PlaceCandidate candidate) {
        validateCandidate(candidate);

        String placeId = candidate.getPlaceId();
        Optional<Store> existing = storeRepository.findByPlaceId(placeId);
        if (existing.isPresent()) {
            log.debug("기존 매장 사용: id={}, placeId={}", existing.get().getId(), placeId);
            return existing.get();
        }

        Store store = Store.builder()
                .placeId(placeId)
                .name(candidate.getName().trim())
                .address(candidate.getAddress())
                .latitude(candidate.getLatitude())
                .longitude(candidate.getLongitude())
                .link(candidate.getLink())
                .online(Boolean.TRUE.equals(candidate.getOnline()))
                .build();

        try {
            Store saved = storeRepository.saveAndFlush(store);
            log.info("매장 생성: id={}, placeId={}, name={}", saved.getId(), placeId, saved.getName());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.info("매장 동시 생성 감지, 먼저 저장된 매장을 재조회: placeId={}", placeId);
            return storeRepository.findByPlaceId(placeId)
                    .orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public Store getStore(Long id) {
        return storeRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(ApiMessages.STORE_NOT_FOUND));
    }

    @Transactional(readOnly = true)
    public List<Store> getAllStores() {
        return storeRepository.findAllByOrderByNameAsc();
    }

    /**
     * 매장별 가격이 등록된 상품 수 (많은 순, 숨김 매장 포함)
     */
    @Transactional(readOnly = true)
    public List<StoreProductCount> getStoreSummary() {
        return priceRepository.countProductsByStore();
    }

    /**
     * 매장 노출 여부 변경
     * 숨김 매장은 가격 목록/최저가/바코드 조회에서 제외됩니다.
     */
    @Transactional
    public Store updateVisibility(Long id, Boolean visible) {
        if (visible == null) {
            throw new ValidationException(ApiMessages.VISIBLE_REQUIRED);
        }
        Store store = storeRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(ApiMessages.STORE_NOT_FOUND));
        store.setVisible(visible);
        log.info("매장 노출 여부 변경: id={}, visible={}", id, visible);
        return store;
    }

    /**
     * 매장 후보 필수 값과 컬럼 길이 검증 (쓰기 전에 호출)
     */
    public void validateCandidate(PlaceCandidate candidate) {
        if (candidate == null) {
            throw new ValidationException(ApiMessages.STORE_INFO_REQUIRED);
        }
        if (candidate.getPlaceId() == null || candidate.getPlaceId().isBlank()) {
            throw new ValidationException(ApiMessages.STORE_PLACE_ID_REQUIRED);
        }
        if (candidate.getName() == null || candidate.getName().isBlank()) {
            throw new ValidationException(ApiMessages.STORE_NAME_REQUIRED);
        }
        FieldLengthValidator.checkMaxLength("store_info.place_id", candidate.getPlaceId(), Store.PLACE_ID_MAX_LENGTH);
        FieldLengthValidator.checkMaxLength("store_info.name", candidate.getName().trim(), Store.NAME_MAX_LENGTH);
        FieldLengthValidator.checkMaxLength("store_info.address", candidate.getAddress(), Store.ADDRESS_MAX_LENGTH);
        FieldLengthValidator.checkMaxLength("store_info.link", candidate.getLink(), Store.LINK_MAX_LENGTH);
    }
}
