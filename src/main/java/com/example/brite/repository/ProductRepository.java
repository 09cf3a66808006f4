package com.example.brite.repository;

import com.example.brite.domain.Product;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProductRepository extends JpaRepository<Product, Long> {

    Optional<Product> findByName(String name);

    Optional<Product> findFirstByMatchKeyOrderByIdAsc(String matchKey);

    List<Product> findByNameContainingIgnoreCaseOrderByNameAsc(String name, Pageable pageable);

    List<Product> findAllByOrderByUpdatedAtDesc(Pageable pageable);

    @Query("select distinct p.category from Product p where p.category is not null and p.category <> '' order by p.category")
    List<String> findDistinctCategories();

    /**
     * 추정 가격만 직접 갱신 (파생 값이므로 마지막 쓰기가 이김)
     */
    @Modifying(clearAutomatically = true)
    @Query("update Product p set p.estimatedPrice = :estimatedPrice, p.updatedAt = :updatedAt where p.id = :id")
    int updateEstimatedPrice(@Param("id") Long id,
                             @Param("estimatedPrice") BigDecimal estimatedPrice,
                             @Param("updatedAt") LocalDateTime updatedAt);
}
