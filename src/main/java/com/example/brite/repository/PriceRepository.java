package com.example.brite.repository;

import com.example.brite.domain.Price;
import com.example.brite.dto.StoreProductCount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Repository
public interface PriceRepository extends JpaRepository<Price, Long> {

    Optional<Price> findByProductIdAndStoreId(Long productId, Long storeId);

    @Query("select p from Price p join fetch p.store where p.product.id = :productId order by p.amount asc, p.id asc")
    List<Price> findWithStoreByProductId(@Param("productId") Long productId);

    @Query("select p.amount from Price p where p.product.id = :productId")
    List<BigDecimal> findAmountsByProductId(@Param("productId") Long productId);

    @Query("select new com.example.brite.dto.StoreProductCount(s.id, s.name, count(p)) "
            + "from Price p join p.store s group by s.id, s.name order by count(p) desc, s.name asc")
    List<StoreProductCount> countProductsByStore();
}
