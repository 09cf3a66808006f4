package com.example.brite.repository;

import com.example.brite.domain.BarcodeMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BarcodeMappingRepository extends JpaRepository<BarcodeMapping, Long> {

    Optional<BarcodeMapping> findByBarcode(String barcode);
}
