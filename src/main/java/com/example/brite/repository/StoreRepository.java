package com.example.brite.repository;

import com.example.brite.domain.Store;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StoreRepository extends JpaRepository<Store, Long> {

    Optional<Store> findByPlaceId(String placeId);

    List<Store> findAllByOrderByNameAsc();
}
