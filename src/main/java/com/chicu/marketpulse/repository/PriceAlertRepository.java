package com.chicu.marketpulse.repository;

import com.chicu.marketpulse.domain.PriceAlertEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface PriceAlertRepository extends JpaRepository<PriceAlertEntity, Long> {

    List<PriceAlertEntity> findByActiveTrueOrderByIdAsc();

    List<PriceAlertEntity> findByOwnerAndActiveTrueOrderByIdAsc(String owner);

    // =====================================================
    // условные апдейты: срабатывают только на активном алерте
    // =====================================================

    @Transactional
    @Modifying
    @Query("""
        update PriceAlertEntity a
           set a.active = false,
               a.triggeredAt = :ts
         where a.id = :id
           and a.active = true
    """)
    int markTriggered(@Param("id") Long id, @Param("ts") Instant ts);

    @Transactional
    @Modifying
    @Query("""
        update PriceAlertEntity a
           set a.active = false
         where a.id = :id
           and a.active = true
    """)
    int deactivate(@Param("id") Long id);
}
