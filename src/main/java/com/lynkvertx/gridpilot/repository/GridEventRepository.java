package com.lynkvertx.gridpilot.repository;

import com.lynkvertx.gridpilot.entity.GridEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Grid Event Repository
 */
@Repository
public interface GridEventRepository extends JpaRepository<GridEvent, Long> {

    @Query("select e from GridEvent e where e.discomId = :discomId and e.active = true "
        + "and e.startTime <= :now and (e.endTime is null or e.endTime > :now) "
        + "order by e.startTime desc")
    List<GridEvent> findInEffect(@Param("discomId") String discomId, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update GridEvent e set e.active = false "
        + "where e.discomId = :discomId and e.active = true and e.endTime is not null and e.endTime <= :now")
    int expireEnded(@Param("discomId") String discomId, @Param("now") LocalDateTime now);
}
