package com.solospot.rating.repository;

import com.solospot.rating.entity.Spot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface SpotRepository extends JpaRepository<Spot, String> {

    /**
     * 只更新聚合统计两列，不覆盖地点的其他字段
     * @return 受影响行数，0 表示地点不存在
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Spot s SET s.averageRating = :averageRating, s.reviewCount = :reviewCount, " +
           "s.updatedAt = :updatedAt WHERE s.id = :spotId")
    int updateAggregate(@Param("spotId") String spotId,
                        @Param("averageRating") double averageRating,
                        @Param("reviewCount") int reviewCount,
                        @Param("updatedAt") LocalDateTime updatedAt);

    @Query("SELECT s.id FROM Spot s")
    List<String> findAllIds();
}
