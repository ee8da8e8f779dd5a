package com.solospot.rating.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Spot Entity: 可被评分的地点
 * averageRating / reviewCount 为物化的聚合统计，只由评分服务重算后写回。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "spots", indexes = {
        @Index(name = "idx_spots_location", columnList = "latitude, longitude"),
        @Index(name = "idx_spots_category", columnList = "category")
})
public class Spot {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "latitude", nullable = false, precision = 10, scale = 8)
    private BigDecimal latitude;

    @Column(name = "longitude", nullable = false, precision = 11, scale = 8)
    private BigDecimal longitude;

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    @Column(name = "address", columnDefinition = "text")
    private String address;

    // ISO 3166-1 alpha-2
    @Column(name = "country_code", length = 2)
    private String countryCode;

    /**
     * 所有评分的算术平均，无评分时为 0（不做四舍五入）
     */
    @Column(name = "average_rating", nullable = false)
    private double averageRating = 0.0;

    @Column(name = "review_count", nullable = false)
    private int reviewCount = 0;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt = LocalDateTime.now();
}
