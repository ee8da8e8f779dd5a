package com.solospot.rating.entity;

import com.solospot.rating.validation.RatingValidator;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Rating Entity: 用户对某个地点的单人友好度评分
 * 对应数据库表 'solo_ratings'，同一 (spot_id, user_id) 只允许一条记录。
 *
 * 只能通过 {@link #create} 创建、{@link #update} 修改，两者共用 {@link RatingValidator}。
 * id / spotId / userId / createdAt 创建后不再变化。
 */
@Entity
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA 需要
@Table(name = "solo_ratings",
        uniqueConstraints = @UniqueConstraint(name = "uk_solo_ratings_spot_user", columnNames = {"spot_id", "user_id"}),
        indexes = {
                @Index(name = "idx_solo_ratings_spot", columnList = "spot_id"),
                @Index(name = "idx_solo_ratings_user", columnList = "user_id")
        })
public class Rating {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "spot_id", nullable = false, length = 36)
    private String spotId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    /**
     * 单人友好度 1-5
     */
    @Column(name = "solo_friendly_rating", nullable = false)
    private int score;

    @Convert(converter = RatingCategoryListConverter.class)
    @Column(name = "categories", nullable = false, length = 512)
    private List<RatingCategory> categories = new ArrayList<>();

    @Column(name = "comment", columnDefinition = "text")
    private String comment;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    private Rating(String id, String spotId, String userId, int score, List<RatingCategory> categories,
                   String comment, LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.spotId = spotId;
        this.userId = userId;
        this.score = score;
        this.categories = new ArrayList<>(categories);
        this.comment = comment;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static Rating create(String spotId, String userId, int score, List<String> categories, String comment) {
        return create(spotId, userId, score, categories, comment, Clock.systemDefaultZone());
    }

    /**
     * 校验并创建新评分：生成 UUID，createdAt = updatedAt = now
     *
     * @throws com.solospot.rating.exception.InvalidRatingInputException 任一字段不合法
     */
    public static Rating create(String spotId, String userId, int score, List<String> categories,
                                String comment, Clock clock) {
        List<RatingCategory> resolved = RatingValidator.validate(spotId, userId, score, categories);
        LocalDateTime now = LocalDateTime.now(clock);
        return new Rating(UUID.randomUUID().toString(), spotId, userId, score, resolved, comment, now, now);
    }

    public void update(int newScore, List<String> newCategories, String newComment) {
        update(newScore, newCategories, newComment, Clock.systemDefaultZone());
    }

    /**
     * 用新的分数/分类/评论覆盖当前评分，只刷新 updatedAt。
     * 校验失败时对象保持原样。
     */
    public void update(int newScore, List<String> newCategories, String newComment, Clock clock) {
        List<RatingCategory> resolved = RatingValidator.validate(spotId, userId, newScore, newCategories);
        this.score = newScore;
        this.categories = new ArrayList<>(resolved);
        this.comment = newComment;
        this.updatedAt = LocalDateTime.now(clock);
    }

    public List<RatingCategory> getCategories() {
        return Collections.unmodifiableList(categories);
    }

    /**
     * 分类对外名称，逗号+空格拼接
     */
    public String categoriesAsString() {
        return categories.stream()
                .map(RatingCategory::getWireName)
                .collect(Collectors.joining(", "));
    }

    public boolean isRecentlyUpdated(Duration window) {
        return isRecentlyUpdated(window, Clock.systemDefaultZone());
    }

    public boolean isRecentlyUpdated(Duration window, Clock clock) {
        return updatedAt != null && updatedAt.isAfter(LocalDateTime.now(clock).minus(window));
    }

    /**
     * 独立副本，存储层做快照时使用，修改副本不影响原对象
     */
    public Rating copy() {
        return new Rating(id, spotId, userId, score, categories, comment, createdAt, updatedAt);
    }
}
