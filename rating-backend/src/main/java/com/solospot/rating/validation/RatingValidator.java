package com.solospot.rating.validation;

import com.solospot.rating.entity.RatingCategory;
import com.solospot.rating.exception.InvalidRatingInputException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 评分输入校验，新建与更新共用同一套规则。
 * 快速失败：遇到第一个错误立即抛出，不做任何副作用。
 */
public final class RatingValidator {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 5;

    private RatingValidator() {
    }

    /**
     * 校验 spotId / userId 非空
     */
    public static void validateIdentity(String spotId, String userId) {
        if (spotId == null || spotId.isBlank()) {
            throw new InvalidRatingInputException("spotId", "spot ID cannot be empty");
        }
        if (userId == null || userId.isBlank()) {
            throw new InvalidRatingInputException("userId", "user ID cannot be empty");
        }
    }

    public static void validateScore(int score) {
        if (score < MIN_SCORE || score > MAX_SCORE) {
            throw new InvalidRatingInputException("score",
                    "solo-friendly rating must be between " + MIN_SCORE + " and " + MAX_SCORE);
        }
    }

    /**
     * 将分类名称解析为枚举并去重，保留首次出现的顺序。
     * @param categories 对外名称，允许为 null（视为空）
     * @return 去重后的分类列表
     */
    public static List<RatingCategory> resolveCategories(List<String> categories) {
        if (categories == null || categories.isEmpty()) {
            return new ArrayList<>();
        }
        Set<RatingCategory> unique = new LinkedHashSet<>();
        for (String name : categories) {
            RatingCategory category = RatingCategory.fromWireName(name)
                    .orElseThrow(() -> new InvalidRatingInputException("category", name, "invalid category: " + name));
            unique.add(category);
        }
        return new ArrayList<>(unique);
    }

    /**
     * 完整校验，返回去重后的分类
     */
    public static List<RatingCategory> validate(String spotId, String userId, int score, List<String> categories) {
        validateIdentity(spotId, userId);
        validateScore(score);
        return resolveCategories(categories);
    }
}
