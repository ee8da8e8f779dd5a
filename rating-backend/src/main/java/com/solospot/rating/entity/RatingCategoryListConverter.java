package com.solospot.rating.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 分类列表 <-> 逗号分隔字符串（solo_ratings.categories 列）。
 * 保留列表顺序，读出时遇到未知名称直接报错，说明数据被绕过校验写入。
 */
@Converter
public class RatingCategoryListConverter implements AttributeConverter<List<RatingCategory>, String> {

    private static final String SEPARATOR = ",";

    @Override
    public String convertToDatabaseColumn(List<RatingCategory> categories) {
        if (categories == null) {
            return "";
        }
        return categories.stream()
                .map(RatingCategory::getWireName)
                .collect(Collectors.joining(SEPARATOR));
    }

    @Override
    public List<RatingCategory> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>(Collections.emptyList());
        }
        List<RatingCategory> result = new ArrayList<>();
        for (String name : dbData.split(SEPARATOR)) {
            String trimmed = name.trim();
            RatingCategory category = RatingCategory.fromWireName(trimmed)
                    .orElseThrow(() -> new IllegalStateException("数据库中存在未知的评分分类: " + trimmed));
            result.add(category);
        }
        return result;
    }
}
