package com.solospot.rating.entity;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 单人友好度评分的分类标签（封闭词表）。
 * 词表在类加载时构建一次，之后只读，多线程共享无需加锁。
 */
public enum RatingCategory {

    QUIET_ATMOSPHERE("quiet_atmosphere"),
    WIFI_AVAILABLE("wifi_available"),
    SINGLE_SEATING("single_seating"),
    GOOD_LIGHTING("good_lighting"),
    POWER_OUTLETS("power_outlets"),
    COMFORTABLE_SEATING("comfortable_seating"),
    MINIMAL_NOISE("minimal_noise"),
    STUDY_FRIENDLY("study_friendly"),
    WORK_FRIENDLY("work_friendly"),
    READING_FRIENDLY("reading_friendly");

    private static final Map<String, RatingCategory> BY_WIRE_NAME = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(RatingCategory::getWireName, Function.identity())));

    private static final List<String> WIRE_NAMES = Arrays.stream(values())
            .map(RatingCategory::getWireName)
            .collect(Collectors.toUnmodifiableList());

    // 对外（API / 数据库）使用的小写名称
    private final String wireName;

    RatingCategory(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * 按对外名称查找分类，不在词表中时返回 empty
     */
    public static Optional<RatingCategory> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    /**
     * 词表全部名称，按声明顺序
     */
    public static List<String> validWireNames() {
        return WIRE_NAMES;
    }
}
