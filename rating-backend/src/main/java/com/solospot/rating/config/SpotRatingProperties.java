package com.solospot.rating.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * spot-rating.* 配置项
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "spot-rating")
public class SpotRatingProperties {

    private final Reconciliation reconciliation = new Reconciliation();

    /**
     * "最近更新" 的判定窗口（小时）
     */
    private int recentUpdateWindowHours = 24;

    @Data
    public static class Reconciliation {
        private boolean enabled = true;
        // 两次对账之间的间隔（毫秒）
        private long intervalMs = 60000;
        // 除失败登记表外，是否每轮都重算所有地点
        private boolean fullPassEnabled = false;
    }
}
