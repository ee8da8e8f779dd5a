package com.solospot.rating;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // 聚合对账定时任务
public class SoloSpotRatingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SoloSpotRatingApplication.class, args);
    }

}
