package com.lanewatch.backend.config;

import com.lanewatch.backend.service.LaneLayoutService;
import com.lanewatch.backend.service.TrafficAnalysisEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TrafficProperties.class)
public class TrafficConfig {

    @Bean
    public Clock trafficClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TrafficAnalysisEngine trafficAnalysisEngine(TrafficProperties properties,
                                                       LaneLayoutService laneLayoutService,
                                                       Clock trafficClock) {
        return new TrafficAnalysisEngine(properties, laneLayoutService.getLanes(), trafficClock.millis());
    }
}
