package com.candidateprep.coach.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CoachProperties.class)
public class CoachConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
