package com.tsc.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BusinessTimeConfig {

    @Bean
    public ZoneId businessZoneId(RegistrationProperties registrationProperties) {
        return ZoneId.of(registrationProperties.getZone());
    }

    @Bean
    public Clock businessClock(ZoneId businessZoneId) {
        return Clock.system(businessZoneId);
    }
}
