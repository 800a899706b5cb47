package com.gt.recall.conf;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class BeanConfig {

    // All scheduling math runs in UTC
    @Bean
    public Clock getClock() {
        return Clock.systemUTC();
    }
}
