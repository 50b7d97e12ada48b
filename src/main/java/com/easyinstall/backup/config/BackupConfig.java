package com.easyinstall.backup.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class BackupConfig {

    // artifact names and history timestamps are taken from this clock
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
