package com.cronpilot.scheduler.config;

import com.cronpilot.scheduler.schedule.ScheduleZone;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties({SchedulerProperties.class, JobDefinitionsProperties.class})
public class SchedulerConfig {

    /** All "now" reads go through this bean so tests can pin the time. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ScheduleZone scheduleZone(SchedulerProperties props) {
        return new ScheduleZone(ZoneId.of(props.zone()));
    }
}
