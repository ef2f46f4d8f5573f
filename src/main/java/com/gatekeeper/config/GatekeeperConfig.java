package com.gatekeeper.config;

import com.gatekeeper.dos.DosDetector;
import com.gatekeeper.dos.RequestRateDosDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(GatekeeperProperties.class)
public class GatekeeperConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public DosDetector dosDetector(GatekeeperProperties properties, Clock clock) {
        GatekeeperProperties.Dos dos = properties.getDos();
        if (!dos.isEnabled()) {
            log.info("DoS screen disabled");
            return DosDetector.disabled();
        }
        log.info("DoS screen: {} requests per {} per IP, ban {}", dos.getMaxRequests(), dos.getWindow(), dos.getBanDuration());
        return new RequestRateDosDetector(clock, dos.getMaxRequests(), dos.getWindow(),
                dos.getBanDuration(), dos.getMaxTrackedIps());
    }
}
