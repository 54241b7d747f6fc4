package com.jobscout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jobscout.discovery.antibot.CooldownRecovery;
import com.jobscout.discovery.antibot.RecoveryStrategy;
import com.jobscout.discovery.antibot.VerificationDetector;
import com.jobscout.discovery.antibot.VisibleBrowserRecovery;
import com.jobscout.discovery.browser.BrowserSessionFactory;
import com.jobscout.discovery.util.Pacer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Configuration
public class DiscoveryConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Pacer pacer() {
        return new Pacer(Pacer.THREAD_SLEEPER);
    }

    @Bean
    public RecoveryStrategy recoveryStrategy(
        DiscoveryProperties properties,
        BrowserSessionFactory sessionFactory,
        VerificationDetector detector,
        Pacer pacer
    ) {
        DiscoveryProperties.AntiBot antiBot = properties.getAntiBot();
        if ("cooldown".equalsIgnoreCase(antiBot.getRecoveryMode())) {
            List<Duration> steps = antiBot.getCooldownStepsSeconds().stream()
                .map(Duration::ofSeconds)
                .toList();
            return new CooldownRecovery(sessionFactory, detector, pacer, steps);
        }
        return new VisibleBrowserRecovery(
            sessionFactory,
            detector,
            pacer,
            Duration.ofSeconds(antiBot.getVerificationTimeoutSeconds()),
            Duration.ofMillis(antiBot.getVerificationPollMs())
        );
    }
}
