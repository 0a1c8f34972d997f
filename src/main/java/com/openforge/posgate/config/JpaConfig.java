package com.openforge.posgate.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Fills create_time on {@code BaseEntity} from the application
 * {@link Clock}, the same clock that stamps tokens and audit entries.
 */
@Configuration
@EnableJpaAuditing(dateTimeProviderRef = "entityTimestamps")
public class JpaConfig {

    @Bean
    public DateTimeProvider entityTimestamps(Clock clock) {
        return () -> Optional.of(LocalDateTime.now(clock));
    }
}
