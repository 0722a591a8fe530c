package com.openforge.chatrouter.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Turns on JPA auditing so the timestamps on BaseEntity fill themselves in
 * for conversations and memory summaries.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
