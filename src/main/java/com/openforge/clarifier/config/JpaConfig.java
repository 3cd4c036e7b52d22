package com.openforge.clarifier.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Populates createTime / updateTime on BaseEntity.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
