package com.openforge.mcpchat.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/** Repositories live in one package; auditing fills BaseEntity.createdAt. */
@Configuration
@EnableJpaAuditing
@EnableJpaRepositories(basePackages = "com.openforge.mcpchat.repository")
public class JpaConfig {
}
