package com.auditchain.api.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Entities and repositories of the core module. Not on the application class, which web
 * slice tests load without a database.
 */
@Configuration
@EntityScan(basePackages = "com.auditchain.core.domain")
@EnableJpaRepositories(basePackages = "com.auditchain.core.repository")
public class JpaConfig {
}
