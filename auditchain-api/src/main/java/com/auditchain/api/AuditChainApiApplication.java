package com.auditchain.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AuditChain API Application
 *
 * Tamper-evident audit trail: per-tenant hash chains with externally exported checkpoints.
 */
@SpringBootApplication(scanBasePackages = "com.auditchain")
public class AuditChainApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuditChainApiApplication.class, args);
    }
}
