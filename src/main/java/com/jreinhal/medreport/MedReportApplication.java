package com.jreinhal.medreport;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.core.env.Environment;

@SpringBootApplication
public class MedReportApplication {
    private static final Logger log = LoggerFactory.getLogger(MedReportApplication.class);
    private final Environment environment;

    public MedReportApplication(Environment environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(MedReportApplication.class, (String[])args);
    }

    @PostConstruct
    public void logStoreConfiguration() {
        String timeout = this.environment.getProperty("medreport.store.operation-timeout", "PT5S");
        String attempts = this.environment.getProperty("medreport.store.max-attempts", "3");
        String staleClaim = this.environment.getProperty("medreport.ledger.stale-claim-timeout", "PT30S");
        boolean auditFailClosed = this.environment.getProperty("medreport.audit.fail-closed", Boolean.class, false);
        log.info("Store: operation timeout {}, {} attempt(s) per call; ledger stale-claim timeout {}", timeout, attempts, staleClaim);
        if (auditFailClosed) {
            log.info("Audit logging is fail-closed: mutations fail when their audit record cannot be written");
        }
    }
}
