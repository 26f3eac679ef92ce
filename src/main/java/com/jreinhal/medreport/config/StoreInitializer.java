package com.jreinhal.medreport.config;

import com.jreinhal.medreport.ledger.MongoVersionLedger;
import com.jreinhal.medreport.repository.MongoReportStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Store preparation on startup.
 *
 * The ledger's unique (reportId, versionNumber) index must exist before the first append; without it two
 * concurrent saves could record the same version number. Startup fails if the index cannot be created.
 */
@Configuration
public class StoreInitializer {

    private static final Logger log = LoggerFactory.getLogger(StoreInitializer.class);

    @Value("${medreport.store.ensure-indexes:true}")
    private boolean ensureIndexes;

    @Bean
    public CommandLineRunner initStoreIndexes(MongoVersionLedger versionLedger, MongoReportStore reportStore) {
        return args -> {
            if (!ensureIndexes) {
                log.warn("Index creation disabled via configuration; the ledger index must be provisioned externally");
                return;
            }
            versionLedger.ensureIndexes();
            reportStore.ensureIndexes();
        };
    }
}
