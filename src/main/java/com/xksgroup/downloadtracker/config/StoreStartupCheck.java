package com.xksgroup.downloadtracker.config;

import com.xksgroup.downloadtracker.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

/**
 * Fails startup when MongoDB cannot be reached. Nothing useful can run without the store.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class StoreStartupCheck implements ApplicationRunner {

    private final MongoTemplate mongoTemplate;

    @Override
    public void run(ApplicationArguments args) {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
            log.info("MongoDB reachable, database '{}'", mongoTemplate.getDb().getName());
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("MongoDB is unreachable at startup", e);
        }
    }
}
