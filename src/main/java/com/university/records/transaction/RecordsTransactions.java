package com.university.records.transaction;

import com.university.records.error.DatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

@Component
public class RecordsTransactions {
    private static final Logger log = LoggerFactory.getLogger(RecordsTransactions.class);

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;

    public RecordsTransactions(PlatformTransactionManager transactionManager,
                               @Value("${records.transaction.timeout-seconds:10}") int timeoutSeconds,
                               @Value("${records.transaction.isolation:READ_COMMITTED}") Isolation isolation) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setIsolationLevel(isolation.value());
        this.writeTemplate.setTimeout(timeoutSeconds);

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setIsolationLevel(isolation.value());
        this.readTemplate.setTimeout(timeoutSeconds);
        this.readTemplate.setReadOnly(true);
    }

    public <T> T write(String operation, Supplier<T> work) {
        return execute(writeTemplate, operation, work);
    }

    public void run(String operation, Runnable work) {
        execute(writeTemplate, operation, () -> {
            work.run();
            return null;
        });
    }

    public <T> T read(String operation, Supplier<T> work) {
        return execute(readTemplate, operation, work);
    }

    private <T> T execute(TransactionTemplate template, String operation, Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (DataAccessException e) {
            log.warn("{} rolled back, store reported: {}", operation, e.getMostSpecificCause().getMessage());
            throw new DatabaseException(operation + " failed: the store rejected the change.", e);
        } catch (TransactionException e) {
            log.warn("{} rolled back, transaction failure: {}", operation, e.getMessage());
            throw new DatabaseException(operation + " failed: the transaction could not complete.", e);
        }
    }
}
