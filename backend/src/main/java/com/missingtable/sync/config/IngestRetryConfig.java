package com.missingtable.sync.config;

import com.missingtable.sync.exception.TransientIngestionException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.classify.BinaryExceptionClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;

@Configuration
public class IngestRetryConfig {

    // Everything else (validation, unknown references, integrity violations) fails on the first attempt
    static final List<Class<? extends Throwable>> RETRYABLE = List.of(
            TransientIngestionException.class,
            TransientDataAccessException.class,
            RecoverableDataAccessException.class,
            CannotCreateTransactionException.class);

    @Bean(name = "ingestFailureClassifier")
    public BinaryExceptionClassifier ingestFailureClassifier() {
        BinaryExceptionClassifier classifier = new BinaryExceptionClassifier(RETRYABLE, true);
        classifier.setTraverseCauses(true);
        return classifier;
    }

    @Bean(name = "ingestRetryTemplate")
    public RetryTemplate ingestRetryTemplate(BinaryExceptionClassifier ingestFailureClassifier,
                                             @Value("${sync.ingest.retry.max-attempts:4}") int maxAttempts,
                                             @Value("${sync.ingest.retry.initial-interval-ms:1000}") long initialIntervalMs,
                                             @Value("${sync.ingest.retry.multiplier:2.0}") double multiplier,
                                             @Value("${sync.ingest.retry.max-interval-ms:60000}") long maxIntervalMs) {
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(initialIntervalMs);
        backOff.setMultiplier(multiplier);
        backOff.setMaxInterval(maxIntervalMs);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(maxAttempts, ingestFailureClassifier));
        template.setBackOffPolicy(backOff);
        return template;
    }
}
