package com.missingtable.sync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.missingtable.sync.dto.IngestionOutcome;
import com.missingtable.sync.dto.MatchMessage;
import com.missingtable.sync.exception.ValidationException;
import com.missingtable.sync.model.DeadLetterCategory;
import com.missingtable.sync.model.DeadLetterMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.classify.BinaryExceptionClassifier;
import org.springframework.retry.RetryContext;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Entry point for every ingestion path (queue, REST, CSV, replay). Validates once, then
 * runs the unit of work under the retry policy. Every message ends either applied or in
 * the dead-letter table; the only exception that escapes is a failure to write the dead letter.
 */
@Service
public class RetryingIngestionExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryingIngestionExecutor.class);

    private final MatchMessageValidator validator;
    private final MatchIngestionService ingestionService;
    private final DeadLetterService deadLetterService;
    private final RetryTemplate retryTemplate;
    private final BinaryExceptionClassifier failureClassifier;
    private final ObjectMapper objectMapper;

    public RetryingIngestionExecutor(MatchMessageValidator validator,
                                     MatchIngestionService ingestionService,
                                     DeadLetterService deadLetterService,
                                     @Qualifier("ingestRetryTemplate") RetryTemplate retryTemplate,
                                     @Qualifier("ingestFailureClassifier") BinaryExceptionClassifier failureClassifier,
                                     ObjectMapper objectMapper) {
        this.validator = validator;
        this.ingestionService = ingestionService;
        this.deadLetterService = deadLetterService;
        this.retryTemplate = retryTemplate;
        this.failureClassifier = failureClassifier;
        this.objectMapper = objectMapper;
    }

    public IngestionOutcome execute(String rawPayload) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            return deadLetter(rawPayload, DeadLetterCategory.VALIDATION, "Malformed JSON: " + e.getOriginalMessage(), 0);
        }
        return execute(payload, rawPayload);
    }

    public IngestionOutcome execute(JsonNode payload) {
        return execute(payload, payload == null ? "null" : payload.toString());
    }

    private IngestionOutcome execute(JsonNode payload, String raw) {
        MatchMessage message;
        try {
            message = validator.validate(payload);
        } catch (ValidationException e) {
            return deadLetter(raw, DeadLetterCategory.VALIDATION, e.getMessage(), 0);
        }
        return retryTemplate.execute(ctx -> {
            if (ctx.getRetryCount() > 0) {
                log.info("[Ingest][Retry] attempt {} for {} after: {}", ctx.getRetryCount() + 1,
                        message.describe(), ctx.getLastThrowable().getMessage());
            }
            return ingestionService.ingest(message).withAttempts(ctx.getRetryCount() + 1);
        }, ctx -> recover(raw, message, ctx));
    }

    private IngestionOutcome recover(String raw, MatchMessage message, RetryContext ctx) {
        Throwable last = ctx.getLastThrowable();
        int attempts = ctx.getRetryCount();
        DeadLetterCategory category;
        if (last instanceof ValidationException) {
            category = DeadLetterCategory.VALIDATION;
        } else if (failureClassifier.classify(last)) {
            category = DeadLetterCategory.EXHAUSTED_RETRIES;
        } else {
            category = DeadLetterCategory.PERMANENT_FAILURE;
            log.error("[Ingest][Failure] {} failed permanently", message.describe(), last);
        }
        return deadLetter(raw, category, describe(last), attempts);
    }

    private IngestionOutcome deadLetter(String raw, DeadLetterCategory category, String error, int attempts) {
        DeadLetterMessage dl = deadLetterService.record(raw, category, error, attempts);
        return IngestionOutcome.deadLettered(dl.getId(), category, category.label() + ": " + error, attempts);
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown error";
        return t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
