package com.ecoWasteEngine.classifier;

import com.ecoWasteEngine.config.EngineConfig;
import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.exception.ClassifierUnavailableException;
import com.ecoWasteEngine.model.StepResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wraps the configured classifier variant behind a hard timeout. Every failure
 * (timeout, transport error, bad output) comes back as a failed
 * {@link StepResult} holding a {@link ClassifierUnavailableException}; this
 * class never throws.
 */
@Slf4j
@Component
public class ClassifierAdapter {

    private final WasteClassifier classifier;
    private final Executor executor;
    private final Duration timeout;

    @Autowired
    public ClassifierAdapter(WasteEngineProperties properties,
            RestTemplate restTemplate,
            ObjectMapper objectMapper,
            @Qualifier(EngineConfig.CLASSIFIER_EXECUTOR) TaskExecutor executor) {
        this(selectClassifier(properties.getClassifier(), restTemplate, objectMapper),
                executor,
                properties.getClassifier().getTimeout());
    }

    public ClassifierAdapter(WasteClassifier classifier, Executor executor, Duration timeout) {
        this.classifier = classifier;
        this.executor = executor;
        this.timeout = timeout;
        log.info("[Classifier] Using {} with a {} ms timeout", classifier.modelName(), timeout.toMillis());
    }

    static WasteClassifier selectClassifier(WasteEngineProperties.Classifier config,
            RestTemplate restTemplate, ObjectMapper objectMapper) {
        WasteEngineProperties.Classifier.ClassifierType type = config.getType();
        if (type == WasteEngineProperties.Classifier.ClassifierType.STUB) {
            return new StubWasteClassifier();
        }
        String endpoint = config.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            log.warn("[Classifier] {} selected but no endpoint configured, falling back to the stub", type);
            return new StubWasteClassifier();
        }
        if (type == WasteEngineProperties.Classifier.ClassifierType.CLIP) {
            return new ClipClassifier(restTemplate, objectMapper, endpoint);
        }
        return new MobileNetClassifier(restTemplate, objectMapper, endpoint);
    }

    public String modelName() {
        return classifier.modelName();
    }

    public StepResult<ClassifierPrediction> classify(byte[] image, String contentType) {
        FutureTask<ClassifierPrediction> task = new FutureTask<>(() -> classifier.predict(image, contentType));
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("[Classifier] Worker pool is saturated, skipping classification");
            return StepResult.failed(new ClassifierUnavailableException("Classifier worker pool is saturated", e));
        }

        try {
            ClassifierPrediction prediction = task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (prediction == null) {
                return StepResult.failed(new ClassifierUnavailableException(
                        classifier.modelName() + " returned no prediction", null));
            }
            return StepResult.ok(prediction);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("[Classifier] {} did not answer within {} ms", classifier.modelName(), timeout.toMillis());
            return StepResult.failed(new ClassifierUnavailableException(
                    "Classifier timed out after " + timeout.toMillis() + " ms", e, true));
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            return StepResult.failed(new ClassifierUnavailableException("Interrupted while classifying", e));
        } catch (ExecutionException e) {
            log.warn("[Classifier] {} failed: {}", classifier.modelName(), e.getCause().getMessage());
            return StepResult.failed(new ClassifierUnavailableException(
                    "Classifier failed: " + e.getCause().getMessage(), e.getCause()));
        }
    }
}
