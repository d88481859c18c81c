package com.ecoWasteEngine.classifier;

import static org.assertj.core.api.Assertions.assertThat;

import com.ecoWasteEngine.config.WasteEngineProperties;
import com.ecoWasteEngine.exception.ClassifierUnavailableException;
import com.ecoWasteEngine.model.StepResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

class ClassifierAdapterTest {

    private static final byte[] IMAGE = {1, 2, 3, 4};

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void successfulPredictionIsReturned() {
        ClassifierAdapter adapter = new ClassifierAdapter(new StubWasteClassifier(), pool, Duration.ofSeconds(1));

        StepResult<ClassifierPrediction> result = adapter.classify(IMAGE, "image/png");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().getModelName()).isEqualTo(StubWasteClassifier.MODEL_NAME);
    }

    @Test
    void timeoutIsReportedAndTheCallIsInterrupted() throws Exception {
        AtomicBoolean interrupted = new AtomicBoolean();
        WasteClassifier hanging = new WasteClassifier() {
            @Override
            public String modelName() {
                return "hanging";
            }

            @Override
            public ClassifierPrediction predict(byte[] image, String contentType) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.set(true);
                    Thread.currentThread().interrupt();
                }
                return null;
            }
        };
        ClassifierAdapter adapter = new ClassifierAdapter(hanging, pool, Duration.ofMillis(100));

        StepResult<ClassifierPrediction> result = adapter.classify(IMAGE, "image/png");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().orElseThrow())
                .isInstanceOfSatisfying(ClassifierUnavailableException.class,
                        e -> assertThat(e.isTimedOut()).isTrue());
        Thread.sleep(200);
        assertThat(interrupted).isTrue();
    }

    @Test
    void exceptionFromTheModelBecomesUnavailable() {
        WasteClassifier broken = new WasteClassifier() {
            @Override
            public String modelName() {
                return "broken";
            }

            @Override
            public ClassifierPrediction predict(byte[] image, String contentType) throws Exception {
                throw new java.io.IOException("connection refused");
            }
        };
        ClassifierAdapter adapter = new ClassifierAdapter(broken, pool, Duration.ofSeconds(1));

        StepResult<ClassifierPrediction> result = adapter.classify(IMAGE, "image/png");

        assertThat(result.getError().orElseThrow())
                .isInstanceOf(ClassifierUnavailableException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void rejectedWorkIsReportedAsUnavailable() {
        ClassifierAdapter adapter = new ClassifierAdapter(new StubWasteClassifier(), command -> {
            throw new RejectedExecutionException("full");
        }, Duration.ofSeconds(1));

        assertThat(adapter.classify(IMAGE, "image/png").isSuccess()).isFalse();
    }

    @Test
    void modelWithoutEndpointFallsBackToTheStub() {
        WasteEngineProperties.Classifier config = new WasteEngineProperties.Classifier();
        config.setType(WasteEngineProperties.Classifier.ClassifierType.CLIP);

        WasteClassifier selected = ClassifierAdapter.selectClassifier(config, new RestTemplate(), new ObjectMapper());

        assertThat(selected).isInstanceOf(StubWasteClassifier.class);
    }

    @Test
    void configuredEndpointSelectsTheHttpVariant() {
        WasteEngineProperties.Classifier config = new WasteEngineProperties.Classifier();
        config.setType(WasteEngineProperties.Classifier.ClassifierType.MOBILENET);
        config.setEndpoint("http://models.local:8500/");

        WasteClassifier selected = ClassifierAdapter.selectClassifier(config, new RestTemplate(), new ObjectMapper());

        assertThat(selected).isInstanceOf(MobileNetClassifier.class);
    }

    @Test
    void stubIsDeterministic() throws Exception {
        StubWasteClassifier stub = new StubWasteClassifier();

        assertThat(stub.predict(IMAGE, "image/png")).isEqualTo(stub.predict(IMAGE.clone(), "image/png"));
    }
}
