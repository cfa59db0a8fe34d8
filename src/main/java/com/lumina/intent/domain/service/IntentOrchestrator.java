package com.lumina.intent.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.intent.domain.dag.DagExecutor;
import com.lumina.intent.domain.model.AiIntent;
import com.lumina.intent.domain.model.IntentHistory;
import com.lumina.intent.domain.model.ModelAssets;
import com.lumina.intent.domain.model.OrchestratorSettings;
import com.lumina.intent.domain.pipeline.IntentJsonCodec;
import com.lumina.intent.domain.pipeline.IntentPipeline;
import com.lumina.intent.domain.pipeline.PipelineContext;
import com.lumina.intent.domain.port.in.ParseIntentUseCase;
import com.lumina.intent.domain.port.out.ClockPort;
import com.lumina.intent.domain.port.out.ModelPort;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 입력 하나를 고정된 다섯 단계 DAG로 처리하고, 어떤 내부 실패도 호출자에게 예외로 새지 않게 하기 위함.
 *
 * <p>{@code initialize}, {@code parseIntent} and {@code shutdown} are serialized on the instance monitor,
 * which is held for the whole model query. History and last context are published under a separate
 * small lock so diagnostic reads never wait for a query in flight.
 */
public class IntentOrchestrator implements ParseIntentUseCase {

    private static final Logger log = Logger.getLogger(IntentOrchestrator.class);

    static final String PIPELINE_ERROR_TARGET = "pipeline_error";
    static final double PIPELINE_ERROR_CONFIDENCE = 0.0;

    private final OrchestratorSettings settings;
    private final ModelPort modelPort;
    private final ClockPort clockPort;
    private final IntentJsonCodec codec;
    private final IntentPipeline pipeline;
    private final DagExecutor executor;
    private final IntentHistory history;
    private final Object stateLock = new Object();

    private PipelineContext lastContext;
    private volatile boolean initialized;

    public IntentOrchestrator(OrchestratorSettings settings,
                              ModelPort modelPort,
                              ClockPort clockPort,
                              ObjectMapper objectMapper) {
        this(settings, modelPort, clockPort, new IntentJsonCodec(objectMapper),
                IntentPipeline.standard(settings, modelPort, objectMapper));
    }

    public IntentOrchestrator(OrchestratorSettings settings,
                              ModelPort modelPort,
                              ClockPort clockPort,
                              IntentJsonCodec codec,
                              IntentPipeline pipeline) {
        this.settings = settings;
        this.modelPort = modelPort;
        this.clockPort = clockPort;
        this.codec = codec;
        this.pipeline = pipeline;
        this.executor = new DagExecutor(settings.telemetryEnabled());
        this.history = new IntentHistory(settings.maxHistory());
    }

    @Override
    public synchronized boolean initialize(String assetsPath) {
        String resolved = assetsPath == null || assetsPath.isBlank() ? settings.defaultAssetsPath() : assetsPath;
        if (modelPort.isLoaded()) {
            modelPort.release();
        }
        try {
            Path directory = Path.of(resolved);
            Path modelFile = directory.resolve(settings.modelFileName());
            Path grammarFile = directory.resolve(settings.grammarFileName());
            Optional<Path> grammar = Files.isRegularFile(grammarFile) ? Optional.of(grammarFile) : Optional.empty();

            if (!Files.isRegularFile(modelFile)) {
                log.infof("모델 파일이 없어 규칙 전용 모드로 동작합니다: %s", modelFile);
            } else {
                modelPort.load(new ModelAssets(modelFile, grammar), settings.maxLlmTokens());
                log.infof("모델을 로드했습니다: %s (grammar=%s)", modelFile, grammar.map(Path::toString).orElse("none"));
            }
        } catch (InvalidPathException e) {
            log.warnf("자산 경로가 올바르지 않아 규칙 전용 모드로 동작합니다: %s", resolved);
        } catch (RuntimeException e) {
            log.warnf("모델 로드 실패, 규칙 전용 모드로 동작합니다: %s", e.getMessage());
        }
        initialized = true;
        return true;
    }

    @Override
    public synchronized AiIntent parseIntent(String text) {
        if (!initialized) {
            initialize(settings.defaultAssetsPath());
        }
        String input = text == null ? "" : text;
        long timestamp = clockPort.now().toEpochMilli();
        PipelineContext context = new PipelineContext(input, timestamp);

        AiIntent intent;
        try {
            PipelineContext result = executor.run(pipeline.nodes(), pipeline.order(), input, context);
            if (result == null || result.intent().isEmpty()) {
                throw new IllegalStateException("파이프라인이 의도를 만들지 않았습니다.");
            }
            context = result;
            intent = result.intent().get();
        } catch (RuntimeException e) {
            log.errorf(e, "의도 파이프라인 실패: %s", e.getMessage());
            intent = AiIntent.unknown(PIPELINE_ERROR_TARGET, PIPELINE_ERROR_CONFIDENCE, timestamp);
            context.setError(e.toString());
            context.setIntent(intent);
        }

        synchronized (stateLock) {
            history.append(intent);
            lastContext = context;
        }
        return intent;
    }

    @Override
    public String parseIntentJson(String text) {
        return codec.encode(parseIntent(text));
    }

    @Override
    public List<AiIntent> history() {
        synchronized (stateLock) {
            return history.snapshot();
        }
    }

    @Override
    public Optional<PipelineContext> lastContext() {
        synchronized (stateLock) {
            return Optional.ofNullable(lastContext);
        }
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public boolean isModelLoaded() {
        return modelPort.isLoaded();
    }

    @Override
    public synchronized void shutdown() {
        if (!initialized && !modelPort.isLoaded()) {
            return;
        }
        modelPort.release();
        initialized = false;
        log.info("오케스트레이터를 종료했습니다.");
    }
}
