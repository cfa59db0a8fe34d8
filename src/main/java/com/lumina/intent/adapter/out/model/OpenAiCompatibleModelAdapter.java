package com.lumina.intent.adapter.out.model;

import com.lumina.intent.config.AppConfig;
import com.lumina.intent.domain.exception.ModelInvocationException;
import com.lumina.intent.domain.model.ModelAssets;
import com.lumina.intent.domain.model.ModelPrompt;
import com.lumina.intent.domain.port.out.ModelPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.Response;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;

/**
 * 왜: 자산 디렉터리의 GGUF 모델을 서빙하는 로컬 OpenAI 호환 추론 서버(llama.cpp server 등)를 모델 포트 계약에 맞게 감싸기 위함.
 */
@IfBuildProperty(name = "lumina.model.backend", stringValue = "openai", enableIfMissing = true)
@ApplicationScoped
public class OpenAiCompatibleModelAdapter implements ModelPort {

    private static final Logger log = Logger.getLogger(OpenAiCompatibleModelAdapter.class);

    private final AppConfig.ModelConfig config;
    private volatile ChatLanguageModel chatModel;

    @Inject
    public OpenAiCompatibleModelAdapter(AppConfig appConfig) {
        this.config = appConfig.model();
    }

    @Override
    public void load(ModelAssets assets, int maxTokens) {
        try {
            String modelName = config.modelName().orElseGet(() -> stripExtension(assets.modelFile().getFileName().toString()));
            assets.grammarFile().ifPresent(grammar ->
                    log.infof("문법 파일은 서버 측 설정으로 적용해야 합니다: %s", grammar));
            this.chatModel = OpenAiChatModel.builder()
                    .baseUrl(config.baseUrl())
                    .apiKey(config.apiKey().orElse("no-key"))
                    .modelName(modelName)
                    .temperature(config.temperature())
                    .maxTokens(maxTokens)
                    .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                    .maxRetries(0)
                    .build();
            log.infof("모델 클라이언트 준비 완료: model=%s baseUrl=%s", modelName, config.baseUrl());
        } catch (RuntimeException e) {
            this.chatModel = null;
            throw new ModelInvocationException("모델 클라이언트 생성 실패: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isLoaded() {
        return chatModel != null;
    }

    @Override
    @Retry(maxRetries = 1, delay = 200, abortOn = IllegalStateException.class)
    public String query(ModelPrompt prompt) {
        ChatLanguageModel current = chatModel;
        if (current == null) {
            throw new IllegalStateException("모델이 로드되지 않았습니다.");
        }
        try {
            Response<AiMessage> response = current.generate(List.of(
                    SystemMessage.from(prompt.systemMessage()),
                    UserMessage.from(prompt.userMessage())
            ));
            if (response == null || response.content() == null || response.content().text() == null) {
                throw new ModelInvocationException("모델 응답이 비어 있습니다.");
            }
            return response.content().text().strip();
        } catch (ModelInvocationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelInvocationException("모델 질의 실패: " + e.getMessage(), e);
        }
    }

    @Override
    public void release() {
        chatModel = null;
    }

    static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
