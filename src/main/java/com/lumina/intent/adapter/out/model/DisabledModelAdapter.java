package com.lumina.intent.adapter.out.model;

import com.lumina.intent.domain.exception.ModelInvocationException;
import com.lumina.intent.domain.model.ModelAssets;
import com.lumina.intent.domain.model.ModelPrompt;
import com.lumina.intent.domain.port.out.ModelPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * 왜: 추론 서버가 없는 환경에서 모델을 절대 로드하지 않고 규칙 전용으로 동작시키기 위함.
 */
@IfBuildProperty(name = "lumina.model.backend", stringValue = "none")
@ApplicationScoped
public class DisabledModelAdapter implements ModelPort {

    private static final Logger log = Logger.getLogger(DisabledModelAdapter.class);

    @Override
    public void load(ModelAssets assets, int maxTokens) {
        log.infof("[RULE ONLY] 모델 백엔드가 비활성화되어 로드를 건너뜁니다: %s", assets.modelFile());
    }

    @Override
    public boolean isLoaded() {
        return false;
    }

    @Override
    public String query(ModelPrompt prompt) {
        throw new ModelInvocationException("모델 백엔드가 비활성화되어 있습니다.");
    }

    @Override
    public void release() {
        // nothing loaded
    }
}
