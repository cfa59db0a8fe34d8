package com.lumina.intent.domain.pipeline;

import com.lumina.intent.domain.dag.NodeProcessor;

import java.util.List;
import java.util.Locale;

/**
 * 왜: 분류 전에 입력을 소문자·공백 정리하고 군더더기 표현을 제거해 키워드 매칭을 안정화하기 위함.
 */
public class PreprocessStage implements NodeProcessor<PipelineContext> {

    static final List<String> FILLERS = List.of("please", "can you", "could you", "i want to", "i'd like to");

    private final int maxNormalizedLength;

    public PreprocessStage(int maxNormalizedLength) {
        this.maxNormalizedLength = maxNormalizedLength;
    }

    @Override
    public PipelineContext process(String input, PipelineContext context) {
        String normalized = input == null ? "" : input.toLowerCase(Locale.ROOT).strip();
        for (String filler : FILLERS) {
            normalized = normalized.replace(filler, "").strip();
        }
        // limit counts code points so a surrogate pair is never split
        if (normalized.codePointCount(0, normalized.length()) > maxNormalizedLength) {
            normalized = normalized.substring(0, normalized.offsetByCodePoints(0, maxNormalizedLength));
            context.markTruncated();
        }
        context.setNormalizedInput(normalized);
        context.setOriginalInput(input);
        return context;
    }
}
