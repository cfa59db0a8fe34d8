package com.lumina.intent.domain.pipeline;

import java.util.List;

public final class StageNames {

    public static final String PREPROCESS = "preprocess";
    public static final String CLASSIFY = "classify";
    public static final String EXTRACT = "extract";
    public static final String VALIDATE = "validate";
    public static final String FINALIZE = "finalize";

    public static final List<String> EXECUTION_ORDER = List.of(PREPROCESS, CLASSIFY, EXTRACT, VALIDATE, FINALIZE);

    private StageNames() {
    }
}
