package com.lumina.intent.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.intent.adapter.out.clock.SystemClockAdapter;
import com.lumina.intent.domain.dag.DagNode;
import com.lumina.intent.domain.exception.ModelInvocationException;
import com.lumina.intent.domain.model.AiIntent;
import com.lumina.intent.domain.model.ModelAssets;
import com.lumina.intent.domain.model.OrchestratorSettings;
import com.lumina.intent.domain.pipeline.IntentJsonCodec;
import com.lumina.intent.domain.pipeline.IntentPipeline;
import com.lumina.intent.domain.pipeline.PipelineContext;
import com.lumina.intent.domain.pipeline.StageNames;
import com.lumina.intent.domain.port.out.ClockPort;
import com.lumina.intent.domain.port.out.ModelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntentOrchestratorTest {

    private static final long NOW_MILLIS = 1_760_000_000_000L;

    @TempDir
    Path assetsDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ModelPort modelPort;
    private ClockPort clockPort;
    private OrchestratorSettings settings;
    private IntentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        modelPort = mock(ModelPort.class);
        clockPort = SystemClockAdapter.fixed(Clock.fixed(Instant.ofEpochMilli(NOW_MILLIS), ZoneOffset.UTC));
        settings = OrchestratorSettings.defaults().withDefaultAssetsPath(assetsDir.toString());
        orchestrator = new IntentOrchestrator(settings, modelPort, clockPort, objectMapper);
    }

    @Test
    void dreamy_request_resolves_to_bloom() {
        AiIntent intent = orchestrator.parseIntent("Make it look dreamy");

        assertEquals("add_effect", intent.action());
        assertEquals("bloom", intent.target());
        assertEquals("{}", intent.parameters());
        assertTrue(intent.confidence() >= 0.7);
        assertEquals(NOW_MILLIS, intent.timestamp());
    }

    @Test
    void depth_request_resolves_to_depth_map() {
        AiIntent intent = orchestrator.parseIntent("show me the depth map");

        assertEquals("set_render_mode", intent.action());
        assertEquals("depth_map", intent.target());
        assertTrue(intent.confidence() >= 0.7);
    }

    @Test
    void subtle_blur_carries_low_intensity() throws Exception {
        AiIntent intent = orchestrator.parseIntent("add subtle blur");

        assertEquals("blur", intent.target());
        JsonNode parameters = objectMapper.readTree(intent.parameters());
        assertEquals(0.3, parameters.get("intensity").asDouble());
    }

    @Test
    void empty_and_blank_input_yield_guardrail_intent() {
        AiIntent empty = orchestrator.parseIntent("");
        AiIntent blank = orchestrator.parseIntent("   ");
        AiIntent missing = orchestrator.parseIntent(null);

        for (AiIntent intent : List.of(empty, blank, missing)) {
            assertEquals("unknown", intent.action());
            assertEquals("empty_input", intent.target());
            assertTrue(intent.confidence() <= 0.2);
        }
    }

    @Test
    void confident_rule_never_reaches_model() {
        when(modelPort.isLoaded()).thenReturn(true);

        orchestrator.parseIntent("help");
        orchestrator.parseIntent("take a screenshot");

        verify(modelPort, never()).query(any());
    }

    @Test
    void model_answer_with_invalid_target_is_ignored() {
        when(modelPort.isLoaded()).thenReturn(true);
        when(modelPort.query(any())).thenReturn(
                "{\"action\": \"add_effect\", \"target\": \"notreal\", \"parameters\": \"{}\", \"confidence\": 0.95}");

        AiIntent intent = orchestrator.parseIntent("add blur");

        assertEquals("add_effect", intent.action());
        assertEquals("blur", intent.target());
        verify(modelPort).query(any());
    }

    @Test
    void trusted_model_answer_is_adopted() {
        when(modelPort.isLoaded()).thenReturn(true);
        when(modelPort.query(any())).thenReturn(
                "Here you go: {\"action\": \"adjust_parameter\", \"target\": \"bloom\", \"parameters\": \"{}\", \"confidence\": 0.8}");

        AiIntent intent = orchestrator.parseIntent("tone it down a notch");

        assertEquals("adjust_parameter", intent.action());
        assertEquals("bloom", intent.target());
        assertEquals("{\"intensity\":0.5}", intent.parameters());
        assertEquals(0.8, intent.confidence());
    }

    @Test
    void model_failure_degrades_to_rule_result() {
        when(modelPort.isLoaded()).thenReturn(true);
        when(modelPort.query(any())).thenThrow(new ModelInvocationException("connection refused"));

        AiIntent intent = orchestrator.parseIntent("add some grain");

        assertEquals("add_effect", intent.action());
        assertEquals("noise", intent.target());
        assertThat(orchestrator.lastContext()).hasValueSatisfying(context -> assertThat(context.error()).isEmpty());
    }

    @Test
    void history_keeps_only_most_recent_entries() {
        OrchestratorSettings small = new OrchestratorSettings(0.9, 96, 512, 0.5, true, 3,
                assetsDir.toString(), "model.gguf", "grammar.gbnf");
        IntentOrchestrator bounded = new IntentOrchestrator(small, modelPort, clockPort, objectMapper);

        List<String> inputs = List.of("help", "reset", "add blur", "add bloom", "show depth");
        inputs.forEach(bounded::parseIntent);

        List<AiIntent> history = bounded.history();
        assertThat(history).hasSize(3);
        assertThat(history).extracting(AiIntent::target).containsExactly("blur", "bloom", "depth_map");
    }

    @Test
    void failing_stage_is_converted_to_low_confidence_unknown() {
        IntentPipeline broken = IntentPipeline.standard(settings, modelPort, objectMapper)
                .withNode(DagNode.<PipelineContext>after(StageNames.EXTRACT, StageNames.VALIDATE, (input, context) -> {
                    throw new IllegalStateException("boom");
                }));
        IntentOrchestrator failing = new IntentOrchestrator(settings, modelPort, clockPort,
                new IntentJsonCodec(objectMapper), broken);

        AiIntent intent = failing.parseIntent("add blur");

        assertEquals("unknown", intent.action());
        assertEquals("pipeline_error", intent.target());
        assertTrue(intent.confidence() <= 0.1);
        assertEquals(NOW_MILLIS, intent.timestamp());
        assertThat(failing.history()).containsExactly(intent);
        PipelineContext context = failing.lastContext().orElseThrow();
        assertThat(context.error()).hasValueSatisfying(error -> assertThat(error).contains("boom"));
        assertThat(context.intent()).contains(intent);
    }

    @Test
    void invalid_graph_is_reported_as_pipeline_error() {
        IntentPipeline unordered = new IntentPipeline(
                IntentPipeline.standard(settings, modelPort, objectMapper).nodes(),
                List.of(StageNames.CLASSIFY, StageNames.PREPROCESS, StageNames.EXTRACT, StageNames.VALIDATE,
                        StageNames.FINALIZE));
        IntentOrchestrator failing = new IntentOrchestrator(settings, modelPort, clockPort,
                new IntentJsonCodec(objectMapper), unordered);

        AiIntent intent = failing.parseIntent("add blur");

        assertEquals("pipeline_error", intent.target());
        assertThat(failing.lastContext().orElseThrow().error())
                .hasValueSatisfying(error -> assertThat(error).contains("dependency order violation"));
    }

    @Test
    void last_context_records_every_stage_timing() {
        orchestrator.parseIntent("add blur");

        PipelineContext context = orchestrator.lastContext().orElseThrow();
        assertThat(context.nodeTimings().keySet()).containsExactlyElementsOf(StageNames.EXECUTION_ORDER);
        assertThat(context.validated()).isTrue();
        assertThat(context.normalizedInput()).isEqualTo("add blur");
    }

    @Test
    void parse_intent_json_embeds_parameters_as_string() throws Exception {
        JsonNode node = objectMapper.readTree(orchestrator.parseIntentJson("add blur at 40%"));

        assertEquals("add_effect", node.get("action").asText());
        assertTrue(node.get("parameters").isTextual());
        assertEquals(0.4, objectMapper.readTree(node.get("parameters").asText()).get("intensity").asDouble());
    }

    @Test
    void parse_before_initialize_initializes_lazily() {
        assertThat(orchestrator.isInitialized()).isFalse();

        orchestrator.parseIntent("help");

        assertThat(orchestrator.isInitialized()).isTrue();
    }

    @Test
    void initialize_without_model_file_runs_rule_only() {
        assertTrue(orchestrator.initialize(assetsDir.toString()));

        assertTrue(orchestrator.isInitialized());
        verify(modelPort, never()).load(any(), anyInt());
    }

    @Test
    void initialize_with_missing_directory_still_succeeds() {
        assertTrue(orchestrator.initialize(assetsDir.resolve("does-not-exist").toString()));

        verify(modelPort, never()).load(any(), anyInt());
    }

    @Test
    void initialize_loads_model_and_grammar_when_present() throws Exception {
        Path model = Files.writeString(assetsDir.resolve(settings.modelFileName()), "gguf");
        Path grammar = Files.writeString(assetsDir.resolve(settings.grammarFileName()), "root ::= object");

        assertTrue(orchestrator.initialize(assetsDir.toString()));

        verify(modelPort).load(new ModelAssets(model, Optional.of(grammar)), settings.maxLlmTokens());
    }

    @Test
    void initialize_with_blank_path_uses_default_assets_path() throws Exception {
        Path model = Files.writeString(assetsDir.resolve(settings.modelFileName()), "gguf");

        orchestrator.initialize("  ");

        verify(modelPort).load(new ModelAssets(model, Optional.empty()), settings.maxLlmTokens());
    }

    @Test
    void initialize_survives_model_load_failure() throws Exception {
        Files.writeString(assetsDir.resolve(settings.modelFileName()), "gguf");
        doThrow(new ModelInvocationException("bad model")).when(modelPort).load(any(), anyInt());

        assertTrue(orchestrator.initialize(assetsDir.toString()));
        assertTrue(orchestrator.isInitialized());
        assertEquals("help", orchestrator.parseIntent("help").action());
    }

    @Test
    void reinitialize_releases_loaded_model_first() {
        when(modelPort.isLoaded()).thenReturn(true);

        orchestrator.initialize(assetsDir.toString());

        verify(modelPort).release();
    }

    @Test
    void shutdown_is_idempotent() {
        orchestrator.initialize(assetsDir.toString());

        orchestrator.shutdown();
        orchestrator.shutdown();

        verify(modelPort, times(1)).release();
        assertThat(orchestrator.isInitialized()).isFalse();
    }

    @Test
    void shutdown_before_initialize_does_nothing() {
        orchestrator.shutdown();

        verify(modelPort, never()).release();
    }
}
