package com.lumina.intent.domain.classifier;

import com.lumina.intent.domain.model.Classification;
import com.lumina.intent.domain.model.ClassificationSource;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RuleClassifierTest {

    private final RuleClassifier classifier = new RuleClassifier(new IntensityExtractor());

    @Test
    void dreamyMapsToBloom() {
        Classification result = classifier.classify("make it look dreamy");

        assertThat(result.action()).isEqualTo("add_effect");
        assertThat(result.target()).isEqualTo("bloom");
        assertThat(result.confidence()).isEqualTo(0.7);
        assertThat(result.parameters()).isEmpty();
        assertThat(result.source()).isEqualTo(ClassificationSource.RULE);
    }

    @Test
    void depthMapsToRenderMode() {
        Classification result = classifier.classify("show me the depth map");

        assertThat(result.action()).isEqualTo("set_render_mode");
        assertThat(result.target()).isEqualTo("depth_map");
        assertThat(result.confidence()).isEqualTo(0.75);
    }

    @Test
    void subtleBlurCarriesIntensity() {
        Classification result = classifier.classify("add subtle blur");

        assertThat(result.action()).isEqualTo("add_effect");
        assertThat(result.target()).isEqualTo("blur");
        assertThat(result.parameters()).isEqualTo(Map.of("intensity", 0.3));
    }

    @Test
    void percentageWinsOverAdjective() {
        Classification result = classifier.classify("add some blur, about 50%");

        assertThat(result.parameters()).containsEntry("intensity", 0.5);
    }

    @Test
    void offTurnsEffectIntoRemoval() {
        Classification result = classifier.classify("turn off the blur");

        assertThat(result.action()).isEqualTo("remove_effect");
        assertThat(result.target()).isEqualTo("blur");
    }

    @Test
    void renderModeTableTakesPrecedenceOverControlWords() {
        // "clear" is both a passthrough keyword and a reset keyword
        Classification result = classifier.classify("clear");

        assertThat(result.action()).isEqualTo("set_render_mode");
        assertThat(result.target()).isEqualTo("passthrough");
    }

    @Test
    void normalResolvesToPassthroughBeforeNormalMap() {
        Classification result = classifier.classify("go back to normal");

        assertThat(result.target()).isEqualTo("passthrough");
    }

    @Test
    void controlWordsFollowPriorityChain() {
        assertThat(classifier.classify("take a screenshot").action()).isEqualTo("capture_frame");
        assertThat(classifier.classify("take a screenshot").confidence()).isEqualTo(0.9);
        assertThat(classifier.classify("start recording").action()).isEqualTo("start_recording");
        assertThat(classifier.classify("stop now").action()).isEqualTo("stop_recording");
        assertThat(classifier.classify("stop now").confidence()).isEqualTo(0.85);
        assertThat(classifier.classify("reset everything").action()).isEqualTo("reset");
        assertThat(classifier.classify("help").action()).isEqualTo("help");
        assertThat(classifier.classify("help").confidence()).isEqualTo(0.95);
    }

    @Test
    void captureBeatsRecordingWhenBothPresent() {
        assertThat(classifier.classify("snap a photo while you record").action()).isEqualTo("capture_frame");
    }

    @Test
    void controlMatchesHaveEmptyTarget() {
        assertThat(classifier.classify("help").target()).isEmpty();
    }

    @Test
    void noMatchIsUnknownAtHalfConfidence() {
        Classification result = classifier.classify("xyzzy");

        assertThat(result.action()).isEqualTo("unknown");
        assertThat(result.confidence()).isEqualTo(0.5);
        assertThat(result.target()).isEmpty();
    }
}
