package io.imagexform.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.imagexform.core.builder.ImagePipeline;
import io.imagexform.core.error.PipelineDefinitionException;
import io.imagexform.core.fixture.Canvas;
import io.imagexform.core.fixture.CanvasAdapter;
import io.imagexform.core.model.Operation;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("PipelineDefinitionParser")
class PipelineDefinitionParserTest {

    private final PipelineDefinitionParser parser = new PipelineDefinitionParser();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("parses format, options and ordered operations")
    void fullDefinition() {
        PipelineDefinition definition = parser.parse("""
                format: png
                loader:
                  page: 0
                saver:
                  quality: 85
                operations:
                  - resize_to_limit: [400, 400]
                  - strip
                  - blur: 2
                  - resize_and_pad: [500, 500, {background: white, gravity: north}]
                """, "inline");

        assertThat(definition.format()).isEqualTo("png");
        assertThat(definition.loaderOptions()).containsEntry("page", 0);
        assertThat(definition.saverOptions()).containsEntry("quality", 85);
        assertThat(definition.operations())
                .extracting(entry -> entry.getKey())
                .containsExactly("resize_to_limit", "strip", "blur", "resize_and_pad");
        assertThat(definition.operations().get(0).getValue()).isEqualTo(List.of(400, 400));
        assertThat(definition.operations().get(1).getValue()).isNull();
    }

    @Test
    @DisplayName("applying a definition builds the same pipeline as the fluent calls")
    void applyTo() {
        PipelineDefinition definition = parser.parse("""
                format: webp
                operations:
                  - resize_and_pad: [500, 500, {background: white}]
                  - blur: 2
                """, "inline");

        ImagePipeline<Canvas> pipeline = definition.applyTo(ImagePipeline.using(new CanvasAdapter()));

        assertThat(pipeline.spec().format()).isEqualTo("webp");
        Operation pad = pipeline.spec().operations().get(0);
        assertThat(pad.name()).isEqualTo("resize_and_pad");
        assertThat(pad.args()).containsExactly(500, 500);
        assertThat(pad.options()).containsEntry("background", "white");
        assertThat(pipeline.spec().operations().get(1).args()).containsExactly(2);
    }

    @Test
    @DisplayName("an empty document is an empty definition")
    void emptyDocument() {
        PipelineDefinition definition = parser.parse("", "empty");

        assertThat(definition.format()).isNull();
        assertThat(definition.operations()).isEmpty();
    }

    @Test
    @DisplayName("reads definitions from files")
    void fromFile() throws IOException {
        Path file = tempDir.resolve("thumb.yaml");
        Files.writeString(file, "operations:\n  - resize_to_fit: [100, 100]\n");

        assertThat(parser.parse(file).operations()).hasSize(1);
    }

    @Test
    @DisplayName("unknown root keys are rejected")
    void unknownKey() {
        assertThatThrownBy(() -> parser.parse("formt: png\n", "typo.yaml"))
                .isInstanceOf(PipelineDefinitionException.class)
                .hasMessageContaining("formt")
                .extracting(e -> ((PipelineDefinitionException) e).source())
                .isEqualTo("typo.yaml");
    }

    @Test
    @DisplayName("operation entries must be a name or a single-key mapping")
    void multiKeyOperation() {
        assertThatThrownBy(() -> parser.parse("operations:\n  - {a: 1, b: 2}\n", "bad.yaml"))
                .isInstanceOf(PipelineDefinitionException.class)
                .hasMessageContaining("operations[0]");
    }

    @Test
    @DisplayName("structural type errors are rejected")
    void wrongShapes() {
        assertThatThrownBy(() -> parser.parse("operations: strip\n", "bad.yaml"))
                .isInstanceOf(PipelineDefinitionException.class);
        assertThatThrownBy(() -> parser.parse("saver: [1, 2]\n", "bad.yaml"))
                .isInstanceOf(PipelineDefinitionException.class);
        assertThatThrownBy(() -> parser.parse("- just a list\n", "bad.yaml"))
                .isInstanceOf(PipelineDefinitionException.class);
    }

    @Test
    @DisplayName("missing file fails with the path as source")
    void missingFile() {
        Path missing = tempDir.resolve("missing.yaml");

        assertThatThrownBy(() -> parser.parse(missing))
                .isInstanceOf(PipelineDefinitionException.class)
                .extracting(e -> ((PipelineDefinitionException) e).source())
                .isEqualTo(missing.toString());
    }
}
