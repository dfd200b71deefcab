package io.imagexform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.imagexform.core.engine.OperationResolver.Kind;
import io.imagexform.core.error.ImageXformException.Phase;
import io.imagexform.core.error.UnknownOperationException;
import io.imagexform.core.fixture.Canvas;
import io.imagexform.core.fixture.CanvasAdapter;
import io.imagexform.core.model.Operation;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OperationResolver")
class OperationResolverTest {

    private final CanvasAdapter adapter = new CanvasAdapter();
    private final Canvas canvas = new Canvas(600, 800);

    @Test
    @DisplayName("classifies custom, macro and pass-through names")
    void classification() {
        assertThat(OperationResolver.resolve(adapter, "custom")).isEqualTo(Kind.CUSTOM);
        assertThat(OperationResolver.resolve(adapter, "resize_to_limit")).isEqualTo(Kind.MACRO);
        assertThat(OperationResolver.resolve(adapter, "blur")).isEqualTo(Kind.PASS_THROUGH);
    }

    @Test
    @DisplayName("a name registered as both resolves to the macro")
    void macroWins() {
        Canvas result = OperationResolver.apply(adapter, Operation.of("sharpen", List.of()), canvas);

        assertThat(result.history()).containsExactly("sharpen:macro");
    }

    @Test
    @DisplayName("macro receives its positional arguments")
    void macroArguments() {
        Operation operation = Operation.of("resize_to_limit", Arrays.asList(null, 400));

        Canvas result = OperationResolver.apply(adapter, operation, canvas);

        assertThat(result.width()).isEqualTo(300);
        assertThat(result.height()).isEqualTo(400);
    }

    @Test
    @DisplayName("pass-through result of the accumulator type replaces the accumulator")
    void passThroughReplaces() {
        Canvas result = OperationResolver.apply(adapter, Operation.of("blur", List.of(3)), canvas);

        assertThat(result.history()).containsExactly("blur:3");
    }

    @Test
    @DisplayName("pass-through returning another type keeps the accumulator")
    void inspectionKeeps() {
        assertThat(OperationResolver.apply(adapter, Operation.of("width", List.of()), canvas)).isSameAs(canvas);
        assertThat(OperationResolver.apply(adapter, Operation.of("noop", List.of()), canvas)).isSameAs(canvas);
    }

    @Test
    @DisplayName("custom callback result replaces the accumulator; null keeps it")
    void customCallback() {
        Canvas replaced = OperationResolver.apply(adapter, Operation.custom((Canvas c) -> c.with("custom")), canvas);
        Canvas kept = OperationResolver.apply(adapter, Operation.custom((Canvas c) -> null), canvas);

        assertThat(replaced.history()).containsExactly("custom");
        assertThat(kept).isSameAs(canvas);
    }

    @Test
    @DisplayName("unregistered name fails without reaching the engine")
    void unknownName() {
        assertThatThrownBy(() -> OperationResolver.apply(adapter, Operation.of("getClass", List.of()), canvas))
                .isInstanceOf(UnknownOperationException.class)
                .hasMessageContaining("getClass")
                .satisfies(e -> {
                    UnknownOperationException ex = (UnknownOperationException) e;
                    assertThat(ex.engineId()).isEqualTo("canvas");
                    assertThat(ex.phase()).isEqualTo(Phase.TRANSFORM);
                });
    }
}
