package io.keeplast.server.engine;

import io.keeplast.core.Value;
import io.keeplast.core.function.KeepLastFunctions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * keep_last_window over sliding frames. keep_last cannot undo a step, so only the
 * RECOMPUTE policy gives exact results once rows leave the frame.
 */
class WindowExecutorTest {

    private record Row(String value, long ts) {}

    private static final List<Row> ROWS = List.of(
            new Row("big", 100),
            new Row("a", 1),
            new Row("b", 2)
    );

    private FunctionCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new FunctionCatalog();
        KeepLastFunctions.register(catalog);
    }

    private List<Object> run(RetractionPolicy policy, List<Row> rows, WindowFrame frame) {
        return new WindowExecutor(catalog, policy).evaluate("keep_last_window", 4, rows,
                r -> List.of(Value.of(r.value()), Value.of(r.ts()), Value.of(1L), Value.of(1L)),
                frame);
    }

    @Test
    void recompute_is_exact_after_rows_leave_the_frame() {
        List<Object> out = run(RetractionPolicy.RECOMPUTE, ROWS, WindowFrame.rowsPreceding(1));

        assertEquals(List.of("big", "big", "b"), out);
    }

    @Test
    void incremental_keeps_a_winner_that_already_left_the_frame() {
        List<Object> out = run(RetractionPolicy.INCREMENTAL, ROWS, WindowFrame.rowsPreceding(1));

        assertEquals(List.of("big", "big", "big"), out);
    }

    @Test
    void unbounded_frame_never_retracts() {
        List<Object> recompute = run(RetractionPolicy.RECOMPUTE, ROWS, WindowFrame.unboundedPreceding());
        List<Object> incremental = run(RetractionPolicy.INCREMENTAL, ROWS, WindowFrame.unboundedPreceding());

        assertEquals(List.of("big", "big", "big"), recompute);
        assertEquals(recompute, incremental);
    }

    @Test
    void zero_preceding_reports_each_row_alone() {
        List<Object> out = run(RetractionPolicy.RECOMPUTE, ROWS, WindowFrame.rowsPreceding(0));

        assertEquals(List.of("big", "a", "b"), out);
    }

    @Test
    void null_rows_report_null_until_a_value_arrives() {
        List<Row> rows = List.of(new Row(null, 1), new Row("x", 2), new Row(null, 3));

        List<Object> out = run(RetractionPolicy.RECOMPUTE, rows, WindowFrame.unboundedPreceding());

        assertEquals(Arrays.asList(null, "x", "x"), out);
    }

    @Test
    void default_policy_is_recompute() {
        assertEquals(RetractionPolicy.RECOMPUTE, new WindowExecutor(catalog).policy());
    }

    @Test
    void plain_aggregate_is_rejected_over_a_window() {
        var executor = new WindowExecutor(catalog);
        assertThrows(IllegalArgumentException.class, () -> executor.evaluate(
                "keep_last", 4, ROWS, r -> List.of(), WindowFrame.unboundedPreceding()));
    }

    @Test
    void negative_frame_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> WindowFrame.rowsPreceding(-1));
    }
}
