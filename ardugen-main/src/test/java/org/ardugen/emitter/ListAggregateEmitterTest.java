package org.ardugen.emitter;

import org.ardugen.UnknownSelectorException;
import org.ardugen.session.GenerationSession;
import org.ardugen.session.HelperDefinition;
import org.ardugen.testutil.SketchInterpreter;
import org.ardugen.tree.ArithmeticNode;
import org.ardugen.tree.ArithmeticOperator;
import org.ardugen.tree.ListOperation;
import org.ardugen.tree.NumberNode;
import org.ardugen.tree.OnListNode;
import org.ardugen.tree.VariableGetNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ListAggregateEmitterTest {

    private static final double NAN = Double.NaN;

    private final MathEmitter emitter = new MathEmitter();
    private GenerationSession session;

    @BeforeEach
    void setUp() {
        session = new GenerationSession();
    }

    private String call(ListOperation operation) {
        return emitter.emit(new OnListNode(operation, new VariableGetNode("readings")), session).text();
    }

    /**
     * Emits the aggregate over {@code readings} and runs it against the given values.
     */
    private Object run(ListOperation operation, double... readings) {
        String code = call(operation);
        return new SketchInterpreter()
                .defineAll(session.definitions())
                .global("readings", readings)
                .evaluate(code);
    }

    @Test
    void call_passesArrayAndLength() {
        EmissionResult result = emitter.emit(new OnListNode(ListOperation.SUM, new VariableGetNode("readings")), session);

        assertThat(result.text()).isEqualTo("math_sum(readings, sizeof(readings) / sizeof(readings[0]))");
        assertThat(result.strength()).isEqualTo(BindingStrength.UNARY_POSTFIX);
    }

    @Test
    void call_unconnectedListPassesEmptyList() {
        String code = emitter.emit(new OnListNode(ListOperation.MAX, null), session).text();

        assertThat(code).isEqualTo("math_max(NULL, 0)");
        assertThat(new SketchInterpreter().defineAll(session.definitions()).evaluate(code))
                .isEqualTo(NAN);
    }

    @Test
    void helpers_namedPerOperation() {
        for (ListOperation operation : ListOperation.values()) {
            call(operation);
        }

        assertThat(session.definitions()).extracting(HelperDefinition::key).containsExactly(
                "math_sum", "math_min", "math_max", "math_average",
                "math_nth_smallest", "math_median", "math_mode",
                "math_standard_deviation", "math_random_item");
    }

    @Test
    void helpers_registeredOncePerSession() {
        call(ListOperation.SUM);
        call(ListOperation.SUM);
        call(ListOperation.MEDIAN);
        call(ListOperation.MODE);

        assertThat(session.definitions()).extracting(HelperDefinition::key)
                .containsExactly("math_sum", "math_nth_smallest", "math_median", "math_mode");
    }

    @Test
    void median_referencesSelectionHelperByIssuedName() {
        session.issueUniqueName("math_nth_smallest");
        call(ListOperation.MEDIAN);

        HelperDefinition selection = session.helper("math_nth_smallest").orElseThrow();
        assertThat(selection.name()).isEqualTo("math_nth_smallest2");
        assertThat(session.helper("math_median").orElseThrow().source())
                .contains("return math_nth_smallest2(myList, size, index);");
    }

    @Test
    void sum_minAndMax() {
        assertThat(run(ListOperation.SUM, 1, 2.5, 3)).isEqualTo(6.5);
        assertThat(run(ListOperation.SUM)).isEqualTo(0.0);
        assertThat(run(ListOperation.MIN, 4, -2, 7)).isEqualTo(-2.0);
        assertThat(run(ListOperation.MAX, 4, -2, 7)).isEqualTo(7.0);
        assertThat(run(ListOperation.MIN)).isEqualTo(NAN);
    }

    @Test
    void average_skipsNonNumbers() {
        assertThat(run(ListOperation.AVERAGE, 2, NAN, 4)).isEqualTo(3.0);
        assertThat(run(ListOperation.AVERAGE, NAN)).isEqualTo(NAN);
    }

    @Test
    void median_oddLengthReturnsMiddleElement() {
        assertThat(run(ListOperation.MEDIAN, 9, 1, 5)).isEqualTo(5.0);
        assertThat(run(ListOperation.MEDIAN, 3, NAN, 8, 1, 7, 2)).isEqualTo(3.0);
    }

    @Test
    void median_evenLengthAveragesMiddlePair() {
        assertThat(run(ListOperation.MEDIAN, 4, 1, 3, 10)).isEqualTo(3.5);
        assertThat(run(ListOperation.MEDIAN, NAN, 6, 2)).isEqualTo(4.0);
        assertThat(run(ListOperation.MEDIAN, NAN)).isEqualTo(NAN);
    }

    @Test
    void nthSmallest_skipsNonNumbersAndCountsDuplicates() {
        call(ListOperation.MEDIAN);
        SketchInterpreter interpreter = new SketchInterpreter().defineAll(session.definitions());
        double[] values = {5, NAN, -1, 3, NAN, 3};

        assertThat(interpreter.call("math_nth_smallest", values, 6L, 0L)).isEqualTo(-1.0);
        assertThat(interpreter.call("math_nth_smallest", values, 6L, 1L)).isEqualTo(3.0);
        assertThat(interpreter.call("math_nth_smallest", values, 6L, 2L)).isEqualTo(3.0);
        assertThat(interpreter.call("math_nth_smallest", values, 6L, 3L)).isEqualTo(5.0);
        assertThat(interpreter.call("math_nth_smallest", values, 6L, 4L)).isEqualTo(NAN);
    }

    @Test
    void median_leavesListUntouched() {
        double[] readings = {3, NAN, 1, 2};

        assertThat(run(ListOperation.MEDIAN, readings)).isEqualTo(2.0);
        assertThat(readings).containsExactly(3, NAN, 1, 2);
    }

    @Test
    void mode_returnsMostFrequentValue() {
        assertThat(run(ListOperation.MODE, 3, 1, 3, 2)).isEqualTo(3.0);
        assertThat(run(ListOperation.MODE, 9, NAN, NAN, 9, 4)).isEqualTo(9.0);
        assertThat(run(ListOperation.MODE, NAN)).isEqualTo(NAN);
        assertThat(run(ListOperation.MODE)).isEqualTo(NAN);
    }

    @Test
    void mode_tieGivesSmallestValue() {
        assertThat(run(ListOperation.MODE, 4, 2, NAN, 4, 2, 1)).isEqualTo(2.0);
        assertThat(run(ListOperation.MODE, 3, 2, 1)).isEqualTo(1.0);
    }

    @Test
    void mode_isUsableAsValueAndLeavesListUntouched() {
        String code = emitter.emit(new ArithmeticNode(ArithmeticOperator.ADD,
                new OnListNode(ListOperation.MODE, new VariableGetNode("readings")), new NumberNode("1")), session).text();
        double[] readings = {7, 3, 7, 3, 5, 7};

        Object result = new SketchInterpreter()
                .defineAll(session.definitions())
                .global("readings", readings)
                .evaluate(code);

        assertThat(result).isEqualTo(8.0);
        assertThat(readings).containsExactly(7, 3, 7, 3, 5, 7);
    }

    @Test
    void mode_equalityIsNumeric() {
        assertThat(run(ListOperation.MODE, 2.5, 2.0, 2, NAN, NAN, NAN)).isEqualTo(2.0);
    }

    @Test
    void standardDeviation_isPopulationDeviation() {
        assertThat((Double) run(ListOperation.STD_DEV, 2, 4, 4, 4, 5, 5, 7, 9)).isCloseTo(2.0, within(1e-12));
        assertThat((Double) run(ListOperation.STD_DEV, 1, NAN, 3)).isCloseTo(1.0, within(1e-12));
        assertThat(run(ListOperation.STD_DEV)).isEqualTo(NAN);
    }

    @Test
    void randomItem_picksByRand() {
        String code = call(ListOperation.RANDOM);
        SketchInterpreter interpreter = new SketchInterpreter()
                .defineAll(session.definitions())
                .global("readings", new double[] {10, 20, 30});

        assertThat(interpreter.rand(4).evaluate(code)).isEqualTo(20.0);
        assertThat(interpreter.rand(2).evaluate(code)).isEqualTo(30.0);
        assertThat(interpreter.global("readings", new double[0]).evaluate(code)).isEqualTo(NAN);
    }

    @Test
    void unknownOperationFailsWithoutRegisteringHelper() {
        OnListNode node = new OnListNode();
        node.setField(OnListNode.OP, "PRODUCT").setInput(OnListNode.LIST, new VariableGetNode("readings"));

        assertThatThrownBy(() -> emitter.emit(node, session))
                .isInstanceOf(UnknownSelectorException.class)
                .hasMessageContaining("PRODUCT");
        assertThat(session.definitions()).isEmpty();
    }
}
