package org.ardugen.emitter;

import org.ardugen.CodeEmitException;
import org.ardugen.session.GenerationSession;
import org.ardugen.tree.ArithmeticNode;
import org.ardugen.tree.ArithmeticOperator;
import org.ardugen.tree.ChangeNode;
import org.ardugen.tree.ConstrainNode;
import org.ardugen.tree.NumberNode;
import org.ardugen.tree.VariableGetNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChildResolverTest {

    private final MathEmitter emitter = new MathEmitter();
    private final ChildResolver resolver = emitter.resolver();
    private final GenerationSession session = new GenerationSession();

    @ParameterizedTest
    @EnumSource(BindingStrength.class)
    void parenthesize_wrapsExactlyWhenWeaker(BindingStrength child) {
        EmissionResult result = new EmissionResult("x", child);
        for (BindingStrength required : BindingStrength.values()) {
            String text = ChildResolver.parenthesize(result, required);
            if (child.isAtLeast(required)) {
                assertThat(text).isEqualTo("x");
            } else {
                assertThat(text).isEqualTo("(x)");
            }
        }
    }

    @Test
    void parenthesize_addsSinglePairAroundGroupedText() {
        EmissionResult grouped = new EmissionResult("(a + b) * c", BindingStrength.MULTIPLICATIVE);
        assertThat(ChildResolver.parenthesize(grouped, BindingStrength.UNARY_POSTFIX)).isEqualTo("((a + b) * c)");
    }

    @Test
    void resolve_connectedChild() {
        ArithmeticNode node = new ArithmeticNode(ArithmeticOperator.MULTIPLY,
                new ArithmeticNode(ArithmeticOperator.ADD, new NumberNode("1"), new NumberNode("2")), null);

        assertThat(resolver.resolve(node, ArithmeticNode.A, BindingStrength.MULTIPLICATIVE, session)).isEqualTo("(1 + 2)");
        assertThat(resolver.resolve(node, ArithmeticNode.A, BindingStrength.ADDITIVE, session)).isEqualTo("1 + 2");
    }

    @Test
    void resolve_unconnectedSlotUsesDefaultLiteral() {
        ConstrainNode node = new ConstrainNode(new VariableGetNode("speed"), null, null);

        assertThat(resolver.resolve(node, ConstrainNode.LOW, BindingStrength.NONE, session)).isEqualTo(ChildResolver.DEFAULT_NUMBER);
        assertThat(resolver.resolve(node, ConstrainNode.HIGH, BindingStrength.NONE, session, "255")).isEqualTo("255");
        assertThat(resolver.resolve(node, "NO_SUCH_SLOT", BindingStrength.ATOMIC, session)).isEqualTo("0");
    }

    @Test
    void emitChild_returnsRawResult() {
        ArithmeticNode node = new ArithmeticNode(ArithmeticOperator.MINUS, new NumberNode("4"), null);

        assertThat(resolver.emitChild(node, ArithmeticNode.A, session))
                .contains(new EmissionResult("4", BindingStrength.ATOMIC));
        assertThat(resolver.emitChild(node, ArithmeticNode.B, session)).isEmpty();
    }

    @Test
    void emitChild_rejectsStatement() {
        ArithmeticNode node = new ArithmeticNode(ArithmeticOperator.ADD, new ChangeNode("x", new NumberNode("1")), null);

        assertThatThrownBy(() -> resolver.resolve(node, ArithmeticNode.A, BindingStrength.NONE, session))
                .isInstanceOf(CodeEmitException.class)
                .hasMessageContaining("'A'")
                .satisfies(e -> assertThat(((CodeEmitException) e).getNodeDescription()).startsWith("math_arithmetic"));
    }

    @Test
    void negate_insertsSpaceBeforeExistingSign() {
        assertThat(ChildResolver.negate("-3")).isEqualTo("- -3");
        assertThat(ChildResolver.negate("-x")).isEqualTo("- -x");
        assertThat(ChildResolver.negate("- -3")).isEqualTo("- - -3");
    }

    @Test
    void negate_plainOperandGetsBareSign() {
        assertThat(ChildResolver.negate("3")).isEqualTo("-3");
        assertThat(ChildResolver.negate("x")).isEqualTo("-x");
        assertThat(ChildResolver.negate("(a + b)")).isEqualTo("-(a + b)");
    }
}
