package org.ardugen.emitter;

import org.ardugen.CodeEmitException;
import org.ardugen.session.GenerationSession;
import org.ardugen.tree.ArithmeticNode;
import org.ardugen.tree.ArithmeticOperator;
import org.ardugen.tree.ChangeNode;
import org.ardugen.tree.ConstantNode;
import org.ardugen.tree.ConstrainNode;
import org.ardugen.tree.ModuloNode;
import org.ardugen.tree.NumberNode;
import org.ardugen.tree.NumberPropertyNode;
import org.ardugen.tree.OnListNode;
import org.ardugen.tree.OperationNode;
import org.ardugen.tree.OperationVisitor;
import org.ardugen.tree.RandomFloatNode;
import org.ardugen.tree.RandomIntNode;
import org.ardugen.tree.SingleNode;
import org.ardugen.tree.VariableGetNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static org.ardugen.emitter.BindingStrength.ADDITIVE;
import static org.ardugen.emitter.BindingStrength.ATOMIC;
import static org.ardugen.emitter.BindingStrength.EQUALITY;
import static org.ardugen.emitter.BindingStrength.FUNCTION_CALL;
import static org.ardugen.emitter.BindingStrength.MULTIPLICATIVE;
import static org.ardugen.emitter.BindingStrength.NONE;
import static org.ardugen.emitter.BindingStrength.UNARY_POSTFIX;
import static org.ardugen.emitter.BindingStrength.UNARY_PREFIX;

/**
 * Emits Arduino C++ for math operation nodes.
 * <p>
 * Every rule is a function of the node and its resolved children; the only effect on the
 * session is the registration of helper routines. The emitter keeps no state of its own
 * and can be shared between threads, each working on its own session.
 */
public final class MathEmitter implements OperationVisitor<EmissionResult, GenerationSession> {

    private static final Logger LOG = LoggerFactory.getLogger(MathEmitter.class);

    private final ChildResolver resolver = new ChildResolver(this);

    public EmissionResult emit(OperationNode node, GenerationSession session) {
        EmissionResult result = node.accept(this, session);
        LOG.trace("Emitted {} as '{}' ({})", node.kind().type(), result.text(), result.strength());
        return result;
    }

    public ChildResolver resolver() {
        return resolver;
    }

    @Override
    public EmissionResult visit(NumberNode n, GenerationSession session) {
        String text = n.value();
        double value;
        try {
            value = Double.parseDouble(text == null ? "" : text.trim());
        } catch (NumberFormatException e) {
            throw new CodeEmitException("Not a number: '" + text + "'", n.toString(), e);
        }
        return new EmissionResult(NumberFormats.format(value), ATOMIC);
    }

    @Override
    public EmissionResult visit(ArithmeticNode n, GenerationSession session) {
        ArithmeticOperator operator = n.operator();
        if (operator == ArithmeticOperator.POWER) {
            String base = resolver.resolve(n, ArithmeticNode.A, NONE, session);
            String exponent = resolver.resolve(n, ArithmeticNode.B, NONE, session);
            return new EmissionResult("pow(" + base + ", " + exponent + ")", UNARY_POSTFIX);
        }
        String symbol = switch (operator) {
            case ADD -> " + ";
            case MINUS -> " - ";
            case MULTIPLY -> " * ";
            case DIVIDE -> " / ";
            case POWER -> throw new IllegalStateException("pow is emitted as a call");
        };
        BindingStrength order = operator == ArithmeticOperator.ADD || operator == ArithmeticOperator.MINUS
                ? ADDITIVE
                : MULTIPLICATIVE;
        // a - (b - c), a / (b * c): only + may take an operand of its own level on the right
        BindingStrength rightOrder = operator == ArithmeticOperator.ADD ? order : order.stronger();
        String left = resolver.resolve(n, ArithmeticNode.A, order, session);
        String right = resolver.resolve(n, ArithmeticNode.B, rightOrder, session);
        return new EmissionResult(left + symbol + right, order);
    }

    @Override
    public EmissionResult visit(SingleNode n, GenerationSession session) {
        return switch (n.operator()) {
            case NEG -> {
                String operand = resolver.resolve(n, SingleNode.NUM, UNARY_PREFIX, session);
                yield new EmissionResult(ChildResolver.negate(operand), UNARY_PREFIX);
            }
            case ABS -> call("abs", n, UNARY_POSTFIX, session);
            case ROUND -> call("round", n, UNARY_POSTFIX, session);
            case ROUNDUP -> call("ceil", n, UNARY_POSTFIX, session);
            case ROUNDDOWN -> call("floor", n, UNARY_POSTFIX, session);
            case ROOT -> call("sqrt", n, NONE, session);
            case LN -> call("log", n, NONE, session);
            case EXP -> call("exp", n, NONE, session);
            case POW10 -> new EmissionResult("pow(10, " + operand(n, NONE, session) + ")", UNARY_POSTFIX);
            case SIN -> degreesToRadians("sin", n, session);
            case COS -> degreesToRadians("cos", n, session);
            case TAN -> degreesToRadians("tan", n, session);
            case LOG10 -> new EmissionResult("log(" + operand(n, NONE, session) + ") / log(10)", MULTIPLICATIVE);
            case ASIN -> radiansToDegrees("asin", n, session);
            case ACOS -> radiansToDegrees("acos", n, session);
            case ATAN -> radiansToDegrees("atan", n, session);
        };
    }

    private String operand(SingleNode n, BindingStrength minStrength, GenerationSession session) {
        return resolver.resolve(n, SingleNode.NUM, minStrength, session);
    }

    private EmissionResult call(String function, SingleNode n, BindingStrength minStrength, GenerationSession session) {
        return new EmissionResult(function + "(" + operand(n, minStrength, session) + ")", UNARY_POSTFIX);
    }

    private EmissionResult degreesToRadians(String function, SingleNode n, GenerationSession session) {
        String degrees = operand(n, MULTIPLICATIVE, session);
        return new EmissionResult(function + "(" + degrees + " / 180.0 * M_PI)", UNARY_POSTFIX);
    }

    private EmissionResult radiansToDegrees(String function, SingleNode n, GenerationSession session) {
        String value = operand(n, NONE, session);
        return new EmissionResult(function + "(" + value + ") / M_PI * 180", MULTIPLICATIVE);
    }

    @Override
    public EmissionResult visit(ConstantNode n, GenerationSession session) {
        return switch (n.constant()) {
            case PI -> new EmissionResult("M_PI", UNARY_POSTFIX);
            case E -> new EmissionResult("M_E", UNARY_POSTFIX);
            case GOLDEN_RATIO -> new EmissionResult("(1 + sqrt(5)) / 2", MULTIPLICATIVE);
            case SQRT2 -> new EmissionResult("M_SQRT2", UNARY_POSTFIX);
            case SQRT1_2 -> new EmissionResult("M_SQRT1_2", UNARY_POSTFIX);
            case INFINITY -> new EmissionResult("INFINITY", ATOMIC);
        };
    }

    @Override
    public EmissionResult visit(NumberPropertyNode n, GenerationSession session) {
        return switch (n.property()) {
            case PRIME -> {
                String number = resolver.resolve(n, NumberPropertyNode.NUMBER_TO_CHECK, NONE, session);
                String lineSeparator = session.options().lineSeparator();
                String function = session.ensureHelper("math_isPrime",
                        name -> HelperTemplates.isPrime(name, lineSeparator));
                yield new EmissionResult(function + "(" + number + ")", FUNCTION_CALL);
            }
            case EVEN -> comparison(n, " % 2 == 0", session);
            case ODD -> comparison(n, " % 2 == 1", session);
            case WHOLE -> comparison(n, " % 1 == 0", session);
            case POSITIVE -> comparison(n, " > 0", session);
            case NEGATIVE -> comparison(n, " < 0", session);
            case DIVISIBLE_BY -> {
                String number = numberToCheck(n, session);
                String divisor = resolver.resolve(n, NumberPropertyNode.DIVISOR, MULTIPLICATIVE.stronger(), session);
                yield new EmissionResult(number + " % " + divisor + " == 0", EQUALITY);
            }
        };
    }

    private String numberToCheck(NumberPropertyNode n, GenerationSession session) {
        return resolver.resolve(n, NumberPropertyNode.NUMBER_TO_CHECK, MULTIPLICATIVE, session);
    }

    private EmissionResult comparison(NumberPropertyNode n, String test, GenerationSession session) {
        return new EmissionResult(numberToCheck(n, session) + test, EQUALITY);
    }

    @Override
    public EmissionResult visit(ChangeNode n, GenerationSession session) {
        String delta = resolver.resolve(n, ChangeNode.DELTA, ADDITIVE, session);
        String variable = variableName(n, n.variableId(), session);
        return EmissionResult.statement(variable + " += " + delta + ";" + session.options().lineSeparator());
    }

    @Override
    public EmissionResult visit(VariableGetNode n, GenerationSession session) {
        return new EmissionResult(variableName(n, n.variableId(), session), ATOMIC);
    }

    private static String variableName(OperationNode n, String variableId, GenerationSession session) {
        if (variableId == null) {
            throw new CodeEmitException("No variable selected", n.toString());
        }
        return session.variableName(variableId);
    }

    @Override
    public EmissionResult visit(OnListNode n, GenerationSession session) {
        Optional<EmissionResult> list = resolver.emitChild(n, OnListNode.LIST, session);
        String function = listHelper(n, session);
        String arguments = list
                .map(l -> {
                    String array = ChildResolver.parenthesize(l, NONE);
                    String element = ChildResolver.parenthesize(l, UNARY_POSTFIX) + "[0]";
                    return array + ", sizeof(" + array + ") / sizeof(" + element + ")";
                })
                .orElse("NULL, 0");
        return new EmissionResult(function + "(" + arguments + ")", UNARY_POSTFIX);
    }

    private static String listHelper(OnListNode n, GenerationSession session) {
        String lineSeparator = session.options().lineSeparator();
        return switch (n.operation()) {
            case SUM -> session.ensureHelper("math_sum", name -> HelperTemplates.sum(name, lineSeparator));
            case MIN -> session.ensureHelper("math_min", name -> HelperTemplates.min(name, lineSeparator));
            case MAX -> session.ensureHelper("math_max", name -> HelperTemplates.max(name, lineSeparator));
            case AVERAGE -> session.ensureHelper("math_average",
                    name -> HelperTemplates.average(name, lineSeparator));
            case MEDIAN -> session.ensureHelper("math_median",
                    name -> HelperTemplates.median(name, nthSmallest(session), lineSeparator));
            case MODE -> session.ensureHelper("math_mode", name -> HelperTemplates.mode(name, lineSeparator));
            case STD_DEV -> session.ensureHelper("math_standard_deviation",
                    name -> HelperTemplates.standardDeviation(name, lineSeparator));
            case RANDOM -> session.ensureHelper("math_random_item",
                    name -> HelperTemplates.randomItem(name, lineSeparator));
        };
    }

    private static String nthSmallest(GenerationSession session) {
        String lineSeparator = session.options().lineSeparator();
        return session.ensureHelper("math_nth_smallest", name -> HelperTemplates.nthSmallest(name, lineSeparator));
    }

    @Override
    public EmissionResult visit(ModuloNode n, GenerationSession session) {
        String dividend = resolver.resolve(n, ModuloNode.DIVIDEND, MULTIPLICATIVE, session);
        String divisor = resolver.resolve(n, ModuloNode.DIVISOR, MULTIPLICATIVE.stronger(), session);
        return new EmissionResult(dividend + " % " + divisor, MULTIPLICATIVE);
    }

    @Override
    public EmissionResult visit(ConstrainNode n, GenerationSession session) {
        String value = resolver.resolve(n, ConstrainNode.VALUE, NONE, session);
        String low = resolver.resolve(n, ConstrainNode.LOW, NONE, session);
        String high = resolver.resolve(n, ConstrainNode.HIGH, NONE, session);
        String code = "(" + value + " < " + low + " ? " + low
                + " : ( " + value + " > " + high + " ? " + high + " : " + value + "))";
        return new EmissionResult(code, UNARY_POSTFIX);
    }

    @Override
    public EmissionResult visit(RandomIntNode n, GenerationSession session) {
        String from = resolver.resolve(n, RandomIntNode.FROM, NONE, session);
        String to = resolver.resolve(n, RandomIntNode.TO, NONE, session);
        String lineSeparator = session.options().lineSeparator();
        String function = session.ensureHelper("math_random_int", name -> HelperTemplates.randomInt(name, lineSeparator));
        return new EmissionResult(function + "(" + from + ", " + to + ")", UNARY_POSTFIX);
    }

    @Override
    public EmissionResult visit(RandomFloatNode n, GenerationSession session) {
        return new EmissionResult("(rand() / ((double) RAND_MAX + 1))", UNARY_POSTFIX);
    }
}
