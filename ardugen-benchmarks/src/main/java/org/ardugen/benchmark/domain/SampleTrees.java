package org.ardugen.benchmark.domain;

import java.util.Random;

import org.ardugen.tree.ArithmeticNode;
import org.ardugen.tree.ArithmeticOperator;
import org.ardugen.tree.ConstrainNode;
import org.ardugen.tree.ListOperation;
import org.ardugen.tree.ModuloNode;
import org.ardugen.tree.NumberNode;
import org.ardugen.tree.NumberProperty;
import org.ardugen.tree.NumberPropertyNode;
import org.ardugen.tree.OnListNode;
import org.ardugen.tree.OperationNode;
import org.ardugen.tree.RandomIntNode;
import org.ardugen.tree.SingleNode;
import org.ardugen.tree.SingleOperator;
import org.ardugen.tree.VariableGetNode;

/**
 * Block trees of the shapes sketches are made of.
 */
public final class SampleTrees {

    private static final ArithmeticOperator[] OPERATORS = {
            ArithmeticOperator.ADD, ArithmeticOperator.MINUS, ArithmeticOperator.MULTIPLY, ArithmeticOperator.DIVIDE
    };

    private SampleTrees() {}

    /**
     * A full binary tree of arithmetic on sensor variables, with an occasional negation or
     * modulo so that every precedence level shows up.
     */
    public static OperationNode deepArithmetic(int depth, long seed) {
        return arithmetic(depth, new Random(seed));
    }

    private static OperationNode arithmetic(int depth, Random random) {
        if (depth == 0) {
            return random.nextBoolean()
                    ? new VariableGetNode("sensor" + random.nextInt(4))
                    : new NumberNode(String.valueOf(random.nextInt(100)));
        }
        OperationNode left = arithmetic(depth - 1, random);
        OperationNode right = arithmetic(depth - 1, random);
        switch (random.nextInt(6)) {
            case 0:
                return new SingleNode(SingleOperator.NEG, new ArithmeticNode(ArithmeticOperator.MINUS, left, right));
            case 1:
                return new ModuloNode(left, right);
            default:
                return new ArithmeticNode(OPERATORS[random.nextInt(OPERATORS.length)], left, right);
        }
    }

    /**
     * Sums every list aggregate over one list, clamped, plus a primality test: one of each
     * helper routine.
     */
    public static OperationNode helperHeavy() {
        OperationNode sum = null;
        for (ListOperation operation : ListOperation.values()) {
            OperationNode aggregate = new OnListNode(operation, new VariableGetNode("readings"));
            sum = sum == null ? aggregate : new ArithmeticNode(ArithmeticOperator.ADD, sum, aggregate);
        }
        OperationNode jitter = new RandomIntNode(new NumberNode("-5"), new NumberNode("5"));
        OperationNode clamped = new ConstrainNode(
                new ArithmeticNode(ArithmeticOperator.ADD, sum, jitter), new NumberNode("0"), new NumberNode("1023"));
        return new NumberPropertyNode(NumberProperty.PRIME, clamped);
    }
}
