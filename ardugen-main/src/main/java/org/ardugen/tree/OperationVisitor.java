package org.ardugen.tree;

/**
 * Double dispatch over the closed set of operation kinds. Every kind has its own visit
 * method, so an implementation that compiles handles all of them.
 *
 * @param <R> the result of a visit
 * @param <A> an argument threaded through the traversal
 */
public interface OperationVisitor<R, A> {

    R visit(NumberNode n, A arg);

    R visit(ArithmeticNode n, A arg);

    R visit(SingleNode n, A arg);

    R visit(ConstantNode n, A arg);

    R visit(NumberPropertyNode n, A arg);

    R visit(ChangeNode n, A arg);

    R visit(VariableGetNode n, A arg);

    R visit(OnListNode n, A arg);

    R visit(ModuloNode n, A arg);

    R visit(ConstrainNode n, A arg);

    R visit(RandomIntNode n, A arg);

    R visit(RandomFloatNode n, A arg);
}
