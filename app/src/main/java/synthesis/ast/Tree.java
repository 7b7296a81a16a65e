package synthesis.ast;

/** A syntax tree: either an atomic {@link Value} or an operator {@link Node}. */
public sealed interface Tree extends Term permits Value, Node {}
