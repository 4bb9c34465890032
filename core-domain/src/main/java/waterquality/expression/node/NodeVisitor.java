package waterquality.expression.node;

public interface NodeVisitor<R> {

    R visitNumber(NumberNode node);

    R visitSymbol(SymbolNode node);

    R visitNegate(NegateNode node);

    R visitBinary(BinaryNode node);

    R visitFunction(FunctionNode node);
}
