package analysis.guards.cfg;

/**
 * Integer arithmetic on two operands
 */
public final class BinaryOpInstruction extends Instruction {

    /**
     * Arithmetic operators. Only {@link #ADD} and {@link #SUB} take part in comparison rewriting.
     */
    public enum Operator {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), REM("%"), AND("&"), OR("|"), XOR("^");

        private final String symbol;

        private Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Operator operator;
    private final Instruction left;
    private final Instruction right;

    BinaryOpInstruction(int valueNumber, BasicBlock basicBlock, Operator operator, Instruction left,
                        Instruction right) {
        super(valueNumber, basicBlock);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public Operator getOperator() {
        return operator;
    }

    public Instruction getLeft() {
        return left;
    }

    public Instruction getRight() {
        return right;
    }

    @Override
    public int getNumberOfUses() {
        return 2;
    }

    @Override
    public Instruction getUse(int j) {
        checkUse(j);
        return j == 0 ? left : right;
    }

    @Override
    public String toString() {
        return valueString() + " = " + left.valueString() + " " + operator.getSymbol() + " " + right.valueString();
    }
}
