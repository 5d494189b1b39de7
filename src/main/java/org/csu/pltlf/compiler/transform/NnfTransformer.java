package org.csu.pltlf.compiler.transform;

import org.csu.pltlf.compiler.parser.ast.*;

import java.util.EnumMap;
import java.util.Map;

import static org.csu.pltlf.compiler.parser.ast.Formulas.*;

/**
 * @description: 否定范式 (NNF) 转换
 *
 * 把否定一直下推到原子上：合取/析取、Until/Release、Since/Trigger、
 * Next/WeakNext、Always/Eventually、Before/WeakBefore、Once/Historically 两两对偶。
 * 蕴含和等价展开为合取与析取。被否定的符号以及 last/init 保留为 !(atom)。
 * 输入的AST不会被修改，结果是新构造的树。
 */
public final class NnfTransformer {

    private static final Map<Operator, Operator> DUALS = new EnumMap<>(Operator.class);

    static {
        dual(Operator.AND, Operator.OR);
        dual(Operator.UNTIL, Operator.RELEASE);
        dual(Operator.SINCE, Operator.TRIGGER);
        dual(Operator.NEXT, Operator.WEAK_NEXT);
        dual(Operator.ALWAYS, Operator.EVENTUALLY);
        dual(Operator.BEFORE, Operator.WEAK_BEFORE);
        dual(Operator.ONCE, Operator.HISTORICALLY);
    }

    private static void dual(Operator a, Operator b) {
        DUALS.put(a, b);
        DUALS.put(b, a);
    }

    private NnfTransformer() {
    }

    public static FormulaNode toNnf(FormulaNode node) {
        if (node instanceof UnaryFormulaNode unaryNode) {
            if (unaryNode.operator() == Operator.NOT) {
                return negate(unaryNode.operand());
            }
            return unary(unaryNode.operator(), toNnf(unaryNode.operand()));
        }
        if (node instanceof BinaryFormulaNode binaryNode) {
            FormulaNode left = binaryNode.left();
            FormulaNode right = binaryNode.right();
            switch (binaryNode.operator()) {
                case IMPLIES:
                    return or(negate(left), toNnf(right));
                case EQUIVALENCE:
                    return or(and(toNnf(left), toNnf(right)), and(negate(left), negate(right)));
                default:
                    return binary(binaryNode.operator(), toNnf(left), toNnf(right));
            }
        }
        return node;
    }

    /**
     * @return 公式否定之后的否定范式
     */
    public static FormulaNode negate(FormulaNode node) {
        if (node instanceof TrueNode) {
            return ff();
        }
        if (node instanceof FalseNode) {
            return tt();
        }
        if (node instanceof UnaryFormulaNode unaryNode) {
            if (unaryNode.operator() == Operator.NOT) {
                return toNnf(unaryNode.operand());
            }
            return unary(DUALS.get(unaryNode.operator()), negate(unaryNode.operand()));
        }
        if (node instanceof BinaryFormulaNode binaryNode) {
            FormulaNode left = binaryNode.left();
            FormulaNode right = binaryNode.right();
            switch (binaryNode.operator()) {
                case IMPLIES:
                    return and(toNnf(left), negate(right));
                case EQUIVALENCE:
                    return or(and(toNnf(left), negate(right)), and(negate(left), toNnf(right)));
                default:
                    return binary(DUALS.get(binaryNode.operator()), negate(left), negate(right));
            }
        }
        // 符号、last、init
        return not(node);
    }
}
