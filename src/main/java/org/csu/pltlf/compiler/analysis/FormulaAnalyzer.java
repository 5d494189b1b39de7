package org.csu.pltlf.compiler.analysis;

import org.csu.pltlf.compiler.parser.ast.BinaryFormulaNode;
import org.csu.pltlf.compiler.parser.ast.FormulaNode;
import org.csu.pltlf.compiler.parser.ast.Operator;
import org.csu.pltlf.compiler.parser.ast.SymbolNode;
import org.csu.pltlf.compiler.parser.ast.UnaryFormulaNode;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * @description: 对公式AST做只读的结构分析
 *
 * 收集命题符号，判断公式使用了过去算子还是未来算子，计算时序嵌套深度。
 * 不涉及公式的语义求值。
 */
public final class FormulaAnalyzer {

    private FormulaAnalyzer() {
    }

    /**
     * @return 公式中出现的所有命题符号名，按字典序排列
     */
    public static SortedSet<String> labels(FormulaNode formula) {
        SortedSet<String> labels = new TreeSet<>();
        collectLabels(formula, labels);
        return Collections.unmodifiableSortedSet(labels);
    }

    private static void collectLabels(FormulaNode node, SortedSet<String> labels) {
        if (node instanceof SymbolNode symbol) {
            labels.add(symbol.name());
        } else if (node instanceof UnaryFormulaNode unary) {
            collectLabels(unary.operand(), labels);
        } else if (node instanceof BinaryFormulaNode binary) {
            collectLabels(binary.left(), labels);
            collectLabels(binary.right(), labels);
        }
        // true/false/last/init 不含符号
    }

    public static boolean hasPastOperators(FormulaNode formula) {
        return containsDirection(formula, Operator.Direction.PAST);
    }

    public static boolean hasFutureOperators(FormulaNode formula) {
        return containsDirection(formula, Operator.Direction.FUTURE);
    }

    /**
     * 纯未来公式：不含任何过去算子 (纯命题公式也算)。
     */
    public static boolean isPureFuture(FormulaNode formula) {
        return !hasPastOperators(formula);
    }

    /**
     * 纯过去公式：不含任何未来算子 (纯命题公式也算)。
     */
    public static boolean isPurePast(FormulaNode formula) {
        return !hasFutureOperators(formula);
    }

    private static boolean containsDirection(FormulaNode node, Operator.Direction direction) {
        if (node instanceof UnaryFormulaNode unary) {
            return unary.operator().direction() == direction
                    || containsDirection(unary.operand(), direction);
        }
        if (node instanceof BinaryFormulaNode binary) {
            return binary.operator().direction() == direction
                    || containsDirection(binary.left(), direction)
                    || containsDirection(binary.right(), direction);
        }
        return false;
    }

    /**
     * @return 从根到叶子路径上时序算子的最大个数
     */
    public static int temporalDepth(FormulaNode node) {
        if (node instanceof UnaryFormulaNode unary) {
            return weight(unary.operator()) + temporalDepth(unary.operand());
        }
        if (node instanceof BinaryFormulaNode binary) {
            return weight(binary.operator())
                    + Math.max(temporalDepth(binary.left()), temporalDepth(binary.right()));
        }
        return 0;
    }

    private static int weight(Operator operator) {
        return operator.isTemporal() ? 1 : 0;
    }
}
