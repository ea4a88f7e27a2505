package org.csu.astrodsl.compiler.semantic;

import org.csu.astrodsl.chart.Dignities;
import org.csu.astrodsl.chart.ZodiacSign;
import org.csu.astrodsl.common.exception.SemanticException;
import org.csu.astrodsl.compiler.parser.ast.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @description: 占星语义校验器
 *
 * 拒绝在任何星盘上都无法成立的公式：
 * <ul>
 *     <li>断言不会逆行的天体 (日、月、四轴、交点) 处于逆行状态</li>
 *     <li>宫位属性与 1 到 12 以外的编号比较</li>
 *     <li>星座属性与非星座名的标识符比较</li>
 *     <li>星座内度数不在 [0, 30)、黄经不在 [0, 360) 的比较</li>
 *     <li>同一个 AND 链中，为同一天体断言两种不同的尊贵状态，
 *         或断言的星座与尊贵状态不符 (e.g., Mars.Sign == Taurus AND Mars.Dignity == Rulership)</li>
 * </ul>
 * 校验器没有状态，可以在多个引擎之间共享。
 */
public class AstrologicalValidator implements FormulaValidator {

    public static final Set<String> NON_RETROGRADE_BODIES = Set.of(
            "Sun", "Moon", "Asc", "MC", "IC", "Dsc", "NorthNode", "SouthNode");

    private static final String RETROGRADE = "Retrograde";
    private static final String HOUSE = "House";
    private static final String SIGN = "Sign";
    private static final String DIGNITY = "Dignity";
    private static final String DEGREE = "Degree";
    private static final String LONGITUDE = "Longitude";
    private static final BigDecimal FIRST_HOUSE = BigDecimal.ONE;
    private static final BigDecimal LAST_HOUSE = BigDecimal.valueOf(12);
    private static final BigDecimal DEGREES_PER_SIGN = BigDecimal.valueOf(30);
    private static final BigDecimal FULL_CIRCLE = BigDecimal.valueOf(360);

    @Override
    public void validate(ExpressionNode formula) {
        checkBooleanOperand(formula);
        formula.accept(new RuleChecker());
    }

    // 直接作为布尔条件使用的 X.Retrograde 等价于 X.Retrograde == True
    private static void checkBooleanOperand(ExpressionNode operand) {
        if (operand instanceof PropertyAccessNode access && isImpossibleRetrograde(access)) {
            throw retrogradeError(access);
        }
    }

    private static boolean isImpossibleRetrograde(PropertyAccessNode access) {
        return RETROGRADE.equals(access.propertyName()) && NON_RETROGRADE_BODIES.contains(access.objectName());
    }

    private static SemanticException retrogradeError(PropertyAccessNode access) {
        return new SemanticException("'" + access.objectName() + "' can never be retrograde, so '"
                + access + "' is never true");
    }

    private static final class RuleChecker implements ExpressionVisitor<Void> {

        @Override
        public Void visitBinary(BinaryExpressionNode node) {
            checkBooleanOperand(node.left());
            checkBooleanOperand(node.right());
            if (node.operator() == LogicalOperator.AND) {
                checkConjunction(node);
            }
            node.left().accept(this);
            node.right().accept(this);
            return null;
        }

        @Override
        public Void visitUnary(UnaryExpressionNode node) {
            // NOT Sun.Retrograde 恒为真，但并不矛盾
            return node.operand().accept(this);
        }

        @Override
        public Void visitComparison(ComparisonNode node) {
            checkSides(node, node.left(), node.right());
            checkSides(node, node.right(), node.left());
            node.left().accept(this);
            node.right().accept(this);
            return null;
        }

        private void checkSides(ComparisonNode node, ExpressionNode property, ExpressionNode other) {
            if (!(property instanceof PropertyAccessNode access)) {
                return;
            }
            switch (access.propertyName()) {
                case RETROGRADE -> checkRetrograde(node, access, other);
                case HOUSE -> checkHouse(node, other);
                case SIGN -> checkSign(node, other);
                case DEGREE -> checkRange(node, access, other, DEGREES_PER_SIGN);
                case LONGITUDE -> checkRange(node, access, other, FULL_CIRCLE);
                default -> {
                }
            }
        }

        private void checkRetrograde(ComparisonNode node, PropertyAccessNode access, ExpressionNode other) {
            if (!isImpossibleRetrograde(access) || !(other instanceof BooleanLiteralNode literal)) {
                return;
            }
            boolean assertsRetrograde = switch (node.operator()) {
                case EQ -> literal.value();
                case NEQ -> !literal.value();
                default -> false;
            };
            if (assertsRetrograde) {
                throw retrogradeError(access);
            }
        }

        private void checkHouse(ComparisonNode node, ExpressionNode other) {
            switch (node.operator()) {
                case EQ, NEQ -> checkHouseNumber(node, other);
                case IN -> {
                    if (other instanceof ListLiteralNode list) {
                        list.items().forEach(item -> checkHouseNumber(node, item));
                    }
                }
                default -> {
                }
            }
        }

        private void checkHouseNumber(ComparisonNode node, ExpressionNode candidate) {
            if (!(candidate instanceof NumberLiteralNode number)) {
                return;
            }
            BigDecimal value = number.value();
            boolean whole = value.stripTrailingZeros().scale() <= 0;
            if (!whole || value.compareTo(FIRST_HOUSE) < 0 || value.compareTo(LAST_HOUSE) > 0) {
                throw new SemanticException("House number " + value.toPlainString()
                        + " is out of range 1-12 in '" + node + "'");
            }
        }

        private void checkSign(ComparisonNode node, ExpressionNode other) {
            switch (node.operator()) {
                case EQ, NEQ -> checkSignName(node, other);
                case IN -> {
                    if (other instanceof ListLiteralNode list) {
                        list.items().forEach(item -> checkSignName(node, item));
                    }
                }
                default -> {
                }
            }
        }

        private void checkSignName(ComparisonNode node, ExpressionNode candidate) {
            if (candidate instanceof IdentifierNode identifier && !ZodiacSign.isSign(identifier.name())) {
                throw new SemanticException("'" + identifier.name() + "' is not a zodiac sign in '" + node + "'");
            }
        }

        private void checkRange(ComparisonNode node, PropertyAccessNode access, ExpressionNode other, BigDecimal limit) {
            switch (node.operator()) {
                case EQ, NEQ -> checkRangeValue(node, access, other, limit);
                case IN -> {
                    if (other instanceof ListLiteralNode list) {
                        list.items().forEach(item -> checkRangeValue(node, access, item, limit));
                    }
                }
                default -> {
                }
            }
        }

        private void checkRangeValue(ComparisonNode node, PropertyAccessNode access,
                                     ExpressionNode candidate, BigDecimal limit) {
            if (candidate instanceof NumberLiteralNode number
                    && (number.value().signum() < 0 || number.value().compareTo(limit) >= 0)) {
                throw new SemanticException(access.propertyName() + " " + number.value().toPlainString()
                        + " is out of range [0, " + limit + ") in '" + node + "'");
            }
        }

        /**
         * 收集整条 AND 链上形如 X.Sign == S、X.Dignity == D 的断言，检查同一天体的断言是否相容。
         * OR 和 NOT 之下的断言不参与，因为它们不一定同时成立。
         */
        private void checkConjunction(BinaryExpressionNode node) {
            List<ExpressionNode> conjuncts = new ArrayList<>();
            collectConjuncts(node, conjuncts);

            Map<String, String> signs = new LinkedHashMap<>();
            Map<String, String> dignities = new LinkedHashMap<>();
            for (ExpressionNode conjunct : conjuncts) {
                if (!(conjunct instanceof ComparisonNode comparison) || comparison.operator() != ComparisonOperator.EQ) {
                    continue;
                }
                recordAssertion(comparison.left(), comparison.right(), signs, dignities);
                recordAssertion(comparison.right(), comparison.left(), signs, dignities);
            }

            for (Map.Entry<String, String> entry : dignities.entrySet()) {
                String body = entry.getKey();
                String sign = signs.get(body);
                if (sign != null && Dignities.contradicts(body, ZodiacSign.valueOf(sign), entry.getValue())) {
                    throw new SemanticException("'" + body + "' in " + sign + " cannot have dignity "
                            + entry.getValue() + " (actual: " + Dignities.of(body, ZodiacSign.valueOf(sign))
                            + ") in '" + node + "'");
                }
            }
        }

        private void collectConjuncts(ExpressionNode node, List<ExpressionNode> conjuncts) {
            if (node instanceof BinaryExpressionNode binary && binary.operator() == LogicalOperator.AND) {
                collectConjuncts(binary.left(), conjuncts);
                collectConjuncts(binary.right(), conjuncts);
            } else {
                conjuncts.add(node);
            }
        }

        private void recordAssertion(ExpressionNode property, ExpressionNode other,
                                     Map<String, String> signs, Map<String, String> dignities) {
            if (!(property instanceof PropertyAccessNode access)) {
                return;
            }
            String name = literalName(other);
            if (name == null) {
                return;
            }
            String body = access.objectName();
            if (SIGN.equals(access.propertyName()) && ZodiacSign.isSign(name)) {
                String previous = signs.putIfAbsent(body, name);
                if (previous != null && !previous.equals(name)) {
                    throw new SemanticException("'" + body + "' cannot be in both " + previous + " and " + name);
                }
            } else if (DIGNITY.equals(access.propertyName()) && Dignities.isDignity(name)) {
                String previous = dignities.putIfAbsent(body, name);
                if (previous != null && !previous.equals(name)) {
                    throw new SemanticException("'" + body + "' cannot have both " + previous + " and " + name);
                }
            }
        }

        private String literalName(ExpressionNode node) {
            if (node instanceof IdentifierNode identifier) {
                return identifier.name();
            }
            if (node instanceof StringLiteralNode string) {
                return string.value();
            }
            return null;
        }

        @Override
        public Void visitList(ListLiteralNode node) {
            node.items().forEach(item -> item.accept(this));
            return null;
        }

        // 叶子节点没有需要检查的内容

        @Override
        public Void visitPropertyAccess(PropertyAccessNode node) {
            return null;
        }

        @Override
        public Void visitAggregatorAccess(AggregatorAccessNode node) {
            return null;
        }

        @Override
        public Void visitIdentifier(IdentifierNode node) {
            return null;
        }

        @Override
        public Void visitNumber(NumberLiteralNode node) {
            return null;
        }

        @Override
        public Void visitString(StringLiteralNode node) {
            return null;
        }

        @Override
        public Void visitBoolean(BooleanLiteralNode node) {
            return null;
        }
    }
}
