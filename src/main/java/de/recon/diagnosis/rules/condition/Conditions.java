package de.recon.diagnosis.rules.condition;

import de.recon.diagnosis.model.TradeRow;

import java.util.HashSet;
import java.util.Set;

final class Conditions {

    private Conditions() {
    }

    record And(Condition left, Condition right) implements Condition {
        @Override
        public boolean test(TradeRow row) {
            return left.test(row) && right.test(row);
        }

        @Override
        public Set<String> fields() {
            return union(left, right);
        }
    }

    record Or(Condition left, Condition right) implements Condition {
        @Override
        public boolean test(TradeRow row) {
            return left.test(row) || right.test(row);
        }

        @Override
        public Set<String> fields() {
            return union(left, right);
        }
    }

    record Not(Condition operand) implements Condition {
        @Override
        public boolean test(TradeRow row) {
            return !operand.test(row);
        }

        @Override
        public Set<String> fields() {
            return operand.fields();
        }
    }

    /**
     * {@code field is None} / {@code field is not None}. The only nodes that observe null.
     */
    record NullCheck(String field, boolean expectNull) implements Condition {
        @Override
        public boolean test(TradeRow row) {
            Object value = row.get(field);
            boolean isNull = value == null || (value instanceof Double d && d.isNaN());
            return isNull == expectNull;
        }

        @Override
        public Set<String> fields() {
            return Set.of(field);
        }
    }

    /**
     * {@code field == literal} / {@code field != literal}. False in both forms when the field is null.
     */
    record Compare(String field, Object literal, boolean negated) implements Condition {
        @Override
        public boolean test(TradeRow row) {
            Object value = row.get(field);
            if (value == null || (value instanceof Double d && d.isNaN())) {
                return false;
            }
            boolean equal = matches(value, literal);
            return negated != equal;
        }

        @Override
        public Set<String> fields() {
            return Set.of(field);
        }

        private static boolean matches(Object value, Object literal) {
            if (literal instanceof Double number) {
                return value instanceof Number n && Double.compare(n.doubleValue(), number) == 0;
            }
            if (literal instanceof Boolean flag) {
                return value instanceof Boolean b && b.equals(flag);
            }
            return value instanceof String s && s.equals(literal);
        }
    }

    record Flag(String field) implements Condition {
        @Override
        public boolean test(TradeRow row) {
            return Boolean.TRUE.equals(row.get(field));
        }

        @Override
        public Set<String> fields() {
            return Set.of(field);
        }
    }

    private static Set<String> union(Condition a, Condition b) {
        Set<String> all = new HashSet<>(a.fields());
        all.addAll(b.fields());
        return Set.copyOf(all);
    }
}
