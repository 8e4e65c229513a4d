package com.quintstore.jena.store;

import com.quintstore.jena.codec.TermCodec;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;

/**
 * Translates a {@link QuintPattern} into a parameterised SQL condition.
 *
 * <p>Column names come from {@link TermName} and table aliases are checked
 * to be plain identifiers; every value is bound as a parameter. Conditions
 * for all constrained positions are joined with {@code AND}.</p>
 *
 * <p>Operands compared against the object column are encoded the way the
 * object column is stored. Ordering operators ({@code $gt, $gte, $lt,
 * $lte}) against a numeric or dateTime operand compare against the
 * sortable prefix only, so that they range over values rather than over
 * lexical forms.</p>
 */
public final class PatternTranslator {

    /** Legal table alias. */
    private static final Pattern ALIAS = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** Escape character used in LIKE patterns. */
    private static final char LIKE_ESCAPE = '\\';

    /** The engine the conditions are rendered for. */
    private final SqlDialect dialect;

    /**
     * Create a translator for a dialect.
     *
     * @param dialect the target engine
     */
    public PatternTranslator(final SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    /**
     * Translate a pattern against the unaliased quint table.
     *
     * @param pattern the pattern
     * @return the condition; empty when the pattern is empty
     */
    public SqlFragment where(final QuintPattern pattern) {
        return translate(null, pattern);
    }

    /**
     * Translate a pattern against an aliased copy of the quint table, as
     * used in compound self-joins.
     *
     * @param alias the table alias
     * @param pattern the pattern
     * @return the condition; empty when the pattern is empty
     */
    public SqlFragment whereAliased(final String alias, final QuintPattern pattern) {
        if (alias == null || !ALIAS.matcher(alias).matches()) {
            throw new IllegalArgumentException("Invalid table alias: " + alias);
        }
        return translate(alias, pattern);
    }

    private SqlFragment translate(final String alias, final QuintPattern pattern) {
        var conditions = new Conditions();
        for (TermName name : TermName.values()) {
            TermMatch match = pattern.get(name);
            if (match == null) {
                continue;
            }
            String column = alias == null ? name.column() : alias + "." + name.column();
            if (match instanceof TermMatch.Concrete concrete) {
                conditions.add(column + " = ?", encode(name, concrete.term()));
            } else if (match instanceof TermMatch.Operators operators) {
                addOperators(conditions, column, name, operators.operators());
            }
        }
        return conditions.toFragment();
    }

    private void addOperators(final Conditions conditions, final String column,
            final TermName name, final TermOperators ops) {
        if (ops.getEq() != null) {
            conditions.add(column + " = ?", operand(name, ops.getEq(), false, false));
        }
        if (ops.getNe() != null) {
            conditions.add(column + " != ?", operand(name, ops.getNe(), false, false));
        }
        if (ops.getGt() != null) {
            conditions.add(column + " > ?", operand(name, ops.getGt(), true, true));
        }
        if (ops.getGte() != null) {
            conditions.add(column + " >= ?", operand(name, ops.getGte(), true, false));
        }
        if (ops.getLt() != null) {
            conditions.add(column + " < ?", operand(name, ops.getLt(), true, false));
        }
        if (ops.getLte() != null) {
            conditions.add(column + " <= ?", operand(name, ops.getLte(), true, true));
        }
        if (ops.getIn() != null) {
            if (ops.getIn().isEmpty()) {
                conditions.add("1 = 0");
            } else {
                conditions.add(column + " IN (" + placeholders(ops.getIn().size()) + ")",
                    operands(name, ops.getIn()));
            }
        }
        if (ops.getNotIn() != null && !ops.getNotIn().isEmpty()) {
            conditions.add(column + " NOT IN (" + placeholders(ops.getNotIn().size()) + ")",
                operands(name, ops.getNotIn()));
        }
        if (ops.getStartsWith() != null) {
            String prefix = ops.getStartsWith();
            conditions.add(column + " >= ? AND " + column + " < ?",
                prefix, prefix + TermCodec.MAX_SUFFIX);
        }
        if (ops.getEndsWith() != null) {
            conditions.add(like(column), "%" + escapeLike(ops.getEndsWith()));
        }
        if (ops.getContains() != null) {
            conditions.add(like(column), "%" + escapeLike(ops.getContains()) + "%");
        }
        if (ops.getRegex() != null) {
            conditions.add(dialect.regexCondition(column), ops.getRegex());
        }
        if (ops.getIsNull() != null) {
            conditions.add(column + (ops.getIsNull() ? " IS NULL" : " IS NOT NULL"));
        }
    }

    /**
     * Encode a concrete term the way the column stores it.
     *
     * @param name the column
     * @param term the term
     * @return the stored string
     */
    static String encode(final TermName name, final Node term) {
        return name == TermName.OBJECT ? TermCodec.encodeObject(term)
            : TermCodec.encodeTerm(term);
    }

    /**
     * Serialise an operator operand.
     *
     * @param name the column compared against
     * @param value the operand
     * @param ordering whether the operator is an ordering comparison
     * @param upperBound whether the comparison must sort after every stored
     *        value with the same sortable prefix ({@code $gt}, {@code $lte})
     * @return the parameter value
     */
    static String operand(final TermName name, final OperatorValue value,
            final boolean ordering, final boolean upperBound) {
        boolean objectColumn = name == TermName.OBJECT;
        if (value instanceof OperatorValue.TermValue termValue) {
            Node term = termValue.term();
            if (objectColumn && ordering && term.isLiteral()
                    && term.getLiteralLanguage().isEmpty()) {
                String key = TermCodec.rangeKey(term.getLiteralLexicalForm(),
                    term.getLiteralDatatypeURI(), upperBound);
                if (key != null) {
                    return key;
                }
            }
            return encode(name, term);
        }
        if (value instanceof OperatorValue.NumberValue numberValue) {
            Number number = numberValue.number();
            if (!objectColumn) {
                return number.toString();
            }
            if (ordering) {
                return TermCodec.rangeKey(number, upperBound);
            }
            return TermCodec.encodeObject(numberLiteral(number));
        }
        String raw = ((OperatorValue.RawValue) value).value();
        if (objectColumn && !raw.startsWith(TermCodec.NUMERIC_PREFIX)
                && !raw.startsWith(TermCodec.DATETIME_PREFIX)
                && !raw.startsWith("\"")) {
            return '"' + raw + '"';
        }
        return raw;
    }

    private static List<Object> operands(final TermName name,
            final List<OperatorValue> values) {
        var params = new ArrayList<Object>(values.size());
        for (OperatorValue value : values) {
            params.add(operand(name, value, false, false));
        }
        return params;
    }

    private static Node numberLiteral(final Number number) {
        if (number instanceof BigDecimal decimal) {
            return NodeFactory.createLiteral(decimal.toPlainString(),
                XSDDatatype.XSDdecimal);
        }
        if (number instanceof Double || number instanceof Float) {
            return NodeFactory.createLiteral(number.toString(), XSDDatatype.XSDdouble);
        }
        return NodeFactory.createLiteral(number.toString(), XSDDatatype.XSDinteger);
    }

    private static String like(final String column) {
        return column + " LIKE ? ESCAPE '" + LIKE_ESCAPE + "'";
    }

    private static String escapeLike(final String value) {
        var escaped = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static String placeholders(final int count) {
        var joined = new StringBuilder();
        for (int i = 0; i < count; i++) {
            joined.append(i == 0 ? "?" : ", ?");
        }
        return joined.toString();
    }

    /**
     * Accumulates conditions together with the parameters they bind, so
     * parameter order always follows placeholder order.
     */
    private static final class Conditions {
        private final List<String> parts = new ArrayList<>();
        private final List<Object> params = new ArrayList<>();

        void add(final String condition, final Object... values) {
            parts.add(condition);
            params.addAll(List.of(values));
        }

        void add(final String condition, final List<Object> values) {
            parts.add(condition);
            params.addAll(values);
        }

        SqlFragment toFragment() {
            if (parts.isEmpty()) {
                return SqlFragment.EMPTY;
            }
            return new SqlFragment(String.join(" AND ", parts), params);
        }
    }
}
