package com.quintstore.jena.query;

import com.quintstore.jena.codec.TermCodec;
import com.quintstore.jena.store.OperatorValue;
import com.quintstore.jena.store.TermName;
import com.quintstore.jena.store.TermOperators;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.expr.E_Bound;
import org.apache.jena.sparql.expr.E_Equals;
import org.apache.jena.sparql.expr.E_GreaterThan;
import org.apache.jena.sparql.expr.E_GreaterThanOrEqual;
import org.apache.jena.sparql.expr.E_IsBlank;
import org.apache.jena.sparql.expr.E_IsIRI;
import org.apache.jena.sparql.expr.E_IsLiteral;
import org.apache.jena.sparql.expr.E_IsNumeric;
import org.apache.jena.sparql.expr.E_Lang;
import org.apache.jena.sparql.expr.E_LangMatches;
import org.apache.jena.sparql.expr.E_LessThan;
import org.apache.jena.sparql.expr.E_LessThanOrEqual;
import org.apache.jena.sparql.expr.E_LogicalAnd;
import org.apache.jena.sparql.expr.E_LogicalNot;
import org.apache.jena.sparql.expr.E_LogicalOr;
import org.apache.jena.sparql.expr.E_NotEquals;
import org.apache.jena.sparql.expr.E_NotOneOf;
import org.apache.jena.sparql.expr.E_OneOf;
import org.apache.jena.sparql.expr.E_Regex;
import org.apache.jena.sparql.expr.E_Str;
import org.apache.jena.sparql.expr.E_StrContains;
import org.apache.jena.sparql.expr.E_StrEndsWith;
import org.apache.jena.sparql.expr.E_StrStartsWith;
import org.apache.jena.sparql.expr.Expr;
import org.apache.jena.sparql.expr.ExprFunction2;
import org.apache.jena.sparql.expr.ExprList;

/**
 * Extracts store conditions from SPARQL FILTER expressions over one triple
 * pattern.
 *
 * <p>Conditions are computed against the stored text of each column, so
 * most of them only prefilter: they keep every row the expression could
 * accept and the expression itself stays in the remainder to be evaluated
 * over the results. A few conditions are exact (IRI equality, membership in
 * a list of IRIs or plain strings, BOUND, isBlank) and are removed from the
 * remainder.</p>
 *
 * <p>Supported forms, with the variable on either side of a comparison:</p>
 * <ul>
 *   <li>{@code =, !=} against an IRI or literal, {@code < <= > >=} against
 *       a numeric or dateTime literal in the object position</li>
 *   <li>{@code STRSTARTS, STRENDS, CONTAINS, REGEX} over {@code ?v} or
 *       {@code STR(?v)}</li>
 *   <li>{@code IN, NOT IN, BOUND, !BOUND}</li>
 *   <li>{@code isIRI, isBlank, isLiteral, isNumeric}</li>
 *   <li>{@code LANGMATCHES(LANG(?v), ...)}</li>
 *   <li>{@code &&} of the above, and {@code ||} of equalities on one
 *       variable, which becomes a membership test</li>
 * </ul>
 */
public final class FilterPushdownExtractor {

    /** Regex constructs whose meaning depends on what surrounds a match. */
    private static final Pattern CONTEXT_SENSITIVE = Pattern.compile(
        "[\\^$]|\\(\\?|\\\\[bBAzZG]");

    /** Language tags usable inside a regex. */
    private static final Pattern LANGUAGE_TAG = Pattern.compile("[A-Za-z0-9-]+");

    /** Stored text of any literal starts with one of these. */
    private static final String LITERAL_PREFIX_REGEX = "^[\"ND]";

    /** Stored text of an IRI starts with a scheme letter. */
    private static final String IRI_PREFIX_REGEX = "^[A-Za-z]";

    /**
     * Variables of a quad pattern and the position each occupies. A
     * variable used twice keeps its first position.
     *
     * @param triple the triple pattern
     * @param graph the graph term or variable, or null
     * @return positions by variable
     */
    public static Map<Var, TermName> positions(final Triple triple, final Node graph) {
        var positions = new LinkedHashMap<Var, TermName>();
        position(positions, triple.getSubject(), TermName.SUBJECT);
        position(positions, triple.getPredicate(), TermName.PREDICATE);
        position(positions, triple.getObject(), TermName.OBJECT);
        position(positions, graph, TermName.GRAPH);
        return positions;
    }

    /**
     * Extract conditions from a filter's expression list, read as a
     * conjunction.
     *
     * @param exprs the expressions
     * @param positions positions of the pattern's variables
     * @return the conditions and the remainder
     */
    public PushdownResult extract(final ExprList exprs,
            final Map<Var, TermName> positions) {
        return extract(exprs.getList(), positions);
    }

    /**
     * Extract conditions from a conjunction of expressions.
     *
     * @param exprs the expressions
     * @param positions positions of the pattern's variables
     * @return the conditions and the remainder
     */
    public PushdownResult extract(final List<Expr> exprs,
            final Map<Var, TermName> positions) {
        var conjuncts = new ArrayList<Expr>();
        for (Expr expr : exprs) {
            flattenAnd(expr, conjuncts);
        }
        var filters = new LinkedHashMap<Var, TermOperators>();
        var remainder = new ArrayList<Expr>();
        for (Expr conjunct : conjuncts) {
            Condition condition = conjunct instanceof E_LogicalOr
                ? disjunction(conjunct, positions)
                : single(conjunct, positions);
            if (condition == null) {
                remainder.add(conjunct);
                continue;
            }
            TermOperators existing = filters.get(condition.var());
            if (existing != null && existing.overlaps(condition.operators())) {
                // one operand per operator; the later test is evaluated instead
                remainder.add(conjunct);
                continue;
            }
            filters.merge(condition.var(), condition.operators(), TermOperators::merge);
            if (!condition.exact()) {
                remainder.add(conjunct);
            }
        }
        return new PushdownResult(filters, remainder);
    }

    /**
     * Extract conditions from one expression.
     *
     * @param expr the expression
     * @param positions positions of the pattern's variables
     * @return the conditions and the remainder
     */
    public PushdownResult extract(final Expr expr, final Map<Var, TermName> positions) {
        return extract(List.of(expr), positions);
    }

    private Condition single(final Expr expr, final Map<Var, TermName> positions) {
        if (expr instanceof E_Equals || expr instanceof E_NotEquals
                || expr instanceof E_LessThan || expr instanceof E_LessThanOrEqual
                || expr instanceof E_GreaterThan || expr instanceof E_GreaterThanOrEqual) {
            return comparison((ExprFunction2) expr, positions);
        }
        if (expr instanceof E_StrStartsWith || expr instanceof E_StrEndsWith
                || expr instanceof E_StrContains) {
            return stringTest((ExprFunction2) expr, positions);
        }
        if (expr instanceof E_Regex regex) {
            return regex(regex, positions);
        }
        if (expr instanceof E_OneOf oneOf) {
            return membership(oneOf.getLHS(), oneOf.getRHS(), false, positions);
        }
        if (expr instanceof E_NotOneOf notOneOf) {
            return membership(notOneOf.getLHS(), notOneOf.getRHS(), true, positions);
        }
        if (expr instanceof E_Bound bound) {
            Var var = variable(bound.getArg(), positions);
            return var == null ? null
                : new Condition(var, TermOperators.builder().isNull(false).build(), true);
        }
        if (expr instanceof E_LogicalNot not && not.getArg() instanceof E_Bound bound) {
            Var var = variable(bound.getArg(), positions);
            return var == null ? null
                : new Condition(var, TermOperators.builder().isNull(true).build(), true);
        }
        if (expr instanceof E_IsIRI isIri) {
            return typeTest(isIri.getArg(), positions,
                TermOperators.builder().regex(IRI_PREFIX_REGEX).build(), false);
        }
        if (expr instanceof E_IsBlank isBlank) {
            return typeTest(isBlank.getArg(), positions,
                TermOperators.builder().startsWith("_:").build(), true);
        }
        if (expr instanceof E_IsLiteral isLiteral) {
            return typeTest(isLiteral.getArg(), positions,
                TermOperators.builder().regex(LITERAL_PREFIX_REGEX).build(), false);
        }
        if (expr instanceof E_IsNumeric isNumeric) {
            return typeTest(isNumeric.getArg(), positions,
                TermOperators.builder().startsWith(TermCodec.NUMERIC_PREFIX).build(),
                false);
        }
        if (expr instanceof E_LangMatches langMatches) {
            return languageTest(langMatches, positions);
        }
        return null;
    }

    private Condition comparison(final ExprFunction2 function,
            final Map<Var, TermName> positions) {
        Expr left = function.getArg1();
        Expr right = function.getArg2();
        boolean flipped = false;
        Var var = variable(left, positions);
        Node value = constant(right);
        if (var == null || value == null) {
            var = variable(right, positions);
            value = constant(left);
            flipped = true;
        }
        if (var == null || value == null) {
            return null;
        }
        boolean objectColumn = positions.get(var) == TermName.OBJECT;
        boolean sortable = objectColumn && sortable(value);
        var ops = TermOperators.builder();

        if (function instanceof E_Equals) {
            if (value.isURI() || simpleString(value)) {
                return new Condition(var, ops.eq(value).build(), true);
            }
            if (sortable) {
                return new Condition(var, ops.gte(value).lte(value).build(), false);
            }
            return null;
        }
        if (function instanceof E_NotEquals) {
            return new Condition(var, ops.ne(value).build(), value.isURI());
        }
        if (!sortable) {
            return null;
        }
        boolean greater = function instanceof E_GreaterThan
            || function instanceof E_GreaterThanOrEqual;
        boolean inclusive = function instanceof E_GreaterThanOrEqual
            || function instanceof E_LessThanOrEqual;
        if (flipped) {
            greater = !greater;
        }
        if (greater) {
            ops = inclusive ? ops.gte(value) : ops.gt(value);
        } else {
            ops = inclusive ? ops.lte(value) : ops.lt(value);
        }
        return new Condition(var, ops.build(), false);
    }

    private Condition stringTest(final ExprFunction2 function,
            final Map<Var, TermName> positions) {
        Node argument = constant(function.getArg2());
        if (argument == null || !argument.isLiteral()) {
            return null;
        }
        String value = argument.getLiteralLexicalForm();
        Expr target = function.getArg1();
        boolean viaStr = target instanceof E_Str;
        Var var = variable(viaStr ? ((E_Str) target).getArg() : target, positions);
        if (var == null) {
            return null;
        }
        boolean objectColumn = positions.get(var) == TermName.OBJECT;
        var ops = TermOperators.builder();
        if (function instanceof E_StrContains || (viaStr && objectColumn)) {
            ops.contains(value);
        } else if (function instanceof E_StrStartsWith) {
            ops.startsWith(viaStr ? value : '"' + value);
        } else if (viaStr) {
            ops.endsWith(value);
        } else {
            // the literal's closing quote follows its lexical form
            ops.contains(value + '"');
        }
        return new Condition(var, ops.build(), false);
    }

    private Condition regex(final E_Regex regex, final Map<Var, TermName> positions) {
        List<Expr> args = regex.getArgs();
        if (args.size() > 2) {
            return null;
        }
        Node patternNode = constant(args.get(1));
        if (patternNode == null || !patternNode.isLiteral()) {
            return null;
        }
        String pattern = patternNode.getLiteralLexicalForm();
        Expr target = args.get(0);
        Var var = variable(target instanceof E_Str str ? str.getArg() : target, positions);
        if (var == null) {
            return null;
        }
        if (positions.get(var) == TermName.OBJECT
                && CONTEXT_SENSITIVE.matcher(pattern).find()) {
            return null;
        }
        return new Condition(var, TermOperators.builder().regex(pattern).build(), false);
    }

    private Condition membership(final Expr lhs, final ExprList rhs,
            final boolean negated, final Map<Var, TermName> positions) {
        Var var = variable(lhs, positions);
        if (var == null || rhs.isEmpty()) {
            return null;
        }
        var terms = new ArrayList<Node>(rhs.size());
        boolean allExactTerms = true;
        boolean allIris = true;
        for (Expr item : rhs.getList()) {
            Node term = constant(item);
            if (term == null) {
                return null;
            }
            allExactTerms &= term.isURI() || simpleString(term);
            allIris &= term.isURI();
            terms.add(term);
        }
        if (negated) {
            return new Condition(var, TermOperators.builder().notInTerms(terms).build(),
                allIris);
        }
        if (!allExactTerms) {
            return null;
        }
        return new Condition(var, TermOperators.builder().inTerms(terms).build(), true);
    }

    private Condition disjunction(final Expr expr, final Map<Var, TermName> positions) {
        var branches = new ArrayList<Expr>();
        flattenOr(expr, branches);
        Var var = null;
        var terms = new ArrayList<Node>();
        for (Expr branch : branches) {
            if (!(branch instanceof E_Equals)) {
                return null;
            }
            Condition condition = comparison((ExprFunction2) branch, positions);
            if (condition == null || !condition.exact()
                    || condition.operators().getEq() == null
                    || (var != null && !var.equals(condition.var()))) {
                return null;
            }
            var = condition.var();
            terms.add(((OperatorValue.TermValue) condition.operators().getEq()).term());
        }
        return new Condition(var, TermOperators.builder().inTerms(terms).build(), true);
    }

    private Condition typeTest(final Expr arg, final Map<Var, TermName> positions,
            final TermOperators operators, final boolean exact) {
        Var var = variable(arg, positions);
        return var == null ? null : new Condition(var, operators, exact);
    }

    private Condition languageTest(final E_LangMatches langMatches,
            final Map<Var, TermName> positions) {
        if (!(langMatches.getArg1() instanceof E_Lang lang)) {
            return null;
        }
        Var var = variable(lang.getArg(), positions);
        Node range = constant(langMatches.getArg2());
        if (var == null || range == null || !range.isLiteral()) {
            return null;
        }
        String tag = range.getLiteralLexicalForm();
        var ops = TermOperators.builder();
        if ("*".equals(tag)) {
            ops.contains("\"@");
        } else if (LANGUAGE_TAG.matcher(tag).matches()) {
            ops.regex("(?i)\"@" + tag + "(-|$)");
        } else {
            return null;
        }
        return new Condition(var, ops.build(), false);
    }

    private static Var variable(final Expr expr, final Map<Var, TermName> positions) {
        if (expr == null || !expr.isVariable()) {
            return null;
        }
        Var var = expr.asVar();
        return positions.containsKey(var) ? var : null;
    }

    private static Node constant(final Expr expr) {
        if (expr == null || !expr.isConstant()) {
            return null;
        }
        return expr.getConstant().asNode();
    }

    private static boolean simpleString(final Node node) {
        return node.isLiteral() && node.getLiteralLanguage().isEmpty()
            && TermCodec.XSD_STRING.equals(node.getLiteralDatatypeURI());
    }

    private static boolean sortable(final Node node) {
        return node.isLiteral() && node.getLiteralLanguage().isEmpty()
            && TermCodec.rangeKey(node.getLiteralLexicalForm(),
                node.getLiteralDatatypeURI(), false) != null;
    }

    private static void flattenAnd(final Expr expr, final List<Expr> out) {
        if (expr instanceof E_LogicalAnd and) {
            flattenAnd(and.getArg1(), out);
            flattenAnd(and.getArg2(), out);
        } else {
            out.add(expr);
        }
    }

    private static void flattenOr(final Expr expr, final List<Expr> out) {
        if (expr instanceof E_LogicalOr or) {
            flattenOr(or.getArg1(), out);
            flattenOr(or.getArg2(), out);
        } else {
            out.add(expr);
        }
    }

    private static void position(final Map<Var, TermName> positions,
            final Node node, final TermName name) {
        if (node != null && node.isVariable()) {
            positions.putIfAbsent(Var.alloc(node), name);
        }
    }

    /**
     * One extracted condition.
     *
     * @param var the variable it constrains
     * @param operators the store condition
     * @param exact whether the condition alone decides the expression
     */
    private record Condition(Var var, TermOperators operators, boolean exact) {
    }
}
