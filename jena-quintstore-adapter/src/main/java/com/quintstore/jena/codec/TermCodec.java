package com.quintstore.jena.codec;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Set;
import org.apache.jena.datatypes.RDFDatatype;
import org.apache.jena.datatypes.TypeMapper;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.sparql.core.Quad;
import org.apache.jena.sparql.core.Var;

/**
 * Converts RDF terms to and from the strings stored in the quint table.
 *
 * <p>Subjects, predicates and graphs use a canonical reversible text form:</p>
 * <ul>
 *   <li>IRI: the IRI itself</li>
 *   <li>blank node: {@code _:label}</li>
 *   <li>literal: {@code "lexical"}, {@code "lexical"@lang} or
 *       {@code "lexical"^^<datatype>}</li>
 *   <li>default graph: the empty string</li>
 * </ul>
 *
 * <p>Objects additionally give numeric and {@code xsd:dateTime} literals a
 * sortable form so that string order equals value order:</p>
 * <pre>
 * N\0&lt;fpstring&gt;\0&lt;datatype&gt;\0&lt;lexical&gt;
 * D\0&lt;fpstring of epoch millis&gt;\0&lt;lexical&gt;
 * </pre>
 *
 * <p>Decoding never rebuilds a value from the fpstring; the trailing lexical
 * field is used so the original term comes back unchanged. Strings that do not
 * match any known shape decode as an IRI.</p>
 */
public final class TermCodec {

    /** Field separator inside encoded object strings. */
    public static final char SEP = '\u0000';

    /**
     * Suffix that sorts after stored values sharing a prefix. Under UTF-8
     * byte order a supplementary-plane character (U+10000 and above) sorts
     * after it, so a value with such a character directly after the prefix
     * falls outside a {@code [prefix, prefix + MAX_SUFFIX)} range.
     */
    public static final String MAX_SUFFIX = "\uFFFF";

    /** Prefix of encoded numeric literals. */
    public static final String NUMERIC_PREFIX = "N" + SEP;

    /** Prefix of encoded dateTime literals. */
    public static final String DATETIME_PREFIX = "D" + SEP;

    /** XSD namespace. */
    public static final String XSD = "http://www.w3.org/2001/XMLSchema#";

    /** The xsd:string datatype IRI. */
    public static final String XSD_STRING = XSD + "string";

    /** The xsd:integer datatype IRI. */
    public static final String XSD_INTEGER = XSD + "integer";

    /** The xsd:dateTime datatype IRI. */
    public static final String XSD_DATETIME = XSD + "dateTime";

    /** Datatypes encoded with the sortable numeric form. */
    public static final Set<String> NUMERIC_TYPES = Set.of(
        XSD + "integer",
        XSD + "decimal",
        XSD + "float",
        XSD + "double",
        XSD + "nonPositiveInteger",
        XSD + "negativeInteger",
        XSD + "long",
        XSD + "int",
        XSD + "short",
        XSD + "byte",
        XSD + "nonNegativeInteger",
        XSD + "unsignedLong",
        XSD + "unsignedInt",
        XSD + "unsignedShort",
        XSD + "unsignedByte",
        XSD + "positiveInteger");

    /** Private constructor to prevent instantiation. */
    private TermCodec() {
        // Utility class
    }

    /**
     * Check whether a datatype IRI belongs to the XSD numeric family.
     *
     * @param datatypeUri the datatype IRI, may be null
     * @return true for numeric datatypes
     */
    public static boolean isNumericDatatype(final String datatypeUri) {
        return datatypeUri != null && NUMERIC_TYPES.contains(datatypeUri);
    }

    /**
     * Encode a subject, predicate or graph term.
     *
     * @param term the term
     * @return the canonical text form
     */
    public static String encodeTerm(final Node term) {
        if (term == null || Quad.isDefaultGraph(term)) {
            return "";
        }
        if (term.isURI()) {
            return term.getURI();
        }
        if (term.isBlank()) {
            return "_:" + term.getBlankNodeLabel();
        }
        if (term.isLiteral()) {
            return encodePlainLiteral(term);
        }
        if (term.isVariable()) {
            return "?" + term.getName();
        }
        throw new IllegalArgumentException("Cannot encode term: " + term);
    }

    /**
     * Encode an object term, using the sortable form for numeric and
     * dateTime literals.
     *
     * @param term the term
     * @return the stored string
     */
    public static String encodeObject(final Node term) {
        if (term == null || !term.isLiteral()) {
            return encodeTerm(term);
        }
        String datatype = term.getLiteralDatatypeURI();
        String lexical = term.getLiteralLexicalForm();
        if (term.getLiteralLanguage().isEmpty()) {
            if (isNumericDatatype(datatype)) {
                return NUMERIC_PREFIX + FpString.encode(lexical)
                    + SEP + datatype + SEP + lexical;
            }
            if (XSD_DATETIME.equals(datatype)) {
                return DATETIME_PREFIX + FpString.encode(epochMillis(lexical))
                    + SEP + lexical;
            }
        }
        return encodePlainLiteral(term);
    }

    /**
     * Decode a subject, predicate or graph string.
     *
     * @param encoded the stored string
     * @return the term
     */
    public static Node decodeTerm(final String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return Quad.defaultGraphIRI;
        }
        if (encoded.startsWith("_:")) {
            return NodeFactory.createBlankNode(encoded.substring(2));
        }
        if (encoded.charAt(0) == '"') {
            Node literal = decodePlainLiteral(encoded);
            if (literal != null) {
                return literal;
            }
        }
        if (encoded.charAt(0) == '?' && encoded.length() > 1) {
            return Var.alloc(encoded.substring(1));
        }
        return NodeFactory.createURI(encoded);
    }

    /**
     * Decode a stored object string.
     *
     * @param encoded the stored string
     * @return the term; unknown shapes decode as an IRI
     */
    public static Node decodeObject(final String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return decodeTerm(encoded);
        }
        if (encoded.startsWith(NUMERIC_PREFIX)) {
            String[] parts = encoded.split(String.valueOf(SEP), 4);
            if (parts.length == 4) {
                return NodeFactory.createLiteral(parts[3], datatype(parts[2]));
            }
            return NodeFactory.createURI(encoded);
        }
        if (encoded.startsWith(DATETIME_PREFIX)) {
            String[] parts = encoded.split(String.valueOf(SEP), 3);
            if (parts.length == 3) {
                return NodeFactory.createLiteral(parts[2], datatype(XSD_DATETIME));
            }
            return NodeFactory.createURI(encoded);
        }
        return decodeTerm(encoded);
    }

    /**
     * Sortable prefix used by ordering comparisons against a numeric or
     * dateTime literal.
     *
     * <p>{@code $lt} and {@code $gte} compare against the bare prefix, which
     * sorts before every stored value carrying the same fpstring.
     * {@code $gt} and {@code $lte} compare against the prefix followed by
     * the maximal suffix, which sorts after them.</p>
     *
     * @param lexical the literal lexical form
     * @param datatypeUri the literal datatype
     * @param upperBound whether to append the maximal suffix
     * @return the comparison key, or null when the datatype is not sortable
     */
    public static String rangeKey(final String lexical,
            final String datatypeUri, final boolean upperBound) {
        String key;
        if (isNumericDatatype(datatypeUri)) {
            key = NUMERIC_PREFIX + FpString.encode(lexical);
        } else if (XSD_DATETIME.equals(datatypeUri)) {
            key = DATETIME_PREFIX + FpString.encode(epochMillis(lexical));
        } else {
            return null;
        }
        return upperBound ? key + SEP + MAX_SUFFIX : key;
    }

    /**
     * Sortable comparison key for a plain number.
     *
     * @param value the number
     * @param upperBound whether to append the maximal suffix
     * @return the comparison key
     */
    public static String rangeKey(final Number value, final boolean upperBound) {
        String key = NUMERIC_PREFIX + FpString.encode(value.toString());
        return upperBound ? key + SEP + MAX_SUFFIX : key;
    }

    /**
     * Milliseconds since the epoch for an xsd:dateTime lexical form.
     * A value without a timezone is read as UTC.
     *
     * @param lexical the lexical form
     * @return epoch milliseconds, or NaN when unparseable
     */
    static double epochMillis(final String lexical) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(lexical.trim(), OffsetDateTime::from,
                    LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant().toEpochMilli();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC)
                .toEpochMilli();
        } catch (DateTimeParseException e) {
            return Double.NaN;
        }
    }

    private static String encodePlainLiteral(final Node literal) {
        String lexical = literal.getLiteralLexicalForm();
        String lang = literal.getLiteralLanguage();
        if (lang != null && !lang.isEmpty()) {
            return '"' + lexical + "\"@" + lang;
        }
        String datatype = literal.getLiteralDatatypeURI();
        if (datatype == null || XSD_STRING.equals(datatype)) {
            return '"' + lexical + '"';
        }
        return '"' + lexical + "\"^^<" + datatype + '>';
    }

    private static Node decodePlainLiteral(final String encoded) {
        int close = encoded.lastIndexOf('"');
        if (close <= 0) {
            return null;
        }
        String lexical = encoded.substring(1, close);
        String suffix = encoded.substring(close + 1);
        if (suffix.isEmpty()) {
            return NodeFactory.createLiteralString(lexical);
        }
        if (suffix.startsWith("@") && suffix.length() > 1) {
            return NodeFactory.createLiteralLang(lexical, suffix.substring(1));
        }
        if (suffix.startsWith("^^")) {
            String datatype = suffix.substring(2);
            if (datatype.startsWith("<") && datatype.endsWith(">")) {
                datatype = datatype.substring(1, datatype.length() - 1);
            }
            if (!datatype.isEmpty()) {
                return NodeFactory.createLiteral(lexical, datatype(datatype));
            }
        }
        return null;
    }

    private static RDFDatatype datatype(final String uri) {
        return TypeMapper.getInstance().getSafeTypeByName(uri);
    }
}
