package com.quintstore.jena.codec;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Sortable fixed-width string encoding of floating point values.
 *
 * <p>An encoded value is a single case digit, a three digit biased exponent
 * and a mantissa with seventeen decimals. Plain string comparison of two
 * encodings gives the same ordering as numeric comparison of the values.</p>
 *
 * <table>
 *   <caption>Encoding cases</caption>
 *   <tr><th>Case</th><th>Values</th><th>Exponent</th><th>Mantissa</th></tr>
 *   <tr><td>0</td><td>negative infinity</td><td>000</td><td>0</td></tr>
 *   <tr><td>1</td><td>negative, exponent &gt;= 0</td><td>999 - e</td><td>10 - m</td></tr>
 *   <tr><td>2</td><td>negative, exponent &lt; 0</td><td>-e</td><td>10 - m</td></tr>
 *   <tr><td>3</td><td>zero</td><td>000</td><td>0</td></tr>
 *   <tr><td>4</td><td>positive, exponent &lt; 0</td><td>999 + e</td><td>m</td></tr>
 *   <tr><td>5</td><td>positive, exponent &gt;= 0</td><td>e</td><td>m</td></tr>
 *   <tr><td>6</td><td>positive infinity</td><td>000</td><td>0</td></tr>
 *   <tr><td>7</td><td>NaN</td><td>000</td><td>0</td></tr>
 * </table>
 *
 * <p>The encoding is lossy. It exists for ordering only, the original
 * lexical value is always stored next to it.</p>
 */
public final class FpString {

    /** Number of mantissa decimals. */
    static final int MANTISSA_SCALE = 17;

    /** Largest exponent the three digit field can hold. */
    private static final int MAX_EXPONENT = 999;

    /** Encoding of zero. */
    public static final String ZERO = join(3, 0, BigDecimal.ZERO);

    /** Encoding of negative infinity. */
    public static final String NEGATIVE_INFINITY = join(0, 0, BigDecimal.ZERO);

    /** Encoding of positive infinity. */
    public static final String POSITIVE_INFINITY = join(6, 0, BigDecimal.ZERO);

    /** Encoding of NaN and of unparseable input. */
    public static final String NAN = join(7, 0, BigDecimal.ZERO);

    /** Private constructor to prevent instantiation. */
    private FpString() {
        // Utility class
    }

    /**
     * Encode a double.
     *
     * @param value the value
     * @return the sortable encoding
     */
    public static String encode(final double value) {
        if (Double.isNaN(value)) {
            return NAN;
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return NEGATIVE_INFINITY;
        }
        if (value == Double.POSITIVE_INFINITY) {
            return POSITIVE_INFINITY;
        }
        return encode(new BigDecimal(Double.toString(value)));
    }

    /**
     * Encode the lexical form of a numeric literal.
     *
     * <p>Accepts the XSD special values {@code INF}, {@code +INF},
     * {@code -INF} and {@code NaN}. Anything that does not parse as a number
     * encodes as NaN.</p>
     *
     * @param lexical the lexical form
     * @return the sortable encoding
     */
    public static String encode(final String lexical) {
        if (lexical == null) {
            return NAN;
        }
        String trimmed = lexical.trim();
        switch (trimmed) {
            case "INF", "+INF", "Infinity", "+Infinity":
                return POSITIVE_INFINITY;
            case "-INF", "-Infinity":
                return NEGATIVE_INFINITY;
            case "NaN":
                return NAN;
            default:
                break;
        }
        try {
            return encode(new BigDecimal(trimmed));
        } catch (NumberFormatException e) {
            return NAN;
        }
    }

    /**
     * Encode an exact decimal value.
     *
     * @param value the value
     * @return the sortable encoding
     */
    public static String encode(final BigDecimal value) {
        if (value.signum() == 0) {
            return ZERO;
        }
        boolean negative = value.signum() < 0;
        BigDecimal magnitude = value.abs().stripTrailingZeros();

        int exponent = magnitude.precision() - magnitude.scale() - 1;
        BigDecimal mantissa = magnitude.movePointLeft(exponent)
            .setScale(MANTISSA_SCALE, RoundingMode.HALF_EVEN);
        if (mantissa.compareTo(BigDecimal.TEN) >= 0) {
            exponent += 1;
            mantissa = mantissa.movePointLeft(1)
                .setScale(MANTISSA_SCALE, RoundingMode.HALF_EVEN);
        }

        if (exponent > MAX_EXPONENT) {
            return negative ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
        }
        if (exponent < -MAX_EXPONENT) {
            return ZERO;
        }

        if (negative) {
            BigDecimal complement = BigDecimal.TEN.subtract(mantissa);
            if (exponent >= 0) {
                return join(1, MAX_EXPONENT - exponent, complement);
            }
            return join(2, -exponent, complement);
        }
        if (exponent < 0) {
            return join(4, MAX_EXPONENT + exponent, mantissa);
        }
        return join(5, exponent, mantissa);
    }

    private static String join(final int encodingCase, final int exponent,
            final BigDecimal mantissa) {
        var sb = new StringBuilder(22);
        sb.append(encodingCase);
        if (exponent < 10) {
            sb.append("00");
        } else if (exponent < 100) {
            sb.append('0');
        }
        sb.append(exponent);
        sb.append(mantissa.setScale(MANTISSA_SCALE, RoundingMode.HALF_EVEN)
            .toPlainString());
        return sb.toString();
    }
}
