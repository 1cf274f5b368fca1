package com.martian.mro.format;

import com.martian.mro.loader.ast.Exp;
import com.martian.mro.loader.ast.Param;
import com.martian.mro.loader.ast.RefExp;
import com.martian.mro.loader.ast.ValExp;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Canonical text for expressions. {@code prefix} is the indentation of the enclosing line. */
public final class ExpFormatter {

    private ExpFormatter() {}

    public static String format(Exp exp, String prefix) {
        StringBuilder out = new StringBuilder();
        format(exp, out, prefix);
        return out.toString();
    }

    static void format(Exp exp, StringBuilder out, String prefix) {
        if (exp instanceof RefExp ref) {
            formatRef(ref, out);
            return;
        }
        ValExp val = (ValExp) exp;
        switch (val.getKind()) {
            case NULL -> out.append("null");
            case INT -> out.append(val.asInt());
            case FLOAT -> out.append(formatFloat(val.asFloat()));
            case STRING -> out.append('"').append(val.asString()).append('"');
            case BOOL -> out.append(val.asBool());
            case ARRAY -> formatArray(val.asArray(), out, prefix);
            case MAP -> formatMap(val.asMap(), out, prefix);
        }
    }

    static void formatRef(RefExp ref, StringBuilder out) {
        if (ref.getKind() == RefExp.Kind.CALL) {
            out.append(ref.getId());
            if (!Param.DEFAULT_ID.equals(ref.getOutputId())) {
                out.append('.').append(ref.getOutputId());
            }
        } else {
            out.append("self.").append(ref.getId());
        }
    }

    static void formatSweep(List<Exp> values, StringBuilder out, String prefix) {
        out.append("sweep(\n");
        String indent = prefix + MroFormatter.INDENT;
        for (Exp value : values) {
            out.append(indent);
            format(value, out, indent);
            out.append(",\n");
        }
        out.append(prefix).append(')');
    }

    private static void formatArray(List<Exp> values, StringBuilder out, String prefix) {
        if (values.isEmpty()) {
            out.append("[]");
        } else if (values.size() == 1) {
            out.append('[');
            format(values.get(0), out, prefix);
            out.append(']');
        } else {
            out.append("[\n");
            String indent = prefix + MroFormatter.INDENT;
            for (Exp value : values) {
                out.append(indent);
                format(value, out, indent);
                out.append(",\n");
            }
            out.append(prefix).append(']');
        }
    }

    private static void formatMap(Map<String, Exp> values, StringBuilder out, String prefix) {
        if (values.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{\n");
        String indent = prefix + MroFormatter.INDENT;
        List<String> keys = new ArrayList<>(values.keySet());
        Collections.sort(keys);
        for (String key : keys) {
            out.append(indent).append('"').append(key).append("\": ");
            format(values.get(key), out, indent);
            out.append(",\n");
        }
        out.append(prefix).append('}');
    }

    /**
     * Shortest decimal that reads back as {@code value}. Fixed point unless the decimal exponent
     * is below -4 or at least 18, in which case {@code 5e-10} or {@code 1e+21} style with at least
     * two exponent digits. Negative zero prints as {@code 0}.
     */
    public static String formatFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("float has no literal form: " + value);
        }
        if (value == 0) {
            return "0";
        }
        BigDecimal decimal = shortestDecimal(value);
        int exponent = decimal.precision() - decimal.scale() - 1;
        // Fixed point integers must still fit a 64-bit int when read back.
        if (exponent >= -4 && exponent < 18) {
            return decimal.toPlainString();
        }
        String digits = decimal.unscaledValue().abs().toString();
        StringBuilder out = new StringBuilder();
        if (decimal.signum() < 0) {
            out.append('-');
        }
        out.append(digits.charAt(0));
        if (digits.length() > 1) {
            out.append('.').append(digits, 1, digits.length());
        }
        out.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            out.append('0');
        }
        return out.append(magnitude).toString();
    }

    /**
     * Rounds the exact binary value to the fewest significant digits that parse back to it.
     * {@link Double#toString(double)} is not shortest on every JDK.
     */
    private static BigDecimal shortestDecimal(double value) {
        BigDecimal exact = new BigDecimal(value);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == value) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }
}
