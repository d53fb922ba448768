package espresso.ast.expr;

import espresso.ast.NodeKind;
import espresso.ast.RenderContext;
import espresso.ast.RenderException;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Integer or floating literal with its inferred runtime type.
 * <p>
 * C++ based literals cannot carry a sign, so a negative hex, binary or octal literal is rendered
 * as the two's complement bit pattern of its signed type: {@code -0x1} becomes {@code 0xFF}.
 *
 * @param raw      source text, sign included
 * @param digits   text without sign, separators and suffix, e.g. {@code 0x1F}
 * @param suffix   suffix in table spelling ({@code i8}, {@code UL}), "" when absent
 * @param negative whether a minus sign was folded into the literal
 * @param base     radix of {@code digits}
 * @param type     C++ runtime type name, e.g. {@code EspressoInt}
 */
public record NumericLiteral(String raw, String digits, String suffix, boolean negative,
                             int base, String type) implements Expr {

    static final Map<String, String> SUFFIX_TYPES = Map.ofEntries(
            Map.entry("u8", "EspressoUByte"),
            Map.entry("u16", "EspressoUShort"),
            Map.entry("u32", "EspressoUInt"),
            Map.entry("u64", "EspressoULong"),
            Map.entry("U", "EspressoUInt"),
            Map.entry("UL", "EspressoULong"),
            Map.entry("i8", "EspressoByte"),
            Map.entry("i16", "EspressoShort"),
            Map.entry("i32", "EspressoInt"),
            Map.entry("i64", "EspressoLong"),
            Map.entry("L", "EspressoLong"),
            Map.entry("LL", "EspressoLongLong"),
            Map.entry("f32", "EspressoFloat"),
            Map.entry("f64", "EspressoDouble"),
            Map.entry("F", "EspressoFloat"),
            Map.entry("D", "EspressoDouble")
    );

    private static final List<String> SUFFIXES_LONGEST_FIRST = SUFFIX_TYPES.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.<String>naturalOrder()))
            .toList();

    private record Range(String type, BigInteger min, BigInteger max, int bits) {
        Range(String type, String min, String max, int bits) {
            this(type, new BigInteger(min), new BigInteger(max), bits);
        }

        boolean fits(BigInteger value) {
            return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
        }
    }

    private static final List<Range> SIGNED = List.of(
            new Range("EspressoByte", "-128", "127", 8),
            new Range("EspressoShort", "-32768", "32767", 16),
            new Range("EspressoInt", "-2147483648", "2147483647", 32),
            new Range("EspressoLong", "-9223372036854775808", "9223372036854775807", 64)
    );

    private static final List<Range> UNSIGNED = List.of(
            new Range("EspressoUShort", "0", "65535", 16),
            new Range("EspressoUInt", "0", "4294967295", 32),
            new Range("EspressoULong", "0", "18446744073709551615", 64)
    );

    private static final Map<String, Range> SUFFIX_RANGES = suffixRanges();

    private static final Map<String, Integer> SIGNED_BITS = Map.of(
            "EspressoByte", 8,
            "EspressoShort", 16,
            "EspressoInt", 32,
            "EspressoLong", 64,
            "EspressoLongLong", 64
    );

    /**
     * Parses a literal as written, optionally with a leading {@code -}.
     *
     * @throws IllegalArgumentException when the text is malformed or no integer type holds the value
     */
    public static NumericLiteral of(String raw) {
        String clean = raw.replace("_", "").strip();
        boolean negative = clean.startsWith("-");
        if (negative) clean = clean.substring(1).strip();

        int base = baseOf(clean);
        String suffix = findSuffix(clean, base);
        String digits = clean.substring(0, clean.length() - suffix.length());

        String body = base == 10 ? digits : digits.substring(2);
        if (body.isEmpty()) throw new IllegalArgumentException("Malformed numeric literal: " + raw);

        String type;
        if (!suffix.isEmpty()) {
            type = SUFFIX_TYPES.get(suffix);
        } else if (base == 10 && isFloating(digits)) {
            type = "EspressoDouble";
        } else {
            type = inferIntegerType(raw, magnitude(body, base, raw), negative, base);
        }

        if (isFloatType(type) && base != 10) {
            throw new IllegalArgumentException("Float suffix on a based literal: " + raw);
        }
        if (!isFloatType(type) && isFloating(digits) && base == 10) {
            throw new IllegalArgumentException("Integer suffix on a floating literal: " + raw);
        }
        if (!isFloatType(type)) {
            BigInteger value = magnitude(body, base, raw);
            if (!suffix.isEmpty()) checkSuffixRange(raw, type, negative ? value.negate() : value);
        }

        return new NumericLiteral(raw, digits, suffix, negative, base, type);
    }

    public boolean isFloating() {
        return isFloatType(type);
    }

    @Override
    public NodeKind kind() { return NodeKind.NUMERIC_LITERAL; }

    @Override
    public String render(RenderContext ctx) {
        if (isFloating()) {
            String text = digits;
            if (type.equals("EspressoFloat")) {
                if (!isFloating(text)) text += ".0";
                text += "F";
            }
            return negative ? "-" + text : text;
        }

        if (negative && type.startsWith("EspressoU")) {
            throw new RenderException(kind(), "negative literal " + raw + " with unsigned type " + type);
        }

        String value = integerText();
        return suffix.isEmpty() ? value : type + "(" + value + ")";
    }

    private String integerText() {
        if (negative && base != 10) {
            return twosComplement();
        }
        String text = base == 8 ? "0" + digits.substring(2) : digits;
        return negative ? "-" + text : text;
    }

    private String twosComplement() {
        int bits = SIGNED_BITS.getOrDefault(type, 32);
        BigInteger modulus = BigInteger.ONE.shiftLeft(bits);
        BigInteger pattern = modulus.subtract(magnitude(digits.substring(2), base, raw)).mod(modulus);
        return switch (base) {
            case 16 -> "0x" + pattern.toString(16).toUpperCase(Locale.ROOT);
            case 2 -> "0b" + pattern.toString(2);
            case 8 -> "0" + pattern.toString(8);
            default -> pattern.toString();
        };
    }

    // ---------- parsing helpers ----------

    private static int baseOf(String clean) {
        String lower = clean.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x")) return 16;
        if (lower.startsWith("0b")) return 2;
        if (lower.startsWith("0o")) return 8;
        return 10;
    }

    /** Longest matching suffix in table spelling, case-insensitive. Hex literals skip suffixes that read as hex digits. */
    private static String findSuffix(String clean, int base) {
        String lower = clean.toLowerCase(Locale.ROOT);
        for (String candidate : SUFFIXES_LONGEST_FIRST) {
            if (base == 16 && isHexDigits(candidate)) continue;
            if (candidate.length() >= clean.length()) continue;
            if (lower.endsWith(candidate.toLowerCase(Locale.ROOT))) {
                return candidate;
            }
        }
        return "";
    }

    private static String inferIntegerType(String raw, BigInteger magnitude, boolean negative, int base) {
        BigInteger value = negative ? magnitude.negate() : magnitude;
        if (!negative && base == 10) {
            for (Range r : UNSIGNED) {
                if (r.fits(value)) return r.type();
            }
        }
        for (Range r : SIGNED) {
            if (r.fits(value)) return r.type();
        }
        if (!negative) {
            for (Range r : UNSIGNED) {
                if (r.fits(value)) return r.type();
            }
        }
        throw new IllegalArgumentException("Value " + raw + " is out of range for all types");
    }

    private static Map<String, Range> suffixRanges() {
        Map<String, Range> ranges = new HashMap<>();
        for (Range r : SIGNED) ranges.put(r.type(), r);
        for (Range r : UNSIGNED) ranges.put(r.type(), r);
        ranges.put("EspressoUByte", new Range("EspressoUByte", "0", "255", 8));
        ranges.put("EspressoLongLong", new Range("EspressoLongLong", "-9223372036854775808", "9223372036854775807", 64));
        return Map.copyOf(ranges);
    }

    /** A negative value with an unsigned suffix is left to {@link #render} and only its magnitude is checked here. */
    private static void checkSuffixRange(String raw, String type, BigInteger value) {
        Range range = SUFFIX_RANGES.get(type);
        BigInteger checked = type.startsWith("EspressoU") ? value.abs() : value;
        if (range != null && !range.fits(checked)) {
            throw new IllegalArgumentException("Value " + raw + " is out of range for " + type);
        }
    }

    private static BigInteger magnitude(String body, int base, String raw) {
        try {
            return new BigInteger(body, base);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed numeric literal: " + raw, e);
        }
    }

    private static boolean isFloating(String digits) {
        return digits.contains(".") || digits.contains("e") || digits.contains("E");
    }

    private static boolean isFloatType(String type) {
        return type.equals("EspressoFloat") || type.equals("EspressoDouble");
    }

    private static boolean isHexDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) < 0) return false;
        }
        return true;
    }
}
