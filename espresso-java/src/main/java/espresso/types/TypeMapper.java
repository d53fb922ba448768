package espresso.types;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * Rewrites Espresso type text into C++ type text.
 * <p>
 * {@code map[string, list[int]]} becomes {@code EspressoDict<EspressoString, EspressoList<EspressoInt>>}.
 * Square brackets turn into angle brackets, angle brackets are kept, known base names are replaced
 * and everything else passes through, so user classes and already converted text are left alone.
 */
public final class TypeMapper {

    private static final Map<String, String> TYPE_MAP = Map.ofEntries(
            Map.entry("byte", "EspressoByte"),
            Map.entry("short", "EspressoShort"),
            Map.entry("int", "EspressoInt"),
            Map.entry("long", "EspressoLong"),
            Map.entry("dlong", "EspressoLongLong"),
            Map.entry("ubyte", "EspressoUByte"),
            Map.entry("ushort", "EspressoUShort"),
            Map.entry("uint", "EspressoUInt"),
            Map.entry("ulong", "EspressoULong"),
            Map.entry("dulong", "EspressoULongLong"),
            Map.entry("float8", "EspressoFloat8"),
            Map.entry("float16", "EspressoFloat16"),
            Map.entry("float", "EspressoFloat"),
            Map.entry("double", "EspressoDouble"),
            Map.entry("decimal", "EspressoDecimal"),
            Map.entry("bin", "EspressoBits"),
            Map.entry("hex", "EspressoBits"),
            Map.entry("oct", "EspressoBits"),
            Map.entry("char", "EspressoChar"),
            Map.entry("string", "EspressoString"),
            Map.entry("bool", "bool"),
            Map.entry("void", "void"),
            Map.entry("any", "EspressoAny"),
            Map.entry("list", "EspressoList"),
            Map.entry("collection", "EspressoCollection"),
            Map.entry("map", "EspressoDict"),
            Map.entry("set", "EspressoSet"),
            Map.entry("tuple", "EspressoTuple"),
            Map.entry("auto", "auto"),
            Map.entry("union", "EspressoUnion")
    );

    private TypeMapper() {}

    /** C++ name for a single base type word, or the word itself when it is not a built-in. */
    public static String mapBaseName(String word) {
        int end = word.length();
        while (end > 0 && (word.charAt(end - 1) == '*' || word.charAt(end - 1) == '&')) end--;
        String base = word.substring(0, end);
        String mapped = TYPE_MAP.get(base);
        return mapped == null ? word : mapped + word.substring(end);
    }

    public static boolean isBuiltin(String word) {
        return TYPE_MAP.containsKey(word);
    }

    public static String convert(String typeText) {
        StringBuilder out = new StringBuilder(typeText.length() + 16);
        StringBuilder word = new StringBuilder();
        Deque<Character> brackets = new ArrayDeque<>();
        boolean pendingSpace = false;

        for (int i = 0; i < typeText.length(); i++) {
            char c = typeText.charAt(i);

            if (isWordChar(c)) {
                if (word.length() == 0 && pendingSpace && needsSpaceBefore(out)) out.append(' ');
                pendingSpace = false;
                word.append(c);
                continue;
            }

            flush(word, out);

            switch (c) {
                case '[', '<' -> {
                    brackets.push(c);
                    out.append('<');
                    pendingSpace = false;
                }
                case ']' -> {
                    close(brackets, '[', typeText);
                    out.append('>');
                    pendingSpace = false;
                }
                case '>' -> {
                    close(brackets, '<', typeText);
                    out.append('>');
                    pendingSpace = false;
                }
                case ',' -> {
                    out.append(", ");
                    pendingSpace = false;
                }
                case ' ', '\t', '\n', '\r' -> pendingSpace = true;
                default -> {
                    out.append(c);
                    pendingSpace = false;
                }
            }
        }
        flush(word, out);

        if (!brackets.isEmpty()) {
            throw new TypeMapException("Unclosed '" + brackets.peek() + "'", typeText);
        }
        return out.toString();
    }

    private static void close(Deque<Character> brackets, char expected, String typeText) {
        char closing = expected == '[' ? ']' : '>';
        if (brackets.isEmpty()) {
            throw new TypeMapException("Unmatched '" + closing + "'", typeText);
        }
        char open = brackets.pop();
        if (open != expected) {
            throw new TypeMapException("'" + open + "' closed by '" + closing + "'", typeText);
        }
    }

    private static void flush(StringBuilder word, StringBuilder out) {
        if (word.length() == 0) return;
        out.append(mapBaseName(word.toString()));
        word.setLength(0);
    }

    private static boolean needsSpaceBefore(StringBuilder out) {
        if (out.length() == 0) return false;
        char last = out.charAt(out.length() - 1);
        return last != '<' && last != ' ';
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == ':' || c == '.' || c == '*' || c == '&';
    }
}
