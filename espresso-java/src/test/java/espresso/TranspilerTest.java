package espresso;

import espresso.lexer.TokenType;
import espresso.parser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TranspilerTest {

    @Test
    void transpile_brace_program() {
        var cpp = new Transpiler().transpile("""
            int main() {
                return 0;
            }
            """);
        assertEquals("""
            #include <runtime.hpp>

            EspressoInt main() {
                return 0;
            }
            """, cpp);
    }

    @Test
    void transpile_adds_headers_used_by_the_code() {
        var cpp = new Transpiler().transpile("string s = $\"Hi {name}\";");
        assertEquals("""
            #include <fmt/format.h>
            #include <runtime.hpp>

            EspressoString s = fmt::format("Hi {0}", name);
            """, cpp);
    }

    @Test
    void transpile_keeps_string_escapes() {
        var cpp = new Transpiler().transpile("string s = \"\\x41\\a\\q\";");
        assertEquals("#include <runtime.hpp>\n\nEspressoString s = \"A\\a\\\\q\";\n", cpp);
    }

    @Test
    void transpile_layout_function() {
        var t = new Transpiler(new TranspilerOptions().withIndentationSensitive(true));
        var cpp = t.transpile("""
            func main():
                int x = 1
                if x > 0:
                    print(x)
                else:
                    print(0)
            """);
        assertEquals("""
            #include <runtime.hpp>

            void main() {
                EspressoInt x = 1;
                if (x > 0) {
                    print(x);
                } else {
                    print(0);
                }
            }
            """, cpp);
    }

    @Test
    void transpile_layout_class_with_section() {
        var t = new Transpiler(new TranspilerOptions().withIndentationSensitive(true));
        var cpp = t.transpile("""
            class Counter:
                int count = 0
                public:
                    void inc():
                        count++
            """);
        assertEquals("""
            #include <runtime.hpp>

            class Counter {
                EspressoInt count = 0;
            public:
                void inc() {
                    count++;
                }
            };
            """, cpp);
    }

    @Test
    void tokenize_follows_dialect() {
        var layout = new Transpiler(new TranspilerOptions().withIndentationSensitive(true)).tokenize("a:\n  b\n");
        assertTrue(layout.tokens().stream().anyMatch(tok -> tok.type() == TokenType.INDENT));
        var braces = new Transpiler().tokenize("a:\n  b\n");
        assertTrue(braces.tokens().stream().noneMatch(tok -> tok.type() == TokenType.INDENT));
    }

    @Test
    void recovery_reports_first_error() {
        var t = new Transpiler(new TranspilerOptions().withRecoverFromErrors(true));
        var e = assertThrows(ParseException.class, () -> t.transpile("int x = ;\nint y = 2;\nint z = );\n"));
        assertEquals(1, e.line());
        assertEquals("[1:9] Expected expression (got SEMICOLON ';')", e.getMessage());
    }

    @Test
    void custom_foreign_marker() {
        var t = new Transpiler(new TranspilerOptions().withForeignBlockMarker("@raw"));
        assertEquals("#include <runtime.hpp>\n\nint a = 1;\n", t.transpile("@raw {\n    int a = 1;\n}\n"));
    }

    @Test
    void options_default_includes_replace_the_header() {
        var t = new Transpiler(new TranspilerOptions().withDefaultIncludes(List.of("<vector>")));
        assertEquals("#include <vector>\n\nEspressoInt x = 1;\n", t.transpile("int x = 1;"));
    }
}
