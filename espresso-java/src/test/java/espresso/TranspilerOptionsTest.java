package espresso;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class TranspilerOptionsTest {

    private static Properties props(String... pairs) {
        var p = new Properties();
        for (int i = 0; i < pairs.length; i += 2) p.setProperty(pairs[i], pairs[i + 1]);
        return p;
    }

    @Test
    void defaults() {
        var o = new TranspilerOptions();
        assertEquals("@cpp", o.foreignBlockMarker());
        assertFalse(o.indentationSensitive());
        assertFalse(o.recoverFromErrors());
        assertEquals(4, o.tabWidth());
        assertEquals(List.of("<runtime.hpp>"), o.defaultIncludes());
    }

    @Test
    void with_methods_change_one_field() {
        var o = new TranspilerOptions().withIndentationSensitive(true).withTabWidth(8);
        assertTrue(o.indentationSensitive());
        assertEquals(8, o.tabWidth());
        assertEquals("@cpp", o.foreignBlockMarker());
        assertEquals(List.of(), o.withDefaultIncludes(null).defaultIncludes());
    }

    @Test
    void from_properties() {
        var o = TranspilerOptions.fromProperties(props(
                "espresso.foreign-marker", " @raw ",
                "espresso.indentation", "true",
                "espresso.default-includes", "<a.h>,, \"b.h\""
        ));
        assertEquals("@raw", o.foreignBlockMarker());
        assertTrue(o.indentationSensitive());
        assertFalse(o.recoverFromErrors());
        assertEquals(List.of("<a.h>", "\"b.h\""), o.defaultIncludes());
    }

    @Test
    void empty_properties_give_defaults() {
        assertEquals(new TranspilerOptions(), TranspilerOptions.fromProperties(new Properties()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-2", "four"})
    void bad_tab_width(String width) {
        assertThrows(IllegalArgumentException.class,
                () -> TranspilerOptions.fromProperties(props("espresso.tab-width", width)));
    }

    @Test
    void blank_marker() {
        assertThrows(IllegalArgumentException.class, () -> new TranspilerOptions().withForeignBlockMarker(" "));
    }

    @Test
    void load_reads_classpath_resource() {
        var o = TranspilerOptions.load();
        assertEquals(2, o.tabWidth());
        assertTrue(o.recoverFromErrors());
        assertEquals(List.of("<runtime.hpp>", "<vector>"), o.defaultIncludes());
    }
}
