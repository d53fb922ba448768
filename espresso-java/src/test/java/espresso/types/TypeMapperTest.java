package espresso.types;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class TypeMapperTest {

    static Stream<Arguments> conversions() {
        return Stream.of(
                Arguments.of("int", "EspressoInt"),
                Arguments.of("string", "EspressoString"),
                Arguments.of("bool", "bool"),
                Arguments.of("dulong", "EspressoULongLong"),
                Arguments.of("hex", "EspressoBits"),
                Arguments.of("list[int]", "EspressoList<EspressoInt>"),
                Arguments.of("map[string, list[int]]", "EspressoDict<EspressoString, EspressoList<EspressoInt>>"),
                Arguments.of("map[string,int]", "EspressoDict<EspressoString, EspressoInt>"),
                Arguments.of("tuple[int, string, bool]", "EspressoTuple<EspressoInt, EspressoString, bool>"),
                Arguments.of("Box<int>", "Box<EspressoInt>"),
                Arguments.of("std::vector[int]", "std::vector<EspressoInt>"),
                Arguments.of("MyClass", "MyClass"),
                Arguments.of("int*", "EspressoInt*"),
                Arguments.of("const int", "const EspressoInt"),
                Arguments.of("list[ int ]", "EspressoList<EspressoInt>")
        );
    }

    @ParameterizedTest
    @MethodSource("conversions")
    void convert_type(String espresso, String cpp) {
        assertEquals(cpp, TypeMapper.convert(espresso));
    }

    @Test
    void convert_is_stable_on_converted_text() {
        String once = TypeMapper.convert("map[string, list[int]]");
        assertEquals(once, TypeMapper.convert(once));
    }

    @Test
    void deeply_nested_generics() {
        assertEquals("EspressoList<EspressoList<EspressoList<EspressoDict<EspressoInt, EspressoSet<EspressoChar>>>>>",
                TypeMapper.convert("list[list[list[map[int, set[char]]]]]"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"list[int", "list[int>", "int]", "map<string]", "a>"})
    void mismatched_brackets(String type) {
        var e = assertThrows(TypeMapException.class, () -> TypeMapper.convert(type));
        assertEquals(type, e.typeText());
        assertTrue(e.getMessage().contains("in type '" + type + "'"), e.getMessage());
    }

    @Test
    void base_name_lookup() {
        assertTrue(TypeMapper.isBuiltin("float16"));
        assertFalse(TypeMapper.isBuiltin("Point"));
        assertEquals("EspressoChar&", TypeMapper.mapBaseName("char&"));
        assertEquals("Point", TypeMapper.mapBaseName("Point"));
    }
}
