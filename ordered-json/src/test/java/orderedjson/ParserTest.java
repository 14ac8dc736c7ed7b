package orderedjson;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ParserTest {

    private final OrderedJson.Parser parser = OrderedJson.Parser.builder().build();

    @Nested
    class Reconstruct {

        @Test
        void repeatedMemberMovesToTheEnd() {
            // the scan would reject this; reconstruction on its own must still never duplicate a key
            var json = "{\"a\":1,\"b\":2,\"a\":3}";

            var map = (OrderedMap) parser.reconstruct(json, parser.decodeFlat(json));

            assertThat(map.keys()).containsExactly("b", "a");
            assertThat(map.get("a")).isEqualTo(new JsonNumber(3));
        }

        @Test
        void scalarTypeDisagreement() {
            assertThatThrownBy(() -> parser.reconstruct("{\"a\":1}", Map.of("a", "one")))
                    .isInstanceOf(OrderedJson.TypeMismatchException.class)
                    .hasMessage("Expected NUMBER at line 1, column 6, but the decoded value is String");
        }

        @Test
        void containerTypeDisagreement() {
            assertThatThrownBy(() -> parser.reconstruct("{\"a\":{}}", Map.of("a", List.of())))
                    .isInstanceOf(OrderedJson.TypeMismatchException.class)
                    .hasMessageStartingWith("Expected object");
            assertThatThrownBy(() -> parser.reconstruct("[1]", Map.of()))
                    .isInstanceOf(OrderedJson.TypeMismatchException.class)
                    .hasMessageStartingWith("Expected array");
        }

        @Test
        void missingMember() {
            assertThatThrownBy(() -> parser.reconstruct("{\"a\":1}", Map.of()))
                    .isInstanceOf(OrderedJson.TypeMismatchException.class)
                    .hasMessageContaining("\"a\"");
        }

        @Test
        void arrayLongerThanDecoded() {
            assertThatThrownBy(() -> parser.reconstruct("[1,2]", List.of(1)))
                    .isInstanceOf(OrderedJson.TypeMismatchException.class);
        }
    }

    @Nested
    class MaxDepth {

        @Test
        void limitApplies() {
            var shallow = OrderedJson.Parser.builder().maxDepth(2).build();

            assertThatCode(() -> shallow.parse("[[1]]")).doesNotThrowAnyException();
            assertThatCode(() -> shallow.unmarshal("{\"a\":{}}")).doesNotThrowAnyException();
            assertThatThrownBy(() -> shallow.parse("[[[1]]]"))
                    .isInstanceOf(OrderedJson.SyntaxException.class)
                    .hasMessageContaining("Maximum nesting depth of 2 exceeded");
            assertThatThrownBy(() -> shallow.checkDuplicates("{\"a\":{\"b\":{}}}"))
                    .isInstanceOf(OrderedJson.SyntaxException.class);
        }

        @Test
        void deepInputFailsCleanly() {
            var json = "[".repeat(100_000) + "]".repeat(100_000);

            assertThatThrownBy(() -> OrderedJson.parse(json))
                    .isInstanceOf(OrderedJson.SyntaxException.class)
                    .hasMessageContaining("Maximum nesting depth of " + OrderedJson.DEFAULT_MAX_DEPTH);
        }

        @Test
        void toBuilderKeepsSettings() {
            var shallow = OrderedJson.Parser.builder().maxDepth(1).build();
            var copy = shallow.toBuilder().build();

            assertThatThrownBy(() -> copy.parse("[[]]")).isInstanceOf(OrderedJson.SyntaxException.class);
        }
    }

    @Nested
    class IntegerDigits {

        @Test
        void longIntegersStayDecimalPastTheLimit() {
            var narrow = OrderedJson.Parser.builder().maxIntegerDigits(5).build();

            assertThat(((JsonNumber) narrow.parse("12345")).value()).isEqualTo(12345);
            assertThat(((JsonNumber) narrow.parse("123456")).value()).isEqualTo(new BigDecimal("123456"));
            assertThat(((JsonNumber) narrow.parse("1e5")).value()).isInstanceOf(BigDecimal.class);
            assertThat(((JsonNumber) parser.parse("123456")).value()).isEqualTo(123456);
        }

        @Test
        void defaultLimitStillExpandsLargeIntegers() {
            var digits = "9".repeat(OrderedJson.DEFAULT_MAX_INTEGER_DIGITS);

            assertThat(((JsonNumber) parser.parse(digits)).value()).isEqualTo(new BigInteger(digits));
            assertThat(((JsonNumber) parser.parse("1e" + OrderedJson.DEFAULT_MAX_INTEGER_DIGITS)).value())
                    .isInstanceOf(BigDecimal.class);
        }

        @Test
        void exponentOutOfRange() {
            assertThatThrownBy(() -> parser.parse("[1E+9999999999]"))
                    .isInstanceOf(OrderedJson.SyntaxException.class)
                    .hasMessageContaining("Number out of range: 1E+9999999999");
        }
    }
}
