package orderedjson;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.Builder;
import org.jspecify.annotations.Nullable;

/**
 * Order-preserving JSON codec for {@link OrderedMap}.
 *
 * <p> Objects are written with their members in key order, and read back with the key order of the document.
 * Duplicate member names are rejected at any depth instead of letting the last value win.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * OrderedMap map = OrderedJson.unmarshal("{\"b\":1,\"a\":{\"y\":2,\"x\":3}}");
 * map.keys();                   // -> [b, a]
 * OrderedJson.stringify(map);   // -> {"b":1,"a":{"y":2,"x":3}}
 *
 * OrderedJson.unmarshal("{\"a\":1,\"a\":2}");
 * // -> DuplicateKeyException: Duplicate key "a" at line 1, column 8
 * }</pre>
 */
public final class OrderedJson {

    static final int DEFAULT_MAX_DEPTH = 512;
    static final int DEFAULT_MAX_INTEGER_DIGITS = 4096;

    private static final Writer defaultWriter = Writer.builder().build();
    private static final Parser defaultParser = Parser.builder().build();

    private OrderedJson() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Serialize an ordered map to compact UTF-8 JSON, members in key order.
     *
     * @param map map to write, not {@code null}
     * @return UTF-8 encoded JSON object
     */
    public static byte[] marshal(OrderedMap map) {
        Objects.requireNonNull(map, "map");
        return defaultWriter.writeBytes(map);
    }

    /**
     * Serialize any JSON value to compact JSON text.
     *
     * @param value value to write, not {@code null}
     * @return non-null JSON text
     */
    public static String stringify(JsonValue value) {
        Objects.requireNonNull(value, "value");
        return defaultWriter.write(value);
    }

    /**
     * Parse a UTF-8 encoded JSON object into an {@link OrderedMap}.
     *
     * @param json UTF-8 JSON bytes, not {@code null}
     * @return a new map holding the document's members in document order
     * @throws SyntaxException       if the input is not valid JSON
     * @throws DuplicateKeyException if any object in the input repeats a member name
     * @throws TypeMismatchException if the top-level value is not an object
     */
    public static OrderedMap unmarshal(byte[] json) {
        Objects.requireNonNull(json, "json");
        return defaultParser.unmarshal(new String(json, StandardCharsets.UTF_8));
    }

    /**
     * Parse JSON text into an {@link OrderedMap}.
     *
     * <p> This is a convenience overload of {@link #unmarshal(byte[])}
     *
     * @param json JSON text, not {@code null}
     * @return a new map holding the document's members in document order
     */
    public static OrderedMap unmarshal(String json) {
        Objects.requireNonNull(json, "json");
        return defaultParser.unmarshal(json);
    }

    /**
     * Parse any UTF-8 encoded JSON value. Nested objects become {@link OrderedMap}s.
     *
     * @param json UTF-8 JSON bytes, not {@code null}
     * @return parsed value, {@link JsonNull} for {@code null}
     */
    public static JsonValue parse(byte[] json) {
        Objects.requireNonNull(json, "json");
        return defaultParser.parse(new String(json, StandardCharsets.UTF_8));
    }

    /**
     * Convenience overload of {@link #parse(byte[])} for JSON text.
     */
    public static JsonValue parse(String json) {
        Objects.requireNonNull(json, "json");
        return defaultParser.parse(json);
    }

    /**
     * Validate that no object anywhere in the given UTF-8 JSON repeats a member name.
     *
     * <p> Builds nothing; usable on any JSON without going through {@link OrderedMap}.
     *
     * @param json UTF-8 JSON bytes, not {@code null}
     * @throws SyntaxException       if the input is not valid JSON
     * @throws DuplicateKeyException on the first repeated member name
     */
    public static void checkDuplicates(byte[] json) {
        Objects.requireNonNull(json, "json");
        defaultParser.checkDuplicates(new String(json, StandardCharsets.UTF_8));
    }

    /**
     * Convenience overload of {@link #checkDuplicates(byte[])} for JSON text.
     */
    public static void checkDuplicates(String json) {
        Objects.requireNonNull(json, "json");
        defaultParser.checkDuplicates(json);
    }

    // ============================================================
    // Lexer
    // ============================================================

    enum Token {
        LBRACE,
        RBRACE,
        LBRACKET,
        RBRACKET,
        COLON,
        COMMA,
        STRING,
        NUMBER,
        TRUE,
        FALSE,
        NULL,
        EOF
    }

    static final class Lexer {
        private final String s;
        private int i = 0, line = 1, col = 1;
        private int tokenLine = 1, tokenCol = 1;
        private Token current;
        private String stringValue, numberLexeme;

        Lexer(String s) {
            this.s = Objects.requireNonNull(s);
            advance();
        }

        Token current() {
            return current;
        }

        String string() {
            return stringValue;
        }

        String number() {
            return numberLexeme;
        }

        int line() {
            return line;
        }

        int col() {
            return col;
        }

        /** Line where the current token starts. */
        int tokenLine() {
            return tokenLine;
        }

        int tokenCol() {
            return tokenCol;
        }

        void advance() {
            skipWs();
            tokenLine = line;
            tokenCol = col;
            if (eof()) {
                current = Token.EOF;
                return;
            }
            char c = peek();
            switch (c) {
                case '{' -> {
                    consume();
                    current = Token.LBRACE;
                }
                case '}' -> {
                    consume();
                    current = Token.RBRACE;
                }
                case '[' -> {
                    consume();
                    current = Token.LBRACKET;
                }
                case ']' -> {
                    consume();
                    current = Token.RBRACKET;
                }
                case ':' -> {
                    consume();
                    current = Token.COLON;
                }
                case ',' -> {
                    consume();
                    current = Token.COMMA;
                }
                case '"' -> {
                    stringValue = readString();
                    current = Token.STRING;
                }
                case 't' -> {
                    readKeyword("true");
                    current = Token.TRUE;
                }
                case 'f' -> {
                    readKeyword("false");
                    current = Token.FALSE;
                }
                case 'n' -> {
                    readKeyword("null");
                    current = Token.NULL;
                }
                default -> {
                    if (c == '-' || isDigit(c)) {
                        numberLexeme = readNumber();
                        current = Token.NUMBER;
                    } else error("Unexpected character: '" + c + "'");
                }
            }
        }

        private void skipWs() {
            for (; !eof(); consume()) {
                char c = peek();
                if (c == '\n') {
                    line++;
                    col = 0;
                } else if (c != ' ' && c != '\t' && c != '\r') {
                    return;
                }
            }
        }

        /**
         * Copies unescaped runs in one go. A unicode escape yields one UTF-16 unit, so an escaped surrogate pair
         * lands in the builder as the pair and an unpaired surrogate is kept as it is.
         */
        private String readString() {
            consume(); // opening quote
            var sb = new StringBuilder();
            int run = i;
            while (!eof()) {
                char c = peek();
                if (c != '"' && c != '\\' && c >= 0x20) {
                    consume();
                    continue;
                }
                sb.append(s, run, i);
                consume();
                if (c == '"') return sb.toString();
                if (c != '\\') error("Unescaped control character in string (ASCII " + (int) c + ")");
                sb.append(readEscape());
                run = i;
            }
            error("Unterminated string literal");
            return null;
        }

        private char readEscape() {
            if (eof()) error("Unterminated escape sequence");
            char e = consume();
            return switch (e) {
                case '"', '\\', '/' -> e;
                case 'b' -> '\b';
                case 'f' -> '\f';
                case 'n' -> '\n';
                case 'r' -> '\r';
                case 't' -> '\t';
                case 'u' -> readHex4();
                default -> {
                    error("Invalid escape sequence: \\" + e);
                    yield e;
                }
            };
        }

        private char readHex4() {
            int unit = 0;
            for (int k = 0; k < 4; k++) {
                if (eof()) error("Unexpected end of input in \\u escape sequence");
                int digit = hexDigit(consume());
                if (digit < 0) error("Invalid hexadecimal digit in \\u escape sequence");
                unit = unit << 4 | digit;
            }
            return (char) unit;
        }

        private static int hexDigit(char c) {
            if (isDigit(c)) return c - '0';
            char lower = (char) (c | 0x20);
            return lower >= 'a' && lower <= 'f' ? lower - 'a' + 10 : -1;
        }

        private void readKeyword(String kw) {
            int k = 0;
            while (k < kw.length() && !eof() && peek() == kw.charAt(k)) {
                consume();
                k++;
            }
            if (k < kw.length()) error("Invalid literal, expected '" + kw + "'");
        }

        /** Returns the lexeme as written; conversion to a {@link Number} is the parser's job. */
        private String readNumber() {
            int start = i;
            if (peek() == '-') consume();
            if (eof()) error("Unexpected end of input while parsing number");
            if (peek() == '0') consume();
            else if (skipDigits() == 0) error("Invalid number format (integer part)");
            if (!eof() && peek() == '.') {
                consume();
                if (skipDigits() == 0) error("Invalid number format (fractional part)");
            }
            if (!eof() && (peek() == 'e' || peek() == 'E')) {
                consume();
                if (!eof() && (peek() == '+' || peek() == '-')) consume();
                if (skipDigits() == 0) error("Invalid number format (exponent part)");
            }
            return s.substring(start, i);
        }

        private int skipDigits() {
            int from = i;
            while (!eof() && isDigit(peek())) consume();
            return i - from;
        }

        private boolean eof() {
            return i >= s.length();
        }

        private char peek() {
            return s.charAt(i);
        }

        private char consume() {
            col++;
            return s.charAt(i++);
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private void error(String msg) {
            throw new SyntaxException(msg, line, col);
        }
    }

    // ============================================================
    // Writer (compact, members in key order)
    // ============================================================

    @Builder(toBuilder = true)
    public static final class Writer {

        /**
         * Write {@code <}, {@code >} and {@code &} as unicode escapes. Off by default: they are emitted literally.
         */
        private final boolean escapeHtml;

        public String write(JsonValue v) {
            var sb = new StringBuilder();
            write(sb, v);
            return sb.toString();
        }

        public byte[] writeBytes(JsonValue v) {
            return write(v).getBytes(StandardCharsets.UTF_8);
        }

        void write(StringBuilder out, JsonValue v) {
            if (v instanceof JsonNull) {
                out.append("null");
                return;
            }
            if (v instanceof JsonBoolean b) {
                out.append(b.value() ? "true" : "false");
                return;
            }
            if (v instanceof JsonNumber n) {
                out.append(n.value());
                return;
            }
            if (v instanceof JsonString s) {
                writeString(out, s.value());
                return;
            }
            if (v instanceof JsonArray a) {
                out.append('[');
                List<JsonValue> vs = a.value();
                for (int i = 0; i < vs.size(); i++) {
                    if (i > 0) out.append(',');
                    write(out, vs.get(i));
                }
                out.append(']');
                return;
            }
            if (v instanceof OrderedMap m) {
                writeObject(out, m);
                return;
            }
            throw new IllegalArgumentException("Unknown JsonValue type: " + v.getClass());
        }

        private void writeObject(StringBuilder out, OrderedMap map) {
            out.append('{');
            for (int i = 0; i < map.size(); i++) {
                if (i > 0) out.append(',');
                String key = map.getKeyAt(i);
                writeString(out, key);
                out.append(':');
                write(out, map.get(key));
            }
            out.append('}');
        }

        void writeString(StringBuilder out, String s) {
            out.append('"');
            escapeTo(out, s, escapeHtml);
            out.append('"');
        }

        static void escapeTo(StringBuilder out, String s, boolean escapeHtml) {
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                switch (c) {
                    case '"' -> out.append("\\\"");
                    case '\\' -> out.append("\\\\");
                    case '\b' -> out.append("\\b");
                    case '\f' -> out.append("\\f");
                    case '\n' -> out.append("\\n");
                    case '\r' -> out.append("\\r");
                    case '\t' -> out.append("\\t");
                    // line and paragraph separators break JavaScript string literals
                    case '\u2028', '\u2029' -> appendUnicodeEscape(out, c);
                    case '<', '>', '&' -> {
                        if (escapeHtml) appendUnicodeEscape(out, c);
                        else out.append(c);
                    }
                    default -> {
                        if (c < 0x20) {
                            appendUnicodeEscape(out, c);
                        } else if (Character.isHighSurrogate(c)
                                && i + 1 < s.length()
                                && Character.isLowSurrogate(s.charAt(i + 1))) {
                            out.append(c).append(s.charAt(++i));
                        } else if (Character.isSurrogate(c)) {
                            // unpaired, has no UTF-8 form
                            appendUnicodeEscape(out, c);
                        } else {
                            out.append(c);
                        }
                    }
                }
            }
        }

        private static void appendUnicodeEscape(StringBuilder out, char c) {
            out.append("\\u");
            String hex = Integer.toHexString(c);
            for (int k = hex.length(); k < 4; k++) out.append('0');
            out.append(hex);
        }
    }

    // ============================================================
    // Parser
    // ============================================================

    /**
     * Three passes over the same text: a duplicate scan that validates syntax and member uniqueness, a flat
     * decode into unordered Java maps and lists, and a token walk that recovers member order and splices it
     * onto the flat tree.
     */
    @Builder(toBuilder = true)
    public static final class Parser {

        /**
         * Maximum nesting of objects and arrays.
         */
        @Builder.Default
        private final int maxDepth = DEFAULT_MAX_DEPTH;

        /**
         * Integral numbers with more digits than this, such as {@code 1e999999}, stay {@link BigDecimal} instead of
         * being expanded to a {@link java.math.BigInteger}.
         */
        @Builder.Default
        private final int maxIntegerDigits = DEFAULT_MAX_INTEGER_DIGITS;

        public OrderedMap unmarshal(String json) {
            var value = parse(json);
            if (value instanceof OrderedMap map) return map;
            throw new TypeMismatchException(
                    "Expected JSON object at top level, but got " + value.getClass().getSimpleName());
        }

        public JsonValue parse(String json) {
            checkDuplicates(json);
            return reconstruct(json, decodeFlat(json));
        }

        public void checkDuplicates(String json) {
            var lexer = new Lexer(json);
            scanValue(lexer, 0);
            if (lexer.current() != Token.EOF) error(lexer, "Trailing characters after top-level value");
        }

        // ------------------------------------------------------------
        // Duplicate scan
        // ------------------------------------------------------------

        private void scanValue(Lexer lexer, int depth) {
            switch (lexer.current()) {
                case LBRACE -> scanObject(lexer, depth + 1);
                case LBRACKET -> scanArray(lexer, depth + 1);
                case STRING, NUMBER, TRUE, FALSE, NULL -> lexer.advance();
                case RBRACE, RBRACKET, COMMA, COLON -> error(lexer, "Unexpected token: " + lexer.current());
                case EOF -> error(lexer, "Unexpected end of input while expecting a value");
            }
        }

        private void scanObject(Lexer lexer, int depth) {
            checkDepth(lexer, depth);
            expect(lexer, Token.LBRACE);
            if (accept(lexer, Token.RBRACE)) return;
            Set<String> seen = new HashSet<>();
            while (true) {
                if (lexer.current() != Token.STRING) error(lexer, "Expected string key in object");
                String key = lexer.string();
                if (!seen.add(key)) throw new DuplicateKeyException(key, lexer.tokenLine(), lexer.tokenCol());
                lexer.advance();
                expect(lexer, Token.COLON);
                scanValue(lexer, depth);
                if (accept(lexer, Token.COMMA)) continue;
                else if (accept(lexer, Token.RBRACE)) break;
                else error(lexer, "Expected ',' or '}' in object");
            }
        }

        private void scanArray(Lexer lexer, int depth) {
            checkDepth(lexer, depth);
            expect(lexer, Token.LBRACKET);
            if (accept(lexer, Token.RBRACKET)) return;
            while (true) {
                scanValue(lexer, depth);
                if (accept(lexer, Token.COMMA)) continue;
                else if (accept(lexer, Token.RBRACKET)) break;
                else error(lexer, "Expected ',' or ']' in array");
            }
        }

        // ------------------------------------------------------------
        // Flat decode: HashMap / ArrayList / String / Number / Boolean / null
        // ------------------------------------------------------------

        @Nullable
        Object decodeFlat(String json) {
            var lexer = new Lexer(json);
            Object v = flatValue(lexer, 0);
            if (lexer.current() != Token.EOF) error(lexer, "Trailing characters after top-level value");
            return v;
        }

        private @Nullable Object flatValue(Lexer lexer, int depth) {
            return switch (lexer.current()) {
                case LBRACE -> flatObject(lexer, depth + 1);
                case LBRACKET -> flatArray(lexer, depth + 1);
                case STRING -> {
                    String s = lexer.string();
                    lexer.advance();
                    yield s;
                }
                case NUMBER -> {
                    Number n = toNumber(lexer);
                    lexer.advance();
                    yield n;
                }
                case TRUE -> {
                    lexer.advance();
                    yield Boolean.TRUE;
                }
                case FALSE -> {
                    lexer.advance();
                    yield Boolean.FALSE;
                }
                case NULL -> {
                    lexer.advance();
                    yield null;
                }
                case RBRACE, RBRACKET, COMMA, COLON -> {
                    error(lexer, "Unexpected token: " + lexer.current());
                    yield null;
                }
                case EOF -> {
                    error(lexer, "Unexpected end of input while expecting a value");
                    yield null;
                }
            };
        }

        private Map<String, @Nullable Object> flatObject(Lexer lexer, int depth) {
            checkDepth(lexer, depth);
            expect(lexer, Token.LBRACE);
            Map<String, @Nullable Object> m = new HashMap<>();
            if (accept(lexer, Token.RBRACE)) return m;
            while (true) {
                if (lexer.current() != Token.STRING) error(lexer, "Expected string key in object");
                String key = lexer.string();
                lexer.advance();
                expect(lexer, Token.COLON);
                m.put(key, flatValue(lexer, depth));
                if (accept(lexer, Token.COMMA)) continue;
                else if (accept(lexer, Token.RBRACE)) break;
                else error(lexer, "Expected ',' or '}' in object");
            }
            return m;
        }

        private List<@Nullable Object> flatArray(Lexer lexer, int depth) {
            checkDepth(lexer, depth);
            expect(lexer, Token.LBRACKET);
            List<@Nullable Object> list = new ArrayList<>();
            if (accept(lexer, Token.RBRACKET)) return list;
            while (true) {
                list.add(flatValue(lexer, depth));
                if (accept(lexer, Token.COMMA)) continue;
                else if (accept(lexer, Token.RBRACKET)) break;
                else error(lexer, "Expected ',' or ']' in array");
            }
            return list;
        }

        // ------------------------------------------------------------
        // Order reconstruction
        // ------------------------------------------------------------

        /**
         * Walk the tokens of {@code json} once more and rebuild {@code flat} as a {@link JsonValue}, giving every
         * object the member order of the document. Scalars are taken from {@code flat}; the tokens only decide
         * structure and order.
         *
         * <p> Does not look for duplicates. A repeated member moves to the end of the key order and keeps the
         * flat tree's value, so no key ever appears twice in {@link OrderedMap#keys()}.
         */
        JsonValue reconstruct(String json, @Nullable Object flat) {
            var lexer = new Lexer(json);
            return reconstructValue(lexer, flat, 0);
        }

        private JsonValue reconstructValue(Lexer lexer, @Nullable Object flat, int depth) {
            Token token = lexer.current();
            return switch (token) {
                case LBRACE -> reconstructObject(lexer, expectObject(flat, lexer), depth + 1);
                case LBRACKET -> reconstructArray(lexer, expectArray(flat, lexer), depth + 1);
                case STRING, NUMBER, TRUE, FALSE, NULL -> {
                    JsonValue scalar = toScalar(token, flat, lexer);
                    lexer.advance();
                    yield scalar;
                }
                case RBRACE, RBRACKET, COMMA, COLON, EOF -> {
                    error(lexer, "Unexpected token: " + token);
                    yield null;
                }
            };
        }

        private OrderedMap reconstructObject(Lexer lexer, Map<?, ?> flat, int depth) {
            checkDepth(lexer, depth);
            expect(lexer, Token.LBRACE);
            var target = new OrderedMap(flat.size());
            if (accept(lexer, Token.RBRACE)) return target;
            while (true) {
                if (lexer.current() != Token.STRING) error(lexer, "Expected string key in object");
                String key = lexer.string();
                if (!flat.containsKey(key)) {
                    throw new TypeMismatchException(
                            "Member \"" + key + "\" at line " + lexer.tokenLine() + ", column " + lexer.tokenCol()
                                    + " is missing from the decoded object");
                }
                lexer.advance();
                expect(lexer, Token.COLON);
                target.putLast(key, reconstructValue(lexer, flat.get(key), depth));
                if (accept(lexer, Token.COMMA)) continue;
                else if (accept(lexer, Token.RBRACE)) break;
                else error(lexer, "Expected ',' or '}' in object");
            }
            return target;
        }

        private JsonArray reconstructArray(Lexer lexer, List<?> flat, int depth) {
            checkDepth(lexer, depth);
            expect(lexer, Token.LBRACKET);
            List<JsonValue> elements = new ArrayList<>(flat.size());
            if (accept(lexer, Token.RBRACKET)) return new JsonArray(elements);
            while (true) {
                if (elements.size() >= flat.size()) {
                    throw new TypeMismatchException("Array at line " + lexer.tokenLine() + ", column "
                            + lexer.tokenCol() + " has more elements than the decoded array (" + flat.size() + ")");
                }
                elements.add(reconstructValue(lexer, flat.get(elements.size()), depth));
                if (accept(lexer, Token.COMMA)) continue;
                else if (accept(lexer, Token.RBRACKET)) break;
                else error(lexer, "Expected ',' or ']' in array");
            }
            return new JsonArray(elements);
        }

        private static JsonValue toScalar(Token token, @Nullable Object flat, Lexer lexer) {
            boolean matches = switch (token) {
                case STRING -> flat instanceof String;
                case NUMBER -> flat instanceof Number;
                case TRUE, FALSE -> flat instanceof Boolean;
                case NULL -> flat == null;
                default -> false;
            };
            if (!matches) throw mismatch(token.name(), flat, lexer);
            return JsonValue.of(flat);
        }

        private static Map<?, ?> expectObject(@Nullable Object flat, Lexer lexer) {
            if (flat instanceof Map<?, ?> m) return m;
            throw mismatch("object", flat, lexer);
        }

        private static List<?> expectArray(@Nullable Object flat, Lexer lexer) {
            if (flat instanceof List<?> l) return l;
            throw mismatch("array", flat, lexer);
        }

        private static TypeMismatchException mismatch(String expected, @Nullable Object flat, Lexer lexer) {
            return new TypeMismatchException("Expected " + expected + " at line " + lexer.tokenLine() + ", column "
                    + lexer.tokenCol() + ", but the decoded value is "
                    + (flat == null ? "null" : flat.getClass().getSimpleName()));
        }

        // ------------------------------------------------------------
        // Shared helpers
        // ------------------------------------------------------------

        private void checkDepth(Lexer lexer, int depth) {
            if (depth > maxDepth) error(lexer, "Maximum nesting depth of " + maxDepth + " exceeded");
        }

        static void expect(Lexer lexer, Token t) {
            if (lexer.current() != t) error(lexer, "Expected " + t + " but found " + lexer.current());
            lexer.advance();
        }

        static boolean accept(Lexer lexer, Token t) {
            if (lexer.current() == t) {
                lexer.advance();
                return true;
            }
            return false;
        }

        static void error(Lexer lexer, String msg) {
            throw new SyntaxException(msg + " (token: " + lexer.current() + ")", lexer.line(), lexer.col());
        }

        private Number toNumber(Lexer lexer) {
            String s = lexer.number();
            try {
                return parseNumber(s, maxIntegerDigits);
            } catch (NumberFormatException | ArithmeticException e) {
                error(lexer, "Number out of range: " + s);
                return null;
            }
        }

        /**
         * Integers become {@code Integer}, {@code Long} or {@code BigInteger}, whichever is smallest; fractions become
         * {@code Double} when that is exact, otherwise {@code BigDecimal}. Negative zero is kept as {@code -0.0}.
         *
         * @throws NumberFormatException if the exponent does not fit an {@code int}
         */
        static Number parseNumber(String s, int maxIntegerDigits) {
            BigDecimal b = new BigDecimal(s), n = b.stripTrailingZeros();
            if (n.signum() == 0) {
                if (s.charAt(0) == '-') return -0.0;
                return 0;
            }
            if (n.scale() > 0) {
                double d = b.doubleValue();
                return Double.isFinite(d) && b.compareTo(BigDecimal.valueOf(d)) == 0 ? d : b;
            }
            if ((long) n.precision() - n.scale() > maxIntegerDigits) return b;
            try {
                long l = n.longValueExact();
                if ((int) l == l) return (int) l; // Do NOT use Ternary Operator here!
                return l;
            } catch (ArithmeticException e) {
                return n.toBigIntegerExact();
            }
        }
    }

    // ============================================================
    // Exceptions
    // ============================================================

    /**
     * Base exception for all ordered-json errors.
     */
    public abstract static class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }

        public Exception(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Exception thrown when JSON parsing fails due to malformed JSON syntax.
     */
    public static class SyntaxException extends Exception {
        private final int line;
        private final int column;

        public SyntaxException(String message, int line, int column) {
            super(message + " at line " + line + ", column " + column);
            this.line = line;
            this.column = column;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }

    /**
     * Exception thrown when a JSON object repeats a member name, at any nesting depth.
     *
     * <p> The position is that of the second occurrence.
     */
    public static class DuplicateKeyException extends Exception {
        private final String key;
        private final int line;
        private final int column;

        public DuplicateKeyException(String key, int line, int column) {
            super("Duplicate key \"" + key + "\" at line " + line + ", column " + column);
            this.key = key;
            this.line = line;
            this.column = column;
        }

        public String getKey() {
            return key;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }
    }

    /**
     * Exception thrown when a value does not have the JSON type the operation requires.
     */
    public static class TypeMismatchException extends Exception {
        public TypeMismatchException(String message) {
            super(message);
        }
    }

    /**
     * Exception thrown when a Java value cannot be represented as a {@link JsonValue}.
     */
    public static class ConversionException extends Exception {
        public ConversionException(String message) {
            super(message);
        }

        public ConversionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
