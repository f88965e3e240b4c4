package dumb.lambda;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;

/**
 * Reads the textual syntax:
 * <pre>
 *   application := atom+                          left-associative
 *   atom        := identifier | numeral | "(" application ")" | lambda
 *   lambda      := ("\" | "λ") identifier+ "." application
 * </pre>
 * An abstraction body extends as far right as possible. Numerals become Church numerals.
 * {@code #} starts a comment running to the end of the line.
 */
public class LambdaParser {
    public static final int MAX_NUMERAL = 1000;
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;

    private LambdaParser(Reader reader) {
        this.reader = reader;
    }

    public static Term parse(String text) throws ParseException {
        try (var reader = new StringReader(text)) {
            var parser = new LambdaParser(reader);
            parser.skipWhitespaceAndComments();
            if (parser.peek() == -1) throw parser.createParseException("Empty input");
            var term = parser.parseApplication();
            parser.skipWhitespaceAndComments();
            var c = parser.peek();
            if (c != -1) throw parser.createParseException("Unexpected input after term", "'" + (char) c + "'");
            return term;
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    static boolean isIdentifierStart(int c) {
        return c != 'λ' && Character.isLetter(c);
    }

    static boolean isIdentifierPart(int c) {
        return c != 'λ' && (Character.isLetterOrDigit(c) || c == '_' || c == '\'');
    }

    private static boolean isLambda(int c) {
        return c == '\\' || c == 'λ';
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) {
                contextBuffer.deleteCharAt(0);
            }
            if (currentChar != -1) {
                contextBuffer.append((char) currentChar);
            }
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void consumeChar(char expected) throws IOException, ParseException {
        var actual = consumeChar();
        if (actual != expected) {
            throw createParseException("Expected '" + expected + "'", ((actual == -1) ? "end of input" : "'" + (char) actual + "'"));
        }
    }

    private void skipWhitespaceAndComments() throws IOException {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (Character.isWhitespace(c)) {
                consumeChar();
            } else if (c == '#') {
                consumeChar();
                while (peek() != '\n' && peek() != -1) {
                    consumeChar();
                }
            } else {
                return;
            }
        }
    }

    private Term parseApplication() throws IOException, ParseException {
        var term = parseAtom();
        skipWhitespaceAndComments();
        while (peek() != -1 && peek() != ')') {
            term = new Term.App(term, parseAtom());
            skipWhitespaceAndComments();
        }
        return term;
    }

    private Term parseAtom() throws IOException, ParseException {
        skipWhitespaceAndComments();
        var c = peek();
        if (c == -1) throw createParseException("Unexpected end of input while parsing term");
        if (c == '(') return parseGroup();
        if (isLambda(c)) return parseLambda();
        if (Character.isDigit(c)) return parseNumeral();
        if (isIdentifierStart(c)) return Term.Var.of(parseIdentifier());
        throw createParseException("Unexpected character", "'" + (char) c + "'");
    }

    private Term parseGroup() throws IOException, ParseException {
        consumeChar('(');
        skipWhitespaceAndComments();
        if (peek() == ')') throw createParseException("Empty parentheses");
        var term = parseApplication();
        consumeChar(')');
        return term;
    }

    private Term parseLambda() throws IOException, ParseException {
        consumeChar();
        var params = new ArrayList<String>();
        skipWhitespaceAndComments();
        while (peek() != '.') {
            if (peek() == -1) throw createParseException("Unexpected end of input in abstraction, expected '.'");
            if (!isIdentifierStart(peek()))
                throw createParseException("Expected parameter name", "'" + (char) peek() + "'");
            params.add(parseIdentifier());
            skipWhitespaceAndComments();
        }
        if (params.isEmpty()) throw createParseException("Abstraction without parameter");
        consumeChar('.');
        skipWhitespaceAndComments();
        if (peek() == -1 || peek() == ')') throw createParseException("Abstraction without body");
        return Term.lam(parseApplication(), params.toArray(new String[0]));
    }

    private String parseIdentifier() throws IOException {
        var sb = new StringBuilder();
        sb.append((char) consumeChar());
        while (peek() != -1 && isIdentifierPart(peek())) {
            sb.append((char) consumeChar());
        }
        return sb.toString();
    }

    private Term parseNumeral() throws IOException, ParseException {
        var sb = new StringBuilder();
        while (peek() != -1 && Character.isDigit(peek())) {
            sb.append((char) consumeChar());
        }
        if (peek() != -1 && isIdentifierPart(peek()))
            throw createParseException("Identifiers must start with a letter", "'" + sb + (char) peek() + "'");
        int n;
        try {
            n = Integer.parseInt(sb.toString());
        } catch (NumberFormatException e) {
            n = Integer.MAX_VALUE;
        }
        if (n > MAX_NUMERAL) throw createParseException("Numeral too large (max " + MAX_NUMERAL + ")", sb.toString());
        return Numerals.church(n);
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ParseException(message + foundInfo, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, -1, -1, "");
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
