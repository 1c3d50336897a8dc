package asdl.java21;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Splits schema source text into [AsdlToken]s.
///
/// Comments start with `#` or `--` and run to the end of the line; they are
/// dropped together with whitespace. The returned list always ends with an
/// [AsdlToken.Kind#EOF] token.
final class AsdlLexer {

    private static final Logger LOG = Logger.getLogger(AsdlLexer.class.getName());

    private final String source;
    private final String sourceName;
    private int pos;
    private int line = 1;
    private int lineStart;

    private AsdlLexer(String source, String sourceName) {
        this.source = source;
        this.sourceName = sourceName;
    }

    /// Tokenizes the whole source.
    /// @throws AsdlLexException on a character that cannot start a token
    static List<AsdlToken> tokenize(String source, String sourceName) {
        Objects.requireNonNull(source, "source must not be null");
        final var tokens = new AsdlLexer(source, sourceName).run();
        LOG.finer(() -> "Lexed " + tokens.size() + " tokens from " + (sourceName == null ? "<string>" : sourceName));
        return tokens;
    }

    private List<AsdlToken> run() {
        final var tokens = new ArrayList<AsdlToken>();
        while (true) {
            skipTrivia();
            if (pos >= source.length()) {
                tokens.add(new AsdlToken(AsdlToken.Kind.EOF, "", here()));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipTrivia() {
        while (pos < source.length()) {
            final char c = source.charAt(pos);
            if (c == '\n') {
                pos++;
                line++;
                lineStart = pos;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#' || (c == '-' && peek(1) == '-')) {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private AsdlToken next() {
        final var start = here();
        final char c = source.charAt(pos);

        if (isNameStart(c)) {
            final int begin = pos;
            while (pos < source.length() && isNamePart(source.charAt(pos))) {
                pos++;
            }
            final var text = source.substring(begin, pos);
            final var kind = switch (text) {
                case "module" -> AsdlToken.Kind.MODULE;
                case "attributes" -> AsdlToken.Kind.ATTRIBUTES;
                default -> AsdlToken.Kind.NAME;
            };
            return new AsdlToken(kind, text, start);
        }

        final AsdlToken.Kind kind = switch (c) {
            case '(' -> AsdlToken.Kind.LPAREN;
            case ')' -> AsdlToken.Kind.RPAREN;
            case '{' -> AsdlToken.Kind.LBRACE;
            case '}' -> AsdlToken.Kind.RBRACE;
            case '|' -> AsdlToken.Kind.PIPE;
            case '*' -> AsdlToken.Kind.STAR;
            case '?' -> AsdlToken.Kind.QUESTION;
            case ',' -> AsdlToken.Kind.COMMA;
            case '=' -> AsdlToken.Kind.EQUALS;
            default -> null;
        };
        if (kind == null) {
            if (c == '-') {
                throw new AsdlLexException("unterminated comment: expected '--'", sourceName, start);
            }
            throw new AsdlLexException("invalid character '" + printable(c) + "'", sourceName, start);
        }
        pos++;
        return new AsdlToken(kind, String.valueOf(c), start);
    }

    private char peek(int ahead) {
        final int at = pos + ahead;
        return at < source.length() ? source.charAt(at) : '\0';
    }

    private SourcePosition here() {
        return new SourcePosition(pos, line, pos - lineStart + 1);
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }

    private static String printable(char c) {
        return Character.isISOControl(c) ? String.format("\\u%04x", (int) c) : String.valueOf(c);
    }
}
