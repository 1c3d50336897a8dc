package asdl.java21;

import java.util.Objects;

/// A lexical token of schema source text.
record AsdlToken(Kind kind, String text, SourcePosition position) {

    AsdlToken {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }

    boolean is(Kind expected) {
        return kind == expected;
    }

    /// Token kinds
    enum Kind {
        NAME("name"),
        MODULE("'module'"),
        ATTRIBUTES("'attributes'"),
        LPAREN("'('"),
        RPAREN("')'"),
        LBRACE("'{'"),
        RBRACE("'}'"),
        PIPE("'|'"),
        STAR("'*'"),
        QUESTION("'?'"),
        COMMA("','"),
        EQUALS("'='"),
        EOF("end of input");

        private final String display;

        Kind(String display) {
            this.display = display;
        }

        /// How the kind is named in error messages.
        String display() {
            return display;
        }
    }

    @Override
    public String toString() {
        return kind == Kind.NAME ? "name '" + text + "'" : kind.display();
    }
}
