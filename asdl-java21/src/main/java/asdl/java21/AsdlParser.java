package asdl.java21;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Recursive descent parser from [AsdlToken]s to [AsdlAst] modules.
///
/// Grammar:
/// ```
/// source    := module+ EOF
/// module    := 'module' NAME '{' typedecl* '}'
/// typedecl  := NAME '=' ( fields | ctor ('|' ctor)* ['attributes' fields] )
/// ctor      := NAME [fields]
/// fields    := '(' [field (',' field)*] ')'
/// field     := NAME ['*' | '?'] NAME
/// ```
/// A parenthesised field list straight after `=` declares a product type.
/// Duplicate names are reported as soon as the declaration that repeats them is read.
final class AsdlParser {

    private static final Logger LOG = Logger.getLogger(AsdlParser.class.getName());

    private final List<AsdlToken> tokens;
    private final String sourceName;
    private int pos;

    private AsdlParser(List<AsdlToken> tokens, String sourceName) {
        this.tokens = tokens;
        this.sourceName = sourceName;
    }

    /// Parses every module in the source text.
    /// @throws AsdlLexException if the text cannot be tokenized
    /// @throws AsdlParseException if the tokens do not follow the grammar
    static List<AsdlAst.Module> parse(String source, String sourceName) {
        Objects.requireNonNull(source, "source must not be null");
        final var tokens = AsdlLexer.tokenize(source, sourceName);
        return new AsdlParser(tokens, sourceName).parseSource();
    }

    private List<AsdlAst.Module> parseSource() {
        final var modules = new ArrayList<AsdlAst.Module>();
        final var seen = new HashMap<String, SourcePosition>();
        do {
            final var module = parseModule();
            if (seen.putIfAbsent(module.name(), module.position()) != null) {
                throw error("duplicate module '" + module.name() + "'", module.position());
            }
            modules.add(module);
            LOG.fine(() -> "Parsed module " + module.name() + " with " + module.types().size() + " types");
        } while (!current().is(AsdlToken.Kind.EOF));
        return modules;
    }

    private AsdlAst.Module parseModule() {
        final var start = expect(AsdlToken.Kind.MODULE);
        final var name = expect(AsdlToken.Kind.NAME).text();
        expect(AsdlToken.Kind.LBRACE);

        final var types = new ArrayList<AsdlAst.TypeDecl>();
        final var seen = new HashMap<String, SourcePosition>();
        while (!current().is(AsdlToken.Kind.RBRACE)) {
            if (current().is(AsdlToken.Kind.EOF)) {
                throw error("unterminated module '" + name + "': expected '}'", current().position());
            }
            final var decl = parseTypeDecl();
            if (seen.putIfAbsent(decl.name(), decl.position()) != null) {
                throw error("duplicate type '" + decl.name() + "' in module '" + name + "'", decl.position());
            }
            types.add(decl);
        }
        expect(AsdlToken.Kind.RBRACE);
        return new AsdlAst.Module(name, types, start.position());
    }

    private AsdlAst.TypeDecl parseTypeDecl() {
        final var nameToken = expect(AsdlToken.Kind.NAME);
        final var name = nameToken.text();
        if (TypeRef.Primitive.isPrimitiveName(name)) {
            throw error("type name '" + name + "' is reserved for a primitive", nameToken.position());
        }
        expect(AsdlToken.Kind.EQUALS);

        if (current().is(AsdlToken.Kind.LPAREN)) {
            final var fields = parseFields("product type '" + name + "'");
            LOG.finer(() -> "Parsed product " + name);
            return new AsdlAst.ProductDecl(name, fields, nameToken.position());
        }

        final var constructors = new ArrayList<AsdlAst.ConstructorDecl>();
        final var seen = new HashMap<String, SourcePosition>();
        do {
            final var ctor = parseConstructor();
            if (seen.putIfAbsent(ctor.name(), ctor.position()) != null) {
                throw error("duplicate constructor '" + ctor.name() + "' in sum type '" + name + "'", ctor.position());
            }
            constructors.add(ctor);
        } while (accept(AsdlToken.Kind.PIPE));

        List<AsdlAst.FieldDecl> attributes = List.of();
        if (accept(AsdlToken.Kind.ATTRIBUTES)) {
            attributes = parseFields("attributes of '" + name + "'");
            for (final var ctor : constructors) {
                checkDistinct(ctor.fields(), attributes, "constructor '" + ctor.name() + "'");
            }
        }
        LOG.finer(() -> "Parsed sum " + name + " with " + constructors.size() + " constructors");
        return new AsdlAst.SumDecl(name, constructors, attributes, nameToken.position());
    }

    private AsdlAst.ConstructorDecl parseConstructor() {
        final var nameToken = expect(AsdlToken.Kind.NAME);
        final List<AsdlAst.FieldDecl> fields = current().is(AsdlToken.Kind.LPAREN)
            ? parseFields("constructor '" + nameToken.text() + "'")
            : List.of();
        return new AsdlAst.ConstructorDecl(nameToken.text(), fields, nameToken.position());
    }

    private List<AsdlAst.FieldDecl> parseFields(String owner) {
        expect(AsdlToken.Kind.LPAREN);
        final var fields = new ArrayList<AsdlAst.FieldDecl>();
        if (!current().is(AsdlToken.Kind.RPAREN)) {
            do {
                fields.add(parseField());
            } while (accept(AsdlToken.Kind.COMMA));
        }
        expect(AsdlToken.Kind.RPAREN);
        checkDistinct(List.of(), fields, owner);
        return fields;
    }

    private AsdlAst.FieldDecl parseField() {
        final var typeToken = expect(AsdlToken.Kind.NAME);
        Multiplicity multiplicity = Multiplicity.SINGLE;
        if (accept(AsdlToken.Kind.STAR)) {
            multiplicity = Multiplicity.REPEATED;
        } else if (accept(AsdlToken.Kind.QUESTION)) {
            multiplicity = Multiplicity.OPTIONAL;
        }
        final var nameToken = current();
        // `module` and `attributes` may name fields
        if (!isFieldName(nameToken)) {
            throw error("expected field name after type '" + typeToken.text() + multiplicity.symbol()
                + "' but found " + nameToken, nameToken.position());
        }
        pos++;
        return new AsdlAst.FieldDecl(typeToken.text(), multiplicity, nameToken.text(), typeToken.position());
    }

    private static boolean isFieldName(AsdlToken token) {
        return token.is(AsdlToken.Kind.NAME) || token.is(AsdlToken.Kind.MODULE) || token.is(AsdlToken.Kind.ATTRIBUTES);
    }

    /// Fails on the first field of `added` whose name is already taken in `existing` or earlier in `added`.
    private void checkDistinct(List<AsdlAst.FieldDecl> existing, List<AsdlAst.FieldDecl> added, String owner) {
        final Map<String, AsdlAst.FieldDecl> names = new HashMap<>();
        for (final var field : existing) {
            names.put(field.name(), field);
        }
        for (final var field : added) {
            if (names.putIfAbsent(field.name(), field) != null) {
                throw error("duplicate field '" + field.name() + "' in " + owner, field.position());
            }
        }
    }

    private AsdlToken current() {
        return tokens.get(pos);
    }

    private boolean accept(AsdlToken.Kind kind) {
        if (current().is(kind)) {
            pos++;
            return true;
        }
        return false;
    }

    private AsdlToken expect(AsdlToken.Kind kind) {
        final var token = current();
        if (!token.is(kind)) {
            throw error("expected " + kind.display() + " but found " + token, token.position());
        }
        pos++;
        return token;
    }

    private AsdlParseException error(String message, SourcePosition position) {
        return new AsdlParseException(message, sourceName, position);
    }
}
