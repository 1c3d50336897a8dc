package asdl.java21;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsdlParserTest extends AsdlTestBase {

    @Test
    void parsesSumAndProductDeclarations() {
        LOG.info(() -> "TEST: parsesSumAndProductDeclarations");
        final var modules = Asdl.parse(ARITH);
        assertThat(modules).hasSize(1);
        final var module = modules.get(0);
        assertThat(module.name()).isEqualTo("arith");
        assertThat(module.types()).extracting(AsdlAst.TypeDecl::name).containsExactly("arith_expr", "binding");

        final var sum = (AsdlAst.SumDecl) module.types().get(0);
        assertThat(sum.constructors()).extracting(AsdlAst.ConstructorDecl::name)
            .containsExactly("ArithUnary", "ArithBinary", "Const", "Var", "FuncCall");
        final var call = sum.constructors().get(4);
        assertThat(call.fields()).extracting(AsdlAst.FieldDecl::toString)
            .containsExactly("string name", "arith_expr* args", "string? comment");

        final var product = (AsdlAst.ProductDecl) module.types().get(1);
        assertThat(product.fields()).extracting(AsdlAst.FieldDecl::multiplicity)
            .containsExactly(Multiplicity.SINGLE, Multiplicity.SINGLE);
    }

    @Test
    void parsesAttributesAndEmptyParentheses() {
        LOG.info(() -> "TEST: parsesAttributesAndEmptyParentheses");
        final var modules = Asdl.parse("""
            module py {
              stmt = Pass() | Expr(int value) attributes (int lineno, int col_offset)
              unit = ()
            }
            """);
        final var stmt = (AsdlAst.SumDecl) modules.get(0).types().get(0);
        assertThat(stmt.constructors().get(0).fields()).isEmpty();
        assertThat(stmt.attributes()).extracting(AsdlAst.FieldDecl::name).containsExactly("lineno", "col_offset");
        assertThat(((AsdlAst.ProductDecl) modules.get(0).types().get(1)).fields()).isEmpty();
    }

    @Test
    void parsesSeveralModules() {
        LOG.info(() -> "TEST: parsesSeveralModules");
        final var modules = Asdl.parse(CONTROL + BOOLS);
        assertThat(modules).extracting(AsdlAst.Module::name).containsExactly("control", "bools");
    }

    @Test
    void emptyModuleIsAllowed() {
        LOG.info(() -> "TEST: emptyModuleIsAllowed");
        assertThat(Asdl.parse("module empty {}").get(0).types()).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", quoteCharacter = '"', value = {
        "module m { t = A | A }                 => duplicate constructor 'A' in sum type 't'",
        "module m { t = (int x, bool x) }       => duplicate field 'x' in product type 't'",
        "module m { t = A(int x, int x) }       => duplicate field 'x' in constructor 'A'",
        "module m { t = A(int n) attributes (int n) } => duplicate field 'n' in constructor 'A'",
        "module m { t = A  t = B }              => duplicate type 't' in module 'm'",
        "module m { } module m { }              => duplicate module 'm'",
        "module m { int = A }                   => type name 'int' is reserved for a primitive",
        "module m { t = A(int) }                => expected field name after type 'int'",
        "module m { t = A(int x,) }             => expected name but found ')'",
        "module m { t A }                       => expected '=' but found name 'A'",
        "module m { t = A                       => unterminated module 'm': expected '}'",
        "m { }                                  => expected 'module' but found name 'm'",
        "\"\"                                   => expected 'module' but found end of input",
    })
    void rejectsMalformedSchemas(String source, String expected) {
        LOG.info(() -> "TEST: rejectsMalformedSchemas " + source);
        assertThatThrownBy(() -> Asdl.parse(source))
            .isInstanceOf(AsdlParseException.class)
            .satisfies(e -> assertThat(((AsdlParseException) e).description()).startsWith(expected));
    }

    @Test
    void parseErrorsCarryTheSourceName() {
        LOG.info(() -> "TEST: parseErrorsCarryTheSourceName");
        assertThatThrownBy(() -> AsdlParser.parse("module m {\n  t = A | A\n}", "dup.asdl"))
            .isInstanceOf(AsdlParseException.class)
            .hasMessage("duplicate constructor 'A' in sum type 't' at dup.asdl:2:11")
            .satisfies(e -> assertThat(((AsdlParseException) e).sourceName()).isEqualTo("dup.asdl"));
    }

    @Test
    void keywordsMayNameFields() {
        LOG.info(() -> "TEST: keywordsMayNameFields");
        final var model = Asdl.load("""
            module m {
              t = Expr(int attributes, string? module) attributes (int lineno)
            }
            """);
        final var expr = model.construct("t", "Expr", List.of(1, "m", 7));
        assertThat(expr.getInt("attributes")).isEqualTo(1L);
        assertThat(expr.toString()).isEqualTo("Expr(attributes=1, module=\"m\", lineno=7)");
    }
}
