package asdl.java21;

import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AsdlResolverTest extends AsdlTestBase {

    @Test
    void assignsTagsAndFieldIndicesInDeclarationOrder() {
        LOG.info(() -> "TEST: assignsTagsAndFieldIndicesInDeclarationOrder");
        final var model = Asdl.load(ARITH);
        final var expr = (SumType) model.type("arith_expr");
        assertThat(expr.constructors()).extracting(Constructor::tag).containsExactly(0, 1, 2, 3, 4);
        final var call = expr.constructor("FuncCall").orElseThrow();
        assertThat(call.fields()).extracting(Field::index).containsExactly(0, 1, 2);
        assertThat(call.fields()).extracting(Field::multiplicity)
            .containsExactly(Multiplicity.SINGLE, Multiplicity.REPEATED, Multiplicity.OPTIONAL);
        assertThat(call.fields().get(1).type()).isEqualTo(model.typeRef("arith_expr"));
    }

    @Test
    void resolvesPrimitivesAndIdentifierAlias() {
        LOG.info(() -> "TEST: resolvesPrimitivesAndIdentifierAlias");
        final var model = Asdl.load(ARITH);
        final var binding = (ProductType) model.type("binding");
        assertThat(binding.fields().get(0).type()).isEqualTo(TypeRef.Primitive.STRING);
        final var value = (TypeRef.Named) binding.fields().get(1).type();
        assertThat(value.target()).isSameAs(model.type("arith_expr"));
        assertThat(value.qualifiedName()).isEqualTo("arith.arith_expr");
    }

    @Test
    void forwardReferencesResolve() {
        LOG.info(() -> "TEST: forwardReferencesResolve");
        final var model = Asdl.load("""
            module m {
              a = (b inner)
              b = (int n)
            }
            """);
        final var inner = (TypeRef.Named) ((ProductType) model.type("a")).fields().get(0).type();
        assertThat(inner.target()).isSameAs(model.type("b"));
    }

    @Test
    void loadingIsDeterministic() {
        LOG.info(() -> "TEST: loadingIsDeterministic");
        final var first = Asdl.load(ARITH + BOOLS);
        final var second = Asdl.load(ARITH + BOOLS);
        assertThat(second.types()).isEqualTo(first.types());
        assertThat(second.types()).extracting(AsdlType::qualifiedName)
            .containsExactly("arith.arith_expr", "arith.binding", "bools.bool_expr");
    }

    @Test
    void attributesAreAppendedToEveryConstructor() {
        LOG.info(() -> "TEST: attributesAreAppendedToEveryConstructor");
        final var model = Asdl.load("""
            module py {
              stmt = Pass | Expr(int value) attributes (int lineno, int? end_lineno)
            }
            """);
        final var stmt = (SumType) model.type("stmt");
        assertThat(stmt.attributes()).extracting(Field::name).containsExactly("lineno", "end_lineno");
        assertThat(stmt.constructor("Pass").orElseThrow().fields()).extracting(Field::name)
            .containsExactly("lineno", "end_lineno");
        assertThat(stmt.constructor("Expr").orElseThrow().fields()).extracting(Field::toString)
            .containsExactly("int value", "int lineno", "int? end_lineno");
        assertThat(stmt.constructor("Expr").orElseThrow().fields()).extracting(Field::index)
            .containsExactly(0, 1, 2);
        assertThat(stmt.isSimple()).isFalse();
    }

    @Test
    void selfReferenceThroughSingleFieldIsACycle() {
        LOG.info(() -> "TEST: selfReferenceThroughSingleFieldIsACycle");
        assertThatThrownBy(() -> Asdl.load("t.asdl", "module m {\n  t = (t self)\n}"))
            .isInstanceOf(AsdlCycleException.class)
            .hasMessage("illegal recursion without optional or repeated field: t -> t at t.asdl:2:3")
            .satisfies(e -> assertThat(((AsdlCycleException) e).cycle()).containsExactly("t", "t"));
    }

    @Test
    void mutualRecursionThroughSingleFieldsIsACycle() {
        LOG.info(() -> "TEST: mutualRecursionThroughSingleFieldsIsACycle");
        assertThatThrownBy(() -> Asdl.load("""
            module m {
              a = (b next)
              b = Only(a back)
            }
            """))
            .isInstanceOf(AsdlCycleException.class)
            .satisfies(e -> assertThat(((AsdlCycleException) e).cycle()).containsExactly("a", "b", "a"));
    }

    @Test
    void repeatedOrOptionalSelfReferenceIsAllowed() {
        LOG.info(() -> "TEST: repeatedOrOptionalSelfReferenceIsAllowed");
        final var model = Asdl.load("""
            module m {
              t = (t* selves)
              chain = (int value, chain? next)
            }
            """);
        assertThat(model.types()).hasSize(2);
        final var leaf = model.construct("t", List.of(List.of()));
        assertThat(model.construct("t", List.of(List.of(leaf, leaf))).toString()).isEqualTo("([([]), ([])])");
    }

    @Test
    void recursiveSumWithABaseCaseIsAllowed() {
        LOG.info(() -> "TEST: recursiveSumWithABaseCaseIsAllowed");
        assertThat(Asdl.load(BOOLS).type("bool_expr")).isInstanceOf(SumType.class);
    }

    @Test
    void sumWhoseEveryConstructorRecursesIsACycle() {
        LOG.info(() -> "TEST: sumWhoseEveryConstructorRecursesIsACycle");
        assertThatThrownBy(() -> Asdl.load("module m { e = Neg(e inner) | Add(e l, e r) }"))
            .isInstanceOf(AsdlCycleException.class)
            .satisfies(e -> assertThat(((AsdlCycleException) e).cycle()).containsExactly("e", "e"));
    }

    @Test
    void unknownFieldTypeIsReported() {
        LOG.info(() -> "TEST: unknownFieldTypeIsReported");
        assertThatThrownBy(() -> Asdl.load("u.asdl", "module m {\n  t = (expr body)\n}"))
            .isInstanceOf(AsdlResolutionException.class)
            .hasMessage("unknown type 'expr' for field 'body' at u.asdl:2:8");
    }

    @Test
    void laterModulesSeeEarlierOnes() {
        LOG.info(() -> "TEST: laterModulesSeeEarlierOnes");
        final var model = Asdl.load(CONTROL + """
            module program {
              block = (cflow* steps)
            }
            """);
        final var steps = ((ProductType) model.type("block")).fields().get(0);
        assertThat(((TypeRef.Named) steps.type()).qualifiedName()).isEqualTo("control.cflow");
    }

    @Test
    void earlierModulesDoNotSeeLaterOnes() {
        LOG.info(() -> "TEST: earlierModulesDoNotSeeLaterOnes");
        assertThatThrownBy(() -> Asdl.load("module a { t = (u x) } module b { u = (int n) }"))
            .isInstanceOf(AsdlResolutionException.class)
            .hasMessageContaining("unknown type 'u'");
    }

    @Test
    void importedModelsProvideTypes() {
        LOG.info(() -> "TEST: importedModelsProvideTypes");
        final var base = Asdl.load(CONTROL);
        final var model = Asdl.load("loop.asdl", "module loop { body = (cflow last, int count) }", base);

        assertThat(model.modules()).extracting(AsdlModule::name).containsExactly("loop");
        assertThat(model.imports()).containsExactly(base);
        assertThat(model.module("control")).isPresent();
        assertThat(model.lookup("control.cflow")).containsSame(base.type("cflow"));

        final var ret = base.construct("cflow", "Return", List.of(1));
        final var body = model.construct("body", List.of(ret, 3));
        assertThat(body.toString()).isEqualTo("(Return(status=1), 3)");
    }

    @Test
    void reloadingAnImportedModuleIsRejected() {
        LOG.info(() -> "TEST: reloadingAnImportedModuleIsRejected");
        final var base = Asdl.load(CONTROL);
        assertThatThrownBy(() -> Asdl.load("again.asdl", CONTROL, base))
            .isInstanceOf(AsdlResolutionException.class)
            .satisfies(e -> assertThat(((AsdlResolutionException) e).description())
                .isEqualTo("module 'control' is already loaded by an imported model"));
    }

    @Test
    void primitiveNameLookupIsNotAType() {
        LOG.info(() -> "TEST: primitiveNameLookupIsNotAType");
        final var model = Asdl.load(CONTROL);
        assertThat(model.lookup("int")).isEmpty();
        assertThat(model.typeRef("identifier")).isEqualTo(TypeRef.Primitive.STRING);
        assertThatThrownBy(() -> model.type("nope")).isInstanceOf(AsdlTypeMismatchException.class);
    }

    @Test
    void loadedRegistryIsReadOnly() {
        LOG.info(() -> "TEST: loadedRegistryIsReadOnly");
        final var model = Asdl.load(ARITH);
        final var unary = ((SumType) model.type("arith_expr")).constructor("ArithUnary").orElseThrow();
        final var child = (TypeRef.Named) unary.field("child").orElseThrow().type();

        assertThatThrownBy(() -> model.registry().remove("arith.arith_expr"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(Arrays.stream(TypeRef.Named.class.getMethods())
            .map(Method::getReturnType)
            .noneMatch(Map.class::isAssignableFrom)).isTrue();
        assertThat(model.lookup("arith.arith_expr")).isPresent();
        assertThat(child.target()).isSameAs(model.type("arith_expr"));
    }
}
