package asdl.java21;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AsdlExceptionTest extends AsdlTestBase {

    @Test
    void schemaErrorsFormatLocation() {
        LOG.info(() -> "TEST: schemaErrorsFormatLocation");
        final var at = new SourcePosition(10, 2, 5);
        assertThat(new AsdlParseException("bad", "x.asdl", at)).hasMessage("bad at x.asdl:2:5");
        assertThat(new AsdlParseException("bad", null, at)).hasMessage("bad at 2:5");
        assertThat(new AsdlResolutionException("bad", "x.asdl", SourcePosition.UNKNOWN)).hasMessage("bad in x.asdl");
        assertThat(new AsdlLexException("bad", null, null)).hasMessage("bad")
            .satisfies(e -> assertThat(e.position().isKnown()).isFalse());
    }

    @Test
    void cycleErrorListsTheCycle() {
        LOG.info(() -> "TEST: cycleErrorListsTheCycle");
        final var e = new AsdlCycleException(List.of("a", "b", "a"), null, new SourcePosition(0, 1, 1));
        assertThat(e).hasMessage("illegal recursion without optional or repeated field: a -> b -> a at 1:1");
        assertThat(e.cycle()).containsExactly("a", "b", "a");
        assertThat(e).isInstanceOf(AsdlSchemaException.class).isInstanceOf(AsdlException.class);
    }

    @Test
    void valueErrorsCarryPathAndDetail() {
        LOG.info(() -> "TEST: valueErrorsCarryPathAndDetail");
        final var e = new AsdlArityException("too many", "Return");
        assertThat(e).hasMessage("too many at Return");
        assertThat(e.detail()).isEqualTo("too many");
        assertThat(e.path()).isEqualTo("Return");
        assertThat(new AsdlFieldAccessException("no field", null).path()).isEmpty();
        assertThat(new AsdlRecursionLimitException("deep", "")).hasMessage("deep");
    }

    @Test
    void validationErrorPrintsPath() {
        LOG.info(() -> "TEST: validationErrorPrintsPath");
        final var result = Asdl.load(CONTROL).check(AsdlInt.of(1), "cflow");
        assertThat(result.errors()).singleElement()
            .hasToString("expected cflow, got int at cflow");
        assertThat(SourcePosition.UNKNOWN).hasToString("?");
    }
}
