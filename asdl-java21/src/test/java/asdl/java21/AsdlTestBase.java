package asdl.java21;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.logging.Logger;

/// Base class for all ASDL tests.
/// - Emits an INFO banner per test.
/// - Holds the schemas most tests load.
public class AsdlTestBase extends AsdlLoggingConfig {

    static final Logger LOG = Logger.getLogger("asdl.java21");

    static final String CONTROL = """
        module control {
          cflow = Break | Continue | Return(int status)
        }
        """;

    static final String BOOLS = """
        module bools {
          bool_expr = BoolUnary(string op, bool_expr child)
                    | BoolBinary(string op, bool_expr left, bool_expr right)
                    | BoolLit(bool value)
        }
        """;

    static final String ARITH = """
        -- arithmetic expressions
        module arith {
          arith_expr = ArithUnary(string op, arith_expr child)
                     | ArithBinary(string op, arith_expr left, arith_expr right)
                     | Const(int i)
                     | Var(identifier name)
                     | FuncCall(string name, arith_expr* args, string? comment)
          binding = (identifier name, arith_expr value)
        }
        """;

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }
}
