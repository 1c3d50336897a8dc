package asdl.java21;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point: loads schema text into a [TypeModel].
///
/// ```java
/// TypeModel model = Asdl.load("""
///     module control {
///       cflow = Break | Continue | Return(int status)
///     }
///     """);
/// AsdlNode ret = model.construct("cflow", "Return", List.of(2));
/// model.print(ret);   // Return(status=2)
/// ```
///
/// Loading either returns a complete model or throws an [AsdlSchemaException];
/// no partially loaded model is ever visible.
public final class Asdl {

    private static final Logger LOG = Logger.getLogger(Asdl.class.getName());

    private Asdl() {}

    /// Loads schema text containing one or more modules.
    /// @throws AsdlLexException on a character that cannot start a token
    /// @throws AsdlParseException on a grammar violation or duplicate name
    /// @throws AsdlResolutionException on an unknown field type
    /// @throws AsdlCycleException on a type with no finite value
    public static TypeModel load(String source) {
        return load(null, source);
    }

    /// Loads schema text whose fields may also refer to the types of previously loaded models.
    /// @param sourceName name used in error messages, may be null
    /// @param source     schema text
    /// @param imports    models searched, in order, after the modules of this text
    public static TypeModel load(String sourceName, String source, TypeModel... imports) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(imports, "imports must not be null");
        LOG.fine(() -> "Loading schema " + (sourceName == null ? "<string>" : sourceName)
            + " with " + imports.length + " import(s)");
        final var modules = AsdlParser.parse(source, sourceName);
        return AsdlResolver.resolve(modules, sourceName, List.of(imports));
    }

    /// Parses schema text without resolving it.
    /// @throws AsdlLexException on a character that cannot start a token
    /// @throws AsdlParseException on a grammar violation or duplicate name
    public static List<AsdlAst.Module> parse(String source) {
        return AsdlParser.parse(source, null);
    }
}
