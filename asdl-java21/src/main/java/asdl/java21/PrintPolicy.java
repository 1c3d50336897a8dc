package asdl.java21;

import java.util.logging.Logger;

/// Settings for [AsdlPrinter].
///
/// @param maxDepth   deepest node nesting the printer will descend into
/// @param lineWidth  width [AsdlPrinter#printTree] tries to keep each line within
/// @param indent     spaces per nesting level in tree output
public record PrintPolicy(int maxDepth, int lineWidth, int indent) {

    /// System property overriding the default `maxDepth`, read once.
    public static final String MAX_DEPTH_PROPERTY = "asdl.print.maxDepth";

    private static final Logger LOG = Logger.getLogger(PrintPolicy.class.getName());

    static final int DEFAULT_MAX_DEPTH = 1000;

    private static final PrintPolicy DEFAULTS = new PrintPolicy(configuredMaxDepth(), 80, 2);

    public PrintPolicy {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be > 0");
        }
        if (lineWidth <= 0) {
            throw new IllegalArgumentException("lineWidth must be > 0");
        }
        if (indent < 0) {
            throw new IllegalArgumentException("indent must be >= 0");
        }
    }

    public static PrintPolicy defaults() {
        return DEFAULTS;
    }

    public PrintPolicy withMaxDepth(int newMaxDepth) {
        return new PrintPolicy(newMaxDepth, lineWidth, indent);
    }

    public PrintPolicy withLineWidth(int newLineWidth) {
        return new PrintPolicy(maxDepth, newLineWidth, indent);
    }

    public PrintPolicy withIndent(int newIndent) {
        return new PrintPolicy(maxDepth, lineWidth, newIndent);
    }

    static int configuredMaxDepth() {
        final String propertyValue = System.getProperty(MAX_DEPTH_PROPERTY);
        if (propertyValue == null) {
            return DEFAULT_MAX_DEPTH;
        }
        try {
            final int value = Integer.parseInt(propertyValue.trim());
            if (value > 0) {
                LOG.fine(() -> "Printer max depth set to " + value + " via system property");
                return value;
            }
        } catch (NumberFormatException e) {
            LOG.finer(() -> "Unparseable " + MAX_DEPTH_PROPERTY + ": " + e.getMessage());
        }
        LOG.warning(() -> "Invalid " + MAX_DEPTH_PROPERTY + ": " + propertyValue
            + ". Using default: " + DEFAULT_MAX_DEPTH);
        return DEFAULT_MAX_DEPTH;
    }
}
