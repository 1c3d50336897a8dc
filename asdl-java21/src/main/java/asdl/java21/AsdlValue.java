package asdl.java21;

/// A value held by a field: a primitive, a sequence, an optional, or a node of a declared type.
///
/// Instances are immutable and thread safe. [AsdlNode]s are created by
/// [TypeModel]; the remaining kinds through their `of` factories.
/// `toString()` returns the canonical form produced by [AsdlPrinter].
public sealed interface AsdlValue permits AsdlString, AsdlInt, AsdlBool, AsdlSeq, AsdlOptional, AsdlNode {

    /// Short name of the value's kind for error messages.
    String kind();
}
