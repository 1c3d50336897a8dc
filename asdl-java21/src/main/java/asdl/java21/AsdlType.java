package asdl.java21;

import java.util.List;

/// A type declared in a module: a [SumType] or a [ProductType].
public sealed interface AsdlType permits SumType, ProductType {

    /// Name of the declaring module.
    String module();

    String name();

    /// `module.name`, unique within a [TypeModel].
    default String qualifiedName() {
        return module() + "." + name();
    }

    /// Every distinct field list a node of this type may carry, in declaration order.
    List<List<Field>> shapes();
}
