package bigo.ast.decl;

public sealed interface Parameter
        permits SimpleParameter, ArrayParameter, ObjectParameter {

    String name();
}
