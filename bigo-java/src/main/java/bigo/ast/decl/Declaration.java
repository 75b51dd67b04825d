package bigo.ast.decl;

public sealed interface Declaration
        permits ArrayDeclaration, ObjectDeclaration {

    String name();
}
