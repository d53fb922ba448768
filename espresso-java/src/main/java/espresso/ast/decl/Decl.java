package espresso.ast.decl;

import espresso.ast.Node;

/** Declarations; they render complete C++ statements and never take an extra {@code ;}. */
public sealed interface Decl extends Node
        permits VarDecl, MultiVarDecl, FunctionDecl, ClassDecl, ClassSection, GenericParam, Param {}
