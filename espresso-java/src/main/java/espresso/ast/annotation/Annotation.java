package espresso.ast.annotation;

import espresso.ast.Node;

/** {@code @decorator} statements. */
public sealed interface Annotation extends Node
        permits DefineAnnotation, AssertAnnotation, NamespaceAnnotation, IncludeAnnotation,
        UsingAnnotation, AliasAnnotation, PanicAnnotation, MarkerAnnotation {}
