package espresso.ast.expr;

import espresso.ast.Node;

/** Value-producing nodes: literals and expressions. */
public sealed interface Expr extends Node
        permits NumericLiteral, StringLiteral, RawStringLiteral, InterpolatedString,
        CharLiteral, BoolLiteral, NullLiteral, VoidLiteral, ContainerLiteral, MapLiteral,
        Identifier, TypeName, BinaryExpr, UnaryExpr, TernaryExpr, GroupingExpr,
        CallExpr, MemberAccessExpr, IndexExpr, AssignExpr, LambdaExpr {}
