package espresso.ast.stmt;

import espresso.ast.Node;

/** Control-flow statements. */
public sealed interface Stmt extends Node
        permits IfStmt, WhileStmt, ForInStmt, ForStmt, MatchStmt, TryStmt,
        BreakStmt, ContinueStmt, ReturnStmt, ThrowStmt, ForeignBlock {}
