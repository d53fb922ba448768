package espresso.parser;

import espresso.ast.Body;
import espresso.ast.Modifier;
import espresso.ast.Node;
import espresso.ast.Program;
import espresso.ast.annotation.*;
import espresso.ast.decl.*;
import espresso.ast.expr.*;
import espresso.ast.stmt.*;
import espresso.lexer.ForeignBlockExtractor;
import espresso.lexer.LexResult;
import espresso.lexer.Lexer;
import espresso.lexer.Token;
import espresso.lexer.TokenType;
import espresso.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent over statements, precedence climbing over binary operators.
 * <p>
 * Accepts both dialects: braces with {@code ;} or line ends, and the layout dialect where blocks
 * are {@code : NEWLINE INDENT ... DEDENT}. Lookahead that needs to try a construct saves the
 * cursor in a local {@code int} and restores it.
 */
public final class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private final List<String> foreignBlocks;
    private final boolean recover;
    private final List<ParseException> errors = new ArrayList<>();

    private int pos = 0;
    private String currentClass = null;

    public Parser(List<Token> tokens) {
        this(tokens, List.of(), false);
    }

    public Parser(LexResult lexed) {
        this(lexed.tokens(), lexed.foreignBlocks(), false);
    }

    public Parser(List<Token> tokens, List<String> foreignBlocks) {
        this(tokens, foreignBlocks, false);
    }

    /**
     * @param recover record a broken statement in {@link #errors()} and continue with the next one
     */
    public Parser(List<Token> tokens, List<String> foreignBlocks, boolean recover) {
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty() || copy.get(copy.size() - 1).type() != TokenType.EOF) {
            Token last = copy.isEmpty() ? null : copy.get(copy.size() - 1);
            copy.add(new Token(TokenType.EOF, "", last == null ? 1 : last.line(), last == null ? 1 : last.column()));
        }
        this.tokens = copy;
        this.foreignBlocks = List.copyOf(foreignBlocks);
        this.recover = recover;
    }

    /** Errors skipped over in recovery mode, in source order. */
    public List<ParseException> errors() {
        return List.copyOf(errors);
    }

    // ---------- entry ----------
    public Program parseProgram() {
        Body.Builder body = Body.builder(0);
        skipSeparators();
        while (!check(TokenType.EOF)) {
            parseStatementInto(body);
            skipSeparators();
        }
        consume(TokenType.EOF, "Expected end of input");
        return new Program(body.build());
    }

    private void parseStatementInto(Body.Builder body) {
        if (!recover) {
            body.add(parseStatement());
            return;
        }
        try {
            body.add(parseStatement());
        } catch (ParseException e) {
            errors.add(e);
            logger.debug("Resynchronizing after: {}", e.getMessage());
            synchronize();
        }
    }

    /** Skips to just after the next statement terminator. */
    private void synchronize() {
        int start = pos;
        while (!check(TokenType.EOF)) {
            if (match(TokenType.SEMICOLON, TokenType.NEWLINE)) return;
            if (check(TokenType.RBRACE) || check(TokenType.DEDENT)) {
                if (pos == start) advance();
                return;
            }
            if (pos > start && peek().line() > previous().line()) return;
            advance();
        }
    }

    // ---------- statements ----------
    private Node parseStatement() {
        List<Modifier> mods = parseModifiers();
        Token t = peek();

        switch (t.type()) {
            case DECORATOR -> {
                noModifiers(mods, t);
                return parseAnnotation();
            }
            case FOREIGN_BLOCK -> {
                noModifiers(mods, t);
                advance();
                match(TokenType.SEMICOLON);
                return new ForeignBlock(foreignText(t));
            }
            case FUNC -> {
                advance();
                return parseFunctionRest(mods, null);
            }
            case CLASS -> {
                advance();
                return parseClass(mods);
            }
            case IF, WHILE, FOR, MATCH, SWITCH, TRY, THROW, BREAK, CONTINUE, RETURN -> {
                noModifiers(mods, t);
                return parseControl();
            }
            default -> { }
        }

        Node decl = tryParseTypeLedDeclaration(mods);
        if (decl != null) return decl;

        if (!mods.isEmpty()) throw error(t, "Expected a declaration after modifiers");

        Expr e = parseExpression();
        endStatement();
        return e;
    }

    private Node parseControl() {
        Token t = advance();
        return switch (t.type()) {
            case IF -> parseIf();
            case WHILE -> new WhileStmt(parseExpression(), parseBlock());
            case FOR -> parseFor();
            case MATCH, SWITCH -> parseMatch();
            case TRY -> parseTry();
            case THROW -> {
                Expr value = atStatementEnd() ? null : parseExpression();
                endStatement();
                yield new ThrowStmt(value);
            }
            case BREAK -> {
                endStatement();
                yield new BreakStmt();
            }
            case CONTINUE -> {
                endStatement();
                yield new ContinueStmt();
            }
            case RETURN -> {
                Expr value = atStatementEnd() ? null : parseExpression();
                endStatement();
                yield new ReturnStmt(value);
            }
            default -> throw error(t, "Expected a statement");
        };
    }

    private List<Modifier> parseModifiers() {
        List<Modifier> mods = new ArrayList<>();
        while (peek().type().isModifier()) {
            // public: starts a class section, not a modifier
            if (Modifier.fromToken(peek().type()).isAccess() && checkNext(TokenType.COLON)) break;
            mods.add(Modifier.fromToken(advance().type()));
        }
        return mods;
    }

    private void noModifiers(List<Modifier> mods, Token at) {
        if (!mods.isEmpty()) throw error(at, "Modifiers are not allowed here");
    }

    /**
     * Variable or function declaration led by a type, or a constructor-style {@code name(...) {}}.
     * Returns null, with the cursor untouched, when the statement is an expression.
     */
    private Node tryParseTypeLedDeclaration(List<Modifier> mods) {
        if (!isTypeStart(peek())) return null;

        int saved = pos;
        String type = tryParseType();
        if (type != null) {
            if (match(TokenType.FUNC)) {
                return parseFunctionRest(mods, type);
            }
            // Type name(...) cannot be an expression, so a bodiless form is a prototype
            if (onSameLine() && looksLikeFunctionAt(pos, true)) {
                return parseFunctionRest(mods, type);
            }
        }
        pos = saved;

        if (looksLikeFunctionAt(pos, false)) {
            return parseFunctionRest(mods, null);
        }

        if (isVarDeclStart()) {
            Node decl = parseVarDecl(mods);
            endStatement();
            return decl;
        }
        return null;
    }

    private boolean isVarDeclStart() {
        int saved = pos;
        try {
            if (tryParseType() == null) return false;
            if (!check(TokenType.IDENTIFIER) || !onSameLine()) return false;
            advance();
            return check(TokenType.ASSIGN) || check(TokenType.COMMA) || atStatementEnd();
        } finally {
            pos = saved;
        }
    }

    private Decl parseVarDecl(List<Modifier> mods) {
        String type = parseType();
        List<String> names = new ArrayList<>();
        names.add(consume(TokenType.IDENTIFIER, "Expected variable name").lexeme());
        while (match(TokenType.COMMA)) {
            names.add(consume(TokenType.IDENTIFIER, "Expected variable name after ','").lexeme());
        }
        Expr value = match(TokenType.ASSIGN) ? parseExpression() : null;

        if (names.size() == 1) return new VarDecl(mods, type, names.get(0), value);
        return new MultiVarDecl(mods, type, names, value);
    }

    private IfStmt parseIf() {
        List<IfStmt.Branch> branches = new ArrayList<>();
        branches.add(new IfStmt.Branch(parseExpression(), parseBlock()));

        Body elseBody = null;
        while (true) {
            if (matchAfterNewlines(TokenType.ELIF)) {
                branches.add(new IfStmt.Branch(parseExpression(), parseBlock()));
            } else if (matchAfterNewlines(TokenType.ELSE)) {
                if (match(TokenType.IF)) {
                    branches.add(new IfStmt.Branch(parseExpression(), parseBlock()));
                } else {
                    elseBody = parseBlock();
                    break;
                }
            } else {
                break;
            }
        }
        return new IfStmt(branches, elseBody);
    }

    private Stmt parseFor() {
        boolean paren = match(TokenType.LPAREN);

        if (hasInBeforeBody(paren)) {
            String type = null;
            if (!(check(TokenType.IDENTIFIER) && checkNext(TokenType.IN))) type = parseType();
            Token var = consume(TokenType.IDENTIFIER, "Expected loop variable");
            consume(TokenType.IN, "Expected 'in'");
            Expr iterable = parseExpression();
            if (paren) consume(TokenType.RPAREN, "Expected ')' after for-in header");
            return new ForInStmt(type, var.lexeme(), iterable, parseBlock());
        }

        // C-style: for (init; cond; update)
        Node init = null;
        if (!check(TokenType.SEMICOLON)) {
            init = isVarDeclStart() ? parseVarDecl(List.of()) : parseExpression();
        }
        consume(TokenType.SEMICOLON, "Expected ';' after for-init");

        Expr cond = check(TokenType.SEMICOLON) ? null : parseExpression();
        consume(TokenType.SEMICOLON, "Expected ';' after for-condition");

        Expr update = null;
        if (!(paren ? check(TokenType.RPAREN) : isBlockStart())) update = parseExpression();
        if (paren) consume(TokenType.RPAREN, "Expected ')' after for header");

        return new ForStmt(init, cond, update, parseBlock());
    }

    /** Scans the loop header for {@code in}: at depth 1 inside parentheses, else up to the block. */
    private boolean hasInBeforeBody(boolean paren) {
        int depth = paren ? 1 : 0;
        for (int i = pos; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            switch (t.type()) {
                case LPAREN, LBRACKET -> depth++;
                case RPAREN, RBRACKET -> {
                    depth--;
                    if (paren && depth == 0) return false;
                }
                case LBRACE, NEWLINE, EOF, SEMICOLON -> {
                    if (!paren || t.type() == TokenType.EOF) return false;
                }
                case COLON -> {
                    if (!paren && i + 1 < tokens.size() && tokens.get(i + 1).type() == TokenType.NEWLINE) return false;
                }
                case IN -> {
                    if (depth == (paren ? 1 : 0)) return true;
                }
                default -> { }
            }
        }
        return false;
    }

    private MatchStmt parseMatch() {
        Expr subject = parseExpression();
        List<MatchStmt.Case> cases = new ArrayList<>();
        Body defaultBody = null;

        TokenType closer = openBlock();
        skipSeparators();
        while (!check(closer) && !check(TokenType.EOF)) {
            if (match(TokenType.CASE)) {
                List<Expr> patterns = new ArrayList<>();
                do {
                    patterns.add(parseTernary());
                } while (match(TokenType.COMMA));
                skipCaseColon();
                cases.add(new MatchStmt.Case(patterns, parseBlock()));
            } else if (match(TokenType.DEFAULT, TokenType.ELSE)) {
                skipCaseColon();
                defaultBody = parseBlock();
            } else {
                throw error(peek(), "Expected 'case' or 'default'");
            }
            skipSeparators();
        }
        closeBlock(closer);
        return new MatchStmt(subject, cases, defaultBody);
    }

    /** {@code case 1: { ... }} - a colon that does not open a layout block. */
    private void skipCaseColon() {
        if (check(TokenType.COLON) && !checkNext(TokenType.NEWLINE)) advance();
    }

    private TryStmt parseTry() {
        Body body = parseBlock();
        List<TryStmt.Catch> catches = new ArrayList<>();

        while (matchAfterNewlines(TokenType.CATCH)) {
            boolean paren = match(TokenType.LPAREN);
            String type = null;
            String name = null;
            if (isTypeStart(peek())) {
                type = parseType();
                if (check(TokenType.IDENTIFIER)) name = advance().lexeme();
            }
            if (paren) consume(TokenType.RPAREN, "Expected ')' after catch clause");
            catches.add(new TryStmt.Catch(type, name, parseBlock()));
        }

        Body finallyBody = matchAfterNewlines(TokenType.FINALLY) ? parseBlock() : null;
        return new TryStmt(body, catches, finallyBody);
    }

    // ---------- functions ----------

    /**
     * Tentatively reads {@code name(params)} at {@code start} and reports whether a function body
     * follows. The cursor is always restored.
     */
    private boolean looksLikeFunctionAt(int start, boolean allowBodiless) {
        int saved = pos;
        pos = start;
        try {
            if (!isDeclName(peek())) return false;
            advance();
            if (match(TokenType.LT)) {
                parseGenericList(TokenType.GT);
                consume(TokenType.GT, "Expected '>'");
            }
            if (!match(TokenType.LPAREN)) return false;
            parseParams(false);
            consume(TokenType.RPAREN, "Expected ')'");
            while (match(TokenType.CONST, TokenType.OVERRIDE)) {
                // trailing qualifiers
            }
            if (check(TokenType.LBRACE) || check(TokenType.FAT_ARROW) || check(TokenType.ARROW)) return true;
            if (check(TokenType.COLON) && checkNext(TokenType.NEWLINE)) return true;
            return allowBodiless && atStatementEnd();
        } catch (ParseException e) {
            return false;
        } finally {
            pos = saved;
        }
    }

    /**
     * After an optional leading return type (and {@code func}): name, generics, parameters,
     * trailing qualifiers, {@code -> Ret} and the body.
     */
    private FunctionDecl parseFunctionRest(List<Modifier> mods, String returnType) {
        Token nameTok = peek();
        DeclName declName = parseDeclName("function");

        consume(TokenType.LPAREN, "Expected '(' after function name");
        List<Param> params = parseParams(false);
        consume(TokenType.RPAREN, "Expected ')' after parameters");

        List<Modifier> trailing = new ArrayList<>();
        while (match(TokenType.CONST, TokenType.OVERRIDE)) {
            trailing.add(Modifier.fromToken(previous().type()));
        }

        if (match(TokenType.ARROW)) {
            if (returnType != null) throw error(previous(), "Return type given twice");
            returnType = parseType();
        }
        if (returnType == null && !declName.name().equals(currentClass)) {
            returnType = "void";
        }

        Body body;
        if (isBlockStart()) {
            body = parseBlock();
        } else if (match(TokenType.FAT_ARROW)) {
            Expr value = parseExpression();
            endStatement();
            body = Body.builder(1).add(new ReturnStmt(value)).build();
        } else {
            endStatement();
            body = null;
        }

        logger.debug("Parsed function {} at {}:{}", declName.name(), nameTok.line(), nameTok.column());
        return new FunctionDecl(mods, returnType, declName.name(), declName.generics(), params, trailing, body);
    }

    private List<Param> parseParams(boolean allowUntyped) {
        List<Param> params = new ArrayList<>();
        if (check(TokenType.RPAREN)) return params;
        do {
            String type;
            if (allowUntyped && check(TokenType.IDENTIFIER)
                    && (checkNext(TokenType.COMMA) || checkNext(TokenType.RPAREN))) {
                type = "auto";
            } else {
                type = parseType();
            }
            Token name = consume(TokenType.IDENTIFIER, "Expected parameter name");
            Expr defaultValue = match(TokenType.ASSIGN) ? parseTernary() : null;
            params.add(new Param(type, name.lexeme(), defaultValue));
        } while (match(TokenType.COMMA));
        return params;
    }

    // ---------- classes ----------
    private ClassDecl parseClass(List<Modifier> mods) {
        DeclName declName = parseDeclName("class");

        List<String> bases = new ArrayList<>();
        if (match(TokenType.LPAREN)) {
            if (!check(TokenType.RPAREN)) {
                do {
                    bases.add(parseType());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RPAREN, "Expected ')' after base classes");
        } else if (check(TokenType.COLON) && !checkNext(TokenType.NEWLINE)) {
            advance();
            do {
                bases.add(parseType());
            } while (match(TokenType.COMMA));
        }

        String outer = currentClass;
        currentClass = declName.name();
        try {
            Body body = parseClassBody();
            match(TokenType.SEMICOLON);
            return new ClassDecl(mods, declName.name(), declName.generics(), bases, body);
        } finally {
            currentClass = outer;
        }
    }

    private Body parseClassBody() {
        Body.Builder members = Body.builder(1);
        Body.Builder section = null;
        Modifier sectionAccess = null;

        TokenType closer = openBlock();
        skipSeparators();
        while (!check(closer) && !check(TokenType.EOF)) {
            if (isDivider()) {
                Modifier access = Modifier.fromToken(advance().type());
                advance(); // ':'
                if (section != null) members.add(new ClassSection(sectionAccess, section.build()));
                section = null;

                if (check(TokenType.NEWLINE) && checkNext(TokenType.INDENT)) {
                    advance();
                    advance();
                    members.add(new ClassSection(access, parseStatementsUntil(TokenType.DEDENT)));
                    consume(TokenType.DEDENT, "Expected end of section");
                } else {
                    section = Body.builder(1);
                    sectionAccess = access;
                }
                skipSeparators();
                continue;
            }

            parseStatementInto(section != null ? section : members);
            skipSeparators();
        }
        if (section != null) members.add(new ClassSection(sectionAccess, section.build()));
        closeBlock(closer);
        return members.build();
    }

    private boolean isDivider() {
        return (check(TokenType.PUBLIC) || check(TokenType.PRIVATE) || check(TokenType.PROTECTED))
                && checkNext(TokenType.COLON);
    }

    // ---------- generics ----------
    private record DeclName(String name, List<GenericParam> generics) {}

    /** Name of a function or class with its template parameters, merged ({@code Box<T>}) or not. */
    private DeclName parseDeclName(String what) {
        Token t = peek();
        String name;
        List<GenericParam> generics = new ArrayList<>();

        if (check(TokenType.IDENTIFIER)) {
            advance();
            name = t.lexeme();
            if (match(TokenType.LT)) {
                generics = parseGenericList(TokenType.GT);
                consume(TokenType.GT, "Expected '>' after generic parameters");
            }
        } else if (isMergedGeneric(t)) {
            advance();
            int lt = t.lexeme().indexOf('<');
            name = t.lexeme().substring(0, lt);
            generics = parseGenericsFromText(t.lexeme().substring(lt + 1, t.lexeme().length() - 1), t);
        } else {
            throw error(t, "Expected " + what + " name");
        }

        String dup = GenericParam.firstDuplicate(generics);
        if (dup != null) throw error(t, "Duplicate generic parameter '" + dup + "'");
        return new DeclName(name, generics);
    }

    private List<GenericParam> parseGenericsFromText(String inner, Token anchor) {
        List<Token> innerTokens = relocate(new Lexer(inner).tokenize().tokens(), anchor);
        Parser sub = new Parser(innerTokens);
        List<GenericParam> generics = sub.parseGenericList(TokenType.EOF);
        sub.consume(TokenType.EOF, "Malformed generic parameter list");
        return generics;
    }

    /** {@code T}, {@code T = int}, {@code typename T}, {@code int N}, {@code int N = 4}. */
    private List<GenericParam> parseGenericList(TokenType closer) {
        List<GenericParam> out = new ArrayList<>();
        if (check(closer)) return out;
        do {
            boolean keyword = false;
            if (match(TokenType.CLASS)) {
                keyword = true;
            } else if (check(TokenType.IDENTIFIER) && peek().lexeme().equals("typename") && checkNext(TokenType.IDENTIFIER)) {
                advance();
                keyword = true;
            }

            if (keyword || (check(TokenType.IDENTIFIER)
                    && (checkNext(TokenType.COMMA) || checkNext(TokenType.ASSIGN) || checkNext(closer)))) {
                Token name = consume(TokenType.IDENTIFIER, "Expected generic parameter name");
                String def = match(TokenType.ASSIGN) ? parseType() : null;
                out.add(new GenericParam(null, name.lexeme(), def));
            } else {
                String type = parseType();
                Token name = consume(TokenType.IDENTIFIER, "Expected generic parameter name");
                String def = match(TokenType.ASSIGN) ? parseUnary().render() : null;
                out.add(new GenericParam(type, name.lexeme(), def));
            }
        } while (match(TokenType.COMMA));
        return out;
    }

    // ---------- annotations ----------
    private Node parseAnnotation() {
        Token deco = advance();
        switch (deco.lexeme()) {
            case "@include" -> {
                String header;
                if (match(TokenType.ANGLE_PATH)) header = previous().lexeme();
                else if (match(TokenType.STRING_LITERAL)) header = "\"" + previous().lexeme() + "\"";
                else throw error(peek(), "Expected <header> or \"header\" after @include");
                endStatement();
                return new IncludeAnnotation(header);
            }
            case "@using" -> {
                if (check(TokenType.IDENTIFIER) && peek().lexeme().equals("namespace")) advance();
                Token ns = consumeName("Expected namespace after @using");
                endStatement();
                return new UsingAnnotation(ns.lexeme());
            }
            case "@alias" -> {
                Token name = consume(TokenType.IDENTIFIER, "Expected alias name");
                consume(TokenType.ASSIGN, "Expected '=' after alias name");
                String type = parseType();
                endStatement();
                return new AliasAnnotation(name.lexeme(), type);
            }
            case "@define" -> {
                Token name = consume(TokenType.IDENTIFIER, "Expected macro name after @define");
                Expr value = atStatementEnd() ? null : parseExpression();
                endStatement();
                return new DefineAnnotation(name.lexeme(), value);
            }
            case "@assert" -> {
                consume(TokenType.LPAREN, "Expected '(' after @assert");
                Expr cond = parseExpression();
                Expr message = match(TokenType.COMMA) ? parseExpression() : null;
                consume(TokenType.RPAREN, "Expected ')' after @assert arguments");
                endStatement();
                return new AssertAnnotation(cond, message);
            }
            case "@namespace" -> {
                Token name = consumeName("Expected namespace name");
                return new NamespaceAnnotation(name.lexeme(), parseBlock());
            }
            case "@panic" -> {
                consume(TokenType.LPAREN, "Expected '(' after @panic");
                Expr message = parseExpression();
                consume(TokenType.RPAREN, "Expected ')' after @panic message");
                endStatement();
                return new PanicAnnotation(message);
            }
            case "@io", "@safe", "@unsafe" -> {
                match(TokenType.SEMICOLON, TokenType.NEWLINE);
                MarkerAnnotation.Marker marker = switch (deco.lexeme()) {
                    case "@io" -> MarkerAnnotation.Marker.IO;
                    case "@safe" -> MarkerAnnotation.Marker.SAFE;
                    default -> MarkerAnnotation.Marker.UNSAFE;
                };
                return new MarkerAnnotation(marker);
            }
            default -> throw error(deco, "Unknown decorator " + deco.lexeme());
        }
    }

    // ---------- blocks ----------
    private boolean isBlockStart() {
        return check(TokenType.LBRACE) || (check(TokenType.COLON) && checkNext(TokenType.NEWLINE));
    }

    /** Consumes {@code {} or {@code : NEWLINE INDENT} and returns the token that closes the block. */
    private TokenType openBlock() {
        if (match(TokenType.LBRACE)) return TokenType.RBRACE;
        if (check(TokenType.COLON) && checkNext(TokenType.NEWLINE)) {
            advance();
            advance();
            consume(TokenType.INDENT, "Expected an indented block");
            return TokenType.DEDENT;
        }
        throw error(peek(), "Expected '{' or ':' to open a block");
    }

    private void closeBlock(TokenType closer) {
        consume(closer, closer == TokenType.RBRACE ? "Expected '}' to close block" : "Expected end of indented block");
    }

    private Body parseBlock() {
        TokenType closer = openBlock();
        Body body = parseStatementsUntil(closer);
        closeBlock(closer);
        return body;
    }

    private Body parseStatementsUntil(TokenType closer) {
        Body.Builder body = Body.builder(1);
        skipSeparators();
        while (!check(closer) && !check(TokenType.EOF)) {
            parseStatementInto(body);
            skipSeparators();
        }
        return body.build();
    }

    private void endStatement() {
        if (match(TokenType.SEMICOLON)) {
            match(TokenType.NEWLINE);
            return;
        }
        if (match(TokenType.NEWLINE)) return;
        if (atStatementEnd()) return;
        throw error(peek(), "Expected ';' or end of line");
    }

    private boolean atStatementEnd() {
        if (check(TokenType.SEMICOLON) || check(TokenType.NEWLINE) || check(TokenType.RBRACE)
                || check(TokenType.DEDENT) || check(TokenType.EOF)) {
            return true;
        }
        return pos > 0 && peek().line() > previous().line();
    }

    private void skipSeparators() {
        while (match(TokenType.NEWLINE, TokenType.SEMICOLON)) {
            // empty statements
        }
    }

    // ---------- types ----------
    private boolean isTypeStart(Token t) {
        return t.type() == TokenType.TYPE || t.type() == TokenType.IDENTIFIER || t.type() == TokenType.PATH;
    }

    private boolean isDeclName(Token t) {
        return t.type() == TokenType.IDENTIFIER || isMergedGeneric(t);
    }

    private static boolean isMergedGeneric(Token t) {
        return t.type() == TokenType.TYPE && t.lexeme().indexOf('<') > 0 && t.lexeme().endsWith(">");
    }

    /** {@code int}, {@code Box<T>}, {@code map[string, list[int]]}; returned as source text. */
    private String parseType() {
        Token t = peek();
        if (!isTypeStart(t)) throw error(t, "Expected type");
        advance();
        StringBuilder sb = new StringBuilder(t.lexeme());
        if (check(TokenType.LBRACKET) && peek().line() == t.line()) {
            advance();
            List<String> args = new ArrayList<>();
            do {
                if (match(TokenType.NUMBER_LITERAL)) args.add(previous().lexeme());
                else args.add(parseType());
            } while (match(TokenType.COMMA));
            consume(TokenType.RBRACKET, "Expected ']' after type arguments");
            sb.append('[').append(String.join(", ", args)).append(']');
        }
        return sb.toString();
    }

    /** Speculative {@link #parseType()}: the type text, or null with the cursor restored. */
    private String tryParseType() {
        int saved = pos;
        try {
            return parseType();
        } catch (ParseException e) {
            pos = saved;
            return null;
        }
    }

    // ---------- expressions (precedence climbing) ----------
    public Expr parseExpression() { return parseAssign(); }

    private Expr parseAssign() {
        Expr left = parseTernary();

        if (match(TokenType.ASSIGN)) {
            Token op = previous();
            Expr right = parseAssign(); // right-assoc
            if (!AssignExpr.isAssignable(left)) throw error(op, "Invalid assignment target");
            return new AssignExpr(left, right);
        }

        if (peek().type().isCompoundAssign()) {
            Token op = advance();
            Expr right = parseAssign();
            if (!AssignExpr.isAssignable(left)) throw error(op, "Invalid assignment target");
            Expr operand = needsGrouping(right) ? new GroupingExpr(right) : right;
            return new AssignExpr(left, new BinaryExpr(BinaryExpr.Operator.fromCompoundAssign(op.type()), left, operand));
        }
        return left;
    }

    private static boolean needsGrouping(Expr e) {
        return e instanceof BinaryExpr || e instanceof TernaryExpr || e instanceof AssignExpr;
    }

    private Expr parseTernary() {
        Expr cond = parseBinary(1);
        if (match(TokenType.QUESTION)) {
            Expr whenTrue = parseExpression();
            consume(TokenType.COLON, "Expected ':' in conditional expression");
            Expr whenFalse = parseTernary();
            return new TernaryExpr(cond, whenTrue, whenFalse);
        }
        return cond;
    }

    private Expr parseBinary(int minPrecedence) {
        Expr left = parseUnary();
        while (true) {
            BinaryExpr.Operator op = BinaryExpr.Operator.fromToken(peek().type());
            if (op == null || op.precedence() < minPrecedence) break;
            advance();
            Expr right = parseBinary(op.precedence() + 1); // left-assoc
            left = new BinaryExpr(op, left, right);
        }
        return left;
    }

    private Expr parseUnary() {
        if (match(TokenType.NOT)) return new UnaryExpr("!", parseUnary());
        if (match(TokenType.MINUS)) {
            if (check(TokenType.NUMBER_LITERAL)) {
                Token num = advance();
                return parsePostfixOn(numeric(num, "-" + num.lexeme()));
            }
            return new UnaryExpr("-", parseUnary());
        }
        if (match(TokenType.PLUS)) return new UnaryExpr("+", parseUnary());
        if (match(TokenType.TILDE)) return new UnaryExpr("~", parseUnary());
        if (match(TokenType.INC)) return new UnaryExpr("++", parseUnary());
        if (match(TokenType.DEC)) return new UnaryExpr("--", parseUnary());
        return parsePostfixOn(parsePrimary());
    }

    private Expr parsePostfixOn(Expr start) {
        Expr e = start;
        while (true) {
            if (check(TokenType.LPAREN) && onSameLine()) {
                advance();
                e = new CallExpr(e, parseArguments());
                continue;
            }
            if (check(TokenType.LBRACKET) && onSameLine()) {
                advance();
                Expr idx = parseExpression();
                consume(TokenType.RBRACKET, "Expected ']'");
                e = new IndexExpr(e, idx);
                continue;
            }
            if (match(TokenType.DOT)) {
                Token name = peek();
                if (!check(TokenType.IDENTIFIER) && !isMergedGeneric(name)) {
                    throw error(name, "Expected member name after '.'");
                }
                advance();
                e = new MemberAccessExpr(e, name.type() == TokenType.TYPE
                        ? TypeMapper.convert(name.lexeme()) : name.lexeme());
                continue;
            }
            if ((check(TokenType.INC) || check(TokenType.DEC)) && onSameLine()) {
                e = new UnaryExpr(advance().lexeme(), e, true);
                continue;
            }
            break;
        }
        return e;
    }

    private List<CallExpr.Argument> parseArguments() {
        List<CallExpr.Argument> args = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
                    String name = advance().lexeme();
                    advance(); // '='
                    args.add(new CallExpr.Argument(name, parseTernary()));
                } else {
                    args.add(CallExpr.Argument.positional(parseTernary()));
                }
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after arguments");
        return args;
    }

    private Expr parsePrimary() {
        Token t = peek();
        switch (t.type()) {
            case NUMBER_LITERAL -> {
                advance();
                return numeric(t, t.lexeme());
            }
            case STRING_LITERAL -> {
                advance();
                return new StringLiteral(t.lexeme());
            }
            case RAW_STRING_LITERAL -> {
                advance();
                return new RawStringLiteral(t.lexeme());
            }
            case INTERP_STRING_LITERAL -> {
                advance();
                return InterpolatedString.parse(t.lexeme(), source -> parseEmbedded(source, t));
            }
            case CHAR_LITERAL -> {
                advance();
                return new CharLiteral(t.lexeme());
            }
            case BOOL_LITERAL -> {
                advance();
                return new BoolLiteral(t.lexeme().equals("true"));
            }
            case NULL_LITERAL -> {
                advance();
                return new NullLiteral();
            }
            case IDENTIFIER, PATH -> {
                advance();
                return new Identifier(t.lexeme());
            }
            case TYPE -> {
                advance();
                if (t.lexeme().equals("void") && !check(TokenType.LPAREN)) return new VoidLiteral();
                return new TypeName(t.lexeme());
            }
            case LAMBDA -> {
                advance();
                return parseLambda();
            }
            case LPAREN -> {
                advance();
                return parseParenthesized();
            }
            case LBRACKET -> {
                advance();
                List<Expr> items = new ArrayList<>();
                if (!check(TokenType.RBRACKET)) {
                    do {
                        items.add(parseTernary());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RBRACKET, "Expected ']' after list items");
                return new ContainerLiteral(ContainerLiteral.Shape.LIST, items);
            }
            case LBRACE -> {
                advance();
                return parseBraceLiteral();
            }
            default -> throw error(t, "Expected expression");
        }
    }

    /** Grouping, or a tuple when the parentheses hold a comma. */
    private Expr parseParenthesized() {
        if (match(TokenType.RPAREN)) return new ContainerLiteral(ContainerLiteral.Shape.TUPLE, List.of());
        Expr first = parseExpression();
        if (!match(TokenType.COMMA)) {
            consume(TokenType.RPAREN, "Expected ')'");
            return new GroupingExpr(first);
        }
        List<Expr> items = new ArrayList<>();
        items.add(first);
        if (!check(TokenType.RPAREN)) {
            do {
                items.add(parseTernary());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')' after tuple items");
        return new ContainerLiteral(ContainerLiteral.Shape.TUPLE, items);
    }

    /** {@code {a, b}} set or {@code {k: v}} map. */
    private Expr parseBraceLiteral() {
        if (match(TokenType.RBRACE)) return new ContainerLiteral(ContainerLiteral.Shape.SET, List.of());

        Expr first = parseTernary();
        if (match(TokenType.COLON)) {
            List<MapLiteral.Entry> entries = new ArrayList<>();
            entries.add(new MapLiteral.Entry(first, parseTernary()));
            while (match(TokenType.COMMA)) {
                if (check(TokenType.RBRACE)) break;
                Expr key = parseTernary();
                consume(TokenType.COLON, "Expected ':' between map key and value");
                entries.add(new MapLiteral.Entry(key, parseTernary()));
            }
            consume(TokenType.RBRACE, "Expected '}' after map entries");
            return new MapLiteral(entries);
        }

        List<Expr> items = new ArrayList<>();
        items.add(first);
        while (match(TokenType.COMMA)) {
            if (check(TokenType.RBRACE)) break;
            items.add(parseTernary());
        }
        consume(TokenType.RBRACE, "Expected '}' after set items");
        return new ContainerLiteral(ContainerLiteral.Shape.SET, items);
    }

    private LambdaExpr parseLambda() {
        consume(TokenType.LPAREN, "Expected '(' after lambda");
        List<Param> params = parseParams(true);
        consume(TokenType.RPAREN, "Expected ')' after lambda parameters");
        String returnType = match(TokenType.ARROW) ? parseType() : null;

        if (match(TokenType.FAT_ARROW)) {
            return new LambdaExpr(params, returnType, null, parseExpression());
        }
        return new LambdaExpr(params, returnType, parseBlock(), null);
    }

    private Expr parseEmbedded(String source, Token anchor) {
        List<Token> inner = relocate(new Lexer(source).tokenize().tokens(), anchor);
        Parser sub = new Parser(inner);
        Expr e = sub.parseExpression();
        sub.consume(TokenType.EOF, "Unexpected text in interpolated expression");
        return e;
    }

    private NumericLiteral numeric(Token at, String text) {
        try {
            return NumericLiteral.of(text);
        } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage(), at, "numeric literal", e);
        }
    }

    private String foreignText(Token t) {
        int index = ForeignBlockExtractor.placeholderIndex(t.lexeme());
        if (index < 0) return t.lexeme();
        if (index >= foreignBlocks.size()) throw error(t, "Unknown foreign block");
        return foreignBlocks.get(index);
    }

    /** Tokens lexed from a fragment report the position of the token they came from. */
    private static List<Token> relocate(List<Token> inner, Token anchor) {
        List<Token> out = new ArrayList<>(inner.size());
        for (Token t : inner) {
            out.add(new Token(t.type(), t.lexeme(), anchor.line(), anchor.column()));
        }
        return out;
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    /** Like {@link #match} but looks past line breaks; they stay unconsumed when nothing matches. */
    private boolean matchAfterNewlines(TokenType type) {
        int i = pos;
        while (tokens.get(i).type() == TokenType.NEWLINE) i++;
        if (tokens.get(i).type() != type) return false;
        pos = i + 1;
        return true;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw new ParseException(msg, peek(), t.name());
    }

    private Token consumeName(String msg) {
        if (check(TokenType.IDENTIFIER) || check(TokenType.PATH)) return advance();
        throw new ParseException(msg, peek(), "name");
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private boolean onSameLine() {
        return pos == 0 || peek().line() == previous().line();
    }

    private Token advance() {
        Token t = peek();
        if (t.type() != TokenType.EOF) pos++;
        return t;
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private ParseException error(Token at, String msg) {
        return new ParseException(msg, at, null);
    }
}
