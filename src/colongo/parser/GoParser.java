package colongo.parser;

import colongo.errors.Issue;
import colongo.errors.TopLevelIssueContext;
import colongo.lexer.GoLexer;
import colongo.lexer.GoToken;
import colongo.lexer.GoTokenType;
import colongo.lexer.LexerIssue;
import colongo.model.golang.*;
import colongo.model.golang.type.*;
import colongo.util.SourceFile;
import colongo.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static colongo.lexer.GoTokenType.*;

/**
 * Recursive descent parser for Go source files.
 *
 * The grammar follows the Go reference parser closely, including its error messages, so that
 * diagnostics read the way a Go programmer expects. Parsing stops at the first error.
 *
 * Comments are not attached to nodes. They are collected in source order into
 * {@link GoModule#getComments()}, from where the printer interleaves them by location.
 */
public final class GoParser {

	private enum SimpleStatementMode {
		BASIC,
		LABEL_OK,
		RANGE_OK,
	}

	private static final class RangeClause {
		final GoToken start;
		final List<GoExpression> lhs;
		final GoAssignmentStatement.Operator operator;
		final GoExpression expression;

		RangeClause(GoToken start, List<GoExpression> lhs, GoAssignmentStatement.Operator operator,
		            GoExpression expression) {
			this.start = start;
			this.lhs = lhs;
			this.operator = operator;
			this.expression = expression;
		}
	}

	// either a statement, or a range clause when parsed in RANGE_OK mode
	private static final class SimpleStatement {
		final GoStatement statement;
		final RangeClause range;

		SimpleStatement(GoStatement statement, RangeClause range) {
			this.statement = statement;
			this.range = range;
		}
	}

	private static final class VarType {
		final GoType type;
		final boolean variadic;
		final SourceLocation location;

		VarType(GoType type, boolean variadic, SourceLocation location) {
			this.type = type;
			this.variadic = variadic;
			this.location = location;
		}
	}

	private final List<GoToken> tokens = new ArrayList<>();
	private final List<GoComment> comments = new ArrayList<>();
	private int index = 0;
	private GoToken tok;
	private GoToken previous;
	// < 0 in control clauses, where "T {" opens a block rather than a composite literal
	private int exprLev = 0;

	private GoParser(List<GoToken> allTokens) {
		for (GoToken t : allTokens) {
			if (t.getType() == COMMENT) {
				comments.add(new GoComment(t.getLocation(), t.getValue()));
			} else {
				tokens.add(t);
			}
		}
		tok = tokens.get(0);
		previous = tok;
	}

	/**
	 * Parses a whole Go file.
	 *
	 * @param file the file locations are reported against
	 * @param text the text to parse, which may be a rewritten copy of the file's text
	 * @throws GoParseException on the first lexical or syntax error
	 */
	public static GoModule readModule(SourceFile file, CharSequence text) throws GoParseException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<GoToken> tokens = new GoLexer(file, text, true).readTokens(ctx);
		if (ctx.hasErrors()) {
			Issue first = ctx.getSortedIssues().get(0);
			throw new GoParseException(first.getLocation(), ((LexerIssue) first).getDescription());
		}
		return new GoParser(tokens).parseModule();
	}

	public static GoModule readModule(SourceFile file) throws GoParseException {
		return readModule(file, file.getText());
	}

	// token handling

	private void next() {
		previous = tok;
		if (index < tokens.size() - 1) {
			++index;
		}
		tok = tokens.get(index);
	}

	private boolean at(GoTokenType type) {
		return tok.getType() == type;
	}

	private GoToken expect(GoTokenType type) throws GoParseException {
		if (!at(type)) {
			throw errorExpected("'" + type.getText() + "'");
		}
		GoToken t = tok;
		next();
		return t;
	}

	private void expectSemi() throws GoParseException {
		// semicolons may be omitted before a closing ")" or "}"
		if (at(RPAREN) || at(RBRACE)) {
			return;
		}
		if (at(SEMICOLON)) {
			next();
			return;
		}
		throw errorExpected("';'");
	}

	private boolean atComma(String context, GoTokenType follow) throws GoParseException {
		if (at(COMMA)) {
			return true;
		}
		if (!at(follow)) {
			String msg = "missing ','";
			if (tok.isAutomaticSemicolon()) {
				msg += " before newline";
			}
			throw new GoParseException(tok.getLocation(), msg + " in " + context);
		}
		return false;
	}

	private GoParseException errorExpected(String what) {
		String found;
		if (tok.isAutomaticSemicolon()) {
			found = "newline";
		} else if (tok.getType().isLiteral()) {
			found = tok.getValue();
		} else if (at(EOF)) {
			found = "'EOF'";
		} else {
			found = "'" + tok.getValue() + "'";
		}
		return new GoParseException(tok.getLocation(), "expected " + what + ", found " + found);
	}

	private SourceLocation from(GoToken start) {
		return start.getLocation().combine(previous.getLocation());
	}

	private SourceLocation from(GoNode start) {
		return start.getLocation().combine(previous.getLocation());
	}

	// declarations

	private GoModule parseModule() throws GoParseException {
		GoToken start = tok;
		expect(PACKAGE);
		String name = parseIdent().getName();
		expectSemi();
		List<GoDeclaration> declarations = new ArrayList<>();
		while (at(IMPORT)) {
			declarations.add(parseImportDeclaration());
		}
		while (!at(EOF)) {
			declarations.add(parseDeclaration());
		}
		return new GoModule(from(start), name, declarations, comments);
	}

	private GoDeclaration parseDeclaration() throws GoParseException {
		switch (tok.getType()) {
			case CONST:
			case VAR:
				return parseValueDeclaration();
			case TYPE:
				return parseTypeDeclaration();
			case FUNC:
				return parseFunctionDeclaration();
			case IMPORT:
				throw new GoParseException(tok.getLocation(), "imports must appear before other declarations");
			default:
				throw errorExpected("declaration");
		}
	}

	private GoImportDeclaration parseImportDeclaration() throws GoParseException {
		GoToken start = expect(IMPORT);
		List<GoImportSpec> specs = new ArrayList<>();
		boolean grouped = at(LPAREN);
		if (grouped) {
			next();
			while (!at(RPAREN) && !at(EOF)) {
				specs.add(parseImportSpec());
				expectSemi();
			}
			expect(RPAREN);
		} else {
			specs.add(parseImportSpec());
		}
		GoImportDeclaration declaration = new GoImportDeclaration(from(start), grouped, specs);
		expectSemi();
		return declaration;
	}

	private GoImportSpec parseImportSpec() throws GoParseException {
		GoToken start = tok;
		String name = null;
		if (at(IDENT)) {
			name = tok.getValue();
			next();
		} else if (at(PERIOD)) {
			name = ".";
			next();
		}
		if (!at(STRING)) {
			throw errorExpected("import path");
		}
		String path = tok.getValue();
		next();
		return new GoImportSpec(from(start), name, path);
	}

	private GoVariableDeclaration parseValueDeclaration() throws GoParseException {
		GoToken start = tok;
		boolean constant = at(CONST);
		next();
		List<GoValueSpec> specs = new ArrayList<>();
		boolean grouped = at(LPAREN);
		if (grouped) {
			next();
			for (int i = 0; !at(RPAREN) && !at(EOF); ++i) {
				specs.add(parseValueSpec(constant, i));
				expectSemi();
			}
			expect(RPAREN);
		} else {
			specs.add(parseValueSpec(constant, 0));
		}
		GoVariableDeclaration declaration = new GoVariableDeclaration(from(start), constant, grouped, specs);
		expectSemi();
		return declaration;
	}

	private GoValueSpec parseValueSpec(boolean constant, int position) throws GoParseException {
		GoToken start = tok;
		List<GoVariableName> names = parseIdentList();
		GoType type = tryType();
		List<GoExpression> values = new ArrayList<>();
		if (at(ASSIGN)) {
			next();
			values = parseExpressionList();
		}
		if (!constant && type == null && values.isEmpty()) {
			throw new GoParseException(start.getLocation(), "missing variable type or initialization");
		}
		if (constant && position == 0 && values.isEmpty()) {
			throw new GoParseException(start.getLocation(), "missing init expr for const declaration");
		}
		return new GoValueSpec(from(start), names, type, values);
	}

	private GoTypeDeclaration parseTypeDeclaration() throws GoParseException {
		GoToken start = expect(TYPE);
		List<GoTypeSpec> specs = new ArrayList<>();
		boolean grouped = at(LPAREN);
		if (grouped) {
			next();
			while (!at(RPAREN) && !at(EOF)) {
				specs.add(parseTypeSpec());
				expectSemi();
			}
			expect(RPAREN);
		} else {
			specs.add(parseTypeSpec());
		}
		GoTypeDeclaration declaration = new GoTypeDeclaration(from(start), grouped, specs);
		expectSemi();
		return declaration;
	}

	private GoTypeSpec parseTypeSpec() throws GoParseException {
		GoToken start = tok;
		String name = parseIdent().getName();
		boolean alias = at(ASSIGN);
		if (alias) {
			next();
		}
		GoType type = parseType();
		return new GoTypeSpec(from(start), name, alias, type);
	}

	private GoFunctionDeclaration parseFunctionDeclaration() throws GoParseException {
		GoToken start = expect(FUNC);
		GoFunctionParameter receiver = null;
		if (at(LPAREN)) {
			GoToken lparen = tok;
			List<GoFunctionParameter> receivers = parseParameters(false);
			if (receivers.size() != 1) {
				throw new GoParseException(from(lparen),
						receivers.isEmpty() ? "method has no receiver" : "method has multiple receivers");
			}
			receiver = receivers.get(0);
		}
		String name = parseIdent().getName();
		GoToken signatureStart = tok;
		GoFunctionType signature = parseSignature(signatureStart);
		GoBlock body = null;
		if (at(LBRACE)) {
			body = parseBlock();
		}
		GoFunctionDeclaration declaration = new GoFunctionDeclaration(from(start), receiver, name, signature, body);
		expectSemi();
		return declaration;
	}

	// identifiers

	private GoVariableName parseIdent() throws GoParseException {
		if (!at(IDENT)) {
			throw errorExpected("identifier");
		}
		GoVariableName name = new GoVariableName(tok.getLocation(), tok.getValue());
		next();
		return name;
	}

	private List<GoVariableName> parseIdentList() throws GoParseException {
		List<GoVariableName> names = new ArrayList<>();
		names.add(parseIdent());
		while (at(COMMA)) {
			next();
			names.add(parseIdent());
		}
		return names;
	}

	// types

	private GoType parseType() throws GoParseException {
		GoType type = tryType();
		if (type == null) {
			throw errorExpected("type");
		}
		return type;
	}

	private GoType tryType() throws GoParseException {
		GoToken start = tok;
		switch (tok.getType()) {
			case IDENT:
				return parseTypeName();
			case LBRACK:
				return parseArrayOrSliceType();
			case STRUCT:
				return parseStructType();
			case MUL: {
				next();
				GoType element = parseType();
				return new GoPtrType(from(start), element);
			}
			case FUNC:
				next();
				return parseSignature(start);
			case INTERFACE:
				return parseInterfaceType();
			case MAP:
				return parseMapType();
			case CHAN:
			case ARROW:
				return parseChanType();
			case LPAREN: {
				// the parentheses only group, they are not kept
				next();
				GoType type = parseType();
				expect(RPAREN);
				return type;
			}
			default:
				return null;
		}
	}

	private GoTypeName parseTypeName() throws GoParseException {
		GoToken start = tok;
		String name = parseIdent().getName();
		if (at(PERIOD)) {
			next();
			name += "." + parseIdent().getName();
		}
		return new GoTypeName(from(start), name);
	}

	private GoType parseArrayOrSliceType() throws GoParseException {
		GoToken start = expect(LBRACK);
		if (at(RBRACK)) {
			next();
			GoType element = parseType();
			return new GoSliceType(from(start), element);
		}
		GoExpression length = null;
		if (at(ELLIPSIS)) {
			next();
		} else {
			++exprLev;
			length = parseExpression();
			--exprLev;
		}
		expect(RBRACK);
		GoType element = parseType();
		return new GoArrayType(from(start), length, element);
	}

	private GoMapType parseMapType() throws GoParseException {
		GoToken start = expect(MAP);
		expect(LBRACK);
		GoType key = parseType();
		expect(RBRACK);
		GoType value = parseType();
		return new GoMapType(from(start), key, value);
	}

	private GoChanType parseChanType() throws GoParseException {
		GoToken start = tok;
		GoChanType.Direction direction = GoChanType.Direction.BOTH;
		if (at(CHAN)) {
			next();
			if (at(ARROW)) {
				next();
				direction = GoChanType.Direction.SEND;
			}
		} else {
			expect(ARROW);
			expect(CHAN);
			direction = GoChanType.Direction.RECV;
		}
		GoType element = parseType();
		return new GoChanType(from(start), direction, element);
	}

	private GoStructType parseStructType() throws GoParseException {
		GoToken start = expect(STRUCT);
		expect(LBRACE);
		List<GoStructTypeField> fields = new ArrayList<>();
		while (at(IDENT) || at(MUL) || at(LPAREN)) {
			fields.add(parseFieldDeclaration());
		}
		expect(RBRACE);
		return new GoStructType(from(start), fields);
	}

	private GoStructTypeField parseFieldDeclaration() throws GoParseException {
		GoToken start = tok;
		List<GoVariableName> names = new ArrayList<>();
		GoType type;
		if (at(IDENT)) {
			GoVariableName first = parseIdent();
			if (at(PERIOD) || at(STRING) || at(SEMICOLON) || at(RBRACE)) {
				// embedded type
				String name = first.getName();
				if (at(PERIOD)) {
					next();
					name += "." + parseIdent().getName();
				}
				type = new GoTypeName(from(start), name);
			} else {
				names.add(first);
				while (at(COMMA)) {
					next();
					names.add(parseIdent());
				}
				type = parseType();
			}
		} else if (at(MUL)) {
			next();
			GoTypeName element = parseTypeName();
			type = new GoPtrType(from(start), element);
		} else {
			throw new GoParseException(tok.getLocation(), "cannot parenthesize embedded type");
		}
		String tag = null;
		if (at(STRING)) {
			tag = tok.getValue();
			next();
		}
		GoStructTypeField field = new GoStructTypeField(from(start), names, type, tag);
		expectSemi();
		return field;
	}

	private GoInterfaceType parseInterfaceType() throws GoParseException {
		GoToken start = expect(INTERFACE);
		expect(LBRACE);
		List<GoInterfaceTypeField> fields = new ArrayList<>();
		while (at(IDENT)) {
			GoToken fieldStart = tok;
			GoVariableName name = parseIdent();
			GoInterfaceTypeField field;
			if (at(LPAREN)) {
				GoToken signatureStart = tok;
				GoFunctionType signature = parseSignature(signatureStart);
				field = new GoInterfaceTypeField(from(fieldStart), name.getName(), signature);
			} else {
				String typeName = name.getName();
				if (at(PERIOD)) {
					next();
					typeName += "." + parseIdent().getName();
				}
				field = new GoInterfaceTypeField(from(fieldStart), null, new GoTypeName(from(fieldStart), typeName));
			}
			fields.add(field);
			expectSemi();
		}
		expect(RBRACE);
		return new GoInterfaceType(from(start), fields);
	}

	private GoFunctionType parseSignature(GoToken start) throws GoParseException {
		List<GoFunctionParameter> parameters = parseParameters(true);
		List<GoFunctionParameter> results = parseResults();
		return new GoFunctionType(from(start), parameters, results);
	}

	private List<GoFunctionParameter> parseResults() throws GoParseException {
		if (at(LPAREN)) {
			return parseParameters(false);
		}
		GoType type = tryType();
		if (type == null) {
			return new ArrayList<>();
		}
		List<GoFunctionParameter> results = new ArrayList<>();
		results.add(new GoFunctionParameter(type.getLocation(), new ArrayList<>(), type, false));
		return results;
	}

	private List<GoFunctionParameter> parseParameters(boolean ellipsisOk) throws GoParseException {
		expect(LPAREN);
		List<GoFunctionParameter> parameters = new ArrayList<>();
		if (!at(RPAREN)) {
			parameters = parseParameterList(ellipsisOk);
		}
		expect(RPAREN);
		return parameters;
	}

	private VarType tryVarType(boolean ellipsisOk) throws GoParseException {
		if (ellipsisOk && at(ELLIPSIS)) {
			GoToken start = tok;
			next();
			GoType type = tryType();
			if (type == null) {
				throw new GoParseException(start.getLocation(), "'...' parameter is missing type");
			}
			return new VarType(type, true, from(start));
		}
		GoType type = tryType();
		return type == null ? null : new VarType(type, false, type.getLocation());
	}

	private VarType parseVarType(boolean ellipsisOk) throws GoParseException {
		VarType type = tryVarType(ellipsisOk);
		if (type == null) {
			throw errorExpected("type");
		}
		return type;
	}

	private List<GoFunctionParameter> parseParameterList(boolean ellipsisOk) throws GoParseException {
		// a list of types, or of identifiers if a type follows
		List<VarType> list = new ArrayList<>();
		while (true) {
			list.add(parseVarType(ellipsisOk));
			if (!at(COMMA)) {
				break;
			}
			next();
			if (at(RPAREN)) {
				break;
			}
		}

		List<GoFunctionParameter> parameters = new ArrayList<>();
		VarType type = tryVarType(ellipsisOk);
		if (type == null) {
			for (VarType t : list) {
				parameters.add(new GoFunctionParameter(t.location, new ArrayList<>(), t.type, t.variadic));
			}
			return parameters;
		}

		List<GoVariableName> names = new ArrayList<>();
		for (VarType t : list) {
			if (t.variadic || !(t.type instanceof GoTypeName) || ((GoTypeName) t.type).getName().contains(".")) {
				throw new GoParseException(t.location, "expected identifier");
			}
			names.add(new GoVariableName(t.location, ((GoTypeName) t.type).getName()));
		}
		parameters.add(new GoFunctionParameter(
				names.get(0).getLocation().combine(previous.getLocation()), names, type.type, type.variadic));
		if (!atComma("parameter list", RPAREN)) {
			return parameters;
		}
		next();
		while (!at(RPAREN) && !at(EOF)) {
			GoToken start = tok;
			List<GoVariableName> group = parseIdentList();
			VarType groupType = parseVarType(ellipsisOk);
			parameters.add(new GoFunctionParameter(from(start), group, groupType.type, groupType.variadic));
			if (!atComma("parameter list", RPAREN)) {
				break;
			}
			next();
		}
		return parameters;
	}

	// statements

	private GoBlock parseBlock() throws GoParseException {
		GoToken lbrace = expect(LBRACE);
		List<GoStatement> statements = parseStatementList();
		expect(RBRACE);
		return new GoBlock(from(lbrace), statements);
	}

	private List<GoStatement> parseStatementList() throws GoParseException {
		List<GoStatement> statements = new ArrayList<>();
		while (!at(CASE) && !at(DEFAULT) && !at(RBRACE) && !at(EOF)) {
			GoStatement statement = parseStatement();
			if (!(statement instanceof GoEmptyStatement)) {
				statements.add(statement);
			}
		}
		return statements;
	}

	private GoStatement parseStatement() throws GoParseException {
		switch (tok.getType()) {
			case CONST:
			case VAR: {
				GoDeclaration declaration = parseValueDeclaration();
				return new GoDeclarationStatement(declaration.getLocation(), declaration);
			}
			case TYPE: {
				GoDeclaration declaration = parseTypeDeclaration();
				return new GoDeclarationStatement(declaration.getLocation(), declaration);
			}
			case IDENT:
			case INT:
			case FLOAT:
			case IMAG:
			case CHAR:
			case STRING:
			case FUNC:
			case LPAREN:
			case LBRACK:
			case STRUCT:
			case MAP:
			case CHAN:
			case INTERFACE:
			case ADD:
			case SUB:
			case MUL:
			case AND:
			case XOR:
			case ARROW:
			case NOT: {
				GoStatement statement = parseSimpleStatement(SimpleStatementMode.LABEL_OK).statement;
				if (!(statement instanceof GoLabeledStatement)) {
					expectSemi();
				}
				return statement;
			}
			case GO:
			case DEFER:
				return parseCallStatement();
			case RETURN:
				return parseReturn();
			case BREAK:
			case CONTINUE:
			case GOTO:
			case FALLTHROUGH:
				return parseBranch();
			case LBRACE: {
				GoBlock block = parseBlock();
				expectSemi();
				return block;
			}
			case IF:
				return parseIf();
			case SWITCH:
				return parseSwitch();
			case SELECT:
				return parseSelect();
			case FOR:
				return parseFor();
			case SEMICOLON: {
				GoStatement statement = new GoEmptyStatement(tok.getLocation());
				next();
				return statement;
			}
			case RBRACE:
				// the empty statement a label may stand before at the end of a block
				return new GoEmptyStatement(tok.getLocation());
			default:
				throw errorExpected("statement");
		}
	}

	private SimpleStatement parseSimpleStatement(SimpleStatementMode mode) throws GoParseException {
		GoToken start = tok;
		List<GoExpression> lhs = parseExpressionList();

		if (tok.getType().isAssignmentOperator()) {
			GoAssignmentStatement.Operator operator = assignmentOperator(tok.getType());
			next();
			if (mode == SimpleStatementMode.RANGE_OK && at(RANGE) &&
					(operator == GoAssignmentStatement.Operator.DEFINE ||
							operator == GoAssignmentStatement.Operator.ASSIGN)) {
				next();
				GoExpression expression = parseExpression();
				return new SimpleStatement(null, new RangeClause(start, lhs, operator, expression));
			}
			List<GoExpression> rhs = parseExpressionList();
			if (operator == GoAssignmentStatement.Operator.DEFINE) {
				checkDefinitionTargets(lhs);
			}
			return new SimpleStatement(new GoAssignmentStatement(from(start), lhs, operator, rhs), null);
		}

		if (lhs.size() > 1) {
			throw new GoParseException(lhs.get(0).getLocation(), "expected 1 expression");
		}
		GoExpression x = lhs.get(0);
		switch (tok.getType()) {
			case COLON: {
				GoToken colon = tok;
				next();
				if (mode == SimpleStatementMode.LABEL_OK && x instanceof GoVariableName) {
					GoStatement statement = parseStatement();
					return new SimpleStatement(
							new GoLabeledStatement(from(start), ((GoVariableName) x).getName(), statement), null);
				}
				throw new GoParseException(colon.getLocation(), "illegal label declaration");
			}
			case ARROW: {
				next();
				GoExpression value = parseExpression();
				return new SimpleStatement(new GoSend(from(start), x, value), null);
			}
			case INC:
			case DEC: {
				boolean inc = at(INC);
				next();
				return new SimpleStatement(new GoIncDec(from(start), inc, x), null);
			}
			default:
				return new SimpleStatement(new GoExpressionStatement(from(start), x), null);
		}
	}

	private void checkDefinitionTargets(List<GoExpression> lhs) throws GoParseException {
		for (GoExpression e : lhs) {
			if (!(e instanceof GoVariableName)) {
				throw new GoParseException(e.getLocation(), "non-name " + e + " on left side of :=");
			}
		}
	}

	private static GoAssignmentStatement.Operator assignmentOperator(GoTokenType type) {
		switch (type) {
			case ASSIGN:
				return GoAssignmentStatement.Operator.ASSIGN;
			case DEFINE:
				return GoAssignmentStatement.Operator.DEFINE;
			case ADD_ASSIGN:
				return GoAssignmentStatement.Operator.ADD_ASSIGN;
			case SUB_ASSIGN:
				return GoAssignmentStatement.Operator.SUB_ASSIGN;
			case MUL_ASSIGN:
				return GoAssignmentStatement.Operator.MUL_ASSIGN;
			case QUO_ASSIGN:
				return GoAssignmentStatement.Operator.QUO_ASSIGN;
			case REM_ASSIGN:
				return GoAssignmentStatement.Operator.REM_ASSIGN;
			case AND_ASSIGN:
				return GoAssignmentStatement.Operator.AND_ASSIGN;
			case OR_ASSIGN:
				return GoAssignmentStatement.Operator.OR_ASSIGN;
			case XOR_ASSIGN:
				return GoAssignmentStatement.Operator.XOR_ASSIGN;
			case SHL_ASSIGN:
				return GoAssignmentStatement.Operator.SHL_ASSIGN;
			case SHR_ASSIGN:
				return GoAssignmentStatement.Operator.SHR_ASSIGN;
			case AND_NOT_ASSIGN:
				return GoAssignmentStatement.Operator.AND_NOT_ASSIGN;
			default:
				throw new IllegalArgumentException("not an assignment operator: " + type);
		}
	}

	private GoStatement parseCallStatement() throws GoParseException {
		GoToken start = tok;
		boolean defer = at(DEFER);
		next();
		GoExpression call = parseExpression();
		if (!(call instanceof GoCall)) {
			throw new GoParseException(call.getLocation(),
					defer ? "expression in defer must be function call" : "expression in go must be function call");
		}
		GoStatement statement = defer ? new GoDefer(from(start), call) : new GoRoutineStatement(from(start), call);
		expectSemi();
		return statement;
	}

	private GoReturn parseReturn() throws GoParseException {
		GoToken start = expect(RETURN);
		List<GoExpression> values = new ArrayList<>();
		if (!at(SEMICOLON) && !at(RBRACE)) {
			values = parseExpressionList();
		}
		GoReturn statement = new GoReturn(from(start), values);
		expectSemi();
		return statement;
	}

	private GoStatement parseBranch() throws GoParseException {
		GoToken start = tok;
		GoTokenType type = tok.getType();
		next();
		String label = null;
		if (type != FALLTHROUGH && at(IDENT)) {
			label = tok.getValue();
			next();
		}
		GoStatement statement;
		switch (type) {
			case BREAK:
				statement = new GoBreak(from(start), label);
				break;
			case CONTINUE:
				statement = new GoContinue(from(start), label);
				break;
			case GOTO:
				if (label == null) {
					throw errorExpected("identifier");
				}
				statement = new GoTo(from(start), label);
				break;
			default:
				statement = new GoFallthrough(from(start));
				break;
		}
		expectSemi();
		return statement;
	}

	private GoExpression makeExpression(GoStatement statement, String want) throws GoParseException {
		if (statement == null) {
			return null;
		}
		if (statement instanceof GoExpressionStatement) {
			return ((GoExpressionStatement) statement).getExpression();
		}
		throw new GoParseException(statement.getLocation(),
				"expected " + want + ", found simple statement (missing parentheses around composite literal?)");
	}

	private GoIf parseIf() throws GoParseException {
		GoToken start = expect(IF);
		if (at(LBRACE)) {
			throw new GoParseException(tok.getLocation(), "missing condition in if statement");
		}
		int prevLev = exprLev;
		exprLev = -1;
		GoStatement init = null;
		if (!at(SEMICOLON)) {
			init = parseSimpleStatement(SimpleStatementMode.BASIC).statement;
		}
		GoStatement condition;
		if (!at(LBRACE)) {
			expect(SEMICOLON);
			if (at(LBRACE)) {
				throw new GoParseException(tok.getLocation(), "missing condition in if statement");
			}
			condition = parseSimpleStatement(SimpleStatementMode.BASIC).statement;
		} else {
			condition = init;
			init = null;
		}
		exprLev = prevLev;
		GoExpression cond = makeExpression(condition, "boolean expression");

		GoBlock then = parseBlock();
		GoStatement otherwise = null;
		if (at(ELSE)) {
			next();
			if (at(IF)) {
				otherwise = parseIf();
			} else if (at(LBRACE)) {
				otherwise = parseBlock();
			} else {
				throw errorExpected("if statement or block");
			}
		}
		GoIf statement = new GoIf(from(start), init, cond, then, otherwise);
		if (!(otherwise instanceof GoIf)) {
			expectSemi();
		}
		return statement;
	}

	private GoStatement parseFor() throws GoParseException {
		GoToken start = expect(FOR);
		int prevLev = exprLev;
		exprLev = -1;
		GoStatement init = null;
		GoStatement condition = null;
		GoStatement post = null;
		RangeClause range = null;
		if (!at(LBRACE)) {
			if (!at(SEMICOLON)) {
				if (at(RANGE)) {
					GoToken rangeStart = tok;
					next();
					GoExpression expression = parseExpression();
					range = new RangeClause(rangeStart, Collections.emptyList(), null, expression);
				} else {
					SimpleStatement s = parseSimpleStatement(SimpleStatementMode.RANGE_OK);
					range = s.range;
					condition = s.statement;
				}
			}
			if (range == null && at(SEMICOLON)) {
				next();
				init = condition;
				condition = null;
				if (!at(SEMICOLON)) {
					condition = parseSimpleStatement(SimpleStatementMode.BASIC).statement;
				}
				expectSemi();
				if (!at(LBRACE)) {
					post = parseSimpleStatement(SimpleStatementMode.BASIC).statement;
				}
			}
		}
		exprLev = prevLev;
		GoBlock body = parseBlock();
		SourceLocation location = from(start);

		GoStatement statement;
		if (range != null) {
			if (range.lhs.size() > 2) {
				throw new GoParseException(range.lhs.get(0).getLocation(), "expected at most 2 expressions");
			}
			GoExpression key = range.lhs.size() > 0 ? range.lhs.get(0) : null;
			GoExpression value = range.lhs.size() > 1 ? range.lhs.get(1) : null;
			statement = new GoForRange(location, key, value, range.operator, range.expression, body);
		} else {
			statement = new GoFor(location, init, makeExpression(condition, "boolean or range expression"), post, body);
		}
		expectSemi();
		return statement;
	}

	private boolean isTypeSwitchGuard(GoStatement statement) throws GoParseException {
		if (statement instanceof GoExpressionStatement) {
			return isTypeSwitchAssertion(((GoExpressionStatement) statement).getExpression());
		}
		if (statement instanceof GoAssignmentStatement) {
			GoAssignmentStatement assignment = (GoAssignmentStatement) statement;
			if (assignment.getLhs().size() == 1 && assignment.getRhs().size() == 1 &&
					isTypeSwitchAssertion(assignment.getRhs().get(0))) {
				switch (assignment.getOperator()) {
					case ASSIGN:
						throw new GoParseException(statement.getLocation(), "expected ':=', found '='");
					case DEFINE:
						return true;
					default:
						return false;
				}
			}
		}
		return false;
	}

	private static boolean isTypeSwitchAssertion(GoExpression expression) {
		return expression instanceof GoTypeAssertion && ((GoTypeAssertion) expression).getType() == null;
	}

	private GoStatement parseSwitch() throws GoParseException {
		GoToken start = expect(SWITCH);
		int prevLev = exprLev;
		exprLev = -1;
		GoStatement init = null;
		GoStatement tag = null;
		if (!at(LBRACE)) {
			if (!at(SEMICOLON)) {
				tag = parseSimpleStatement(SimpleStatementMode.BASIC).statement;
			}
			if (at(SEMICOLON)) {
				next();
				init = tag;
				tag = null;
				if (!at(LBRACE)) {
					tag = parseSimpleStatement(SimpleStatementMode.BASIC).statement;
				}
			}
		}
		exprLev = prevLev;
		boolean typeSwitch = isTypeSwitchGuard(tag);

		expect(LBRACE);
		List<GoSwitchCase> cases = new ArrayList<>();
		while (at(CASE) || at(DEFAULT)) {
			cases.add(parseCaseClause());
		}
		expect(RBRACE);
		SourceLocation location = from(start);

		GoStatement statement;
		if (typeSwitch) {
			statement = new GoTypeSwitch(location, init, tag, cases);
		} else {
			statement = new GoSwitch(location, init, makeExpression(tag, "switch expression"), cases);
		}
		expectSemi();
		return statement;
	}

	private GoSwitchCase parseCaseClause() throws GoParseException {
		GoToken start = tok;
		List<GoExpression> expressions = null;
		if (at(CASE)) {
			next();
			expressions = parseExpressionList();
		} else {
			expect(DEFAULT);
		}
		expect(COLON);
		List<GoStatement> body = parseStatementList();
		return new GoSwitchCase(from(start), expressions, body);
	}

	private GoSelect parseSelect() throws GoParseException {
		GoToken start = expect(SELECT);
		expect(LBRACE);
		List<GoSelectCase> cases = new ArrayList<>();
		while (at(CASE) || at(DEFAULT)) {
			cases.add(parseCommClause());
		}
		expect(RBRACE);
		GoSelect statement = new GoSelect(from(start), cases);
		expectSemi();
		return statement;
	}

	private GoSelectCase parseCommClause() throws GoParseException {
		GoToken start = tok;
		GoStatement communication = null;
		if (at(CASE)) {
			next();
			GoToken commStart = tok;
			List<GoExpression> lhs = parseExpressionList();
			if (at(ARROW)) {
				if (lhs.size() > 1) {
					throw new GoParseException(lhs.get(0).getLocation(), "expected 1 expression");
				}
				next();
				GoExpression value = parseExpression();
				communication = new GoSend(from(commStart), lhs.get(0), value);
			} else if (at(ASSIGN) || at(DEFINE)) {
				if (lhs.size() > 2) {
					throw new GoParseException(lhs.get(0).getLocation(), "expected 1 or 2 expressions");
				}
				GoAssignmentStatement.Operator operator = assignmentOperator(tok.getType());
				next();
				List<GoExpression> rhs = new ArrayList<>();
				rhs.add(parseExpression());
				if (operator == GoAssignmentStatement.Operator.DEFINE) {
					checkDefinitionTargets(lhs);
				}
				communication = new GoAssignmentStatement(from(commStart), lhs, operator, rhs);
			} else {
				if (lhs.size() > 1) {
					throw new GoParseException(lhs.get(0).getLocation(), "expected 1 expression");
				}
				communication = new GoExpressionStatement(from(commStart), lhs.get(0));
			}
		} else {
			expect(DEFAULT);
		}
		expect(COLON);
		List<GoStatement> body = parseStatementList();
		return new GoSelectCase(from(start), communication, body);
	}

	// expressions

	private List<GoExpression> parseExpressionList() throws GoParseException {
		List<GoExpression> list = new ArrayList<>();
		list.add(parseExpression());
		while (at(COMMA)) {
			next();
			list.add(parseExpression());
		}
		return list;
	}

	private GoExpression parseExpression() throws GoParseException {
		return parseBinaryExpression(LOWEST_PRECEDENCE + 1);
	}

	private GoExpression parseBinaryExpression(int minPrecedence) throws GoParseException {
		GoExpression x = parseUnaryExpression();
		while (true) {
			int precedence = tok.getType().precedence();
			if (precedence < minPrecedence) {
				return x;
			}
			GoToken operator = tok;
			next();
			GoExpression y = parseBinaryExpression(precedence + 1);
			boolean lineBreak = y.getLocation().getStartLine() > operator.getLocation().getEndLine();
			x = new GoBinop(x.getLocation().combine(y.getLocation()), binaryOperation(operator.getType()), x, y,
					lineBreak);
		}
	}

	private static GoBinop.Operation binaryOperation(GoTokenType type) {
		switch (type) {
			case LOR:
				return GoBinop.Operation.LOR;
			case LAND:
				return GoBinop.Operation.LAND;
			case EQL:
				return GoBinop.Operation.EQL;
			case NEQ:
				return GoBinop.Operation.NEQ;
			case LSS:
				return GoBinop.Operation.LSS;
			case LEQ:
				return GoBinop.Operation.LEQ;
			case GTR:
				return GoBinop.Operation.GTR;
			case GEQ:
				return GoBinop.Operation.GEQ;
			case ADD:
				return GoBinop.Operation.ADD;
			case SUB:
				return GoBinop.Operation.SUB;
			case OR:
				return GoBinop.Operation.OR;
			case XOR:
				return GoBinop.Operation.XOR;
			case MUL:
				return GoBinop.Operation.MUL;
			case QUO:
				return GoBinop.Operation.QUO;
			case REM:
				return GoBinop.Operation.REM;
			case SHL:
				return GoBinop.Operation.SHL;
			case SHR:
				return GoBinop.Operation.SHR;
			case AND:
				return GoBinop.Operation.AND;
			case AND_NOT:
				return GoBinop.Operation.AND_NOT;
			default:
				throw new IllegalArgumentException("not a binary operator: " + type);
		}
	}

	private GoExpression parseUnaryExpression() throws GoParseException {
		GoToken start = tok;
		GoUnary.Operation operation;
		switch (tok.getType()) {
			case ADD:
				operation = GoUnary.Operation.POS;
				break;
			case SUB:
				operation = GoUnary.Operation.NEG;
				break;
			case NOT:
				operation = GoUnary.Operation.NOT;
				break;
			case XOR:
				operation = GoUnary.Operation.COMPLEMENT;
				break;
			case AND:
				operation = GoUnary.Operation.ADDR;
				break;
			case MUL:
				operation = GoUnary.Operation.DEREF;
				break;
			case ARROW: {
				next();
				if (at(CHAN)) {
					// <-chan T
					next();
					GoType element = parseType();
					return new GoChanType(from(start), GoChanType.Direction.RECV, element);
				}
				GoExpression target = parseUnaryExpression();
				return new GoUnary(from(start), GoUnary.Operation.RECV, target);
			}
			default:
				return parsePrimaryExpression();
		}
		next();
		GoExpression target = parseUnaryExpression();
		return new GoUnary(from(start), operation, target);
	}

	private GoExpression parsePrimaryExpression() throws GoParseException {
		GoExpression x = parseOperand();
		while (true) {
			switch (tok.getType()) {
				case PERIOD:
					next();
					if (at(IDENT)) {
						String name = tok.getValue();
						next();
						x = new GoSelectorExpression(from(x), x, name);
					} else if (at(LPAREN)) {
						next();
						GoType type = null;
						if (at(TYPE)) {
							next();
						} else {
							type = parseType();
						}
						expect(RPAREN);
						x = new GoTypeAssertion(from(x), x, type);
					} else {
						throw errorExpected("selector or type assertion");
					}
					break;
				case LBRACK:
					x = parseIndexOrSlice(x);
					break;
				case LPAREN:
					x = parseCall(x);
					break;
				case LBRACE:
					if (isLiteralType(x) && (exprLev >= 0 || !isTypeName(x))) {
						x = parseLiteralValue(x);
						break;
					}
					return x;
				default:
					return x;
			}
		}
	}

	private static boolean isTypeName(GoExpression x) {
		return x instanceof GoVariableName || x instanceof GoTypeName ||
				(x instanceof GoSelectorExpression &&
						((GoSelectorExpression) x).getExpression() instanceof GoVariableName);
	}

	private static boolean isLiteralType(GoExpression x) {
		return isTypeName(x) || x instanceof GoArrayType || x instanceof GoSliceType ||
				x instanceof GoStructType || x instanceof GoMapType;
	}

	private GoExpression parseOperand() throws GoParseException {
		GoToken start = tok;
		switch (tok.getType()) {
			case IDENT:
				return parseIdent();
			case INT:
			case FLOAT:
			case IMAG:
			case CHAR:
			case STRING: {
				GoBasicLiteral literal = new GoBasicLiteral(tok.getLocation(), literalKind(tok.getType()), tok.getValue());
				next();
				return literal;
			}
			case LPAREN: {
				next();
				++exprLev;
				GoExpression inner = parseExpression();
				--exprLev;
				expect(RPAREN);
				return new GoParenthesizedExpression(from(start), inner);
			}
			case FUNC: {
				next();
				GoFunctionType signature = parseSignature(start);
				if (at(LBRACE)) {
					++exprLev;
					GoBlock body = parseBlock();
					--exprLev;
					return new GoAnonymousFunction(from(start), signature, body);
				}
				return signature;
			}
			default: {
				GoType type = tryType();
				if (type != null) {
					return type;
				}
				throw errorExpected("operand");
			}
		}
	}

	private static GoBasicLiteral.Kind literalKind(GoTokenType type) {
		switch (type) {
			case INT:
				return GoBasicLiteral.Kind.INT;
			case FLOAT:
				return GoBasicLiteral.Kind.FLOAT;
			case IMAG:
				return GoBasicLiteral.Kind.IMAG;
			case CHAR:
				return GoBasicLiteral.Kind.CHAR;
			default:
				return GoBasicLiteral.Kind.STRING;
		}
	}

	private GoExpression parseIndexOrSlice(GoExpression x) throws GoParseException {
		expect(LBRACK);
		++exprLev;
		GoExpression[] index = new GoExpression[3];
		int colons = 0;
		if (!at(COLON)) {
			index[0] = parseExpression();
		}
		while (at(COLON) && colons < 2) {
			++colons;
			next();
			if (!at(COLON) && !at(RBRACK) && !at(EOF)) {
				index[colons] = parseExpression();
			}
		}
		--exprLev;
		GoToken rbrack = tok;
		expect(RBRACK);
		if (colons > 0) {
			if (colons == 2) {
				if (index[1] == null) {
					throw new GoParseException(rbrack.getLocation(), "middle index required in 3-index slice");
				}
				if (index[2] == null) {
					throw new GoParseException(rbrack.getLocation(), "final index required in 3-index slice");
				}
			}
			return new GoSliceOperator(from(x), x, index[0], index[1], index[2]);
		}
		if (index[0] == null) {
			throw new GoParseException(rbrack.getLocation(), "expected operand");
		}
		return new GoIndexExpression(from(x), x, index[0]);
	}

	private GoCall parseCall(GoExpression function) throws GoParseException {
		GoToken lparen = expect(LPAREN);
		++exprLev;
		List<GoExpression> arguments = new ArrayList<>();
		List<Boolean> breaks = new ArrayList<>();
		int lastLine = lparen.getLocation().getEndLine();
		boolean ellipsis = false;
		while (!at(RPAREN) && !at(EOF) && !ellipsis) {
			GoExpression argument = parseExpression();
			breaks.add(argument.getLocation().getStartLine() > lastLine);
			arguments.add(argument);
			lastLine = argument.getLocation().getEndLine();
			if (at(ELLIPSIS)) {
				ellipsis = true;
				next();
			}
			if (!atComma("argument list", RPAREN)) {
				break;
			}
			next();
		}
		--exprLev;
		GoToken rparen = expect(RPAREN);
		boolean breakBeforeClose = !arguments.isEmpty() && rparen.getLocation().getStartLine() > lastLine;
		return new GoCall(from(function), function, arguments, ellipsis, new GoLineBreaks(breaks, breakBeforeClose));
	}

	private GoCompositeLiteral parseLiteralValue(GoExpression type) throws GoParseException {
		GoToken lbrace = expect(LBRACE);
		++exprLev;
		List<GoExpression> elements = new ArrayList<>();
		List<Boolean> breaks = new ArrayList<>();
		int lastLine = lbrace.getLocation().getEndLine();
		while (!at(RBRACE) && !at(EOF)) {
			GoExpression element = parseElement();
			breaks.add(element.getLocation().getStartLine() > lastLine);
			elements.add(element);
			lastLine = element.getLocation().getEndLine();
			if (!atComma("composite literal", RBRACE)) {
				break;
			}
			next();
		}
		--exprLev;
		GoToken rbrace = expect(RBRACE);
		boolean breakBeforeClose = !elements.isEmpty() && rbrace.getLocation().getStartLine() > lastLine;
		SourceLocation location = type == null ? from(lbrace) : from(type);
		return new GoCompositeLiteral(location, type, elements, new GoLineBreaks(breaks, breakBeforeClose));
	}

	private GoExpression parseElement() throws GoParseException {
		GoExpression x = parseElementValue();
		if (at(COLON)) {
			next();
			GoExpression value = parseElementValue();
			return new GoKeyValue(x.getLocation().combine(value.getLocation()), x, value);
		}
		return x;
	}

	private GoExpression parseElementValue() throws GoParseException {
		if (at(LBRACE)) {
			return parseLiteralValue(null);
		}
		return parseExpression();
	}

}
