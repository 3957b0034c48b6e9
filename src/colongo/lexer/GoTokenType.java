package colongo.lexer;

import java.util.HashMap;
import java.util.Map;

public enum GoTokenType {
	EOF(""),
	COMMENT(""),

	// literals
	IDENT(""),
	INT(""),
	FLOAT(""),
	IMAG(""),
	CHAR(""),
	STRING(""),

	// operators and delimiters
	ADD("+"),
	SUB("-"),
	MUL("*"),
	QUO("/"),
	REM("%"),

	AND("&"),
	OR("|"),
	XOR("^"),
	SHL("<<"),
	SHR(">>"),
	AND_NOT("&^"),

	ADD_ASSIGN("+="),
	SUB_ASSIGN("-="),
	MUL_ASSIGN("*="),
	QUO_ASSIGN("/="),
	REM_ASSIGN("%="),

	AND_ASSIGN("&="),
	OR_ASSIGN("|="),
	XOR_ASSIGN("^="),
	SHL_ASSIGN("<<="),
	SHR_ASSIGN(">>="),
	AND_NOT_ASSIGN("&^="),

	LAND("&&"),
	LOR("||"),
	ARROW("<-"),
	INC("++"),
	DEC("--"),

	EQL("=="),
	LSS("<"),
	GTR(">"),
	ASSIGN("="),
	NOT("!"),

	NEQ("!="),
	LEQ("<="),
	GEQ(">="),
	DEFINE(":="),
	ELLIPSIS("..."),

	LPAREN("("),
	LBRACK("["),
	LBRACE("{"),
	COMMA(","),
	PERIOD("."),

	RPAREN(")"),
	RBRACK("]"),
	RBRACE("}"),
	SEMICOLON(";"),
	COLON(":"),
	TILDE("~"),

	// keywords
	BREAK("break"),
	CASE("case"),
	CHAN("chan"),
	CONST("const"),
	CONTINUE("continue"),

	DEFAULT("default"),
	DEFER("defer"),
	ELSE("else"),
	FALLTHROUGH("fallthrough"),
	FOR("for"),

	FUNC("func"),
	GO("go"),
	GOTO("goto"),
	IF("if"),
	IMPORT("import"),

	INTERFACE("interface"),
	MAP("map"),
	PACKAGE("package"),
	RANGE("range"),
	RETURN("return"),

	SELECT("select"),
	STRUCT("struct"),
	SWITCH("switch"),
	TYPE("type"),
	VAR("var"),
	;

	public static final int LOWEST_PRECEDENCE = 0;
	public static final int UNARY_PRECEDENCE = 6;
	public static final int HIGHEST_PRECEDENCE = 7;

	private static final Map<String, GoTokenType> KEYWORDS = new HashMap<>();
	static {
		for (GoTokenType t : values()) {
			if (t.isKeyword()) {
				KEYWORDS.put(t.text, t);
			}
		}
	}

	private final String text;

	GoTokenType(String text) {
		this.text = text;
	}

	/**
	 * @return the fixed spelling of operators and keywords, empty for literal kinds
	 */
	public String getText() {
		return text;
	}

	public boolean isKeyword() {
		return compareTo(BREAK) >= 0;
	}

	public boolean isLiteral() {
		return compareTo(IDENT) >= 0 && compareTo(STRING) <= 0;
	}

	/**
	 * @return the binary operator precedence, or {@link #LOWEST_PRECEDENCE} for tokens that are not binary operators
	 */
	public int precedence() {
		switch (this) {
			case LOR:
				return 1;
			case LAND:
				return 2;
			case EQL:
			case NEQ:
			case LSS:
			case LEQ:
			case GTR:
			case GEQ:
				return 3;
			case ADD:
			case SUB:
			case OR:
			case XOR:
				return 4;
			case MUL:
			case QUO:
			case REM:
			case SHL:
			case SHR:
			case AND:
			case AND_NOT:
				return 5;
			default:
				return LOWEST_PRECEDENCE;
		}
	}

	public boolean isAssignmentOperator() {
		switch (this) {
			case ASSIGN:
			case DEFINE:
			case ADD_ASSIGN:
			case SUB_ASSIGN:
			case MUL_ASSIGN:
			case QUO_ASSIGN:
			case REM_ASSIGN:
			case AND_ASSIGN:
			case OR_ASSIGN:
			case XOR_ASSIGN:
			case SHL_ASSIGN:
			case SHR_ASSIGN:
			case AND_NOT_ASSIGN:
				return true;
			default:
				return false;
		}
	}

	public static GoTokenType lookupIdentifier(String ident) {
		return KEYWORDS.getOrDefault(ident, IDENT);
	}

	/**
	 * @return how the token reads in an error message
	 */
	public String describe() {
		switch (this) {
			case EOF:
				return "EOF";
			case COMMENT:
				return "comment";
			case IDENT:
				return "identifier";
			case INT:
			case FLOAT:
			case IMAG:
			case CHAR:
			case STRING:
				return "literal";
			default:
				return "'" + text + "'";
		}
	}
}
