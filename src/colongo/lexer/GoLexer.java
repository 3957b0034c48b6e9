package colongo.lexer;

import colongo.errors.IssueContext;
import colongo.util.SourceFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Go source text into tokens, inserting the semicolons Go's grammar expects at line ends.
 *
 * The scanned text may differ from the text in the {@link SourceFile} (when it was rewritten); token
 * offsets refer to the scanned text, token locations to the source file.
 */
public class GoLexer {

	private final SourceFile file;
	private final CharSequence text;
	private final boolean keepComments;

	private int pos = 0;
	private boolean insertSemicolon = false;

	public GoLexer(SourceFile file, CharSequence text, boolean keepComments) {
		this.file = file;
		this.text = text;
		this.keepComments = keepComments;
	}

	public GoLexer(SourceFile file, boolean keepComments) {
		this(file, file.getText(), keepComments);
	}

	public List<GoToken> readTokens(IssueContext ctx) {
		List<GoToken> tokens = new ArrayList<>();
		// a byte order mark is only allowed as the very first character
		if (pos == 0 && text.length() > 0 && text.charAt(0) == '\uFEFF') {
			pos = 1;
		}
		while (true) {
			GoToken token = scan(ctx);
			if (token.getType() != GoTokenType.COMMENT || keepComments) {
				tokens.add(token);
			}
			if (token.getType() == GoTokenType.EOF) {
				return tokens;
			}
		}
	}

	private GoToken token(GoTokenType type, int start, int end) {
		return new GoToken(text.subSequence(start, end).toString(), type, start, end, file.locate(start, end));
	}

	private char peek(int ahead) {
		int i = pos + ahead;
		return i < text.length() ? text.charAt(i) : '\0';
	}

	private boolean atEnd() {
		return pos >= text.length();
	}

	private void error(IssueContext ctx, int start, int end, String description) {
		ctx.error(new LexerIssue(file.locate(start, end), description));
	}

	private GoToken scan(IssueContext ctx) {
		while (true) {
			// skip whitespace, stopping at newlines that end a statement
			while (!atEnd()) {
				char c = text.charAt(pos);
				if (c == '\n' && insertSemicolon) {
					break;
				}
				if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
					break;
				}
				++pos;
			}
			int start = pos;
			if (atEnd()) {
				if (insertSemicolon) {
					insertSemicolon = false;
					return new GoToken("\n", GoTokenType.SEMICOLON, start, start, file.locate(start, start));
				}
				return new GoToken("", GoTokenType.EOF, start, start, file.locate(start, start));
			}
			char c = text.charAt(pos);
			if (c == '\n') {
				insertSemicolon = false;
				++pos;
				return new GoToken("\n", GoTokenType.SEMICOLON, start, start + 1, file.locate(start, start + 1));
			}
			if (c == '/' && (peek(1) == '/' || peek(1) == '*')) {
				if (insertSemicolon && commentReachesLineEnd()) {
					// the comment stands in for the newline that ends the statement
					insertSemicolon = false;
					return new GoToken("\n", GoTokenType.SEMICOLON, start, start, file.locate(start, start));
				}
				GoToken comment = scanComment(ctx);
				if (comment == null) {
					continue;
				}
				return comment;
			}
			GoToken result = scanToken(ctx, c);
			if (result == null) {
				continue;
			}
			return result;
		}
	}

	/**
	 * @return whether the comment starting at pos is followed by nothing but whitespace up to the next
	 * newline or the end of the text, or contains a newline itself
	 */
	private boolean commentReachesLineEnd() {
		int i = pos;
		while (i < text.length()) {
			if (text.charAt(i) == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
				return true;
			}
			if (text.charAt(i) == '/' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
				i += 2;
				boolean closed = false;
				while (i < text.length()) {
					char c = text.charAt(i);
					if (c == '\n') {
						return true;
					}
					if (c == '*' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
						i += 2;
						closed = true;
						break;
					}
					++i;
				}
				if (!closed) {
					return true;
				}
				while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t' || text.charAt(i) == '\r')) {
					++i;
				}
				if (i >= text.length() || text.charAt(i) == '\n') {
					return true;
				}
				continue;
			}
			return false;
		}
		return true;
	}

	private GoToken scanComment(IssueContext ctx) {
		int start = pos;
		if (peek(1) == '/') {
			while (!atEnd() && text.charAt(pos) != '\n') {
				++pos;
			}
			int end = pos;
			// a carriage return before the newline is not part of the comment
			if (end > start && text.charAt(end - 1) == '\r') {
				--end;
			}
			return token(GoTokenType.COMMENT, start, end);
		}
		pos += 2;
		while (!atEnd()) {
			if (text.charAt(pos) == '*' && peek(1) == '/') {
				pos += 2;
				return token(GoTokenType.COMMENT, start, pos);
			}
			++pos;
		}
		error(ctx, start, pos, "comment not terminated");
		return token(GoTokenType.COMMENT, start, pos);
	}

	private static boolean isLetter(int cp) {
		return cp == '_' || Character.isLetter(cp);
	}

	private static boolean isDigit(int cp) {
		return Character.isDigit(cp);
	}

	private GoToken scanToken(IssueContext ctx, char c) {
		int start = pos;
		int cp = Character.codePointAt(text, pos);
		if (isLetter(cp)) {
			while (!atEnd()) {
				int next = Character.codePointAt(text, pos);
				if (!isLetter(next) && !isDigit(next)) {
					break;
				}
				pos += Character.charCount(next);
			}
			String ident = text.subSequence(start, pos).toString();
			GoTokenType type = GoTokenType.lookupIdentifier(ident);
			switch (type) {
				case IDENT:
				case BREAK:
				case CONTINUE:
				case FALLTHROUGH:
				case RETURN:
					insertSemicolon = true;
					break;
				default:
					insertSemicolon = false;
			}
			return token(type, start, pos);
		}
		if ((c >= '0' && c <= '9') || (c == '.' && peek(1) >= '0' && peek(1) <= '9')) {
			insertSemicolon = true;
			return scanNumber(start);
		}
		switch (c) {
			case '"':
				insertSemicolon = true;
				return scanString(ctx, start);
			case '`':
				insertSemicolon = true;
				return scanRawString(ctx, start);
			case '\'':
				insertSemicolon = true;
				return scanRune(ctx, start);
			default:
				break;
		}
		GoTokenType type = scanOperator(c);
		if (type == null) {
			pos += Character.charCount(cp);
			error(ctx, start, pos, "illegal character " + String.format("U+%04X", cp));
			return null;
		}
		switch (type) {
			case RPAREN:
			case RBRACK:
			case RBRACE:
			case INC:
			case DEC:
				insertSemicolon = true;
				break;
			default:
				insertSemicolon = false;
		}
		return token(type, start, pos);
	}

	private boolean scanDigits(int base) {
		boolean any = false;
		while (!atEnd()) {
			char c = text.charAt(pos);
			if (c == '_' || Character.digit(c, base) >= 0) {
				any = true;
				++pos;
			} else {
				break;
			}
		}
		return any;
	}

	private GoToken scanNumber(int start) {
		GoTokenType type = GoTokenType.INT;
		char c = text.charAt(pos);
		if (c == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
			pos += 2;
			scanDigits(16);
			if (!atEnd() && text.charAt(pos) == '.') {
				type = GoTokenType.FLOAT;
				++pos;
				scanDigits(16);
			}
			if (!atEnd() && (text.charAt(pos) == 'p' || text.charAt(pos) == 'P')) {
				type = GoTokenType.FLOAT;
				++pos;
				if (!atEnd() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
					++pos;
				}
				scanDigits(10);
			}
		} else if (c == '0' && (peek(1) == 'b' || peek(1) == 'B')) {
			pos += 2;
			scanDigits(2);
		} else if (c == '0' && (peek(1) == 'o' || peek(1) == 'O')) {
			pos += 2;
			scanDigits(8);
		} else {
			scanDigits(10);
			if (!atEnd() && text.charAt(pos) == '.') {
				type = GoTokenType.FLOAT;
				++pos;
				scanDigits(10);
			}
			if (!atEnd() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
				type = GoTokenType.FLOAT;
				++pos;
				if (!atEnd() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
					++pos;
				}
				scanDigits(10);
			}
		}
		if (!atEnd() && text.charAt(pos) == 'i') {
			type = GoTokenType.IMAG;
			++pos;
		}
		return token(type, start, pos);
	}

	private GoToken scanString(IssueContext ctx, int start) {
		++pos;
		while (true) {
			if (atEnd() || text.charAt(pos) == '\n') {
				error(ctx, start, pos, "string literal not terminated");
				break;
			}
			char c = text.charAt(pos);
			++pos;
			if (c == '"') {
				break;
			}
			if (c == '\\' && !atEnd() && text.charAt(pos) != '\n') {
				++pos;
			}
		}
		return token(GoTokenType.STRING, start, pos);
	}

	private GoToken scanRawString(IssueContext ctx, int start) {
		++pos;
		while (true) {
			if (atEnd()) {
				error(ctx, start, pos, "raw string literal not terminated");
				break;
			}
			char c = text.charAt(pos);
			++pos;
			if (c == '`') {
				break;
			}
		}
		return token(GoTokenType.STRING, start, pos);
	}

	private GoToken scanRune(IssueContext ctx, int start) {
		++pos;
		int count = 0;
		while (true) {
			if (atEnd() || text.charAt(pos) == '\n') {
				error(ctx, start, pos, "rune literal not terminated");
				return token(GoTokenType.CHAR, start, pos);
			}
			char c = text.charAt(pos);
			++pos;
			if (c == '\'') {
				break;
			}
			++count;
			if (c == '\\' && !atEnd() && text.charAt(pos) != '\n') {
				++pos;
			}
		}
		if (count == 0) {
			error(ctx, start, pos, "empty rune literal or unescaped ' in rune literal");
		}
		return token(GoTokenType.CHAR, start, pos);
	}

	private boolean accept(char c) {
		if (!atEnd() && text.charAt(pos) == c) {
			++pos;
			return true;
		}
		return false;
	}

	private GoTokenType scanOperator(char c) {
		++pos;
		switch (c) {
			case '+':
				if (accept('+')) return GoTokenType.INC;
				if (accept('=')) return GoTokenType.ADD_ASSIGN;
				return GoTokenType.ADD;
			case '-':
				if (accept('-')) return GoTokenType.DEC;
				if (accept('=')) return GoTokenType.SUB_ASSIGN;
				return GoTokenType.SUB;
			case '*':
				if (accept('=')) return GoTokenType.MUL_ASSIGN;
				return GoTokenType.MUL;
			case '/':
				if (accept('=')) return GoTokenType.QUO_ASSIGN;
				return GoTokenType.QUO;
			case '%':
				if (accept('=')) return GoTokenType.REM_ASSIGN;
				return GoTokenType.REM;
			case '&':
				if (accept('^')) {
					if (accept('=')) return GoTokenType.AND_NOT_ASSIGN;
					return GoTokenType.AND_NOT;
				}
				if (accept('&')) return GoTokenType.LAND;
				if (accept('=')) return GoTokenType.AND_ASSIGN;
				return GoTokenType.AND;
			case '|':
				if (accept('|')) return GoTokenType.LOR;
				if (accept('=')) return GoTokenType.OR_ASSIGN;
				return GoTokenType.OR;
			case '^':
				if (accept('=')) return GoTokenType.XOR_ASSIGN;
				return GoTokenType.XOR;
			case '<':
				if (accept('-')) return GoTokenType.ARROW;
				if (accept('<')) {
					if (accept('=')) return GoTokenType.SHL_ASSIGN;
					return GoTokenType.SHL;
				}
				if (accept('=')) return GoTokenType.LEQ;
				return GoTokenType.LSS;
			case '>':
				if (accept('>')) {
					if (accept('=')) return GoTokenType.SHR_ASSIGN;
					return GoTokenType.SHR;
				}
				if (accept('=')) return GoTokenType.GEQ;
				return GoTokenType.GTR;
			case '=':
				if (accept('=')) return GoTokenType.EQL;
				return GoTokenType.ASSIGN;
			case '!':
				if (accept('=')) return GoTokenType.NEQ;
				return GoTokenType.NOT;
			case ':':
				if (accept('=')) return GoTokenType.DEFINE;
				return GoTokenType.COLON;
			case '.':
				if (peek(0) == '.' && peek(1) == '.') {
					pos += 2;
					return GoTokenType.ELLIPSIS;
				}
				return GoTokenType.PERIOD;
			case ',':
				return GoTokenType.COMMA;
			case ';':
				return GoTokenType.SEMICOLON;
			case '(':
				return GoTokenType.LPAREN;
			case ')':
				return GoTokenType.RPAREN;
			case '[':
				return GoTokenType.LBRACK;
			case ']':
				return GoTokenType.RBRACK;
			case '{':
				return GoTokenType.LBRACE;
			case '}':
				return GoTokenType.RBRACE;
			case '~':
				return GoTokenType.TILDE;
			default:
				--pos;
				return null;
		}
	}

}
