package colongo.trans.passes.rewrite;

import colongo.errors.IssueContext;
import colongo.lexer.GoLexer;
import colongo.lexer.GoToken;
import colongo.lexer.GoTokenType;
import colongo.util.OffsetMap;
import colongo.util.SourceFile;

import java.util.List;

/**
 * Turns colon-prefixed names into identifiers a plain Go parser accepts.
 *
 * A marker is the token sequence COLON IDENT (ASSIGN | COMMA) where the colon touches the
 * identifier. The colon is replaced by a space and the declaration tag, so ":n, err = f()"
 * becomes " TAGn, err = f()". Colons after labels, case clauses and keys in composite literals
 * are expected to be followed by whitespace and are left alone; a key written as "{a:b, c}"
 * is encoded as well and then fails to parse.
 *
 * A type switch guard must be written with ":=", so when a marked name is directly followed by
 * "=" the operator becomes ":=", unless a comma precedes the marker: "x, :y = f()" keeps "=",
 * since ":=" does not allow a non-name on its left.
 *
 * ":=" itself may not appear in the input at all.
 */
public class MarkerRewritingPass {
	private MarkerRewritingPass() {}

	/**
	 * @return the rewritten text, or null if any issue was found
	 */
	public static RewrittenSource perform(IssueContext ctx, SourceFile file, String declarationTag) {
		List<GoToken> tokens = new GoLexer(file, false).readTokens(ctx);
		String text = file.getText();
		StringBuilder out = new StringBuilder(text.length());
		OffsetMap offsetMap = new OffsetMap();
		int low = 0;
		// the last four tokens, indexed by position modulo 4
		GoToken[] window = new GoToken[4];
		for (int i = 0; i < tokens.size(); ++i) {
			GoToken token = tokens.get(i);
			window[i % 4] = token;
			if (token.getType() == GoTokenType.EOF) {
				break;
			}
			if (token.getType() == GoTokenType.DEFINE) {
				ctx.error(new ReservedOperatorIssue(token.getLocation()));
				continue;
			}
			if (i < 2 || token.getType() != GoTokenType.ASSIGN && token.getType() != GoTokenType.COMMA) {
				continue;
			}
			GoToken ident = window[(i - 1) % 4];
			GoToken colon = window[(i - 2) % 4];
			if (ident.getType() != GoTokenType.IDENT || colon.getType() != GoTokenType.COLON ||
					ident.getValue().equals("_") || colon.getOffset() + 1 != ident.getOffset()) {
				continue;
			}
			out.append(text, low, colon.getOffset());
			// " TAG" takes the colon's place; the tag's last character is the one mapped to the
			// colon, so the encoded identifier starts inside the insertion and is located at the colon
			offsetMap.recordInsertion(out.length(), declarationTag.length());
			out.append(' ');
			out.append(declarationTag);
			out.append(text, ident.getOffset(), token.getOffset());
			low = token.getOffset();
			if (token.getType() == GoTokenType.ASSIGN &&
					(i < 3 || window[(i - 3) % 4].getType() != GoTokenType.COMMA)) {
				offsetMap.recordInsertion(out.length(), 1);
				out.append(':');
			}
		}
		out.append(text, low, text.length());
		if (ctx.hasErrors()) {
			return null;
		}
		return new RewrittenSource(out.toString(), offsetMap);
	}

}
