package colongo.errors;

import colongo.lexer.LexerIssue;
import colongo.trans.IOErrorIssue;
import colongo.trans.passes.desugar.MixedAssignmentIssue;
import colongo.trans.passes.desugar.UnexpectedMarkerIssue;
import colongo.trans.passes.parse.ParsingIssue;
import colongo.trans.passes.parse.option.OptionParserIssue;
import colongo.trans.passes.rewrite.ReservedOperatorIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(LexerIssue lexerIssue) throws E;
	public abstract T visit(ReservedOperatorIssue reservedOperatorIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(MixedAssignmentIssue mixedAssignmentIssue) throws E;
	public abstract T visit(UnexpectedMarkerIssue unexpectedMarkerIssue) throws E;
}
