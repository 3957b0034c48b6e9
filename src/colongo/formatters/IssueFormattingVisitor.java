package colongo.formatters;

import colongo.errors.Issue;
import colongo.errors.IssueVisitor;
import colongo.lexer.LexerIssue;
import colongo.trans.IOErrorIssue;
import colongo.trans.passes.desugar.MixedAssignmentIssue;
import colongo.trans.passes.desugar.UnexpectedMarkerIssue;
import colongo.trans.passes.parse.ParsingIssue;
import colongo.trans.passes.parse.option.OptionParserIssue;
import colongo.trans.passes.rewrite.ReservedOperatorIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeLocation(Issue issue) throws IOException {
		if (!issue.getLocation().isUnknown()) {
			out.write(issue.getLocation().prettyString());
			out.write(": ");
		}
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getFile().toString());
		out.write(": ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(LexerIssue lexerIssue) throws IOException {
		writeLocation(lexerIssue);
		out.write(lexerIssue.getDescription());
		return null;
	}

	@Override
	public Void visit(ReservedOperatorIssue reservedOperatorIssue) throws IOException {
		writeLocation(reservedOperatorIssue);
		out.write("reserved operator \":=\" used directly");
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		writeLocation(parsingIssue);
		out.write("error parsing Go: ");
		out.write(parsingIssue.getError().getReason());
		return null;
	}

	@Override
	public Void visit(MixedAssignmentIssue mixedAssignmentIssue) throws IOException {
		writeLocation(mixedAssignmentIssue);
		switch (mixedAssignmentIssue.getPosition()) {
			case INIT_STATEMENT:
				out.write("mixed assignment in init statement");
				break;
			case RANGE:
				out.write("mixed assignment in range");
				break;
		}
		return null;
	}

	@Override
	public Void visit(UnexpectedMarkerIssue unexpectedMarkerIssue) throws IOException {
		writeLocation(unexpectedMarkerIssue);
		out.write("unexpected colon-prefix ");
		out.write(unexpectedMarkerIssue.getName());
		return null;
	}
}
