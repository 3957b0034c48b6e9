package colongo.trans;

import colongo.errors.Issue;
import colongo.errors.IssueVisitor;

import java.io.IOException;
import java.nio.file.Path;

public class IOErrorIssue extends Issue {

	private final Path file;
	private final IOException error;

	public IOErrorIssue(Path file, IOException e) {
		super();
		this.file = file;
		this.error = e;
	}

	public Path getFile() {
		return file;
	}

	public IOException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
