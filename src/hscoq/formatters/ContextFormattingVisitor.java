package hscoq.formatters;

import hscoq.errors.ContextVisitor;
import hscoq.trans.WhileConvertingDeclaration;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileConvertingDeclaration whileConvertingDeclaration) throws IOException {
		out.write("while converting declaration ");
		out.write(whileConvertingDeclaration.getDeclarationName());
		return null;
	}

}
