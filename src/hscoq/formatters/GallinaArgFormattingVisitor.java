package hscoq.formatters;

import hscoq.model.gallina.GallinaArgVisitor;
import hscoq.model.gallina.GallinaNamedArg;
import hscoq.model.gallina.GallinaPositionalArg;

import java.io.IOException;

public class GallinaArgFormattingVisitor extends GallinaArgVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final int precedence;

	public GallinaArgFormattingVisitor(IndentingWriter out, int precedence) {
		this.out = out;
		this.precedence = precedence;
	}

	@Override
	public Void visit(GallinaPositionalArg positionalArg) throws IOException {
		positionalArg.getTerm().accept(new GallinaTermFormattingVisitor(out, precedence));
		return null;
	}

	@Override
	public Void visit(GallinaNamedArg namedArg) throws IOException {
		out.write("(");
		out.write(namedArg.getName());
		out.write(" := ");
		namedArg.getValue().accept(new GallinaTermFormattingVisitor(out));
		out.write(")");
		return null;
	}

}
