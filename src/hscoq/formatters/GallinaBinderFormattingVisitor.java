package hscoq.formatters;

import hscoq.model.gallina.*;

import java.io.IOException;

public class GallinaBinderFormattingVisitor extends GallinaBinderVisitor<Void, IOException> {

	private final IndentingWriter out;

	public GallinaBinderFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void open(GallinaBinder.Explicitness explicitness) throws IOException {
		out.write(explicitness == GallinaBinder.Explicitness.IMPLICIT ? "{" : "(");
	}

	private void close(GallinaBinder.Explicitness explicitness) throws IOException {
		out.write(explicitness == GallinaBinder.Explicitness.IMPLICIT ? "}" : ")");
	}

	@Override
	public Void visit(GallinaInferredBinder inferredBinder) throws IOException {
		if (inferredBinder.getExplicitness() == GallinaBinder.Explicitness.IMPLICIT) {
			out.write("{");
			inferredBinder.getName().accept(new GallinaNodeFormattingVisitor(out));
			out.write("}");
		} else {
			inferredBinder.getName().accept(new GallinaNodeFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(GallinaTypedBinder typedBinder) throws IOException {
		if (typedBinder.getGeneralizability() == GallinaBinder.Generalizability.GENERALIZABLE) {
			out.write("`");
		}
		open(typedBinder.getExplicitness());
		FormattingTools.writeSpaceSeparated(out, typedBinder.getNames(),
				n -> n.accept(new GallinaNodeFormattingVisitor(out)));
		out.write(" : ");
		typedBinder.getType().accept(new GallinaTermFormattingVisitor(out));
		close(typedBinder.getExplicitness());
		return null;
	}

	@Override
	public Void visit(GallinaLetBinder letBinder) throws IOException {
		out.write("(");
		letBinder.getName().accept(new GallinaNodeFormattingVisitor(out));
		if (letBinder.getType() != null) {
			out.write(" : ");
			letBinder.getType().accept(new GallinaTermFormattingVisitor(out));
		}
		out.write(" := ");
		letBinder.getValue().accept(new GallinaTermFormattingVisitor(out));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GallinaGeneralizedBinder generalizedBinder) throws IOException {
		out.write("`");
		open(generalizedBinder.getExplicitness());
		generalizedBinder.getTerm().accept(new GallinaTermFormattingVisitor(out));
		close(generalizedBinder.getExplicitness());
		return null;
	}

}
