package hscoq.formatters;

import hscoq.model.gallina.*;

import java.io.IOException;

public class GallinaNodeFormattingVisitor extends GallinaNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public GallinaNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(GallinaTerm term) throws IOException {
		term.accept(new GallinaTermFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GallinaArg arg) throws IOException {
		arg.accept(new GallinaArgFormattingVisitor(out, GallinaPrecedence.TOP));
		return null;
	}

	@Override
	public Void visit(GallinaBinder binder) throws IOException {
		binder.accept(new GallinaBinderFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GallinaPattern pattern) throws IOException {
		pattern.accept(new GallinaPatternFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GallinaSentence sentence) throws IOException {
		sentence.accept(new GallinaSentenceFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GallinaName name) throws IOException {
		out.write(name.isUnderscore() ? "_" : name.getIdent());
		return null;
	}

	@Override
	public Void visit(GallinaQualid qualid) throws IOException {
		out.write(String.join(".", qualid.getParts()));
		return null;
	}

	@Override
	public Void visit(GallinaFixBodies fixBodies) throws IOException {
		FormattingTools.writeSeparated(out, fixBodies.getBodies(), " with ", b -> b.accept(this));
		if (fixBodies.getForIdent() != null) {
			out.write(" for ");
			out.write(fixBodies.getForIdent());
		}
		return null;
	}

	@Override
	public Void visit(GallinaCofixBodies cofixBodies) throws IOException {
		FormattingTools.writeSeparated(out, cofixBodies.getBodies(), " with ", b -> b.accept(this));
		if (cofixBodies.getForIdent() != null) {
			out.write(" for ");
			out.write(cofixBodies.getForIdent());
		}
		return null;
	}

	@Override
	public Void visit(GallinaFixBody fixBody) throws IOException {
		writeFixBodyHeader(out, fixBody);
		out.write(" ");
		fixBody.getBody().accept(new GallinaTermFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GallinaCofixBody cofixBody) throws IOException {
		writeCofixBodyHeader(out, cofixBody);
		out.write(" ");
		cofixBody.getBody().accept(new GallinaTermFormattingVisitor(out));
		return null;
	}

	/**
	 * Writes {@code ident binders [{struct ident}] [: type] :=}, shared with the Fixpoint sentence.
	 */
	static void writeFixBodyHeader(IndentingWriter out, GallinaFixBody fixBody) throws IOException {
		out.write(fixBody.getName());
		FormattingTools.writeSpacePrefixed(out, fixBody.getBinders(),
				b -> b.accept(new GallinaBinderFormattingVisitor(out)));
		if (fixBody.getStructArgument() != null) {
			out.write(" {struct ");
			out.write(fixBody.getStructArgument());
			out.write("}");
		}
		if (fixBody.getType() != null) {
			out.write(" : ");
			fixBody.getType().accept(new GallinaTermFormattingVisitor(out));
		}
		out.write(" :=");
	}

	static void writeCofixBodyHeader(IndentingWriter out, GallinaCofixBody cofixBody) throws IOException {
		out.write(cofixBody.getName());
		FormattingTools.writeSpacePrefixed(out, cofixBody.getBinders(),
				b -> b.accept(new GallinaBinderFormattingVisitor(out)));
		if (cofixBody.getType() != null) {
			out.write(" : ");
			cofixBody.getType().accept(new GallinaTermFormattingVisitor(out));
		}
		out.write(" :=");
	}

	@Override
	public Void visit(GallinaMatchItem matchItem) throws IOException {
		matchItem.getScrutinee().accept(new GallinaTermFormattingVisitor(out, GallinaPrecedence.CAST - 1));
		if (matchItem.getAs() != null) {
			out.write(" as ");
			matchItem.getAs().accept(this);
		}
		if (matchItem.getInAnnotation() != null) {
			out.write(" ");
			matchItem.getInAnnotation().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(GallinaInAnnotation inAnnotation) throws IOException {
		out.write("in ");
		inAnnotation.getQualid().accept(this);
		FormattingTools.writeSpacePrefixed(out, inAnnotation.getPatterns(),
				p -> p.accept(new GallinaPatternFormattingVisitor(out, GallinaPrecedence.ARG)));
		return null;
	}

	@Override
	public Void visit(GallinaDepRetType depRetType) throws IOException {
		if (depRetType.getAs() != null) {
			out.write("as ");
			depRetType.getAs().accept(this);
			out.write(" ");
		}
		depRetType.getReturnType().accept(this);
		return null;
	}

	@Override
	public Void visit(GallinaReturnType returnType) throws IOException {
		out.write("return ");
		returnType.getType().accept(new GallinaTermFormattingVisitor(out, GallinaPrecedence.CAST - 1));
		return null;
	}

	@Override
	public Void visit(GallinaEquation equation) throws IOException {
		for (GallinaMultPattern pattern : equation.getPatterns()) {
			out.write("| ");
			pattern.accept(this);
			out.write(" ");
		}
		out.write("=> ");
		equation.getBody().accept(new GallinaTermFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GallinaMultPattern multPattern) throws IOException {
		FormattingTools.writeCommaSeparated(out, multPattern.getPatterns(),
				p -> p.accept(new GallinaPatternFormattingVisitor(out)));
		return null;
	}

	@Override
	public Void visit(GallinaOrPattern orPattern) throws IOException {
		FormattingTools.writeSeparated(out, orPattern.getAlternatives(), " | ",
				p -> p.accept(new GallinaPatternFormattingVisitor(out)));
		return null;
	}

	@Override
	public Void visit(GallinaAssums assums) throws IOException {
		if (assums.isParenthesized()) {
			FormattingTools.writeSpaceSeparated(out, assums.getGroups(), g -> {
				out.write("(");
				g.accept(this);
				out.write(")");
			});
		} else {
			assums.getGroups().get(0).accept(this);
		}
		return null;
	}

	@Override
	public Void visit(GallinaAssumsGroup assumsGroup) throws IOException {
		out.write(String.join(" ", assumsGroup.getNames()));
		out.write(" : ");
		assumsGroup.getType().accept(new GallinaTermFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GallinaInductiveBody inductiveBody) throws IOException {
		out.write(inductiveBody.getName());
		FormattingTools.writeSpacePrefixed(out, inductiveBody.getParameters(),
				b -> b.accept(new GallinaBinderFormattingVisitor(out)));
		out.write(" : ");
		inductiveBody.getType().accept(new GallinaTermFormattingVisitor(out));
		out.write(" :=");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (GallinaConstructor constructor : inductiveBody.getConstructors()) {
				out.newLine();
				constructor.accept(this);
			}
		}
		return null;
	}

	@Override
	public Void visit(GallinaConstructor constructor) throws IOException {
		out.write("| ");
		out.write(constructor.getName());
		FormattingTools.writeSpacePrefixed(out, constructor.getBinders(),
				b -> b.accept(new GallinaBinderFormattingVisitor(out)));
		if (constructor.getType() != null) {
			out.write(" : ");
			constructor.getType().accept(new GallinaTermFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(GallinaProof proof) throws IOException {
		out.write("Proof.");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (String line : proof.getTactics().split("\\R", -1)) {
				out.newLine();
				out.write(line);
			}
		}
		out.newLine();
		switch (proof.getEnding()) {
			case QED:
				out.write("Qed.");
				break;
			case DEFINED:
				out.write("Defined.");
				break;
			case ADMITTED:
				out.write("Admitted.");
				break;
		}
		return null;
	}

	@Override
	public Void visit(GallinaRecordField recordField) throws IOException {
		out.write(recordField.getName());
		out.write(" := ");
		recordField.getValue().accept(new GallinaTermFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GallinaNotationBinding notationBinding) throws IOException {
		out.write("\"'");
		out.write(notationBinding.getName());
		out.write("'\" := (");
		notationBinding.getValue().accept(new GallinaTermFormattingVisitor(out));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GallinaArgumentSpec argumentSpec) throws IOException {
		switch (argumentSpec.getExplicitness()) {
			case EXPLICIT:
				argumentSpec.getName().accept(this);
				break;
			case IMPLICIT:
				out.write("[");
				argumentSpec.getName().accept(this);
				out.write("]");
				break;
			case MAXIMAL:
				out.write("{");
				argumentSpec.getName().accept(this);
				out.write("}");
				break;
		}
		if (argumentSpec.getScope() != null) {
			out.write("%");
			out.write(argumentSpec.getScope());
		}
		return null;
	}

}
