package hscoq.formatters;

import hscoq.model.gallina.*;

import java.io.IOException;
import java.util.List;

public class GallinaSentenceFormattingVisitor extends GallinaSentenceVisitor<Void, IOException> {

	private final IndentingWriter out;

	public GallinaSentenceFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeBinders(List<GallinaBinder> binders) throws IOException {
		FormattingTools.writeSpacePrefixed(out, binders, b -> b.accept(new GallinaBinderFormattingVisitor(out)));
	}

	private void writeTerm(GallinaTerm term) throws IOException {
		term.accept(new GallinaTermFormattingVisitor(out));
	}

	// writes the term on its own line, indented once
	private void writeIndentedBody(GallinaTerm body) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			writeTerm(body);
		}
	}

	private void writeNotations(List<GallinaNotationBinding> notations) throws IOException {
		boolean first = true;
		for (GallinaNotationBinding notation : notations) {
			out.newLine();
			out.write(first ? "where " : "and ");
			notation.accept(new GallinaNodeFormattingVisitor(out));
			first = false;
		}
	}

	private static String keyword(Enum<?> value) {
		String name = value.name().toLowerCase();
		return Character.toUpperCase(name.charAt(0)) + name.substring(1);
	}

	@Override
	public Void visit(GallinaAssumption assumption) throws IOException {
		out.write(keyword(assumption.getKeyword()));
		out.write(" ");
		assumption.getAssums().accept(new GallinaNodeFormattingVisitor(out));
		out.write(".");
		return null;
	}

	@Override
	public Void visit(GallinaDefinition definition) throws IOException {
		if (definition.getLocality() == GallinaLocality.LOCAL) {
			out.write("Local ");
		}
		out.write("Definition ");
		writeDefinitionBody(definition.getName(), definition.getBinders(), definition.getType(),
				definition.getBody());
		return null;
	}

	@Override
	public Void visit(GallinaLetDefinition letDefinition) throws IOException {
		out.write("Let ");
		writeDefinitionBody(letDefinition.getName(), letDefinition.getBinders(), letDefinition.getType(),
				letDefinition.getBody());
		return null;
	}

	private void writeDefinitionBody(String name, List<GallinaBinder> binders, GallinaTerm type, GallinaTerm body)
			throws IOException {
		out.write(name);
		writeBinders(binders);
		if (type != null) {
			out.write(" : ");
			writeTerm(type);
		}
		out.write(" :=");
		writeIndentedBody(body);
		out.write(".");
	}

	@Override
	public Void visit(GallinaInductive inductive) throws IOException {
		out.write(inductive.getKind() == GallinaInductive.Kind.INDUCTIVE ? "Inductive " : "CoInductive ");
		boolean first = true;
		for (GallinaInductiveBody body : inductive.getBodies()) {
			if (!first) {
				out.newLine();
				out.write("with ");
			}
			first = false;
			body.accept(new GallinaNodeFormattingVisitor(out));
		}
		writeNotations(inductive.getNotations());
		out.write(".");
		return null;
	}

	@Override
	public Void visit(GallinaFixpoint fixpoint) throws IOException {
		out.write("Fixpoint ");
		boolean first = true;
		for (GallinaFixBody body : fixpoint.getBodies()) {
			if (!first) {
				out.newLine();
				out.write("with ");
			}
			first = false;
			GallinaNodeFormattingVisitor.writeFixBodyHeader(out, body);
			writeIndentedBody(body.getBody());
		}
		writeNotations(fixpoint.getNotations());
		out.write(".");
		return null;
	}

	@Override
	public Void visit(GallinaCoFixpoint coFixpoint) throws IOException {
		out.write("CoFixpoint ");
		boolean first = true;
		for (GallinaCofixBody body : coFixpoint.getBodies()) {
			if (!first) {
				out.newLine();
				out.write("with ");
			}
			first = false;
			GallinaNodeFormattingVisitor.writeCofixBodyHeader(out, body);
			writeIndentedBody(body.getBody());
		}
		writeNotations(coFixpoint.getNotations());
		out.write(".");
		return null;
	}

	@Override
	public Void visit(GallinaAssertion assertion) throws IOException {
		out.write(keyword(assertion.getKeyword()));
		out.write(" ");
		out.write(assertion.getName());
		writeBinders(assertion.getBinders());
		out.write(" : ");
		writeTerm(assertion.getType());
		out.write(".");
		out.newLine();
		assertion.getProof().accept(new GallinaNodeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GallinaClassDefinition classDefinition) throws IOException {
		out.write("Class ");
		out.write(classDefinition.getName());
		writeBinders(classDefinition.getParameters());
		if (classDefinition.getSort() != null) {
			out.write(" : ");
			writeTerm(classDefinition.getSort());
		}
		out.write(" := {");
		writeRecordFields(classDefinition.getFields(), " : ");
		out.write("}.");
		return null;
	}

	@Override
	public Void visit(GallinaInstanceDefinition instanceDefinition) throws IOException {
		out.write("Instance ");
		out.write(instanceDefinition.getName());
		writeBinders(instanceDefinition.getParameters());
		out.write(" : ");
		GallinaTerm classType = instanceDefinition.getClassType();
		if (!(classType instanceof GallinaBang)) {
			classType = new GallinaBang(classType);
		}
		writeTerm(classType);
		out.write(" := {");
		writeRecordFields(instanceDefinition.getFields(), " := ");
		out.write("}.");
		if (instanceDefinition.getProof() != null) {
			out.newLine();
			instanceDefinition.getProof().accept(new GallinaNodeFormattingVisitor(out));
		}
		return null;
	}

	// { f1 sep t1 ; f2 sep t2 }, one field per line
	private void writeRecordFields(List<GallinaRecordField> fields, String separator) throws IOException {
		if (fields.isEmpty()) {
			return;
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			boolean first = true;
			for (GallinaRecordField field : fields) {
				if (!first) {
					out.write(" ;");
				}
				first = false;
				out.newLine();
				out.write(field.getName());
				out.write(separator);
				writeTerm(field.getValue());
			}
		}
		out.write(" ");
	}

	@Override
	public Void visit(GallinaReservedNotation reservedNotation) throws IOException {
		out.write("Reserved Notation \"'");
		out.write(reservedNotation.getName());
		out.write("'\".");
		return null;
	}

	@Override
	public Void visit(GallinaNotation notation) throws IOException {
		out.write("Notation ");
		notation.getBinding().accept(new GallinaNodeFormattingVisitor(out));
		out.write(".");
		return null;
	}

	@Override
	public Void visit(GallinaInfixDefinition infixDefinition) throws IOException {
		out.write("Infix ");
		FormattingTools.writeStringLiteral(out, infixDefinition.getOperator());
		out.write(" := (");
		writeTerm(infixDefinition.getDefinition());
		out.write(") (");
		if (infixDefinition.getAssociativity() != null) {
			switch (infixDefinition.getAssociativity()) {
				case LEFT:
					out.write("left");
					break;
				case RIGHT:
					out.write("right");
					break;
				case NONE:
					out.write("no");
					break;
			}
			out.write(" associativity, ");
		}
		out.write("at level ");
		out.write(Integer.toString(infixDefinition.getLevel()));
		out.write(").");
		return null;
	}

	@Override
	public Void visit(GallinaArguments arguments) throws IOException {
		if (arguments.getLocality() != null) {
			out.write(arguments.getLocality() == GallinaLocality.LOCAL ? "Local " : "Global ");
		}
		out.write("Arguments ");
		arguments.getFunction().accept(new GallinaNodeFormattingVisitor(out));
		FormattingTools.writeSpacePrefixed(out, arguments.getSpecs(),
				s -> s.accept(new GallinaNodeFormattingVisitor(out)));
		out.write(".");
		return null;
	}

	@Override
	public Void visit(GallinaComment comment) throws IOException {
		out.write("(* ");
		out.write(comment.getText().replace("*)", "* )"));
		out.write(" *)");
		return null;
	}

}
