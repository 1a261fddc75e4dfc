package hscoq.formatters;

import hscoq.model.gallina.*;

import java.io.IOException;
import java.util.List;

/**
 * Renders a term so that it reparses to the same tree when written in a position that accepts terms up to
 * {@code precedence}, inserting the fewest parentheses the precedence table allows.
 */
public class GallinaTermFormattingVisitor extends GallinaTermVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final int precedence;

	public GallinaTermFormattingVisitor(IndentingWriter out) {
		this(out, GallinaPrecedence.TOP);
	}

	public GallinaTermFormattingVisitor(IndentingWriter out, int precedence) {
		this.out = out;
		this.precedence = precedence;
	}

	private void format(GallinaTerm term, int precedence) throws IOException {
		term.accept(new GallinaTermFormattingVisitor(out, precedence));
	}

	private void open(int level) throws IOException {
		if (GallinaPrecedence.needsParentheses(level, precedence)) {
			out.write("(");
		}
	}

	private void close(int level) throws IOException {
		if (GallinaPrecedence.needsParentheses(level, precedence)) {
			out.write(")");
		}
	}

	private void writeBinders(List<GallinaBinder> binders) throws IOException {
		FormattingTools.writeSpacePrefixed(out, binders, b -> b.accept(new GallinaBinderFormattingVisitor(out)));
	}

	private void writeTypeAnnotation(GallinaTerm type) throws IOException {
		if (type != null) {
			out.write(" : ");
			format(type, GallinaPrecedence.TOP);
		}
	}

	// writes "in" followed by the body on its own line, aligned with the start of the let
	private void writeLetBody(int start, GallinaTerm body) throws IOException {
		out.write(" in");
		try (IndentingWriter.Indent ignored = out.indentToPosition(start)) {
			out.newLine();
			format(body, GallinaPrecedence.TOP);
		}
	}

	@Override
	public Void visit(GallinaForall forall) throws IOException {
		open(GallinaPrecedence.FORALL);
		out.write("forall");
		writeBinders(forall.getBinders());
		out.write(", ");
		format(forall.getBody(), GallinaPrecedence.TOP);
		close(GallinaPrecedence.FORALL);
		return null;
	}

	@Override
	public Void visit(GallinaFun funNode) throws IOException {
		open(GallinaPrecedence.FUN);
		out.write("fun");
		writeBinders(funNode.getBinders());
		out.write(" => ");
		format(funNode.getBody(), GallinaPrecedence.TOP);
		close(GallinaPrecedence.FUN);
		return null;
	}

	@Override
	public Void visit(GallinaFix fix) throws IOException {
		open(GallinaPrecedence.FIX);
		out.write("fix ");
		fix.getBodies().accept(new GallinaNodeFormattingVisitor(out));
		close(GallinaPrecedence.FIX);
		return null;
	}

	@Override
	public Void visit(GallinaCofix cofix) throws IOException {
		open(GallinaPrecedence.FIX);
		out.write("cofix ");
		cofix.getBodies().accept(new GallinaNodeFormattingVisitor(out));
		close(GallinaPrecedence.FIX);
		return null;
	}

	@Override
	public Void visit(GallinaLet letNode) throws IOException {
		open(GallinaPrecedence.LET);
		int start = out.getHorizontalPosition();
		out.write("let ");
		out.write(letNode.getName());
		writeBinders(letNode.getBinders());
		writeTypeAnnotation(letNode.getType());
		out.write(" := ");
		format(letNode.getValue(), GallinaPrecedence.TOP);
		writeLetBody(start, letNode.getBody());
		close(GallinaPrecedence.LET);
		return null;
	}

	@Override
	public Void visit(GallinaLetFix letFix) throws IOException {
		open(GallinaPrecedence.LET);
		int start = out.getHorizontalPosition();
		out.write("let fix ");
		letFix.getDefinition().accept(new GallinaNodeFormattingVisitor(out));
		writeLetBody(start, letFix.getBody());
		close(GallinaPrecedence.LET);
		return null;
	}

	@Override
	public Void visit(GallinaLetCofix letCofix) throws IOException {
		open(GallinaPrecedence.LET);
		int start = out.getHorizontalPosition();
		out.write("let cofix ");
		letCofix.getDefinition().accept(new GallinaNodeFormattingVisitor(out));
		writeLetBody(start, letCofix.getBody());
		close(GallinaPrecedence.LET);
		return null;
	}

	@Override
	public Void visit(GallinaLetTuple letTuple) throws IOException {
		open(GallinaPrecedence.LET);
		int start = out.getHorizontalPosition();
		out.write("let (");
		FormattingTools.writeCommaSeparated(out, letTuple.getNames(),
				n -> n.accept(new GallinaNodeFormattingVisitor(out)));
		out.write(")");
		if (letTuple.getReturnType() != null) {
			out.write(" ");
			letTuple.getReturnType().accept(new GallinaNodeFormattingVisitor(out));
		}
		out.write(" := ");
		format(letTuple.getValue(), GallinaPrecedence.TOP);
		writeLetBody(start, letTuple.getBody());
		close(GallinaPrecedence.LET);
		return null;
	}

	@Override
	public Void visit(GallinaLetTick letTick) throws IOException {
		open(GallinaPrecedence.LET);
		int start = out.getHorizontalPosition();
		out.write("let '");
		letTick.getPattern().accept(new GallinaPatternFormattingVisitor(out, GallinaPrecedence.ARG));
		out.write(" := ");
		format(letTick.getValue(), GallinaPrecedence.TOP);
		writeLetBody(start, letTick.getBody());
		close(GallinaPrecedence.LET);
		return null;
	}

	@Override
	public Void visit(GallinaLetTickDep letTickDep) throws IOException {
		open(GallinaPrecedence.LET);
		int start = out.getHorizontalPosition();
		out.write("let '");
		letTickDep.getPattern().accept(new GallinaPatternFormattingVisitor(out, GallinaPrecedence.ARG));
		if (letTickDep.getInAnnotation() != null) {
			out.write(" ");
			letTickDep.getInAnnotation().accept(new GallinaNodeFormattingVisitor(out));
		}
		out.write(" := ");
		format(letTickDep.getValue(), GallinaPrecedence.TOP);
		out.write(" ");
		letTickDep.getReturnType().accept(new GallinaNodeFormattingVisitor(out));
		writeLetBody(start, letTickDep.getBody());
		close(GallinaPrecedence.LET);
		return null;
	}

	@Override
	public Void visit(GallinaIf ifNode) throws IOException {
		open(GallinaPrecedence.IF);
		out.write("if ");
		format(ifNode.getCondition(), GallinaPrecedence.TOP);
		if (ifNode.getReturnType() != null) {
			out.write(" ");
			ifNode.getReturnType().accept(new GallinaNodeFormattingVisitor(out));
		}
		out.write(" then ");
		format(ifNode.getThenBranch(), GallinaPrecedence.TOP);
		out.write(" else ");
		format(ifNode.getElseBranch(), GallinaPrecedence.TOP);
		close(GallinaPrecedence.IF);
		return null;
	}

	// casts are always written in their own parentheses
	private void writeCast(GallinaTerm term, String operator, GallinaTerm type) throws IOException {
		out.write("(");
		format(term, GallinaPrecedence.CAST - 1);
		out.write(" ");
		out.write(operator);
		if (type != null) {
			out.write(" ");
			format(type, GallinaPrecedence.TOP);
		}
		out.write(")");
	}

	@Override
	public Void visit(GallinaHasType hasType) throws IOException {
		writeCast(hasType.getTerm(), ":", hasType.getType());
		return null;
	}

	@Override
	public Void visit(GallinaCheckType checkType) throws IOException {
		writeCast(checkType.getTerm(), "<:", checkType.getType());
		return null;
	}

	@Override
	public Void visit(GallinaToSupportType toSupportType) throws IOException {
		writeCast(toSupportType.getTerm(), ":>", null);
		return null;
	}

	@Override
	public Void visit(GallinaArrow arrow) throws IOException {
		open(GallinaPrecedence.ARROW);
		format(arrow.getDomain(), GallinaPrecedence.ARROW - 1);
		out.write(" -> ");
		format(arrow.getCodomain(), GallinaPrecedence.TOP);
		close(GallinaPrecedence.ARROW);
		return null;
	}

	@Override
	public Void visit(GallinaApp app) throws IOException {
		open(GallinaPrecedence.APP);
		format(app.getFunction(), GallinaPrecedence.APP);
		FormattingTools.writeSpacePrefixed(out, app.getArguments(),
				a -> a.accept(new GallinaArgFormattingVisitor(out, GallinaPrecedence.ARG)));
		close(GallinaPrecedence.APP);
		return null;
	}

	@Override
	public Void visit(GallinaExplicitApp explicitApp) throws IOException {
		int level = explicitApp.getArguments().isEmpty() ? GallinaPrecedence.ATOM : GallinaPrecedence.APP;
		open(level);
		out.write("@");
		explicitApp.getFunction().accept(new GallinaNodeFormattingVisitor(out));
		FormattingTools.writeSpacePrefixed(out, explicitApp.getArguments(),
				a -> format(a, GallinaPrecedence.ARG));
		close(level);
		return null;
	}

	@Override
	public Void visit(GallinaInfix infix) throws IOException {
		GallinaPrecedence.Fixity fixity = GallinaPrecedence.lookup(infix.getOperator());
		if (fixity == null) {
			// the level of a user notation is unknown here
			out.write("(");
			format(infix.getLhs(), GallinaPrecedence.ATOM);
			out.write(" ");
			out.write(infix.getOperator());
			out.write(" ");
			format(infix.getRhs(), GallinaPrecedence.ATOM);
			out.write(")");
			return null;
		}
		open(fixity.getLevel());
		format(infix.getLhs(), fixity.getLeftLevel());
		out.write(" ");
		out.write(infix.getOperator());
		out.write(" ");
		format(infix.getRhs(), fixity.getRightLevel());
		close(fixity.getLevel());
		return null;
	}

	@Override
	public Void visit(GallinaInScope inScope) throws IOException {
		open(GallinaPrecedence.SCOPE);
		format(inScope.getTerm(), GallinaPrecedence.ATOM);
		out.write("%");
		out.write(inScope.getScope());
		close(GallinaPrecedence.SCOPE);
		return null;
	}

	@Override
	public Void visit(GallinaMatch match) throws IOException {
		open(GallinaPrecedence.MATCH);
		int start = out.getHorizontalPosition();
		out.write("match ");
		FormattingTools.writeCommaSeparated(out, match.getItems(),
				i -> i.accept(new GallinaNodeFormattingVisitor(out)));
		if (match.getReturnType() != null) {
			out.write(" ");
			match.getReturnType().accept(new GallinaNodeFormattingVisitor(out));
		}
		out.write(" with");
		if (match.getEquations().isEmpty()) {
			out.write(" end");
		} else {
			try (IndentingWriter.Indent ignored = out.indentToPosition(start)) {
				for (GallinaEquation equation : match.getEquations()) {
					out.newLine();
					equation.accept(new GallinaNodeFormattingVisitor(out));
				}
				out.newLine();
				out.write("end");
			}
		}
		close(GallinaPrecedence.MATCH);
		return null;
	}

	@Override
	public Void visit(GallinaVariable variable) throws IOException {
		variable.getQualid().accept(new GallinaNodeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GallinaSort sort) throws IOException {
		switch (sort.getKind()) {
			case PROP:
				out.write("Prop");
				break;
			case SET:
				out.write("Set");
				break;
			case TYPE:
				out.write("Type");
				break;
		}
		return null;
	}

	@Override
	public Void visit(GallinaNum num) throws IOException {
		out.write(num.getValue().toString());
		return null;
	}

	@Override
	public Void visit(GallinaPolyNum polyNum) throws IOException {
		out.write("#");
		out.write(polyNum.getValue().toString());
		return null;
	}

	@Override
	public Void visit(GallinaString stringNode) throws IOException {
		FormattingTools.writeStringLiteral(out, stringNode.getValue());
		return null;
	}

	@Override
	public Void visit(GallinaHsString hsString) throws IOException {
		out.write("&");
		FormattingTools.writeStringLiteral(out, hsString.getValue());
		return null;
	}

	@Override
	public Void visit(GallinaHsChar hsChar) throws IOException {
		out.write("&#");
		FormattingTools.writeStringLiteral(out, String.valueOf(hsChar.getValue()));
		return null;
	}

	@Override
	public Void visit(GallinaUnderscore underscore) throws IOException {
		out.write("_");
		return null;
	}

	@Override
	public Void visit(GallinaParens parens) throws IOException {
		out.write("(");
		format(parens.getTerm(), GallinaPrecedence.TOP);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GallinaBang bang) throws IOException {
		open(GallinaPrecedence.APP);
		out.write("!");
		format(bang.getTerm(), GallinaPrecedence.APP);
		close(GallinaPrecedence.APP);
		return null;
	}

	@Override
	public Void visit(GallinaMissingValue missingValue) throws IOException {
		out.write("patternFailure");
		return null;
	}

}
