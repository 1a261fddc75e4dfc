package hscoq.formatters;

import hscoq.model.gallina.*;

import java.io.IOException;
import java.util.List;

/**
 * Renders patterns with the same precedence rules as terms: constructor application at
 * {@link GallinaPrecedence#APP}, standard infix constructors such as {@code ::} from the shared table.
 */
public class GallinaPatternFormattingVisitor extends GallinaPatternVisitor<Void, IOException> {

	private final IndentingWriter out;
	private final int precedence;

	public GallinaPatternFormattingVisitor(IndentingWriter out) {
		this(out, GallinaPrecedence.TOP);
	}

	public GallinaPatternFormattingVisitor(IndentingWriter out, int precedence) {
		this.out = out;
		this.precedence = precedence;
	}

	private void format(GallinaPattern pattern, int precedence) throws IOException {
		pattern.accept(new GallinaPatternFormattingVisitor(out, precedence));
	}

	private void writeApplication(String prefix, GallinaQualid constructor, List<GallinaPattern> arguments)
			throws IOException {
		int level = arguments.isEmpty() ? GallinaPrecedence.ATOM : GallinaPrecedence.APP;
		boolean parens = GallinaPrecedence.needsParentheses(level, precedence);
		if (parens) {
			out.write("(");
		}
		out.write(prefix);
		constructor.accept(new GallinaNodeFormattingVisitor(out));
		FormattingTools.writeSpacePrefixed(out, arguments, p -> format(p, GallinaPrecedence.ARG));
		if (parens) {
			out.write(")");
		}
	}

	@Override
	public Void visit(GallinaArgsPattern argsPattern) throws IOException {
		writeApplication("", argsPattern.getConstructor(), argsPattern.getArguments());
		return null;
	}

	@Override
	public Void visit(GallinaExplicitArgsPattern explicitArgsPattern) throws IOException {
		writeApplication("@", explicitArgsPattern.getConstructor(), explicitArgsPattern.getArguments());
		return null;
	}

	@Override
	public Void visit(GallinaInfixPattern infixPattern) throws IOException {
		GallinaPrecedence.Fixity fixity = GallinaPrecedence.lookup(infixPattern.getOperator());
		if (fixity == null) {
			out.write("(");
			format(infixPattern.getLhs(), GallinaPrecedence.ATOM);
			out.write(" ");
			out.write(infixPattern.getOperator());
			out.write(" ");
			format(infixPattern.getRhs(), GallinaPrecedence.ATOM);
			out.write(")");
			return null;
		}
		boolean parens = GallinaPrecedence.needsParentheses(fixity.getLevel(), precedence);
		if (parens) {
			out.write("(");
		}
		format(infixPattern.getLhs(), fixity.getLeftLevel());
		out.write(" ");
		out.write(infixPattern.getOperator());
		out.write(" ");
		format(infixPattern.getRhs(), fixity.getRightLevel());
		if (parens) {
			out.write(")");
		}
		return null;
	}

	@Override
	public Void visit(GallinaAsPattern asPattern) throws IOException {
		out.write("(");
		format(asPattern.getPattern(), GallinaPrecedence.TOP);
		out.write(" as ");
		out.write(asPattern.getName());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GallinaInScopePattern inScopePattern) throws IOException {
		boolean parens = GallinaPrecedence.needsParentheses(GallinaPrecedence.SCOPE, precedence);
		if (parens) {
			out.write("(");
		}
		format(inScopePattern.getPattern(), GallinaPrecedence.ATOM);
		out.write("%");
		out.write(inScopePattern.getScope());
		if (parens) {
			out.write(")");
		}
		return null;
	}

	@Override
	public Void visit(GallinaQualidPattern qualidPattern) throws IOException {
		qualidPattern.getQualid().accept(new GallinaNodeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GallinaUnderscorePattern underscorePattern) throws IOException {
		out.write("_");
		return null;
	}

	@Override
	public Void visit(GallinaNumPattern numPattern) throws IOException {
		out.write(numPattern.getValue().toString());
		return null;
	}

	@Override
	public Void visit(GallinaStringPattern stringPattern) throws IOException {
		FormattingTools.writeStringLiteral(out, stringPattern.getValue());
		return null;
	}

	@Override
	public Void visit(GallinaOrPatterns orPatterns) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, orPatterns.getOrPatterns(),
				p -> p.accept(new GallinaNodeFormattingVisitor(out)));
		out.write(")");
		return null;
	}

}
