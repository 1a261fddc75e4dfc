package hscoq.trans;

import hscoq.errors.Context;
import hscoq.errors.ContextVisitor;

public class WhileConvertingDeclaration extends Context {

	private final String declarationName;

	public WhileConvertingDeclaration(String declarationName) {
		this.declarationName = declarationName;
	}

	public String getDeclarationName() {
		return declarationName;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
