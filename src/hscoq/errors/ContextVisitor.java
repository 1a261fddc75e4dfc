package hscoq.errors;

import hscoq.trans.WhileConvertingDeclaration;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileConvertingDeclaration whileConvertingDeclaration) throws E;

}
