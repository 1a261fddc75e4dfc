package hscoq.model.gallina;

public abstract class GallinaArgVisitor<T, E extends Throwable> {
	public abstract T visit(GallinaPositionalArg positionalArg) throws E;
	public abstract T visit(GallinaNamedArg namedArg) throws E;
}
