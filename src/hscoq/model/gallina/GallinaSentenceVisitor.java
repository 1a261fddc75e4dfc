package hscoq.model.gallina;

public abstract class GallinaSentenceVisitor<T, E extends Throwable> {
	public abstract T visit(GallinaAssumption assumption) throws E;
	public abstract T visit(GallinaDefinition definition) throws E;
	public abstract T visit(GallinaLetDefinition letDefinition) throws E;
	public abstract T visit(GallinaInductive inductive) throws E;
	public abstract T visit(GallinaFixpoint fixpoint) throws E;
	public abstract T visit(GallinaCoFixpoint coFixpoint) throws E;
	public abstract T visit(GallinaAssertion assertion) throws E;
	public abstract T visit(GallinaClassDefinition classDefinition) throws E;
	public abstract T visit(GallinaInstanceDefinition instanceDefinition) throws E;
	public abstract T visit(GallinaReservedNotation reservedNotation) throws E;
	public abstract T visit(GallinaNotation notation) throws E;
	public abstract T visit(GallinaInfixDefinition infixDefinition) throws E;
	public abstract T visit(GallinaArguments arguments) throws E;
	public abstract T visit(GallinaComment comment) throws E;
}
