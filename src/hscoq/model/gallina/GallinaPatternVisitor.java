package hscoq.model.gallina;

public abstract class GallinaPatternVisitor<T, E extends Throwable> {
	public abstract T visit(GallinaArgsPattern argsPattern) throws E;
	public abstract T visit(GallinaExplicitArgsPattern explicitArgsPattern) throws E;
	public abstract T visit(GallinaInfixPattern infixPattern) throws E;
	public abstract T visit(GallinaAsPattern asPattern) throws E;
	public abstract T visit(GallinaInScopePattern inScopePattern) throws E;
	public abstract T visit(GallinaQualidPattern qualidPattern) throws E;
	public abstract T visit(GallinaUnderscorePattern underscorePattern) throws E;
	public abstract T visit(GallinaNumPattern numPattern) throws E;
	public abstract T visit(GallinaStringPattern stringPattern) throws E;
	public abstract T visit(GallinaOrPatterns orPatterns) throws E;
}
