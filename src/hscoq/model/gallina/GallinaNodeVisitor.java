package hscoq.model.gallina;

public abstract class GallinaNodeVisitor<T, E extends Throwable> {
	public abstract T visit(GallinaTerm term) throws E;
	public abstract T visit(GallinaArg arg) throws E;
	public abstract T visit(GallinaBinder binder) throws E;
	public abstract T visit(GallinaPattern pattern) throws E;
	public abstract T visit(GallinaSentence sentence) throws E;
	public abstract T visit(GallinaName name) throws E;
	public abstract T visit(GallinaQualid qualid) throws E;
	public abstract T visit(GallinaFixBodies fixBodies) throws E;
	public abstract T visit(GallinaCofixBodies cofixBodies) throws E;
	public abstract T visit(GallinaFixBody fixBody) throws E;
	public abstract T visit(GallinaCofixBody cofixBody) throws E;
	public abstract T visit(GallinaMatchItem matchItem) throws E;
	public abstract T visit(GallinaInAnnotation inAnnotation) throws E;
	public abstract T visit(GallinaDepRetType depRetType) throws E;
	public abstract T visit(GallinaReturnType returnType) throws E;
	public abstract T visit(GallinaEquation equation) throws E;
	public abstract T visit(GallinaMultPattern multPattern) throws E;
	public abstract T visit(GallinaOrPattern orPattern) throws E;
	public abstract T visit(GallinaAssums assums) throws E;
	public abstract T visit(GallinaAssumsGroup assumsGroup) throws E;
	public abstract T visit(GallinaInductiveBody inductiveBody) throws E;
	public abstract T visit(GallinaConstructor constructor) throws E;
	public abstract T visit(GallinaProof proof) throws E;
	public abstract T visit(GallinaRecordField recordField) throws E;
	public abstract T visit(GallinaNotationBinding notationBinding) throws E;
	public abstract T visit(GallinaArgumentSpec argumentSpec) throws E;
}
