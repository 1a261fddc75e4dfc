package hscoq.model.gallina;

public abstract class GallinaTermVisitor<T, E extends Throwable> {
	public abstract T visit(GallinaForall forall) throws E;
	public abstract T visit(GallinaFun funNode) throws E;
	public abstract T visit(GallinaFix fix) throws E;
	public abstract T visit(GallinaCofix cofix) throws E;
	public abstract T visit(GallinaLet letNode) throws E;
	public abstract T visit(GallinaLetFix letFix) throws E;
	public abstract T visit(GallinaLetCofix letCofix) throws E;
	public abstract T visit(GallinaLetTuple letTuple) throws E;
	public abstract T visit(GallinaLetTick letTick) throws E;
	public abstract T visit(GallinaLetTickDep letTickDep) throws E;
	public abstract T visit(GallinaIf ifNode) throws E;
	public abstract T visit(GallinaHasType hasType) throws E;
	public abstract T visit(GallinaCheckType checkType) throws E;
	public abstract T visit(GallinaToSupportType toSupportType) throws E;
	public abstract T visit(GallinaArrow arrow) throws E;
	public abstract T visit(GallinaApp app) throws E;
	public abstract T visit(GallinaExplicitApp explicitApp) throws E;
	public abstract T visit(GallinaInfix infix) throws E;
	public abstract T visit(GallinaInScope inScope) throws E;
	public abstract T visit(GallinaMatch match) throws E;
	public abstract T visit(GallinaVariable variable) throws E;
	public abstract T visit(GallinaSort sort) throws E;
	public abstract T visit(GallinaNum num) throws E;
	public abstract T visit(GallinaPolyNum polyNum) throws E;
	public abstract T visit(GallinaString stringNode) throws E;
	public abstract T visit(GallinaHsString hsString) throws E;
	public abstract T visit(GallinaHsChar hsChar) throws E;
	public abstract T visit(GallinaUnderscore underscore) throws E;
	public abstract T visit(GallinaParens parens) throws E;
	public abstract T visit(GallinaBang bang) throws E;
	public abstract T visit(GallinaMissingValue missingValue) throws E;
}
