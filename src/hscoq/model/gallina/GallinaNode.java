package hscoq.model.gallina;

import hscoq.Unreachable;
import hscoq.formatters.GallinaNodeFormattingVisitor;
import hscoq.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Base class of every piece of Gallina syntax.
 *
 * Nodes are immutable once constructed. {@link #toString()} renders the node as Gallina source text at the
 * loosest precedence.
 */
public abstract class GallinaNode {

	public abstract <T, E extends Throwable> T accept(GallinaNodeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new GallinaNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

}
