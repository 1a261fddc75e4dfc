package hscoq.model.gallina;

import java.util.Objects;

public class GallinaComment extends GallinaSentence {

	private final String text;

	public GallinaComment(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(GallinaSentenceVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GallinaComment comment = (GallinaComment) o;
		return Objects.equals(text, comment.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}
}
