package hscoq.trans;

@FunctionalInterface
public interface LocalizedAction<T, E extends Throwable> {
	T run() throws E;
}
