package hscoq.formatters;

import hscoq.model.gallina.GallinaAssociativity;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Precedence levels of Gallina's syntactic forms and standard infix notations.
 *
 * Levels follow Coq: a smaller level binds tighter and {@link #TOP} is the loosest. A term written at
 * level {@code n} in a position that accepts at most level {@code p} must be parenthesized iff {@code n > p}.
 */
public final class GallinaPrecedence {

	private GallinaPrecedence() {}

	public static final int TOP = 200;

	public static final int FORALL = 200;
	public static final int FUN = 200;
	public static final int MATCH = 200;
	public static final int LET = 200;
	public static final int IF = 200;
	public static final int FIX = 200;

	public static final int CAST = 100;

	// right associative, the codomain is parsed at TOP
	public static final int ARROW = 99;

	// left associative
	public static final int APP = 10;
	public static final int ARG = 9;

	// postfix, term%scope
	public static final int SCOPE = 1;

	public static final int ATOM = 0;

	public static class Fixity {
		private final int level;
		private final GallinaAssociativity associativity;

		public Fixity(int level, GallinaAssociativity associativity) {
			this.level = level;
			this.associativity = associativity;
		}

		public int getLevel() {
			return level;
		}

		public GallinaAssociativity getAssociativity() {
			return associativity;
		}

		/**
		 * @return the level the left operand is written at
		 */
		public int getLeftLevel() {
			return associativity == GallinaAssociativity.LEFT ? level : level - 1;
		}

		/**
		 * @return the level the right operand is written at
		 */
		public int getRightLevel() {
			return associativity == GallinaAssociativity.RIGHT ? level : level - 1;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Fixity fixity = (Fixity) o;
			return level == fixity.level &&
					associativity == fixity.associativity;
		}

		@Override
		public int hashCode() {
			return Objects.hash(level, associativity);
		}

		@Override
		public String toString() {
			return "Fixity(" + level + ", " + associativity + ")";
		}
	}

	// https://coq.inria.fr/refman/language/coq-library.html#notations
	private static final Map<String, Fixity> operatorFixities = new HashMap<>();
	static {
		put("<->", 95, GallinaAssociativity.NONE);
		put("\\/", 85, GallinaAssociativity.RIGHT);
		put("/\\", 80, GallinaAssociativity.RIGHT);
		for (String op : new String[]{"=", "<>", "<", ">", "<=", ">="}) {
			put(op, 70, GallinaAssociativity.NONE);
		}
		put("::", 60, GallinaAssociativity.RIGHT);
		put("++", 60, GallinaAssociativity.RIGHT);
		for (String op : new String[]{"+", "||", "-"}) {
			put(op, 50, GallinaAssociativity.LEFT);
		}
		for (String op : new String[]{"*", "&&", "/"}) {
			put(op, 40, GallinaAssociativity.LEFT);
		}
		put("^", 30, GallinaAssociativity.RIGHT);
	}

	private static void put(String op, int level, GallinaAssociativity associativity) {
		operatorFixities.put(op, new Fixity(level, associativity));
	}

	/**
	 * @return the fixity of a standard infix operator, or null if the operator is not in the table
	 */
	public static Fixity lookup(String operator) {
		return operatorFixities.get(operator);
	}

	public static Map<String, Fixity> getOperatorFixities() {
		return Collections.unmodifiableMap(operatorFixities);
	}

	public static boolean needsParentheses(int level, int ambient) {
		return level > ambient;
	}

}
