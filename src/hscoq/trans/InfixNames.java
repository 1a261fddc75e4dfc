package hscoq.trans;

import java.util.HashMap;
import java.util.Map;

/**
 * Translates operator names, which Gallina identifiers cannot spell, into identifiers of the form
 * {@code op_<encoding>__}, encoding each symbol with a z-escape.
 */
public class InfixNames {

	private InfixNames() {}

	private static final Map<Character, String> encodings = new HashMap<>();
	static {
		encodings.put('&', "za");
		encodings.put('|', "zb");
		encodings.put('^', "zc");
		encodings.put('$', "zd");
		encodings.put('=', "ze");
		encodings.put('>', "zg");
		encodings.put('#', "zh");
		encodings.put('.', "zi");
		encodings.put('<', "zl");
		encodings.put('-', "zm");
		encodings.put('!', "zn");
		encodings.put('+', "zp");
		encodings.put('\'', "zq");
		encodings.put('\\', "zr");
		encodings.put('/', "zs");
		encodings.put('*', "zt");
		encodings.put('_', "zu");
		encodings.put('%', "zv");
		encodings.put('~', "zw");
		encodings.put('?', "zk");
		encodings.put('@', "zy");
		encodings.put(':', "ZC");
		encodings.put('z', "zz");
		encodings.put('Z', "ZZ");
	}

	/**
	 * An identifier is an operator when it does not start like a variable or constructor name.
	 */
	public static boolean isOperator(String ident) {
		if (ident.isEmpty()) {
			return false;
		}
		char first = ident.charAt(0);
		return !(Character.isLetterOrDigit(first) || first == '_');
	}

	public static String toCoqName(String ident) {
		if (!isOperator(ident)) {
			return ident;
		}
		StringBuilder result = new StringBuilder("op_");
		for (char c : ident.toCharArray()) {
			String encoded = encodings.get(c);
			if (encoded != null) {
				result.append(encoded);
			} else if (Character.isLetterOrDigit(c)) {
				result.append(c);
			} else {
				result.append('z').append(Integer.toHexString(c)).append('U');
			}
		}
		result.append("__");
		return result.toString();
	}

	/**
	 * @return the prefix notation name for an operator, {@code _op_}
	 */
	public static String toPrefixNotation(String op) {
		return "_" + op + "_";
	}

}
