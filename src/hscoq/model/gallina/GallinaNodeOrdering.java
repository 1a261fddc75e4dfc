package hscoq.model.gallina;

import hscoq.formatters.GallinaJSONFormattingVisitor;
import org.json.JSONArray;
import org.json.JSONObject;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Iterator;
import java.util.TreeSet;

/**
 * A structural total order on nodes, consistent with {@link GallinaNode#equals(Object)}.
 * <p>
 * Nodes of different variants order by variant name. Nodes of the same variant compare field by field, in
 * field-name order: child nodes recursively, lists lexicographically, numbers numerically, and an absent
 * optional field before a present one.
 */
public class GallinaNodeOrdering implements Comparator<GallinaNode> {

	@Override
	public int compare(GallinaNode a, GallinaNode b) {
		if (a.equals(b)) {
			return 0;
		}
		return compareValues(GallinaJSONFormattingVisitor.toJSON(a), GallinaJSONFormattingVisitor.toJSON(b));
	}

	private static int compareValues(Object a, Object b) {
		if (JSONObject.NULL.equals(a) || JSONObject.NULL.equals(b)) {
			return Boolean.compare(!JSONObject.NULL.equals(a), !JSONObject.NULL.equals(b));
		}
		if (a instanceof JSONObject && b instanceof JSONObject) {
			return compareObjects((JSONObject) a, (JSONObject) b);
		}
		if (a instanceof JSONArray && b instanceof JSONArray) {
			return compareArrays((JSONArray) a, (JSONArray) b);
		}
		if (a instanceof Number && b instanceof Number) {
			return new BigInteger(a.toString()).compareTo(new BigInteger(b.toString()));
		}
		if (a instanceof Boolean && b instanceof Boolean) {
			return Boolean.compare((Boolean) a, (Boolean) b);
		}
		return a.toString().compareTo(b.toString());
	}

	private static int compareObjects(JSONObject a, JSONObject b) {
		int byTag = a.getString("node").compareTo(b.getString("node"));
		if (byTag != 0) {
			return byTag;
		}
		// same variant, so both carry the same fields
		for (String key : new TreeSet<>(a.keySet())) {
			int result = compareValues(a.get(key), b.get(key));
			if (result != 0) {
				return result;
			}
		}
		return 0;
	}

	private static int compareArrays(JSONArray a, JSONArray b) {
		Iterator<Object> left = a.iterator();
		Iterator<Object> right = b.iterator();
		while (left.hasNext() && right.hasNext()) {
			int result = compareValues(left.next(), right.next());
			if (result != 0) {
				return result;
			}
		}
		return Boolean.compare(left.hasNext(), right.hasNext());
	}

}
