package hscoq.trans;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The field shape of a data constructor: positional fields, or named record fields.
 */
public abstract class ConstructorFields {

	public abstract int getArity();

	public static class NonRecordFields extends ConstructorFields {
		private final int count;

		public NonRecordFields(int count) {
			if (count < 0) {
				throw new IllegalArgumentException("negative field count " + count);
			}
			this.count = count;
		}

		@Override
		public int getArity() {
			return count;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			NonRecordFields that = (NonRecordFields) o;
			return count == that.count;
		}

		@Override
		public int hashCode() {
			return Objects.hash(count);
		}

		@Override
		public String toString() {
			return "NonRecordFields(" + count + ")";
		}
	}

	public static class RecordFields extends ConstructorFields {
		private final List<String> fields;

		public RecordFields(List<String> fields) {
			this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
		}

		public List<String> getFields() {
			return fields;
		}

		@Override
		public int getArity() {
			return fields.size();
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			RecordFields that = (RecordFields) o;
			return Objects.equals(fields, that.fields);
		}

		@Override
		public int hashCode() {
			return Objects.hash(fields);
		}

		@Override
		public String toString() {
			return "RecordFields(" + fields + ")";
		}
	}
}
