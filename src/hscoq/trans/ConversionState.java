package hscoq.trans;

import hscoq.model.gallina.GallinaClassDefinition;
import hscoq.model.gallina.GallinaTerm;

import java.util.*;

import static hscoq.model.gallina.GallinaBuilder.*;

/**
 * The bookkeeping threaded through the conversion of one module: renamings, constructor and record metadata,
 * class default methods and definitions, and the counter behind fresh names.
 *
 * Declarations are converted in document order against a single instance, so later declarations see the
 * tables written by earlier ones. {@link #localize(LocalizedAction)} confines the table writes of a
 * sub-conversion; the counter is never rolled back.
 */
public class ConversionState {

	private Map<NamespacedIdent, String> renamings;
	private final Edits edits;
	private Map<String, List<String>> constructors;
	private Map<String, String> constructorTypes;
	private Map<String, ConstructorFields> constructorFields;
	private Map<String, String> recordFieldTypes;
	private Map<String, Map<String, GallinaTerm>> defaultMethods;
	private Map<String, GallinaClassDefinition> classDefinitions;
	private long unique;

	public ConversionState(Map<NamespacedIdent, String> renamings, Edits edits) {
		this(renamings, edits, 0);
	}

	// starts the fresh-name counter at the given value
	ConversionState(Map<NamespacedIdent, String> renamings, Edits edits, long firstUnique) {
		this.renamings = new HashMap<>(renamings);
		this.edits = edits;
		this.constructors = new HashMap<>();
		this.constructorTypes = new HashMap<>();
		this.constructorFields = new HashMap<>();
		this.recordFieldTypes = new HashMap<>();
		this.defaultMethods = new HashMap<>();
		this.classDefinitions = new HashMap<>();
		this.unique = firstUnique;

		Map<String, GallinaTerm> eqDefaults = new HashMap<>();
		eqDefaults.put(InfixNames.toCoqName("=="),
				fun(binders(inferred("x"), inferred("y")), app("negb", infix(var("x"), "/=", var("y")))));
		eqDefaults.put(InfixNames.toCoqName("/="),
				fun(binders(inferred("x"), inferred("y")), app("negb", infix(var("x"), "==", var("y")))));
		defaultMethods.put("Eq", eqDefaults);
	}

	public ConversionState() {
		this(Collections.emptyMap(), Edits.empty());
	}

	/**
	 * @return a number never returned before by this state
	 */
	public long fresh() {
		long result = unique;
		unique = Math.addExact(unique, 1);
		return result;
	}

	public String gensym(String name) {
		return "__" + name + "_" + fresh() + "__";
	}

	public void rename(HsNamespace namespace, String from, String to) {
		renamings.put(new NamespacedIdent(namespace, from), to);
	}

	/**
	 * @return the recorded renaming, or null if the identifier keeps its name
	 */
	public String getRenamed(HsNamespace namespace, String ident) {
		return renamings.get(new NamespacedIdent(namespace, ident));
	}

	public String renamedOrSelf(HsNamespace namespace, String ident) {
		String renamed = getRenamed(namespace, ident);
		return renamed != null ? renamed : ident;
	}

	public Map<NamespacedIdent, String> getRenamings() {
		return Collections.unmodifiableMap(renamings);
	}

	public Edits getEdits() {
		return edits;
	}

	/**
	 * Records the constructors of a data type, in declaration order.
	 */
	public void addConstructors(String typeName, List<String> constructorNames) {
		constructors.put(typeName, new ArrayList<>(constructorNames));
		for (String con : constructorNames) {
			constructorTypes.put(con, typeName);
		}
	}

	public List<String> getConstructors(String typeName) {
		List<String> result = constructors.get(typeName);
		return result == null ? null : Collections.unmodifiableList(result);
	}

	public String getConstructorType(String constructorName) {
		return constructorTypes.get(constructorName);
	}

	/**
	 * Records the field shape of a constructor, and for record constructors the owning type of each field.
	 */
	public void setConstructorFields(String constructorName, ConstructorFields fields) {
		constructorFields.put(constructorName, fields);
		if (fields instanceof ConstructorFields.RecordFields) {
			String typeName = constructorTypes.get(constructorName);
			if (typeName != null) {
				for (String field : ((ConstructorFields.RecordFields) fields).getFields()) {
					recordFieldTypes.put(field, typeName);
				}
			}
		}
	}

	public ConstructorFields getConstructorFields(String constructorName) {
		return constructorFields.get(constructorName);
	}

	public void setRecordFieldType(String fieldName, String typeName) {
		recordFieldTypes.put(fieldName, typeName);
	}

	public String getRecordFieldType(String fieldName) {
		return recordFieldTypes.get(fieldName);
	}

	public void setDefaultMethods(String className, Map<String, GallinaTerm> methods) {
		defaultMethods.put(className, new HashMap<>(methods));
	}

	/**
	 * @return the default method bodies of a class keyed by method name, empty if it has none
	 */
	public Map<String, GallinaTerm> getDefaultMethods(String className) {
		Map<String, GallinaTerm> result = defaultMethods.get(className);
		return result == null ? Collections.emptyMap() : Collections.unmodifiableMap(result);
	}

	public void setClassDefinition(String className, GallinaClassDefinition definition) {
		classDefinitions.put(className, definition);
	}

	public GallinaClassDefinition getClassDefinition(String className) {
		return classDefinitions.get(className);
	}

	/**
	 * Runs the action against this state, then discards every table write the action made. Fresh names drawn
	 * inside stay drawn. The tables are restored whether the action returns or throws.
	 */
	public <T, E extends Throwable> T localize(LocalizedAction<T, E> action) throws E {
		Map<NamespacedIdent, String> savedRenamings = new HashMap<>(renamings);
		Map<String, List<String>> savedConstructors = new HashMap<>();
		for (Map.Entry<String, List<String>> entry : constructors.entrySet()) {
			savedConstructors.put(entry.getKey(), new ArrayList<>(entry.getValue()));
		}
		Map<String, String> savedConstructorTypes = new HashMap<>(constructorTypes);
		Map<String, ConstructorFields> savedConstructorFields = new HashMap<>(constructorFields);
		Map<String, String> savedRecordFieldTypes = new HashMap<>(recordFieldTypes);
		Map<String, Map<String, GallinaTerm>> savedDefaultMethods = new HashMap<>();
		for (Map.Entry<String, Map<String, GallinaTerm>> entry : defaultMethods.entrySet()) {
			savedDefaultMethods.put(entry.getKey(), new HashMap<>(entry.getValue()));
		}
		Map<String, GallinaClassDefinition> savedClassDefinitions = new HashMap<>(classDefinitions);
		try {
			return action.run();
		} finally {
			renamings = savedRenamings;
			constructors = savedConstructors;
			constructorTypes = savedConstructorTypes;
			constructorFields = savedConstructorFields;
			recordFieldTypes = savedRecordFieldTypes;
			defaultMethods = savedDefaultMethods;
			classDefinitions = savedClassDefinitions;
		}
	}

}
