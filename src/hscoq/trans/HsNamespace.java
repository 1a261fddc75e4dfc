package hscoq.trans;

/**
 * The source-language namespace an identifier belongs to; the same name may be renamed differently in each.
 */
public enum HsNamespace {
	VALUE("value"),
	TYPE("type");

	private final String configName;

	HsNamespace(String configName) {
		this.configName = configName;
	}

	public String getConfigName() {
		return configName;
	}

	/**
	 * @return the namespace with the given configuration name, or null if there is none
	 */
	public static HsNamespace fromConfigName(String name) {
		for (HsNamespace ns : values()) {
			if (ns.configName.equals(name)) {
				return ns;
			}
		}
		return null;
	}
}
