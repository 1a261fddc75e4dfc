package hscoq;

import hscoq.trans.ConversionState;
import hscoq.trans.Edits;
import hscoq.trans.HsNamespace;
import hscoq.trans.NamespacedIdent;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * The inputs of a translation run read from a JSON document: renamings, edits and the output file.
 *
 * <pre>
 * {
 *   "renamings": [ {"namespace": "value", "from": "==", "to": "eqb"} ],
 *   "edits": { "skip": ["foo"], "skip_method": [ {"class": "Eq", "method": "/="} ] },
 *   "output": { "dest_file": "Out.v" }
 * }
 * </pre>
 */
public class HsCoqConfig {

	public static final String RENAMINGS_FIELD = "renamings";
	public static final String EDITS_FIELD = "edits";
	public static final String OUTPUT_FIELD = "output";

	private final Map<NamespacedIdent, String> renamings;
	private final Edits edits;
	private final String destFile;

	public HsCoqConfig(Map<NamespacedIdent, String> renamings, Edits edits, String destFile) {
		this.renamings = Collections.unmodifiableMap(new LinkedHashMap<>(renamings));
		this.edits = edits;
		this.destFile = destFile;
	}

	public static HsCoqConfig load(File configFile) throws HsCoqConfigException {
		String s;
		try {
			s = FileUtils.readFileToString(configFile, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new HsCoqConfigException("Error reading configuration file: " + ex.getMessage(), ex);
		}
		try {
			return parse(s);
		} catch (HsCoqConfigException e) {
			throw new HsCoqConfigException(configFile + ": " + e.getMsg(), e);
		}
	}

	public static HsCoqConfig parse(String json) throws HsCoqConfigException {
		try {
			JSONObject config = new JSONObject(json);
			Map<NamespacedIdent, String> renamings = new LinkedHashMap<>();
			if (config.has(RENAMINGS_FIELD)) {
				JSONArray entries = config.getJSONArray(RENAMINGS_FIELD);
				for (int i = 0; i < entries.length(); i++) {
					JSONObject entry = entries.getJSONObject(i);
					String namespaceName = entry.getString("namespace");
					HsNamespace namespace = HsNamespace.fromConfigName(namespaceName);
					if (namespace == null) {
						throw new HsCoqConfigException("unknown namespace " + namespaceName);
					}
					renamings.put(new NamespacedIdent(namespace, entry.getString("from")), entry.getString("to"));
				}
			}

			Set<String> skipped = new TreeSet<>();
			Map<String, Set<String>> skippedMethods = new TreeMap<>();
			if (config.has(EDITS_FIELD)) {
				JSONObject edits = config.getJSONObject(EDITS_FIELD);
				if (edits.has("skip")) {
					JSONArray skip = edits.getJSONArray("skip");
					for (int i = 0; i < skip.length(); i++) {
						skipped.add(skip.getString(i));
					}
				}
				if (edits.has("skip_method")) {
					JSONArray skipMethod = edits.getJSONArray("skip_method");
					for (int i = 0; i < skipMethod.length(); i++) {
						JSONObject entry = skipMethod.getJSONObject(i);
						skippedMethods.computeIfAbsent(entry.getString("class"), k -> new TreeSet<>())
								.add(entry.getString("method"));
					}
				}
			}

			String destFile = null;
			if (config.has(OUTPUT_FIELD)) {
				destFile = config.getJSONObject(OUTPUT_FIELD).getString("dest_file");
			}
			return new HsCoqConfig(renamings, new Edits(skipped, skippedMethods), destFile);
		} catch (JSONException e) {
			throw new HsCoqConfigException("parsing error: " + e.getMessage(), e);
		}
	}

	public Map<NamespacedIdent, String> getRenamings() {
		return renamings;
	}

	public Edits getEdits() {
		return edits;
	}

	/**
	 * @return the output file name, or null when the configuration does not name one
	 */
	public String getDestFile() {
		return destFile;
	}

	public ConversionState createState() {
		return new ConversionState(renamings, edits);
	}

}
