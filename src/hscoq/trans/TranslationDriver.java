package hscoq.trans;

import hscoq.errors.IssueContext;
import hscoq.formatters.GallinaFormatting;
import hscoq.model.gallina.GallinaSentence;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Logger;

/**
 * Converts the declarations of one module in document order. A declaration that fails to convert is
 * reported to the issue context and left out; the rest of the module is still converted.
 */
public class TranslationDriver<D> {

	private static final Logger logger = Logger.getLogger("TranslationDriver");

	private final ConversionState state;
	private final DeclarationConverter<D> converter;

	public TranslationDriver(ConversionState state, DeclarationConverter<D> converter) {
		this.state = state;
		this.converter = converter;
	}

	public ConversionState getState() {
		return state;
	}

	public List<GallinaSentence> convertModule(IssueContext ctx, List<D> declarations) {
		logger.info("Converting " + declarations.size() + " declaration(s)");
		Set<String> unusedSkips = new TreeSet<>(state.getEdits().getSkipped());
		List<GallinaSentence> sentences = new ArrayList<>();
		for (D declaration : declarations) {
			String name = converter.name(declaration);
			if (state.getEdits().isSkipped(name)) {
				unusedSkips.remove(name);
				logger.fine("Skipping " + name);
				continue;
			}
			try {
				sentences.addAll(converter.convert(state, declaration));
				logger.fine("Converted " + name);
			} catch (ProgramError e) {
				IssueContext declarationCtx = ctx.withContext(new WhileConvertingDeclaration(name));
				declarationCtx.error(new ConversionFailureIssue(e));
				logger.warning("Skipping declaration " + name + ": " + e.getMessage());
			}
		}
		if (!unusedSkips.isEmpty()) {
			throw ProgramError.editFailure("skip " + unusedSkips.iterator().next());
		}
		logger.info("Converted to " + sentences.size() + " sentence(s)");
		return sentences;
	}

	public static String render(List<GallinaSentence> sentences) {
		return GallinaFormatting.renderSentences(sentences);
	}

	public static void write(IssueContext ctx, File destination, List<GallinaSentence> sentences) {
		try {
			FileUtils.writeStringToFile(destination, render(sentences), StandardCharsets.UTF_8);
			logger.info("Wrote " + destination);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
		}
	}

}
