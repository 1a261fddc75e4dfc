package hscoq.formatters;

import hscoq.Unreachable;
import hscoq.model.gallina.GallinaSentence;
import hscoq.model.gallina.GallinaTerm;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

public class GallinaFormatting {

	private GallinaFormatting() {}

	/**
	 * Renders a term for a position that accepts terms up to the given precedence level.
	 */
	public static String render(GallinaTerm term, int precedence) {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			term.accept(new GallinaTermFormattingVisitor(out, precedence));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	public static String renderSentences(List<GallinaSentence> sentences) {
		StringWriter w = new StringWriter();
		try {
			writeSentences(w, sentences);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	/**
	 * Writes each sentence followed by a line break, with a blank line between consecutive sentences.
	 */
	public static void writeSentences(Writer writer, List<GallinaSentence> sentences) throws IOException {
		IndentingWriter out = new IndentingWriter(writer);
		boolean first = true;
		for (GallinaSentence sentence : sentences) {
			if (!first) {
				out.newLine();
			}
			first = false;
			sentence.accept(new GallinaSentenceFormattingVisitor(out));
			out.newLine();
		}
		out.flush();
	}

}
