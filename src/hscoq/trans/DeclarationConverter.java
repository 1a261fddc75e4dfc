package hscoq.trans;

import hscoq.model.gallina.GallinaSentence;

import java.util.List;

/**
 * Converts one already-parsed source declaration into Gallina sentences, reading and writing the shared
 * {@link ConversionState}. Throws {@link ProgramError} when the declaration cannot be converted.
 */
public interface DeclarationConverter<D> {

	List<GallinaSentence> convert(ConversionState state, D declaration);

	/**
	 * @return the source name of the declaration, as written in skip edits
	 */
	String name(D declaration);

}
