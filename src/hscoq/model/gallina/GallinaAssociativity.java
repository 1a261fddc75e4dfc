package hscoq.model.gallina;

public enum GallinaAssociativity {
	LEFT,
	RIGHT,
	NONE,
}
