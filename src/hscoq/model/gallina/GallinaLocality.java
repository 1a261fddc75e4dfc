package hscoq.model.gallina;

public enum GallinaLocality {
	GLOBAL,
	LOCAL,
}
