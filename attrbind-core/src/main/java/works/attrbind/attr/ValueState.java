package works.attrbind.attr;

public enum ValueState {
	KNOWN,
	NULL,
	UNKNOWN,
}
