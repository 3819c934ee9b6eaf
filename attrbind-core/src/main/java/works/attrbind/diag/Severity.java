package works.attrbind.diag;

public enum Severity {
	ERROR,
	WARNING,
}
