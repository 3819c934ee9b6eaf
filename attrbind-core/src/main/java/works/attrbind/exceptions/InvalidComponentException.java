package works.attrbind.exceptions;

public class InvalidComponentException extends InvalidRecordTypeException {
	private final Class<?> containingClass;
	private final String componentName;

	public Class<?> containingClass() {
		return this.containingClass;
	}

	public String componentName() {
		return this.componentName;
	}

	public InvalidComponentException(Class<?> containingClass, String componentName, String message) {
		super(fullMessage(containingClass, componentName, message));
		this.containingClass = containingClass;
		this.componentName = componentName;
	}

	public InvalidComponentException(Class<?> containingClass, String componentName, String message, Throwable cause) {
		super(fullMessage(containingClass, componentName, message), cause);
		this.containingClass = containingClass;
		this.componentName = componentName;
	}

	private static String fullMessage(Class<?> containingClass, String componentName, String message) {
		return "Invalid component " + containingClass.getSimpleName() + "." + componentName + ": " + message;
	}
}
