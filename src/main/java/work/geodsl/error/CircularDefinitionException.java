package work.geodsl.error;

public final class CircularDefinitionException extends DslException {
    public CircularDefinitionException(String label) {
        super(ErrorKind.CIRCULAR_DEFINITION, label, "Circular definition: " + label + " would depend on itself");
    }
}
