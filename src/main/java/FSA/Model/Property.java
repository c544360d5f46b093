package FSA.Model;

/**
 * Structural properties reported by classification, in reporting order.
 */
public enum Property {
    DETERMINISTIC("deterministic"),
    COMPLETE("complete"),
    STANDARD("standard");

    private final String label;

    Property(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
