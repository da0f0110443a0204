package structview;

/**
 * Outcome of {@link NodeClassifier#classify}: how a value is shown and whether it can be expanded.
 */
public record Classification(NodeKind kind, String displayValue, String typeLabel, boolean hasChildren) {

    static Classification leaf(NodeKind kind, String displayValue, String typeLabel) {
        return new Classification(kind, displayValue, typeLabel, false);
    }
}
