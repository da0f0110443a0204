package structview;

/**
 * The kind of node, used for styling in the tree.
 */
public enum NodeKind {
    NULL,
    PRIMITIVE,
    STRING,
    ENUM,
    DATE_TIME,
    TIME_SPAN,
    GUID,
    COLLECTION,
    DICTIONARY,
    OBJECT,
    CIRCULAR_REFERENCE,
    MAX_DEPTH_REACHED;

    public boolean isMarker() {
        return this == CIRCULAR_REFERENCE || this == MAX_DEPTH_REACHED;
    }
}
