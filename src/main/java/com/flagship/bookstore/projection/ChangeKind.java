package com.flagship.bookstore.projection;

/**
 * How a projection document changed in a commit.
 */
public enum ChangeKind {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Change kind as readers observe it: an update that soft-deletes is a deletion.
     *
     * <pre>
     * INSERT                -> INSERT
     * UPDATE, deleted=false -> UPDATE
     * UPDATE, deleted=true  -> DELETE
     * DELETE                -> DELETE
     * </pre>
     */
    public static ChangeKind effective(ChangeKind raw, boolean deleted) {
        return switch (raw) {
            case INSERT -> INSERT;
            case UPDATE -> deleted ? DELETE : UPDATE;
            case DELETE -> DELETE;
        };
    }
}
