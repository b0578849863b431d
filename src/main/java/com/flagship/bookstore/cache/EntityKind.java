package com.flagship.bookstore.cache;

/**
 * Entity kinds with their cache tag names.
 *
 * The item prefix and the collection tag are shared by readers, which store entries
 * under them, and by the invalidation router, which evicts them.
 */
public enum EntityKind {
    BOOK("Book", "book", "booksList"),
    AUTHOR("Author", "author", "authorsList"),
    CATEGORY("Category", "category", "categoriesList"),
    PUBLISHER("Publisher", "publisher", "publishersList"),
    USER("User", "user", "usersList"),
    TENANT("Tenant", "tenant", "tenantsList");

    private final String displayName;
    private final String itemPrefix;
    private final String collectionTag;

    EntityKind(String displayName, String itemPrefix, String collectionTag) {
        this.displayName = displayName;
        this.itemPrefix = itemPrefix;
        this.collectionTag = collectionTag;
    }

    /**
     * Name used in notification event types, e.g. {@code Book} in {@code BookUpdated}.
     */
    public String getDisplayName() {
        return displayName;
    }

    public String getItemPrefix() {
        return itemPrefix;
    }

    public String getCollectionTag() {
        return collectionTag;
    }
}
