package de.bsommerfeld.forum.db;

/**
 * Options for {@link ForumDatabase#modifyTag}.
 */
public final class TagChanges extends ColumnChanges {

    public TagChanges name(String name) {
        setRequired("Name", name);
        return this;
    }

    /** {@code null} clears the description. */
    public TagChanges description(String description) {
        set("Description", description);
        return this;
    }

    public TagChanges colour(String colour) {
        setRequired("Colour", colour);
        return this;
    }
}
