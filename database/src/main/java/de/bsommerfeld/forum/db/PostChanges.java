package de.bsommerfeld.forum.db;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Options for {@link ForumDatabase#modifyPost}. Setting {@link #tags}
 * replaces the post's whole tag set; leaving it unset keeps the current links.
 */
public final class PostChanges extends ColumnChanges {

    private Set<Integer> tags;

    public PostChanges title(String title) {
        setRequired("Title", title);
        return this;
    }

    public PostChanges content(String content) {
        setRequired("Content", content);
        return this;
    }

    /** {@code null} removes the expiry. */
    public PostChanges expiresOn(LocalDateTime expiresOn) {
        set("ExpiresOn", expiresOn);
        return this;
    }

    /**
     * An empty collection unlinks every tag.
     *
     * @throws IllegalArgumentException if the collection or one of its ids is
     *                                  {@code null}
     */
    public PostChanges tags(Collection<Integer> tagIds) {
        if (tagIds == null)
            throw new IllegalArgumentException("Tag ids must not be null, pass an empty collection to unlink all");
        this.tags = tagIdSet(tagIds);
        return this;
    }

    /** The replacement tag set, {@code null} if tags are left unchanged. */
    Set<Integer> tags() {
        return tags;
    }

    static Set<Integer> tagIdSet(Collection<Integer> tagIds) {
        Set<Integer> ids = new LinkedHashSet<>();
        for (Integer id : tagIds) {
            if (id == null)
                throw new IllegalArgumentException("Tag ids must not contain null");
            ids.add(id);
        }
        return ids;
    }

    @Override
    public boolean isEmpty() {
        return super.isEmpty() && tags == null;
    }
}
