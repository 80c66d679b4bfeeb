package de.bsommerfeld.forum.db;

/**
 * Options for {@link ForumDatabase#modifyComment}. Changing the content also
 * stamps {@code EditedOn}.
 */
public final class CommentChanges extends ColumnChanges {

    public CommentChanges content(String content) {
        setRequired("Content", content);
        return this;
    }
}
