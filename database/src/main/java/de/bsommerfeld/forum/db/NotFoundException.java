package de.bsommerfeld.forum.db;

/**
 * Thrown by keyed lookups and modifications when no row has the given id.
 */
public class NotFoundException extends ForumDataException {

    private final String entity;
    private final int id;

    public NotFoundException(String entity, int id) {
        super(entity + " " + id + " does not exist");
        this.entity = entity;
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public int getId() {
        return id;
    }
}
