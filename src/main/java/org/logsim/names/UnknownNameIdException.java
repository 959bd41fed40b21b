package org.logsim.names;

/**
 * Thrown when an id is resolved that was never allocated by a {@link NameTable}.
 */
public class UnknownNameIdException extends IllegalArgumentException {

    private final int id;

    /**
     * Constructs a new exception for the given id.
     * @param id The unknown id.
     */
    public UnknownNameIdException(int id) {
        super("Unknown name id: " + id);
        this.id = id;
    }

    /**
     * @return The id that could not be resolved.
     */
    public int getId() {
        return id;
    }
}
