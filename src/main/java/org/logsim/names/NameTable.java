package org.logsim.names;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interns strings (keywords, device names, pin names) to small integer ids.
 * <p>
 * Ids are allocated densely from zero in the order strings are first seen and stay
 * stable for the lifetime of the table. One table is shared by the lexer, the
 * parser and the runtime registries of a circuit; it is passed explicitly, never
 * held in static state. Not thread-safe.
 */
public class NameTable {

    private final List<String> names = new ArrayList<>();
    private final Map<String, Integer> ids = new HashMap<>();

    /**
     * Returns the id of every string in the list, allocating ids for strings
     * that have not been seen before.
     * @param nameStrings The strings to intern.
     * @return The ids, in the same order as the input.
     */
    public List<Integer> lookup(List<String> nameStrings) {
        List<Integer> result = new ArrayList<>(nameStrings.size());
        for (String nameString : nameStrings) {
            result.add(lookup(nameString));
        }
        return result;
    }

    /**
     * Returns the id of a single string, allocating one if necessary.
     * @param nameString The string to intern.
     * @return The id of the string.
     */
    public int lookup(String nameString) {
        Integer existing = ids.get(nameString);
        if (existing != null) {
            return existing;
        }
        int id = names.size();
        names.add(nameString);
        ids.put(nameString, id);
        return id;
    }

    /**
     * Returns the id of a string without interning it.
     * @param nameString The string to look for.
     * @return The id, or {@code null} if the string was never interned.
     */
    public Integer query(String nameString) {
        return ids.get(nameString);
    }

    /**
     * Returns the string for an id.
     * @param id The id to resolve.
     * @return The interned string.
     * @throws UnknownNameIdException if the id was never allocated.
     */
    public String getNameString(int id) {
        if (id < 0 || id >= names.size()) {
            throw new UnknownNameIdException(id);
        }
        return names.get(id);
    }

    /**
     * @return The number of interned strings.
     */
    public int size() {
        return names.size();
    }

    /**
     * @return All interned strings, indexed by id.
     */
    public List<String> getNames() {
        return Collections.unmodifiableList(names);
    }
}
