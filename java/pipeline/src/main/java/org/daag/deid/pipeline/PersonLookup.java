package org.daag.deid.pipeline;

import com.google.common.collect.ImmutableMap;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.java.Log;
import org.daag.deid.csv.MalformedTableException;
import org.daag.deid.model.Person;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * people by id, held in memory for the whole of a join run
 *
 * built once, read-only thereafter.
 */
@Log
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PersonLookup {

    private final Map<Long, Person> people;

    /**
     * number of rows that replaced an earlier row with the same id
     */
    @Getter
    private final long duplicates;

    public static PersonLookup of(Iterable<Person> people) {
        return of("people", people.iterator(), DuplicatePersonPolicy.LAST_WRITE_WINS);
    }

    /**
     * @param table  name of table people came from, for diagnostics
     * @param people to index
     * @param policy for duplicate ids
     * @throws MalformedTableException if policy is REJECT and an id occurs twice
     */
    public static PersonLookup of(String table, Iterator<Person> people, DuplicatePersonPolicy policy) {
        Map<Long, Person> byId = new HashMap<>();
        long duplicates = 0;
        while (people.hasNext()) {
            Person person = people.next();
            if (byId.put(person.getId(), person) != null) {
                if (policy == DuplicatePersonPolicy.REJECT) {
                    throw new MalformedTableException(table, "duplicate person id: " + person.getId());
                }
                log.warning("duplicate person id " + person.getId() + " in " + table + "; using last row");
                duplicates++;
            }
        }
        return new PersonLookup(ImmutableMap.copyOf(byId), duplicates);
    }

    public Optional<Person> get(long id) {
        return Optional.ofNullable(people.get(id));
    }

    public int size() {
        return people.size();
    }
}
