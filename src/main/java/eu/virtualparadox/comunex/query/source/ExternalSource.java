package eu.virtualparadox.comunex.query.source;

import java.util.Optional;

/**
 * A statistics provider consulted when no document yields a value. Register implementations
 * as Spring beans.
 */
public interface ExternalSource {

    /** Short identifier, used in the {@code external_<name>} method label. */
    String name();

    Optional<ExternalValue> query(String comune, String indicator, int year);
}
