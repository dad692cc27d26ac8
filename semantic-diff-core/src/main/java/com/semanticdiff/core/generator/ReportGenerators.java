package com.semanticdiff.core.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Looks up {@link ReportGenerator} implementations registered through {@link ServiceLoader}.
 */
public final class ReportGenerators {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerators.class);

    private ReportGenerators() {
        // Utility class
    }

    /**
     * Returns every registered generator.
     *
     * @return generators in discovery order
     */
    public static List<ReportGenerator> all() {
        List<ReportGenerator> generators = new ArrayList<>();
        for (ReportGenerator generator : ServiceLoader.load(ReportGenerator.class)) {
            generators.add(generator);
        }
        log.debug("Discovered {} report generators", generators.size());
        return generators;
    }

    /**
     * Finds a generator by id.
     *
     * @param id generator id (case-insensitive)
     * @return matching generator, or empty if none is registered
     */
    public static Optional<ReportGenerator> find(String id) {
        return all().stream()
            .filter(generator -> generator.getId().equalsIgnoreCase(id))
            .findFirst();
    }

    /**
     * Finds a generator by id, failing if it is not registered.
     *
     * @param id generator id
     * @return matching generator
     * @throws IllegalArgumentException if no generator has the id
     */
    public static ReportGenerator require(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("Unknown report format: " + id));
    }
}
