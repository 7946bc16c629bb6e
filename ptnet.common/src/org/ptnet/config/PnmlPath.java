package org.ptnet.config;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;

import org.apache.log4j.Logger;
import org.ptnet.constants.PnmlConstants;

/**
 * Process-wide base directory that schema names are resolved against.
 *
 * The initial value comes from the {@value #PROPERTY} system property, then the
 * {@value #ENV_VARIABLE} environment variable, and otherwise the
 * {@value #DEFAULT_DIRECTORY} directory next to the install location.
 * {@link #override(Path)} replaces it for the whole process until {@link #reset()}.
 */
public final class PnmlPath {

    private static final Logger logger = Logger.getLogger(PnmlPath.class);

    public static final String PROPERTY = "ptnet.pnml.path";
    public static final String ENV_VARIABLE = "PNML_PATH";
    public static final String DEFAULT_DIRECTORY = "examples";

    private static Path current;

    private PnmlPath() {
    }

    /**
     * Current base directory, initialising it on first use.
     */
    public static synchronized Path get() {
        if (current == null) {
            current = initialPath();
            logger.debug("PNML base directory initialised to " + current);
        }
        return current;
    }

    /**
     * Replace the base directory for every subsequent lookup in this process.
     */
    public static synchronized void override(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("PNML base directory cannot be null");
        }
        current = directory.toAbsolutePath().normalize();
        logger.info("PNML base directory overridden: " + current);
    }

    /**
     * Drop any override; the next {@link #get()} re-reads property, environment and default.
     */
    public static synchronized void reset() {
        current = null;
    }

    /**
     * File holding the schema called {@code name}: {@code <base>/<name>.xml}.
     */
    public static Path schemaFile(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("schema name cannot be empty");
        }
        return get().resolve(name + PnmlConstants.SCHEMA_FILE_EXTENSION);
    }

    static Path initialPath() {
        String property = System.getProperty(PROPERTY);
        if (property != null && !property.trim().isEmpty()) {
            return Paths.get(property.trim()).toAbsolutePath().normalize();
        }
        String env = System.getenv(ENV_VARIABLE);
        if (env != null && !env.trim().isEmpty()) {
            return Paths.get(env.trim()).toAbsolutePath().normalize();
        }
        return installLocation().resolve(DEFAULT_DIRECTORY).normalize();
    }

    /**
     * Directory containing the jar (or class directory) this class was loaded from,
     * falling back to the working directory.
     */
    private static Path installLocation() {
        CodeSource source = PnmlPath.class.getProtectionDomain().getCodeSource();
        if (source != null && source.getLocation() != null) {
            try {
                Path location = Paths.get(source.getLocation().toURI());
                Path parent = location.getParent();
                if (parent != null) {
                    return parent;
                }
            } catch (URISyntaxException | IllegalArgumentException e) {
                logger.warn("Cannot derive install location from " + source.getLocation() + ": " + e.getMessage());
            }
        }
        return Paths.get(System.getProperty("user.dir"));
    }
}
