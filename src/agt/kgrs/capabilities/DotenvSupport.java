package kgrs.capabilities;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;

import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Wires a .env file in the working directory into {@link ConfigResolver}.
 * A missing file is not an error.
 */
public final class DotenvSupport {

    private static final Logger logger = Logger.getLogger(DotenvSupport.class.getName());

    private DotenvSupport() {}

    public static void enable() {
        enable(".");
    }

    /**
     * @param directory Directory holding the .env file
     */
    public static void enable(String directory) {
        Dotenv dotenv = Dotenv.configure()
            .directory(directory)
            .ignoreIfMissing()
            .load();

        ConfigResolver.enableDotenvFallback(() ->
            dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE).stream()
                .collect(Collectors.toMap(
                    DotenvEntry::getKey,
                    DotenvEntry::getValue,
                    (a, b) -> b
                ))
        );
        logger.fine("Enabled .env fallback from " + directory);
    }
}
