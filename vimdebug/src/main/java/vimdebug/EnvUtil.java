package vimdebug;

/**
 * Reads settings from system properties and environment variables
 * using the vimdebug naming convention.
 */
public final class EnvUtil {

    private EnvUtil() {}

    /**
     * System property takes precedence. The env var name is derived from the property name
     * by uppercasing and replacing dots with underscores.
     *
     * @param propertyName e.g. "vimdebug.port"
     * @return the value, or null if not set
     */
    public static String getSystemPropOrEnvVar(String propertyName) {
        String value = System.getProperty(propertyName);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        // vimdebug.dapPort -> VIMDEBUG_DAPPORT
        String envName = propertyName.toUpperCase().replace('.', '_');
        value = System.getenv(envName);
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * @param key a config key, e.g. "handshakeTimeout"
     */
    public static String getSetting(String key) {
        return getSystemPropOrEnvVar("vimdebug." + key);
    }
}
