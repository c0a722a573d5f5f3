package txengine.config;

/**
 * Exception thrown when engine configuration cannot be loaded or is invalid.
 *
 * <p>This exception is thrown when:
 * <ul>
 *   <li>No configuration file is found on the classpath</li>
 *   <li>Configuration file cannot be read or parsed</li>
 * </ul>
 *
 * <p>This is an unchecked exception so configuration loading can sit in
 * initialization code without forced exception handling.
 *
 * @see EngineConfigLoader
 */
public class EngineConfigException extends RuntimeException {

    public EngineConfigException(String message) {
        super(message);
    }

    public EngineConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
