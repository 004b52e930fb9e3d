package no.cantara.definer;

/**
 * Answers whether a free-standing name already has a meaning in the ambient environment.
 *
 * <p>Implementations must be safe to query concurrently and must not change as a result of
 * being queried.
 */
@FunctionalInterface
public interface GlobalResolver {

    /** Defines nothing: every unbound identifier is free. */
    GlobalResolver NONE = name -> false;

    /**
     * @throws ResolutionUnavailableException if the environment cannot answer
     */
    boolean isGloballyDefined(String name);

    /** Thrown when the ambient environment cannot be consulted. */
    class ResolutionUnavailableException extends RuntimeException {
        private final String name;

        public ResolutionUnavailableException(String name, String message) {
            super(message);
            this.name = name;
        }

        public ResolutionUnavailableException(String name, Throwable cause) {
            super("Cannot resolve '" + name + "': " + cause.getMessage(), cause);
            this.name = name;
        }

        public String name() { return name; }
    }
}
