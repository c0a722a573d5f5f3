package txengine.engine;

import java.util.Optional;

/**
 * Auth/session collaborator supplying the acting user and session for new
 * transactions. The engine does not authenticate; it only records what this
 * provider reports.
 */
public interface SessionProvider {

    /** Provider that knows no user or session. */
    SessionProvider NONE = new SessionProvider() {
        @Override
        public Optional<String> currentUserId() {
            return Optional.empty();
        }

        @Override
        public Optional<String> currentSessionId() {
            return Optional.empty();
        }
    };

    Optional<String> currentUserId();

    Optional<String> currentSessionId();
}
