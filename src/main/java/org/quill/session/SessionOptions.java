package org.quill.session;

import com.typesafe.config.Config;

/**
 * Settings that control how a {@link Session} treats comment lines and failed statements.
 *
 * @param echoComments Whether {@code //} comment lines are written to the output.
 * @param commentPrefix The text written in front of an echoed comment.
 * @param fallbackToExpression Whether a line that fails as a statement is retried as an expression.
 * @param failFast Whether {@link Session#run} stops at the first failed line.
 */
public record SessionOptions(
        boolean echoComments,
        String commentPrefix,
        boolean fallbackToExpression,
        boolean failFast
) {

    private static final String SESSION_PATH = "quill.session";

    /**
     * @return The built-in defaults, identical to {@code reference.conf}.
     */
    public static SessionOptions defaults() {
        return new SessionOptions(true, "Comment: ", true, false);
    }

    /**
     * Reads the {@code quill.session} block of the configuration. Missing keys keep their defaults.
     *
     * @param config The resolved application configuration.
     * @return The session options.
     */
    public static SessionOptions fromConfig(Config config) {
        SessionOptions defaults = defaults();
        if (!config.hasPath(SESSION_PATH)) {
            return defaults;
        }
        Config session = config.getConfig(SESSION_PATH);
        return new SessionOptions(
                session.hasPath("echo-comments") ? session.getBoolean("echo-comments") : defaults.echoComments(),
                session.hasPath("comment-prefix") ? session.getString("comment-prefix") : defaults.commentPrefix(),
                session.hasPath("fallback-to-expression") ? session.getBoolean("fallback-to-expression") : defaults.fallbackToExpression(),
                session.hasPath("fail-fast") ? session.getBoolean("fail-fast") : defaults.failFast()
        );
    }

    /**
     * @param enabled The new fail-fast setting.
     * @return A copy with fail-fast changed.
     */
    public SessionOptions withFailFast(boolean enabled) {
        return new SessionOptions(echoComments, commentPrefix, fallbackToExpression, enabled);
    }
}
