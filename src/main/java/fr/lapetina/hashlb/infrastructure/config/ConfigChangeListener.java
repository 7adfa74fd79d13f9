package fr.lapetina.hashlb.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called after a reloaded configuration has been validated and differs from the
     * previous one. Reloads that change nothing are not reported.
     */
    void onConfigChanged(ConfigChange change);
}
