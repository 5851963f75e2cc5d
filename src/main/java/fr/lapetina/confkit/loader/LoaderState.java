package fr.lapetina.confkit.loader;

/**
 * Lifecycle state of a {@link ConfigLoader}.
 */
public enum LoaderState {
    /**
     * No configuration object has been built yet.
     */
    UNBOOTSTRAPPED,
    /**
     * A configuration object is available.
     */
    LOADED,
    /**
     * A reload is in progress; the previous object is still served.
     */
    RELOADING,
    /**
     * The file is being reconciled with the bundled default.
     */
    UPDATING
}
