package fr.lapetina.confkit.domain.merge;

import fr.lapetina.confkit.domain.model.Version;

/**
 * Outcome of a merge: the merged root mapping plus the versions on each side.
 *
 * @param document       merged tree; carries the default's version key
 * @param currentVersion version of the user's document before the merge
 * @param defaultVersion version of the shipped default
 */
public record MergeResult<N>(N document, Version currentVersion, Version defaultVersion) {

    /**
     * True when the versions differ, i.e. the merge bumps the user's document.
     */
    public boolean changed() {
        return !currentVersion.equals(defaultVersion);
    }
}
