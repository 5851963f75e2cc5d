/**
 * Version-aware structural merge of configuration documents.
 *
 * <p>{@link fr.lapetina.confkit.domain.merge.DocumentMerger} holds the single merge algorithm.
 * Formats plug their native trees in through {@link fr.lapetina.confkit.domain.merge.TreeAdapter};
 * {@link fr.lapetina.confkit.domain.merge.MapTreeAdapter} covers plain nested maps.
 *
 * <h2>Key matching</h2>
 * <p>{@link fr.lapetina.confkit.domain.merge.Keys} defines the relaxed comparison used both here
 * and by the field resolver, so a key the merger treats as "the same" is also the key a field
 * resolves from.
 */
package fr.lapetina.confkit.domain.merge;
