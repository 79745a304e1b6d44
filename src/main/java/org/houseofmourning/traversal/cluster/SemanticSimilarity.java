package org.houseofmourning.traversal.cluster;

import org.houseofmourning.traversal.model.Message;

/**
 * Content-based similarity term in [0, 1].
 *
 * <p>Its weight is reserved in the scoring function. The only implementation today is {@link
 * #NONE}, which contributes nothing, so the reserved weight lowers every score uniformly.
 */
@FunctionalInterface
public interface SemanticSimilarity {

  SemanticSimilarity NONE = (a, b) -> 0.0;

  double similarity(Message a, Message b);
}
