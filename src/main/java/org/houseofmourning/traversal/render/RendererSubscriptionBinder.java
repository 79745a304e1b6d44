package org.houseofmourning.traversal.render;

import io.reactivex.rxjava3.disposables.CompositeDisposable;
import java.util.Objects;
import org.houseofmourning.traversal.traversal.TraversalCoordinator;
import org.houseofmourning.traversal.traversal.TraversalEvent;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Forwards coordinator events to a {@link RendererPort}. */
@Component
@ApplicationLayer
public class RendererSubscriptionBinder {
  private static final Logger log = LoggerFactory.getLogger(RendererSubscriptionBinder.class);

  public void bind(
      TraversalCoordinator coordinator, RendererPort renderer, CompositeDisposable disposables) {
    Objects.requireNonNull(renderer, "renderer");
    disposables.add(
        coordinator
            .events()
            .subscribe(
                event -> deliver(renderer, event),
                err -> log.error("[traversal] Renderer event stream failed", err)));
  }

  // A failing renderer must not terminate the subscription.
  private static void deliver(RendererPort renderer, TraversalEvent event) {
    try {
      if (event instanceof TraversalEvent.ClusterChanged c) {
        renderer.onClusterChanged(c.cluster());
      } else if (event instanceof TraversalEvent.WorkingSetChanged w) {
        renderer.onWorkingSetChanged(w.change().removedIds(), w.change().added());
      }
    } catch (RuntimeException e) {
      log.error("[traversal] Renderer rejected {}", event.getClass().getSimpleName(), e);
    }
  }
}
