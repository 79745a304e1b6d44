package org.houseofmourning.traversal.render;

import java.util.List;
import org.houseofmourning.traversal.model.Message;
import org.houseofmourning.traversal.model.MessageCluster;
import org.jmolecules.architecture.layered.InterfaceLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Headless renderer: writes each event to the log. */
@InterfaceLayer
public class LoggingRendererPort implements RendererPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingRendererPort.class);

  @Override
  public void onClusterChanged(MessageCluster cluster) {
    if (cluster.isPlaceholder()) {
      log.info("[traversal] Showing placeholder (no messages yet)");
      return;
    }
    log.info(
        "[traversal] Cluster #{}: focus {} \"{}\" with {} related, next {}",
        cluster.totalShown(),
        cluster.focusId(),
        abbreviate(cluster.focus().content()),
        cluster.related().size(),
        cluster.nextId());
  }

  @Override
  public void onWorkingSetChanged(List<Long> removedIds, List<Message> added) {
    log.info("[traversal] Working set: -{} +{}", removedIds.size(), added.size());
  }

  private static String abbreviate(String s) {
    if (s.length() <= 40) return s;
    return s.substring(0, 39) + "…";
  }
}
