package org.houseofmourning.traversal.render;

import java.util.List;
import org.houseofmourning.traversal.model.Message;
import org.houseofmourning.traversal.model.MessageCluster;

/**
 * Outbound port to whatever draws the messages.
 *
 * <p>Membership in the working set is authoritative: ids in {@code removedIds} should be dropped
 * from the scene eventually. Calls arrive on the engine thread and should return quickly.
 */
public interface RendererPort {

  void onClusterChanged(MessageCluster cluster);

  void onWorkingSetChanged(List<Long> removedIds, List<Message> added);
}
