package org.houseofmourning.traversal.architecture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import org.houseofmourning.traversal.TraversalEngineApp;
import org.houseofmourning.traversal.cluster.ClusterSelector;
import org.houseofmourning.traversal.intake.SubmissionService;
import org.houseofmourning.traversal.pool.MessagePoolManager;
import org.houseofmourning.traversal.render.RendererPort;
import org.houseofmourning.traversal.store.MessageStore;
import org.houseofmourning.traversal.traversal.TraversalCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModule;
import org.springframework.modulith.core.ApplicationModules;

class SpringModulithIncrementalAdoptionTest {

  @Test
  void applicationModulesCanBeDiscovered() {
    assertThatCode(() -> ApplicationModules.of(TraversalEngineApp.class)).doesNotThrowAnyException();
  }

  @Test
  void engineTypesResolveToTheirOwnModules() {
    ApplicationModules modules = ApplicationModules.of(TraversalEngineApp.class);

    assertBasePackage(modules, MessageStore.class, "org.houseofmourning.traversal.store");
    assertBasePackage(modules, MessagePoolManager.class, "org.houseofmourning.traversal.pool");
    assertBasePackage(modules, ClusterSelector.class, "org.houseofmourning.traversal.cluster");
    assertBasePackage(modules, TraversalCoordinator.class, "org.houseofmourning.traversal.traversal");
    assertBasePackage(modules, SubmissionService.class, "org.houseofmourning.traversal.intake");
    assertBasePackage(modules, RendererPort.class, "org.houseofmourning.traversal.render");
  }

  @Test
  void moduleVerificationPassesWithCurrentBoundaries() {
    ApplicationModules.of(TraversalEngineApp.class).verify();
  }

  private static void assertBasePackage(ApplicationModules modules, Class<?> type, String pkg) {
    ApplicationModule module =
        modules
            .getModuleByType(type)
            .orElseThrow(() -> new AssertionError("No module discovered for type " + type.getName()));
    assertThat(module.getBasePackage().getName()).isEqualTo(pkg);
  }
}
