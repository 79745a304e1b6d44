package org.houseofmourning.traversal;

import io.reactivex.rxjava3.disposables.CompositeDisposable;
import org.houseofmourning.traversal.config.IntakeProperties;
import org.houseofmourning.traversal.config.StoreProperties;
import org.houseofmourning.traversal.config.TraversalProperties;
import org.houseofmourning.traversal.render.RendererPort;
import org.houseofmourning.traversal.render.RendererSubscriptionBinder;
import org.houseofmourning.traversal.traversal.TraversalCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "GriefTraversal",
    sharedModules = {"config", "model", "util"})
@EnableConfigurationProperties({
  TraversalProperties.class,
  StoreProperties.class,
  IntakeProperties.class
})
public class TraversalEngineApp {
  private static final Logger log = LoggerFactory.getLogger(TraversalEngineApp.class);

  public static void main(String[] args) {
    new SpringApplicationBuilder(TraversalEngineApp.class)
        .web(WebApplicationType.NONE)
        .run(args);
  }

  @Bean(destroyMethod = "dispose")
  public CompositeDisposable rendererSubscriptions() {
    return new CompositeDisposable();
  }

  @Bean
  public ApplicationRunner run(
      TraversalCoordinator coordinator,
      RendererPort renderer,
      RendererSubscriptionBinder binder,
      CompositeDisposable rendererSubscriptions) {
    return args -> {
      // Subscribe before initializing so the renderer sees the initial events.
      binder.bind(coordinator, renderer, rendererSubscriptions);
      coordinator.initialize();
      log.info("[traversal] Engine started: {}", coordinator.getStats());
    };
  }
}
