package com.truetickets.tickets;

import com.truetickets.server.Server;
import com.truetickets.server.component.DropWizardComponent;
import com.truetickets.server.module.DropWizardModule;
import com.truetickets.tickets.component.DaggerTicketsServerComponent;
import com.truetickets.tickets.module.TicketsConfigurationModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The tickets server.
 */
public class TicketsServer extends Server<TicketsServerConfiguration> {

  private static final Logger LOGGER = LoggerFactory.getLogger(TicketsServer.class);

  /**
   * Run the world.
   *
   * @param args from the command line.
   * @throws Exception if we could not start the server.
   */
  public static void main(String[] args) throws Exception {
    LOGGER.info("main({})", (Object) args);
    final TicketsServer server = new TicketsServer();
    server.run(args);
  }

  @Override
  protected DropWizardComponent dropWizardComponent(final TicketsServerConfiguration configuration,
                                                    final DropWizardModule module) {
    return DaggerTicketsServerComponent.builder()
        .dropWizardModule(module)
        .ticketsConfigurationModule(new TicketsConfigurationModule(configuration))
        .build();
  }

}
