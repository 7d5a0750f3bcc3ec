package com.truetickets.tickets.component;

import com.truetickets.server.component.DropWizardComponent;
import com.truetickets.server.module.DropWizardModule;
import com.truetickets.tickets.module.AwsModule;
import com.truetickets.tickets.module.TicketsConfigurationModule;
import com.truetickets.tickets.module.TicketsServerModule;
import com.truetickets.tickets.module.UpstreamModule;
import dagger.Component;
import javax.inject.Singleton;

/**
 * Creates the pieces needed for the tickets server to run.
 */
@Component(modules = {
    DropWizardModule.class,
    TicketsConfigurationModule.class,
    TicketsServerModule.class,
    AwsModule.class,
    UpstreamModule.class
})
@Singleton
public interface TicketsServerComponent extends DropWizardComponent {
}
