package com.truetickets.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.codahale.metrics.health.HealthCheck;
import com.truetickets.api.v1.model.ErrorResponse;
import com.truetickets.server.component.DropWizardComponent;
import com.truetickets.server.exception.ConflictException;
import com.truetickets.server.module.DropWizardModule;
import com.truetickets.server.resource.ApiGatewayFilter;
import com.truetickets.server.resource.JerseyResource;
import dagger.Binds;
import dagger.Component;
import dagger.Module;
import dagger.Provides;
import dagger.multibindings.IntoSet;
import io.dropwizard.core.Application;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

@ExtendWith(DropwizardExtensionsSupport.class)
class ServerTest {

  private static final String HELLO_WORLD = "Hello World";
  private static final DropwizardAppExtension<ServerTestConfiguration> EXT = new DropwizardAppExtension<>(
      ServerTestServer.class,
      ResourceHelpers.resourceFilePath("server-test.yml")
  );

  private String url(final String path) {
    return "http://localhost:" + EXT.getLocalPort() + path;
  }

  @Test
  void testServerExists() {
    final Application<ServerTestConfiguration> application = EXT.getApplication();
    assertThat(application).isNotNull();
  }

  @Test
  void testResourceCall() {
    final Response response = EXT.client().target(url("/hello"))
        .request()
        .get();
    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.getHeaderString(ApiGatewayFilter.ALLOW_ORIGIN)).isEqualTo("*");
    assertThat(response.readEntity(String.class)).isEqualTo(HELLO_WORLD);
  }

  @Test
  void testStagePrefixIsStripped() {
    assertThat(EXT.client().target(url("/Prod/hello")).request().get(String.class)).isEqualTo(HELLO_WORLD);
    assertThat(EXT.client().target(url("/prod/hello")).request().get(String.class)).isEqualTo(HELLO_WORLD);
  }

  @Test
  void testPreflight() {
    final Response response = EXT.client().target(url("/anything/at/all"))
        .request()
        .options();
    assertThat(response.getStatus()).isEqualTo(200);
    assertThat(response.getHeaderString(ApiGatewayFilter.ALLOW_ORIGIN)).isEqualTo("*");
    assertThat(response.getHeaderString(ApiGatewayFilter.ALLOW_METHODS)).isEqualTo("GET,POST,PUT,DELETE,OPTIONS");
    assertThat(response.getHeaderString(ApiGatewayFilter.ALLOW_HEADERS)).contains("If-Modified-Since");
    assertThat(response.getHeaderString(ApiGatewayFilter.MAX_AGE)).isEqualTo("86400");
  }

  @Test
  void testUnknownRoute() {
    final Response response = EXT.client().target(url("/v1/bad"))
        .request()
        .get();
    assertThat(response.getStatus()).isEqualTo(405);
    assertThat(response.getHeaderString(ApiGatewayFilter.ALLOW_ORIGIN)).isEqualTo("*");
    final ErrorResponse error = response.readEntity(ErrorResponse.class);
    assertThat(error.error()).isEqualTo("Method not allowed");
    assertThat(error.suggestion()).contains("You're sending a request that doesn't exist.");
  }

  @Test
  void testWrongMethod() {
    final Response response = EXT.client().target(url("/hello"))
        .request()
        .put(Entity.json("{}"));
    assertThat(response.getStatus()).isEqualTo(405);
  }

  @Test
  void testServiceException() {
    final Response response = EXT.client().target(url("/conflict"))
        .request()
        .get();
    assertThat(response.getStatus()).isEqualTo(409);
    final ErrorResponse error = response.readEntity(ErrorResponse.class);
    assertThat(error.error()).isEqualTo("Conflict");
    assertThat(error.details()).isEqualTo("Try again");
    assertThat(error.suggestion()).isEmpty();
  }

  @Test
  void testUnexpectedException() {
    final Response response = EXT.client().target(url("/broken"))
        .request()
        .get();
    assertThat(response.getStatus()).isEqualTo(500);
    assertThat(response.readEntity(ErrorResponse.class).error()).isEqualTo("Internal Server Error");
  }

  /**
   * Creates the pieces needed for the control plane to run.
   */
  @Component(modules = {
      DropWizardModule.class,
      ServerTestBinderModule.class,
      ServerTestConfigurationModule.class
  })
  @Singleton
  public interface ServerTestDropWizardComponent extends DropWizardComponent {
  }

  @Module
  public interface ServerTestBinderModule {
    @Binds
    @IntoSet
    JerseyResource helloWorldResource(final HelloWorldResource resource);
  }

  public static class ServerTestServer extends Server<ServerTestConfiguration> {
    @Override
    protected DropWizardComponent dropWizardComponent(final ServerTestConfiguration configuration,
                                                      final DropWizardModule module) {
      return DaggerServerTest_ServerTestDropWizardComponent.builder()
          .dropWizardModule(module)
          .build();
    }
  }

  @Module
  public static class ServerTestConfigurationModule {

    @Provides
    @Singleton
    Clock clock() {
      return Clock.systemUTC();
    }

    @Provides
    @Singleton
    @IntoSet
    HealthCheck fakeHealthCheck() {
      return new HealthCheck() {
        @Override
        protected Result check() {
          return Result.healthy();
        }
      };
    }

  }

  @Singleton
  @Path("/")
  public static class HelloWorldResource implements JerseyResource {

    @Inject
    public HelloWorldResource() {
    }

    @GET
    @Path("hello")
    @Produces(MediaType.TEXT_PLAIN)
    public String hello() {
      LoggerFactory.getLogger(HelloWorldResource.class).info("hello()");
      return HELLO_WORLD;
    }

    @GET
    @Path("conflict")
    @Produces(MediaType.APPLICATION_JSON)
    public String conflict() {
      throw new ConflictException("Conflict", "Try again");
    }

    @GET
    @Path("broken")
    @Produces(MediaType.APPLICATION_JSON)
    public String broken() {
      throw new IllegalStateException("broken");
    }
  }

}
