package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Wraps the store config, which is null until an owner saves one.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableStoreConfigResponse.class)
@JsonDeserialize(as = ImmutableStoreConfigResponse.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface StoreConfigResponse {

  @JsonProperty("config")
  Optional<StoreConfig> config();

}
