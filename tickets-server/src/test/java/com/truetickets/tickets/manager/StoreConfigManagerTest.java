package com.truetickets.tickets.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.truetickets.api.v1.model.ImmutableStoreConfig;
import com.truetickets.api.v1.model.StoreConfig;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.converter.StoreConfigConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.TableNames;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

@ExtendWith(MockitoExtension.class)
class StoreConfigManagerTest {

  @Mock private DynamoDbStore dynamoDbStore;
  @Captor private ArgumentCaptor<PutItemRequest> putCaptor;

  private final StoreConfigConverter storeConfigConverter = new StoreConfigConverter();
  private StoreConfigManager storeConfigManager;

  @BeforeEach
  void setUp() {
    storeConfigManager = new StoreConfigManager(dynamoDbStore, storeConfigConverter);
  }

  @Test
  void get_neverSaved() {
    when(dynamoDbStore.get(TableNames.CONFIG, storeConfigConverter.storeConfigKey(), false))
        .thenReturn(Optional.empty());

    assertThat(storeConfigManager.get()).isEmpty();
  }

  @Test
  void put() {
    final StoreConfig config = ImmutableStoreConfig.builder().storeName("Cacell").taxRate(8.25).build();

    assertThat(storeConfigManager.put(config)).isEqualTo(config);

    verify(dynamoDbStore).put(putCaptor.capture());
    assertThat(putCaptor.getValue().tableName()).isEqualTo(TableNames.CONFIG);
    assertThat(putCaptor.getValue().item()).containsEntry(Attributes.TAX_RATE, AttributeValues.n(8.25));
  }

  @Test
  void put_taxOutOfRange() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> storeConfigManager.put(ImmutableStoreConfig.builder()
            .storeName("Cacell").taxRate(101).build()));
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> storeConfigManager.put(ImmutableStoreConfig.builder()
            .storeName("Cacell").taxRate(-1).build()));
    verify(dynamoDbStore, never()).put(any(PutItemRequest.class));
  }

  @Test
  void put_blankName() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> storeConfigManager.put(ImmutableStoreConfig.builder()
            .storeName(" ").taxRate(8).build()));
  }

  @Test
  void taxRate() {
    when(dynamoDbStore.get(TableNames.CONFIG, storeConfigConverter.storeConfigKey(), true, Attributes.TAX_RATE))
        .thenReturn(Optional.of(Map.of(Attributes.TAX_RATE, AttributeValues.n(8.0))));

    assertThat(storeConfigManager.taxRate()).isEqualTo(8.0);
  }

  @Test
  void taxRate_neverSet() {
    when(dynamoDbStore.get(TableNames.CONFIG, storeConfigConverter.storeConfigKey(), true, Attributes.TAX_RATE))
        .thenReturn(Optional.empty());

    assertThat(storeConfigManager.taxRate()).isZero();
  }

}
