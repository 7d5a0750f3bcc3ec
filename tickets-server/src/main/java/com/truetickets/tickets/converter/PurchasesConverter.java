package com.truetickets.tickets.converter;

import com.truetickets.api.v1.model.ImmutableMonthPurchases;
import com.truetickets.api.v1.model.ImmutablePurchaseItem;
import com.truetickets.api.v1.model.MonthPurchases;
import com.truetickets.api.v1.model.PurchaseItem;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.ItemBuilder;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * The purchases of one month, keyed YYYY-MM.
 */
@Singleton
public class PurchasesConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(PurchasesConverter.class);

  /**
   * Instantiates a new Purchases converter.
   */
  @Inject
  public PurchasesConverter() {
    LOGGER.info("PurchasesConverter()");
  }

  public Map<String, AttributeValue> toItem(final MonthPurchases purchases) {
    return ItemBuilder.item()
        .with(Attributes.MONTH_YEAR, purchases.monthYear())
        .with(Attributes.ITEMS, AttributeValue.fromL(purchases.items().stream().map(this::purchaseItem).toList()))
        .build();
  }

  public MonthPurchases fromItem(final Map<String, AttributeValue> item) {
    return ImmutableMonthPurchases.builder()
        .monthYear(AttributeValues.string(item, Attributes.MONTH_YEAR))
        .items(AttributeValues.list(item, Attributes.ITEMS, this::readPurchaseItem))
        .build();
  }

  private AttributeValue purchaseItem(final PurchaseItem purchaseItem) {
    return AttributeValue.fromM(Map.of(
        Attributes.NAME, AttributeValues.s(purchaseItem.name()),
        Attributes.AMOUNT_CENTS, AttributeValues.n(purchaseItem.amountCents())));
  }

  private PurchaseItem readPurchaseItem(final AttributeValue value) {
    final Map<String, AttributeValue> map = AttributeValues.map(value);
    return ImmutablePurchaseItem.builder()
        .name(AttributeValues.string(map, Attributes.NAME))
        .amountCents(AttributeValues.number(map, Attributes.AMOUNT_CENTS))
        .build();
  }

}
